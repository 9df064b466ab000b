package io.github.joke.wireform;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.CLASS;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/**
 * Marks a domain class, record or enum for which a {@code <Name>WireConverter} is generated.
 *
 * <p>Only explicitly assigned members count as directives; the declared defaults mean "not given".
 */
@Documented
@Target(TYPE)
@Retention(CLASS)
public @interface ProtoConvert {

    /** Java package of the wire type. Falls back to the {@code wireform.namespace} option. */
    String namespace() default "";

    /** Simple (or outer-class qualified) name of the wire type. Defaults to the domain name. */
    String wireName() default "";

    /** Error type thrown for missing wire fields, inherited by fields without their own. */
    Class<? extends RuntimeException> errorType() default WireConversionException.class;

    /** Static factory {@code (String fieldName) -> error}, inherited by fields without their own. */
    String errorFn() default "";

    /** Further directives in textual form, e.g. {@code namespace = "com.acme.wire"}. */
    String directives() default "";
}
