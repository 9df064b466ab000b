package io.github.joke.wireform;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.CLASS;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/**
 * Per-field conversion directives. Members left at their default are not passed on as directives.
 */
@Documented
@Target(FIELD)
@Retention(CLASS)
public @interface ProtoField {

    boolean ignore() default false;

    boolean transparent() default false;

    Expect expect() default Expect.NONE;

    /** Substitute the type's zero value when the wire value is absent. */
    boolean useDefault() default false;

    /** Static factory supplying the value when the wire value is absent. */
    String defaultFn() default "";

    /** Wire field name, when it differs from the domain field name. */
    String rename() default "";

    boolean optional() default false;

    boolean required() default false;

    String fromWireFn() default "";

    String toWireFn() default "";

    String errorFn() default "";

    Class<? extends RuntimeException> errorType() default WireConversionException.class;

    /** Further directives in textual form, e.g. {@code expect(panic), default = "fallback"}. */
    String directives() default "";
}
