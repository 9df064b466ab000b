package io.github.joke.wireform.stage;

import io.github.joke.wireform.di.RoundScoped;
import io.github.joke.wireform.model.ConversionStrategy;
import io.github.joke.wireform.model.DefaultValue;
import io.github.joke.wireform.model.DomainFieldShape;
import io.github.joke.wireform.model.ErrorMode;
import io.github.joke.wireform.model.FieldAnnotation;
import io.github.joke.wireform.model.WireFieldShape;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;

/**
 * Picks exactly one conversion strategy per field. Rules are ordered and the first match wins:
 * ignore, custom functions, transparent, collections, declared default, then the
 * (domain nullable, wire optional) matrix.
 */
@RoundScoped
public class StrategyResolver {

    @Inject
    StrategyResolver() {}

    public ConversionStrategy resolve(
            DomainFieldShape shape, FieldAnnotation annotation, @Nullable WireFieldShape wire, String wireNamespace) {
        if (annotation.isIgnore()) {
            return ConversionStrategy.ignore();
        }
        if (annotation.hasCustomFunction()) {
            return ConversionStrategy.custom(annotation.getFromWireFn(), annotation.getToWireFn());
        }
        if (wire == null) {
            throw new IllegalStateException("No wire shape for " + shape);
        }
        if (annotation.isTransparent()) {
            boolean absentable = wire.isOptional() && !shape.isNullable();
            return ConversionStrategy.transparent(absentable ? absenceMode(annotation) : ErrorMode.none());
        }
        if (shape.isNullableSequence()) {
            return ConversionStrategy.mapOption();
        }
        if (shape.isSequence() || wire.isRepeated()) {
            if (annotation.hasAbsenceHandling()) {
                return ConversionStrategy.collect(absenceMode(annotation));
            }
            DomainFieldShape element = shape.isSequence() ? shape.requireInner() : shape;
            return ValueConversions.isIdentity(element, wireNamespace)
                    ? ConversionStrategy.collectionDirectAssignment()
                    : ConversionStrategy.collect(ErrorMode.none());
        }
        DefaultValue defaultValue = annotation.getDefaultValue();
        if (defaultValue != null) {
            return ConversionStrategy.optionUnwrap(ErrorMode.fromDefault(defaultValue));
        }
        boolean domainNullable = shape.isNullable();
        boolean wireOptional = wire.isOptional();
        if (!domainNullable && !wireOptional) {
            return ValueConversions.isIdentity(shape, wireNamespace)
                    ? ConversionStrategy.directAssignment()
                    : ConversionStrategy.directWithConversion();
        }
        if (!domainNullable) {
            return ConversionStrategy.optionUnwrap(absenceMode(annotation));
        }
        return wireOptional ? ConversionStrategy.optionMap() : ConversionStrategy.optionWrap();
    }

    static ErrorMode absenceMode(FieldAnnotation annotation) {
        DefaultValue defaultValue = annotation.getDefaultValue();
        if (defaultValue != null) {
            return ErrorMode.fromDefault(defaultValue);
        }
        switch (annotation.getExpectMode()) {
            case ERROR:
                return ErrorMode.error();
            case PANIC:
            default:
                return ErrorMode.panic();
        }
    }
}
