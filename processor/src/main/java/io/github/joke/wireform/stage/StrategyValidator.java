package io.github.joke.wireform.stage;

import io.github.joke.wireform.di.RoundScoped;
import io.github.joke.wireform.error.DiagnosticKind;
import io.github.joke.wireform.error.GenerationDiagnostic;
import io.github.joke.wireform.error.GenerationException;
import io.github.joke.wireform.model.ConversionStrategy;
import io.github.joke.wireform.model.DomainFieldShape;
import io.github.joke.wireform.model.FieldAnnotation;
import io.github.joke.wireform.model.WireFieldShape;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;

/** Checks the structural preconditions of a resolved strategy before any code is emitted. */
@RoundScoped
public class StrategyValidator {

    @Inject
    StrategyValidator() {}

    /**
     * @throws GenerationException with {@link DiagnosticKind#STRATEGY_PRECONDITION_VIOLATION} or
     *     {@link DiagnosticKind#EMPTY_CUSTOM_FUNCTION_REFERENCE}
     */
    public void validate(
            String aggregate,
            String field,
            ConversionStrategy strategy,
            DomainFieldShape shape,
            FieldAnnotation annotation,
            @Nullable WireFieldShape wire) {
        if (strategy instanceof ConversionStrategy.Ignore) {
            require(annotation.isIgnore(), aggregate, field, strategy, "field is not marked ignore", "add ignore");
        } else if (strategy instanceof ConversionStrategy.Custom) {
            validateCustom(aggregate, field, (ConversionStrategy.Custom) strategy);
        } else if (strategy instanceof ConversionStrategy.Transparent) {
            require(
                    annotation.isTransparent(),
                    aggregate,
                    field,
                    strategy,
                    "field is not marked transparent",
                    "add transparent");
        } else if (strategy instanceof ConversionStrategy.Option) {
            validateOption(aggregate, field, (ConversionStrategy.Option) strategy, shape, wire);
        } else if (strategy instanceof ConversionStrategy.Collection) {
            boolean sequenceLike = shape.isSequence() || shape.isNullableSequence() || (wire != null && wire.isRepeated());
            require(
                    sequenceLike,
                    aggregate,
                    field,
                    strategy,
                    "neither the domain field is a List nor the wire field repeated",
                    "declare the field as List<T>");
        } else if (strategy instanceof ConversionStrategy.Direct) {
            require(
                    !shape.isNullable() && (wire == null || !wire.isOptional()),
                    aggregate,
                    field,
                    strategy,
                    "direct conversion needs a non-Optional domain field and a required wire field",
                    "declare how absence is handled with expect or default");
        }
    }

    private static void validateOption(
            String aggregate,
            String field,
            ConversionStrategy.Option strategy,
            DomainFieldShape shape,
            @Nullable WireFieldShape wire) {
        boolean wireOptional = wire != null && wire.isOptional();
        switch (strategy.getVariant()) {
            case WRAP:
                require(
                        shape.isNullable() && !wireOptional,
                        aggregate,
                        field,
                        strategy,
                        "wrapping needs an Optional domain field over a required wire field",
                        shape.isNullable() ? "mark the field required" : "declare the field as Optional<T>");
                break;
            case UNWRAP:
                require(
                        wireOptional,
                        aggregate,
                        field,
                        strategy,
                        "unwrapping needs an optional wire field but " + wire + " is not",
                        "mark the field optional, or drop default and expect");
                break;
            default:
                require(
                        wireOptional && shape.isNullable(),
                        aggregate,
                        field,
                        strategy,
                        "mapping needs an Optional domain field over an optional wire field",
                        "mark the field optional");
                break;
        }
    }

    private static void validateCustom(String aggregate, String field, ConversionStrategy.Custom strategy) {
        String from = strategy.getFromWireFn();
        String to = strategy.getToWireFn();
        if (from == null && to == null) {
            throw violation(aggregate, field, strategy, "no custom function given", "set from_wire_fn or to_wire_fn");
        }
        if ((from != null && from.trim().isEmpty()) || (to != null && to.trim().isEmpty())) {
            throw new GenerationException(new GenerationDiagnostic(
                    DiagnosticKind.EMPTY_CUSTOM_FUNCTION_REFERENCE,
                    aggregate,
                    field,
                    "custom conversion function reference is empty",
                    "name a static method, e.g. from_wire_fn = \"parse\""));
        }
    }

    private static void require(
            boolean condition,
            String aggregate,
            String field,
            ConversionStrategy strategy,
            String reason,
            String suggestedFix) {
        if (!condition) {
            throw violation(aggregate, field, strategy, reason, suggestedFix);
        }
    }

    private static GenerationException violation(
            String aggregate, String field, ConversionStrategy strategy, String reason, String suggestedFix) {
        return new GenerationException(new GenerationDiagnostic(
                DiagnosticKind.STRATEGY_PRECONDITION_VIOLATION,
                aggregate,
                field,
                strategy + ": " + reason,
                suggestedFix));
    }
}
