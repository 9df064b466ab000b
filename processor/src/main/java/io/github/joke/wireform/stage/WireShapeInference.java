package io.github.joke.wireform.stage;

import io.github.joke.wireform.di.RoundScoped;
import io.github.joke.wireform.error.DiagnosticKind;
import io.github.joke.wireform.error.GenerationDiagnostic;
import io.github.joke.wireform.error.GenerationException;
import io.github.joke.wireform.model.DomainFieldShape;
import io.github.joke.wireform.model.FieldAnnotation;
import io.github.joke.wireform.model.InferenceTier;
import io.github.joke.wireform.model.InferredWireShape;
import io.github.joke.wireform.model.Optionality;
import io.github.joke.wireform.model.ShapeKind;
import io.github.joke.wireform.model.WireFieldShape;
import io.github.joke.wireform.model.WireMapping;
import io.github.joke.wireform.spi.FieldOptionalitySource;
import java.util.Optional;
import javax.inject.Inject;

/**
 * Decides the mapping and optionality of a field's wire counterpart. Tiers are tried in order and
 * the first that answers wins: explicit directive, side channel, structure, usage.
 */
@RoundScoped
public class WireShapeInference {

    private final FieldOptionalitySource sideChannel;

    @Inject
    WireShapeInference(FieldOptionalitySource sideChannel) {
        this.sideChannel = sideChannel;
    }

    /**
     * @param wireMessage canonical name of the wire class, the side channel key
     * @param wireField schema name of the wire field
     * @throws GenerationException with {@link DiagnosticKind#AMBIGUOUS_OPTIONALITY} when no tier answers
     */
    public InferredWireShape infer(
            String aggregate,
            String field,
            DomainFieldShape shape,
            FieldAnnotation annotation,
            String wireMessage,
            String wireField) {
        WireMapping mapping = structuralMapping(shape);

        if (annotation.getFromWireFn() != null && annotation.getToWireFn() != null) {
            Optionality declared = annotation.getExplicitOptionality();
            return new InferredWireShape(
                    WireFieldShape.of(WireMapping.CUSTOM_DERIVED, declared != null ? declared : Optionality.REQUIRED),
                    InferenceTier.EXPLICIT_OVERRIDE,
                    true);
        }

        Optionality explicit = annotation.getExplicitOptionality();
        if (explicit != null) {
            return new InferredWireShape(WireFieldShape.of(mapping, explicit), InferenceTier.EXPLICIT_OVERRIDE, true);
        }

        Optional<Boolean> answer = sideChannel.fieldOptionality(wireMessage, wireField);
        if (answer.isPresent()) {
            return new InferredWireShape(
                    WireFieldShape.of(mapping, Optionality.of(answer.get())), InferenceTier.SIDE_CHANNEL, true);
        }

        switch (shape.getKind()) {
            case NULLABLE_WRAPPER:
            case SEQUENCE_WRAPPER:
                return new InferredWireShape(
                        WireFieldShape.of(mapping, Optionality.OPTIONAL), InferenceTier.STRUCTURAL, true);
            case PRIMITIVE:
            case TAGGED_ENUM:
            case TRANSPARENT_WRAPPER:
                if (annotation.hasAbsenceHandling()) {
                    return new InferredWireShape(
                            WireFieldShape.of(WireMapping.SCALAR, Optionality.OPTIONAL),
                            InferenceTier.USAGE_PATTERN,
                            true);
                }
                return new InferredWireShape(
                        WireFieldShape.of(WireMapping.SCALAR, Optionality.REQUIRED), InferenceTier.STRUCTURAL, true);
            default:
                break;
        }

        if (annotation.hasAbsenceHandling()) {
            return new InferredWireShape(
                    WireFieldShape.of(WireMapping.MESSAGE, Optionality.OPTIONAL), InferenceTier.USAGE_PATTERN, true);
        }
        if (shape.isPlainName()) {
            return new InferredWireShape(
                    WireFieldShape.of(WireMapping.MESSAGE, Optionality.OPTIONAL), InferenceTier.USAGE_PATTERN, false);
        }
        throw new GenerationException(new GenerationDiagnostic(
                DiagnosticKind.AMBIGUOUS_OPTIONALITY,
                aggregate,
                field,
                "cannot tell whether wire field " + wireField + " of " + wireMessage + " (" + shape.getTypeName()
                        + ") is optional",
                "mark the field optional or required"));
    }

    static WireMapping structuralMapping(DomainFieldShape shape) {
        if (shape.isNullableSequence() || shape.isSequence()) {
            return WireMapping.REPEATED;
        }
        if (shape.isNullable()) {
            return WireMapping.OPTIONAL;
        }
        return shape.is(ShapeKind.CUSTOM_AGGREGATE) ? WireMapping.MESSAGE : WireMapping.SCALAR;
    }
}
