package io.github.joke.wireform.model;

import io.github.joke.wireform.error.GenerationDiagnostic;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Per-aggregate result of strategy resolution, fields in declaration order. */
public final class StructConversionPlan {

    private final AggregateDescriptor aggregate;
    private final AggregateAnnotation annotation;
    private final String wireTypeName;
    private final List<FieldPlan> fields;
    private final @Nullable String generatedErrorTypeName;
    private final List<GenerationDiagnostic> warnings;

    public StructConversionPlan(
            AggregateDescriptor aggregate,
            AggregateAnnotation annotation,
            String wireTypeName,
            List<FieldPlan> fields,
            @Nullable String generatedErrorTypeName,
            List<GenerationDiagnostic> warnings) {
        this.aggregate = aggregate;
        this.annotation = annotation;
        this.wireTypeName = wireTypeName;
        this.fields = List.copyOf(fields);
        this.generatedErrorTypeName = generatedErrorTypeName;
        this.warnings = List.copyOf(warnings);
    }

    public AggregateDescriptor getAggregate() {
        return aggregate;
    }

    public AggregateAnnotation getAnnotation() {
        return annotation;
    }

    public String getWireTypeName() {
        return wireTypeName;
    }

    public List<FieldPlan> getFields() {
        return fields;
    }

    public Map<String, ConversionStrategy> getStrategies() {
        Map<String, ConversionStrategy> strategies = new LinkedHashMap<>();
        fields.forEach(field -> strategies.put(field.getName(), field.getStrategy()));
        return strategies;
    }

    public boolean needsFallibleConversion() {
        return fields.stream().anyMatch(field -> field.getStrategy().errorMode().is(ErrorMode.Kind.ERROR));
    }

    public @Nullable String getGeneratedErrorTypeName() {
        return generatedErrorTypeName;
    }

    public List<GenerationDiagnostic> getWarnings() {
        return warnings;
    }
}
