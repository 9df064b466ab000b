package io.github.joke.wireform.processor;

import io.github.joke.wireform.ProtoConvert;
import io.github.joke.wireform.config.GeneratorOptions;
import io.github.joke.wireform.di.RoundScoped;
import io.github.joke.wireform.error.GenerationDiagnostic;
import io.github.joke.wireform.error.GenerationException;
import io.github.joke.wireform.model.EnumDescriptor;
import io.github.joke.wireform.model.FieldPlan;
import io.github.joke.wireform.model.StructConversionPlan;
import io.github.joke.wireform.stage.AggregateOrchestrator;
import io.github.joke.wireform.stage.EnumOrchestrator;
import java.util.List;
import javax.annotation.processing.Messager;
import javax.annotation.processing.RoundEnvironment;
import javax.inject.Inject;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.tools.Diagnostic;

/**
 * Generates one converter per {@link ProtoConvert} type. A failing type is reported and skipped;
 * the remaining types of the round are still generated.
 */
@RoundScoped
public class Pipeline {

    static final String PREFIX = "[Wireform] ";

    private final DescriptorExtractor extractor;
    private final AggregateOrchestrator aggregateOrchestrator;
    private final EnumOrchestrator enumOrchestrator;
    private final ConverterWriter writer;
    private final GeneratorOptions options;
    private final Messager messager;

    @Inject
    Pipeline(
            DescriptorExtractor extractor,
            AggregateOrchestrator aggregateOrchestrator,
            EnumOrchestrator enumOrchestrator,
            ConverterWriter writer,
            GeneratorOptions options,
            Messager messager) {
        this.extractor = extractor;
        this.aggregateOrchestrator = aggregateOrchestrator;
        this.enumOrchestrator = enumOrchestrator;
        this.writer = writer;
        this.options = options;
        this.messager = messager;
    }

    public void process(RoundEnvironment roundEnv) {
        for (Element element : roundEnv.getElementsAnnotatedWith(ProtoConvert.class)) {
            try {
                process(element);
            } catch (GenerationException e) {
                report(e.getDiagnostic(), element);
            }
        }
    }

    private void process(Element element) {
        switch (element.getKind()) {
            case ENUM:
                generateEnum((TypeElement) element);
                break;
            case CLASS:
            case RECORD:
                generateAggregate((TypeElement) element);
                break;
            default:
                messager.printMessage(
                        Diagnostic.Kind.ERROR,
                        PREFIX + "@ProtoConvert applies to classes, records and enums, not " + element.getKind(),
                        element);
        }
    }

    private void generateAggregate(TypeElement type) {
        StructConversionPlan plan = aggregateOrchestrator.plan(extractor.extractAggregate(type));
        if (options.isDebug()) {
            for (FieldPlan field : plan.getFields()) {
                messager.printMessage(
                        Diagnostic.Kind.NOTE,
                        PREFIX + plan.getAggregate().getSimpleName() + "." + AggregateOrchestrator.describe(field),
                        type);
            }
        }
        plan.getWarnings().forEach(warning -> report(warning, type));
        writer.write(aggregateOrchestrator.generate(plan), type);
    }

    private void generateEnum(TypeElement type) {
        EnumDescriptor withoutWire = extractor.extractEnum(type, List.of());
        String wireType = enumOrchestrator.wireType(withoutWire).canonicalName();
        EnumDescriptor descriptor = extractor.extractEnum(type, extractor.enumConstants(wireType));
        writer.write(enumOrchestrator.orchestrate(descriptor), type);
    }

    private void report(GenerationDiagnostic diagnostic, Element aggregate) {
        Diagnostic.Kind kind = diagnostic.getKind().isError() ? Diagnostic.Kind.ERROR : Diagnostic.Kind.WARNING;
        messager.printMessage(kind, PREFIX + diagnostic.render(), target(diagnostic, aggregate));
    }

    private static Element target(GenerationDiagnostic diagnostic, Element aggregate) {
        if (diagnostic.getField() == null || !(aggregate instanceof TypeElement)) {
            return aggregate;
        }
        for (VariableElement field : DescriptorExtractor.instanceFields((TypeElement) aggregate)) {
            if (field.getSimpleName().contentEquals(diagnostic.getField())) {
                return field;
            }
        }
        return aggregate;
    }
}
