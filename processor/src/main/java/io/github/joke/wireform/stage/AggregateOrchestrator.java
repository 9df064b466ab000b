package io.github.joke.wireform.stage;

import static javax.lang.model.element.Modifier.FINAL;
import static javax.lang.model.element.Modifier.PRIVATE;
import static javax.lang.model.element.Modifier.PUBLIC;
import static javax.lang.model.element.Modifier.STATIC;

import com.palantir.javapoet.ClassName;
import com.palantir.javapoet.CodeBlock;
import com.palantir.javapoet.MethodSpec;
import com.palantir.javapoet.TypeSpec;
import io.github.joke.wireform.config.GeneratorOptions;
import io.github.joke.wireform.di.RoundScoped;
import io.github.joke.wireform.error.DiagnosticKind;
import io.github.joke.wireform.error.GenerationDiagnostic;
import io.github.joke.wireform.model.AggregateAnnotation;
import io.github.joke.wireform.model.AggregateDescriptor;
import io.github.joke.wireform.model.ConversionStrategy;
import io.github.joke.wireform.model.DomainFieldShape;
import io.github.joke.wireform.model.ErrorMode;
import io.github.joke.wireform.model.FieldAnnotation;
import io.github.joke.wireform.model.FieldDescriptor;
import io.github.joke.wireform.model.FieldPlan;
import io.github.joke.wireform.model.GeneratedConverter;
import io.github.joke.wireform.model.InferredWireShape;
import io.github.joke.wireform.model.StructConversionPlan;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;

/**
 * Drives classification, parsing, inference, resolution and validation over the fields of one
 * aggregate, then assembles its {@code fromWire} and {@code toWire} methods. Any failure aborts
 * the whole aggregate.
 */
@RoundScoped
public class AggregateOrchestrator {

    private final ShapeClassifier classifier;
    private final DirectiveParser parser;
    private final WireShapeInference inference;
    private final StrategyResolver resolver;
    private final StrategyValidator validator;
    private final CodeSynthesizer synthesizer;
    private final GeneratorOptions options;

    @Inject
    AggregateOrchestrator(
            ShapeClassifier classifier,
            DirectiveParser parser,
            WireShapeInference inference,
            StrategyResolver resolver,
            StrategyValidator validator,
            CodeSynthesizer synthesizer,
            GeneratorOptions options) {
        this.classifier = classifier;
        this.parser = parser;
        this.inference = inference;
        this.resolver = resolver;
        this.validator = validator;
        this.synthesizer = synthesizer;
        this.options = options;
    }

    public GeneratedConverter orchestrate(AggregateDescriptor aggregate) {
        return generate(plan(aggregate));
    }

    public StructConversionPlan plan(AggregateDescriptor aggregate) {
        String aggregateName = aggregate.getSimpleName();
        AggregateAnnotation annotation = parser.parseAggregate(aggregate.getTokens(), aggregateName);
        String wireNamespace = WireTypes.namespace(annotation, options, aggregate.getPackageName());
        ClassName wireType =
                WireTypes.wireType(annotation, options, aggregate.getPackageName(), aggregate.getSimpleName());

        List<FieldPlan> fields = new ArrayList<>();
        List<GenerationDiagnostic> warnings = new ArrayList<>();
        for (FieldDescriptor field : aggregate.getFields()) {
            FieldPlan plan = planField(aggregateName, field, annotation, wireType, wireNamespace);
            InferredWireShape wireShape = plan.getWireShape();
            if (wireShape != null && !wireShape.isVerified()) {
                warnings.add(new GenerationDiagnostic(
                        DiagnosticKind.INFERRED_NOT_VERIFIED,
                        aggregateName,
                        field.getName(),
                        "wire field " + plan.getWireFieldName() + " assumed " + wireShape.getShape()
                                + ": inferred, not verified",
                        "mark the field optional or required"));
            }
            fields.add(plan);
        }

        boolean needsGeneratedError = fields.stream().anyMatch(AggregateOrchestrator::usesGeneratedError);
        @Nullable String generatedErrorTypeName = needsGeneratedError
                ? String.join("", WireTypes.domainType(aggregate.getPackageName(), aggregateName).simpleNames())
                        + "ConversionException"
                : null;
        return new StructConversionPlan(
                aggregate, annotation, wireType.canonicalName(), fields, generatedErrorTypeName, warnings);
    }

    public GeneratedConverter generate(StructConversionPlan plan) {
        AggregateDescriptor aggregate = plan.getAggregate();
        ClassName domainType = WireTypes.domainType(aggregate.getPackageName(), aggregate.getSimpleName());
        ClassName wireType =
                WireTypes.wireType(plan.getAnnotation(), options, aggregate.getPackageName(), aggregate.getSimpleName());
        String wireNamespace = WireTypes.namespace(plan.getAnnotation(), options, aggregate.getPackageName());
        @Nullable ClassName errorType = plan.getGeneratedErrorTypeName() != null
                ? ClassName.get(aggregate.getPackageName(), plan.getGeneratedErrorTypeName())
                : null;
        SynthesisContext context = new SynthesisContext(domainType, wireType, wireNamespace, errorType);

        TypeSpec converter = TypeSpec.classBuilder(CodeSynthesizer.converterName(domainType))
                .addJavadoc("Converts between {@link $T} and its wire form {@link $T}.\n", domainType, wireType)
                .addModifiers(PUBLIC, FINAL)
                .addMethod(MethodSpec.constructorBuilder().addModifiers(PRIVATE).build())
                .addMethod(fromWire(plan, context))
                .addMethod(toWire(plan, context))
                .build();

        List<TypeSpec> supportTypes = new ArrayList<>();
        if (errorType != null) {
            supportTypes.add(synthesizer.errorType(errorType));
        }
        return new GeneratedConverter(aggregate.getPackageName(), converter, supportTypes);
    }

    private FieldPlan planField(
            String aggregateName,
            FieldDescriptor field,
            AggregateAnnotation aggregateAnnotation,
            ClassName wireType,
            String wireNamespace) {
        FieldAnnotation annotation =
                parser.parseField(field.getTokens(), aggregateName, field.getName()).inherit(aggregateAnnotation);
        DomainFieldShape shape = classifier.classify(field.getTypeText(), annotation.isTransparent());
        String wireFieldName = annotation.getRename() != null ? annotation.getRename() : Names.snakeCase(field.getName());
        @Nullable InferredWireShape wireShape = annotation.isIgnore()
                ? null
                : inference.infer(
                        aggregateName, field.getName(), shape, annotation, wireType.canonicalName(), wireFieldName);
        ConversionStrategy strategy =
                resolver.resolve(shape, annotation, wireShape != null ? wireShape.getShape() : null, wireNamespace);
        validator.validate(
                aggregateName,
                field.getName(),
                strategy,
                shape,
                annotation,
                wireShape != null ? wireShape.getShape() : null);
        return new FieldPlan(field, annotation, shape, wireShape, strategy, wireFieldName);
    }

    private MethodSpec fromWire(StructConversionPlan plan, SynthesisContext context) {
        MethodSpec.Builder method = MethodSpec.methodBuilder("fromWire")
                .addModifiers(PUBLIC, STATIC)
                .returns(context.getDomainType())
                .addParameter(context.getWireType(), CodeSynthesizer.WIRE);
        Set<ClassName> thrown = new LinkedHashSet<>();
        List<CodeBlock> arguments = new ArrayList<>();
        for (FieldPlan field : plan.getFields()) {
            method.addCode(synthesizer.fromWire(field, context));
            arguments.add(CodeBlock.of("$L", CodeSynthesizer.localName(field)));
            if (field.getStrategy().errorMode().is(ErrorMode.Kind.ERROR)) {
                ClassName errorType = CodeSynthesizer.errorTypeOf(field, context);
                if (errorType != null) {
                    thrown.add(errorType);
                }
            }
        }
        thrown.forEach(method::addException);
        return method.addStatement("return new $T($L)", context.getDomainType(), CodeBlock.join(arguments, ", "))
                .build();
    }

    private MethodSpec toWire(StructConversionPlan plan, SynthesisContext context) {
        ClassName builderType = context.getWireType().nestedClass("Builder");
        MethodSpec.Builder method = MethodSpec.methodBuilder("toWire")
                .addModifiers(PUBLIC, STATIC)
                .returns(context.getWireType())
                .addParameter(context.getDomainType(), CodeSynthesizer.DOMAIN)
                .addStatement("$T $L = $T.newBuilder()", builderType, CodeSynthesizer.BUILDER, context.getWireType());
        plan.getFields().forEach(field -> method.addCode(synthesizer.toWire(field, context)));
        return method.addStatement("return $L.build()", CodeSynthesizer.BUILDER).build();
    }

    private static boolean usesGeneratedError(FieldPlan field) {
        FieldAnnotation annotation = field.getAnnotation();
        return field.getStrategy().errorMode().is(ErrorMode.Kind.ERROR)
                && annotation.getErrorFn() == null
                && annotation.getErrorType() == null;
    }

    public static String describe(FieldPlan field) {
        InferredWireShape wireShape = field.getWireShape();
        return field.getName() + ": " + field.getStrategy() + " (" + field.getStrategy().describe() + ")"
                + (wireShape != null ? ", wire " + wireShape : "");
    }
}
