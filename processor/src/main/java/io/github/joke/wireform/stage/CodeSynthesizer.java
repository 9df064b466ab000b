package io.github.joke.wireform.stage;

import static javax.lang.model.element.Modifier.FINAL;
import static javax.lang.model.element.Modifier.PRIVATE;
import static javax.lang.model.element.Modifier.PUBLIC;
import static javax.lang.model.element.Modifier.STATIC;

import com.palantir.javapoet.ClassName;
import com.palantir.javapoet.CodeBlock;
import com.palantir.javapoet.FieldSpec;
import com.palantir.javapoet.MethodSpec;
import com.palantir.javapoet.TypeName;
import com.palantir.javapoet.TypeSpec;
import io.github.joke.wireform.WireConversionException;
import io.github.joke.wireform.di.RoundScoped;
import io.github.joke.wireform.error.DiagnosticKind;
import io.github.joke.wireform.error.GenerationDiagnostic;
import io.github.joke.wireform.error.GenerationException;
import io.github.joke.wireform.model.ConversionStrategy;
import io.github.joke.wireform.model.Direction;
import io.github.joke.wireform.model.DomainFieldShape;
import io.github.joke.wireform.model.ErrorMode;
import io.github.joke.wireform.model.FieldAnnotation;
import io.github.joke.wireform.model.FieldPlan;
import io.github.joke.wireform.model.ShapeKind;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;

/**
 * Emits the per-field statements of the generated converter. Wire-to-domain statements declare a
 * local holding the domain value; domain-to-wire statements call setters on {@code builder}.
 */
@RoundScoped
public class CodeSynthesizer {

    static final String WIRE = "wire";
    static final String DOMAIN = "domain";
    static final String BUILDER = "builder";

    private static final Set<String> RESERVED = Set.of(WIRE, DOMAIN, BUILDER, "element", "value", "values");
    private static final ClassName BYTE_STRING = ClassName.get("com.google.protobuf", "ByteString");

    @Inject
    CodeSynthesizer() {}

    public CodeBlock synthesize(FieldPlan plan, Direction direction, SynthesisContext context) {
        return direction == Direction.FROM_WIRE ? fromWire(plan, context) : toWire(plan, context);
    }

    public CodeBlock fromWire(FieldPlan plan, SynthesisContext context) {
        ConversionStrategy strategy = plan.getStrategy();
        if (strategy instanceof ConversionStrategy.Ignore) {
            return declare(plan, context, defaultValue(plan, context));
        }
        if (strategy instanceof ConversionStrategy.Custom) {
            String fn = ((ConversionStrategy.Custom) strategy).getFromWireFn();
            if (fn == null) {
                return fallbackFromWire(plan, context);
            }
            CodeBlock read = isSequenceLike(plan) ? readList(plan) : read(plan);
            return declare(plan, context, call(fn, context, read));
        }
        if (strategy instanceof ConversionStrategy.Collection) {
            return collectionFromWire(plan, (ConversionStrategy.Collection) strategy, context);
        }
        if (strategy instanceof ConversionStrategy.Option) {
            ConversionStrategy.Option option = (ConversionStrategy.Option) strategy;
            switch (option.getVariant()) {
                case WRAP:
                    return declare(plan, context, presentValue(plan, context));
                case MAP:
                    return declare(
                            plan,
                            context,
                            CodeBlock.of(
                                    "$L ? $L : $T.empty()", has(plan), presentValue(plan, context), Optional.class));
                default:
                    return absentable(plan, option.errorMode(), context);
            }
        }
        if (strategy instanceof ConversionStrategy.Transparent) {
            if (plan.getDomainShape().isNullable()) {
                return nullableFromWire(plan, context);
            }
            return absentable(plan, strategy.errorMode(), context);
        }
        return declare(plan, context, presentValue(plan, context));
    }

    public CodeBlock toWire(FieldPlan plan, SynthesisContext context) {
        ConversionStrategy strategy = plan.getStrategy();
        if (strategy instanceof ConversionStrategy.Ignore) {
            return CodeBlock.builder().build();
        }
        if (strategy instanceof ConversionStrategy.Custom) {
            String fn = ((ConversionStrategy.Custom) strategy).getToWireFn();
            if (fn == null) {
                return isSequenceLike(plan) ? collectionToWire(plan, context) : write(plan, context);
            }
            String setter = (isSequenceLike(plan) ? "addAll" : "set") + stem(plan);
            return CodeBlock.builder()
                    .addStatement("$L.$L($L)", BUILDER, setter, call(fn, context, domainValue(plan)))
                    .build();
        }
        if (strategy instanceof ConversionStrategy.Collection) {
            return collectionToWire(plan, context);
        }
        return write(plan, context);
    }

    /** The generated {@code <Aggregate>ConversionException} with its {@code missingField} factory. */
    public TypeSpec errorType(ClassName name) {
        return TypeSpec.classBuilder(name)
                .addJavadoc("Thrown when a wire field the domain type requires is missing.\n")
                .addModifiers(PUBLIC, FINAL)
                .superclass(WireConversionException.class)
                .addField(FieldSpec.builder(TypeName.LONG, "serialVersionUID", PRIVATE, STATIC, FINAL)
                        .initializer("1L")
                        .build())
                .addMethod(MethodSpec.constructorBuilder()
                        .addModifiers(PRIVATE)
                        .addParameter(String.class, "fieldName")
                        .addStatement("super(fieldName)")
                        .build())
                .addMethod(MethodSpec.methodBuilder("missingField")
                        .addModifiers(PUBLIC, STATIC)
                        .returns(name)
                        .addParameter(String.class, "fieldName")
                        .addStatement("return new $T(fieldName)", name)
                        .build())
                .build();
    }

    /**
     * The type thrown for an error-moded field, or {@code null} when an error function builds it
     * and its type is unknown.
     */
    public static @Nullable ClassName errorTypeOf(FieldPlan plan, SynthesisContext context) {
        FieldAnnotation annotation = plan.getAnnotation();
        if (annotation.getErrorFn() != null) {
            return null;
        }
        if (annotation.getErrorType() != null) {
            return TypeTexts.toClassName(annotation.getErrorType(), context.getDomainPackage());
        }
        return context.getGeneratedErrorType();
    }

    /** {@code com.acme.Track} to {@code com.acme.TrackWireConverter}; nested names are joined. */
    public static ClassName converterName(ClassName domainType) {
        return ClassName.get(domainType.packageName(), String.join("", domainType.simpleNames()) + "WireConverter");
    }

    public static String localName(FieldPlan plan) {
        String name = plan.getName();
        return RESERVED.contains(name) ? name + "_" : name;
    }

    private CodeBlock fallbackFromWire(FieldPlan plan, SynthesisContext context) {
        if (isSequenceLike(plan)) {
            return collectionFromWire(
                    plan,
                    plan.getDomainShape().isNullable()
                            ? ConversionStrategy.mapOption()
                            : ConversionStrategy.collect(ErrorMode.none()),
                    context);
        }
        if (plan.getDomainShape().isNullable()) {
            return nullableFromWire(plan, context);
        }
        return declare(plan, context, presentValue(plan, context));
    }

    private CodeBlock nullableFromWire(FieldPlan plan, SynthesisContext context) {
        if (!plan.isWireOptional()) {
            return declare(plan, context, presentValue(plan, context));
        }
        return declare(
                plan, context, CodeBlock.of("$L ? $L : $T.empty()", has(plan), presentValue(plan, context), Optional.class));
    }

    private CodeBlock absentable(FieldPlan plan, ErrorMode mode, SynthesisContext context) {
        switch (mode.getKind()) {
            case DEFAULT:
                return declare(
                        plan,
                        context,
                        CodeBlock.of(
                                "$L ? $L : $L",
                                has(plan),
                                presentValue(plan, context),
                                fallback(plan, mode, context)));
            case PANIC:
            case ERROR:
                return CodeBlock.builder()
                        .beginControlFlow("if (!$L)", has(plan))
                        .addStatement("throw $L", missing(plan, mode, context))
                        .endControlFlow()
                        .add(declare(plan, context, presentValue(plan, context)))
                        .build();
            default:
                return declare(plan, context, presentValue(plan, context));
        }
    }

    private CodeBlock collectionFromWire(
            FieldPlan plan, ConversionStrategy.Collection strategy, SynthesisContext context) {
        DomainFieldShape element = elementShape(plan, context);
        CodeBlock list = readList(plan);
        CodeBlock converted = mapList(list, element, Direction.FROM_WIRE, context);
        CodeBlock isEmpty = CodeBlock.of("$L.isEmpty()", list);
        switch (strategy.getVariant()) {
            case MAP_OPTION:
                return declare(
                        plan,
                        context,
                        CodeBlock.of(
                                "$L ? $T.empty() : $T.of($L)", isEmpty, Optional.class, Optional.class, converted));
            case DIRECT_ASSIGNMENT:
                return declare(plan, context, converted);
            default:
                break;
        }
        ErrorMode mode = strategy.errorMode();
        switch (mode.getKind()) {
            case DEFAULT:
                return declare(plan, context, CodeBlock.of("$L ? $L : $L", isEmpty, fallback(plan, mode, context), converted));
            case PANIC:
            case ERROR:
                return CodeBlock.builder()
                        .beginControlFlow("if ($L)", isEmpty)
                        .addStatement("throw $L", missing(plan, mode, context))
                        .endControlFlow()
                        .add(declare(plan, context, converted))
                        .build();
            default:
                return declare(plan, context, converted);
        }
    }

    private CodeBlock collectionToWire(FieldPlan plan, SynthesisContext context) {
        DomainFieldShape element = elementShape(plan, context);
        String adder = "addAll" + stem(plan);
        if (plan.getDomainShape().isNullable()) {
            return CodeBlock.builder()
                    .addStatement(
                            "$L.ifPresent(values -> $L.$L($L))",
                            domainValue(plan),
                            BUILDER,
                            adder,
                            mapList(CodeBlock.of("values"), element, Direction.TO_WIRE, context))
                    .build();
        }
        return CodeBlock.builder()
                .addStatement(
                        "$L.$L($L)", BUILDER, adder, mapList(domainValue(plan), element, Direction.TO_WIRE, context))
                .build();
    }

    private CodeBlock mapList(CodeBlock list, DomainFieldShape element, Direction direction, SynthesisContext context) {
        CodeBlock each = convert(element, CodeBlock.of("element"), direction, context);
        if (each.toString().equals("element")) {
            return direction == Direction.FROM_WIRE ? CodeBlock.of("$T.copyOf($L)", List.class, list) : list;
        }
        return CodeBlock.of(
                "$L.stream().map(element -> $L).collect($T.toList())", list, each, Collectors.class);
    }

    private CodeBlock write(FieldPlan plan, SynthesisContext context) {
        DomainFieldShape shape = plan.getDomainShape();
        String setter = "set" + stem(plan);
        if (shape.isNullable()) {
            CodeBlock converted = convert(shape.requireInner(), CodeBlock.of("value"), Direction.TO_WIRE, context);
            return CodeBlock.builder()
                    .addStatement("$L.ifPresent(value -> $L.$L($L))", domainValue(plan), BUILDER, setter, converted)
                    .build();
        }
        return CodeBlock.builder()
                .addStatement(
                        "$L.$L($L)", BUILDER, setter, convert(shape, domainValue(plan), Direction.TO_WIRE, context))
                .build();
    }

    private CodeBlock presentValue(FieldPlan plan, SynthesisContext context) {
        DomainFieldShape shape = plan.getDomainShape();
        if (shape.isNullable()) {
            return CodeBlock.of(
                    "$T.of($L)",
                    Optional.class,
                    convert(shape.requireInner(), read(plan), Direction.FROM_WIRE, context));
        }
        return convert(shape, read(plan), Direction.FROM_WIRE, context);
    }

    /** Converts a single value across the boundary; wrappers other than transparent ones are rejected. */
    CodeBlock convert(DomainFieldShape shape, CodeBlock value, Direction direction, SynthesisContext context) {
        boolean fromWire = direction == Direction.FROM_WIRE;
        switch (shape.getKind()) {
            case PRIMITIVE:
                if (ValueConversions.isByteArray(shape)) {
                    return fromWire
                            ? CodeBlock.of("$L.toByteArray()", value)
                            : CodeBlock.of("$T.copyFrom($L)", BYTE_STRING, value);
                }
                String narrow = ValueConversions.narrowing(shape);
                if (narrow != null) {
                    // the wire holds int32; list elements arrive boxed
                    return fromWire ? CodeBlock.of("($L) (int) $L", narrow, value) : CodeBlock.of("(int) $L", value);
                }
                return value;
            case TAGGED_ENUM:
                return CodeBlock.of(
                        "$T.$L($L)", converterName(domainClass(shape, context)), fromWire ? "fromWire" : "toWire", value);
            case TRANSPARENT_WRAPPER:
                DomainFieldShape inner = shape.getInner();
                if (fromWire) {
                    CodeBlock unwrapped = inner == null ? value : convert(inner, value, direction, context);
                    return CodeBlock.of("new $T($L)", domainClass(shape, context), unwrapped);
                }
                CodeBlock read = CodeBlock.of("$L.$L()", value, shape.getAccessor());
                return inner == null ? read : convert(inner, read, direction, context);
            case CUSTOM_AGGREGATE:
                if (ValueConversions.isWireType(shape.getTypeName(), context.getWireNamespace())) {
                    return value;
                }
                if (!shape.isPlainName()) {
                    throw unsupported(shape, context);
                }
                return CodeBlock.of(
                        "$T.$L($L)", converterName(domainClass(shape, context)), fromWire ? "fromWire" : "toWire", value);
            default:
                throw unsupported(shape, context);
        }
    }

    private CodeBlock fallback(FieldPlan plan, ErrorMode mode, SynthesisContext context) {
        String fn = mode.getDefaultFn();
        return fn != null ? call(fn, context) : zeroValue(plan.getDomainShape(), fieldType(plan, context), context);
    }

    private CodeBlock defaultValue(FieldPlan plan, SynthesisContext context) {
        FieldAnnotation annotation = plan.getAnnotation();
        String fn = annotation.getDefaultValue() != null ? annotation.getDefaultValue().getFunctionName() : null;
        return fn != null ? call(fn, context) : zeroValue(plan.getDomainShape(), fieldType(plan, context), context);
    }

    /** Zero value of a type: 0, false, "", empty Optional or List, first enum constant or no-arg instance. */
    CodeBlock zeroValue(DomainFieldShape shape, TypeName type, SynthesisContext context) {
        if (shape.isNullable()) {
            return CodeBlock.of("$T.empty()", Optional.class);
        }
        if (shape.isSequence()) {
            return CodeBlock.of("$T.of()", List.class);
        }
        if (shape.is(ShapeKind.TAGGED_ENUM)) {
            return CodeBlock.of("$T.values()[0]", domainClass(shape, context));
        }
        if (shape.is(ShapeKind.PRIMITIVE)) {
            if (ValueConversions.isByteArray(shape)) {
                return CodeBlock.of("new byte[0]");
            }
            if (BYTE_STRING.equals(type)) {
                return CodeBlock.of("$T.EMPTY", BYTE_STRING);
            }
            TypeName unboxed = type.isBoxedPrimitive() ? type.unbox() : type;
            if (unboxed.equals(TypeName.BOOLEAN)) {
                return CodeBlock.of("false");
            }
            if (unboxed.equals(TypeName.LONG)) {
                return CodeBlock.of("0L");
            }
            if (unboxed.equals(TypeName.FLOAT)) {
                return CodeBlock.of("0F");
            }
            if (unboxed.equals(TypeName.DOUBLE)) {
                return CodeBlock.of("0D");
            }
            if (unboxed.equals(TypeName.SHORT) || unboxed.equals(TypeName.BYTE) || unboxed.equals(TypeName.CHAR)) {
                return CodeBlock.of("($T) 0", unboxed);
            }
            if (unboxed.isPrimitive()) {
                return CodeBlock.of("0");
            }
            return CodeBlock.of("$S", "");
        }
        return CodeBlock.of("new $T()", domainClass(shape, context));
    }

    private CodeBlock missing(FieldPlan plan, ErrorMode mode, SynthesisContext context) {
        if (mode.is(ErrorMode.Kind.PANIC)) {
            return CodeBlock.of(
                    "new $T($S)",
                    IllegalStateException.class,
                    "Missing required wire field " + context.getAggregateName() + "." + plan.getWireFieldName());
        }
        String errorFn = plan.getAnnotation().getErrorFn();
        if (errorFn != null) {
            return call(errorFn, context, CodeBlock.of("$S", plan.getName()));
        }
        ClassName errorType = errorTypeOf(plan, context);
        if (errorType == null) {
            throw new IllegalStateException("No error type for " + plan);
        }
        if (errorType.equals(context.getGeneratedErrorType())) {
            return CodeBlock.of("$T.missingField($S)", errorType, plan.getName());
        }
        return CodeBlock.of("new $T($S)", errorType, plan.getName());
    }

    private static CodeBlock call(String function, SynthesisContext context, CodeBlock... arguments) {
        int dot = function.lastIndexOf('.');
        ClassName owner = dot < 0
                ? context.getDomainType()
                : TypeTexts.toClassName(function.substring(0, dot), context.getDomainPackage());
        String method = function.substring(dot + 1);
        return CodeBlock.of("$T.$L($L)", owner, method, CodeBlock.join(List.of(arguments), ", "));
    }

    private CodeBlock declare(FieldPlan plan, SynthesisContext context, CodeBlock initializer) {
        return CodeBlock.builder()
                .addStatement("$T $L = $L", fieldType(plan, context), localName(plan), initializer)
                .build();
    }

    private DomainFieldShape elementShape(FieldPlan plan, SynthesisContext context) {
        DomainFieldShape shape = plan.getDomainShape();
        DomainFieldShape sequence = shape.isNullable() ? shape.requireInner() : shape;
        if (!sequence.isSequence()) {
            throw unsupported(shape, context);
        }
        return sequence.requireInner();
    }

    private static boolean isSequenceLike(FieldPlan plan) {
        DomainFieldShape shape = plan.getDomainShape();
        return shape.isSequence() || shape.isNullableSequence();
    }

    private static TypeName fieldType(FieldPlan plan, SynthesisContext context) {
        return TypeTexts.toTypeName(plan.getDescriptor().getTypeText(), context.getDomainPackage());
    }

    private static ClassName domainClass(DomainFieldShape shape, SynthesisContext context) {
        return TypeTexts.toClassName(TypeTexts.rawType(shape.getTypeName()), context.getDomainPackage());
    }

    private static String stem(FieldPlan plan) {
        return Names.upperCamel(plan.getWireFieldName());
    }

    private static CodeBlock read(FieldPlan plan) {
        return CodeBlock.of("$L.get$L()", WIRE, stem(plan));
    }

    private static CodeBlock readList(FieldPlan plan) {
        return CodeBlock.of("$L.get$LList()", WIRE, stem(plan));
    }

    private static CodeBlock has(FieldPlan plan) {
        return CodeBlock.of("$L.has$L()", WIRE, stem(plan));
    }

    private static CodeBlock domainValue(FieldPlan plan) {
        return CodeBlock.of("$L.$L()", DOMAIN, plan.getDescriptor().getAccessor());
    }

    private static GenerationException unsupported(DomainFieldShape shape, SynthesisContext context) {
        return new GenerationException(new GenerationDiagnostic(
                DiagnosticKind.STRATEGY_PRECONDITION_VIOLATION,
                context.getAggregateName(),
                null,
                "no wire conversion for " + shape,
                "use a custom from_wire_fn / to_wire_fn pair for nested or generic types"));
    }
}
