package io.github.joke.wireform.stage;

import static javax.lang.model.element.Modifier.FINAL;
import static javax.lang.model.element.Modifier.PRIVATE;
import static javax.lang.model.element.Modifier.PUBLIC;
import static javax.lang.model.element.Modifier.STATIC;

import com.palantir.javapoet.ClassName;
import com.palantir.javapoet.CodeBlock;
import com.palantir.javapoet.MethodSpec;
import com.palantir.javapoet.TypeName;
import com.palantir.javapoet.TypeSpec;
import io.github.joke.wireform.config.GeneratorOptions;
import io.github.joke.wireform.di.RoundScoped;
import io.github.joke.wireform.error.DiagnosticKind;
import io.github.joke.wireform.error.GenerationDiagnostic;
import io.github.joke.wireform.error.GenerationException;
import io.github.joke.wireform.model.AggregateAnnotation;
import io.github.joke.wireform.model.EnumDescriptor;
import io.github.joke.wireform.model.GeneratedConverter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;

/**
 * Maps the constants of a domain enum onto its wire enum by name. A wire constant matches when it
 * equals the domain constant or carries the wire enum's name as prefix, e.g. {@code STATUS_ACTIVE}.
 */
@RoundScoped
public class EnumOrchestrator {

    private final DirectiveParser parser;
    private final GeneratorOptions options;

    @Inject
    EnumOrchestrator(DirectiveParser parser, GeneratorOptions options) {
        this.parser = parser;
        this.options = options;
    }

    public ClassName wireType(EnumDescriptor descriptor) {
        AggregateAnnotation annotation = parser.parseAggregate(descriptor.getTokens(), descriptor.getSimpleName());
        return WireTypes.wireType(annotation, options, descriptor.getPackageName(), descriptor.getSimpleName());
    }

    public GeneratedConverter orchestrate(EnumDescriptor descriptor) {
        ClassName domainType = WireTypes.domainType(descriptor.getPackageName(), descriptor.getSimpleName());
        ClassName wireType = wireType(descriptor);
        Map<String, String> mapping = mapVariants(descriptor, wireType);

        TypeSpec converter = TypeSpec.classBuilder(CodeSynthesizer.converterName(domainType))
                .addJavadoc("Converts between {@link $T} and its wire form {@link $T}.\n", domainType, wireType)
                .addModifiers(PUBLIC, FINAL)
                .addMethod(MethodSpec.constructorBuilder().addModifiers(PRIVATE).build())
                .addMethod(fromWire(domainType, wireType, mapping))
                .addMethod(toWire(domainType, wireType, mapping))
                .addMethod(fromWireNumber(domainType, wireType))
                .addMethod(toWireNumber(domainType))
                .build();
        return new GeneratedConverter(descriptor.getPackageName(), converter, List.of());
    }

    /**
     * Domain constant to wire constant, in declaration order.
     *
     * @throws GenerationException with {@link DiagnosticKind#UNMATCHED_VARIANT}
     */
    public Map<String, String> mapVariants(EnumDescriptor descriptor, ClassName wireType) {
        String prefix = Names.screamingSnake(wireType.simpleName()) + "_";
        Map<String, String> mapping = new LinkedHashMap<>();
        for (String variant : descriptor.getVariants()) {
            String screaming = Names.screamingSnake(variant);
            String match = List.of(variant, screaming, prefix + variant, prefix + screaming).stream()
                    .filter(descriptor.getWireVariants()::contains)
                    .findFirst()
                    .orElseThrow(() -> new GenerationException(new GenerationDiagnostic(
                            DiagnosticKind.UNMATCHED_VARIANT,
                            descriptor.getSimpleName(),
                            variant,
                            "no constant of " + wireType.canonicalName() + " matches " + variant + "; wire has "
                                    + descriptor.getWireVariants(),
                            "add " + prefix + screaming + " to the wire enum")));
            mapping.put(variant, match);
        }
        return mapping;
    }

    private static MethodSpec fromWire(ClassName domainType, ClassName wireType, Map<String, String> mapping) {
        CodeBlock.Builder body = CodeBlock.builder().beginControlFlow("switch (wire)");
        mapping.forEach((variant, wireVariant) -> body.add("case $L:\n", wireVariant)
                .indent()
                .addStatement("return $T.$L", domainType, variant)
                .unindent());
        body.add("default:\n")
                .indent()
                .addStatement(
                        "throw new $T($S + wire)",
                        IllegalArgumentException.class,
                        "No " + domainType.simpleName() + " constant for wire value ")
                .unindent()
                .endControlFlow();
        return MethodSpec.methodBuilder("fromWire")
                .addModifiers(PUBLIC, STATIC)
                .returns(domainType)
                .addParameter(wireType, "wire")
                .addCode(body.build())
                .build();
    }

    private static MethodSpec toWire(ClassName domainType, ClassName wireType, Map<String, String> mapping) {
        CodeBlock.Builder body = CodeBlock.builder().beginControlFlow("switch (domain)");
        mapping.forEach((variant, wireVariant) -> body.add("case $L:\n", variant)
                .indent()
                .addStatement("return $T.$L", wireType, wireVariant)
                .unindent());
        body.add("default:\n")
                .indent()
                .addStatement(
                        "throw new $T($S + domain)",
                        IllegalArgumentException.class,
                        "No wire constant for " + domainType.simpleName() + ".")
                .unindent()
                .endControlFlow();
        return MethodSpec.methodBuilder("toWire")
                .addModifiers(PUBLIC, STATIC)
                .returns(wireType)
                .addParameter(domainType, "domain")
                .addCode(body.build())
                .build();
    }

    private static MethodSpec fromWireNumber(ClassName domainType, ClassName wireType) {
        return MethodSpec.methodBuilder("fromWireNumber")
                .addModifiers(PUBLIC, STATIC)
                .returns(domainType)
                .addParameter(TypeName.INT, "number")
                .addStatement("$T wire = $T.forNumber(number)", wireType, wireType)
                .beginControlFlow("if (wire == null)")
                .addStatement(
                        "throw new $T($S + number)",
                        IllegalArgumentException.class,
                        "Unknown wire number for " + domainType.simpleName() + ": ")
                .endControlFlow()
                .addStatement("return fromWire(wire)")
                .build();
    }

    private static MethodSpec toWireNumber(ClassName domainType) {
        return MethodSpec.methodBuilder("toWireNumber")
                .addModifiers(PUBLIC, STATIC)
                .returns(TypeName.INT)
                .addParameter(domainType, "domain")
                .addStatement("return toWire(domain).getNumber()")
                .build();
    }
}
