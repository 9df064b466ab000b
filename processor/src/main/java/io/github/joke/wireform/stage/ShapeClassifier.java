package io.github.joke.wireform.stage;

import io.github.joke.wireform.config.GeneratorOptions;
import io.github.joke.wireform.di.RoundScoped;
import io.github.joke.wireform.model.DomainFieldShape;
import io.github.joke.wireform.spi.TransparentType;
import io.github.joke.wireform.spi.TypeCatalog;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;

/**
 * Classifies declared-type text into a {@link DomainFieldShape}. Total: every input yields a
 * shape, unknown names end up as custom aggregates.
 */
@RoundScoped
public class ShapeClassifier {

    static final Set<String> BUILT_IN_PRIMITIVES = Set.of(
            "boolean",
            "byte",
            "short",
            "int",
            "long",
            "char",
            "float",
            "double",
            "Boolean",
            "Byte",
            "Short",
            "Integer",
            "Long",
            "Character",
            "Float",
            "Double",
            "String",
            "byte[]",
            "ByteString",
            "com.google.protobuf.ByteString");

    static final String DEFAULT_WRAPPER_ACCESSOR = "getValue";

    private final Set<String> extraPrimitives;
    private final TypeCatalog catalog;

    @Inject
    ShapeClassifier(GeneratorOptions options, TypeCatalog catalog) {
        this.extraPrimitives = options.getExtraPrimitives();
        this.catalog = catalog;
    }

    public DomainFieldShape classify(String typeText) {
        return classify(typeText, false);
    }

    /**
     * @param transparent the field carries the {@code transparent} directive; applies to the value
     *     type inside {@code Optional} or {@code List}
     */
    public DomainFieldShape classify(String typeText, boolean transparent) {
        String text = TypeTexts.normalize(typeText);
        if (TypeTexts.isGeneric(text)) {
            return classifyGeneric(text, transparent);
        }
        if (transparent || catalog.isTransparent(text)) {
            return classifyTransparent(text);
        }
        if (isPrimitive(text)) {
            return DomainFieldShape.primitive(text);
        }
        if (catalog.isEnum(text)) {
            return DomainFieldShape.taggedEnum(text);
        }
        boolean plainName = !text.endsWith("[]") && !TypeTexts.isPrimitiveKeyword(text);
        return DomainFieldShape.customAggregate(text, plainName);
    }

    public boolean isPrimitive(String typeText) {
        String text = TypeTexts.withoutJavaLang(typeText);
        return BUILT_IN_PRIMITIVES.contains(text) || extraPrimitives.contains(text) || extraPrimitives.contains(typeText);
    }

    private DomainFieldShape classifyGeneric(String text, boolean transparent) {
        String raw = TypeTexts.rawType(text);
        List<String> arguments = TypeTexts.typeArguments(text);
        if (arguments.size() == 1) {
            if ("Optional".equals(raw) || "java.util.Optional".equals(raw)) {
                return DomainFieldShape.nullable(text, classify(arguments.get(0), transparent));
            }
            if ("List".equals(raw) || "java.util.List".equals(raw)) {
                return DomainFieldShape.sequence(text, classify(arguments.get(0), transparent));
            }
        }
        return DomainFieldShape.customAggregate(text, false);
    }

    private DomainFieldShape classifyTransparent(String text) {
        Optional<TransparentType> layout = catalog.wrapperLayout(text);
        if (layout.isEmpty()) {
            return DomainFieldShape.transparent(text, null, DEFAULT_WRAPPER_ACCESSOR);
        }
        String innerText = TypeTexts.normalize(layout.get().getInnerTypeName());
        DomainFieldShape inner = innerText.equals(text)
                ? DomainFieldShape.customAggregate(innerText, true)
                : classify(innerText, false);
        return DomainFieldShape.transparent(text, inner, layout.get().getAccessor());
    }
}
