package io.github.joke.wireform.processor;

import io.github.joke.wireform.di.ProcessorScoped;
import io.github.joke.wireform.spi.TransparentType;
import io.github.joke.wireform.spi.TypeCatalog;
import io.github.joke.wireform.stage.TypeTexts;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.util.Elements;
import org.jspecify.annotations.Nullable;

/** Answers type questions from the compiler's view of the sources being processed. */
@ProcessorScoped
public class ElementTypeCatalog implements TypeCatalog {

    private final Elements elements;

    @Inject
    ElementTypeCatalog(Elements elements) {
        this.elements = elements;
    }

    @Override
    public boolean isEnum(String typeName) {
        TypeElement type = lookup(typeName);
        return type != null && type.getKind() == ElementKind.ENUM;
    }

    @Override
    public Optional<TransparentType> wrapperLayout(String typeName) {
        TypeElement type = lookup(typeName);
        if (type == null || !(type.getKind() == ElementKind.CLASS || type.getKind() == ElementKind.RECORD)) {
            return Optional.empty();
        }
        List<VariableElement> fields = DescriptorExtractor.instanceFields(type);
        if (fields.size() != 1) {
            return Optional.empty();
        }
        VariableElement field = fields.get(0);
        return Optional.of(new TransparentType(
                TypeTexts.normalize(field.asType().toString()), DescriptorExtractor.accessorOf(type, field)));
    }

    private @Nullable TypeElement lookup(String typeName) {
        String raw = TypeTexts.rawType(typeName);
        if (TypeTexts.isPrimitiveKeyword(raw) || !raw.contains(".")) {
            return null;
        }
        return elements.getTypeElement(raw);
    }
}
