package io.github.joke.wireform.processor;

import io.github.joke.wireform.spi.FieldOptionalitySource;
import io.github.joke.wireform.stage.Names;
import java.util.List;
import java.util.Optional;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Elements;

/**
 * Reads field presence off generated wire classes: a {@code hasX()} accessor means the field is
 * optional, a plain {@code getX()} without one means it is required.
 */
public final class WireTypeOptionalitySource implements FieldOptionalitySource {

    private final Elements elements;

    public WireTypeOptionalitySource(Elements elements) {
        this.elements = elements;
    }

    @Override
    public Optional<Boolean> fieldOptionality(String wireMessage, String wireField) {
        TypeElement type = elements.getTypeElement(wireMessage);
        if (type == null) {
            return Optional.empty();
        }
        String stem = Names.upperCamel(wireField);
        List<ExecutableElement> methods = ElementFilter.methodsIn(type.getEnclosedElements());
        if (hasNoArgMethod(methods, "has" + stem)) {
            return Optional.of(true);
        }
        if (hasNoArgMethod(methods, "get" + stem)) {
            return Optional.of(false);
        }
        return Optional.empty();
    }

    private static boolean hasNoArgMethod(List<ExecutableElement> methods, String name) {
        return methods.stream()
                .anyMatch(method -> method.getSimpleName().contentEquals(name) && method.getParameters().isEmpty());
    }
}
