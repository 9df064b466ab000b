package io.github.joke.wireform.stage;

import com.palantir.javapoet.ClassName;
import io.github.joke.wireform.config.GeneratorOptions;
import io.github.joke.wireform.model.AggregateAnnotation;
import java.util.Arrays;

/** Locates the wire class of a domain type. */
public final class WireTypes {

    private WireTypes() {}

    /** Package from the aggregate, then the {@code wireform.namespace} option, then the domain package. */
    public static String namespace(AggregateAnnotation annotation, GeneratorOptions options, String domainPackage) {
        if (annotation.getNamespace() != null) {
            return annotation.getNamespace();
        }
        return options.getNamespace() != null ? options.getNamespace() : domainPackage;
    }

    public static ClassName wireType(
            AggregateAnnotation annotation, GeneratorOptions options, String domainPackage, String domainSimpleName) {
        String wireName = annotation.getWireName() != null ? annotation.getWireName() : lastSegment(domainSimpleName);
        String[] names = wireName.split("\\.");
        return ClassName.get(
                namespace(annotation, options, domainPackage), names[0], Arrays.copyOfRange(names, 1, names.length));
    }

    public static ClassName domainType(String packageName, String simpleName) {
        String[] names = simpleName.split("\\.");
        return ClassName.get(packageName, names[0], Arrays.copyOfRange(names, 1, names.length));
    }

    private static String lastSegment(String dotted) {
        return dotted.substring(dotted.lastIndexOf('.') + 1);
    }
}
