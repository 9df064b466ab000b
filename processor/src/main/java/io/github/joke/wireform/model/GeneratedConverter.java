package io.github.joke.wireform.model;

import com.palantir.javapoet.TypeSpec;
import java.util.List;

/** Source types emitted for one annotated domain type, all in the domain package. */
public final class GeneratedConverter {

    private final String packageName;
    private final TypeSpec converter;
    private final List<TypeSpec> supportTypes;

    public GeneratedConverter(String packageName, TypeSpec converter, List<TypeSpec> supportTypes) {
        this.packageName = packageName;
        this.converter = converter;
        this.supportTypes = List.copyOf(supportTypes);
    }

    public String getPackageName() {
        return packageName;
    }

    public TypeSpec getConverter() {
        return converter;
    }

    public List<TypeSpec> getSupportTypes() {
        return supportTypes;
    }
}
