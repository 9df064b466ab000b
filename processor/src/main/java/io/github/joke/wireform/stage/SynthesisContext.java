package io.github.joke.wireform.stage;

import com.palantir.javapoet.ClassName;
import org.jspecify.annotations.Nullable;

public final class SynthesisContext {

    private final ClassName domainType;
    private final ClassName wireType;
    private final String wireNamespace;
    private final @Nullable ClassName generatedErrorType;

    public SynthesisContext(
            ClassName domainType, ClassName wireType, String wireNamespace, @Nullable ClassName generatedErrorType) {
        this.domainType = domainType;
        this.wireType = wireType;
        this.wireNamespace = wireNamespace;
        this.generatedErrorType = generatedErrorType;
    }

    public ClassName getDomainType() {
        return domainType;
    }

    public ClassName getWireType() {
        return wireType;
    }

    public String getWireNamespace() {
        return wireNamespace;
    }

    public @Nullable ClassName getGeneratedErrorType() {
        return generatedErrorType;
    }

    public String getDomainPackage() {
        return domainType.packageName();
    }

    public String getAggregateName() {
        return String.join(".", domainType.simpleNames());
    }
}
