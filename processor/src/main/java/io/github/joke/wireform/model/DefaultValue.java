package io.github.joke.wireform.model;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

public final class DefaultValue {

    private static final DefaultValue DEFAULT_TRAIT = new DefaultValue(null);

    private final @Nullable String functionName;

    private DefaultValue(@Nullable String functionName) {
        this.functionName = functionName;
    }

    public static DefaultValue defaultTrait() {
        return DEFAULT_TRAIT;
    }

    public static DefaultValue customFn(String functionName) {
        return new DefaultValue(functionName);
    }

    public boolean isCustomFn() {
        return functionName != null;
    }

    public @Nullable String getFunctionName() {
        return functionName;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof DefaultValue)) return false;
        return Objects.equals(functionName, ((DefaultValue) o).functionName);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(functionName);
    }

    @Override
    public String toString() {
        return functionName == null ? "DefaultTrait" : "CustomFn(" + functionName + ")";
    }
}
