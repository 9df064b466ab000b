package io.github.joke.wireform.spi;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

public final class TransparentType {

    private final String innerTypeName;
    private final String accessor;

    public TransparentType(String innerTypeName, String accessor) {
        this.innerTypeName = innerTypeName;
        this.accessor = accessor;
    }

    public String getInnerTypeName() {
        return innerTypeName;
    }

    public String getAccessor() {
        return accessor;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof TransparentType)) return false;
        TransparentType that = (TransparentType) o;
        return innerTypeName.equals(that.innerTypeName) && accessor.equals(that.accessor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(innerTypeName, accessor);
    }

    @Override
    public String toString() {
        return innerTypeName + " via " + accessor + "()";
    }
}
