package io.github.joke.wireform.model;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** Aggregate-level directives: wire location overrides and the error defaults fields inherit. */
public final class AggregateAnnotation {

    private static final AggregateAnnotation EMPTY = new AggregateAnnotation(null, null, null, null);

    private final @Nullable String namespace;
    private final @Nullable String wireName;
    private final @Nullable String errorType;
    private final @Nullable String errorFn;

    public AggregateAnnotation(
            @Nullable String namespace,
            @Nullable String wireName,
            @Nullable String errorType,
            @Nullable String errorFn) {
        this.namespace = namespace;
        this.wireName = wireName;
        this.errorType = errorType;
        this.errorFn = errorFn;
    }

    public static AggregateAnnotation empty() {
        return EMPTY;
    }

    public @Nullable String getNamespace() {
        return namespace;
    }

    public @Nullable String getWireName() {
        return wireName;
    }

    public @Nullable String getErrorType() {
        return errorType;
    }

    public @Nullable String getErrorFn() {
        return errorFn;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateAnnotation)) return false;
        AggregateAnnotation that = (AggregateAnnotation) o;
        return Objects.equals(namespace, that.namespace)
                && Objects.equals(wireName, that.wireName)
                && Objects.equals(errorType, that.errorType)
                && Objects.equals(errorFn, that.errorFn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, wireName, errorType, errorFn);
    }

    @Override
    public String toString() {
        return "AggregateAnnotation{namespace=" + namespace + ", wireName=" + wireName + ", errorType=" + errorType
                + ", errorFn=" + errorFn + "}";
    }
}
