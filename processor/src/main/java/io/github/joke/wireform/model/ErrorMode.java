package io.github.joke.wireform.model;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** What generated code does when a wire value the domain needs is absent. */
public final class ErrorMode {

    public enum Kind {
        NONE,
        PANIC,
        ERROR,
        DEFAULT
    }

    private static final ErrorMode NONE = new ErrorMode(Kind.NONE, null);
    private static final ErrorMode PANIC = new ErrorMode(Kind.PANIC, null);
    private static final ErrorMode ERROR = new ErrorMode(Kind.ERROR, null);

    private final Kind kind;
    private final @Nullable String defaultFn;

    private ErrorMode(Kind kind, @Nullable String defaultFn) {
        this.kind = kind;
        this.defaultFn = defaultFn;
    }

    public static ErrorMode none() {
        return NONE;
    }

    public static ErrorMode panic() {
        return PANIC;
    }

    public static ErrorMode error() {
        return ERROR;
    }

    public static ErrorMode defaultValue(@Nullable String defaultFn) {
        return new ErrorMode(Kind.DEFAULT, defaultFn);
    }

    public static ErrorMode fromDefault(DefaultValue value) {
        return defaultValue(value.getFunctionName());
    }

    public Kind getKind() {
        return kind;
    }

    public boolean is(Kind candidate) {
        return kind == candidate;
    }

    public @Nullable String getDefaultFn() {
        return defaultFn;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorMode)) return false;
        ErrorMode that = (ErrorMode) o;
        return kind == that.kind && Objects.equals(defaultFn, that.defaultFn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, defaultFn);
    }

    @Override
    public String toString() {
        if (kind == Kind.DEFAULT) {
            return defaultFn == null ? "Default" : "Default(" + defaultFn + ")";
        }
        return kind == Kind.NONE ? "None" : kind == Kind.PANIC ? "Panic" : "Error";
    }
}
