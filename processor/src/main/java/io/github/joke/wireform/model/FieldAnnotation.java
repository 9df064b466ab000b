package io.github.joke.wireform.model;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Typed directives of one domain field. Produced once by the directive parser; everything
 * downstream reads this record instead of the raw tokens.
 */
public final class FieldAnnotation {

    private static final FieldAnnotation EMPTY = builder().build();

    private final boolean ignore;
    private final boolean transparent;
    private final ExpectMode expectMode;
    private final @Nullable DefaultValue defaultValue;
    private final @Nullable String rename;
    private final @Nullable Optionality explicitOptionality;
    private final @Nullable String fromWireFn;
    private final @Nullable String toWireFn;
    private final @Nullable String errorFn;
    private final @Nullable String errorType;

    private FieldAnnotation(Builder builder) {
        this.ignore = builder.ignore;
        this.transparent = builder.transparent;
        this.expectMode = builder.expectMode;
        this.defaultValue = builder.defaultValue;
        this.rename = builder.rename;
        this.explicitOptionality = builder.explicitOptionality;
        this.fromWireFn = builder.fromWireFn;
        this.toWireFn = builder.toWireFn;
        this.errorFn = builder.errorFn;
        this.errorType = builder.errorType;
    }

    public static FieldAnnotation empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .ignore(ignore)
                .transparent(transparent)
                .expectMode(expectMode)
                .defaultValue(defaultValue)
                .rename(rename)
                .explicitOptionality(explicitOptionality)
                .fromWireFn(fromWireFn)
                .toWireFn(toWireFn)
                .errorFn(errorFn)
                .errorType(errorType);
    }

    /** Fills error type and function from the aggregate where this field declares none. */
    public FieldAnnotation inherit(AggregateAnnotation aggregate) {
        if ((errorFn != null || aggregate.getErrorFn() == null)
                && (errorType != null || aggregate.getErrorType() == null)) {
            return this;
        }
        return toBuilder()
                .errorFn(errorFn != null ? errorFn : aggregate.getErrorFn())
                .errorType(errorType != null ? errorType : aggregate.getErrorType())
                .build();
    }

    public boolean isIgnore() {
        return ignore;
    }

    public boolean isTransparent() {
        return transparent;
    }

    public ExpectMode getExpectMode() {
        return expectMode;
    }

    public @Nullable DefaultValue getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public @Nullable String getRename() {
        return rename;
    }

    public @Nullable Optionality getExplicitOptionality() {
        return explicitOptionality;
    }

    public @Nullable String getFromWireFn() {
        return fromWireFn;
    }

    public @Nullable String getToWireFn() {
        return toWireFn;
    }

    public boolean hasCustomFunction() {
        return fromWireFn != null || toWireFn != null;
    }

    public boolean hasAbsenceHandling() {
        return expectMode != ExpectMode.NONE || defaultValue != null;
    }

    public @Nullable String getErrorFn() {
        return errorFn;
    }

    public @Nullable String getErrorType() {
        return errorType;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldAnnotation)) return false;
        FieldAnnotation that = (FieldAnnotation) o;
        return ignore == that.ignore
                && transparent == that.transparent
                && expectMode == that.expectMode
                && Objects.equals(defaultValue, that.defaultValue)
                && Objects.equals(rename, that.rename)
                && explicitOptionality == that.explicitOptionality
                && Objects.equals(fromWireFn, that.fromWireFn)
                && Objects.equals(toWireFn, that.toWireFn)
                && Objects.equals(errorFn, that.errorFn)
                && Objects.equals(errorType, that.errorType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                ignore,
                transparent,
                expectMode,
                defaultValue,
                rename,
                explicitOptionality,
                fromWireFn,
                toWireFn,
                errorFn,
                errorType);
    }

    @Override
    public String toString() {
        return "FieldAnnotation{ignore=" + ignore + ", transparent=" + transparent + ", expect=" + expectMode
                + ", default=" + defaultValue + ", rename=" + rename + ", optionality=" + explicitOptionality
                + ", fromWireFn=" + fromWireFn + ", toWireFn=" + toWireFn + ", errorFn=" + errorFn
                + ", errorType=" + errorType + "}";
    }

    public static final class Builder {

        private boolean ignore;
        private boolean transparent;
        private ExpectMode expectMode = ExpectMode.NONE;
        private @Nullable DefaultValue defaultValue;
        private @Nullable String rename;
        private @Nullable Optionality explicitOptionality;
        private @Nullable String fromWireFn;
        private @Nullable String toWireFn;
        private @Nullable String errorFn;
        private @Nullable String errorType;

        private Builder() {}

        public Builder ignore(boolean ignore) {
            this.ignore = ignore;
            return this;
        }

        public Builder transparent(boolean transparent) {
            this.transparent = transparent;
            return this;
        }

        public Builder expectMode(ExpectMode expectMode) {
            this.expectMode = expectMode;
            return this;
        }

        public Builder defaultValue(@Nullable DefaultValue defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder rename(@Nullable String rename) {
            this.rename = rename;
            return this;
        }

        public Builder explicitOptionality(@Nullable Optionality explicitOptionality) {
            this.explicitOptionality = explicitOptionality;
            return this;
        }

        public Builder fromWireFn(@Nullable String fromWireFn) {
            this.fromWireFn = fromWireFn;
            return this;
        }

        public Builder toWireFn(@Nullable String toWireFn) {
            this.toWireFn = toWireFn;
            return this;
        }

        public Builder errorFn(@Nullable String errorFn) {
            this.errorFn = errorFn;
            return this;
        }

        public Builder errorType(@Nullable String errorType) {
            this.errorType = errorType;
            return this;
        }

        public FieldAnnotation build() {
            return new FieldAnnotation(this);
        }
    }
}
