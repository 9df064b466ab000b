package io.github.joke.wireform.model;

import org.jspecify.annotations.Nullable;

/**
 * Mapping and optionality of a wire field. Repeated fields signal absence by being empty, so
 * their optionality is always {@link Optionality#REQUIRED}.
 */
public final class WireFieldShape {

    private final WireMapping mapping;
    private final Optionality optionality;

    private WireFieldShape(WireMapping mapping, Optionality optionality) {
        this.mapping = mapping;
        this.optionality = mapping == WireMapping.REPEATED ? Optionality.REQUIRED : optionality;
    }

    public static WireFieldShape of(WireMapping mapping, Optionality optionality) {
        return new WireFieldShape(mapping, optionality);
    }

    public WireMapping getMapping() {
        return mapping;
    }

    public Optionality getOptionality() {
        return optionality;
    }

    public boolean isOptional() {
        return optionality == Optionality.OPTIONAL && mapping != WireMapping.REPEATED;
    }

    public boolean isRepeated() {
        return mapping == WireMapping.REPEATED;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof WireFieldShape)) return false;
        WireFieldShape that = (WireFieldShape) o;
        return mapping == that.mapping && optionality == that.optionality;
    }

    @Override
    public int hashCode() {
        return 31 * mapping.hashCode() + optionality.hashCode();
    }

    @Override
    public String toString() {
        return mapping + "/" + optionality;
    }
}
