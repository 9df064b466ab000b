package io.github.joke.wireform.spi.impl;

import io.github.joke.wireform.spi.TransparentType;
import io.github.joke.wireform.spi.TypeCatalog;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** A fixed catalog, for callers that know their types up front. */
public final class SimpleTypeCatalog implements TypeCatalog {

    private final Set<String> enums;
    private final Map<String, TransparentType> layouts;
    private final Set<String> transparent;

    private SimpleTypeCatalog(Builder builder) {
        this.enums = Set.copyOf(builder.enums);
        this.layouts = Map.copyOf(builder.layouts);
        this.transparent = Set.copyOf(builder.transparent);
    }

    public static SimpleTypeCatalog empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean isEnum(String typeName) {
        return enums.contains(typeName);
    }

    @Override
    public Optional<TransparentType> wrapperLayout(String typeName) {
        return Optional.ofNullable(layouts.get(typeName));
    }

    @Override
    public boolean isTransparent(String typeName) {
        return transparent.contains(typeName);
    }

    public static final class Builder {

        private final Set<String> enums = new HashSet<>();
        private final Map<String, TransparentType> layouts = new HashMap<>();
        private final Set<String> transparent = new HashSet<>();

        private Builder() {}

        public Builder enumType(String typeName) {
            enums.add(typeName);
            return this;
        }

        public Builder wrapper(String typeName, String innerTypeName, String accessor) {
            layouts.put(typeName, new TransparentType(innerTypeName, accessor));
            return this;
        }

        public Builder transparent(String typeName, String innerTypeName, String accessor) {
            transparent.add(typeName);
            return wrapper(typeName, innerTypeName, accessor);
        }

        public SimpleTypeCatalog build() {
            return new SimpleTypeCatalog(this);
        }
    }
}
