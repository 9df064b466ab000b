package io.github.joke.wireform.spi;

import java.util.Optional;

/** Facts about named domain types that cannot be read off the type text alone. */
public interface TypeCatalog {

    boolean isEnum(String typeName);

    Optional<TransparentType> wrapperLayout(String typeName);

    default boolean isTransparent(String typeName) {
        return false;
    }
}
