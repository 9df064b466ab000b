package io.github.joke.wireform.model;

public enum ShapeKind {
    PRIMITIVE,
    NULLABLE_WRAPPER,
    SEQUENCE_WRAPPER,
    TRANSPARENT_WRAPPER,
    TAGGED_ENUM,
    CUSTOM_AGGREGATE
}
