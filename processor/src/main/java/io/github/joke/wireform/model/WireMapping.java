package io.github.joke.wireform.model;

public enum WireMapping {
    SCALAR,
    OPTIONAL,
    REPEATED,
    MESSAGE,
    CUSTOM_DERIVED
}
