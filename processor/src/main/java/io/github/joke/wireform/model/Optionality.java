package io.github.joke.wireform.model;

public enum Optionality {
    OPTIONAL,
    REQUIRED;

    public static Optionality of(boolean optional) {
        return optional ? OPTIONAL : REQUIRED;
    }

    public boolean isOptional() {
        return this == OPTIONAL;
    }
}
