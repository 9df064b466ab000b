package io.github.joke.wireform;

/** Runtime behaviour of a generated converter when a required wire value is missing. */
public enum Expect {
    NONE,
    /** Throw {@link IllegalStateException} naming the field. */
    PANIC,
    /** Throw the aggregate's typed error. */
    ERROR
}
