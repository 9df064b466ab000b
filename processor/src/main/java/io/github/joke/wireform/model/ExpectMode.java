package io.github.joke.wireform.model;

public enum ExpectMode {
    NONE,
    PANIC,
    ERROR
}
