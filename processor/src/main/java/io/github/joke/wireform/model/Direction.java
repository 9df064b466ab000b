package io.github.joke.wireform.model;

public enum Direction {
    FROM_WIRE,
    TO_WIRE
}
