package io.github.joke.wireform.model;

/** Which rule decided a wire field's shape, in priority order. */
public enum InferenceTier {
    EXPLICIT_OVERRIDE,
    SIDE_CHANNEL,
    STRUCTURAL,
    USAGE_PATTERN
}
