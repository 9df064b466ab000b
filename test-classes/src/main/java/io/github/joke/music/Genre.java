package io.github.joke.music;

import io.github.joke.wireform.ProtoConvert;

/** Wire constants carry the {@code GENRE_} prefix. */
@ProtoConvert
public enum Genre {
    UNSPECIFIED,
    ROCK,
    JAZZ,
    CLASSICAL
}
