package io.github.joke.music;

import io.github.joke.wireform.ProtoConvert;

@ProtoConvert
public enum Visibility {
    PUBLIC,
    UNLISTED,
    PRIVATE
}
