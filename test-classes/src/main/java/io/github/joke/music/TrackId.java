package io.github.joke.music;

import lombok.Value;

@Value
public class TrackId {
    String value;
}
