package io.github.joke.music;

import io.github.joke.wireform.ProtoConvert;
import java.util.Optional;
import lombok.Value;

@Value
@ProtoConvert
public class Artist {
    String name;
    Optional<String> country;
}
