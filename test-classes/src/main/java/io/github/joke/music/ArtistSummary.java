package io.github.joke.music;

import io.github.joke.wireform.Expect;
import io.github.joke.wireform.ProtoConvert;
import io.github.joke.wireform.ProtoField;
import java.util.Optional;
import lombok.Value;

/** A second view over the wire {@code Artist}, rejecting artists without a country. */
@Value
@ProtoConvert(wireName = "Artist", errorFn = "missing")
public class ArtistSummary {

    Optional<String> name;

    @ProtoField(expect = Expect.ERROR)
    String country;

    public static IllegalArgumentException missing(String field) {
        return new IllegalArgumentException("artist summary lacks " + field);
    }
}
