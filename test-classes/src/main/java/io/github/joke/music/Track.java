package io.github.joke.music;

import io.github.joke.wireform.Expect;
import io.github.joke.wireform.ProtoConvert;
import io.github.joke.wireform.ProtoField;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.Value;

@Value
@ProtoConvert
public class Track {

    @ProtoField(transparent = true)
    TrackId trackId;

    String title;

    int durationSeconds;

    @ProtoField(expect = Expect.PANIC)
    Artist artist;

    List<String> tags;

    Optional<String> subtitle;

    Genre genre;

    @ProtoField(useDefault = true)
    int playCount;

    @ProtoField(rename = "released_at_epoch", fromWireFn = "fromEpochSeconds", toWireFn = "toEpochSeconds")
    Instant releasedAt;

    @ProtoField(expect = Expect.ERROR)
    String isrc;

    byte[] artwork;

    Visibility visibility;

    @ProtoField(ignore = true)
    String displayLabel;

    public static Instant fromEpochSeconds(long seconds) {
        return Instant.ofEpochSecond(seconds);
    }

    public static long toEpochSeconds(Instant instant) {
        return instant.getEpochSecond();
    }
}
