package io.github.joke.music;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.protobuf.ByteString;
import io.github.joke.wireform.WireConversionException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TrackWireConverterTest {

    private static final Instant RELEASED = Instant.ofEpochSecond(1_700_000_000L);

    @Test
    void convertsCompleteWireTrack() {
        Track track = TrackWireConverter.fromWire(wireTrack().build());

        assertThat(track.getTrackId()).isEqualTo(new TrackId("trk-1"));
        assertThat(track.getTitle()).isEqualTo("So What");
        assertThat(track.getDurationSeconds()).isEqualTo(562);
        assertThat(track.getArtist()).isEqualTo(new Artist("Miles Davis", Optional.of("US")));
        assertThat(track.getTags()).containsExactly("modal", "1959");
        assertThat(track.getSubtitle()).contains("Kind of Blue");
        assertThat(track.getGenre()).isEqualTo(Genre.JAZZ);
        assertThat(track.getPlayCount()).isEqualTo(42);
        assertThat(track.getReleasedAt()).isEqualTo(RELEASED);
        assertThat(track.getIsrc()).isEqualTo("USSM15900113");
        assertThat(track.getArtwork()).containsExactly(1, 2, 3);
        assertThat(track.getVisibility()).isEqualTo(Visibility.UNLISTED);
        assertThat(track.getDisplayLabel()).isEmpty();
    }

    @Test
    void writesEveryMappedField() {
        Track track = new Track(
                new TrackId("trk-2"),
                "Blue in Green",
                337,
                new Artist("Bill Evans", Optional.empty()),
                List.of("ballad"),
                Optional.empty(),
                Genre.JAZZ,
                7,
                RELEASED,
                "USSM15900115",
                new byte[] {9},
                Visibility.PUBLIC,
                "ignored");

        io.github.joke.music.wire.Track wire = TrackWireConverter.toWire(track);

        assertThat(wire.getTrackId()).isEqualTo("trk-2");
        assertThat(wire.getArtist().getName()).isEqualTo("Bill Evans");
        assertThat(wire.getArtist().hasCountry()).isFalse();
        assertThat(wire.getTagsList()).containsExactly("ballad");
        assertThat(wire.hasSubtitle()).isFalse();
        assertThat(wire.getGenre()).isEqualTo(io.github.joke.music.wire.Genre.GENRE_JAZZ);
        assertThat(wire.getPlayCount()).isEqualTo(7);
        assertThat(wire.getReleasedAtEpoch()).isEqualTo(1_700_000_000L);
        assertThat(wire.getArtwork()).isEqualTo(ByteString.copyFrom(new byte[] {9}));
        assertThat(wire.getVisibility()).isEqualTo(io.github.joke.music.wire.Visibility.PUBLIC);
    }

    @Test
    void roundTripKeepsEverythingButIgnoredFields() {
        io.github.joke.music.wire.Track wire = wireTrack().build();

        assertThat(TrackWireConverter.toWire(TrackWireConverter.fromWire(wire))).isEqualTo(wire);
    }

    @Test
    void missingPlayCountFallsBackToZero() {
        Track track = TrackWireConverter.fromWire(wireTrack().clearPlayCount().build());

        assertThat(track.getPlayCount()).isZero();
    }

    @Test
    void missingSubtitleIsEmpty() {
        Track track = TrackWireConverter.fromWire(wireTrack().clearSubtitle().build());

        assertThat(track.getSubtitle()).isEmpty();
    }

    @Test
    void missingArtistPanics() {
        io.github.joke.music.wire.Track wire = wireTrack().clearArtist().build();

        assertThatThrownBy(() -> TrackWireConverter.fromWire(wire))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Missing required wire field Track.artist");
    }

    @Test
    void missingIsrcRaisesGeneratedConversionError() {
        io.github.joke.music.wire.Track wire = wireTrack().clearIsrc().build();

        assertThatThrownBy(() -> TrackWireConverter.fromWire(wire))
                .isInstanceOf(TrackConversionException.class)
                .isInstanceOf(WireConversionException.class)
                .satisfies(e -> assertThat(((WireConversionException) e).getFieldName()).isEqualTo("isrc"));
    }

    static io.github.joke.music.wire.Track.Builder wireTrack() {
        return io.github.joke.music.wire.Track.newBuilder()
                .setTrackId("trk-1")
                .setTitle("So What")
                .setDurationSeconds(562)
                .setArtist(io.github.joke.music.wire.Artist.newBuilder()
                        .setName("Miles Davis")
                        .setCountry("US"))
                .addAllTags(List.of("modal", "1959"))
                .setSubtitle("Kind of Blue")
                .setGenre(io.github.joke.music.wire.Genre.GENRE_JAZZ)
                .setPlayCount(42)
                .setReleasedAtEpoch(1_700_000_000L)
                .setIsrc("USSM15900113")
                .setArtwork(ByteString.copyFrom(new byte[] {1, 2, 3}))
                .setVisibility(io.github.joke.music.wire.Visibility.UNLISTED);
    }
}
