package io.github.joke.music;

import io.github.joke.wireform.ProtoConvert;
import io.github.joke.wireform.ProtoField;
import java.util.List;

@ProtoConvert(directives = "namespace = \"io.github.joke.music.wire\"")
public record Playlist(
        String name,
        List<Track> tracks,
        @ProtoField(directives = "default = \"noDescription\"") String description,
        @ProtoField(rename = "curators") List<Artist> owners) {

    public static String noDescription() {
        return "(no description)";
    }
}
