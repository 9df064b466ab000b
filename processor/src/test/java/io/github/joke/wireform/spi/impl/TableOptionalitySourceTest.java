package io.github.joke.wireform.spi.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TableOptionalitySourceTest {

    @Test
    void canonicalKeyWins() {
        TableOptionalitySource table =
                TableOptionalitySource.of(Map.of("com.acme.wire.Track.title", true, "Track.title", false));

        assertThat(table.fieldOptionality("com.acme.wire.Track", "title")).contains(true);
    }

    @Test
    void simpleNameKeyMatchesAnyPackage() {
        TableOptionalitySource table = TableOptionalitySource.of(Map.of("Track.artist", true));

        assertThat(table.fieldOptionality("com.acme.wire.Track", "artist")).contains(true);
        assertThat(table.fieldOptionality("org.other.Track", "artist")).contains(true);
        assertThat(table.fieldOptionality("com.acme.wire.Track", "title")).isEmpty();
    }

    @Test
    void rejectsValuesOtherThanBooleans() {
        Properties properties = new Properties();
        properties.setProperty("Track.title", "maybe");

        assertThatThrownBy(() -> TableOptionalitySource.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Track.title")
                .hasMessageContaining("maybe");
    }

    @Test
    void loadsPropertiesFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("optionality.properties");
        Files.write(
                file,
                "# wire presence\nTrack.artist = true\nmusic.Track.title=FALSE\n".getBytes(StandardCharsets.UTF_8));

        TableOptionalitySource table = TableOptionalitySource.load(file);

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.fieldOptionality("io.github.joke.music.wire.Track", "artist")).contains(true);
        assertThat(table.fieldOptionality("music.Track", "title")).contains(false);
    }

    @Test
    void missingFileFails(@TempDir Path dir) {
        assertThatThrownBy(() -> TableOptionalitySource.load(dir.resolve("absent.properties")))
                .isInstanceOf(IOException.class);
    }
}
