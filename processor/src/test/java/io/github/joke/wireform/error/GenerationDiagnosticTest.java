package io.github.joke.wireform.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class GenerationDiagnosticTest {

    @Test
    void rendersFieldAndFix() {
        GenerationDiagnostic diagnostic = new GenerationDiagnostic(
                DiagnosticKind.AMBIGUOUS_OPTIONALITY,
                "Track",
                "artist",
                "cannot tell whether wire field artist is optional",
                "mark the field optional or required");

        assertThat(diagnostic.render())
                .isEqualTo("AMBIGUOUS_OPTIONALITY Track.artist: cannot tell whether wire field artist is optional"
                        + " (fix: mark the field optional or required)");
    }

    @Test
    void rendersAggregateLevelProblemWithoutField() {
        GenerationDiagnostic diagnostic =
                GenerationDiagnostic.of(DiagnosticKind.MALFORMED_DIRECTIVE_VALUE, "Album.Track", null, "bad namespace");

        assertThat(diagnostic.render()).isEqualTo("MALFORMED_DIRECTIVE_VALUE Album.Track: bad namespace");
    }

    @Test
    void exceptionCarriesRenderedDiagnostic() {
        GenerationDiagnostic diagnostic =
                GenerationDiagnostic.of(DiagnosticKind.UNMATCHED_VARIANT, "Genre", "POLKA", "no match");
        GenerationException exception = new GenerationException(diagnostic);

        assertThat(exception).hasMessage("UNMATCHED_VARIANT Genre.POLKA: no match");
        assertThat(exception.getKind()).isEqualTo(DiagnosticKind.UNMATCHED_VARIANT);
        assertThat(exception.getDiagnostic()).isEqualTo(diagnostic);
    }

    @ParameterizedTest
    @EnumSource(value = DiagnosticKind.class, names = "INFERRED_NOT_VERIFIED", mode = EnumSource.Mode.EXCLUDE)
    void everyKindButInferenceWarningIsAnError(DiagnosticKind kind) {
        assertThat(kind.isError()).isTrue();
    }

    @Test
    void inferenceWarningIsNotAnError() {
        assertThat(DiagnosticKind.INFERRED_NOT_VERIFIED.isError()).isFalse();
    }
}
