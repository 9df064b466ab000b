package io.github.joke.wireform.error;

/**
 * Aborts generation of the current aggregate. Caught once per aggregate by the pipeline, which
 * reports the carried diagnostic.
 */
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient GenerationDiagnostic diagnostic;

    public GenerationException(GenerationDiagnostic diagnostic) {
        super(diagnostic.render());
        this.diagnostic = diagnostic;
    }

    public GenerationDiagnostic getDiagnostic() {
        return diagnostic;
    }

    public DiagnosticKind getKind() {
        return diagnostic.getKind();
    }
}
