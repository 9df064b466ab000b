package io.github.joke.wireform.error;

public enum DiagnosticKind {
    CONFLICTING_ANNOTATION,
    MALFORMED_DIRECTIVE_VALUE,
    AMBIGUOUS_OPTIONALITY,
    STRATEGY_PRECONDITION_VIOLATION,
    UNMATCHED_VARIANT,
    EMPTY_CUSTOM_FUNCTION_REFERENCE,
    /** A wire shape chosen by heuristic. Reported as a warning, never aborts generation. */
    INFERRED_NOT_VERIFIED;

    public boolean isError() {
        return this != INFERRED_NOT_VERIFIED;
    }
}
