package io.github.joke.wireform.error;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** A problem found while generating the converter of one aggregate. */
public final class GenerationDiagnostic {

    private final DiagnosticKind kind;
    private final String aggregate;
    private final @Nullable String field;
    private final String message;
    private final @Nullable String suggestedFix;

    public GenerationDiagnostic(
            DiagnosticKind kind,
            String aggregate,
            @Nullable String field,
            String message,
            @Nullable String suggestedFix) {
        this.kind = kind;
        this.aggregate = aggregate;
        this.field = field;
        this.message = message;
        this.suggestedFix = suggestedFix;
    }

    public static GenerationDiagnostic of(
            DiagnosticKind kind, String aggregate, @Nullable String field, String message) {
        return new GenerationDiagnostic(kind, aggregate, field, message, null);
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public String getAggregate() {
        return aggregate;
    }

    public @Nullable String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    public @Nullable String getSuggestedFix() {
        return suggestedFix;
    }

    /** One-line form, e.g. {@code AMBIGUOUS_OPTIONALITY Track.artist: ... (fix: ...)}. */
    public String render() {
        StringBuilder text = new StringBuilder()
                .append(kind)
                .append(' ')
                .append(aggregate);
        if (field != null) {
            text.append('.').append(field);
        }
        text.append(": ").append(message);
        if (suggestedFix != null) {
            text.append(" (fix: ").append(suggestedFix).append(')');
        }
        return text.toString();
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof GenerationDiagnostic)) return false;
        GenerationDiagnostic that = (GenerationDiagnostic) o;
        return kind == that.kind
                && aggregate.equals(that.aggregate)
                && Objects.equals(field, that.field)
                && message.equals(that.message)
                && Objects.equals(suggestedFix, that.suggestedFix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, aggregate, field, message, suggestedFix);
    }

    @Override
    public String toString() {
        return render();
    }
}
