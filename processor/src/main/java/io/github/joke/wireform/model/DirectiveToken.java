package io.github.joke.wireform.model;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One raw directive as written on a field or aggregate, e.g. {@code ignore},
 * {@code default = "fallback"}, {@code error_type = com.acme.Failure} or {@code expect(panic)}.
 */
public final class DirectiveToken {

    public enum ArgumentKind {
        NONE,
        LITERAL,
        IDENTIFIER,
        PARENTHESIZED
    }

    private final String name;
    private final ArgumentKind argumentKind;
    private final @Nullable String argument;

    private DirectiveToken(String name, ArgumentKind argumentKind, @Nullable String argument) {
        this.name = name;
        this.argumentKind = argumentKind;
        this.argument = argument;
    }

    public static DirectiveToken flag(String name) {
        return new DirectiveToken(name, ArgumentKind.NONE, null);
    }

    public static DirectiveToken literal(String name, String value) {
        return new DirectiveToken(name, ArgumentKind.LITERAL, value);
    }

    public static DirectiveToken identifier(String name, String value) {
        return new DirectiveToken(name, ArgumentKind.IDENTIFIER, value);
    }

    public static DirectiveToken parenthesized(String name, String value) {
        return new DirectiveToken(name, ArgumentKind.PARENTHESIZED, value);
    }

    public String getName() {
        return name;
    }

    public ArgumentKind getArgumentKind() {
        return argumentKind;
    }

    public @Nullable String getArgument() {
        return argument;
    }

    public boolean hasArgument() {
        return argumentKind != ArgumentKind.NONE;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof DirectiveToken)) return false;
        DirectiveToken that = (DirectiveToken) o;
        return name.equals(that.name) && argumentKind == that.argumentKind && Objects.equals(argument, that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, argumentKind, argument);
    }

    @Override
    public String toString() {
        switch (argumentKind) {
            case LITERAL:
                return name + " = \"" + argument + "\"";
            case IDENTIFIER:
                return name + " = " + argument;
            case PARENTHESIZED:
                return name + "(" + argument + ")";
            default:
                return name;
        }
    }
}
