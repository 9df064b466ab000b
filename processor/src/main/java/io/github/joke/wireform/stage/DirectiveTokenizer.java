package io.github.joke.wireform.stage;

import io.github.joke.wireform.di.RoundScoped;
import io.github.joke.wireform.error.DiagnosticKind;
import io.github.joke.wireform.error.GenerationDiagnostic;
import io.github.joke.wireform.error.GenerationException;
import io.github.joke.wireform.model.DirectiveToken;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;

/**
 * Reads the textual directive form, a comma separated list such as
 * {@code expect(panic), default = "fallback", error_type = com.acme.Failure}.
 */
@RoundScoped
public class DirectiveTokenizer {

    @Inject
    DirectiveTokenizer() {}

    public List<DirectiveToken> tokenize(String text, String aggregate, @Nullable String field) {
        return new Scanner(text, aggregate, field).readAll();
    }

    private static final class Scanner {

        private final String text;
        private final String aggregate;
        private final @Nullable String field;
        private int pos;

        Scanner(String text, String aggregate, @Nullable String field) {
            this.text = text;
            this.aggregate = aggregate;
            this.field = field;
        }

        List<DirectiveToken> readAll() {
            List<DirectiveToken> tokens = new ArrayList<>();
            skipWhitespace();
            if (atEnd()) {
                return tokens;
            }
            while (true) {
                tokens.add(readToken());
                skipWhitespace();
                if (atEnd()) {
                    return tokens;
                }
                expect(',');
                skipWhitespace();
            }
        }

        private DirectiveToken readToken() {
            String name = readIdentifier(false);
            skipWhitespace();
            if (atEnd() || peek() == ',') {
                return DirectiveToken.flag(name);
            }
            if (peek() == '(') {
                pos++;
                int close = text.indexOf(')', pos);
                if (close < 0) {
                    throw malformed("unclosed '(' after " + name);
                }
                String argument = text.substring(pos, close).trim();
                pos = close + 1;
                return DirectiveToken.parenthesized(name, argument);
            }
            expect('=');
            skipWhitespace();
            if (atEnd() || peek() == ',') {
                throw malformed(name + " = needs a value");
            }
            if (peek() == '"') {
                return DirectiveToken.literal(name, readString());
            }
            return DirectiveToken.identifier(name, readIdentifier(true));
        }

        private String readIdentifier(boolean dotted) {
            int start = pos;
            while (!atEnd()) {
                char c = peek();
                boolean part = pos == start ? Character.isJavaIdentifierStart(c) : Character.isJavaIdentifierPart(c);
                if (!part && !(dotted && c == '.' && pos > start)) {
                    break;
                }
                pos++;
            }
            if (pos == start) {
                throw malformed("expected a directive name or identifier at offset " + start);
            }
            String identifier = text.substring(start, pos);
            if (identifier.endsWith(".")) {
                throw malformed("identifier '" + identifier + "' ends with '.'");
            }
            return identifier;
        }

        private String readString() {
            StringBuilder value = new StringBuilder();
            pos++;
            while (!atEnd()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return value.toString();
                }
                if (c == '\\' && !atEnd()) {
                    c = text.charAt(pos++);
                }
                value.append(c);
            }
            throw malformed("unterminated string literal");
        }

        private void expect(char expected) {
            if (atEnd() || peek() != expected) {
                throw malformed("expected '" + expected + "' at offset " + pos);
            }
            pos++;
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        private char peek() {
            return text.charAt(pos);
        }

        private boolean atEnd() {
            return pos >= text.length();
        }

        private GenerationException malformed(String reason) {
            return new GenerationException(new GenerationDiagnostic(
                    DiagnosticKind.MALFORMED_DIRECTIVE_VALUE,
                    aggregate,
                    field,
                    "cannot read directives \"" + text + "\": " + reason,
                    "write directives as name, name(arg), name = \"literal\" or name = identifier"));
        }
    }
}
