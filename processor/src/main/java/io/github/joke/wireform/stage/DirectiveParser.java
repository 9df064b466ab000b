package io.github.joke.wireform.stage;

import io.github.joke.wireform.di.RoundScoped;
import io.github.joke.wireform.error.DiagnosticKind;
import io.github.joke.wireform.error.GenerationDiagnostic;
import io.github.joke.wireform.error.GenerationException;
import io.github.joke.wireform.model.AggregateAnnotation;
import io.github.joke.wireform.model.DefaultValue;
import io.github.joke.wireform.model.DirectiveToken;
import io.github.joke.wireform.model.DirectiveToken.ArgumentKind;
import io.github.joke.wireform.model.ExpectMode;
import io.github.joke.wireform.model.FieldAnnotation;
import io.github.joke.wireform.model.Optionality;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;

/** Turns raw directive tokens into typed annotation records. */
@RoundScoped
public class DirectiveParser {

    @Inject
    DirectiveParser() {}

    public FieldAnnotation parseField(List<DirectiveToken> tokens, String aggregate, String field) {
        FieldAnnotation.Builder builder = FieldAnnotation.builder();
        Map<String, DirectiveToken> seen = new HashMap<>();
        boolean optional = false;
        boolean required = false;
        @Nullable ExpectMode expect = null;
        for (DirectiveToken token : tokens) {
            if (!"expect".equals(token.getName())) {
                checkRepeat(seen, token, aggregate, field);
            }
            switch (token.getName()) {
                case "ignore":
                    requireFlag(token, aggregate, field);
                    builder.ignore(true);
                    break;
                case "transparent":
                    requireFlag(token, aggregate, field);
                    builder.transparent(true);
                    break;
                case "optional":
                    requireFlag(token, aggregate, field);
                    optional = true;
                    break;
                case "required":
                    requireFlag(token, aggregate, field);
                    required = true;
                    break;
                case "expect":
                    ExpectMode mode = expectMode(token, aggregate, field);
                    if (expect != null && expect != mode) {
                        throw conflict(
                                aggregate,
                                field,
                                "expect is given as both " + expect + " and " + mode,
                                "keep a single expect directive");
                    }
                    expect = mode;
                    builder.expectMode(mode);
                    break;
                case "default":
                    builder.defaultValue(defaultValue(token, aggregate, field));
                    break;
                case "rename":
                    builder.rename(requireNonEmpty(token, aggregate, field));
                    break;
                case "from_wire_fn":
                    builder.fromWireFn(requireValue(token, aggregate, field));
                    break;
                case "to_wire_fn":
                    builder.toWireFn(requireValue(token, aggregate, field));
                    break;
                case "error_fn":
                    builder.errorFn(requireNonEmpty(token, aggregate, field));
                    break;
                case "error_type":
                    builder.errorType(requireNonEmpty(token, aggregate, field));
                    break;
                default:
                    throw unknown(token, aggregate, field);
            }
        }
        if (optional && required) {
            throw new GenerationException(new GenerationDiagnostic(
                    DiagnosticKind.CONFLICTING_ANNOTATION,
                    aggregate,
                    field,
                    "field is marked both optional and required",
                    "keep only one of optional or required"));
        }
        if (optional || required) {
            builder.explicitOptionality(Optionality.of(optional));
        }
        return builder.build();
    }

    public AggregateAnnotation parseAggregate(List<DirectiveToken> tokens, String aggregate) {
        Map<String, DirectiveToken> seen = new HashMap<>();
        @Nullable String namespace = null;
        @Nullable String wireName = null;
        @Nullable String errorType = null;
        @Nullable String errorFn = null;
        for (DirectiveToken token : tokens) {
            checkRepeat(seen, token, aggregate, null);
            switch (token.getName()) {
                case "namespace":
                    namespace = requireNonEmpty(token, aggregate, null);
                    break;
                case "wire_name":
                    wireName = requireNonEmpty(token, aggregate, null);
                    break;
                case "error_type":
                    errorType = requireNonEmpty(token, aggregate, null);
                    break;
                case "error_fn":
                    errorFn = requireNonEmpty(token, aggregate, null);
                    break;
                default:
                    throw unknown(token, aggregate, null);
            }
        }
        return new AggregateAnnotation(namespace, wireName, errorType, errorFn);
    }

    private static void checkRepeat(
            Map<String, DirectiveToken> seen, DirectiveToken token, String aggregate, @Nullable String field) {
        DirectiveToken previous = seen.put(token.getName(), token);
        if (previous == null) {
            return;
        }
        if ("default".equals(token.getName())) {
            throw conflict(aggregate, field, "default is given more than once", "declare a single default");
        }
        if (!previous.equals(token)) {
            throw conflict(
                    aggregate,
                    field,
                    "contradicting directives " + previous + " and " + token,
                    "keep only one " + token.getName() + " directive");
        }
    }

    private static ExpectMode expectMode(DirectiveToken token, String aggregate, String field) {
        if (token.getArgumentKind() == ArgumentKind.NONE) {
            return ExpectMode.ERROR;
        }
        if (token.getArgumentKind() == ArgumentKind.PARENTHESIZED) {
            if ("panic".equals(token.getArgument())) {
                return ExpectMode.PANIC;
            }
            if ("error".equals(token.getArgument())) {
                return ExpectMode.ERROR;
            }
        }
        throw malformed(token, aggregate, field, "unknown expect mode", "use expect, expect(panic) or expect(error)");
    }

    private static DefaultValue defaultValue(DirectiveToken token, String aggregate, String field) {
        if (token.getArgumentKind() == ArgumentKind.NONE) {
            return DefaultValue.defaultTrait();
        }
        return DefaultValue.customFn(requireNonEmpty(token, aggregate, field));
    }

    private static void requireFlag(DirectiveToken token, String aggregate, String field) {
        if (token.hasArgument()) {
            throw malformed(
                    token, aggregate, field, token.getName() + " takes no value", "write " + token.getName() + " alone");
        }
    }

    private static String requireValue(DirectiveToken token, String aggregate, @Nullable String field) {
        String argument = token.getArgument();
        if (argument == null || token.getArgumentKind() == ArgumentKind.PARENTHESIZED) {
            throw malformed(
                    token,
                    aggregate,
                    field,
                    token.getName() + " needs a string literal or identifier value",
                    "write " + token.getName() + " = \"value\"");
        }
        return argument.trim();
    }

    private static String requireNonEmpty(DirectiveToken token, String aggregate, @Nullable String field) {
        String value = requireValue(token, aggregate, field);
        if (value.isEmpty()) {
            throw malformed(
                    token,
                    aggregate,
                    field,
                    token.getName() + " has an empty value",
                    "write " + token.getName() + " = \"value\"");
        }
        return value;
    }

    private static GenerationException unknown(DirectiveToken token, String aggregate, @Nullable String field) {
        return malformed(token, aggregate, field, "unknown directive " + token.getName(), null);
    }

    private static GenerationException malformed(
            DirectiveToken token,
            String aggregate,
            @Nullable String field,
            String reason,
            @Nullable String suggestedFix) {
        return new GenerationException(new GenerationDiagnostic(
                DiagnosticKind.MALFORMED_DIRECTIVE_VALUE, aggregate, field, reason + " in '" + token + "'", suggestedFix));
    }

    private static GenerationException conflict(
            String aggregate, @Nullable String field, String reason, String suggestedFix) {
        return new GenerationException(new GenerationDiagnostic(
                DiagnosticKind.CONFLICTING_ANNOTATION, aggregate, field, reason, suggestedFix));
    }
}
