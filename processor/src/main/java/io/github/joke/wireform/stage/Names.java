package io.github.joke.wireform.stage;

import java.util.Locale;

/** Identifier case conversions between domain fields and protobuf-java naming. */
public final class Names {

    private Names() {}

    /**
     * {@code playCount} to {@code play_count}, {@code HTTPServer} to {@code http_server}; snake_case
     * input is returned unchanged.
     */
    public static String snakeCase(String name) {
        StringBuilder out = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && startsWord(name, i)) {
                    out.append('_');
                }
                out.append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static boolean startsWord(String name, int i) {
        char previous = name.charAt(i - 1);
        if (previous == '_') {
            return false;
        }
        if (Character.isLowerCase(previous) || Character.isDigit(previous)) {
            return true;
        }
        return i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
    }

    /**
     * {@code play_count} to {@code PlayCount}, the stem of protobuf-java accessors. Like protoc, a letter
     * following a digit starts a new word: {@code v1beta} to {@code V1Beta}.
     */
    public static String upperCamel(String name) {
        StringBuilder out = new StringBuilder(name.length());
        boolean upperNext = true;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                upperNext = true;
            } else if (upperNext) {
                out.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                out.append(c);
            }
            if (Character.isDigit(c)) {
                upperNext = true;
            }
        }
        return out.toString();
    }

    public static String screamingSnake(String name) {
        return snakeCase(name).toUpperCase(Locale.ROOT);
    }

    public static String capitalize(String name) {
        return name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
