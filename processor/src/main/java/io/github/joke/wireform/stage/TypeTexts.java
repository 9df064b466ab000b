package io.github.joke.wireform.stage;

import com.palantir.javapoet.ArrayTypeName;
import com.palantir.javapoet.ClassName;
import com.palantir.javapoet.ParameterizedTypeName;
import com.palantir.javapoet.TypeName;
import com.palantir.javapoet.WildcardTypeName;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Helpers over declared-type text such as {@code java.util.List<com.acme.Tag>}. */
public final class TypeTexts {

    private static final Pattern TYPE_ANNOTATION = Pattern.compile("@[\\w.$]+(\\([^)]*\\))?");
    private static final Pattern WILDCARD_BOUND = Pattern.compile("\\?\\s*(extends|super)\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, TypeName> PRIMITIVE_TYPES = Map.of(
            "boolean", TypeName.BOOLEAN,
            "byte", TypeName.BYTE,
            "short", TypeName.SHORT,
            "int", TypeName.INT,
            "long", TypeName.LONG,
            "char", TypeName.CHAR,
            "float", TypeName.FLOAT,
            "double", TypeName.DOUBLE);

    private static final List<String> JAVA_LANG = Arrays.asList(
            "Boolean", "Byte", "Short", "Integer", "Long", "Character", "Float", "Double", "String", "Object");

    private TypeTexts() {}

    /** Drops type-use annotations, wildcard bounds and all whitespace. */
    public static String normalize(String typeText) {
        String text = TYPE_ANNOTATION.matcher(typeText).replaceAll(" ");
        text = WILDCARD_BOUND.matcher(text).replaceAll("");
        return WHITESPACE.matcher(text).replaceAll("");
    }

    public static String rawType(String typeText) {
        int open = typeText.indexOf('<');
        return open < 0 ? typeText : typeText.substring(0, open);
    }

    public static boolean isGeneric(String typeText) {
        return typeText.indexOf('<') >= 0;
    }

    public static List<String> typeArguments(String typeText) {
        int open = typeText.indexOf('<');
        if (open < 0 || !typeText.endsWith(">")) {
            return List.of();
        }
        String body = typeText.substring(open + 1, typeText.length() - 1);
        List<String> arguments = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == ',' && depth == 0) {
                arguments.add(body.substring(start, i));
                start = i + 1;
            }
        }
        arguments.add(body.substring(start));
        return arguments;
    }

    public static String simpleName(String typeText) {
        String raw = rawType(typeText);
        return raw.substring(raw.lastIndexOf('.') + 1);
    }

    /** Name with {@code java.lang.} dropped from top-level classes of that package. */
    public static String withoutJavaLang(String typeText) {
        if (typeText.startsWith("java.lang.") && typeText.indexOf('.', "java.lang.".length()) < 0) {
            return typeText.substring("java.lang.".length());
        }
        return typeText;
    }

    public static boolean isPrimitiveKeyword(String typeText) {
        return PRIMITIVE_TYPES.containsKey(typeText);
    }

    /**
     * Parses type text into a JavaPoet type. Unqualified names resolve against {@code java.lang},
     * {@code java.util} for {@code Optional} and {@code List}, and {@code defaultPackage} otherwise.
     */
    public static TypeName toTypeName(String typeText, String defaultPackage) {
        String text = normalize(typeText);
        TypeName primitive = PRIMITIVE_TYPES.get(text);
        if (primitive != null) {
            return primitive;
        }
        if (text.endsWith("[]")) {
            return ArrayTypeName.of(toTypeName(text.substring(0, text.length() - 2), defaultPackage));
        }
        if ("?".equals(text)) {
            return WildcardTypeName.subtypeOf(Object.class);
        }
        ClassName raw = toClassName(rawType(text), defaultPackage);
        if (!isGeneric(text)) {
            return raw;
        }
        TypeName[] arguments = typeArguments(text).stream()
                .map(argument -> toTypeName(argument, defaultPackage).box())
                .toArray(TypeName[]::new);
        return ParameterizedTypeName.get(raw, arguments);
    }

    /** Splits at the first segment that starts upper case: package before, nested names after. */
    public static ClassName toClassName(String name, String defaultPackage) {
        if (name.indexOf('.') < 0) {
            if (JAVA_LANG.contains(name)) {
                return ClassName.get("java.lang", name);
            }
            if ("Optional".equals(name) || "List".equals(name)) {
                return ClassName.get("java.util", name);
            }
            if ("ByteString".equals(name)) {
                return ClassName.get("com.google.protobuf", name);
            }
            return ClassName.get(defaultPackage, name);
        }
        String[] segments = name.split("\\.");
        int first = 0;
        while (first < segments.length - 1 && !Character.isUpperCase(segments[first].charAt(0))) {
            first++;
        }
        String packageName = first == 0 ? defaultPackage : String.join(".", Arrays.copyOfRange(segments, 0, first));
        String[] nested = Arrays.copyOfRange(segments, first + 1, segments.length);
        return ClassName.get(packageName, segments[first], nested);
    }
}
