package io.github.joke.wireform.stage;

import io.github.joke.wireform.model.DomainFieldShape;
import io.github.joke.wireform.model.ShapeKind;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Whether a single value crosses the wire boundary unchanged. */
final class ValueConversions {

    private static final String PROTOBUF_PACKAGE = "com.google.protobuf.";

    private static final Map<String, String> NARROW = Map.of(
            "byte", "byte",
            "Byte", "byte",
            "short", "short",
            "Short", "short",
            "char", "char",
            "Character", "char");

    private ValueConversions() {}

    /**
     * True for primitives other than {@code byte[]} and the narrow integral types, and for types
     * that already are wire types: members of the wire namespace and the protobuf well-known types.
     */
    static boolean isIdentity(DomainFieldShape shape, String wireNamespace) {
        if (shape.is(ShapeKind.PRIMITIVE)) {
            return !isByteArray(shape) && narrowing(shape) == null;
        }
        return shape.is(ShapeKind.CUSTOM_AGGREGATE) && isWireType(shape.getTypeName(), wireNamespace);
    }

    static boolean isWireType(String typeName, String wireNamespace) {
        return (!wireNamespace.isEmpty() && typeName.startsWith(wireNamespace + "."))
                || typeName.startsWith(PROTOBUF_PACKAGE);
    }

    /** The primitive a wire {@code int} is cast to for this shape, {@code null} when none is needed. */
    static @Nullable String narrowing(DomainFieldShape shape) {
        return shape.is(ShapeKind.PRIMITIVE) ? NARROW.get(TypeTexts.withoutJavaLang(shape.getTypeName())) : null;
    }

    static boolean isByteArray(DomainFieldShape shape) {
        return "byte[]".equals(shape.getTypeName());
    }
}
