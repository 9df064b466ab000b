package io.github.joke.wireform.model;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Syntactic shape of a domain field type. Wrappers carry the shape of their type argument;
 * a transparent wrapper carries the wrapped type when it is known.
 */
public final class DomainFieldShape {

    private final ShapeKind kind;
    private final String typeName;
    private final @Nullable DomainFieldShape inner;
    private final @Nullable String accessor;
    private final boolean plainName;

    private DomainFieldShape(
            ShapeKind kind,
            String typeName,
            @Nullable DomainFieldShape inner,
            @Nullable String accessor,
            boolean plainName) {
        this.kind = kind;
        this.typeName = typeName;
        this.inner = inner;
        this.accessor = accessor;
        this.plainName = plainName;
    }

    public static DomainFieldShape primitive(String typeName) {
        return new DomainFieldShape(ShapeKind.PRIMITIVE, typeName, null, null, true);
    }

    public static DomainFieldShape nullable(String typeName, DomainFieldShape inner) {
        return new DomainFieldShape(ShapeKind.NULLABLE_WRAPPER, typeName, inner, null, true);
    }

    public static DomainFieldShape sequence(String typeName, DomainFieldShape inner) {
        return new DomainFieldShape(ShapeKind.SEQUENCE_WRAPPER, typeName, inner, null, true);
    }

    public static DomainFieldShape transparent(String typeName, @Nullable DomainFieldShape inner, String accessor) {
        return new DomainFieldShape(ShapeKind.TRANSPARENT_WRAPPER, typeName, inner, accessor, true);
    }

    public static DomainFieldShape taggedEnum(String typeName) {
        return new DomainFieldShape(ShapeKind.TAGGED_ENUM, typeName, null, null, true);
    }

    public static DomainFieldShape customAggregate(String typeName, boolean plainName) {
        return new DomainFieldShape(ShapeKind.CUSTOM_AGGREGATE, typeName, null, null, plainName);
    }

    public ShapeKind getKind() {
        return kind;
    }

    public String getTypeName() {
        return typeName;
    }

    public @Nullable DomainFieldShape getInner() {
        return inner;
    }

    public DomainFieldShape requireInner() {
        if (inner == null) {
            throw new IllegalStateException(typeName + " has no inner type");
        }
        return inner;
    }

    public @Nullable String getAccessor() {
        return accessor;
    }

    public boolean isPlainName() {
        return plainName;
    }

    public boolean is(ShapeKind candidate) {
        return kind == candidate;
    }

    public boolean isNullable() {
        return kind == ShapeKind.NULLABLE_WRAPPER;
    }

    public boolean isSequence() {
        return kind == ShapeKind.SEQUENCE_WRAPPER;
    }

    public boolean isNullableSequence() {
        return kind == ShapeKind.NULLABLE_WRAPPER && inner != null && inner.isSequence();
    }

    /** The shape the wire side carries: the type argument of a nullable wrapper, else this shape. */
    public DomainFieldShape valueShape() {
        return isNullable() && inner != null ? inner : this;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof DomainFieldShape)) return false;
        DomainFieldShape that = (DomainFieldShape) o;
        return kind == that.kind
                && plainName == that.plainName
                && typeName.equals(that.typeName)
                && Objects.equals(inner, that.inner)
                && Objects.equals(accessor, that.accessor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, typeName, inner, accessor, plainName);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NULLABLE_WRAPPER:
                return "NullableWrapper(" + inner + ")";
            case SEQUENCE_WRAPPER:
                return "SequenceWrapper(" + inner + ")";
            case TRANSPARENT_WRAPPER:
                return "TransparentWrapper(" + typeName + (inner != null ? " -> " + inner : "") + ")";
            case TAGGED_ENUM:
                return "TaggedEnum(" + typeName + ")";
            case CUSTOM_AGGREGATE:
                return "CustomAggregate(" + typeName + ")";
            default:
                return "Primitive(" + typeName + ")";
        }
    }
}
