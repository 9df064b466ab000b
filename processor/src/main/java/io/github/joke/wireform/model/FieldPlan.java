package io.github.joke.wireform.model;

import org.jspecify.annotations.Nullable;

/** Everything decided about one domain field before code is emitted. */
public final class FieldPlan {

    private final FieldDescriptor descriptor;
    private final FieldAnnotation annotation;
    private final DomainFieldShape domainShape;
    private final @Nullable InferredWireShape wireShape;
    private final ConversionStrategy strategy;
    private final String wireFieldName;

    public FieldPlan(
            FieldDescriptor descriptor,
            FieldAnnotation annotation,
            DomainFieldShape domainShape,
            @Nullable InferredWireShape wireShape,
            ConversionStrategy strategy,
            String wireFieldName) {
        this.descriptor = descriptor;
        this.annotation = annotation;
        this.domainShape = domainShape;
        this.wireShape = wireShape;
        this.strategy = strategy;
        this.wireFieldName = wireFieldName;
    }

    public FieldDescriptor getDescriptor() {
        return descriptor;
    }

    public String getName() {
        return descriptor.getName();
    }

    public FieldAnnotation getAnnotation() {
        return annotation;
    }

    public DomainFieldShape getDomainShape() {
        return domainShape;
    }

    public @Nullable InferredWireShape getWireShape() {
        return wireShape;
    }

    public boolean isWireOptional() {
        return wireShape != null && wireShape.getShape().isOptional();
    }

    public ConversionStrategy getStrategy() {
        return strategy;
    }

    public String getWireFieldName() {
        return wireFieldName;
    }

    @Override
    public String toString() {
        return descriptor.getName() + " -> " + strategy + (wireShape != null ? " [" + wireShape + "]" : "");
    }
}
