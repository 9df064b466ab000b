package io.github.joke.wireform.model;

public final class InferredWireShape {

    private final WireFieldShape shape;
    private final InferenceTier tier;
    private final boolean verified;

    public InferredWireShape(WireFieldShape shape, InferenceTier tier, boolean verified) {
        this.shape = shape;
        this.tier = tier;
        this.verified = verified;
    }

    public WireFieldShape getShape() {
        return shape;
    }

    public InferenceTier getTier() {
        return tier;
    }

    public boolean isVerified() {
        return verified;
    }

    @Override
    public String toString() {
        return shape + " (" + tier + (verified ? "" : ", inferred, not verified") + ")";
    }
}
