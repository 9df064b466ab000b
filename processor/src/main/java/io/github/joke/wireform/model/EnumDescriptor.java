package io.github.joke.wireform.model;

import java.util.List;

public final class EnumDescriptor {

    private final String packageName;
    private final String simpleName;
    private final List<DirectiveToken> tokens;
    private final List<String> variants;
    private final List<String> wireVariants;

    public EnumDescriptor(
            String packageName,
            String simpleName,
            List<DirectiveToken> tokens,
            List<String> variants,
            List<String> wireVariants) {
        this.packageName = packageName;
        this.simpleName = simpleName;
        this.tokens = List.copyOf(tokens);
        this.variants = List.copyOf(variants);
        this.wireVariants = List.copyOf(wireVariants);
    }

    public String getPackageName() {
        return packageName;
    }

    public String getSimpleName() {
        return simpleName;
    }

    public String getQualifiedName() {
        return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }

    public List<DirectiveToken> getTokens() {
        return tokens;
    }

    public List<String> getVariants() {
        return variants;
    }

    public List<String> getWireVariants() {
        return wireVariants;
    }
}
