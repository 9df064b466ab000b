package io.github.joke.wireform.model;

import java.util.List;

public final class AggregateDescriptor {

    private final String packageName;
    private final String simpleName;
    private final List<DirectiveToken> tokens;
    private final List<FieldDescriptor> fields;

    public AggregateDescriptor(
            String packageName, String simpleName, List<DirectiveToken> tokens, List<FieldDescriptor> fields) {
        this.packageName = packageName;
        this.simpleName = simpleName;
        this.tokens = List.copyOf(tokens);
        this.fields = List.copyOf(fields);
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

    public List<FieldDescriptor> getFields() {
        return fields;
    }

    @Override
    public String toString() {
        return getQualifiedName() + fields;
    }
}
