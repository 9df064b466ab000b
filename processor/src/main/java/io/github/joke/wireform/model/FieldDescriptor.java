package io.github.joke.wireform.model;

import java.util.List;
import org.jspecify.annotations.Nullable;

public final class FieldDescriptor {

    private final String name;
    private final String typeText;
    private final List<DirectiveToken> tokens;
    private final String aggregateName;
    private final @Nullable String accessor;

    public FieldDescriptor(
            String name, String typeText, List<DirectiveToken> tokens, String aggregateName, @Nullable String accessor) {
        this.name = name;
        this.typeText = typeText;
        this.tokens = List.copyOf(tokens);
        this.aggregateName = aggregateName;
        this.accessor = accessor;
    }

    public FieldDescriptor(String name, String typeText, List<DirectiveToken> tokens, String aggregateName) {
        this(name, typeText, tokens, aggregateName, null);
    }

    public String getName() {
        return name;
    }

    public String getTypeText() {
        return typeText;
    }

    public List<DirectiveToken> getTokens() {
        return tokens;
    }

    public String getAggregateName() {
        return aggregateName;
    }

    public String getAccessor() {
        if (accessor != null) {
            return accessor;
        }
        return "get" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    @Override
    public String toString() {
        return aggregateName + "." + name + ": " + typeText;
    }
}
