package io.github.joke.wireform.config;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Generation settings, read once from the {@code -A} processor options and passed to every stage.
 */
public final class GeneratorOptions {

    public static final String DEBUG = "wireform.debug";
    public static final String NAMESPACE = "wireform.namespace";
    public static final String PRIMITIVES = "wireform.primitives";
    public static final String OPTIONALITY_TABLE = "wireform.optionality";
    public static final String INSPECT_WIRE_TYPES = "wireform.inspectWireTypes";

    public static final Set<String> KEYS = Set.of(DEBUG, NAMESPACE, PRIMITIVES, OPTIONALITY_TABLE, INSPECT_WIRE_TYPES);

    private static final GeneratorOptions DEFAULTS = builder().build();

    private final boolean debug;
    private final @Nullable String namespace;
    private final Set<String> extraPrimitives;
    private final @Nullable String optionalityTable;
    private final boolean inspectWireTypes;

    private GeneratorOptions(Builder builder) {
        this.debug = builder.debug;
        this.namespace = builder.namespace;
        this.extraPrimitives = Set.copyOf(builder.extraPrimitives);
        this.optionalityTable = builder.optionalityTable;
        this.inspectWireTypes = builder.inspectWireTypes;
    }

    public static GeneratorOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GeneratorOptions fromProcessorOptions(Map<String, String> options) {
        Builder builder = builder()
                .debug(Boolean.parseBoolean(options.get(DEBUG)))
                .namespace(blankToNull(options.get(NAMESPACE)))
                .optionalityTable(blankToNull(options.get(OPTIONALITY_TABLE)));
        String primitives = options.get(PRIMITIVES);
        if (primitives != null) {
            Arrays.stream(primitives.split(","))
                    .map(String::trim)
                    .filter(name -> !name.isEmpty())
                    .forEach(builder::primitive);
        }
        String inspect = options.get(INSPECT_WIRE_TYPES);
        if (inspect != null) {
            builder.inspectWireTypes(Boolean.parseBoolean(inspect));
        }
        return builder.build();
    }

    public boolean isDebug() {
        return debug;
    }

    public @Nullable String getNamespace() {
        return namespace;
    }

    public Set<String> getExtraPrimitives() {
        return extraPrimitives;
    }

    public @Nullable String getOptionalityTable() {
        return optionalityTable;
    }

    public boolean isInspectWireTypes() {
        return inspectWireTypes;
    }

    @Override
    public String toString() {
        return "GeneratorOptions{debug=" + debug + ", namespace=" + namespace + ", extraPrimitives=" + extraPrimitives
                + ", optionalityTable=" + optionalityTable + ", inspectWireTypes=" + inspectWireTypes + "}";
    }

    private static @Nullable String blankToNull(@Nullable String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    public static final class Builder {

        private boolean debug;
        private @Nullable String namespace;
        private final Set<String> extraPrimitives = new LinkedHashSet<>();
        private @Nullable String optionalityTable;
        private boolean inspectWireTypes = true;

        private Builder() {}

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder namespace(@Nullable String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder primitive(String typeName) {
            extraPrimitives.add(typeName);
            return this;
        }

        public Builder primitives(String... typeNames) {
            extraPrimitives.addAll(Arrays.asList(typeNames));
            return this;
        }

        public Builder optionalityTable(@Nullable String optionalityTable) {
            this.optionalityTable = optionalityTable;
            return this;
        }

        public Builder inspectWireTypes(boolean inspectWireTypes) {
            this.inspectWireTypes = inspectWireTypes;
            return this;
        }

        public GeneratorOptions build() {
            return new GeneratorOptions(this);
        }
    }
}
