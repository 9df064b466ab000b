package io.github.joke.wireform.model;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The single conversion method chosen for a field. Instances are immutable and compare by value.
 */
public abstract class ConversionStrategy {

    private ConversionStrategy() {}

    public static Ignore ignore() {
        return Ignore.INSTANCE;
    }

    public static Custom custom(@Nullable String fromWireFn, @Nullable String toWireFn) {
        return new Custom(fromWireFn, toWireFn);
    }

    public static Direct directAssignment() {
        return Direct.ASSIGNMENT;
    }

    public static Direct directWithConversion() {
        return Direct.WITH_CONVERSION;
    }

    public static Option optionWrap() {
        return Option.WRAP;
    }

    public static Option optionUnwrap(ErrorMode errorMode) {
        return new Option(Option.Variant.UNWRAP, errorMode);
    }

    public static Option optionMap() {
        return Option.MAP;
    }

    public static Transparent transparent(ErrorMode errorMode) {
        return new Transparent(errorMode);
    }

    public static Collection collect(ErrorMode errorMode) {
        return new Collection(Collection.Variant.COLLECT, errorMode);
    }

    public static Collection mapOption() {
        return Collection.MAP_OPTION;
    }

    public static Collection collectionDirectAssignment() {
        return Collection.DIRECT_ASSIGNMENT;
    }

    public abstract String category();

    public abstract String describe();

    public ErrorMode errorMode() {
        return ErrorMode.none();
    }

    public static final class Ignore extends ConversionStrategy {

        private static final Ignore INSTANCE = new Ignore();

        private Ignore() {}

        @Override
        public String category() {
            return "ignore";
        }

        @Override
        public String describe() {
            return "field ignored, not on the wire";
        }

        @Override
        public String toString() {
            return "Ignore";
        }
    }

    public static final class Custom extends ConversionStrategy {

        private final @Nullable String fromWireFn;
        private final @Nullable String toWireFn;

        private Custom(@Nullable String fromWireFn, @Nullable String toWireFn) {
            this.fromWireFn = fromWireFn;
            this.toWireFn = toWireFn;
        }

        public @Nullable String getFromWireFn() {
            return fromWireFn;
        }

        public @Nullable String getToWireFn() {
            return toWireFn;
        }

        @Override
        public String category() {
            return "custom";
        }

        @Override
        public String describe() {
            if (fromWireFn != null && toWireFn != null) {
                return "bidirectional custom functions";
            }
            return fromWireFn != null ? "custom wire->domain function" : "custom domain->wire function";
        }

        @Override
        public boolean equals(@Nullable Object o) {
            if (this == o) return true;
            if (!(o instanceof Custom)) return false;
            Custom that = (Custom) o;
            return Objects.equals(fromWireFn, that.fromWireFn) && Objects.equals(toWireFn, that.toWireFn);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fromWireFn, toWireFn);
        }

        @Override
        public String toString() {
            return "Custom{from=" + fromWireFn + ", to=" + toWireFn + "}";
        }
    }

    public static final class Direct extends ConversionStrategy {

        public enum Variant {
            ASSIGNMENT,
            WITH_CONVERSION
        }

        private static final Direct ASSIGNMENT = new Direct(Variant.ASSIGNMENT);
        private static final Direct WITH_CONVERSION = new Direct(Variant.WITH_CONVERSION);

        private final Variant variant;

        private Direct(Variant variant) {
            this.variant = variant;
        }

        public Variant getVariant() {
            return variant;
        }

        @Override
        public String category() {
            return "direct";
        }

        @Override
        public String describe() {
            return variant == Variant.ASSIGNMENT ? "direct assignment" : "direct conversion";
        }

        @Override
        public String toString() {
            return variant == Variant.ASSIGNMENT ? "Direct.Assignment" : "Direct.WithConversion";
        }
    }

    public static final class Option extends ConversionStrategy {

        public enum Variant {
            WRAP,
            UNWRAP,
            MAP
        }

        private static final Option WRAP = new Option(Variant.WRAP, ErrorMode.none());
        private static final Option MAP = new Option(Variant.MAP, ErrorMode.none());

        private final Variant variant;
        private final ErrorMode errorMode;

        private Option(Variant variant, ErrorMode errorMode) {
            this.variant = variant;
            this.errorMode = errorMode;
        }

        public Variant getVariant() {
            return variant;
        }

        @Override
        public ErrorMode errorMode() {
            return errorMode;
        }

        @Override
        public String category() {
            return "option";
        }

        @Override
        public String describe() {
            switch (variant) {
                case WRAP:
                    return "wrap required wire value in Optional";
                case UNWRAP:
                    return "unwrap optional wire value (" + errorMode + ")";
                default:
                    return "map optional through conversion";
            }
        }

        @Override
        public boolean equals(@Nullable Object o) {
            if (this == o) return true;
            if (!(o instanceof Option)) return false;
            Option that = (Option) o;
            return variant == that.variant && errorMode.equals(that.errorMode);
        }

        @Override
        public int hashCode() {
            return Objects.hash(variant, errorMode);
        }

        @Override
        public String toString() {
            switch (variant) {
                case WRAP:
                    return "Option.Wrap";
                case UNWRAP:
                    return "Option.Unwrap(" + errorMode + ")";
                default:
                    return "Option.Map";
            }
        }
    }

    public static final class Transparent extends ConversionStrategy {

        private final ErrorMode errorMode;

        private Transparent(ErrorMode errorMode) {
            this.errorMode = errorMode;
        }

        @Override
        public ErrorMode errorMode() {
            return errorMode;
        }

        @Override
        public String category() {
            return "transparent";
        }

        @Override
        public String describe() {
            return "transparent wrapper conversion (" + errorMode + ")";
        }

        @Override
        public boolean equals(@Nullable Object o) {
            if (this == o) return true;
            if (!(o instanceof Transparent)) return false;
            return errorMode.equals(((Transparent) o).errorMode);
        }

        @Override
        public int hashCode() {
            return errorMode.hashCode();
        }

        @Override
        public String toString() {
            return "Transparent(" + errorMode + ")";
        }
    }

    public static final class Collection extends ConversionStrategy {

        public enum Variant {
            COLLECT,
            MAP_OPTION,
            DIRECT_ASSIGNMENT
        }

        private static final Collection MAP_OPTION = new Collection(Variant.MAP_OPTION, ErrorMode.none());
        private static final Collection DIRECT_ASSIGNMENT = new Collection(Variant.DIRECT_ASSIGNMENT, ErrorMode.none());

        private final Variant variant;
        private final ErrorMode errorMode;

        private Collection(Variant variant, ErrorMode errorMode) {
            this.variant = variant;
            this.errorMode = errorMode;
        }

        public Variant getVariant() {
            return variant;
        }

        @Override
        public ErrorMode errorMode() {
            return errorMode;
        }

        @Override
        public String category() {
            return "collection";
        }

        @Override
        public String describe() {
            switch (variant) {
                case COLLECT:
                    return "collect list with element conversion (" + errorMode + ")";
                case MAP_OPTION:
                    return "map optional list";
                default:
                    return "direct list assignment";
            }
        }

        @Override
        public boolean equals(@Nullable Object o) {
            if (this == o) return true;
            if (!(o instanceof Collection)) return false;
            Collection that = (Collection) o;
            return variant == that.variant && errorMode.equals(that.errorMode);
        }

        @Override
        public int hashCode() {
            return Objects.hash(variant, errorMode);
        }

        @Override
        public String toString() {
            switch (variant) {
                case COLLECT:
                    return "Collection.Collect(" + errorMode + ")";
                case MAP_OPTION:
                    return "Collection.MapOption";
                default:
                    return "Collection.DirectAssignment";
            }
        }
    }
}
