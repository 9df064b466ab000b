package io.github.joke.wireform.stage;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.joke.wireform.config.GeneratorOptions;
import io.github.joke.wireform.model.DomainFieldShape;
import io.github.joke.wireform.model.ShapeKind;
import io.github.joke.wireform.spi.impl.SimpleTypeCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ShapeClassifierTest {

    private final ShapeClassifier classifier = new ShapeClassifier(
            GeneratorOptions.builder().primitive("java.math.BigDecimal").build(),
            SimpleTypeCatalog.builder()
                    .enumType("com.acme.Genre")
                    .wrapper("com.acme.TrackId", "long", "getValue")
                    .transparent("com.acme.Isrc", "java.lang.String", "code")
                    .build());

    @ParameterizedTest
    @ValueSource(strings = {"int", "long", "boolean", "java.lang.String", "String", "byte[]", "java.lang.Double"})
    void builtInPrimitives(String typeText) {
        assertThat(classifier.classify(typeText).getKind()).isEqualTo(ShapeKind.PRIMITIVE);
    }

    @Test
    void configuredPrimitives() {
        assertThat(classifier.classify("java.math.BigDecimal").getKind()).isEqualTo(ShapeKind.PRIMITIVE);
    }

    @Test
    void optionalIsNullableWrapper() {
        DomainFieldShape shape = classifier.classify("java.util.Optional<java.lang.String>");

        assertThat(shape.getKind()).isEqualTo(ShapeKind.NULLABLE_WRAPPER);
        assertThat(shape.requireInner()).isEqualTo(DomainFieldShape.primitive("java.lang.String"));
    }

    @Test
    void listIsSequenceWrapper() {
        DomainFieldShape shape = classifier.classify("java.util.List<com.acme.Genre>");

        assertThat(shape.isSequence()).isTrue();
        assertThat(shape.requireInner().getKind()).isEqualTo(ShapeKind.TAGGED_ENUM);
    }

    @Test
    void optionalListIsNullableSequence() {
        assertThat(classifier.classify("java.util.Optional<java.util.List<java.lang.String>>").isNullableSequence())
                .isTrue();
    }

    @Test
    void catalogEnumsAreTaggedEnums() {
        assertThat(classifier.classify("com.acme.Genre")).isEqualTo(DomainFieldShape.taggedEnum("com.acme.Genre"));
    }

    @Test
    void transparentDirectiveUsesWrapperLayout() {
        DomainFieldShape shape = classifier.classify("com.acme.TrackId", true);

        assertThat(shape.getKind()).isEqualTo(ShapeKind.TRANSPARENT_WRAPPER);
        assertThat(shape.getAccessor()).isEqualTo("getValue");
        assertThat(shape.requireInner()).isEqualTo(DomainFieldShape.primitive("long"));
    }

    @Test
    void transparentDirectiveWithoutLayoutFallsBackToDefaultAccessor() {
        DomainFieldShape shape = classifier.classify("com.acme.Unknown", true);

        assertThat(shape.getKind()).isEqualTo(ShapeKind.TRANSPARENT_WRAPPER);
        assertThat(shape.getInner()).isNull();
        assertThat(shape.getAccessor()).isEqualTo(ShapeClassifier.DEFAULT_WRAPPER_ACCESSOR);
    }

    @Test
    void catalogTransparentTypesNeedNoDirective() {
        DomainFieldShape shape = classifier.classify("com.acme.Isrc");

        assertThat(shape.getKind()).isEqualTo(ShapeKind.TRANSPARENT_WRAPPER);
        assertThat(shape.getAccessor()).isEqualTo("code");
    }

    @Test
    void unknownTypesAreCustomAggregates() {
        DomainFieldShape plain = classifier.classify("com.acme.Artist");
        DomainFieldShape generic = classifier.classify("java.util.Map<java.lang.String,java.lang.Long>");

        assertThat(plain).isEqualTo(DomainFieldShape.customAggregate("com.acme.Artist", true));
        assertThat(generic.getKind()).isEqualTo(ShapeKind.CUSTOM_AGGREGATE);
        assertThat(generic.isPlainName()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "???", "java.util.List<>", "int[][]", "a.b.C<D<E>>"})
    void classificationIsTotal(String typeText) {
        assertThat(classifier.classify(typeText)).isNotNull();
    }

    @Test
    void classificationIsIdempotent() {
        String text = "java.util.Optional<java.util.List<com.acme.Genre>>";

        assertThat(classifier.classify(text)).isEqualTo(classifier.classify(text));
    }
}
