package io.github.joke.wireform.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.palantir.javapoet.ClassName;
import com.palantir.javapoet.CodeBlock;
import com.palantir.javapoet.TypeName;
import com.palantir.javapoet.TypeSpec;
import io.github.joke.wireform.config.GeneratorOptions;
import io.github.joke.wireform.error.DiagnosticKind;
import io.github.joke.wireform.error.GenerationException;
import io.github.joke.wireform.model.ConversionStrategy;
import io.github.joke.wireform.model.Direction;
import io.github.joke.wireform.model.DomainFieldShape;
import io.github.joke.wireform.model.ErrorMode;
import io.github.joke.wireform.model.FieldAnnotation;
import io.github.joke.wireform.model.FieldDescriptor;
import io.github.joke.wireform.model.FieldPlan;
import io.github.joke.wireform.model.InferenceTier;
import io.github.joke.wireform.model.InferredWireShape;
import io.github.joke.wireform.model.Optionality;
import io.github.joke.wireform.model.WireFieldShape;
import io.github.joke.wireform.model.WireMapping;
import io.github.joke.wireform.spi.impl.SimpleTypeCatalog;
import java.util.List;
import org.junit.jupiter.api.Test;

class CodeSynthesizerTest {

    private static final ClassName TRACK = ClassName.get("com.acme", "Track");
    private static final ClassName ERROR = ClassName.get("com.acme", "TrackConversionException");
    private static final SynthesisContext CONTEXT =
            new SynthesisContext(TRACK, ClassName.get("com.acme.wire", "Track"), "com.acme.wire", ERROR);

    private final CodeSynthesizer synthesizer = new CodeSynthesizer();

    @Test
    void primitivesPassThrough() {
        assertThat(convert(DomainFieldShape.primitive("long"), Direction.FROM_WIRE)).isEqualTo("x");
    }

    @Test
    void byteArraysGoThroughByteString() {
        DomainFieldShape bytes = DomainFieldShape.primitive("byte[]");

        assertThat(convert(bytes, Direction.FROM_WIRE)).isEqualTo("x.toByteArray()");
        assertThat(convert(bytes, Direction.TO_WIRE)).isEqualTo("com.google.protobuf.ByteString.copyFrom(x)");
    }

    @Test
    void narrowIntegralsAreCastFromTheWireInt() {
        DomainFieldShape rank = DomainFieldShape.primitive("short");
        DomainFieldShape initial = DomainFieldShape.primitive("Character");

        assertThat(convert(rank, Direction.FROM_WIRE)).isEqualTo("(short) (int) x");
        assertThat(convert(rank, Direction.TO_WIRE)).isEqualTo("(int) x");
        assertThat(convert(initial, Direction.FROM_WIRE)).isEqualTo("(char) (int) x");
        assertThat(convert(DomainFieldShape.primitive("byte"), Direction.FROM_WIRE)).isEqualTo("(byte) (int) x");
        assertThat(ValueConversions.isIdentity(rank, "com.acme.wire")).isFalse();
        assertThat(ValueConversions.isIdentity(DomainFieldShape.primitive("int"), "com.acme.wire")).isTrue();
    }

    @Test
    void enumsAndAggregatesUseTheirConverters() {
        assertThat(convert(DomainFieldShape.taggedEnum("com.acme.Genre"), Direction.TO_WIRE))
                .isEqualTo("com.acme.GenreWireConverter.toWire(x)");
        assertThat(convert(DomainFieldShape.customAggregate("Artist", true), Direction.FROM_WIRE))
                .isEqualTo("com.acme.ArtistWireConverter.fromWire(x)");
    }

    @Test
    void wireTypesNeedNoConversion() {
        assertThat(convert(DomainFieldShape.customAggregate("com.acme.wire.Artist", true), Direction.FROM_WIRE))
                .isEqualTo("x");
        assertThat(convert(DomainFieldShape.customAggregate("com.google.protobuf.Timestamp", true), Direction.TO_WIRE))
                .isEqualTo("x");
    }

    @Test
    void transparentWrappersConstructAndUnwrap() {
        DomainFieldShape isrc =
                DomainFieldShape.transparent("com.acme.Isrc", DomainFieldShape.primitive("java.lang.String"), "code");

        assertThat(convert(isrc, Direction.FROM_WIRE)).isEqualTo("new com.acme.Isrc(x)");
        assertThat(convert(isrc, Direction.TO_WIRE)).isEqualTo("x.code()");
    }

    @Test
    void nestedGenericsAreRejected() {
        DomainFieldShape nested = DomainFieldShape.sequence(
                "java.util.List<java.util.List<java.lang.String>>",
                DomainFieldShape.sequence(
                        "java.util.List<java.lang.String>", DomainFieldShape.primitive("java.lang.String")));

        assertThatThrownBy(() -> convert(nested, Direction.FROM_WIRE))
                .isInstanceOf(GenerationException.class)
                .satisfies(e -> assertThat(((GenerationException) e).getKind())
                        .isEqualTo(DiagnosticKind.STRATEGY_PRECONDITION_VIOLATION));
        assertThatThrownBy(() -> convert(DomainFieldShape.customAggregate("com.acme.Pair<A,B>", false), Direction.TO_WIRE))
                .isInstanceOf(GenerationException.class);
    }

    @Test
    void zeroValues() {
        assertThat(zero(DomainFieldShape.primitive("int"), TypeName.INT)).isEqualTo("0");
        assertThat(zero(DomainFieldShape.primitive("java.lang.Long"), TypeName.LONG.box())).isEqualTo("0L");
        assertThat(zero(DomainFieldShape.primitive("boolean"), TypeName.BOOLEAN)).isEqualTo("false");
        assertThat(zero(DomainFieldShape.primitive("double"), TypeName.DOUBLE)).isEqualTo("0D");
        assertThat(zero(DomainFieldShape.primitive("java.lang.String"), ClassName.get(String.class)))
                .isEqualTo("\"\"");
        assertThat(zero(DomainFieldShape.primitive("byte[]"), TypeName.get(byte[].class)))
                .isEqualTo("new byte[0]");
        assertThat(zero(DomainFieldShape.taggedEnum("com.acme.Genre"), ClassName.get("com.acme", "Genre")))
                .isEqualTo("com.acme.Genre.values()[0]");
        assertThat(zero(DomainFieldShape.customAggregate("com.acme.Artist", true), ClassName.get("com.acme", "Artist")))
                .isEqualTo("new com.acme.Artist()");
    }

    @Test
    void emptyContainersAsZeroValues() {
        DomainFieldShape string = DomainFieldShape.primitive("java.lang.String");

        assertThat(zero(DomainFieldShape.nullable("java.util.Optional<java.lang.String>", string), ClassName.OBJECT))
                .isEqualTo("java.util.Optional.empty()");
        assertThat(zero(DomainFieldShape.sequence("java.util.List<java.lang.String>", string), ClassName.OBJECT))
                .isEqualTo("java.util.List.of()");
    }

    @Test
    void panicNamesTheWireField() {
        FieldPlan plan = plan(
                "artistName",
                "java.lang.String",
                "artist_name",
                ConversionStrategy.optionUnwrap(ErrorMode.panic()),
                Optionality.OPTIONAL);

        assertThat(synthesizer.fromWire(plan, CONTEXT).toString())
                .contains("if (!wire.hasArtistName())", "Missing required wire field Track.artist_name");
    }

    @Test
    void errorModeThrowsGeneratedError() {
        FieldPlan plan = plan(
                "isrc", "java.lang.String", "isrc", ConversionStrategy.optionUnwrap(ErrorMode.error()), Optionality.OPTIONAL);

        assertThat(synthesizer.fromWire(plan, CONTEXT).toString())
                .contains("throw com.acme.TrackConversionException.missingField(\"isrc\")");
        assertThat(CodeSynthesizer.errorTypeOf(plan, CONTEXT)).isEqualTo(ERROR);
    }

    @Test
    void declaredErrorTypeIsConstructedWithFieldName() {
        FieldPlan plan = plan(
                "isrc",
                "java.lang.String",
                "isrc",
                ConversionStrategy.optionUnwrap(ErrorMode.error()),
                Optionality.OPTIONAL,
                FieldAnnotation.builder().errorType("com.acme.BadTrack").build());

        assertThat(synthesizer.fromWire(plan, CONTEXT).toString()).contains("throw new com.acme.BadTrack(\"isrc\")");
    }

    @Test
    void optionalDomainWritesOnlyWhenPresent() {
        FieldPlan plan = plan(
                "subtitle",
                "java.util.Optional<java.lang.String>",
                "subtitle",
                ConversionStrategy.optionMap(),
                Optionality.OPTIONAL);

        assertThat(synthesizer.synthesize(plan, Direction.TO_WIRE, CONTEXT).toString())
                .contains("domain.getSubtitle().ifPresent(value -> builder.setSubtitle(value))");
    }

    @Test
    void listsOfAggregatesMapEachElement() {
        FieldPlan plan = plan(
                "artists",
                "java.util.List<com.acme.Artist>",
                "artists",
                ConversionStrategy.collect(ErrorMode.none()),
                Optionality.OPTIONAL);

        assertThat(synthesizer.fromWire(plan, CONTEXT).toString())
                .contains("wire.getArtistsList().stream().map(element -> com.acme.ArtistWireConverter.fromWire(element))");
        assertThat(synthesizer.toWire(plan, CONTEXT).toString())
                .contains("builder.addAllArtists(domain.getArtists().stream()");
    }

    @Test
    void reservedNamesGetSuffix() {
        FieldPlan builder =
                plan("builder", "int", "builder", ConversionStrategy.directAssignment(), Optionality.REQUIRED);
        FieldPlan title =
                plan("title", "java.lang.String", "title", ConversionStrategy.directAssignment(), Optionality.REQUIRED);

        assertThat(CodeSynthesizer.localName(builder)).isEqualTo("builder_");
        assertThat(CodeSynthesizer.localName(title)).isEqualTo("title");
    }

    @Test
    void converterNameJoinsNestedNames() {
        assertThat(CodeSynthesizer.converterName(ClassName.get("com.acme", "Album", "Track")))
                .isEqualTo(ClassName.get("com.acme", "AlbumTrackWireConverter"));
    }

    @Test
    void generatedErrorTypeHasFactory() {
        TypeSpec type = synthesizer.errorType(ERROR);

        assertThat(type.name()).isEqualTo("TrackConversionException");
        assertThat(type.toString())
                .contains("extends io.github.joke.wireform.WireConversionException", "missingField(", "fieldName)");
    }

    private String convert(DomainFieldShape shape, Direction direction) {
        return synthesizer.convert(shape, CodeBlock.of("x"), direction, CONTEXT).toString();
    }

    private String zero(DomainFieldShape shape, TypeName type) {
        return synthesizer.zeroValue(shape, type, CONTEXT).toString();
    }

    private static FieldPlan plan(
            String name, String type, String wireName, ConversionStrategy strategy, Optionality optionality) {
        return plan(name, type, wireName, strategy, optionality, FieldAnnotation.empty());
    }

    private static FieldPlan plan(
            String name,
            String type,
            String wireName,
            ConversionStrategy strategy,
            Optionality optionality,
            FieldAnnotation annotation) {
        DomainFieldShape shape =
                new ShapeClassifier(GeneratorOptions.defaults(), SimpleTypeCatalog.empty()).classify(type);
        InferredWireShape wire = new InferredWireShape(
                WireFieldShape.of(WireShapeInference.structuralMapping(shape), optionality),
                InferenceTier.EXPLICIT_OVERRIDE,
                true);
        return new FieldPlan(new FieldDescriptor(name, type, List.of(), "Track"), annotation, shape, wire, strategy, wireName);
    }
}
