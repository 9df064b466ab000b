package io.github.joke.wireform.processor;

import static java.util.stream.Collectors.toList;
import static org.assertj.core.api.Assertions.assertThat;

import io.github.joke.wireform.ProtoConvert;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WireformProcessorTest {

    private static final String WIRE_PERSON = "package demo.wire;\n"
            + "public final class Person {\n"
            + "    private final String name;\n"
            + "    private final String nickname;\n"
            + "    private final Address address;\n"
            + "    private Person(Builder builder) {\n"
            + "        this.name = builder.name;\n"
            + "        this.nickname = builder.nickname;\n"
            + "        this.address = builder.address;\n"
            + "    }\n"
            + "    public String getName() { return name; }\n"
            + "    public boolean hasNickname() { return nickname != null; }\n"
            + "    public String getNickname() { return nickname == null ? \"\" : nickname; }\n"
            + "    public boolean hasAddress() { return address != null; }\n"
            + "    public Address getAddress() { return address; }\n"
            + "    public static Builder newBuilder() { return new Builder(); }\n"
            + "    public static final class Builder {\n"
            + "        private String name = \"\";\n"
            + "        private String nickname;\n"
            + "        private Address address;\n"
            + "        public Builder setName(String value) { name = value; return this; }\n"
            + "        public Builder setNickname(String value) { nickname = value; return this; }\n"
            + "        public Builder setAddress(Address value) { address = value; return this; }\n"
            + "        public Person build() { return new Person(this); }\n"
            + "    }\n"
            + "}\n";

    private static final String WIRE_ADDRESS = "package demo.wire;\n"
            + "public final class Address {\n"
            + "    private final String city;\n"
            + "    private final String street;\n"
            + "    private Address(Builder builder) {\n"
            + "        this.city = builder.city;\n"
            + "        this.street = builder.street;\n"
            + "    }\n"
            + "    public String getCity() { return city; }\n"
            + "    public String getStreet() { return street; }\n"
            + "    public static Builder newBuilder() { return new Builder(); }\n"
            + "    public static final class Builder {\n"
            + "        private String city = \"\";\n"
            + "        private String street = \"\";\n"
            + "        public Builder setCity(String value) { city = value; return this; }\n"
            + "        public Builder setStreet(String value) { street = value; return this; }\n"
            + "        public Address build() { return new Address(this); }\n"
            + "    }\n"
            + "}\n";

    private static final String WIRE_GENRE = "package demo.wire;\n"
            + "public enum Genre {\n"
            + "    GENRE_ROCK(1), GENRE_JAZZ(2);\n"
            + "    private final int number;\n"
            + "    Genre(int number) { this.number = number; }\n"
            + "    public int getNumber() { return number; }\n"
            + "    public static Genre forNumber(int number) {\n"
            + "        for (Genre genre : values()) {\n"
            + "            if (genre.number == number) return genre;\n"
            + "        }\n"
            + "        return null;\n"
            + "    }\n"
            + "}\n";

    private static final String PERSON = "package demo;\n"
            + "import io.github.joke.wireform.ProtoConvert;\n"
            + "import java.util.Optional;\n"
            + "@ProtoConvert(namespace = \"demo.wire\")\n"
            + "public final class Person {\n"
            + "    private final String name;\n"
            + "    private final Optional<String> nickname;\n"
            + "    private final Address address;\n"
            + "    public Person(String name, Optional<String> nickname, Address address) {\n"
            + "        this.name = name;\n"
            + "        this.nickname = nickname;\n"
            + "        this.address = address;\n"
            + "    }\n"
            + "    public String getName() { return name; }\n"
            + "    public Optional<String> getNickname() { return nickname; }\n"
            + "    public Address getAddress() { return address; }\n"
            + "}\n";

    private static final String ADDRESS = "package demo;\n"
            + "import io.github.joke.wireform.ProtoConvert;\n"
            + "@ProtoConvert(namespace = \"demo.wire\")\n"
            + "public record Address(String city, String street) {}\n";

    private static final String GENRE = "package demo;\n"
            + "import io.github.joke.wireform.ProtoConvert;\n"
            + "@ProtoConvert(namespace = \"demo.wire\")\n"
            + "public enum Genre { ROCK, JAZZ }\n";

    @TempDir
    Path dir;

    @Test
    void generatesCompilingConverters() throws IOException {
        Compilation compilation = compile(List.of(), all());

        assertThat(compilation.errors()).isEmpty();
        assertThat(compilation.success).isTrue();
        assertThat(compilation.generated("demo/PersonWireConverter.java"))
                .contains(
                        "public final class PersonWireConverter",
                        "wire.hasNickname()",
                        "if (!wire.hasAddress())",
                        "AddressWireConverter.fromWire(wire.getAddress())");
        assertThat(compilation.generated("demo/AddressWireConverter.java"))
                .contains("builder.setCity(domain.city())", "return new Address(city, street);");
        assertThat(compilation.generated("demo/GenreWireConverter.java")).contains("case GENRE_JAZZ:");
        assertThat(Files.exists(dir.resolve("classes/demo/PersonWireConverter.class"))).isTrue();
    }

    @Test
    void debugPrintsStrategyPerField() {
        Compilation compilation = compile(List.of("-Awireform.debug=true"), all());

        assertThat(compilation.messages(Diagnostic.Kind.NOTE))
                .anySatisfy(note -> assertThat(note).startsWith("[Wireform] Person.nickname: Option.Map"))
                .anySatisfy(note -> assertThat(note).startsWith("[Wireform] Address.city: Direct.Assignment"));
    }

    @Test
    void guessedShapesAreWarnedAbout() {
        Compilation compilation = compile(List.of("-Awireform.inspectWireTypes=false"), all());

        assertThat(compilation.success).isTrue();
        assertThat(compilation.messages(Diagnostic.Kind.WARNING))
                .anySatisfy(warning -> assertThat(warning).startsWith("[Wireform] INFERRED_NOT_VERIFIED Person.address"));
    }

    @Test
    void conflictingAnnotationIsReportedOnTheField() {
        String broken = "package demo;\n"
                + "import io.github.joke.wireform.ProtoConvert;\n"
                + "import io.github.joke.wireform.ProtoField;\n"
                + "@ProtoConvert(namespace = \"demo.wire\")\n"
                + "public class Broken {\n"
                + "    @ProtoField(optional = true, required = true)\n"
                + "    String name;\n"
                + "}\n";
        List<JavaFileObject> sources = all();
        sources.add(source("demo.Broken", broken));

        Compilation compilation = compile(List.of(), sources);

        assertThat(compilation.success).isFalse();
        assertThat(compilation.errors())
                .singleElement()
                .satisfies(error -> assertThat(error).startsWith("[Wireform] CONFLICTING_ANNOTATION Broken.name"));
        assertThat(compilation.generated("demo/PersonWireConverter.java")).contains("class PersonWireConverter");
    }

    @Test
    void interfacesAreRejected() {
        String shape = "package demo;\n"
                + "@io.github.joke.wireform.ProtoConvert\n"
                + "public interface Shape {}\n";

        Compilation compilation = compile(List.of(), List.of(source("demo.Shape", shape)));

        assertThat(compilation.errors())
                .containsExactly("[Wireform] @ProtoConvert applies to classes, records and enums, not INTERFACE");
    }

    @Test
    void unmatchedEnumConstantFails() {
        String mood = "package demo;\n"
                + "@io.github.joke.wireform.ProtoConvert(namespace = \"demo.wire\", wireName = \"Genre\")\n"
                + "public enum Mood { ROCK, POLKA }\n";

        Compilation compilation =
                compile(List.of(), List.of(source("demo.wire.Genre", WIRE_GENRE), source("demo.Mood", mood)));

        assertThat(compilation.errors())
                .singleElement()
                .satisfies(error -> assertThat(error)
                        .startsWith("[Wireform] UNMATCHED_VARIANT Mood.POLKA")
                        .contains("add GENRE_POLKA to the wire enum"));
    }

    private List<JavaFileObject> all() {
        List<JavaFileObject> sources = new ArrayList<>();
        sources.add(source("demo.wire.Person", WIRE_PERSON));
        sources.add(source("demo.wire.Address", WIRE_ADDRESS));
        sources.add(source("demo.wire.Genre", WIRE_GENRE));
        sources.add(source("demo.Person", PERSON));
        sources.add(source("demo.Address", ADDRESS));
        sources.add(source("demo.Genre", GENRE));
        return sources;
    }

    private Compilation compile(List<String> extraOptions, List<JavaFileObject> sources) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        Path classes = dir.resolve("classes");
        Path generated = dir.resolve("generated");
        try (StandardJavaFileManager files = compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            Files.createDirectories(classes);
            Files.createDirectories(generated);
            List<String> options = new ArrayList<>(List.of(
                    "-classpath", annotationsLocation().toString(),
                    "-d", classes.toString(),
                    "-s", generated.toString()));
            options.addAll(extraOptions);
            JavaCompiler.CompilationTask task = compiler.getTask(null, files, diagnostics, options, null, sources);
            task.setProcessors(List.of(new WireformProcessor()));
            boolean success = task.call();
            return new Compilation(success, diagnostics.getDiagnostics(), generated);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Path annotationsLocation() {
        try {
            return Path.of(ProtoConvert.class.getProtectionDomain().getCodeSource().getLocation().toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    private static JavaFileObject source(String qualifiedName, String code) {
        URI uri = URI.create("string:///" + qualifiedName.replace('.', '/') + JavaFileObject.Kind.SOURCE.extension);
        return new SimpleJavaFileObject(uri, JavaFileObject.Kind.SOURCE) {
            @Override
            public CharSequence getCharContent(boolean ignoreEncodingErrors) {
                return code;
            }
        };
    }

    private static final class Compilation {

        private final boolean success;
        private final List<Diagnostic<? extends JavaFileObject>> diagnostics;
        private final Path generated;

        Compilation(boolean success, List<Diagnostic<? extends JavaFileObject>> diagnostics, Path generated) {
            this.success = success;
            this.diagnostics = diagnostics;
            this.generated = generated;
        }

        List<String> messages(Diagnostic.Kind kind) {
            return diagnostics.stream()
                    .filter(diagnostic -> diagnostic.getKind() == kind)
                    .map(diagnostic -> diagnostic.getMessage(Locale.ROOT))
                    .collect(toList());
        }

        List<String> errors() {
            return messages(Diagnostic.Kind.ERROR);
        }

        String generated(String path) {
            try {
                return Files.readString(generated.resolve(path));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
