package io.github.joke.wireform.di;

import dagger.Module;
import dagger.Provides;
import io.github.joke.wireform.config.GeneratorOptions;
import io.github.joke.wireform.processor.ElementTypeCatalog;
import io.github.joke.wireform.processor.WireTypeOptionalitySource;
import io.github.joke.wireform.spi.FieldOptionalitySource;
import io.github.joke.wireform.spi.TypeCatalog;
import io.github.joke.wireform.spi.impl.CompositeOptionalitySource;
import io.github.joke.wireform.spi.impl.TableOptionalitySource;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import javax.annotation.processing.Filer;
import javax.annotation.processing.Messager;
import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;

@Module(subcomponents = RoundComponent.class)
public final class ProcessorModule {

    private final ProcessingEnvironment processingEnv;

    public ProcessorModule(ProcessingEnvironment processingEnv) {
        this.processingEnv = processingEnv;
    }

    @Provides
    @ProcessorScoped
    ProcessingEnvironment processingEnvironment() {
        return processingEnv;
    }

    @Provides
    @ProcessorScoped
    Elements elements() {
        return processingEnv.getElementUtils();
    }

    @Provides
    @ProcessorScoped
    Types types() {
        return processingEnv.getTypeUtils();
    }

    @Provides
    @ProcessorScoped
    Filer filer() {
        return processingEnv.getFiler();
    }

    @Provides
    @ProcessorScoped
    Messager messager() {
        return processingEnv.getMessager();
    }

    @Provides
    @ProcessorScoped
    GeneratorOptions generatorOptions() {
        return GeneratorOptions.fromProcessorOptions(processingEnv.getOptions());
    }

    @Provides
    @ProcessorScoped
    TypeCatalog typeCatalog(ElementTypeCatalog catalog) {
        return catalog;
    }

    @Provides
    @ProcessorScoped
    FieldOptionalitySource fieldOptionalitySource(GeneratorOptions options, Elements elements, Messager messager) {
        List<FieldOptionalitySource> sources = new ArrayList<>();
        String table = options.getOptionalityTable();
        if (table != null) {
            try {
                sources.add(TableOptionalitySource.load(Path.of(table)));
            } catch (IOException | IllegalArgumentException e) {
                messager.printMessage(
                        Diagnostic.Kind.ERROR,
                        "[Wireform] Cannot read optionality table " + table + ": " + e.getMessage());
            }
        }
        ServiceLoader.load(FieldOptionalitySource.class, ProcessorModule.class.getClassLoader())
                .forEach(sources::add);
        if (options.isInspectWireTypes()) {
            sources.add(new WireTypeOptionalitySource(elements));
        }
        return new CompositeOptionalitySource(sources);
    }
}
