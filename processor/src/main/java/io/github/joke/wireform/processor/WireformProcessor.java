package io.github.joke.wireform.processor;

import com.google.auto.service.AutoService;
import io.github.joke.wireform.ProtoConvert;
import io.github.joke.wireform.config.GeneratorOptions;
import io.github.joke.wireform.di.DaggerProcessorComponent;
import io.github.joke.wireform.di.ProcessorComponent;
import io.github.joke.wireform.di.ProcessorModule;
import java.util.Collections;
import java.util.Set;
import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.TypeElement;

@AutoService(Processor.class)
public class WireformProcessor extends AbstractProcessor {

    private ProcessorComponent component;

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        component = DaggerProcessorComponent.factory().create(new ProcessorModule(processingEnv));
    }

    @Override
    public Set<String> getSupportedAnnotationTypes() {
        return Collections.singleton(ProtoConvert.class.getCanonicalName());
    }

    @Override
    public Set<String> getSupportedOptions() {
        return GeneratorOptions.KEYS;
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        if (annotations.isEmpty()) {
            return false;
        }
        component.roundComponentFactory().create().pipeline().process(roundEnv);
        return false;
    }
}
