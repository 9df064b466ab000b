package io.github.joke.wireform.processor;

import com.palantir.javapoet.JavaFile;
import com.palantir.javapoet.TypeSpec;
import io.github.joke.wireform.di.RoundScoped;
import io.github.joke.wireform.model.GeneratedConverter;
import java.io.IOException;
import javax.annotation.processing.Filer;
import javax.annotation.processing.Messager;
import javax.inject.Inject;
import javax.lang.model.element.Element;
import javax.tools.Diagnostic;

@RoundScoped
public class ConverterWriter {

    private final Filer filer;
    private final Messager messager;

    @Inject
    ConverterWriter(Filer filer, Messager messager) {
        this.filer = filer;
        this.messager = messager;
    }

    public void write(GeneratedConverter generated, Element origin) {
        write(generated.getPackageName(), generated.getConverter(), origin);
        generated.getSupportTypes().forEach(type -> write(generated.getPackageName(), type, origin));
    }

    private void write(String packageName, TypeSpec type, Element origin) {
        JavaFile javaFile = JavaFile.builder(
                        packageName, type.toBuilder().addOriginatingElement(origin).build())
                .skipJavaLangImports(true)
                .build();
        try {
            javaFile.writeTo(filer);
        } catch (IOException e) {
            messager.printMessage(
                    Diagnostic.Kind.ERROR,
                    Pipeline.PREFIX + "Failed to write generated source " + packageName + "." + type.name() + ": "
                            + e.getMessage(),
                    origin);
        }
    }
}
