package io.github.joke.wireform.di;

import dagger.Subcomponent;
import io.github.joke.wireform.processor.Pipeline;

@RoundScoped
@Subcomponent
public interface RoundComponent {

    Pipeline pipeline();

    @Subcomponent.Factory
    interface Factory {
        RoundComponent create();
    }
}
