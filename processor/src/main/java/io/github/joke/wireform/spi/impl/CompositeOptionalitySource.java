package io.github.joke.wireform.spi.impl;

import io.github.joke.wireform.spi.FieldOptionalitySource;
import java.util.List;
import java.util.Optional;

/** Asks each source in order; the first answer wins. */
public final class CompositeOptionalitySource implements FieldOptionalitySource {

    private final List<FieldOptionalitySource> sources;

    public CompositeOptionalitySource(List<? extends FieldOptionalitySource> sources) {
        this.sources = List.copyOf(sources);
    }

    @Override
    public Optional<Boolean> fieldOptionality(String wireMessage, String wireField) {
        for (FieldOptionalitySource source : sources) {
            Optional<Boolean> answer = source.fieldOptionality(wireMessage, wireField);
            if (answer.isPresent()) {
                return answer;
            }
        }
        return Optional.empty();
    }
}
