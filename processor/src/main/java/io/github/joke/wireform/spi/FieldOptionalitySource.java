package io.github.joke.wireform.spi;

import java.util.Optional;

/**
 * Best-effort side channel telling whether a wire field is optional. Consulted after explicit
 * directives and before any structural or heuristic inference.
 *
 * <p>Implementations registered under {@code META-INF/services} are picked up by the processor.
 */
public interface FieldOptionalitySource {

    /**
     * @param wireMessage canonical name of the wire class
     * @param wireField field name as declared in the wire schema
     * @return whether the field is optional, or empty when this source has no answer
     */
    Optional<Boolean> fieldOptionality(String wireMessage, String wireField);

    static FieldOptionalitySource none() {
        return (wireMessage, wireField) -> Optional.empty();
    }
}
