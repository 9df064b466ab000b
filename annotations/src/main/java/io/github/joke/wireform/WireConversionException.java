package io.github.joke.wireform;

/**
 * Base type of the errors thrown by generated converters when a wire value required by the
 * domain type is missing.
 */
public class WireConversionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;

    public WireConversionException(String fieldName) {
        super("Missing required wire field: " + fieldName);
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
