package io.github.byzatic.cronengine.base_exceptions;

/**
 * Invalid job definition: bad schedule expression, unknown timezone or a missing field.
 */
public class ValidationException extends Exception {
    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
