package com.feedbackengine.common.exception;

/**
 * Malformed numeric or structural input (entry price &le; 0, negative size,
 * out-of-range percentages). Never silently clamped.
 */
public class ValidationException extends EngineException {

    private final String field;

    public ValidationException(String field, String message) {
        super("Validation", field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
