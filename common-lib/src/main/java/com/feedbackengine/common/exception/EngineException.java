package com.feedbackengine.common.exception;

/**
 * Root of the engine's failure hierarchy. Every real failure surfaced by the
 * decision, risk or replay layers extends this type; expected outcomes such as
 * risk rejections are returned as values instead.
 */
public class EngineException extends RuntimeException {

    private final String component;

    public EngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public EngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
