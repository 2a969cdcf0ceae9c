package com.feedbackengine.common.exception;

public class ConfigurationException extends EngineException {

    public ConfigurationException(String message) {
        super("Configuration", message);
    }
}
