package com.climate.quality;

import com.climate.quality.model.ValidationResult;

import java.util.List;

/**
 * 配置不满足前置条件时抛出，列出全部未满足的条件。
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> errors;

    public ConfigurationException(ValidationResult result) {
        super("Invalid configuration: " + String.join("; ", result.getErrors()));
        this.errors = result.getErrors();
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public List<String> getErrors() {
        return errors;
    }
}
