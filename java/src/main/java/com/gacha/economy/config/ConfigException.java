package com.gacha.economy.config;

/**
 * Thrown when the economy configuration cannot be read or is inconsistent.
 */
public class ConfigException extends Exception {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
