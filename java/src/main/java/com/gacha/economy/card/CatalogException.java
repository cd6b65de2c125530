package com.gacha.economy.card;

/**
 * Thrown when the card catalog cannot be loaded or fails validation.
 * The catalog is loaded once at startup, so this is a configuration fault.
 */
public class CatalogException extends Exception {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
