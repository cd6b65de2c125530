package com.gacha.economy.account;

/**
 * Thrown when account state cannot be read from or written to durable storage.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
