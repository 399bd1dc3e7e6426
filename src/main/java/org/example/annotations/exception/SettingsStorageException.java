package org.example.annotations.exception;

/**
 * Raised by settings stores on read or write failure. Callers at the settings boundary recover from it.
 */
public class SettingsStorageException extends RuntimeException {

    public SettingsStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
