package com.example.harborwatch.exception;

/**
 * Signals a registry record that cannot take part in correlation, typically
 * because its latitude, longitude or identifier cannot be resolved. Callers
 * drop the record and continue with the rest of the registry.
 */
public class SkippableRecordException extends Exception {

    public SkippableRecordException(String message) {
        super(message);
    }
}
