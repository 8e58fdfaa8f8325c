package com.example.filefinder;

/**
 * Raised for problems with the command line or configuration, before any worker starts.
 */
public class UsageException extends IllegalArgumentException {
    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
