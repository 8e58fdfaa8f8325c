package com.example.filefinder;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;

public enum FailureKind {
    ACCESS_DENIED("access denied"),
    NOT_FOUND("not found"),
    IO_ERROR("i/o error"),
    UNEXPECTED("unexpected error");

    private final String label;

    FailureKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    static FailureKind of(IOException ex) {
        if (ex instanceof AccessDeniedException) {
            return ACCESS_DENIED;
        }
        if (ex instanceof NoSuchFileException) {
            return NOT_FOUND;
        }
        return IO_ERROR;
    }
}
