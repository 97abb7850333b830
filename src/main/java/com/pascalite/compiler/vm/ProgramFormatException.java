package com.pascalite.compiler.vm;

/** Malformed program text or JSON. */
public final class ProgramFormatException extends RuntimeException {
    public ProgramFormatException(String message) {
        super(message);
    }

    public ProgramFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
