package com.example.roster.infrastructure.exception;

/**
 * Failure of an adapter around the roster engine (PDFBox, file system).
 * Always carries the library exception that caused it.
 */
public abstract class InfrastructureException extends RuntimeException {

    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
