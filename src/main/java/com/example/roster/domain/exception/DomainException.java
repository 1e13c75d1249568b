package com.example.roster.domain.exception;

/**
 * Base type for all domain-level exceptions raised around roster extraction.
 * Subclasses describe unusable inputs without leaking infrastructure dependencies.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of what the caller supplied wrongly
	 */
    protected DomainException(String message) {
        super(message);
    }
}
