package com.initialone.jgiv.errors;

/**
 * Base of every failure the CLI reports to the user.
 *
 * Each subclass maps to its own process exit code so that scripts can tell
 * a bad revision apart from an LLM outage or an unwritable file.
 */
public abstract class GivException extends RuntimeException {

    protected GivException(String message) {
        super(message);
    }

    protected GivException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Process exit code for this kind of failure. */
    public abstract int exitCode();
}
