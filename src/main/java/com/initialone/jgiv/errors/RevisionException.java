package com.initialone.jgiv.errors;

/** Unparseable or unresolvable revision spec; also wraps git plumbing failures. */
public class RevisionException extends GivException {
    public static final int EXIT_CODE = 3;

    private final String revision;

    public RevisionException(String revision, String message) {
        super(message);
        this.revision = revision;
    }

    public RevisionException(String revision, String message, Throwable cause) {
        super(message, cause);
        this.revision = revision;
    }

    public String revision() {
        return revision;
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
