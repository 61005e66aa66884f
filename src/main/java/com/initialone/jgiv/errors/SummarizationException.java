package com.initialone.jgiv.errors;

/** The summarization collaborator failed on every attempt. Aborts the run before any write. */
public class SummarizationException extends GivException {
    public static final int EXIT_CODE = 4;

    private final String subject;
    private final int attempts;

    public SummarizationException(String subject, int attempts, Throwable cause) {
        super("summarization failed for " + subject + " after " + attempts + " attempt(s): "
                + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.subject = subject;
        this.attempts = attempts;
    }

    /** Commit id, or the document type for the final call. */
    public String subject() {
        return subject;
    }

    public int attempts() {
        return attempts;
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
