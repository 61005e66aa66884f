package com.initialone.jgiv.model;

/** Final text of a document run, tagged with the version it represents. */
public final class GeneratedPayload {
    public final String text;
    public final String versionLabel;
    public final DocumentType documentType;
    /** Produced by the no-changes branch rather than by the model. */
    public final boolean empty;
    /** The text is the unsent final prompt. */
    public final boolean dryRun;

    public GeneratedPayload(String text, String versionLabel, DocumentType documentType, boolean empty, boolean dryRun) {
        this.text = text == null ? "" : text;
        this.versionLabel = versionLabel == null || versionLabel.isBlank() ? ProjectMetadata.UNRELEASED : versionLabel;
        this.documentType = documentType;
        this.empty = empty;
        this.dryRun = dryRun;
    }
}
