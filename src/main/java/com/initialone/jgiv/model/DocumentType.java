package com.initialone.jgiv.model;

/**
 * Kinds of document the tool generates.
 *
 * Each type knows its final prompt template, its sampling temperature, the
 * title heading a fresh file starts with, the payload used when the range
 * holds no changes, and where its output file name comes from.
 */
public enum DocumentType {
    MESSAGE("message", "message_prompt.md", 0.9, null,
            "No changes detected.", null, null),
    SUMMARY("summary", "final_summary_prompt.md", 0.9, null,
            "No changes detected in the selected revision range.", null, null),
    CHANGELOG("changelog", "changelog_prompt.md", 0.7, "# Changelog",
            "- No notable changes.", "changelog_file", "CHANGELOG.md"),
    RELEASE_NOTES("release-notes", "release_notes_prompt.md", 0.7, null,
            "This release contains no changes.", "release_notes_file", "{VERSION}_release_notes.md"),
    ANNOUNCEMENT("announcement", "announcement_prompt.md", 0.9, null,
            "There is nothing new to announce yet.", "announcement_file", "{VERSION}_announcement.md"),
    /** User-supplied template via --prompt-file. */
    DOCUMENT("document", null, 0.9, null,
            "No changes detected.", null, null);

    public final String tag;
    public final String templateName;
    public final double temperature;
    /** Heading placed at the top of a freshly created file, or null. */
    public final String title;
    public final String emptyPayload;
    /** Config key holding the output file name, or null when output defaults to stdout. */
    public final String fileConfigKey;
    public final String defaultFileName;

    DocumentType(String tag, String templateName, double temperature, String title,
                 String emptyPayload, String fileConfigKey, String defaultFileName) {
        this.tag = tag;
        this.templateName = templateName;
        this.temperature = temperature;
        this.title = title;
        this.emptyPayload = emptyPayload;
        this.fileConfigKey = fileConfigKey;
        this.defaultFileName = defaultFileName;
    }
}
