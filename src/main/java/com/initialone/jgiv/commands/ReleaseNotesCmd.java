package com.initialone.jgiv.commands;

import com.initialone.jgiv.model.DocumentType;
import picocli.CommandLine;

@CommandLine.Command(
        name = "release-notes",
        description = "Write release notes for the selected changes"
)
public class ReleaseNotesCmd extends AbstractGenerateCmd {
    @Override
    protected DocumentType type() {
        return DocumentType.RELEASE_NOTES;
    }
}
