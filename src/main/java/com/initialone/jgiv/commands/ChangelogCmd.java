package com.initialone.jgiv.commands;

import com.initialone.jgiv.model.DocumentType;
import picocli.CommandLine;

@CommandLine.Command(
        name = "changelog",
        description = "Update CHANGELOG.md with a section for the selected changes"
)
public class ChangelogCmd extends AbstractGenerateCmd {
    @Override
    protected DocumentType type() {
        return DocumentType.CHANGELOG;
    }
}
