package com.initialone.jgiv.commands;

import com.initialone.jgiv.model.DocumentType;
import picocli.CommandLine;

@CommandLine.Command(
        name = "announcement",
        description = "Write a release announcement for the selected changes"
)
public class AnnouncementCmd extends AbstractGenerateCmd {
    @Override
    protected DocumentType type() {
        return DocumentType.ANNOUNCEMENT;
    }
}
