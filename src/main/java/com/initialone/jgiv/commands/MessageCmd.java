package com.initialone.jgiv.commands;

import com.initialone.jgiv.model.DocumentType;
import picocli.CommandLine;

@CommandLine.Command(
        name = "message",
        aliases = "msg",
        description = "Draft a commit message for the working tree, staged changes or a revision"
)
public class MessageCmd extends AbstractGenerateCmd {
    @Override
    protected DocumentType type() {
        return DocumentType.MESSAGE;
    }
}
