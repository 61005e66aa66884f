package com.initialone.jgiv;

import com.initialone.jgiv.commands.*;
import com.initialone.jgiv.errors.GivException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
        name = "jgiv",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Write commit messages, changelogs and release notes from git history with LLMs.",
                "",
                "REVISION: HEAD~3..HEAD | v1.0.0...HEAD | <commit> | staged | working-tree (default)",
                "Providers: openai | deepseek | local (--local-api openai|ollama)",
                "Env: OPENAI_API_KEY / OPENAI_BASE_URL / DEEPSEEK_API_KEY / DEEPSEEK_BASE_URL / GIV_*"
        },
        subcommands = {
                MessageCmd.class, SummaryCmd.class, ChangelogCmd.class, ReleaseNotesCmd.class,
                AnnouncementCmd.class, DocumentCmd.class, CacheCmd.class, ConfigCmd.class
        }
)
public class Main implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public void run() { System.out.println("Use a subcommand. Try --help."); }

    public static void main(String[] args) {
        int code = newCommandLine().execute(args);
        System.exit(code);
    }

    /** Root command with case-insensitive enums and one-line error reporting. */
    public static CommandLine newCommandLine() {
        CommandLine cl = new CommandLine(new Main());
        cl.setCaseInsensitiveEnumValuesAllowed(true);
        cl.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            log.debug("command failed", ex);
            String msg = ex.getMessage() == null ? ex.toString() : ex.getMessage();
            cmd.getErr().println("[giv] error: " + msg);
            cmd.getErr().flush();
            return ex instanceof GivException ? ((GivException) ex).exitCode() : 1;
        });
        return cl;
    }
}
