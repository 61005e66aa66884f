package com.initialone.jgiv.commands;

import ch.qos.logback.classic.Level;
import com.initialone.jgiv.config.GivConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;

/** Flags every subcommand accepts. */
public class CommonOptions {
    static final String LOGGER_ROOT = "com.initialone.jgiv";

    @CommandLine.Option(names = "--config-file",
            description = "Use this config file instead of the nearest .giv/config")
    public Path configFile;

    @CommandLine.Option(names = {"-v", "--verbose"},
            description = "Debug logging on stderr (git commands, cache hits, retries)")
    public boolean verbose;

    /** Applies --verbose and loads the merged config for the current directory. */
    GivConfig init() {
        if (verbose) {
            Logger l = LoggerFactory.getLogger(LOGGER_ROOT);
            if (l instanceof ch.qos.logback.classic.Logger) {
                ((ch.qos.logback.classic.Logger) l).setLevel(Level.DEBUG);
            }
        }
        return GivConfig.load(workDir(), configFile);
    }

    static Path workDir() {
        return Path.of("").toAbsolutePath();
    }

    static Path userHome() {
        return Path.of(System.getProperty("user.home"));
    }
}
