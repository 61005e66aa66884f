package com.initialone.jgiv.commands;

import com.initialone.jgiv.config.GivConfig;
import com.initialone.jgiv.core.CommitCache;
import picocli.CommandLine;

import java.io.PrintWriter;

@CommandLine.Command(
        name = "cache",
        description = {
                "Inspect or clear cached commit summaries.",
                "Summaries are keyed by commit id only; after editing templates run 'cache clear'."
        },
        subcommands = {CacheCmd.Clear.class, CacheCmd.ListEntries.class, CacheCmd.ShowPath.class}
)
public class CacheCmd implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @CommandLine.Command(name = "clear", description = "Delete every cached summary")
    static class Clear implements Runnable {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        CommonOptions common;

        @Override
        public void run() {
            GivConfig cfg = common.init();
            CommitCache cache = new CommitCache(cfg.cacheDir());
            int n = cache.clear();
            spec.commandLine().getOut().println("[cache] removed " + n + " entr" + (n == 1 ? "y" : "ies") + " from " + cache.directory());
        }
    }

    @CommandLine.Command(name = "list", description = "Show how many summaries are cached")
    static class ListEntries implements Runnable {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        CommonOptions common;

        @Override
        public void run() {
            GivConfig cfg = common.init();
            CommitCache cache = new CommitCache(cfg.cacheDir());
            PrintWriter out = spec.commandLine().getOut();
            out.println("[cache] " + cache.size() + " cached summaries in " + cache.directory());
            out.println("[cache] entries are never refreshed automatically; run 'jgiv cache clear' after changing templates");
        }
    }

    @CommandLine.Command(name = "path", description = "Print the cache directory")
    static class ShowPath implements Runnable {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        CommonOptions common;

        @Override
        public void run() {
            spec.commandLine().getOut().println(common.init().cacheDir());
        }
    }
}
