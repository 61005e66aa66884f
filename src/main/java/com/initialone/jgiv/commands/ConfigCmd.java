package com.initialone.jgiv.commands;

import com.initialone.jgiv.config.ConfigFile;
import com.initialone.jgiv.config.GivConfig;
import com.initialone.jgiv.errors.ConfigException;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;

@CommandLine.Command(
        name = "config",
        description = "Read or change settings in the project .giv/config",
        subcommands = {ConfigCmd.ListValues.class, ConfigCmd.Get.class, ConfigCmd.Set.class, ConfigCmd.Unset.class}
)
public class ConfigCmd implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /** Keeps secrets out of terminal scrollback. */
    static String mask(String key, String value) {
        if (!key.endsWith("key")) return value;
        return value.length() <= 4 ? "****" : "****" + value.substring(value.length() - 4);
    }

    @CommandLine.Command(name = "list", description = "Print every effective setting")
    static class ListValues implements Runnable {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        CommonOptions common;

        @Override
        public void run() {
            PrintWriter out = spec.commandLine().getOut();
            for (Map.Entry<String, String> e : common.init().asDisplayMap().entrySet()) {
                out.println(e.getKey() + "=" + mask(e.getKey(), e.getValue()));
            }
        }
    }

    @CommandLine.Command(name = "get", description = "Print one effective setting")
    static class Get implements Runnable {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        CommonOptions common;

        @CommandLine.Parameters(index = "0", paramLabel = "KEY")
        String key;

        @Override
        public void run() {
            String v = common.init().get(key)
                    .orElseThrow(() -> new ConfigException("config key '" + key + "' is not set"));
            spec.commandLine().getOut().println(v);
        }
    }

    @CommandLine.Command(name = "set", description = "Store a setting in the project config file")
    static class Set implements Runnable {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        CommonOptions common;

        @CommandLine.Parameters(index = "0", paramLabel = "KEY")
        String key;

        @CommandLine.Parameters(index = "1", paramLabel = "VALUE")
        String value;

        @Override
        public void run() {
            Path file = common.init().projectFile();
            Map<String, String> values = ConfigFile.read(file);
            values.put(ConfigFile.normalizeKey(key), value);
            ConfigFile.write(file, values);
            spec.commandLine().getOut().println("[config] " + ConfigFile.displayKey(ConfigFile.normalizeKey(key)) + " -> " + file);
        }
    }

    @CommandLine.Command(name = "unset", description = "Remove a setting from the project config file")
    static class Unset implements Runnable {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        CommonOptions common;

        @CommandLine.Parameters(index = "0", paramLabel = "KEY")
        String key;

        @Override
        public void run() {
            Path file = common.init().projectFile();
            Map<String, String> values = ConfigFile.read(file);
            if (values.remove(ConfigFile.normalizeKey(key)) == null) {
                throw new ConfigException("config key '" + key + "' is not set in " + file);
            }
            ConfigFile.write(file, values);
            spec.commandLine().getOut().println("[config] removed " + ConfigFile.displayKey(ConfigFile.normalizeKey(key)));
        }
    }
}
