package com.initialone.jgiv.config;

import com.initialone.jgiv.errors.ConfigException;
import com.initialone.jgiv.model.DocumentType;
import com.initialone.jgiv.model.OutputMode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Merged configuration. Lowest precedence first: ~/.giv/config, the project
 * .giv/config (or --config-file), then GIV_* environment variables.
 * Command-line flags are applied on top by the commands themselves.
 */
public class GivConfig {
    public static final String API_URL = "api.url";
    public static final String API_KEY = "api.key";
    public static final String API_MODEL = "api.model";
    public static final String API_PROVIDER = "api.provider";
    public static final String TEMPERATURE = "temperature";
    public static final String MAX_TOKENS = "max_tokens";
    public static final String OUTPUT_MODE = "output_mode";
    public static final String OUTPUT_VERSION = "output_version";
    public static final String CACHE_DIR = "cache_dir";
    public static final String PROJECT_TITLE = "project.title";
    public static final String PROJECT_VERSION = "project.version";
    public static final String EXAMPLE = "example";
    public static final String RULES = "rules";

    public static final String GIV_DIR = ".giv";

    private final Map<String, String> values;
    private final Path projectDir;
    private final Path projectFile;

    public GivConfig(Map<String, String> values, Path projectDir, Path projectFile) {
        Map<String, String> norm = new LinkedHashMap<>();
        values.forEach((k, v) -> norm.put(ConfigFile.normalizeKey(k), v));
        this.values = Collections.unmodifiableMap(norm);
        this.projectDir = projectDir;
        this.projectFile = projectFile;
    }

    public static GivConfig empty(Path projectDir) {
        return new GivConfig(Map.of(), projectDir, projectDir.resolve(GIV_DIR).resolve("config"));
    }

    public static GivConfig load(Path workDir, Path explicitFile) {
        return load(workDir, explicitFile, System.getenv(), Path.of(System.getProperty("user.home")));
    }

    public static GivConfig load(Path workDir, Path explicitFile, Map<String, String> env, Path home) {
        Map<String, String> merged = new LinkedHashMap<>();
        merged.putAll(ConfigFile.read(home.resolve(GIV_DIR).resolve("config")));

        Path projectFile;
        if (explicitFile != null) {
            if (!Files.isRegularFile(explicitFile)) {
                throw new ConfigException("config file not found: " + explicitFile);
            }
            projectFile = explicitFile;
        } else {
            projectFile = findProjectFile(workDir);
        }
        Path projectDir = projectFile != null && projectFile.getParent() != null && projectFile.getParent().getParent() != null
                && projectFile.getParent().getFileName().toString().equals(GIV_DIR)
                ? projectFile.getParent().getParent()
                : workDir;
        if (projectFile != null) merged.putAll(ConfigFile.read(projectFile));
        else projectFile = workDir.resolve(GIV_DIR).resolve("config");

        env.forEach((k, v) -> {
            if (k.startsWith(ConfigFile.ENV_PREFIX)) merged.put(k, v);
        });
        return new GivConfig(merged, projectDir.toAbsolutePath(), projectFile);
    }

    /** Walks up from {@code start} looking for .giv/config. */
    static Path findProjectFile(Path start) {
        Path dir = start.toAbsolutePath();
        while (dir != null) {
            Path candidate = dir.resolve(GIV_DIR).resolve("config");
            if (Files.isRegularFile(candidate)) return candidate;
            dir = dir.getParent();
        }
        return null;
    }

    public Optional<String> get(String key) {
        String v = values.get(ConfigFile.normalizeKey(key));
        return v == null || v.isBlank() ? Optional.empty() : Optional.of(v);
    }

    public String getOr(String key, String def) {
        return get(key).orElse(def);
    }

    public Optional<Integer> getInt(String key) {
        Optional<String> v = get(key);
        if (v.isEmpty()) return Optional.empty();
        try {
            return Optional.of(Integer.parseInt(v.get().trim()));
        } catch (NumberFormatException e) {
            throw new ConfigException("config '" + key + "' must be an integer, got '" + v.get() + "'");
        }
    }

    public Optional<Double> getDouble(String key) {
        Optional<String> v = get(key);
        if (v.isEmpty()) return Optional.empty();
        try {
            return Optional.of(Double.parseDouble(v.get().trim()));
        } catch (NumberFormatException e) {
            throw new ConfigException("config '" + key + "' must be a number, got '" + v.get() + "'");
        }
    }

    /** {@code <type>.output_mode}, then {@code output_mode}, then AUTO. */
    public OutputMode outputMode(DocumentType type) {
        String key = type.tag + "." + OUTPUT_MODE;
        Optional<String> v = get(key);
        if (v.isEmpty()) {
            key = OUTPUT_MODE;
            v = get(key);
        }
        if (v.isEmpty()) return OutputMode.AUTO;
        try {
            return OutputMode.parse(v.get());
        } catch (IllegalArgumentException e) {
            throw new ConfigException("config '" + key + "' has unknown output mode '" + v.get() + "'");
        }
    }

    /** Output file name or pattern for the type; null means stdout. */
    public String outputFilePattern(DocumentType type) {
        if (type.fileConfigKey == null) return null;
        return getOr(type.fileConfigKey, type.defaultFileName);
    }

    public Path cacheDir() {
        return get(CACHE_DIR)
                .map(p -> projectDir.resolve(p))
                .orElse(projectDir.resolve(GIV_DIR).resolve("cache"));
    }

    public Path projectDir() {
        return projectDir;
    }

    /** Project-level file that {@code config set} writes to. */
    public Path projectFile() {
        return projectFile;
    }

    /** All values keyed by display form, sorted. */
    public Map<String, String> asDisplayMap() {
        Map<String, String> out = new TreeMap<>();
        values.forEach((k, v) -> out.put(ConfigFile.displayKey(k), v));
        return out;
    }
}
