package com.initialone.jgiv.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jgiv.config.GivConfig;
import com.initialone.jgiv.git.Repository;
import com.initialone.jgiv.model.ProjectMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Figures out the project title and version.
 *
 * Config values win; then build descriptors are read in a fixed order
 * (pyproject.toml, Cargo.toml, package.json, pom.xml, build.gradle); then a
 * VERSION file; then the latest git tag. Without any of those the title is
 * the directory name and the version is {@value ProjectMetadata#UNRELEASED}.
 */
public class ProjectMetadataDetector {
    private static final Logger log = LoggerFactory.getLogger(ProjectMetadataDetector.class);

    private static final Set<String> TOML_TABLES = Set.of("project", "tool.poetry", "package");
    private static final Pattern TOML_TABLE = Pattern.compile("^\\s*\\[([^\\[\\]]+)]\\s*(#.*)?$");
    private static final Pattern TOML_STRING = Pattern.compile("^\\s*(name|version)\\s*=\\s*[\"']([^\"']*)[\"']");
    private static final Pattern POM_PARENT = Pattern.compile("(?s)<parent>.*?</parent>");
    private static final Pattern POM_DEPS = Pattern.compile("(?s)<(dependencies|dependencyManagement|build|profiles)>.*?</\\1>");
    private static final Pattern GRADLE_VERSION = Pattern.compile("(?m)^\\s*version\\s*=?\\s*[\"']([^\"']+)[\"']");
    private static final Pattern TAG_VERSION = Pattern.compile("^[vV](\\d.*)$");

    private final Path projectDir;
    private final GivConfig config;
    private final Repository repo;
    private final ObjectMapper om = new ObjectMapper();

    /** {@code repo} may be null; the tag lookup is then skipped. */
    public ProjectMetadataDetector(Path projectDir, GivConfig config, Repository repo) {
        this.projectDir = projectDir;
        this.config = config;
        this.repo = repo;
    }

    public ProjectMetadata detect() {
        return new ProjectMetadata(detectTitle(), detectVersion());
    }

    String detectTitle() {
        Optional<String> configured = config.get(GivConfig.PROJECT_TITLE);
        if (configured.isPresent()) return configured.get();
        for (String found : new String[] {
                toml("pyproject.toml", "name"),
                packageJson("name"),
                toml("Cargo.toml", "name"),
                pom("artifactId")}) {
            if (found != null && !found.isBlank()) return found;
        }
        Path name = projectDir.toAbsolutePath().normalize().getFileName();
        return name == null ? "project" : name.toString();
    }

    String detectVersion() {
        Optional<String> configured = config.get(GivConfig.PROJECT_VERSION);
        if (configured.isPresent()) return configured.get();
        for (String found : new String[] {
                toml("pyproject.toml", "version"),
                toml("Cargo.toml", "version"),
                packageJson("version"),
                pom("version"),
                gradleVersion(),
                versionFile()}) {
            if (found != null && !found.isBlank()) return found;
        }
        if (repo != null) {
            Optional<String> tag = repo.latestTag();
            if (tag.isPresent()) {
                Matcher m = TAG_VERSION.matcher(tag.get());
                return m.matches() ? m.group(1) : tag.get();
            }
        }
        return ProjectMetadata.UNRELEASED;
    }

    private String toml(String file, String key) {
        String text = read(file);
        if (text == null) return null;
        String table = "";
        for (String line : text.split("\\R")) {
            Matcher t = TOML_TABLE.matcher(line);
            if (t.matches()) {
                table = t.group(1).trim();
                continue;
            }
            if (!TOML_TABLES.contains(table)) continue;
            Matcher m = TOML_STRING.matcher(line);
            if (m.find() && m.group(1).equals(key)) return m.group(2).trim();
        }
        return null;
    }

    private String packageJson(String field) {
        String text = read("package.json");
        if (text == null) return null;
        try {
            JsonNode v = om.readTree(text).path(field);
            return v.isTextual() ? v.asText() : null;
        } catch (IOException e) {
            log.debug("package.json is not valid JSON: {}", e.getMessage());
            return null;
        }
    }

    private String pom(String element) {
        String text = read("pom.xml");
        if (text == null) return null;
        String own = POM_DEPS.matcher(POM_PARENT.matcher(text).replaceAll("")).replaceAll("");
        Matcher m = Pattern.compile("<" + element + ">\\s*([^<\\s][^<]*?)\\s*</" + element + ">").matcher(own);
        if (!m.find()) return null;
        String v = m.group(1);
        return v.contains("${") ? null : v;
    }

    private String gradleVersion() {
        for (String f : List.of("build.gradle", "build.gradle.kts")) {
            String text = read(f);
            if (text == null) continue;
            Matcher m = GRADLE_VERSION.matcher(text);
            if (m.find()) return m.group(1);
        }
        return null;
    }

    private String versionFile() {
        for (String f : List.of("VERSION", "VERSION.txt")) {
            String text = read(f);
            if (text != null && !text.isBlank()) return text.strip().split("\\R", 2)[0].trim();
        }
        return null;
    }

    private String read(String name) {
        Path p = projectDir.resolve(name);
        if (!Files.isRegularFile(p)) return null;
        try {
            return Files.readString(p, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("cannot read {}: {}", p, e.getMessage());
            return null;
        }
    }
}
