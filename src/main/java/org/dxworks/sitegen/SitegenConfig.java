package org.dxworks.sitegen;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class SitegenConfig {

    static final String CONFIG_FILE_NAME = "sitegen-config.yml";

    private static final String DEFAULT_CONTENT_DIR = "content";
    private static final String DEFAULT_STATIC_DIR = "static";
    private static final String DEFAULT_TEMPLATE_PATH = "template.html";
    private static final String DEFAULT_OUTPUT_DIR = "docs";
    private static final String DEFAULT_BASE_PATH = "/";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final boolean DEFAULT_CONTINUE_ON_ERROR = false;

    private final Path contentDir;
    private final Path staticDir;
    private final Path templatePath;
    private final Path outputDir;
    private final String basePath;
    private final int maxFileLines;
    private final boolean continueOnError;

    private SitegenConfig(Path contentDir, Path staticDir, Path templatePath, Path outputDir,
                          String basePath, int maxFileLines, boolean continueOnError) {
        this.contentDir = contentDir;
        this.staticDir = staticDir;
        this.templatePath = templatePath;
        this.outputDir = outputDir;
        this.basePath = basePath;
        this.maxFileLines = maxFileLines;
        this.continueOnError = continueOnError;
    }

    public Path getContentDir() {
        return contentDir;
    }

    public Path getStaticDir() {
        return staticDir;
    }

    public Path getTemplatePath() {
        return templatePath;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public String getBasePath() {
        return basePath;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public SitegenConfig withBasePath(String basePath) {
        return new SitegenConfig(contentDir, staticDir, templatePath, outputDir,
                orDefault(basePath, DEFAULT_BASE_PATH), maxFileLines, continueOnError);
    }

    public static SitegenConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static SitegenConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                boolean effectiveContinueOnError = (yamlConfig.continueOnError != null)
                        ? yamlConfig.continueOnError
                        : DEFAULT_CONTINUE_ON_ERROR;

                return new SitegenConfig(
                        Paths.get(orDefault(yamlConfig.contentDir, DEFAULT_CONTENT_DIR)),
                        Paths.get(orDefault(yamlConfig.staticDir, DEFAULT_STATIC_DIR)),
                        Paths.get(orDefault(yamlConfig.templatePath, DEFAULT_TEMPLATE_PATH)),
                        Paths.get(orDefault(yamlConfig.outputDir, DEFAULT_OUTPUT_DIR)),
                        orDefault(yamlConfig.basePath, DEFAULT_BASE_PATH),
                        effectiveMaxFileLines,
                        effectiveContinueOnError);
            }
        } catch (IOException e) {
            System.err.println("Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static SitegenConfig with(Path contentDir, Path staticDir, Path templatePath, Path outputDir,
                                     String basePath, int maxFileLines, boolean continueOnError) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new SitegenConfig(contentDir, staticDir, templatePath, outputDir,
                orDefault(basePath, DEFAULT_BASE_PATH), effectiveMaxFileLines, continueOnError);
    }

    private static SitegenConfig defaults() {
        return new SitegenConfig(
                Paths.get(DEFAULT_CONTENT_DIR),
                Paths.get(DEFAULT_STATIC_DIR),
                Paths.get(DEFAULT_TEMPLATE_PATH),
                Paths.get(DEFAULT_OUTPUT_DIR),
                DEFAULT_BASE_PATH,
                DEFAULT_MAX_FILE_LINES,
                DEFAULT_CONTINUE_ON_ERROR);
    }

    private static String orDefault(String value, String fallback) {
        return (value != null && !value.isBlank()) ? value : fallback;
    }

    private static class YamlConfig {
        public String contentDir;
        public String staticDir;
        public String templatePath;
        public String outputDir;
        public String basePath;
        public Integer maxFileLines;
        public Boolean continueOnError;
    }
}
