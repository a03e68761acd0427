package org.dxworks.omml2latex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class Omml2LatexConfig {

    private static final String CONFIG_FILE_NAME = "omml2latex-config.yml";
    private static final String DEFAULT_INLINE_OPEN = "$";
    private static final String DEFAULT_INLINE_CLOSE = "$";
    private static final String DEFAULT_DISPLAY_OPEN = "\\[";
    private static final String DEFAULT_DISPLAY_CLOSE = "\\]";
    private static final String DEFAULT_MATRIX_ENVIRONMENT = "pmatrix";
    private static final boolean DEFAULT_REPORT_ADVISORIES = true;

    private final String inlineOpen;
    private final String inlineClose;
    private final String displayOpen;
    private final String displayClose;
    private final String matrixEnvironment;
    private final boolean reportAdvisories;

    private Omml2LatexConfig(String inlineOpen, String inlineClose, String displayOpen, String displayClose,
                             String matrixEnvironment, boolean reportAdvisories) {
        this.inlineOpen = inlineOpen;
        this.inlineClose = inlineClose;
        this.displayOpen = displayOpen;
        this.displayClose = displayClose;
        this.matrixEnvironment = matrixEnvironment;
        this.reportAdvisories = reportAdvisories;
    }

    public String getInlineOpen() {
        return inlineOpen;
    }

    public String getInlineClose() {
        return inlineClose;
    }

    public String getDisplayOpen() {
        return displayOpen;
    }

    public String getDisplayClose() {
        return displayClose;
    }

    public String getMatrixEnvironment() {
        return matrixEnvironment;
    }

    public boolean isReportAdvisories() {
        return reportAdvisories;
    }

    public static Omml2LatexConfig defaults() {
        return new Omml2LatexConfig(DEFAULT_INLINE_OPEN, DEFAULT_INLINE_CLOSE, DEFAULT_DISPLAY_OPEN,
                DEFAULT_DISPLAY_CLOSE, DEFAULT_MATRIX_ENVIRONMENT, DEFAULT_REPORT_ADVISORIES);
    }

    public static Omml2LatexConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static Omml2LatexConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return new Omml2LatexConfig(
                        orDefault(yamlConfig.inlineOpen, DEFAULT_INLINE_OPEN),
                        orDefault(yamlConfig.inlineClose, DEFAULT_INLINE_CLOSE),
                        orDefault(yamlConfig.displayOpen, DEFAULT_DISPLAY_OPEN),
                        orDefault(yamlConfig.displayClose, DEFAULT_DISPLAY_CLOSE),
                        orDefault(yamlConfig.matrixEnvironment, DEFAULT_MATRIX_ENVIRONMENT),
                        yamlConfig.reportAdvisories != null
                                ? yamlConfig.reportAdvisories
                                : DEFAULT_REPORT_ADVISORIES);
            }
        } catch (IOException e) {
            synchronized (System.err) {
                System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
            }
        }

        return defaults();
    }

    public static Omml2LatexConfig with(String matrixEnvironment, boolean reportAdvisories) {
        return new Omml2LatexConfig(DEFAULT_INLINE_OPEN, DEFAULT_INLINE_CLOSE, DEFAULT_DISPLAY_OPEN,
                DEFAULT_DISPLAY_CLOSE, orDefault(matrixEnvironment, DEFAULT_MATRIX_ENVIRONMENT), reportAdvisories);
    }

    private static String orDefault(String value, String defaultValue) {
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static class YamlConfig {
        public String inlineOpen;
        public String inlineClose;
        public String displayOpen;
        public String displayClose;
        public String matrixEnvironment;
        public Boolean reportAdvisories;
    }
}
