package org.dxworks.exgraph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class ExgraphConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExgraphConfig.class);

    static final String CONFIG_FILE_NAME = "exgraph-config.yml";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final boolean DEFAULT_INCLUDE_TESTS = false;
    private static final boolean DEFAULT_INTERNAL_ONLY = true;
    private static final boolean DEFAULT_PARALLEL = true;

    private final int maxFileLines;
    private final boolean includeTests;
    private final boolean internalOnly;
    private final boolean parallel;

    private ExgraphConfig(int maxFileLines, boolean includeTests, boolean internalOnly, boolean parallel) {
        this.maxFileLines = maxFileLines;
        this.includeTests = includeTests;
        this.internalOnly = internalOnly;
        this.parallel = parallel;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public boolean isIncludeTests() {
        return includeTests;
    }

    public boolean isInternalOnly() {
        return internalOnly;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Reads {@code exgraph-config.yml} from the working directory.
     */
    public static ExgraphConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static ExgraphConfig load(Path configPath) {
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
                return new ExgraphConfig(
                        effectiveMaxFileLines,
                        orDefault(yamlConfig.includeTests, DEFAULT_INCLUDE_TESTS),
                        orDefault(yamlConfig.internalOnly, DEFAULT_INTERNAL_ONLY),
                        orDefault(yamlConfig.parallel, DEFAULT_PARALLEL));
            }
        } catch (IOException e) {
            LOGGER.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static ExgraphConfig defaults() {
        return new ExgraphConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_INCLUDE_TESTS, DEFAULT_INTERNAL_ONLY, DEFAULT_PARALLEL);
    }

    public static ExgraphConfig with(int maxFileLines, boolean includeTests, boolean internalOnly, boolean parallel) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new ExgraphConfig(effectiveMaxFileLines, includeTests, internalOnly, parallel);
    }

    private static boolean orDefault(Boolean value, boolean fallback) {
        return value != null ? value : fallback;
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Boolean includeTests;
        public Boolean internalOnly;
        public Boolean parallel;
    }
}
