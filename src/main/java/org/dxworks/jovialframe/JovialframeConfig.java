package org.dxworks.jovialframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class JovialframeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(JovialframeConfig.class);

    private static final String CONFIG_FILE_NAME = "jovialframe-config.yml";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_INCREMENTAL_RELEX_THRESHOLD = 256;
    private static final boolean DEFAULT_REPORT_UNRESOLVED_REFERENCES = true;
    private static final int DEFAULT_ANALYSIS_THREADS = 2;

    private final int maxFileLines;
    private final int incrementalRelexThreshold;
    private final boolean reportUnresolvedReferences;
    private final int analysisThreads;

    private JovialframeConfig(int maxFileLines, int incrementalRelexThreshold,
                              boolean reportUnresolvedReferences, int analysisThreads) {
        this.maxFileLines = maxFileLines;
        this.incrementalRelexThreshold = incrementalRelexThreshold;
        this.reportUnresolvedReferences = reportUnresolvedReferences;
        this.analysisThreads = analysisThreads;
    }

    /**
     * Files with more lines are skipped by the command line tool.
     */
    public int getMaxFileLines() {
        return maxFileLines;
    }

    /**
     * Largest changed region, in characters, that is re-lexed incrementally; 0 always re-lexes in full.
     */
    public int getIncrementalRelexThreshold() {
        return incrementalRelexThreshold;
    }

    public boolean isReportUnresolvedReferences() {
        return reportUnresolvedReferences;
    }

    /**
     * Worker threads shared by all document sessions.
     */
    public int getAnalysisThreads() {
        return analysisThreads;
    }

    public static JovialframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static JovialframeConfig load(Path configPath) {
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
                int effectiveThreshold = (yamlConfig.incrementalRelexThreshold != null && yamlConfig.incrementalRelexThreshold >= 0)
                        ? yamlConfig.incrementalRelexThreshold
                        : DEFAULT_INCREMENTAL_RELEX_THRESHOLD;
                boolean effectiveReportUnresolved = (yamlConfig.reportUnresolvedReferences != null)
                        ? yamlConfig.reportUnresolvedReferences
                        : DEFAULT_REPORT_UNRESOLVED_REFERENCES;
                int effectiveThreads = (yamlConfig.analysisThreads != null && yamlConfig.analysisThreads > 0)
                        ? yamlConfig.analysisThreads
                        : DEFAULT_ANALYSIS_THREADS;

                return new JovialframeConfig(effectiveMaxFileLines, effectiveThreshold,
                        effectiveReportUnresolved, effectiveThreads);
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static JovialframeConfig defaults() {
        return new JovialframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_INCREMENTAL_RELEX_THRESHOLD,
                DEFAULT_REPORT_UNRESOLVED_REFERENCES, DEFAULT_ANALYSIS_THREADS);
    }

    public static JovialframeConfig with(int maxFileLines, int incrementalRelexThreshold,
                                         boolean reportUnresolvedReferences, int analysisThreads) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        int effectiveThreshold = Math.max(0, incrementalRelexThreshold);
        int effectiveThreads = analysisThreads > 0 ? analysisThreads : DEFAULT_ANALYSIS_THREADS;
        return new JovialframeConfig(effectiveMaxFileLines, effectiveThreshold, reportUnresolvedReferences, effectiveThreads);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer incrementalRelexThreshold;
        public Boolean reportUnresolvedReferences;
        public Integer analysisThreads;
    }
}
