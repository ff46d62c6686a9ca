package com.vtb.leastprivilege.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;

import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Конфигурация анализатора из YAML файла
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyzerConfig {

    public static final String DEFAULT_RESOURCE = "analyzer-config.yaml";

    private Collector collector;
    private Scheduler scheduler;
    private LogAnalytics logAnalytics;

    private static AnalyzerConfig instance;

    /**
     * Загрузить конфигурацию из classpath (один раз на процесс)
     */
    public static synchronized AnalyzerConfig load() {
        if (instance == null) {
            instance = load(DEFAULT_RESOURCE);
        }
        return instance;
    }

    /**
     * Загрузить конфигурацию из указанного ресурса classpath
     */
    public static AnalyzerConfig load(String resource) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = AnalyzerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " не найден в classpath");
            }
            AnalyzerConfig config = mapper.readValue(is, AnalyzerConfig.class);
            config.ensureDefaults();
            return config;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации " + resource + ": " + e.getMessage(), e);
        }
    }

    /**
     * Конфигурация только со значениями по умолчанию
     */
    public static AnalyzerConfig defaults() {
        AnalyzerConfig config = new AnalyzerConfig();
        config.ensureDefaults();
        return config;
    }

    public void ensureDefaults() {
        if (collector == null) {
            collector = new Collector();
        }
        collector.ensureDefaults();
        if (scheduler == null) {
            scheduler = new Scheduler();
        }
        scheduler.ensureDefaults();
        if (logAnalytics == null) {
            logAnalytics = new LogAnalytics();
        }
        logAnalytics.ensureDefaults();
    }

    @Data
    public static class Collector {
        private static final int DEFAULT_LOOKBACK_DAYS = 30;
        private static final int DEFAULT_MAX_ENTRIES = 100_000;
        private static final int DEFAULT_MIN_WINDOW_HOURS = 24;

        private Integer lookbackDays;
        private Integer maxEntries;
        private Integer minWindowHours;

        void ensureDefaults() {
            if (lookbackDays == null || lookbackDays <= 0) {
                lookbackDays = DEFAULT_LOOKBACK_DAYS;
            }
            if (maxEntries == null || maxEntries <= 0) {
                maxEntries = DEFAULT_MAX_ENTRIES;
            }
            if (minWindowHours == null || minWindowHours <= 0) {
                minWindowHours = DEFAULT_MIN_WINDOW_HOURS;
            }
        }

        public Duration minWindow() {
            return Duration.ofHours(minWindowHours);
        }
    }

    @Data
    public static class Scheduler {
        private static final int DEFAULT_WORKERS = 10;
        private static final int DEFAULT_STALL_TIMEOUT_MINUTES = 5;

        private Integer workers;
        private Integer stallTimeoutMinutes;

        void ensureDefaults() {
            if (workers == null || workers <= 0) {
                workers = DEFAULT_WORKERS;
            }
            if (stallTimeoutMinutes == null || stallTimeoutMinutes <= 0) {
                stallTimeoutMinutes = DEFAULT_STALL_TIMEOUT_MINUTES;
            }
        }

        public Duration stallTimeout() {
            return Duration.ofMinutes(stallTimeoutMinutes);
        }
    }

    @Data
    public static class LogAnalytics {
        private static final String DEFAULT_ENDPOINT = "https://api.loganalytics.io";
        private static final String DEFAULT_TABLE = "MicrosoftGraphActivityLogs";
        private static final int DEFAULT_TIMEOUT_SEC = 300;
        private static final List<String> DEFAULT_SIZE_CODES =
            List.of("ResponseSizeError", "E_QUERY_RESULT_SET_TOO_LARGE");

        private String endpoint;
        private String activityTable;
        private Integer timeoutSec;
        private List<String> sizeExceededCodes;

        void ensureDefaults() {
            if (endpoint == null || endpoint.isBlank()) {
                endpoint = DEFAULT_ENDPOINT;
            }
            if (activityTable == null || activityTable.isBlank()) {
                activityTable = DEFAULT_TABLE;
            }
            if (timeoutSec == null || timeoutSec <= 0) {
                timeoutSec = DEFAULT_TIMEOUT_SEC;
            }
            if (sizeExceededCodes == null || sizeExceededCodes.isEmpty()) {
                sizeExceededCodes = new ArrayList<>(DEFAULT_SIZE_CODES);
            } else {
                sizeExceededCodes = new ArrayList<>(sizeExceededCodes);
            }
        }
    }
}
