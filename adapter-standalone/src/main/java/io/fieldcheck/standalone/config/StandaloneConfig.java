package io.fieldcheck.standalone.config;

import java.util.Locale;
import java.util.Objects;

/**
 * Root configuration for the standalone validator.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances
 * with the builder pattern, or {@link #DEFAULT} when no configuration file
 * is in play.
 *
 * @param loggingFormat console log output: text pattern or JSON events
 * @param loggingLevel  root log level (TRACE, DEBUG, INFO, WARN, ERROR, OFF)
 * @param reportFormat  rendering of the validation report on stdout
 * @param failFast      stop each field's rule chain at its first error
 */
public record StandaloneConfig(
        LogFormat loggingFormat, String loggingLevel, ReportFormat reportFormat, boolean failFast) {

    /** The configuration used when no file is given. */
    public static final StandaloneConfig DEFAULT = builder().build();

    /** Console log output format. */
    public enum LogFormat {
        TEXT,
        JSON;

        /**
         * Parses a configuration value, case-insensitively.
         *
         * @throws ConfigLoadException if the value is not {@code text} or {@code json}
         */
        public static LogFormat parse(String value) {
            return parseEnum(LogFormat.class, "logging.format", value);
        }
    }

    /** Validation report output format. */
    public enum ReportFormat {
        JSON,
        TEXT;

        /**
         * Parses a configuration value, case-insensitively.
         *
         * @throws ConfigLoadException if the value is not {@code json} or {@code text}
         */
        public static ReportFormat parse(String value) {
            return parseEnum(ReportFormat.class, "report.format", value);
        }
    }

    public StandaloneConfig {
        Objects.requireNonNull(loggingFormat, "loggingFormat must not be null");
        Objects.requireNonNull(loggingLevel, "loggingLevel must not be null");
        Objects.requireNonNull(reportFormat, "reportFormat must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (E constant : type.getEnumConstants()) {
                if (constant.name().equals(normalized)) {
                    return constant;
                }
            }
        }
        throw new ConfigLoadException("Invalid value for " + key + ": '" + value + "'");
    }

    /** Builder with the documented defaults. */
    public static final class Builder {
        private LogFormat loggingFormat = LogFormat.TEXT;
        private String loggingLevel = "INFO";
        private ReportFormat reportFormat = ReportFormat.JSON;
        private boolean failFast;

        Builder() {}

        public Builder loggingFormat(LogFormat loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder reportFormat(ReportFormat reportFormat) {
            this.reportFormat = reportFormat;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public StandaloneConfig build() {
            return new StandaloneConfig(loggingFormat, loggingLevel, reportFormat, failFast);
        }
    }
}
