package com.polereduction.runner;

import java.util.Locale;
import java.util.Objects;

/**
 * Typed, immutable configuration of a single profile run.
 *
 * <p>
 * Values are resolved from environment variables with the defaults of the
 * survey the tool was first written for (10 m spacing, inclination 42.3°,
 * declination 0.9719°, an east-bearing profile).
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for command-line runs, or the
 * {@link Builder} for programmatic / test scenarios. The builder validates
 * inputs at {@link Builder#build()} time. Field geometry and spacing are
 * checked again by the pipeline itself.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunnerConfig {

    public static final String DEFAULT_RESULT_COLUMN = "RTP_Processed";

    // ---------------------------------------------------------------
    // Files
    // ---------------------------------------------------------------
    private final String inputPath;
    private final String outputPath;
    private final String settingsPath;

    // ---------------------------------------------------------------
    // Columns
    // ---------------------------------------------------------------
    private final String distanceColumn;
    private final String anomalyColumn;
    private final String resultColumn;

    // ---------------------------------------------------------------
    // Survey geometry
    // ---------------------------------------------------------------
    private final double dx;
    private final double inclination;
    private final double declination;
    private final double azimuth;

    // ---------------------------------------------------------------
    // Post-processing
    // ---------------------------------------------------------------
    private final boolean mirror;

    private RunnerConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.settingsPath = b.settingsPath;
        this.distanceColumn = b.distanceColumn;
        this.anomalyColumn = b.anomalyColumn;
        this.resultColumn = b.resultColumn;
        this.dx = b.dx;
        this.inclination = b.inclination;
        this.declination = b.declination;
        this.azimuth = b.azimuth;
        this.mirror = b.mirror;
    }

    // ---------------------------------------------------------------
    // Factory, resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link RunnerConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is missing or out
     *                                  of range
     */
    public static RunnerConfig fromEnvironment() {
        try {
            return new Builder()
                    .inputPath(env("RTP_INPUT", null))
                    .outputPath(env("RTP_OUTPUT", null))
                    .settingsPath(env("RTP_SETTINGS_PATH", ""))
                    .distanceColumn(env("RTP_DISTANCE_COLUMN", null))
                    .anomalyColumn(env("RTP_ANOMALY_COLUMN", null))
                    .resultColumn(env("RTP_RESULT_COLUMN", DEFAULT_RESULT_COLUMN))
                    .dx(parseDoubleEnv("RTP_DX", "10.0"))
                    .inclination(parseDoubleEnv("RTP_INCLINATION", "42.3"))
                    .declination(parseDoubleEnv("RTP_DECLINATION", "0.9719"))
                    .azimuth(parseDoubleEnv("RTP_AZIMUTH", "90.0"))
                    .mirror(parseBooleanEnv("RTP_MIRROR", "true"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputPath() {
        return inputPath;
    }

    /**
     * @return the output path; defaults to the input path with an
     *         {@code _rtp} suffix before the extension
     */
    public String getOutputPath() {
        return outputPath;
    }

    /** @return settings file path, or an empty string for automatic resolution */
    public String getSettingsPath() {
        return settingsPath;
    }

    /** @return the distance column, or {@code null} to detect it from the headers */
    public String getDistanceColumn() {
        return distanceColumn;
    }

    /** @return the anomaly column, or {@code null} to detect it from the headers */
    public String getAnomalyColumn() {
        return anomalyColumn;
    }

    public String getResultColumn() {
        return resultColumn;
    }

    public double getDx() {
        return dx;
    }

    public double getInclination() {
        return inclination;
    }

    public double getDeclination() {
        return declination;
    }

    public double getAzimuth() {
        return azimuth;
    }

    public boolean isMirror() {
        return mirror;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunnerConfig}.
     *
     * <p>
     * The {@link #build()} method requires an input path and a non-blank
     * result column, rejects a non-positive spacing, and derives the output
     * path when none is given.
     * </p>
     */
    public static class Builder {
        private String inputPath;
        private String outputPath;
        private String settingsPath = "";
        private String distanceColumn;
        private String anomalyColumn;
        private String resultColumn = DEFAULT_RESULT_COLUMN;
        private double dx = 10.0;
        private double inclination = 42.3;
        private double declination = 0.9719;
        private double azimuth = 90.0;
        private boolean mirror = true;

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder settingsPath(String v) {
            this.settingsPath = v;
            return this;
        }

        public Builder distanceColumn(String v) {
            this.distanceColumn = v;
            return this;
        }

        public Builder anomalyColumn(String v) {
            this.anomalyColumn = v;
            return this;
        }

        public Builder resultColumn(String v) {
            this.resultColumn = v;
            return this;
        }

        public Builder dx(double v) {
            this.dx = v;
            return this;
        }

        public Builder inclination(double v) {
            this.inclination = v;
            return this;
        }

        public Builder declination(double v) {
            this.declination = v;
            return this;
        }

        public Builder azimuth(double v) {
            this.azimuth = v;
            return this;
        }

        public Builder mirror(boolean v) {
            this.mirror = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RunnerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RunnerConfig build() {
            requireNonBlank(inputPath, "inputPath");
            requireNonBlank(resultColumn, "resultColumn");

            if (!(dx > 0.0) || Double.isInfinite(dx)) {
                throw new IllegalArgumentException("dx must be > 0, got: " + dx);
            }
            if (distanceColumn != null && distanceColumn.isBlank()) {
                distanceColumn = null;
            }
            if (anomalyColumn != null && anomalyColumn.isBlank()) {
                anomalyColumn = null;
            }
            if (outputPath == null || outputPath.isBlank()) {
                outputPath = defaultOutputPath(inputPath);
            }
            settingsPath = Objects.requireNonNullElse(settingsPath, "");

            return new RunnerConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static String defaultOutputPath(String inputPath) {
        int slash = Math.max(inputPath.lastIndexOf('/'), inputPath.lastIndexOf('\\'));
        int dot = inputPath.lastIndexOf('.');
        if (dot > slash + 1) {
            return inputPath.substring(0, dot) + "_rtp" + inputPath.substring(dot);
        }
        return inputPath + "_rtp.csv";
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static double parseDoubleEnv(String name, String defaultValue) {
        return Double.parseDouble(env(name, defaultValue));
    }

    private static boolean parseBooleanEnv(String name, String defaultValue) {
        String value = env(name, defaultValue).trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new IllegalArgumentException(
                    name + " must be true or false, got: " + value);
        };
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", distanceColumn='" + distanceColumn + '\'' +
                ", anomalyColumn='" + anomalyColumn + '\'' +
                ", resultColumn='" + resultColumn + '\'' +
                ", dx=" + dx +
                ", inclination=" + inclination +
                ", declination=" + declination +
                ", azimuth=" + azimuth +
                ", mirror=" + mirror +
                '}';
    }
}
