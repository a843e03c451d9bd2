package com.polereduction.runner;

import com.polereduction.core.config.ReductionSettings;
import com.polereduction.core.config.SettingsLoader;
import com.polereduction.core.exceptions.ReductionException;
import com.polereduction.core.exceptions.ValidationException;
import com.polereduction.core.filter.ReductionToPole;
import com.polereduction.core.model.FieldGeometry;
import com.polereduction.core.model.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Command-line entry point: reduce one CSV profile to the pole.
 *
 * <h3>Flow</h3>
 *
 * <pre>
 *   RunnerConfig (environment)
 *     → ReductionSettings (YAML)
 *     → ProfileCsvReader → column selection → Profile
 *     → ReductionWorker (background thread, progress)
 *     → ProfileCsvWriter (input columns + result column)
 * </pre>
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@code 0} – success</li>
 * <li>{@code 1} – configuration or I/O failure</li>
 * <li>{@code 2} – invalid profile or degenerate field geometry</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class PoleReductionRunner {

    private static final Logger LOG = LoggerFactory.getLogger(PoleReductionRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG_ERROR = 1;
    static final int EXIT_REDUCTION_ERROR = 2;

    private PoleReductionRunner() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        int status;
        try {
            status = run(RunnerConfig.fromEnvironment());
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Invalid runner configuration: {}", e.getMessage());
            status = EXIT_CONFIG_ERROR;
        }
        System.exit(status);
    }

    /**
     * Execute one reduction end to end.
     *
     * @param config resolved runner configuration
     * @return process exit code
     */
    static int run(RunnerConfig config) {
        LOG.info("Starting pole reduction with config: {}", config);
        try {
            // 1. Pipeline settings
            ReductionSettings settings = config.getSettingsPath().isEmpty()
                    ? SettingsLoader.load()
                    : SettingsLoader.fromFile(config.getSettingsPath());
            ReductionToPole reduction = new ReductionToPole(settings);

            // 2. Input
            ProfileTable table = new ProfileCsvReader().read(Path.of(config.getInputPath()));
            Profile profile = selectProfile(table, config);
            FieldGeometry geometry = FieldGeometry.of(
                    config.getInclination(), config.getDeclination(), config.getAzimuth());

            // 3. Reduce
            double[] result;
            try (ReductionWorker worker = new ReductionWorker(reduction)) {
                result = worker.submit(profile, config.getDx(), geometry, config.isMirror(),
                        percent -> LOG.info("Progress: {}%", percent)).get();
            }

            // 4. Output
            new ProfileCsvWriter().write(Path.of(config.getOutputPath()), table,
                    config.getResultColumn(), result);
            LOG.info("Reduced {} samples with {}; result column '{}' written to {}",
                    result.length, geometry, config.getResultColumn(), config.getOutputPath());
            return EXIT_OK;
        } catch (ReductionException e) {
            LOG.error("Reduction failed: {}", e.getMessage());
            return EXIT_REDUCTION_ERROR;
        } catch (ExecutionException | CompletionException e) {
            return handleAsyncFailure(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Interrupted while waiting for the reduction");
            return EXIT_CONFIG_ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Pole reduction aborted: {}", e.getMessage(), e);
            return EXIT_CONFIG_ERROR;
        }
    }

    /**
     * Pick the distance and anomaly columns, configured or detected.
     *
     * @throws ValidationException if a column cannot be determined, the two
     *                             columns coincide, or the profile is invalid
     */
    static Profile selectProfile(ProfileTable table, RunnerConfig config) {
        String distanceColumn = config.getDistanceColumn() != null
                ? config.getDistanceColumn()
                : table.detectDistanceColumn().orElseThrow(() -> new ValidationException(
                        "no distance column found in " + table.getHeaders()));
        String anomalyColumn = config.getAnomalyColumn() != null
                ? config.getAnomalyColumn()
                : table.detectAnomalyColumn().orElseThrow(() -> new ValidationException(
                        "no anomaly column found in " + table.getHeaders()));
        if (distanceColumn.equals(anomalyColumn)) {
            throw new ValidationException("distance and anomaly columns must differ, both are '"
                    + distanceColumn + "'");
        }
        LOG.info("Using distance column '{}' and anomaly column '{}'", distanceColumn, anomalyColumn);
        return Profile.of(table.column(distanceColumn), table.column(anomalyColumn));
    }

    private static int handleAsyncFailure(Throwable cause) {
        if (cause instanceof ReductionException e) {
            LOG.error("Reduction failed: {}", e.getMessage());
            return EXIT_REDUCTION_ERROR;
        }
        LOG.error("Reduction worker failed: {}", String.valueOf(cause), cause);
        return EXIT_CONFIG_ERROR;
    }
}
