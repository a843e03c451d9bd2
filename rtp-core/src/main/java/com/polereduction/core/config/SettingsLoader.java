package com.polereduction.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@link ReductionSettings} from YAML.
 *
 * <p>
 * {@link #load()} looks at {@value #ENV_SETTINGS_PATH} first, then at the
 * bundled {@value #DEFAULT_RESOURCE}, and settles for
 * {@link ReductionSettings#defaults()} when neither is there. An empty
 * document also means defaults. Whatever is read goes through
 * {@link ReductionSettings#validate()} before it is returned.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    /** Points at a settings file outside the classpath. */
    public static final String ENV_SETTINGS_PATH = "RTP_SETTINGS_PATH";

    /** Bundled settings document. */
    public static final String DEFAULT_RESOURCE = "rtp-settings.yml";

    private SettingsLoader() {
        // utility class, not instantiable
    }

    /**
     * @return settings from the environment path, the bundled resource or the
     *         built-in defaults, in that order of preference
     * @throws IllegalStateException if the chosen document is malformed or
     *                               holds out-of-range values
     */
    public static ReductionSettings load() {
        String envPath = System.getenv(ENV_SETTINGS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Reduction settings from {}={}", ENV_SETTINGS_PATH, envPath);
            return fromFile(envPath);
        }
        if (SettingsLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.info("No {} bundled, using default reduction settings", DEFAULT_RESOURCE);
            return ReductionSettings.defaults();
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file
     * @return validated settings
     * @throws IllegalArgumentException if there is no such file
     * @throws IllegalStateException    if the file cannot be read, parsed or
     *                                  validated
     */
    public static ReductionSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings path must not be null");
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            return parse(in, path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read settings file " + path, e);
        }
    }

    /**
     * @param resource resource name relative to the classpath root
     * @return validated settings
     * @throws IllegalArgumentException if the resource is not on the classpath
     * @throws IllegalStateException    if the resource cannot be read, parsed
     *                                  or validated
     */
    public static ReductionSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Settings resource must not be null");
        InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Settings resource not found: " + resource);
        }
        try (in) {
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read settings resource " + resource, e);
        }
    }

    private static ReductionSettings parse(InputStream in, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(ReductionSettings.class, options));

        ReductionSettings settings;
        try {
            settings = yaml.load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed reduction settings in " + source + ": "
                    + e.getMessage(), e);
        }
        if (settings == null) {
            LOG.warn("{} is empty, using default reduction settings", source);
            settings = ReductionSettings.defaults();
        }
        settings.validate();

        LOG.info("Reduction settings from {}: {}", source, settings);
        return settings;
    }
}
