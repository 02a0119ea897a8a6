package com.driftsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link DriftConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code from*} methods call {@link DriftConfig#validate()} after parsing
 * so that the application <strong>fails fast</strong> on an invalid
 * configuration rather than processing data with undefined thresholds.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DriftConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "DRIFT_CONFIG_PATH";

    /** Classpath resource used when no path is given. */
    public static final String DEFAULT_RESOURCE = "drift.yml";

    private DriftConfigLoader() {
        // utility class
    }

    /**
     * Load configuration using automatic resolution: {@code DRIFT_CONFIG_PATH}
     * when set and the file exists, {@code drift.yml} on the classpath
     * otherwise.
     *
     * @return parsed and validated configuration
     * @throws ConfigurationException if parsing or validation fails
     */
    public static DriftConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading drift configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading drift configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws ConfigurationException   if reading, parsing or validation fails
     */
    public static DriftConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Drift config file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read drift config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws ConfigurationException   if reading, parsing or validation fails
     */
    public static DriftConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DriftConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * @param yaml YAML document text; must not be {@code null}
     * @return parsed and validated configuration
     * @throws ConfigurationException if parsing or validation fails
     */
    public static DriftConfig fromString(String yaml) {
        Objects.requireNonNull(yaml, "YAML text must not be null");
        return parseAndValidate(new StringReader(yaml), "<inline>");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DriftConfig parseAndValidate(Object source, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DriftConfig.class, options));

        Object loaded;
        try {
            loaded = source instanceof Reader reader ? yaml.load(reader) : yaml.load((InputStream) source);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed drift configuration in " + origin + ": "
                    + e.getMessage(), e);
        }
        if (loaded == null) {
            throw new ConfigurationException("Drift configuration is empty: " + origin);
        }
        if (!(loaded instanceof DriftConfig config)) {
            throw new ConfigurationException("Unexpected YAML document in " + origin + ": "
                    + loaded.getClass().getSimpleName());
        }

        // Fail fast before any data is processed
        config.validate();

        LOG.info("Loaded drift configuration from {}: {} numeric, {} categorical feature(s), {} threshold(s)",
                origin, config.getNumericFeatures().size(), config.getCategoricalFeatures().size(),
                config.getThresholds().size());
        return config;
    }
}
