package com.supplysentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link EnsembleConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}, by default
 * {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing, so a misconfigured
 * roster fails at startup rather than at the first fit.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ENSEMBLE_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "ensemble.yml";

    private EnsembleConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration from {@value #ENV_CONFIG_PATH} if it points to an
     * existing file, otherwise from {@value #DEFAULT_RESOURCE} on the
     * classpath.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static EnsembleConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    static EnsembleConfig load(String envPath) {
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading ensemble configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading ensemble configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static EnsembleConfig fromFile(String path) {
        Objects.requireNonNull(path, "Ensemble config path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Ensemble config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ensemble config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static EnsembleConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = EnsembleConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EnsembleConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EnsembleConfig.class, options));
        EnsembleConfig config = yaml.load(is);
        if (config == null) {
            throw new IllegalStateException("Ensemble configuration is empty");
        }
        // an ensemble without detectors cannot do anything; validate() rejects it
        config.validate();

        LOG.info("Loaded {} ensemble with {} detector(s)", config.getPolicy(), config.getDetectors().size());
        return config;
    }
}
