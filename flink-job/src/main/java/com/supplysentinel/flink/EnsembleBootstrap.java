package com.supplysentinel.flink;

import com.supplysentinel.core.config.EnsembleConfig;
import com.supplysentinel.core.config.EnsembleConfigLoader;
import com.supplysentinel.core.ensemble.AnomalyEnsemble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Builds ensembles for the job and the trainer from the configured paths.
 */
final class EnsembleBootstrap {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleBootstrap.class);

    private EnsembleBootstrap() {
        // utility class, not instantiable
    }

    /**
     * @param configPath explicit YAML path, or blank for the loader's default
     *                   resolution
     */
    static EnsembleConfig loadConfig(String configPath) {
        if (configPath != null && !configPath.isBlank()) {
            return EnsembleConfigLoader.fromFile(configPath);
        }
        return EnsembleConfigLoader.load();
    }

    /**
     * Build the configured ensemble and restore a trained bundle into it.
     *
     * @throws IllegalStateException    if no bundle path is configured
     * @throws IllegalArgumentException if the bundle does not match the
     *                                  configured roster
     */
    static AnomalyEnsemble loadFitted(String configPath, String bundlePath) {
        if (bundlePath == null || bundlePath.isBlank()) {
            throw new IllegalStateException(
                    "No trained ensemble bundle configured; set ENSEMBLE_BUNDLE_PATH "
                            + "(train one with EnsembleTrainer)");
        }
        AnomalyEnsemble ensemble = AnomalyEnsemble.fromConfig(loadConfig(configPath));
        try {
            ensemble.load(Path.of(bundlePath));
        } catch (RuntimeException e) {
            ensemble.close();
            throw e;
        }
        LOG.info("Loaded trained ensemble from {}: {}", bundlePath, ensemble);
        return ensemble;
    }
}
