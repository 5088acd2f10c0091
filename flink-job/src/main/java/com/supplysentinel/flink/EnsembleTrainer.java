package com.supplysentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplysentinel.core.ensemble.AnomalyEnsemble;
import com.supplysentinel.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Offline entry point that fits the configured ensemble on historical
 * telemetry and writes the bundle the streaming job loads.
 *
 * <p>
 * Usage: {@code EnsembleTrainer <telemetry.jsonl> [bundle.json]}. The input
 * holds one JSON telemetry record per line; records that carry a
 * {@code label} field ({@code 1} normal, {@code -1} anomalous) enable weight
 * recalibration and threshold search. The bundle path defaults to
 * {@code ENSEMBLE_BUNDLE_PATH}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleTrainer.class);

    private EnsembleTrainer() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        if (args.length < 1 || args.length > 2) {
            throw new IllegalArgumentException("Usage: EnsembleTrainer <telemetry.jsonl> [bundle.json]");
        }
        JobConfig config = JobConfig.fromEnvironment();
        String bundlePath = args.length == 2 ? args[1] : config.getEnsembleBundlePath();
        if (bundlePath == null || bundlePath.isBlank()) {
            throw new IllegalArgumentException("No bundle path given and ENSEMBLE_BUNDLE_PATH is not set");
        }
        train(config, Path.of(args[0]), Path.of(bundlePath)).close();
    }

    /**
     * Fit the configured ensemble on a JSON-lines file and save it.
     *
     * @return the fitted ensemble; the caller closes it
     */
    static AnomalyEnsemble train(JobConfig config, Path input, Path bundle) {
        TrainingSet data = read(input, config.getFeatureFields());
        if (data.rows.isEmpty()) {
            throw new IllegalArgumentException("No usable training records in " + input);
        }
        double[][] matrix = data.rows.toArray(new double[0][]);
        int[] labels = data.labelled() ? data.labels.stream().mapToInt(Integer::intValue).toArray() : null;
        if (!data.labelled() && !data.labels.isEmpty()) {
            LOG.warn("Only {} of {} record(s) are labelled; fitting unsupervised",
                    data.labels.size(), data.rows.size());
        }

        AnomalyEnsemble ensemble = AnomalyEnsemble.fromConfig(
                EnsembleBootstrap.loadConfig(config.getEnsembleConfigPath()));
        try {
            ensemble.fit(matrix, labels);
            ensemble.save(bundle);
        } catch (RuntimeException e) {
            ensemble.close();
            throw e;
        }
        LOG.info("Trained {} ensemble on {} record(s) ({} skipped), weights={}, threshold={}, saved to {}",
                ensemble.policy(), matrix.length, data.skipped, ensemble.weights(), ensemble.threshold(), bundle);
        return ensemble;
    }

    static TrainingSet read(Path input, List<String> featureFields) {
        ObjectMapper mapper = TelemetryJson.newMapper();
        TrainingSet data = new TrainingSet();
        try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                TelemetryEvent event;
                try {
                    event = mapper.readValue(line, TelemetryEvent.class);
                } catch (IOException e) {
                    throw new IllegalArgumentException(
                            "Malformed telemetry record at " + input + ":" + lineNo, e);
                }
                Optional<double[]> row = event.toFeatureVector(featureFields);
                if (row.isEmpty()) {
                    data.skipped++;
                    continue;
                }
                data.rows.add(row.get());
                event.label().ifPresent(data.labels::add);
            }
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Training file not found: " + input, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read training file: " + input, e);
        }
        return data;
    }

    static final class TrainingSet {
        final List<double[]> rows = new ArrayList<>();
        final List<Integer> labels = new ArrayList<>();
        int skipped;

        boolean labelled() {
            return !rows.isEmpty() && labels.size() == rows.size();
        }
    }
}
