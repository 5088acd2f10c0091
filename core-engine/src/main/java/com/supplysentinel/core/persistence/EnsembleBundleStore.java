package com.supplysentinel.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Reads and writes {@link EnsembleBundle}s as JSON files.
 *
 * <p>
 * Writes go to a sibling temporary file that is then moved over the target,
 * so a reader never sees a half-written bundle. Doubles are written in their
 * shortest round-trip representation, which makes a reloaded ensemble score
 * bit-identically.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleBundleStore {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleBundleStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private EnsembleBundleStore() {
        // utility class, not instantiable
    }

    /**
     * Write a bundle, replacing any file at {@code path}.
     *
     * @param path   target file; parent directories are created
     * @param bundle the bundle
     * @throws IllegalStateException if the file cannot be written
     */
    public static void write(Path path, EnsembleBundle bundle) {
        Objects.requireNonNull(path, "Bundle path must not be null");
        Objects.requireNonNull(bundle, "Bundle must not be null");
        Path target = path.toAbsolutePath();
        Path tmp = null;
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            tmp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                MAPPER.writeValue(out, bundle);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            tmp = null;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write ensemble bundle: " + path, e);
        } finally {
            if (tmp != null) {
                deleteQuietly(tmp);
            }
        }
        LOG.info("Saved ensemble bundle with {} detector(s) to {}", bundle.getDetectors().size(), target);
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary bundle file {}: {}", tmp, e.getMessage());
        }
    }

    /**
     * Read a bundle.
     *
     * @param path bundle file
     * @return the parsed bundle
     * @throws IllegalArgumentException if the file does not exist or is not a
     *                                  valid bundle
     * @throws IllegalStateException    if reading fails
     */
    public static EnsembleBundle read(Path path) {
        Objects.requireNonNull(path, "Bundle path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            EnsembleBundle bundle = MAPPER.readValue(in, EnsembleBundle.class);
            if (bundle == null) {
                throw new IllegalArgumentException("Ensemble bundle is empty: " + path);
            }
            if (bundle.getFormatVersion() != EnsembleBundle.FORMAT_VERSION) {
                throw new IllegalArgumentException(String.format(
                        "Unsupported bundle format version %d in %s (expected %d)",
                        bundle.getFormatVersion(), path, EnsembleBundle.FORMAT_VERSION));
            }
            LOG.info("Read ensemble bundle {} from {}", bundle, path);
            return bundle;
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Ensemble bundle not found: " + path, e);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed ensemble bundle: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ensemble bundle: " + path, e);
        }
    }
}
