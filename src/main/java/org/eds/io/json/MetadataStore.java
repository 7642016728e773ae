package org.eds.io.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.eds.metadata.DatasetMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes {@link DatasetMetadata} as JSON.
 *
 * Absent sections are omitted on write and come back as {@code null} on read, so a
 * save/load cycle restores exactly what was stored.
 */
public final class MetadataStore {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataStore.class);

    private final ObjectMapper mapper;

    public MetadataStore() {
        this.mapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public DatasetMetadata load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            DatasetMetadata md = read(in);
            LOG.info("Loaded dataset metadata from {}", path);
            return md;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read metadata from " + path, e);
        }
    }

    public void save(DatasetMetadata metadata, Path path) {
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(path, "path must not be null");
        try (OutputStream out = Files.newOutputStream(path)) {
            mapper.writeValue(out, metadata);
            LOG.info("Saved dataset metadata to {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write metadata to " + path, e);
        }
    }

    public DatasetMetadata read(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in must not be null");
        DatasetMetadata md = mapper.readValue(in, DatasetMetadata.class);
        if (md == null) {
            throw new IllegalArgumentException("Metadata JSON is empty");
        }
        return md;
    }

    public String toJson(DatasetMetadata metadata) {
        try {
            return mapper.writeValueAsString(metadata);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialise metadata", e);
        }
    }
}
