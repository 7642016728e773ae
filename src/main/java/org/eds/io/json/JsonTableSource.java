package org.eds.io.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eds.io.TableSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * JSON implementation of TableSource, bound to a Jackson type.
 *
 * The table is parsed on first {@link #load()} and cached for the lifetime of the source.
 */
public final class JsonTableSource<T> implements TableSource<T> {

    private static final Logger LOG = LoggerFactory.getLogger(JsonTableSource.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final String name;
    private final InputStreamSupplier streamSupplier;
    private final TypeReference<T> type;

    // Cached after first load
    private volatile T cached;

    private final Object lock = new Object();

    public JsonTableSource(String name, InputStreamSupplier streamSupplier, TypeReference<T> type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be non-empty");
        }
        this.name = name;
        this.streamSupplier = Objects.requireNonNull(streamSupplier, "streamSupplier must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    /**
     * A source reading the named resource from the classpath.
     */
    public static <T> JsonTableSource<T> classpath(String resource, TypeReference<T> type) {
        return new JsonTableSource<>(resource, () -> {
            InputStream in = JsonTableSource.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("Missing table resource: " + resource);
            }
            return in;
        }, type);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public T load() {
        T local = cached;
        if (local != null) {
            return local;
        }

        synchronized (lock) {
            if (cached != null) {
                return cached;
            }
            try (InputStream in = streamSupplier.open()) {
                T value = MAPPER.readValue(in, type);
                if (value == null) {
                    throw new IllegalArgumentException("Table '" + name + "' is empty");
                }
                LOG.debug("Loaded table {}", name);
                this.cached = value;
                return value;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read table '" + name + "'", e);
            }
        }
    }

    /**
     * Lets callers provide a file stream, a classpath resource stream, or anything else.
     */
    @FunctionalInterface
    public interface InputStreamSupplier {
        InputStream open() throws IOException;
    }
}
