package org.eds.physics;

import com.fasterxml.jackson.core.type.TypeReference;
import org.eds.error.InvalidElementException;
import org.eds.io.TableSource;
import org.eds.io.json.JsonTableSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Characteristic line tables, one instance per database name.
 * Databases are classpath resources; {@link #named(String)} interns them so each is parsed once.
 */
public final class XrayLineDatabase {

    private static final ConcurrentMap<String, XrayLineDatabase> POOL = new ConcurrentHashMap<>();

    private final String name;
    private final Map<String, ElementLines> bySymbol;

    public XrayLineDatabase(TableSource<List<ElementLines>> source) {
        Objects.requireNonNull(source, "source must not be null");
        Map<String, ElementLines> m = new HashMap<>();
        for (ElementLines e : source.load()) {
            if (m.putIfAbsent(e.symbol(), e) != null) {
                throw new IllegalArgumentException("Duplicate element in x-ray database '" + source.name() + "': " + e.symbol());
            }
        }
        this.name = source.name();
        this.bySymbol = Map.copyOf(m);
    }

    public static XrayLineDatabase named(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("x-ray database name must be non-empty");
        }
        return POOL.computeIfAbsent(resource, r ->
                new XrayLineDatabase(JsonTableSource.classpath(r, new TypeReference<List<ElementLines>>() { })));
    }

    public String name() {
        return name;
    }

    public Optional<ElementLines> find(String symbol) {
        return Optional.ofNullable(bySymbol.get(symbol));
    }

    /**
     * @throws InvalidElementException if the database has no lines for the element
     */
    public ElementLines require(String symbol) {
        ElementLines lines = bySymbol.get(symbol);
        if (lines == null || lines.lines().isEmpty()) {
            throw new InvalidElementException("No x-ray lines for element " + symbol + " in database " + name);
        }
        return lines;
    }
}
