package org.eds.element;

import com.fasterxml.jackson.core.type.TypeReference;
import org.eds.error.InvalidElementException;
import org.eds.io.TableSource;
import org.eds.io.json.JsonTableSource;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Symbol / atomic-number lookup backed by a JSON table.
 */
public final class PeriodicTable {

    public static final String DEFAULT_RESOURCE = "periodic_table.json";

    private static volatile PeriodicTable standard;

    private final Map<String, ChemicalElement> bySymbol;
    private final Map<Integer, ChemicalElement> byZ;

    public PeriodicTable(TableSource<List<ChemicalElement>> source) {
        Objects.requireNonNull(source, "source must not be null");
        Map<String, ChemicalElement> s = new HashMap<>();
        Map<Integer, ChemicalElement> z = new HashMap<>();
        for (ChemicalElement e : source.load()) {
            if (s.putIfAbsent(e.symbol(), e) != null || z.putIfAbsent(e.z(), e) != null) {
                throw new IllegalArgumentException("Duplicate element in table '" + source.name() + "': " + e.symbol());
            }
        }
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Periodic table '" + source.name() + "' is empty");
        }
        this.bySymbol = Collections.unmodifiableMap(s);
        this.byZ = Collections.unmodifiableMap(z);
    }

    /**
     * The bundled table, loaded once.
     */
    public static PeriodicTable standard() {
        PeriodicTable local = standard;
        if (local == null) {
            synchronized (PeriodicTable.class) {
                if (standard == null) {
                    standard = new PeriodicTable(JsonTableSource.classpath(DEFAULT_RESOURCE, new TypeReference<List<ChemicalElement>>() { }));
                }
                local = standard;
            }
        }
        return local;
    }

    public Optional<ChemicalElement> findSymbol(String symbol) {
        return Optional.ofNullable(bySymbol.get(symbol));
    }

    public Optional<ChemicalElement> findZ(int z) {
        return Optional.ofNullable(byZ.get(z));
    }

    public boolean isSymbol(String symbol) {
        return bySymbol.containsKey(symbol);
    }

    public ChemicalElement requireSymbol(String symbol) {
        return findSymbol(symbol).orElseThrow(() ->
                new InvalidElementException("Unknown element symbol: " + symbol));
    }

    public ChemicalElement requireZ(int z) {
        return findZ(z).orElseThrow(() ->
                new InvalidElementException("Unknown atomic number: " + z));
    }
}
