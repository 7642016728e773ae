package org.eds.physics;

import org.eds.element.PeriodicTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Specimen composition as mass fractions summing to one.
 */
public final class Composition {

    private final Map<String, Double> massFractions;

    private Composition(Map<String, Double> massFractions) {
        this.massFractions = Collections.unmodifiableMap(massFractions);
    }

    /**
     * Builds a composition from atom amounts (any positive scale); converts to mass
     * fractions with the atomic weights of the periodic table.
     *
     * @throws IllegalArgumentException if no amount is positive
     */
    public static Composition fromAtomic(Map<String, Double> atomAmounts, PeriodicTable table) {
        Objects.requireNonNull(atomAmounts, "atomAmounts must not be null");
        Objects.requireNonNull(table, "table must not be null");

        Map<String, Double> mass = new LinkedHashMap<>();
        double total = 0.0;
        for (Map.Entry<String, Double> e : atomAmounts.entrySet()) {
            double amount = e.getValue();
            if (!(amount > 0.0)) continue;
            double m = amount * table.requireSymbol(e.getKey()).weight();
            mass.merge(e.getKey(), m, Double::sum);
            total += m;
        }
        if (total == 0.0) {
            throw new IllegalArgumentException("Composition needs at least one positive amount");
        }
        for (Map.Entry<String, Double> e : mass.entrySet()) {
            e.setValue(e.getValue() / total);
        }
        return new Composition(mass);
    }

    /**
     * Equal atom amounts of every listed element.
     */
    public static Composition equiatomic(Iterable<String> symbols, PeriodicTable table) {
        Map<String, Double> atoms = new LinkedHashMap<>();
        for (String s : symbols) atoms.put(s, 1.0);
        return fromAtomic(atoms, table);
    }

    public Map<String, Double> massFractions() {
        return massFractions;
    }

    @Override
    public String toString() {
        return "Composition" + massFractions;
    }
}
