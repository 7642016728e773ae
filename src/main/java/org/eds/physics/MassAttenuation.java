package org.eds.physics;

import org.eds.element.ChemicalElement;
import org.eds.element.PeriodicTable;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Kramers-type mass attenuation coefficients in cm2/g:
 * {@code mu/rho = C * Z^4 / (A * E^3)}, divided by the edge jump ratio of every
 * shell whose edge lies above E.
 */
public final class MassAttenuation {

    static final double KRAMERS_CONSTANT = 19.0;
    static final double K_JUMP = 8.0;
    static final double L_JUMP = 3.0;
    static final double M_JUMP = 2.0;

    private final PeriodicTable table;
    private final XrayLineDatabase lines;

    public MassAttenuation(PeriodicTable table, XrayLineDatabase lines) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.lines = Objects.requireNonNull(lines, "lines must not be null");
    }

    /**
     * Mass attenuation of a pure element at {@code energy} keV.
     */
    public double of(String symbol, double energy) {
        if (!(energy > 0.0)) {
            throw new IllegalArgumentException("energy must be > 0, got " + energy);
        }
        ChemicalElement el = table.requireSymbol(symbol);
        double z4 = Math.pow(el.z(), 4);
        double mu = KRAMERS_CONSTANT * z4 / (el.weight() * energy * energy * energy);

        ElementLines edges = lines.find(symbol).orElse(null);
        if (edges != null) {
            mu /= jump(edges.edgeFor("K"), energy, K_JUMP);
            mu /= jump(edges.edgeFor("L"), energy, L_JUMP);
            mu /= jump(edges.edgeFor("M"), energy, M_JUMP);
        }
        return mu;
    }

    /**
     * Mass attenuation of a mixture: mass-fraction weighted sum.
     */
    public double of(Composition composition, double energy) {
        double mu = 0.0;
        for (Map.Entry<String, Double> e : composition.massFractions().entrySet()) {
            mu += e.getValue() * of(e.getKey(), energy);
        }
        return mu;
    }

    public PeriodicTable table() {
        return table;
    }

    private static double jump(OptionalDouble edge, double energy, double ratio) {
        return (edge.isPresent() && energy < edge.getAsDouble()) ? ratio : 1.0;
    }
}
