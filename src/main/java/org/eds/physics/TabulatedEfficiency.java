package org.eds.physics;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Detector efficiency read from a two-column text table (energy keV, efficiency),
 * linearly interpolated and held constant beyond the tabulated range.
 * Lines starting with {@code #} are comments.
 */
public final class TabulatedEfficiency implements DetectorEfficiency {

    private static final ConcurrentMap<String, TabulatedEfficiency> POOL = new ConcurrentHashMap<>();

    private final PolynomialSplineFunction curve;
    private final double minEnergy;
    private final double maxEnergy;

    public TabulatedEfficiency(double[] energies, double[] efficiencies) {
        if (energies == null || efficiencies == null) {
            throw new IllegalArgumentException("energies and efficiencies must not be null");
        }
        if (energies.length != efficiencies.length || energies.length < 2) {
            throw new IllegalArgumentException("efficiency table needs at least two (energy, efficiency) rows");
        }
        this.curve = new LinearInterpolator().interpolate(energies, efficiencies);
        this.minEnergy = energies[0];
        this.maxEnergy = energies[energies.length - 1];
    }

    /**
     * Loads (once) the named classpath table.
     */
    public static TabulatedEfficiency named(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("detector type must be non-empty");
        }
        return POOL.computeIfAbsent(resource, TabulatedEfficiency::loadResource);
    }

    @Override
    public double at(double energy) {
        double e = Math.max(minEnergy, Math.min(maxEnergy, energy));
        return curve.value(e);
    }

    private static TabulatedEfficiency loadResource(String resource) {
        InputStream stream = TabulatedEfficiency.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new IllegalArgumentException("Missing detector efficiency table: " + resource);
        }
        List<double[]> rows = new ArrayList<>();
        try (BufferedReader r = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                line = line.strip();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("[\\s,;]+");
                if (parts.length < 2) {
                    throw new IllegalArgumentException("Bad row in " + resource + ": " + line);
                }
                rows.add(new double[]{Double.parseDouble(parts[0]), Double.parseDouble(parts[1])});
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read detector efficiency table " + resource, e);
        }
        double[] energies = new double[rows.size()];
        double[] eff = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            energies[i] = rows.get(i)[0];
            eff[i] = rows.get(i)[1];
        }
        return new TabulatedEfficiency(energies, eff);
    }
}
