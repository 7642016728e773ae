package org.eds.physics;

import org.eds.element.ChemicalFormula;
import org.eds.element.PeriodicTable;
import org.eds.model.EnergyAxis;
import org.eds.model.Spectrum;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.DoublePredicate;

/**
 * Synthesises raw (un-normalised) basis spectra on the data's energy axis:
 * characteristic emission of elements and compounds, and the two-term bremsstrahlung basis.
 */
public final class PhysicsModel {

    private final PhysicsParameters params;
    private final PeriodicTable table;
    private final XrayLineDatabase lines;
    private final DetectorEfficiency efficiency;
    private final AbsorptionModel absorption;
    private final Spectrum efficiencyCurve;

    public PhysicsModel(PhysicsParameters params, PeriodicTable table) {
        this.params = Objects.requireNonNull(params, "params must not be null");
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.lines = XrayLineDatabase.named(params.xrayDb());
        MassAttenuation mu = new MassAttenuation(table, lines);
        this.efficiency = params.detector().isParametric()
                ? new LayeredEfficiency(params.detector().layers(), params.detector().sensor(), mu)
                : TabulatedEfficiency.named(params.detector().type());
        this.absorption = new AbsorptionModel(mu, params.thickness(), params.density(), params.takeOffAngle());
        this.efficiencyCurve = efficiency.over(params.axis());
    }

    public PhysicsParameters parameters() {
        return params;
    }

    public EnergyAxis axis() {
        return params.axis();
    }

    public PeriodicTable table() {
        return table;
    }

    public XrayLineDatabase lines() {
        return lines;
    }

    /**
     * Characteristic spectrum of one element, restricted to the lines whose energy passes
     * {@code lineFilter}, absorbed in a film of the given composition.
     */
    public Spectrum characteristic(String symbol, Composition matrix, DoublePredicate lineFilter) {
        ElementLines el = lines.require(symbol);
        EnergyAxis axis = params.axis();
        double[] out = new double[axis.size()];

        for (XrayLine line : el.lines()) {
            if (!lineFilter.test(line.energy())) continue;
            OptionalDouble edge = el.edgeFor(line.family());
            if (edge.isEmpty()) continue;

            double strength = EmissionModel.crossSection(params.beamEnergy(), edge.getAsDouble())
                    * EmissionModel.fluorescenceYield(el.z(), line.family())
                    * line.weight()
                    * efficiency.at(line.energy())
                    * absorption.factor(matrix, line.energy());
            if (strength == 0.0) continue;

            double[] peak = params.lineShape().profile(axis, line.energy());
            for (int i = 0; i < out.length; i++) {
                out[i] += strength * peak[i];
            }
        }
        return new Spectrum(out);
    }

    public Spectrum characteristic(String symbol, Composition matrix) {
        return characteristic(symbol, matrix, e -> true);
    }

    /**
     * Atom-fraction weighted sum of the characteristic spectra of a formula's elements.
     */
    public Spectrum compound(ChemicalFormula formula, Composition matrix) {
        Spectrum acc = Spectrum.zeros(params.axis().size());
        for (Map.Entry<String, Double> e : formula.atomicFractions().entrySet()) {
            acc = acc.add(characteristic(e.getKey(), matrix).scale(e.getValue()));
        }
        return acc;
    }

    /**
     * The two continuum basis spectra
     * {@code B0(E) = (E0 - E) / E} and {@code B1(E) = (E0 - E)^2 / E},
     * zero from E0 upwards, times detector efficiency and film absorption.
     */
    public Spectrum[] bremsstrahlung(Composition matrix) {
        double e0 = params.beamEnergy();
        double[] e = params.axis().energies();
        double[] b0 = new double[e.length];
        double[] b1 = new double[e.length];
        for (int i = 0; i < e.length; i++) {
            if (e[i] >= e0) continue;
            double common = efficiencyCurve.get(i) * absorption.factor(matrix, e[i]) / e[i];
            b0[i] = (e0 - e[i]) * common;
            b1[i] = (e0 - e[i]) * (e0 - e[i]) * common;
        }
        return new Spectrum[]{new Spectrum(b0), new Spectrum(b1)};
    }
}
