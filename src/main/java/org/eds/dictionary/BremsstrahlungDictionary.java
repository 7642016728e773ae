package org.eds.dictionary;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.eds.element.ElementSpec;
import org.eds.error.ShapeMismatchException;
import org.eds.model.Spectrum;
import org.eds.physics.Composition;
import org.eds.physics.PhysicsModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Characteristic columns plus two bremsstrahlung columns whose absorption correction
 * depends on the specimen composition.
 *
 * The element columns never change after construction. {@link #refresh(double[][])} re-derives
 * the composition from a partial mixing matrix and recomputes only the last two columns,
 * normalised by the norms computed at construction time.
 */
public final class BremsstrahlungDictionary implements PhysicsDictionary {

    private static final Logger LOG = LoggerFactory.getLogger(BremsstrahlungDictionary.class);

    private final PhysicsModel model;
    private final List<ElementSpec> elements;
    private final double[][] elementColumns; // [column][channel], already normalised
    private final double[] norms;
    private final double[] backgroundNorms;
    private final Composition initialComposition;

    private double[][] backgroundColumns; // [2][channel]
    private Composition composition;

    BremsstrahlungDictionary(PhysicsModel model,
                             List<ElementSpec> elements,
                             double[][] elementColumns,
                             double[] norms,
                             Composition composition) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.elements = List.copyOf(elements);
        this.elementColumns = elementColumns;
        this.norms = Arrays.copyOf(norms, norms.length);
        this.initialComposition = Objects.requireNonNull(composition, "composition must not be null");

        Spectrum[] raw = model.bremsstrahlung(composition);
        this.backgroundNorms = new double[ProblemType.BACKGROUND_COLUMNS];
        this.backgroundColumns = new double[ProblemType.BACKGROUND_COLUMNS][];
        for (int b = 0; b < raw.length; b++) {
            double n = raw[b].sum();
            if (n == 0.0) {
                LOG.warn("Background column b{} is zero over the energy range; left unnormalised", b);
                n = 1.0;
            }
            backgroundNorms[b] = n;
            backgroundColumns[b] = raw[b].scale(1.0 / n).toArrayCopy();
        }
        this.composition = composition;
    }

    @Override
    public ProblemType problemType() {
        return ProblemType.CHARACTERISTIC_PLUS_BACKGROUND;
    }

    @Override
    public List<ElementSpec> elements() {
        return elements;
    }

    @Override
    public int columnCount() {
        return elements.size() + ProblemType.BACKGROUND_COLUMNS;
    }

    @Override
    public synchronized Optional<RealMatrix> matrix() {
        int channels = model.axis().size();
        double[][] g = new double[channels][columnCount()];
        for (int j = 0; j < elements.size(); j++) {
            for (int i = 0; i < channels; i++) g[i][j] = elementColumns[j][i];
        }
        for (int b = 0; b < ProblemType.BACKGROUND_COLUMNS; b++) {
            int j = elements.size() + b;
            for (int i = 0; i < channels; i++) g[i][j] = backgroundColumns[b][i];
        }
        return Optional.of(new Array2DRowRealMatrix(g, false));
    }

    @Override
    public double[] norms() {
        return Arrays.copyOf(norms, norms.length);
    }

    public double[] backgroundNorms() {
        return Arrays.copyOf(backgroundNorms, backgroundNorms.length);
    }

    public synchronized Composition composition() {
        return composition;
    }

    /**
     * Re-evaluates the background columns for the composition implied by a partial W
     * (components x phases; rows beyond the element rows are ignored).
     *
     * The atom amount of each component is {@code sum_p W[j,p] / norm[j]}; the two halves of a
     * split element each estimate the same amount and are averaged. Negative entries count as zero.
     * When no amount is positive the initial composition is kept.
     *
     * @throws ShapeMismatchException if W has fewer rows than element columns
     */
    public synchronized BremsstrahlungDictionary refresh(double[][] partialW) {
        Objects.requireNonNull(partialW, "partialW must not be null");
        if (partialW.length != elements.size() && partialW.length != columnCount()) {
            throw new ShapeMismatchException("partial W has " + partialW.length + " rows; expected "
                    + elements.size() + " or " + columnCount());
        }

        Map<String, Double> atoms = new LinkedHashMap<>();
        Map<String, Integer> estimates = new LinkedHashMap<>();
        for (int j = 0; j < elements.size(); j++) {
            double amount = 0.0;
            for (double w : partialW[j]) {
                if (w > 0.0) amount += w;
            }
            amount /= norms[j];
            ElementSpec spec = elements.get(j);
            ComponentAtoms.accumulate(spec, amount, atoms);
            if (spec.isSplit()) estimates.merge(spec.symbol(), 1, Integer::sum);
        }
        estimates.forEach((symbol, count) -> atoms.computeIfPresent(symbol, (k, v) -> v / count));

        boolean anyPositive = atoms.values().stream().anyMatch(v -> v > 0.0);
        Composition next = anyPositive ? Composition.fromAtomic(atoms, model.table()) : initialComposition;
        if (!anyPositive) {
            LOG.warn("Partial W carries no positive amount; keeping initial composition");
        }

        Spectrum[] raw = model.bremsstrahlung(next);
        double[][] cols = new double[ProblemType.BACKGROUND_COLUMNS][];
        for (int b = 0; b < raw.length; b++) {
            cols[b] = raw[b].scale(1.0 / backgroundNorms[b]).toArrayCopy();
        }
        this.backgroundColumns = cols;
        this.composition = next;
        LOG.debug("Background columns refreshed for {}", next);
        return this;
    }

    public BremsstrahlungDictionary refresh(RealMatrix partialW) {
        Objects.requireNonNull(partialW, "partialW must not be null");
        return refresh(partialW.getData());
    }
}
