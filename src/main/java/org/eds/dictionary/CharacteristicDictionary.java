package org.eds.dictionary;

import org.apache.commons.math3.linear.RealMatrix;
import org.eds.element.ElementSpec;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable dictionary of normalised characteristic spectra, one column per component.
 */
public final class CharacteristicDictionary implements PhysicsDictionary {

    private final List<ElementSpec> elements;
    private final RealMatrix g;
    private final double[] norms;

    public CharacteristicDictionary(List<ElementSpec> elements, RealMatrix g, double[] norms) {
        this.elements = List.copyOf(Objects.requireNonNull(elements, "elements must not be null"));
        Objects.requireNonNull(g, "g must not be null");
        Objects.requireNonNull(norms, "norms must not be null");
        if (g.getColumnDimension() != this.elements.size() || norms.length != this.elements.size()) {
            throw new IllegalArgumentException("G has " + g.getColumnDimension() + " columns and "
                    + norms.length + " norms for " + this.elements.size() + " elements");
        }
        this.g = g.copy();
        this.norms = Arrays.copyOf(norms, norms.length);
    }

    @Override
    public ProblemType problemType() {
        return ProblemType.CHARACTERISTIC_ONLY;
    }

    @Override
    public List<ElementSpec> elements() {
        return elements;
    }

    @Override
    public int columnCount() {
        return g.getColumnDimension();
    }

    @Override
    public Optional<RealMatrix> matrix() {
        return Optional.of(g.copy());
    }

    @Override
    public double[] norms() {
        return Arrays.copyOf(norms, norms.length);
    }
}
