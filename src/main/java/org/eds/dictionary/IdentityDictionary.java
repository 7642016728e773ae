package org.eds.dictionary;

import org.apache.commons.math3.linear.RealMatrix;
import org.eds.element.ElementSpec;

import java.util.List;
import java.util.Optional;

/**
 * The absent dictionary. Downstream consumers treat G as the identity.
 */
public final class IdentityDictionary implements PhysicsDictionary {

    private final List<ElementSpec> elements;
    private final int channels;

    public IdentityDictionary(List<ElementSpec> elements, int channels) {
        this.elements = (elements == null) ? List.of() : List.copyOf(elements);
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be >= 1");
        }
        this.channels = channels;
    }

    @Override
    public ProblemType problemType() {
        return ProblemType.IDENTITY;
    }

    @Override
    public List<ElementSpec> elements() {
        return elements;
    }

    @Override
    public int columnCount() {
        return channels;
    }

    @Override
    public Optional<RealMatrix> matrix() {
        return Optional.empty();
    }

    @Override
    public double[] norms() {
        return new double[0];
    }
}
