package org.eds.dictionary;

import org.apache.commons.math3.linear.RealMatrix;
import org.eds.element.ElementSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The spectral dictionary G (channels x columns) of a factorisation {@code X ~ G W H}.
 *
 * Columns are the model components in {@link #elements()} order, followed by the two
 * background columns when {@link #hasBackground()}.
 */
public interface PhysicsDictionary {

    String BACKGROUND_0 = "b0";
    String BACKGROUND_1 = "b1";

    ProblemType problemType();

    /**
     * Model components, one per element column, in column order.
     */
    List<ElementSpec> elements();

    /**
     * Number of columns of G (for the identity variant: the channel count).
     */
    int columnCount();

    /**
     * A copy of G, or empty for the identity variant.
     */
    Optional<RealMatrix> matrix();

    /**
     * Normalisation of each element column: G[:, j] = raw[:, j] / norm[j].
     * Background columns are not included.
     */
    double[] norms();

    default boolean hasBackground() {
        return problemType().hasBackground();
    }

    default List<String> elementLabels() {
        List<String> out = new ArrayList<>(elements().size());
        for (ElementSpec e : elements()) out.add(e.label());
        return out;
    }

    /**
     * Labels of every column, background columns named {@code b0} and {@code b1}.
     */
    default List<String> columnLabels() {
        List<String> out = elementLabels();
        if (hasBackground()) {
            out.add(BACKGROUND_0);
            out.add(BACKGROUND_1);
        }
        return out;
    }
}
