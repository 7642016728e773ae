package org.eds.engine;

import org.apache.commons.math3.linear.RealMatrix;
import org.eds.constraint.ConstraintMatrix;
import org.eds.dictionary.PhysicsDictionary;
import org.eds.error.ShapeMismatchException;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything handed to a {@link DecompositionEngine}. Shapes are checked here so that no
 * inconsistent request leaves the core.
 *
 * @param data           channels x pixels
 * @param dictionary     G provider
 * @param components     number of phases
 * @param fixedW         dictionary columns x phases, or null
 * @param fixedH         phases x pixels, or null
 * @param navigationMask one flag per pixel, true for excluded pixels, or null
 */
public record DecompositionRequest(RealMatrix data,
                                   PhysicsDictionary dictionary,
                                   int components,
                                   ConstraintMatrix fixedW,
                                   ConstraintMatrix fixedH,
                                   boolean[] navigationMask) {

    public DecompositionRequest {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(dictionary, "dictionary must not be null");
        if (components <= 0) {
            throw new IllegalArgumentException("components must be >= 1");
        }
        int pixels = data.getColumnDimension();
        int gColumns = dictionary.columnCount();
        Optional<RealMatrix> g = dictionary.matrix();
        if (g.isPresent() && g.get().getRowDimension() != data.getRowDimension()) {
            throw new ShapeMismatchException("G has " + g.get().getRowDimension()
                    + " channels but data has " + data.getRowDimension());
        }
        if (fixedW != null) {
            fixedW.requireRowCount(gColumns);
            if (fixedW.columnCount() != components) {
                throw new ShapeMismatchException("fixed W has " + fixedW.columnCount()
                        + " phases for " + components + " components");
            }
        }
        if (fixedH != null) {
            fixedH.requireRowCount(components);
            if (fixedH.columnCount() != pixels) {
                throw new ShapeMismatchException("fixed H has " + fixedH.columnCount()
                        + " pixels but data has " + pixels);
            }
        }
        if (navigationMask != null) {
            if (navigationMask.length != pixels) {
                throw new ShapeMismatchException("navigation mask has " + navigationMask.length
                        + " entries but data has " + pixels + " pixels");
            }
            navigationMask = Arrays.copyOf(navigationMask, navigationMask.length);
        }
    }

    public static DecompositionRequest of(RealMatrix data, PhysicsDictionary dictionary, int components) {
        return new DecompositionRequest(data, dictionary, components, null, null, null);
    }

    public DecompositionRequest withFixedW(ConstraintMatrix w) {
        return new DecompositionRequest(data, dictionary, components, w, fixedH, navigationMask);
    }

    public DecompositionRequest withFixedH(ConstraintMatrix h) {
        return new DecompositionRequest(data, dictionary, components, fixedW, h, navigationMask);
    }

    public DecompositionRequest withNavigationMask(boolean[] mask) {
        return new DecompositionRequest(data, dictionary, components, fixedW, fixedH, mask);
    }

    public Optional<ConstraintMatrix> fixedWConstraint() {
        return Optional.ofNullable(fixedW);
    }

    public Optional<ConstraintMatrix> fixedHConstraint() {
        return Optional.ofNullable(fixedH);
    }

    @Override
    public boolean[] navigationMask() {
        return navigationMask == null ? null : Arrays.copyOf(navigationMask, navigationMask.length);
    }
}
