package org.eds.metadata;

import java.util.List;

/**
 * Specimen description: thickness in cm, density in g/cm3, and the element symbols present.
 */
public record Sample(Double thickness, Double density, List<String> elements) {

    public static final double DEFAULT_THICKNESS = 200e-7;
    public static final double DEFAULT_DENSITY = 3.5;

    public Sample {
        elements = (elements == null) ? List.of() : List.copyOf(elements);
    }

    public Sample withElements(List<String> newElements) {
        return new Sample(thickness, density, newElements);
    }
}
