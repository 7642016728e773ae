package org.eds.metadata;

/**
 * A homogeneous layer of a parametric detector model: one element, thickness in cm, density in g/cm3.
 */
public record DetectorLayer(String element, double thickness, double density) {

    public DetectorLayer {
        if (element == null || element.isBlank()) {
            throw new IllegalArgumentException("element must be non-empty");
        }
        if (thickness < 0.0 || density < 0.0) {
            throw new IllegalArgumentException("thickness and density must be >= 0");
        }
    }
}
