package org.eds.model;

/**
 * One navigation axis of a spectrum image: pixel count and physical size of a pixel.
 */
public record SpatialAxis(String name, int size, double scale, double offset) {

    public SpatialAxis {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be non-empty");
        }
        if (size <= 0) {
            throw new IllegalArgumentException("size must be >= 1");
        }
        if (!(scale > 0.0)) {
            throw new IllegalArgumentException("scale must be > 0, got " + scale);
        }
    }

    public static SpatialAxis unit(String name, int size) {
        return new SpatialAxis(name, size, 1.0, 0.0);
    }

    /**
     * Converts a physical coordinate into a pixel index by truncating division by the scale.
     */
    public int toIndex(double physical) {
        return (int) Math.floor(physical / scale);
    }
}
