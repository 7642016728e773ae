package org.eds.constraint;

/**
 * An axis-aligned region in physical navigation units. {@code left/right} run along the
 * x (width) axis, {@code top/bottom} along the y (height) axis.
 */
public record RectangularRegion(double left, double top, double right, double bottom) {

    public RectangularRegion {
        if (!Double.isFinite(left) || !Double.isFinite(top) || !Double.isFinite(right) || !Double.isFinite(bottom)) {
            throw new IllegalArgumentException("region bounds must be finite");
        }
        if (right < left || bottom < top) {
            throw new IllegalArgumentException("region must satisfy left <= right and top <= bottom");
        }
    }
}
