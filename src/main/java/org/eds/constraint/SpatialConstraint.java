package org.eds.constraint;

import org.eds.error.InvalidRangeException;
import org.eds.error.ShapeMismatchException;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * How the abundance map of one phase is pinned.
 */
public interface SpatialConstraint {

    String NOT_FIXED = "not_fixed";
    String MASK = "mask";
    String REGIONS = "roi";

    static SpatialConstraint notFixed() {
        return new NotFixed();
    }

    /**
     * Pins the cells where {@code mask} is true to {@code value}.
     *
     * @throws InvalidRangeException if value is outside [0, 1]
     */
    static SpatialConstraint mask(boolean[][] mask, double value) {
        return new Mask(mask, value);
    }

    /**
     * Pins the cells inside each region to {@code value}.
     *
     * @throws InvalidRangeException if value is outside [0, 1]
     */
    static SpatialConstraint regions(List<RectangularRegion> regions, double value) {
        return new Regions(regions, value);
    }

    /**
     * Builds a constraint from its type name: {@code not_fixed}, {@code mask}, or
     * {@code roi}/{@code region_list}.
     *
     * @throws InvalidRangeException for an unknown type or a value outside [0, 1]
     */
    static SpatialConstraint of(String type, boolean[][] mask, List<RectangularRegion> regions, double value) {
        checkValue(value);
        if (type == null) {
            throw new InvalidRangeException("constraint type is not defined");
        }
        switch (type.strip().toLowerCase(Locale.ROOT)) {
            case NOT_FIXED:
                return notFixed();
            case MASK:
                if (mask == null) throw new IllegalArgumentException("mask is not defined");
                return mask(mask, value);
            case REGIONS:
            case "region_list":
                if (regions == null) throw new IllegalArgumentException("regions are not defined");
                return regions(regions, value);
            default:
                throw new InvalidRangeException("Unknown constraint type: " + type
                        + " (expected not_fixed, mask or roi)");
        }
    }

    private static void checkValue(double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidRangeException("Value must be between 0 and 1, got " + value);
        }
    }

    record NotFixed() implements SpatialConstraint {
    }

    record Mask(boolean[][] mask, double value) implements SpatialConstraint {
        public Mask {
            Objects.requireNonNull(mask, "mask must not be null");
            checkValue(value);
            boolean[][] copy = new boolean[mask.length][];
            for (int i = 0; i < mask.length; i++) {
                Objects.requireNonNull(mask[i], "mask rows must not be null");
                if (mask[i].length != mask[0].length) {
                    throw new ShapeMismatchException("Mask row " + i + " has " + mask[i].length
                            + " cells, expected " + mask[0].length);
                }
                copy[i] = mask[i].clone();
            }
            mask = copy;
        }

        public int height() {
            return mask.length;
        }

        public int width() {
            return mask.length == 0 ? 0 : mask[0].length;
        }

        public boolean at(int i, int j) {
            return mask[i][j];
        }
    }

    record Regions(List<RectangularRegion> regions, double value) implements SpatialConstraint {
        public Regions {
            regions = List.copyOf(Objects.requireNonNull(regions, "regions must not be null"));
            checkValue(value);
        }
    }
}
