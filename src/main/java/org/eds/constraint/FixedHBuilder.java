package org.eds.constraint;

import org.eds.error.ShapeMismatchException;
import org.eds.model.SpatialAxis;
import org.eds.model.SpectrumImage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds H constraints: one row per phase (map iteration order), one column per pixel in
 * row-major order. A line scan is handled as a single-row map.
 */
public final class FixedHBuilder {

    private final SpatialAxis yAxis;
    private final SpatialAxis xAxis;

    public FixedHBuilder(SpatialAxis yAxis, SpatialAxis xAxis) {
        this.yAxis = Objects.requireNonNull(yAxis, "yAxis must not be null");
        this.xAxis = Objects.requireNonNull(xAxis, "xAxis must not be null");
    }

    public static FixedHBuilder forImage(SpectrumImage image) {
        Objects.requireNonNull(image, "image must not be null");
        List<SpatialAxis> axes = image.navigationAxes();
        if (axes.size() == 1) {
            return new FixedHBuilder(SpatialAxis.unit("y", 1), axes.get(0));
        }
        return new FixedHBuilder(axes.get(0), axes.get(1));
    }

    public int height() {
        return yAxis.size();
    }

    public int width() {
        return xAxis.size();
    }

    /**
     * @throws ShapeMismatchException if a mask does not match the spatial shape
     */
    public ConstraintMatrix buildFixedH(Map<String, ? extends SpatialConstraint> phases) {
        Objects.requireNonNull(phases, "phases must not be null");
        int pixels = height() * width();
        List<String> names = new ArrayList<>(phases.keySet());
        ConstraintEntry[][] cells = new ConstraintEntry[names.size()][];
        for (int p = 0; p < names.size(); p++) {
            cells[p] = phaseRow(Objects.requireNonNull(phases.get(names.get(p)),
                    "constraint of phase " + names.get(p) + " must not be null"));
        }
        return ConstraintMatrix.overPixels(names, pixels, cells);
    }

    /**
     * The flattened cells of one phase.
     */
    public ConstraintEntry[] phaseRow(SpatialConstraint constraint) {
        int w = width();
        ConstraintEntry[] row = new ConstraintEntry[height() * w];
        Arrays.fill(row, ConstraintEntry.free());

        if (constraint instanceof SpatialConstraint.Mask m) {
            if (m.height() != height() || m.width() != w) {
                throw new ShapeMismatchException("Mask shape " + m.height() + "x" + m.width()
                        + " does not match data shape " + height() + "x" + w);
            }
            ConstraintEntry pinned = ConstraintEntry.fixed(m.value());
            for (int i = 0; i < height(); i++) {
                for (int j = 0; j < w; j++) {
                    if (m.at(i, j)) row[i * w + j] = pinned;
                }
            }
        } else if (constraint instanceof SpatialConstraint.Regions r) {
            ConstraintEntry pinned = ConstraintEntry.fixed(r.value());
            for (RectangularRegion region : r.regions()) {
                int iMin = clamp(yAxis.toIndex(region.top()), height());
                int iMax = clamp(yAxis.toIndex(region.bottom()), height());
                int jMin = clamp(xAxis.toIndex(region.left()), w);
                int jMax = clamp(xAxis.toIndex(region.right()), w);
                for (int i = iMin; i < iMax; i++) {
                    for (int j = jMin; j < jMax; j++) {
                        row[i * w + j] = pinned;
                    }
                }
            }
        }
        return row;
    }

    private static int clamp(int index, int size) {
        return Math.max(0, Math.min(index, size));
    }
}
