package org.eds.quant;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Atomic-percent maps, one per quantified element, in element order.
 * Excluded or undefined pixels hold NaN.
 */
public final class QuantificationResult {

    private final List<String> elements;
    private final int[] spatialShape;
    private final double[][] percent; // [element][pixel]
    private final Map<String, Double> norms;

    QuantificationResult(List<String> elements, int[] spatialShape, double[][] percent, Map<String, Double> norms) {
        this.elements = List.copyOf(elements);
        this.spatialShape = Arrays.copyOf(spatialShape, spatialShape.length);
        this.percent = percent;
        this.norms = new LinkedHashMap<>(norms);
    }

    public List<String> elements() {
        return elements;
    }

    /**
     * {height, width} or {length}.
     */
    public int[] spatialShape() {
        return Arrays.copyOf(spatialShape, spatialShape.length);
    }

    public int pixelCount() {
        return percent.length == 0 ? 0 : percent[0].length;
    }

    /**
     * The percent values of one element over the flattened pixels.
     *
     * @throws NoSuchElementException if the element was not quantified
     */
    public double[] values(String element) {
        double[] row = percent[indexOf(element)];
        return Arrays.copyOf(row, row.length);
    }

    /**
     * The percent map of one element; a line scan comes back as a single row.
     */
    public double[][] map(String element) {
        double[] row = percent[indexOf(element)];
        int height = spatialShape.length == 2 ? spatialShape[0] : 1;
        int width = spatialShape.length == 2 ? spatialShape[1] : spatialShape[0];
        double[][] out = new double[height][];
        for (int i = 0; i < height; i++) {
            out[i] = Arrays.copyOfRange(row, i * width, (i + 1) * width);
        }
        return out;
    }

    /**
     * Composition at one pixel, element to percent.
     */
    public Map<String, Double> at(int pixel) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (int e = 0; e < elements.size(); e++) {
            out.put(elements.get(e), percent[e][pixel]);
        }
        return out;
    }

    /**
     * All values, elements x pixels.
     */
    public double[][] toArray() {
        double[][] out = new double[percent.length][];
        for (int e = 0; e < percent.length; e++) out[e] = Arrays.copyOf(percent[e], percent[e].length);
        return out;
    }

    /**
     * The normalisation factor applied to each quantified element.
     */
    public Map<String, Double> norms() {
        return Collections.unmodifiableMap(norms);
    }

    private int indexOf(String element) {
        Objects.requireNonNull(element, "element must not be null");
        int i = elements.indexOf(element);
        if (i < 0) {
            throw new NoSuchElementException("Element not quantified: " + element);
        }
        return i;
    }

    @Override
    public String toString() {
        return "QuantificationResult{elements=" + elements + ", shape=" + Arrays.toString(spatialShape) + "}";
    }
}
