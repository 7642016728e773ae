package org.eds.metadata;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a dictionary build leaves behind so the same dictionary can be restored later
 * without the raw element input: the mode, the split and compound requests, the resolved
 * column labels (background columns excluded) and one norm per labelled column.
 */
public record ModelState(String problemType,
                         Map<String, Double> referenceElements,
                         List<String> stoichiometries,
                         List<String> elements,
                         double[] norm) {

    public ModelState {
        if (problemType == null || problemType.isBlank()) {
            throw new IllegalArgumentException("problemType must be non-empty");
        }
        referenceElements = (referenceElements == null) ? Map.of() : new LinkedHashMap<>(referenceElements);
        stoichiometries = (stoichiometries == null) ? List.of() : List.copyOf(stoichiometries);
        elements = (elements == null) ? List.of() : List.copyOf(elements);
        norm = (norm == null) ? new double[0] : Arrays.copyOf(norm, norm.length);
        if (norm.length != 0 && norm.length != elements.size()) {
            throw new IllegalArgumentException(
                    "norm has " + norm.length + " entries but there are " + elements.size() + " elements");
        }
    }

    @Override
    public double[] norm() {
        return Arrays.copyOf(norm, norm.length);
    }

    @Override
    public Map<String, Double> referenceElements() {
        return Collections.unmodifiableMap(referenceElements);
    }
}
