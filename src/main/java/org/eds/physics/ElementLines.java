package org.eds.physics;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Emission lines and absorption edges (keV) of one element.
 * Edge keys are {@code K}, {@code L3} and {@code M5}.
 */
public record ElementLines(int z, String symbol, Map<String, Double> edges, List<XrayLine> lines) {

    public ElementLines {
        edges = (edges == null) ? Map.of() : Map.copyOf(edges);
        lines = (lines == null) ? List.of() : List.copyOf(lines);
    }

    /**
     * Ionisation edge that feeds the given line family.
     */
    public OptionalDouble edgeFor(String family) {
        String key = switch (family) {
            case "K" -> "K";
            case "L" -> "L3";
            case "M" -> "M5";
            default -> family;
        };
        Double e = edges.get(key);
        return (e == null) ? OptionalDouble.empty() : OptionalDouble.of(e);
    }
}
