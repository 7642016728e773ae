package org.eds.physics;

/**
 * A characteristic emission line: name (e.g. {@code Ka}), shell family ({@code K}, {@code L}, {@code M}),
 * energy in keV and relative weight within its family.
 */
public record XrayLine(String name, String family, double energy, double weight) {

    public XrayLine {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be non-empty");
        }
        if (family == null || family.isBlank()) {
            throw new IllegalArgumentException("family must be non-empty");
        }
        if (!(energy > 0.0)) {
            throw new IllegalArgumentException("energy must be > 0 for line " + name);
        }
        if (weight < 0.0) {
            throw new IllegalArgumentException("weight must be >= 0 for line " + name);
        }
    }
}
