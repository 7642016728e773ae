package org.eds.element;

/**
 * One row of the periodic table: atomic number, symbol and standard atomic weight (g/mol).
 */
public record ChemicalElement(int z, String symbol, double weight) {

    public ChemicalElement {
        if (z <= 0) {
            throw new IllegalArgumentException("z must be >= 1");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must be non-empty");
        }
        if (!(weight > 0.0)) {
            throw new IllegalArgumentException("weight must be > 0");
        }
    }
}
