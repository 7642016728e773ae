package org.eds.element;

import java.util.Objects;

/**
 * A canonical model component: a plain element, one energy half of a split element,
 * or a stoichiometric compound.
 *
 * {@link #label()} is the name used for dictionary columns and constraint rows,
 * e.g. {@code Fe}, {@code Fe_lo}, {@code Fe_hi}, {@code Fe2O3}.
 */
public record ElementSpec(String symbol, Kind kind) {

    public static final String LOW_SUFFIX = "_lo";
    public static final String HIGH_SUFFIX = "_hi";

    public enum Kind {
        ELEMENT,
        LOW_ENERGY_SPLIT,
        HIGH_ENERGY_SPLIT,
        COMPOUND
    }

    public ElementSpec {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must be non-empty");
        }
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ElementSpec element(String symbol) {
        return new ElementSpec(symbol, Kind.ELEMENT);
    }

    public static ElementSpec compound(String formula) {
        return new ElementSpec(formula, Kind.COMPOUND);
    }

    public String label() {
        return switch (kind) {
            case LOW_ENERGY_SPLIT -> symbol + LOW_SUFFIX;
            case HIGH_ENERGY_SPLIT -> symbol + HIGH_SUFFIX;
            default -> symbol;
        };
    }

    public boolean isSplit() {
        return kind == Kind.LOW_ENERGY_SPLIT || kind == Kind.HIGH_ENERGY_SPLIT;
    }

    public boolean isCompound() {
        return kind == Kind.COMPOUND;
    }

    /**
     * The same component without its split tag.
     */
    public ElementSpec unsplit() {
        return isSplit() ? element(symbol) : this;
    }

    /**
     * Removes a {@code _lo}/{@code _hi} suffix, if any.
     */
    public static String stripSuffix(String label) {
        if (label.endsWith(LOW_SUFFIX) || label.endsWith(HIGH_SUFFIX)) {
            return label.substring(0, label.length() - 3);
        }
        return label;
    }

    @Override
    public String toString() {
        return label();
    }
}
