package org.eds.dictionary;

import java.util.Locale;

/**
 * The three dictionary modes. External names are the ones stored in metadata.
 */
public enum ProblemType {

    /** No dictionary: the data is already in dictionary coordinates. */
    IDENTITY("identity", false),
    /** Characteristic lines only. */
    CHARACTERISTIC_ONLY("no_brstlg", false),
    /** Characteristic lines plus two re-evaluatable bremsstrahlung columns. */
    CHARACTERISTIC_PLUS_BACKGROUND("bremsstrahlung", true);

    /** Number of trailing background columns in the background variant. */
    public static final int BACKGROUND_COLUMNS = 2;

    private final String externalName;
    private final boolean background;

    ProblemType(String externalName, boolean background) {
        this.externalName = externalName;
        this.background = background;
    }

    public String externalName() {
        return externalName;
    }

    public boolean hasBackground() {
        return background;
    }

    public static ProblemType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("problem type must be non-empty");
        }
        String n = name.strip().toLowerCase(Locale.ROOT);
        for (ProblemType t : values()) {
            if (t.externalName.equals(n) || t.name().toLowerCase(Locale.ROOT).equals(n)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown problem type: " + name
                + " (expected identity, no_brstlg or bremsstrahlung)");
    }

    @Override
    public String toString() {
        return externalName;
    }
}
