package org.eds.constraint;

import org.eds.error.InvalidRangeException;

/**
 * One cell of a constraint matrix: either free (learned by the solver) or pinned to a value.
 */
public interface ConstraintEntry {

    /** Value written for a free cell in the solver's array encoding. */
    double FREE_SENTINEL = -1.0;

    ConstraintEntry FREE = new Free();

    boolean isFree();

    /**
     * @throws IllegalStateException if the entry is free
     */
    double value();

    static ConstraintEntry free() {
        return FREE;
    }

    /**
     * @throws InvalidRangeException if value is negative or not finite
     */
    static ConstraintEntry fixed(double value) {
        return new Fixed(value);
    }

    /**
     * Decodes the solver's array encoding: exactly {@code -1} is free, any value {@code >= 0} is pinned.
     *
     * @throws InvalidRangeException for any other value
     */
    static ConstraintEntry fromSentinel(double raw) {
        if (raw == FREE_SENTINEL) {
            return FREE;
        }
        return new Fixed(raw);
    }

    default double toSentinel() {
        return isFree() ? FREE_SENTINEL : value();
    }

    record Free() implements ConstraintEntry {
        @Override
        public boolean isFree() {
            return true;
        }

        @Override
        public double value() {
            throw new IllegalStateException("free entry has no value");
        }

        @Override
        public String toString() {
            return "free";
        }
    }

    record Fixed(double value) implements ConstraintEntry {
        public Fixed {
            if (!Double.isFinite(value) || value < 0.0) {
                throw new InvalidRangeException("pinned value must be finite and >= 0, got " + value);
            }
        }

        @Override
        public boolean isFree() {
            return false;
        }
    }
}
