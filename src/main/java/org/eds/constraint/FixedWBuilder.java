package org.eds.constraint;

import org.eds.dictionary.PhysicsDictionary;
import org.eds.dictionary.ProblemType;
import org.eds.element.ElementResolver;
import org.eds.element.ElementSpec;
import org.eds.error.InvalidElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds W constraints: rows are dictionary columns (element labels, then {@code b0}, {@code b1}
 * when the dictionary has background), columns are phases.
 *
 * Phase constraints map an identifier to a value. An identifier is an element label
 * ({@code Fe}, {@code Fe_lo}, {@code Fe2O3}), anything the {@link ElementResolver} maps to one
 * ({@code 26}, {@code "26_hi"}), or a reserved background key. A value of {@code -1} leaves the
 * cell free. Identifiers matching no row are dropped with a warning, or rejected in strict mode.
 */
public final class FixedWBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(FixedWBuilder.class);

    private final ElementResolver resolver;
    private final boolean strict;

    public FixedWBuilder() {
        this(new ElementResolver(), false);
    }

    public FixedWBuilder(ElementResolver resolver, boolean strict) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.strict = strict;
    }

    public FixedWBuilder strict() {
        return new FixedWBuilder(resolver, true);
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * @throws IllegalArgumentException for the identity dictionary, which has no W rows
     */
    public ConstraintMatrix buildFixedW(Map<String, ? extends Map<String, Double>> phaseConstraints,
                                        PhysicsDictionary dictionary) {
        Objects.requireNonNull(dictionary, "dictionary must not be null");
        requireFactorisable(dictionary);
        ConstraintMatrix w = buildFixedW(phaseConstraints, dictionary.elements(), dictionary.hasBackground());
        return w.requireRowCount(dictionary.columnCount());
    }

    /**
     * @throws org.eds.error.InvalidRangeException if a pinned value is negative (other than -1)
     * @throws InvalidElementException             in strict mode, for an identifier matching no row
     */
    public ConstraintMatrix buildFixedW(Map<String, ? extends Map<String, Double>> phaseConstraints,
                                        List<ElementSpec> elements,
                                        boolean hasBackground) {
        Objects.requireNonNull(phaseConstraints, "phaseConstraints must not be null");
        Objects.requireNonNull(elements, "elements must not be null");

        List<String> rows = rowLabels(elements, hasBackground);
        List<String> phases = new ArrayList<>(phaseConstraints.keySet());
        ConstraintEntry[][] cells = filled(rows.size(), phases.size(), ConstraintEntry.free());

        for (int p = 0; p < phases.size(); p++) {
            Map<String, Double> pins = phaseConstraints.get(phases.get(p));
            if (pins == null) continue;
            for (Map.Entry<String, Double> pin : pins.entrySet()) {
                Optional<Integer> row = rowOf(pin.getKey(), rows, elements.size(), hasBackground);
                if (row.isEmpty()) {
                    if (strict) {
                        throw new InvalidElementException("Identifier " + pin.getKey() + " in phase "
                                + phases.get(p) + " matches no row of " + rows);
                    }
                    LOG.warn("Ignoring identifier {} in phase {}: no matching row in {}",
                            pin.getKey(), phases.get(p), rows);
                    continue;
                }
                cells[row.get()][p] = entryOf(pin.getValue());
            }
        }
        return new ConstraintMatrix(rows, phases, cells);
    }

    /**
     * The chemical-mapping layout: one phase per element column, free on its own element and
     * pinned to zero on every other element. With background, the element phases pin both
     * background rows to zero and {@code backgroundComponents} extra phases hold background only.
     */
    public ConstraintMatrix buildChemicalMappingW(PhysicsDictionary dictionary, int backgroundComponents) {
        Objects.requireNonNull(dictionary, "dictionary must not be null");
        requireFactorisable(dictionary);
        return buildChemicalMappingW(dictionary.elements(), dictionary.hasBackground(), backgroundComponents);
    }

    public ConstraintMatrix buildChemicalMappingW(List<ElementSpec> elements,
                                                  boolean hasBackground,
                                                  int backgroundComponents) {
        Objects.requireNonNull(elements, "elements must not be null");
        if (hasBackground && backgroundComponents < 0) {
            throw new IllegalArgumentException("backgroundComponents must be >= 0");
        }
        int n = elements.size();
        int bgPhases = hasBackground ? backgroundComponents : 0;
        List<String> rows = rowLabels(elements, hasBackground);

        List<String> phases = new ArrayList<>();
        for (ElementSpec e : elements) phases.add(e.label());
        for (int b = 0; b < bgPhases; b++) phases.add("background_" + b);

        ConstraintEntry[][] cells = filled(rows.size(), phases.size(), ConstraintEntry.fixed(0.0));
        for (int i = 0; i < n; i++) {
            cells[i][i] = ConstraintEntry.free();
        }
        for (int b = 0; b < bgPhases; b++) {
            cells[n][n + b] = ConstraintEntry.free();
            cells[n + 1][n + b] = ConstraintEntry.free();
        }
        return new ConstraintMatrix(rows, phases, cells);
    }

    static List<String> rowLabels(List<ElementSpec> elements, boolean hasBackground) {
        List<String> rows = new ArrayList<>(elements.size() + 2);
        for (ElementSpec e : elements) rows.add(e.label());
        if (hasBackground) {
            rows.add(PhysicsDictionary.BACKGROUND_0);
            rows.add(PhysicsDictionary.BACKGROUND_1);
        }
        return rows;
    }

    private Optional<Integer> rowOf(String key, List<String> rows, int elementCount, boolean hasBackground) {
        if (key == null) return Optional.empty();
        if (PhysicsDictionary.BACKGROUND_0.equals(key) || PhysicsDictionary.BACKGROUND_1.equals(key)) {
            if (!hasBackground) return Optional.empty();
            return Optional.of(PhysicsDictionary.BACKGROUND_0.equals(key) ? elementCount : elementCount + 1);
        }
        int direct = rows.subList(0, elementCount).indexOf(key);
        if (direct >= 0) return Optional.of(direct);
        try {
            int resolved = rows.subList(0, elementCount).indexOf(resolver.resolveOne(key).label());
            return resolved >= 0 ? Optional.of(resolved) : Optional.empty();
        } catch (InvalidElementException e) {
            return Optional.empty();
        }
    }

    private static ConstraintEntry entryOf(Double value) {
        if (value == null) {
            return ConstraintEntry.free();
        }
        return ConstraintEntry.fromSentinel(value);
    }

    private static ConstraintEntry[][] filled(int rows, int cols, ConstraintEntry entry) {
        ConstraintEntry[][] cells = new ConstraintEntry[rows][cols];
        for (ConstraintEntry[] row : cells) Arrays.fill(row, entry);
        return cells;
    }

    private static void requireFactorisable(PhysicsDictionary dictionary) {
        if (dictionary.problemType() == ProblemType.IDENTITY) {
            throw new IllegalArgumentException("W constraints need a no_brstlg or bremsstrahlung dictionary");
        }
    }
}
