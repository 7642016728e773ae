package org.eds.element;

import org.eds.error.InvalidElementException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalises heterogeneous element identifiers into canonical model components.
 *
 * Accepted identifiers: atomic numbers ({@code 26}, {@code "26"}), symbols ({@code "Fe"}),
 * split labels ({@code "Fe_lo"}, {@code "26_hi"}) and stoichiometric formulas ({@code "Fe2O3"}).
 * Stateless; safe to share.
 */
public final class ElementResolver {

    private final PeriodicTable table;

    public ElementResolver() {
        this(PeriodicTable.standard());
    }

    public ElementResolver(PeriodicTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    /**
     * Resolves raw identifiers into an ordered, duplicate-free list of components.
     * Split suffixes are stripped (so {@code Fe_lo} and {@code Fe_hi} both collapse to {@code Fe})
     * and insertion order of first occurrence is kept. Compound formulas pass through unchanged.
     *
     * @throws InvalidElementException if an entry is neither a known number, a known symbol nor a formula
     */
    public List<ElementSpec> resolve(List<?> rawIdentifiers) {
        Objects.requireNonNull(rawIdentifiers, "rawIdentifiers must not be null");

        Map<String, ElementSpec> ordered = new LinkedHashMap<>();
        for (Object raw : rawIdentifiers) {
            ElementSpec spec = resolveOne(raw).unsplit();
            ordered.putIfAbsent(spec.label(), spec);
        }
        return List.copyOf(ordered.values());
    }

    /**
     * Resolves a single identifier, keeping its split tag.
     *
     * @throws InvalidElementException if the identifier cannot be resolved
     */
    public ElementSpec resolveOne(Object raw) {
        if (raw == null) {
            throw new InvalidElementException("element identifier must not be null");
        }
        if (raw instanceof Number n) {
            return ElementSpec.element(symbolOfNumber(n));
        }

        String text = raw.toString().strip();
        if (text.isEmpty()) {
            throw new InvalidElementException("element identifier must not be blank");
        }

        ElementSpec.Kind kind = ElementSpec.Kind.ELEMENT;
        String base = text;
        if (text.endsWith(ElementSpec.LOW_SUFFIX)) {
            kind = ElementSpec.Kind.LOW_ENERGY_SPLIT;
            base = ElementSpec.stripSuffix(text);
        } else if (text.endsWith(ElementSpec.HIGH_SUFFIX)) {
            kind = ElementSpec.Kind.HIGH_ENERGY_SPLIT;
            base = ElementSpec.stripSuffix(text);
        }

        Optional<String> symbol = toSymbol(base);
        if (symbol.isPresent()) {
            return new ElementSpec(symbol.get(), kind);
        }

        if (kind == ElementSpec.Kind.ELEMENT) {
            Optional<ChemicalFormula> formula = ChemicalFormula.parse(base);
            if (formula.isPresent() && formula.get().isCompound()) {
                for (String s : formula.get().counts().keySet()) {
                    if (!table.isSymbol(s)) {
                        throw new InvalidElementException("Unknown element " + s + " in " + raw);
                    }
                }
                return ElementSpec.compound(base);
            }
        }
        throw new InvalidElementException("Unknown element identifier: " + raw);
    }

    /**
     * Converts each entry to its display/row label without deduplication.
     * Numbers become symbols and split suffixes are kept; an entry that cannot be converted
     * (typically an already-resolved compound) is left unchanged.
     */
    public List<String> toRowLabels(List<?> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        List<String> out = new ArrayList<>(entries.size());
        for (Object e : entries) {
            try {
                out.add(resolveOne(e).label());
            } catch (InvalidElementException ex) {
                out.add(String.valueOf(e));
            }
        }
        return out;
    }

    public PeriodicTable table() {
        return table;
    }

    private Optional<String> toSymbol(String text) {
        if (table.isSymbol(text)) {
            return Optional.of(text);
        }
        if (text.length() <= 3 && text.chars().allMatch(Character::isDigit)) {
            return Optional.of(symbolOfNumber(Integer.parseInt(text)));
        }
        return Optional.empty();
    }

    private String symbolOfNumber(Number n) {
        double d = n.doubleValue();
        if (d != Math.rint(d)) {
            throw new InvalidElementException("Atomic number must be an integer: " + n);
        }
        return table.findZ((int) d)
                .map(ChemicalElement::symbol)
                .orElseThrow(() -> new InvalidElementException("Unknown atomic number: " + n));
    }
}
