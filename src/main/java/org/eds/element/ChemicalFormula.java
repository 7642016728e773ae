package org.eds.element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A simple stoichiometric formula such as {@code Fe2O3} or {@code Mg0.5Fe1.5SiO4}:
 * element symbols each followed by an optional (possibly fractional) atom count.
 * Parentheses and hydrates are not supported.
 */
public final class ChemicalFormula {

    private static final Pattern TOKEN = Pattern.compile("([A-Z][a-z]?)(\\d*(?:\\.\\d+)?)");
    private static final Pattern WHOLE = Pattern.compile("(?:[A-Z][a-z]?\\d*(?:\\.\\d+)?)+");

    private final String text;
    private final Map<String, Double> counts;

    private ChemicalFormula(String text, Map<String, Double> counts) {
        this.text = text;
        this.counts = Collections.unmodifiableMap(counts);
    }

    /**
     * Parses the formula, or returns empty if the text does not follow the grammar.
     * Symbols are not checked against the periodic table here.
     */
    public static Optional<ChemicalFormula> parse(String text) {
        if (text == null || text.isBlank() || !WHOLE.matcher(text).matches()) {
            return Optional.empty();
        }
        Map<String, Double> counts = new LinkedHashMap<>();
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            String raw = m.group(2);
            double n = raw.isEmpty() ? 1.0 : Double.parseDouble(raw);
            if (n <= 0.0) {
                return Optional.empty();
            }
            counts.merge(m.group(1), n, Double::sum);
        }
        return Optional.of(new ChemicalFormula(text, counts));
    }

    /**
     * True when the text names more than a single atom of a single element,
     * i.e. when it cannot stand for one periodic-table symbol.
     */
    public boolean isCompound() {
        if (counts.size() > 1) return true;
        return counts.values().iterator().next() != 1.0 || !text.equals(counts.keySet().iterator().next());
    }

    public String text() {
        return text;
    }

    /**
     * Atom counts in formula order.
     */
    public Map<String, Double> counts() {
        return counts;
    }

    /**
     * Atomic fractions (counts divided by the total atom count), in formula order.
     */
    public Map<String, Double> atomicFractions() {
        double total = 0.0;
        for (double c : counts.values()) total += c;
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : counts.entrySet()) {
            out.put(e.getKey(), e.getValue() / total);
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public String toString() {
        return text;
    }
}
