package org.eds.dictionary;

import org.eds.element.ChemicalFormula;
import org.eds.element.ElementSpec;
import org.eds.error.InvalidElementException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands model components into per-element atom amounts.
 */
final class ComponentAtoms {

    private ComponentAtoms() {
    }

    static ChemicalFormula formulaOf(ElementSpec compound) {
        return ChemicalFormula.parse(compound.symbol())
                .orElseThrow(() -> new InvalidElementException("Not a chemical formula: " + compound.symbol()));
    }

    /**
     * Adds {@code amount} atoms of the component into {@code atoms}. A compound contributes
     * each constituent in proportion to its atom fraction.
     */
    static void accumulate(ElementSpec spec, double amount, Map<String, Double> atoms) {
        if (spec.isCompound()) {
            for (Map.Entry<String, Double> e : formulaOf(spec).atomicFractions().entrySet()) {
                atoms.merge(e.getKey(), amount * e.getValue(), Double::sum);
            }
        } else {
            atoms.merge(spec.symbol(), amount, Double::sum);
        }
    }

    /**
     * Base elements of all components, in first-seen order.
     */
    static List<String> baseSymbols(List<ElementSpec> specs) {
        Map<String, Double> atoms = new LinkedHashMap<>();
        for (ElementSpec s : specs) accumulate(s, 1.0, atoms);
        return List.copyOf(atoms.keySet());
    }
}
