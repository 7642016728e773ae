package org.eds.dictionary;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.eds.element.ChemicalFormula;
import org.eds.element.ElementResolver;
import org.eds.element.ElementSpec;
import org.eds.element.PeriodicTable;
import org.eds.error.InvalidElementException;
import org.eds.error.MissingMetadataException;
import org.eds.metadata.DatasetMetadata;
import org.eds.metadata.ModelState;
import org.eds.model.Spectrum;
import org.eds.model.SpectrumImage;
import org.eds.physics.Composition;
import org.eds.physics.PhysicsModel;
import org.eds.physics.PhysicsParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoublePredicate;

/**
 * Builds the spectral dictionary G from physics parameters and resolved model components.
 *
 * Column order: the given components in order, where an element listed in the reference map
 * is replaced in place by its {@code _lo} and {@code _hi} halves, then one column per
 * stoichiometry not already present, then (background variant) {@code b0} and {@code b1}.
 */
public final class PhysicsDictionaryBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(PhysicsDictionaryBuilder.class);

    private final PeriodicTable table;
    private final ElementResolver resolver;

    public PhysicsDictionaryBuilder() {
        this(PeriodicTable.standard());
    }

    public PhysicsDictionaryBuilder(PeriodicTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.resolver = new ElementResolver(table);
    }

    public PhysicsDictionary build(ProblemType mode, PhysicsParameters params, List<ElementSpec> elements) {
        return build(mode, params, elements, Map.of(), List.of());
    }

    /**
     * @param referenceElements element identifier to cutoff energy (keV) at which its lines are split
     * @param stoichiometries   compound formulas to add as extra columns
     * @throws InvalidElementException if a reference element or a stoichiometry cannot be resolved,
     *                                 or the line database has no entry for a component
     */
    public PhysicsDictionary build(ProblemType mode,
                                   PhysicsParameters params,
                                   List<ElementSpec> elements,
                                   Map<String, Double> referenceElements,
                                   List<String> stoichiometries) {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(params, "params must not be null");
        Objects.requireNonNull(elements, "elements must not be null");

        if (mode == ProblemType.IDENTITY) {
            return new IdentityDictionary(elements, params.axis().size());
        }

        Map<String, Double> cutoffs = resolveReferences(referenceElements);
        List<ElementSpec> columns = columnSpecs(elements, cutoffs, stoichiometries);
        PhysicsModel model = new PhysicsModel(params, table);
        Composition matrix = Composition.equiatomic(ComponentAtoms.baseSymbols(columns), table);

        int channels = params.axis().size();
        double[][] cols = new double[columns.size()][];
        double[] norms = new double[columns.size()];
        for (int j = 0; j < columns.size(); j++) {
            ElementSpec spec = columns.get(j);
            Spectrum raw = synthesize(model, spec, matrix, cutoffs);
            double n = raw.sum();
            if (n == 0.0) {
                LOG.warn("Column {} has no line in the energy range; left as zeros", spec.label());
                n = 1.0;
            }
            norms[j] = n;
            cols[j] = raw.scale(1.0 / n).toArrayCopy();
        }

        LOG.debug("Built {} dictionary: {} channels, columns {}", mode, channels, columns);

        if (mode == ProblemType.CHARACTERISTIC_PLUS_BACKGROUND) {
            return new BremsstrahlungDictionary(model, columns, cols, norms, matrix);
        }
        double[][] g = new double[channels][columns.size()];
        for (int j = 0; j < cols.length; j++) {
            for (int i = 0; i < channels; i++) g[i][j] = cols[j][i];
        }
        return new CharacteristicDictionary(columns, new Array2DRowRealMatrix(g, false), norms);
    }

    /**
     * Builds from the dataset's metadata and sample elements, then stores the resulting
     * {@link ModelState} back into the dataset so {@link #rebuild(SpectrumImage)} can restore it.
     *
     * @throws MissingMetadataException if the physics parameters are incomplete
     */
    public PhysicsDictionary build(SpectrumImage image,
                                   ProblemType mode,
                                   Map<String, Double> referenceElements,
                                   List<String> stoichiometries) {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        DatasetMetadata md = image.metadata();
        List<String> sampleElements = (md.sample() == null) ? List.of() : md.sample().elements();
        List<ElementSpec> elements = resolver.resolve(sampleElements);

        PhysicsDictionary dictionary;
        if (mode == ProblemType.IDENTITY) {
            dictionary = new IdentityDictionary(elements, image.channels());
        } else {
            dictionary = build(mode, PhysicsParameters.from(md), elements, referenceElements, stoichiometries);
        }

        ModelState state = new ModelState(
                mode.externalName(),
                resolveReferences(referenceElements),
                (stoichiometries == null) ? List.of() : stoichiometries,
                dictionary.elementLabels(),
                dictionary.norms());
        image.setMetadata(md.withModel(state));
        return dictionary;
    }

    /**
     * Restores a dictionary from the stored model state alone: split suffixes are stripped,
     * stoichiometric entries removed and the remaining labels resolved again.
     *
     * @throws MissingMetadataException if no dictionary was built on this dataset
     */
    public PhysicsDictionary rebuild(SpectrumImage image) {
        Objects.requireNonNull(image, "image must not be null");
        ModelState state = image.metadata().model();
        if (state == null) {
            throw new MissingMetadataException("No dictionary model stored in metadata; build one first");
        }
        ProblemType mode = ProblemType.fromName(state.problemType());

        List<String> base = new ArrayList<>();
        for (String label : state.elements()) {
            if (state.stoichiometries().contains(label)) continue;
            base.add(ElementSpec.stripSuffix(label));
        }
        List<ElementSpec> elements = resolver.resolve(base);

        if (mode == ProblemType.IDENTITY) {
            return new IdentityDictionary(elements, image.channels());
        }
        return build(mode, PhysicsParameters.from(image.metadata()), elements,
                state.referenceElements(), state.stoichiometries());
    }

    private Map<String, Double> resolveReferences(Map<String, Double> referenceElements) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (referenceElements == null) return out;
        for (Map.Entry<String, Double> e : referenceElements.entrySet()) {
            ElementSpec spec = resolver.resolveOne(e.getKey()).unsplit();
            if (spec.isCompound()) {
                throw new InvalidElementException("Cannot split the lines of a compound: " + e.getKey());
            }
            if (e.getValue() == null || !(e.getValue() > 0.0)) {
                throw new IllegalArgumentException("cutoff energy of " + e.getKey() + " must be > 0");
            }
            out.put(spec.symbol(), e.getValue());
        }
        return out;
    }

    private List<ElementSpec> columnSpecs(List<ElementSpec> elements,
                                          Map<String, Double> cutoffs,
                                          List<String> stoichiometries) {
        Map<String, ElementSpec> ordered = new LinkedHashMap<>();
        for (ElementSpec e : elements) {
            ElementSpec base = e.unsplit();
            if (!base.isCompound() && cutoffs.containsKey(base.symbol())) {
                ElementSpec lo = new ElementSpec(base.symbol(), ElementSpec.Kind.LOW_ENERGY_SPLIT);
                ElementSpec hi = new ElementSpec(base.symbol(), ElementSpec.Kind.HIGH_ENERGY_SPLIT);
                ordered.putIfAbsent(lo.label(), lo);
                ordered.putIfAbsent(hi.label(), hi);
            } else {
                ordered.putIfAbsent(base.label(), base);
            }
        }
        if (stoichiometries != null) {
            for (String s : stoichiometries) {
                ChemicalFormula formula = ChemicalFormula.parse(s)
                        .orElseThrow(() -> new InvalidElementException("Not a chemical formula: " + s));
                for (String symbol : formula.counts().keySet()) {
                    if (!table.isSymbol(symbol)) {
                        throw new InvalidElementException("Unknown element " + symbol + " in " + s);
                    }
                }
                ordered.putIfAbsent(s, ElementSpec.compound(s));
            }
        }
        return List.copyOf(ordered.values());
    }

    private static Spectrum synthesize(PhysicsModel model,
                                       ElementSpec spec,
                                       Composition matrix,
                                       Map<String, Double> cutoffs) {
        switch (spec.kind()) {
            case COMPOUND:
                return model.compound(ComponentAtoms.formulaOf(spec), matrix);
            case LOW_ENERGY_SPLIT: {
                double cut = cutoffs.get(spec.symbol());
                DoublePredicate below = e -> e < cut;
                return model.characteristic(spec.symbol(), matrix, below);
            }
            case HIGH_ENERGY_SPLIT: {
                double cut = cutoffs.get(spec.symbol());
                DoublePredicate above = e -> e >= cut;
                return model.characteristic(spec.symbol(), matrix, above);
            }
            default:
                return model.characteristic(spec.symbol(), matrix);
        }
    }
}
