package org.eds.app.service;

import org.apache.commons.math3.linear.RealMatrix;
import org.eds.app.api.SpectrumAnalysisUseCases;
import org.eds.constraint.ConstraintMatrix;
import org.eds.constraint.FixedHBuilder;
import org.eds.constraint.FixedWBuilder;
import org.eds.constraint.SpatialConstraint;
import org.eds.dictionary.BremsstrahlungDictionary;
import org.eds.dictionary.PhysicsDictionary;
import org.eds.dictionary.PhysicsDictionaryBuilder;
import org.eds.dictionary.ProblemType;
import org.eds.element.ElementResolver;
import org.eds.element.ElementSpec;
import org.eds.element.PeriodicTable;
import org.eds.engine.DecompositionEngine;
import org.eds.engine.DecompositionRequest;
import org.eds.engine.FittedDecomposition;
import org.eds.error.MissingMetadataException;
import org.eds.io.json.MetadataStore;
import org.eds.metadata.DatasetMetadata;
import org.eds.metadata.Detector;
import org.eds.metadata.Microscope;
import org.eds.metadata.ModelState;
import org.eds.metadata.Sample;
import org.eds.model.SpectrumImage;
import org.eds.physics.TakeOffAngle;
import org.eds.quant.ConcentrationReport;
import org.eds.quant.ModelContributions;
import org.eds.quant.QuantificationPipeline;
import org.eds.quant.QuantificationResult;
import org.eds.truth.GroundTruth;
import org.eds.truth.GroundTruthAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Default application service: one dataset, its dictionary and its last fit. */
public final class SpectrumAnalysisService implements SpectrumAnalysisUseCases {

    private static final Logger LOG = LoggerFactory.getLogger(SpectrumAnalysisService.class);

    private final DecompositionEngine engine;
    private final ElementResolver resolver;
    private final PhysicsDictionaryBuilder dictionaryBuilder;
    private final FixedWBuilder fixedWBuilder;
    private final MetadataStore store;

    private SpectrumImage image;
    private PhysicsDictionary dictionary;
    private FittedDecomposition fit;
    private boolean[] fitMask;

    public SpectrumAnalysisService(DecompositionEngine engine) {
        this(engine, PeriodicTable.standard(), false);
    }

    /**
     * @param strictConstraints reject W constraint identifiers that match no row instead of ignoring them
     */
    public SpectrumAnalysisService(DecompositionEngine engine, PeriodicTable table, boolean strictConstraints) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(table, "table must not be null");
        this.resolver = new ElementResolver(table);
        this.dictionaryBuilder = new PhysicsDictionaryBuilder(table);
        this.fixedWBuilder = new FixedWBuilder(resolver, strictConstraints);
        this.store = new MetadataStore();
    }

    @Override
    public void open(SpectrumImage image) {
        this.image = Objects.requireNonNull(image, "image must not be null");
        this.dictionary = null;
        this.fit = null;
        this.fitMask = null;
    }

    @Override
    public SpectrumImage image() {
        return requireImage();
    }

    @Override
    public void loadMetadata(Path path) {
        requireImage().setMetadata(store.load(path));
        this.dictionary = null;
    }

    @Override
    public void saveMetadata(Path path) {
        store.save(requireImage().metadata(), path);
    }

    @Override
    public void setMicroscopeParameters(double beamEnergy, double azimuthAngle, double elevationAngle, double tiltStage) {
        SpectrumImage img = requireImage();
        Microscope m = new Microscope(beamEnergy, tiltStage, azimuthAngle, elevationAngle,
                Microscope.DEFAULT_RESOLUTION_MNKA);
        DatasetMetadata md = img.metadata().withMicroscope(m);
        if (md.detector() != null) {
            md = md.withDetector(md.detector().withTakeOffAngle(takeOffAngle(m)));
        }
        img.setMetadata(md);
    }

    @Override
    public void setAnalysisParameters(double thickness, double density, String detectorType,
                                      double widthSlope, double widthIntercept, String xrayDb) {
        SpectrumImage img = requireImage();
        DatasetMetadata md = img.metadata();
        if (md.microscope() == null) {
            throw new MissingMetadataException("Microscope parameters are not set; call setMicroscopeParameters first");
        }
        if (!(thickness > 0.0) || !(density > 0.0)) {
            throw new IllegalArgumentException("thickness and density must be > 0");
        }
        Objects.requireNonNull(detectorType, "detectorType must not be null");

        List<String> elements = (md.sample() == null) ? List.of() : md.sample().elements();
        Detector detector = new Detector(detectorType, null, null, widthSlope, widthIntercept,
                takeOffAngle(md.microscope()));
        img.setMetadata(md
                .withSample(new Sample(thickness, density, elements))
                .withDetector(detector)
                .withXrayDb(xrayDb == null ? DatasetMetadata.DEFAULT_XRAY_DB : xrayDb));
    }

    @Override
    public List<ElementSpec> addElements(List<?> identifiers) {
        SpectrumImage img = requireImage();
        List<ElementSpec> resolved = resolver.resolve(identifiers);
        List<String> labels = new ArrayList<>(resolved.size());
        for (ElementSpec e : resolved) labels.add(e.label());

        DatasetMetadata md = img.metadata();
        Sample sample = (md.sample() == null) ? new Sample(null, null, labels) : md.sample().withElements(labels);
        img.setMetadata(md.withSample(sample));
        return resolved;
    }

    @Override
    public PhysicsDictionary buildDictionary(ProblemType mode, Map<String, Double> referenceElements, List<String> stoichiometries) {
        this.dictionary = dictionaryBuilder.build(requireImage(), mode, referenceElements, stoichiometries);
        LOG.debug("Dictionary built: {} with columns {}", mode, dictionary.columnLabels());
        return dictionary;
    }

    @Override
    public PhysicsDictionary rebuildDictionary() {
        this.dictionary = dictionaryBuilder.rebuild(requireImage());
        return dictionary;
    }

    @Override
    public PhysicsDictionary refreshDictionary(RealMatrix partialW) {
        PhysicsDictionary d = requireDictionary();
        if (!(d instanceof BremsstrahlungDictionary)) {
            throw new IllegalStateException("Only a bremsstrahlung dictionary can be refreshed, current is "
                    + d.problemType());
        }
        return ((BremsstrahlungDictionary) d).refresh(partialW);
    }

    @Override
    public Optional<PhysicsDictionary> dictionary() {
        return Optional.ofNullable(dictionary);
    }

    @Override
    public ConstraintMatrix fixedW(Map<String, ? extends Map<String, Double>> phases) {
        return fixedWBuilder.buildFixedW(phases, requireDictionary());
    }

    @Override
    public ConstraintMatrix chemicalMappingW(int backgroundComponents) {
        return fixedWBuilder.buildChemicalMappingW(requireDictionary(), backgroundComponents);
    }

    @Override
    public ConstraintMatrix fixedH(Map<String, ? extends SpatialConstraint> phases) {
        return FixedHBuilder.forImage(requireImage()).buildFixedH(phases);
    }

    @Override
    public GroundTruth groundTruth(boolean reshape) {
        return GroundTruthAccessor.extract(requireImage().metadata(), reshape);
    }

    @Override
    public RealMatrix noiselessData() {
        return GroundTruthAccessor.noiselessData(requireImage().metadata());
    }

    @Override
    public FittedDecomposition decompose(int components, ConstraintMatrix fixedW, ConstraintMatrix fixedH, boolean[] navigationMask) {
        SpectrumImage img = requireImage();
        DecompositionRequest request = new DecompositionRequest(
                img.dataMatrix(), requireDictionary(), components, fixedW, fixedH, navigationMask);
        FittedDecomposition result = engine.decompose(request);
        if (result == null) {
            throw new IllegalStateException("Decomposition engine returned no result");
        }
        this.fit = result;
        this.fitMask = request.navigationMask();
        LOG.info("Decomposition finished: {} components over {} pixels", components, img.pixelCount());
        return result;
    }

    @Override
    public Optional<FittedDecomposition> lastFit() {
        return Optional.ofNullable(fit);
    }

    @Override
    public QuantificationResult quantify(boolean useNavigationMask, Collection<String> skipElements) {
        FittedDecomposition f = requireFit();
        boolean[] mask = (useNavigationMask) ? fitMask : null;
        return QuantificationPipeline.forImage(requireImage()).quantify(f, mask, skipElements);
    }

    @Override
    public String concentrationReport(boolean absolute, Collection<String> selectedElements) {
        FittedDecomposition f = requireFit();
        ModelState state = requireModelState();
        double[] norms = state.norm();
        if (norms.length == 0) {
            norms = new double[state.elements().size()];
            Arrays.fill(norms, 1.0);
        }
        return new ConcentrationReport(state.elements(), norms).render(f.w(), absolute, selectedElements);
    }

    @Override
    public ModelContributions modelContributions() {
        FittedDecomposition f = requireFit();
        if (fitMask != null) {
            f = new FittedDecomposition(f.w(), ModelContributions.fixMaskedH(f.h(), fitMask), f.g());
        }
        return new ModelContributions(f, requireModelState().elements());
    }

    @Override
    public void recalibrate(double measuredLow, double measuredHigh, double trueLow, double trueHigh) {
        SpectrumImage img = requireImage();
        DatasetMetadata md = img.metadata();
        if (md.energyAxis() == null) {
            throw new MissingMetadataException("Energy axis is not set");
        }
        img.setMetadata(md.withEnergyAxis(md.energyAxis().recalibrate(measuredLow, measuredHigh, trueLow, trueHigh)));
        LOG.info("Energy axis recalibrated to {}", img.metadata().energyAxis());
    }

    private static double takeOffAngle(Microscope m) {
        return TakeOffAngle.of(m.tiltAlpha(), m.azimuthAngle(), m.elevationAngle());
    }

    private SpectrumImage requireImage() {
        if (image == null) {
            throw new IllegalStateException("No spectrum image open");
        }
        return image;
    }

    private PhysicsDictionary requireDictionary() {
        if (dictionary == null) {
            throw new IllegalStateException("No dictionary built; call buildDictionary first");
        }
        return dictionary;
    }

    private FittedDecomposition requireFit() {
        if (fit == null) {
            throw new IllegalStateException("No decomposition result; call decompose first");
        }
        return fit;
    }

    private ModelState requireModelState() {
        ModelState state = requireImage().metadata().model();
        if (state == null) {
            throw new MissingMetadataException("No dictionary model stored in metadata; build one first");
        }
        return state;
    }
}
