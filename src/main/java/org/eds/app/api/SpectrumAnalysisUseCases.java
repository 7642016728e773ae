package org.eds.app.api;

import org.apache.commons.math3.linear.RealMatrix;
import org.eds.constraint.ConstraintMatrix;
import org.eds.constraint.SpatialConstraint;
import org.eds.dictionary.PhysicsDictionary;
import org.eds.dictionary.ProblemType;
import org.eds.element.ElementSpec;
import org.eds.engine.FittedDecomposition;
import org.eds.metadata.Detector;
import org.eds.metadata.DatasetMetadata;
import org.eds.metadata.Microscope;
import org.eds.metadata.Sample;
import org.eds.model.SpectrumImage;
import org.eds.quant.ConcentrationReport;
import org.eds.quant.ModelContributions;
import org.eds.quant.QuantificationResult;
import org.eds.truth.GroundTruth;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Application boundary for analysing one spectrum image.
 * Keeps callers independent from the physics, constraint and quantification packages.
 */
public interface SpectrumAnalysisUseCases {

    void open(SpectrumImage image);

    SpectrumImage image();

    void loadMetadata(Path path);

    void saveMetadata(Path path);

    void setMicroscopeParameters(double beamEnergy, double azimuthAngle, double elevationAngle, double tiltStage);

    default void setMicroscopeParameters() {
        setMicroscopeParameters(Microscope.DEFAULT_BEAM_ENERGY, 0.0, Microscope.DEFAULT_ELEVATION, 0.0);
    }

    /**
     * Sets sample and detector parameters and recomputes the take-off angle from the
     * microscope geometry.
     */
    void setAnalysisParameters(double thickness, double density, String detectorType,
                               double widthSlope, double widthIntercept, String xrayDb);

    default void setAnalysisParameters() {
        setAnalysisParameters(Sample.DEFAULT_THICKNESS, Sample.DEFAULT_DENSITY, Detector.DEFAULT_TYPE,
                Detector.DEFAULT_WIDTH_SLOPE, Detector.DEFAULT_WIDTH_INTERCEPT, DatasetMetadata.DEFAULT_XRAY_DB);
    }

    /**
     * Resolves the identifiers and stores them as the sample element list.
     */
    List<ElementSpec> addElements(List<?> identifiers);

    PhysicsDictionary buildDictionary(ProblemType mode, Map<String, Double> referenceElements, List<String> stoichiometries);

    default PhysicsDictionary buildDictionary(ProblemType mode) {
        return buildDictionary(mode, Map.of(), List.of());
    }

    PhysicsDictionary rebuildDictionary();

    /**
     * Re-evaluates the background columns of the current dictionary from a partial W.
     */
    PhysicsDictionary refreshDictionary(RealMatrix partialW);

    Optional<PhysicsDictionary> dictionary();

    ConstraintMatrix fixedW(Map<String, ? extends Map<String, Double>> phases);

    ConstraintMatrix chemicalMappingW(int backgroundComponents);

    ConstraintMatrix fixedH(Map<String, ? extends SpatialConstraint> phases);

    GroundTruth groundTruth(boolean reshape);

    RealMatrix noiselessData();

    FittedDecomposition decompose(int components, ConstraintMatrix fixedW, ConstraintMatrix fixedH, boolean[] navigationMask);

    Optional<FittedDecomposition> lastFit();

    QuantificationResult quantify(boolean useNavigationMask, Collection<String> skipElements);

    /**
     * @see ConcentrationReport
     */
    String concentrationReport(boolean absolute, Collection<String> selectedElements);

    ModelContributions modelContributions();

    void recalibrate(double measuredLow, double measuredHigh, double trueLow, double trueHigh);
}
