package org.eds.metadata;

import org.eds.model.EnergyAxis;

import java.util.List;

/**
 * Everything a dataset records about its acquisition and about the model built on it.
 * Immutable: every change goes through a {@code with...} copy and is persisted by
 * {@link org.eds.io.json.MetadataStore}.
 */
public record DatasetMetadata(Microscope microscope,
                              Detector detector,
                              Sample sample,
                              EnergyAxis energyAxis,
                              String xrayDb,
                              ModelState model,
                              GroundTruthData truth) {

    public static final String DEFAULT_XRAY_DB = "default_xrays.json";

    public static DatasetMetadata of(EnergyAxis energyAxis) {
        return new DatasetMetadata(null, null, new Sample(null, null, List.of()), energyAxis, null, null, null);
    }

    public DatasetMetadata withMicroscope(Microscope m) {
        return new DatasetMetadata(m, detector, sample, energyAxis, xrayDb, model, truth);
    }

    public DatasetMetadata withDetector(Detector d) {
        return new DatasetMetadata(microscope, d, sample, energyAxis, xrayDb, model, truth);
    }

    public DatasetMetadata withSample(Sample s) {
        return new DatasetMetadata(microscope, detector, s, energyAxis, xrayDb, model, truth);
    }

    public DatasetMetadata withEnergyAxis(EnergyAxis axis) {
        return new DatasetMetadata(microscope, detector, sample, axis, xrayDb, model, truth);
    }

    public DatasetMetadata withXrayDb(String db) {
        return new DatasetMetadata(microscope, detector, sample, energyAxis, db, model, truth);
    }

    public DatasetMetadata withModel(ModelState state) {
        return new DatasetMetadata(microscope, detector, sample, energyAxis, xrayDb, state, truth);
    }

    public DatasetMetadata withTruth(GroundTruthData gt) {
        return new DatasetMetadata(microscope, detector, sample, energyAxis, xrayDb, model, gt);
    }
}
