package org.eds.physics;

import org.eds.error.CalibrationException;
import org.eds.error.MissingMetadataException;
import org.eds.metadata.DatasetMetadata;
import org.eds.metadata.Detector;
import org.eds.metadata.Sample;
import org.eds.model.EnergyAxis;

import java.util.Objects;

/**
 * The physics inputs of a dictionary build, validated and gathered from dataset metadata.
 *
 * @param beamEnergy     keV
 * @param axis           energy calibration of the data
 * @param thickness      cm
 * @param density        g/cm3
 * @param takeOffAngle   degrees
 * @param detector       efficiency description
 * @param lineShape      detector line broadening
 * @param xrayDb         name of the line database resource
 */
public record PhysicsParameters(double beamEnergy,
                                EnergyAxis axis,
                                double thickness,
                                double density,
                                double takeOffAngle,
                                Detector detector,
                                LineShape lineShape,
                                String xrayDb) {

    /**
     * Channel energies at or below this offset (keV) make line shapes undefined.
     */
    public static final double MIN_ENERGY_OFFSET = 0.01;

    public PhysicsParameters {
        Objects.requireNonNull(axis, "axis must not be null");
        Objects.requireNonNull(detector, "detector must not be null");
        Objects.requireNonNull(lineShape, "lineShape must not be null");
        Objects.requireNonNull(xrayDb, "xrayDb must not be null");
        if (!(beamEnergy > 0.0)) {
            throw new IllegalArgumentException("beam energy must be > 0");
        }
        if (!(axis.offset() > MIN_ENERGY_OFFSET)) {
            throw new CalibrationException("The energy axis starts at " + axis.offset()
                    + " keV; it must not include 0 (offset > " + MIN_ENERGY_OFFSET + "). Crop the data.");
        }
    }

    /**
     * @throws MissingMetadataException if beam energy, detector, absorption parameters or energy axis are absent
     * @throws CalibrationException     if the energy axis includes zero
     */
    public static PhysicsParameters from(DatasetMetadata md) {
        Objects.requireNonNull(md, "metadata must not be null");
        if (md.energyAxis() == null) {
            throw new MissingMetadataException("Energy axis is not set");
        }
        if (md.microscope() == null || md.microscope().beamEnergy() == null) {
            throw new MissingMetadataException("Beam energy is not set; call setMicroscopeParameters first");
        }
        Detector d = md.detector();
        if (d == null || (d.type() == null && !d.isParametric())) {
            throw new MissingMetadataException("Detector type is not set; call setAnalysisParameters first");
        }
        if (d.widthSlope() == null || d.widthIntercept() == null) {
            throw new MissingMetadataException("Detector width slope/intercept are not set");
        }
        if (d.takeOffAngle() == null) {
            throw new MissingMetadataException("Take-off angle is not set; call setAnalysisParameters first");
        }
        Sample s = md.sample();
        if (s == null || s.thickness() == null || s.density() == null) {
            throw new MissingMetadataException("Sample thickness/density are not set; call setAnalysisParameters first");
        }
        String db = (md.xrayDb() == null) ? DatasetMetadata.DEFAULT_XRAY_DB : md.xrayDb();
        return new PhysicsParameters(
                md.microscope().beamEnergy(),
                md.energyAxis(),
                s.thickness(),
                s.density(),
                d.takeOffAngle(),
                d,
                new LineShape(d.widthSlope(), d.widthIntercept()),
                db
        );
    }
}
