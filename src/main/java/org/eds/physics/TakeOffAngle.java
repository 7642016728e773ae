package org.eds.physics;

/**
 * Detector take-off angle (degrees) from stage and detector geometry.
 */
public final class TakeOffAngle {

    private TakeOffAngle() {
    }

    /**
     * Angle between the specimen surface and the line to the detector.
     * The detector sits at {@code elevation} above the untilted specimen plane and at
     * {@code azimuth} from the tilt direction; the stage is tilted by {@code tiltAlpha}.
     * For an untilted stage the result equals the elevation.
     */
    public static double of(double tiltAlpha, double azimuth, double elevation) {
        double a = Math.toRadians(tiltAlpha);
        double c = Math.toRadians(azimuth);
        double e = Math.toRadians(elevation);
        double s = Math.cos(e) * Math.cos(c) * Math.sin(a) + Math.sin(e) * Math.cos(a);
        return Math.toDegrees(Math.asin(Math.max(-1.0, Math.min(1.0, s))));
    }
}
