package org.eds.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * EDS detector description.
 *
 * The response is either a named efficiency table ({@code type}, e.g. {@code SDD_efficiency.txt})
 * or a parametric model made of absorbing {@code layers} in front of an active {@code sensor}.
 * Line widths follow {@code sigma(E) = widthSlope * E + widthIntercept} in keV.
 */
public record Detector(String type,
                       List<DetectorLayer> layers,
                       DetectorLayer sensor,
                       Double widthSlope,
                       Double widthIntercept,
                       Double takeOffAngle) {

    public static final String DEFAULT_TYPE = "SDD_efficiency.txt";
    public static final double DEFAULT_WIDTH_SLOPE = 0.01;
    public static final double DEFAULT_WIDTH_INTERCEPT = 0.065;

    public Detector {
        layers = (layers == null) ? null : List.copyOf(layers);
    }

    @JsonIgnore
    public boolean isParametric() {
        return sensor != null;
    }

    public Detector withTakeOffAngle(double toa) {
        return new Detector(type, layers, sensor, widthSlope, widthIntercept, toa);
    }
}
