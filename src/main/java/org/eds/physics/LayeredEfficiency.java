package org.eds.physics;

import org.eds.metadata.DetectorLayer;

import java.util.List;
import java.util.Objects;

/**
 * Parametric detector: photons are transmitted through each absorbing layer
 * (window, contacts, dead layer) and then absorbed in the active sensor.
 * {@code eff(E) = prod_l exp(-mu_l rho_l t_l) * (1 - exp(-mu_s rho_s t_s))}
 */
public final class LayeredEfficiency implements DetectorEfficiency {

    private final List<DetectorLayer> layers;
    private final DetectorLayer sensor;
    private final MassAttenuation attenuation;

    public LayeredEfficiency(List<DetectorLayer> layers, DetectorLayer sensor, MassAttenuation attenuation) {
        this.layers = (layers == null) ? List.of() : List.copyOf(layers);
        this.sensor = Objects.requireNonNull(sensor, "sensor must not be null");
        this.attenuation = Objects.requireNonNull(attenuation, "attenuation must not be null");
    }

    @Override
    public double at(double energy) {
        double transmission = 1.0;
        for (DetectorLayer l : layers) {
            transmission *= Math.exp(-attenuation.of(l.element(), energy) * l.density() * l.thickness());
        }
        double absorbed = 1.0 - Math.exp(-attenuation.of(sensor.element(), energy) * sensor.density() * sensor.thickness());
        return transmission * absorbed;
    }
}
