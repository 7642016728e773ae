package org.eds.physics;

/**
 * Relative characteristic emission strength per atom: an ionisation cross-section
 * times the fluorescence yield of the shell.
 */
public final class EmissionModel {

    private EmissionModel() {
    }

    /**
     * Bethe-type cross-section shape {@code ln(U) / (U * Ec^2)} with overvoltage {@code U = E0 / Ec}.
     * Zero when the beam cannot ionise the shell.
     */
    public static double crossSection(double beamEnergy, double edgeEnergy) {
        if (!(edgeEnergy > 0.0)) {
            return 0.0;
        }
        double u = beamEnergy / edgeEnergy;
        if (u <= 1.0) {
            return 0.0;
        }
        return Math.log(u) / (u * edgeEnergy * edgeEnergy);
    }

    /**
     * Fluorescence yield {@code Z^4 / (a + Z^4)} with a shell-dependent constant.
     */
    public static double fluorescenceYield(int z, String family) {
        double a = switch (family) {
            case "K" -> 1.0e6;
            case "L" -> 1.0e8;
            case "M" -> 1.0e9;
            default -> throw new IllegalArgumentException("Unknown line family: " + family);
        };
        double z4 = Math.pow(z, 4);
        return z4 / (a + z4);
    }
}
