package io.flowmie.core;

import io.flowmie.api.FlowMieConstants;
import io.flowmie.api.InvalidInputException;

/**
 * Step sizes of the aperture integral.
 *
 * @param dr          radial step over the unit aperture disk, in (0, 1]
 * @param dphiDegrees azimuthal step in degrees, in (0, 360]
 */
public record IntegrationSettings(double dr, double dphiDegrees) {

    public static final String PROPERTY_DR = "flowmie.integration.dr";
    public static final String PROPERTY_DPHI = "flowmie.integration.dphi";

    /** Interactive accuracy: about 2 percent. */
    public static final IntegrationSettings DEFAULT =
        new IntegrationSettings(FlowMieConstants.DEFAULT_DR, FlowMieConstants.DEFAULT_DPHI_DEGREES);

    /** Calibration accuracy. Roughly 50x the cost of DEFAULT. */
    public static final IntegrationSettings FINE =
        new IntegrationSettings(FlowMieConstants.FINE_DR, FlowMieConstants.FINE_DPHI_DEGREES);

    public IntegrationSettings {
        if (!(dr > 0.0 && dr <= 1.0)) {
            throw InvalidInputException.invalidParameter("dr", dr, "a value in (0, 1]");
        }
        if (!(dphiDegrees > 0.0 && dphiDegrees <= 360.0)) {
            throw InvalidInputException.invalidParameter("dphi", dphiDegrees, "a value in (0, 360]");
        }
    }

    /** Number of radial samples, r = 0, dr, 2dr, ... up to 1. */
    public int radialSteps() {
        return (int) Math.floor(1.0 / dr + FlowMieConstants.STEP_COUNT_FUZZ) + 1;
    }

    /** Number of azimuthal samples, phi = 0, dphi, ... up to 2pi - dphi. */
    public int azimuthalSteps() {
        double dphi = DetectorGeometry.toRadians(dphiDegrees);
        return (int) Math.floor((2 * Math.PI - dphi) / dphi + FlowMieConstants.STEP_COUNT_FUZZ) + 1;
    }

    /**
     * Reads {@value #PROPERTY_DR} and {@value #PROPERTY_DPHI}, falling back to DEFAULT
     * for unset properties.
     *
     * @throws InvalidInputException for unparseable or out-of-range values
     */
    public static IntegrationSettings fromSystemProperties() {
        double dr = readDouble(PROPERTY_DR, DEFAULT.dr());
        double dphi = readDouble(PROPERTY_DPHI, DEFAULT.dphiDegrees());
        return new IntegrationSettings(dr, dphi);
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException("System property " + property + " is not a number: " + raw, e);
        }
    }
}
