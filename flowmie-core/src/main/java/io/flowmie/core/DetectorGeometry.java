package io.flowmie.core;

import io.flowmie.api.Detector;

/**
 * Maps a point on the detector aperture to the scattering geometry it collects.
 *
 * The aperture is a unit disk sampled in polar coordinates (r in [0, 1], phi in
 * [0, 2pi)). Its edge subtends the acceptance half-angle alpha from the particle,
 * which places the aperture at standoff distance l = 1 / tan(alpha).
 *
 *   theta(r, phi)  = thetaZero + atan(r * cos(phi) / l)   scattering angle
 *   psi(r, phi)    = psiZero   - atan(r * sin(phi) / l)   polarization angle
 *   alphaPrime(r)  = atan2(r, l)                          angle off the detector axis
 *
 * Detector angles are converted from degrees once at construction; every value
 * returned is in radians. Defined for all r and phi, no error conditions.
 */
public final class DetectorGeometry {

    private final double thetaZero;
    private final double psiZero;
    private final double alpha;
    private final double standoff;

    private DetectorGeometry(double thetaZeroDegrees, double psiZeroDegrees, double alphaDegrees) {
        this.thetaZero = toRadians(thetaZeroDegrees);
        this.psiZero = toRadians(psiZeroDegrees);
        this.alpha = toRadians(alphaDegrees);
        this.standoff = 1 / Math.tan(alpha);
    }

    public static DetectorGeometry of(Detector detector) {
        if (detector == null) {
            throw new NullPointerException("detector");
        }
        return new DetectorGeometry(
            detector.thetaZeroDegrees(), detector.psiZeroDegrees(), detector.alphaDegrees());
    }

    /** Scattering angle collected at (r, phi), radians. */
    public double theta(double r, double phi) {
        return thetaZero + Math.atan(r * Math.cos(phi) / standoff);
    }

    /** Polarization angle relative to the scattering plane at (r, phi), radians. */
    public double psi(double r, double phi) {
        return psiZero - Math.atan(r * Math.sin(phi) / standoff);
    }

    /** Angle between the detector axis and the aperture ring at radius r, radians. */
    public double alphaPrime(double r) {
        return Math.atan2(r, standoff);
    }

    /** Distance from particle to aperture plane, in aperture radii. */
    public double standoff() { return standoff; }

    public double thetaZero() { return thetaZero; }

    public double psiZero() { return psiZero; }

    public double alpha() { return alpha; }

    /** Degrees to radians as deg * pi / 180, keeping reference traces reproducible. */
    static double toRadians(double degrees) {
        return degrees * Math.PI / 180;
    }
}
