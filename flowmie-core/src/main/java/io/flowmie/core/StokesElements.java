package io.flowmie.core;

import io.flowmie.api.DimensionMismatchException;

/**
 * Intensity-basis Stokes elements S11(theta) and S12(theta) on an angle grid (radians).
 * S11 is the total scattered intensity; S12 the polarization-dependent part.
 *
 * Built only by StokesReducer, so the grid is non-empty, finite and sorted ascending.
 */
public final class StokesElements {

    private final double[] thetaRadians;
    private final double[] s11;
    private final double[] s12;

    StokesElements(double[] thetaRadians, double[] s11, double[] s12) {
        if (s11.length != thetaRadians.length) {
            throw new DimensionMismatchException("S11", thetaRadians.length, s11.length);
        }
        if (s12.length != thetaRadians.length) {
            throw new DimensionMismatchException("S12", thetaRadians.length, s12.length);
        }
        this.thetaRadians = thetaRadians;
        this.s11 = s11;
        this.s12 = s12;
    }

    public int size() { return thetaRadians.length; }

    public double thetaRadians(int index) { return thetaRadians[index]; }

    public double s11(int index) { return s11[index]; }

    public double s12(int index) { return s12[index]; }

    public double[] thetaRadians() { return thetaRadians.clone(); }

    public double[] s11() { return s11.clone(); }

    public double[] s12() { return s12.clone(); }

    /** Grid used for nearest-angle lookup. Not copied; callers must not mutate. */
    double[] grid() { return thetaRadians; }
}
