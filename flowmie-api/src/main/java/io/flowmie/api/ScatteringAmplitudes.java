package io.flowmie.api;

import org.apache.commons.math3.complex.Complex;

/**
 * Far-field scattering amplitudes S1(theta), S2(theta) sampled on a sorted angle grid.
 *
 * Produced fresh per particle by an {@link AmplitudeProvider} and never cached by the
 * engine. Angles are held in radians. Arrays are copied on the way in and on the way out.
 */
public final class ScatteringAmplitudes {

    private final double[] thetaRadians;
    private final Complex[] s1;
    private final Complex[] s2;

    public ScatteringAmplitudes(double[] thetaRadians, Complex[] s1, Complex[] s2) {
        if (thetaRadians == null) {
            throw new NullPointerException("thetaRadians");
        }
        if (s1 == null) {
            throw new NullPointerException("s1");
        }
        if (s2 == null) {
            throw new NullPointerException("s2");
        }
        if (s1.length != s2.length) {
            throw new DimensionMismatchException("S2", s1.length, s2.length);
        }
        if (thetaRadians.length != s1.length) {
            throw new DimensionMismatchException("Angle grid", s1.length, thetaRadians.length);
        }
        if (thetaRadians.length == 0) {
            throw new InvalidInputException("Amplitude grid must contain at least one angle");
        }
        for (int i = 0; i < thetaRadians.length; i++) {
            if (!Double.isFinite(thetaRadians[i])) {
                throw InvalidInputException.invalidParameter("theta[" + i + "]", thetaRadians[i], "a finite angle");
            }
            if (i > 0 && thetaRadians[i] < thetaRadians[i - 1]) {
                throw new InvalidInputException(
                    "Angle grid must be sorted ascending; theta[" + i + "] < theta[" + (i - 1) + "]");
            }
            if (s1[i] == null || s2[i] == null) {
                throw new NullPointerException("amplitude sample " + i);
            }
        }
        this.thetaRadians = thetaRadians.clone();
        this.s1 = s1.clone();
        this.s2 = s2.clone();
    }

    /** Builds amplitudes from an angle grid given in degrees. Converted once at entry. */
    public static ScatteringAmplitudes fromDegrees(double[] thetaDegrees, Complex[] s1, Complex[] s2) {
        if (thetaDegrees == null) {
            throw new NullPointerException("thetaDegrees");
        }
        double[] radians = new double[thetaDegrees.length];
        for (int i = 0; i < thetaDegrees.length; i++) {
            radians[i] = thetaDegrees[i] * Math.PI / 180.0;
        }
        return new ScatteringAmplitudes(radians, s1, s2);
    }

    public int size() { return thetaRadians.length; }

    public double[] thetaRadians() { return thetaRadians.clone(); }

    public Complex[] s1() { return s1.clone(); }

    public Complex[] s2() { return s2.clone(); }

    public double thetaRadians(int index) { return thetaRadians[index]; }

    public Complex s1(int index) { return s1[index]; }

    public Complex s2(int index) { return s2[index]; }

    @Override
    public String toString() {
        return "ScatteringAmplitudes{samples=" + thetaRadians.length
            + ", theta=[" + thetaRadians[0] + ".." + thetaRadians[thetaRadians.length - 1] + "] rad}";
    }
}
