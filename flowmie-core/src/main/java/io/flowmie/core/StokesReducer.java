package io.flowmie.core;

import io.flowmie.api.DimensionMismatchException;
import io.flowmie.api.InvalidInputException;
import io.flowmie.api.ScatteringAmplitudes;
import org.apache.commons.math3.complex.Complex;

/**
 * Reduces complex scattering amplitudes to intensity-basis Stokes elements.
 *
 *   S11 = 0.5 * (|S2|^2 + |S1|^2)
 *   S12 = 0.5 * (|S2|^2 - |S1|^2)
 *
 * Output is aligned with the input angle grid. Stateless.
 */
public final class StokesReducer {

    private StokesReducer() {}

    public static StokesElements reduce(ScatteringAmplitudes amplitudes) {
        if (amplitudes == null) {
            throw new NullPointerException("amplitudes");
        }
        return reduceValidated(amplitudes.thetaRadians(), amplitudes.s1(), amplitudes.s2());
    }

    /**
     * Reduces raw parallel arrays. The grid gets the same checks as {@link ScatteringAmplitudes}.
     *
     * @throws DimensionMismatchException if s1, s2 and the grid differ in length
     * @throws InvalidInputException      if the grid is empty, unsorted or not finite
     */
    public static StokesElements reduce(double[] thetaRadians, Complex[] s1, Complex[] s2) {
        return reduce(new ScatteringAmplitudes(thetaRadians, s1, s2));
    }

    private static StokesElements reduceValidated(double[] thetaRadians, Complex[] s1, Complex[] s2) {
        int n = s1.length;
        double[] s11 = new double[n];
        double[] s12 = new double[n];
        for (int i = 0; i < n; i++) {
            double a1 = s1[i].abs();
            double a2 = s2[i].abs();
            double i1 = a1 * a1;
            double i2 = a2 * a2;
            s11[i] = 0.5 * (i2 + i1);
            s12[i] = 0.5 * (i2 - i1);
        }
        return new StokesElements(thetaRadians, s11, s12);
    }
}
