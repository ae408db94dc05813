package io.flowmie.core;

import io.flowmie.api.Detector;
import io.flowmie.api.EfficiencyProfile;
import io.flowmie.api.FlowMieConstants;
import io.flowmie.api.ScatteringAmplitudes;

/**
 * Numerical integral of scattered light over a finite detector aperture.
 *
 * ALGORITHM:
 *   for r   = 0, dr, 2dr, ... 1                 (ascending, outer loop)
 *     for phi = 0, dphi, ... 2pi - dphi         (ascending, inner loop)
 *       theta, psi, alphaPrime from DetectorGeometry
 *       (S11, S12) = sample of the angle grid nearest theta
 *       signal += eta(alphaPrime, alpha) * (S11 + S12 * pol * cos(2 psi)) * r * dr * dphi
 *   signal = signal / A * gain,  A = pi (unit-disk aperture)
 *
 * The nearest-sample lookup is intentional: no interpolation between grid angles.
 * A coarser amplitude grid therefore limits accuracy directly, and reference signals
 * are only reproducible with this exact lookup and loop order.
 *
 * Stateless. Stokes elements are recomputed from the amplitudes on every call.
 */
public final class DetectorResponseIntegrator {

    private DetectorResponseIntegrator() {}

    /** Integrates with DEFAULT steps (dr = 0.02, dphi = 10 degrees). */
    public static double response(ScatteringAmplitudes amplitudes, Detector detector) {
        return response(amplitudes, detector, IntegrationSettings.DEFAULT);
    }

    /**
     * @param dr          radial step, in (0, 1]
     * @param dphiDegrees azimuthal step in degrees, in (0, 360]
     * @throws io.flowmie.api.InvalidInputException if a step is out of range
     */
    public static double response(ScatteringAmplitudes amplitudes, Detector detector,
                                  double dr, double dphiDegrees) {
        return response(amplitudes, detector, new IntegrationSettings(dr, dphiDegrees));
    }

    public static double response(ScatteringAmplitudes amplitudes, Detector detector,
                                  IntegrationSettings settings) {
        if (amplitudes == null) {
            throw new NullPointerException("amplitudes");
        }
        return response(StokesReducer.reduce(amplitudes), detector, settings);
    }

    /**
     * Integrates pre-reduced Stokes elements over the detector aperture.
     *
     * @return predicted signal, dimensionless per unit incident intensity, times gain
     */
    public static double response(StokesElements stokes, Detector detector, IntegrationSettings settings) {
        if (stokes == null) {
            throw new NullPointerException("stokes");
        }
        if (detector == null) {
            throw new NullPointerException("detector");
        }
        if (settings == null) {
            throw new NullPointerException("settings");
        }

        DetectorGeometry geometry = DetectorGeometry.of(detector);
        EfficiencyProfile eta = detector.efficiency();
        double alpha = geometry.alpha();
        double pol = detector.polarization();
        double[] grid = stokes.grid();

        double dr = settings.dr();
        double dphi = DetectorGeometry.toRadians(settings.dphiDegrees());
        int radialSteps = settings.radialSteps();
        int azimuthalSteps = settings.azimuthalSteps();
        double phiMax = 2 * Math.PI - dphi;

        double signal = 0;
        for (int i = 0; i < radialSteps; i++) {
            double r = Math.min(i * dr, 1.0);
            // efficiency depends on r only
            double eff = eta.efficiency(geometry.alphaPrime(r), alpha);
            for (int j = 0; j < azimuthalSteps; j++) {
                double phi = Math.min(j * dphi, phiMax);
                double theta = geometry.theta(r, phi);
                double psi = geometry.psi(r, phi);

                int idx = nearestIndex(grid, theta);
                double s11 = stokes.s11(idx);
                double s12 = stokes.s12(idx);

                signal += eff * (s11 + s12 * pol * Math.cos(2 * psi)) * r * dr * dphi;
            }
        }

        signal = signal / FlowMieConstants.APERTURE_AREA;
        return signal * detector.gain();
    }

    /**
     * Index of the grid angle closest to theta. Ties resolve to the first occurrence.
     * Exposed for testing.
     *
     * @param grid  sorted ascending, non-empty
     * @param theta query angle, same unit as the grid
     */
    public static int nearestIndex(double[] grid, double theta) {
        int lo = 0;
        int hi = grid.length - 1;
        if (theta <= grid[lo]) {
            return lo;
        }
        if (theta >= grid[hi]) {
            return firstOf(grid, hi);
        }
        // invariant: grid[lo] < theta < grid[hi]
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (grid[mid] < theta) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        double below = Math.abs(grid[lo] - theta);
        double above = Math.abs(grid[hi] - theta);
        return above < below ? firstOf(grid, hi) : firstOf(grid, lo);
    }

    private static int firstOf(double[] grid, int index) {
        int i = index;
        while (i > 0 && grid[i - 1] == grid[index]) {
            i--;
        }
        return i;
    }
}
