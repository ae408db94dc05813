package io.flowmie.calibration;

import io.flowmie.api.FlowMieConstants;
import io.flowmie.api.InvalidInputException;

/**
 * Diameter sweeps for calibration tables.
 */
public final class DiameterSeries {

    private DiameterSeries() {}

    /**
     * from, from + step, ... up to and including to (when reached within rounding).
     * Values are computed as from + i * step, never by accumulation.
     *
     * @throws InvalidInputException if step is not positive or to is below from
     */
    public static double[] range(double from, double to, double step) {
        if (!Double.isFinite(from) || !Double.isFinite(to)) {
            throw new InvalidInputException("Sweep bounds must be finite: [" + from + ", " + to + "]");
        }
        if (!(step > 0.0) || Double.isInfinite(step)) {
            throw InvalidInputException.invalidParameter("step", step, "a finite value > 0");
        }
        if (to < from) {
            throw new InvalidInputException("Sweep end " + to + " is below its start " + from);
        }
        int n = (int) Math.floor((to - from) / step + FlowMieConstants.STEP_COUNT_FUZZ);
        double[] out = new double[n + 1];
        for (int i = 0; i <= n; i++) {
            out[i] = Math.min(from + i * step, to);
        }
        return out;
    }

    /** Default sweep: 20 nm to 1000 nm in 10 nm steps. */
    public static double[] defaultSweep() {
        return range(FlowMieConstants.SWEEP_MIN_DIAMETER_NM,
            FlowMieConstants.SWEEP_MAX_DIAMETER_NM,
            FlowMieConstants.SWEEP_STEP_NM);
    }
}
