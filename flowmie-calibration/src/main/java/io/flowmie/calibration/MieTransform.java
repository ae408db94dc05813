package io.flowmie.calibration;

import io.flowmie.api.AmbiguousInversionException;
import io.flowmie.api.CalibrationTable;
import io.flowmie.api.Detector;
import io.flowmie.api.InvalidInputException;
import io.flowmie.api.SignalOutOfRangeException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inverts detector signals to particle diameters through a calibration table.
 *
 * INVERSION:
 *   1. Negative signals (possible after back-transforming instrument channels) are
 *      clamped to 0. This floor is deliberate; such events are not dropped.
 *   2. Signals outside [minSignal, maxSignal] of the table fail with
 *      SignalOutOfRangeException, which reports the signal as passed in, before
 *      clamping. There is no extrapolation.
 *   3. Every table segment whose signal span contains the value contributes one root,
 *      linearly interpolated in diameter. A value on a table node yields that node's
 *      diameter exactly.
 *   4. More than one distinct root (resonance folding, or a flat segment at the value)
 *      fails with AmbiguousInversionException carrying every candidate.
 *
 * Immutable and safe to share between threads.
 */
public final class MieTransform {

    private static final Logger log = LoggerFactory.getLogger(MieTransform.class);

    private final CalibrationTable table;

    public MieTransform(CalibrationTable table) {
        if (table == null) {
            throw new NullPointerException("table");
        }
        this.table = table;
    }

    /**
     * Transform backed by the lookup table attached to a calibrated detector.
     *
     * @throws InvalidInputException if the detector carries no table
     */
    public static MieTransform of(Detector detector) {
        if (detector == null) {
            throw new NullPointerException("detector");
        }
        return new MieTransform(detector.calibrationTable().orElseThrow(() ->
            new InvalidInputException("Detector has no calibration table; calibrate it first")));
    }

    /** One-shot inversion of a single signal against the table. */
    public static double invert(CalibrationTable table, double observedSignal) {
        return new MieTransform(table).diameter(observedSignal);
    }

    /**
     * Diameter whose predicted signal equals the observed one.
     *
     * @throws InvalidInputException       if the signal is NaN
     * @throws SignalOutOfRangeException   if the signal is outside the table's range
     * @throws AmbiguousInversionException if several diameters share the signal
     */
    public double diameter(double observedSignal) {
        if (Double.isNaN(observedSignal)) {
            throw InvalidInputException.invalidParameter("observedSignal", observedSignal, "a number");
        }
        double s = Math.max(0.0, observedSignal);
        if (s < table.minSignal() || s > table.maxSignal()) {
            throw new SignalOutOfRangeException(observedSignal, table.minSignal(), table.maxSignal());
        }

        List<Double> roots = new ArrayList<>(2);
        for (int i = 0; i < table.size() - 1; i++) {
            double d0 = table.diameter(i);
            double d1 = table.diameter(i + 1);
            double s0 = table.signal(i);
            double s1 = table.signal(i + 1);
            if (s < Math.min(s0, s1) || s > Math.max(s0, s1)) {
                continue;
            }
            if (s0 == s1) {
                // plateau at the observed value, every diameter in [d0, d1] matches
                addRoot(roots, d0);
                addRoot(roots, d1);
            } else if (s == s0) {
                addRoot(roots, d0);
            } else if (s == s1) {
                addRoot(roots, d1);
            } else {
                addRoot(roots, d0 + (s - s0) * (d1 - d0) / (s1 - s0));
            }
        }

        if (roots.size() > 1) {
            double[] candidates = new double[roots.size()];
            for (int i = 0; i < candidates.length; i++) {
                candidates[i] = roots.get(i);
            }
            throw new AmbiguousInversionException(s, candidates);
        }
        return roots.get(0);
    }

    // segments are visited in diameter order, so duplicates can only be adjacent
    private static void addRoot(List<Double> roots, double d) {
        if (roots.isEmpty() || roots.get(roots.size() - 1) != d) {
            roots.add(d);
        }
    }

    /**
     * Inverts a batch of per-event signals, e.g. one acquired scatter channel.
     * Fails on the first event that cannot be inverted; no partial result is returned.
     */
    public double[] diameters(double[] observedSignals) {
        if (observedSignals == null) {
            throw new NullPointerException("observedSignals");
        }
        double[] out = new double[observedSignals.length];
        int clamped = 0;
        for (int i = 0; i < observedSignals.length; i++) {
            if (observedSignals[i] < 0.0) {
                clamped++;
            }
            out[i] = diameter(observedSignals[i]);
        }
        if (clamped > 0) {
            log.debug("Clamped {} of {} negative signals to zero before inversion",
                clamped, observedSignals.length);
        }
        return out;
    }

    public CalibrationTable table() { return table; }
}
