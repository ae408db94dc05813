package io.flowmie.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable diameter-to-signal lookup table used by the Mie transform.
 *
 * Points are sorted by diameter at construction; evaluation order of a parallel sweep
 * therefore does not matter. Diameters must be distinct after sorting.
 *
 * Non-monotone tables are accepted and reported through {@link #monotonicity()}.
 * Inversion decides ambiguity per query, so the monotone parts of a folded table
 * remain usable.
 */
public final class CalibrationTable {

    private final double[] diameters;
    private final double[] signals;
    private final Monotonicity monotonicity;
    private final double minSignal;
    private final double maxSignal;

    public CalibrationTable(List<CalibrationPoint> points) {
        if (points == null) {
            throw new NullPointerException("points");
        }
        if (points.size() < 2) {
            throw new InvalidInputException(
                "A calibration table needs at least 2 points; got " + points.size());
        }
        List<CalibrationPoint> sorted = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            CalibrationPoint p = points.get(i);
            if (p == null) {
                throw new NullPointerException("points[" + i + "]");
            }
            sorted.add(p);
        }
        sorted.sort(Comparator.comparingDouble(CalibrationPoint::diameter));

        int n = sorted.size();
        this.diameters = new double[n];
        this.signals = new double[n];
        for (int i = 0; i < n; i++) {
            diameters[i] = sorted.get(i).diameter();
            signals[i] = sorted.get(i).signal();
            if (i > 0 && diameters[i] == diameters[i - 1]) {
                throw new InvalidInputException("Duplicate diameter in calibration table: " + diameters[i]);
            }
        }
        this.monotonicity = classify(signals);
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double s : signals) {
            lo = Math.min(lo, s);
            hi = Math.max(hi, s);
        }
        this.minSignal = lo;
        this.maxSignal = hi;
    }

    /**
     * Builds a table from parallel diameter and signal arrays.
     *
     * @throws DimensionMismatchException if the arrays differ in length
     */
    public static CalibrationTable of(double[] diameters, double[] signals) {
        if (diameters == null) {
            throw new NullPointerException("diameters");
        }
        if (signals == null) {
            throw new NullPointerException("signals");
        }
        if (diameters.length != signals.length) {
            throw new DimensionMismatchException("Signal vector", diameters.length, signals.length);
        }
        List<CalibrationPoint> points = new ArrayList<>(diameters.length);
        for (int i = 0; i < diameters.length; i++) {
            points.add(new CalibrationPoint(diameters[i], signals[i]));
        }
        return new CalibrationTable(points);
    }

    private static Monotonicity classify(double[] signals) {
        boolean increasing = true;
        boolean decreasing = true;
        for (int i = 1; i < signals.length; i++) {
            if (signals[i] <= signals[i - 1]) {
                increasing = false;
            }
            if (signals[i] >= signals[i - 1]) {
                decreasing = false;
            }
        }
        if (increasing) return Monotonicity.INCREASING;
        if (decreasing) return Monotonicity.DECREASING;
        return Monotonicity.NON_MONOTONE;
    }

    public int size() { return diameters.length; }

    public double diameter(int index) { return diameters[index]; }

    public double signal(int index) { return signals[index]; }

    /** Diameters, ascending. Defensive copy. */
    public double[] diameters() { return diameters.clone(); }

    /** Signals aligned with {@link #diameters()}. Defensive copy. */
    public double[] signals() { return signals.clone(); }

    public List<CalibrationPoint> points() {
        List<CalibrationPoint> out = new ArrayList<>(diameters.length);
        for (int i = 0; i < diameters.length; i++) {
            out.add(new CalibrationPoint(diameters[i], signals[i]));
        }
        return Collections.unmodifiableList(out);
    }

    public Monotonicity monotonicity() { return monotonicity; }

    public boolean isMonotone() { return monotonicity.isMonotone(); }

    public double minSignal() { return minSignal; }

    public double maxSignal() { return maxSignal; }

    public double minDiameter() { return diameters[0]; }

    public double maxDiameter() { return diameters[diameters.length - 1]; }

    @Override
    public String toString() {
        return "CalibrationTable{points=" + diameters.length
            + ", diameter=[" + minDiameter() + ".." + maxDiameter() + "]"
            + ", signal=[" + minSignal + ".." + maxSignal + "]"
            + ", " + monotonicity + "}";
    }
}
