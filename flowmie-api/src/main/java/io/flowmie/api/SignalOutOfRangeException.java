package io.flowmie.api;

/**
 * Thrown when an observed signal lies outside the signal range a calibration table covers.
 * The Mie transform never extrapolates.
 */
public final class SignalOutOfRangeException extends FlowMieException {

    private final double observedSignal;
    private final double minSignal;
    private final double maxSignal;

    public SignalOutOfRangeException(double observedSignal, double minSignal, double maxSignal) {
        super("Signal " + observedSignal + " outside calibrated range ["
            + minSignal + ", " + maxSignal + "]");
        this.observedSignal = observedSignal;
        this.minSignal = minSignal;
        this.maxSignal = maxSignal;
    }

    public double observedSignal() { return observedSignal; }

    public double minSignal() { return minSignal; }

    public double maxSignal() { return maxSignal; }
}
