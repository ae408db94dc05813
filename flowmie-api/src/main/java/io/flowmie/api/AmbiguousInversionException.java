package io.flowmie.api;

import java.util.Arrays;

/**
 * Thrown when an observed signal maps to more than one diameter in a calibration table.
 *
 * Happens where the Mie response folds back on itself (resonance) or is flat at the
 * queried value. The engine never picks one of several valid roots.
 */
public final class AmbiguousInversionException extends FlowMieException {

    private final double observedSignal;
    private final double[] candidateDiameters;

    public AmbiguousInversionException(double observedSignal, double[] candidateDiameters) {
        super("Signal " + observedSignal + " maps to " + candidateDiameters.length
            + " diameters " + Arrays.toString(candidateDiameters)
            + "; calibration table is not monotone over this region");
        this.observedSignal = observedSignal;
        this.candidateDiameters = candidateDiameters.clone();
    }

    public double observedSignal() { return observedSignal; }

    /** Every diameter the table maps the observed signal to, ascending. */
    public double[] candidateDiameters() { return candidateDiameters.clone(); }
}
