package io.flowmie.api;

/**
 * Shape of a calibration table's signal as a function of diameter.
 *
 * INCREASING / DECREASING: strictly monotone, every signal inverts to one diameter.
 * NON_MONOTONE: the response folds (Mie resonance) or plateaus somewhere; signals in
 * the folded region are ambiguous and their inversion fails.
 */
public enum Monotonicity {
    INCREASING,
    DECREASING,
    NON_MONOTONE;

    public boolean isMonotone() {
        return this != NON_MONOTONE;
    }
}
