package io.flowmie.api;

import java.util.Optional;

/**
 * Immutable model of a flow cytometer scatter detector and its illumination.
 *
 * GEOMETRY:
 *   thetaZero  angle between incident beam and detector axis (90 = side scatter)
 *   alpha      acceptance half-angle of the collection aperture, 0 < alpha < 90
 * ILLUMINATION:
 *   psiZero    polarization angle; 0 = in the plane of incidence, 90 = perpendicular
 *   polarization degree of linear polarization in [0, 1]; 0 = unpolarized
 * RESPONSE:
 *   gain       relative photon-to-signal conversion, solved by calibration
 *   efficiency radial sensitivity across the aperture
 *   calibrationTable optional diameter-to-signal lookup attached after calibration
 *
 * All angles are in degrees. Recalibration produces a new instance via
 * {@link #withGain(double)} or {@link #withCalibrationTable(CalibrationTable)}.
 */
public final class Detector {

    private final double thetaZeroDegrees;
    private final double alphaDegrees;
    private final double psiZeroDegrees;
    private final double polarization;
    private final double gain;
    private final EfficiencyProfile efficiency;
    private final CalibrationTable calibrationTable;

    private Detector(Builder builder) {
        if (!Double.isFinite(builder.thetaZeroDegrees)) {
            throw InvalidInputException.invalidParameter("thetaZero", builder.thetaZeroDegrees, "a finite angle");
        }
        if (!(builder.alphaDegrees > 0.0 && builder.alphaDegrees < 90.0)) {
            throw InvalidInputException.invalidParameter("alpha", builder.alphaDegrees, "a value in (0, 90)");
        }
        if (!Double.isFinite(builder.psiZeroDegrees)) {
            throw InvalidInputException.invalidParameter("psiZero", builder.psiZeroDegrees, "a finite angle");
        }
        if (!(builder.polarization >= 0.0 && builder.polarization <= 1.0)) {
            throw InvalidInputException.invalidParameter("polarization", builder.polarization, "a value in [0, 1]");
        }
        if (!(builder.gain > 0.0) || Double.isInfinite(builder.gain)) {
            throw InvalidInputException.invalidParameter("gain", builder.gain, "a finite value > 0");
        }
        if (builder.efficiency == null) {
            throw new NullPointerException("efficiency");
        }
        this.thetaZeroDegrees = builder.thetaZeroDegrees;
        this.alphaDegrees = builder.alphaDegrees;
        this.psiZeroDegrees = builder.psiZeroDegrees;
        this.polarization = builder.polarization;
        this.gain = builder.gain;
        this.efficiency = builder.efficiency;
        this.calibrationTable = builder.calibrationTable;
    }

    /** Detector with every default: side scatter, 60 degree half-angle, polarized, uniform. */
    public static Detector defaults() {
        return builder().build();
    }

    public double thetaZeroDegrees() { return thetaZeroDegrees; }

    public double alphaDegrees() { return alphaDegrees; }

    public double psiZeroDegrees() { return psiZeroDegrees; }

    public double polarization() { return polarization; }

    public double gain() { return gain; }

    public EfficiencyProfile efficiency() { return efficiency; }

    public Optional<CalibrationTable> calibrationTable() {
        return Optional.ofNullable(calibrationTable);
    }

    /** Copy of this detector with a different gain. The calibration table is kept. */
    public Detector withGain(double gain) {
        return toBuilder().gain(gain).build();
    }

    /** Copy of this detector carrying the given lookup table; null detaches it. */
    public Detector withCalibrationTable(CalibrationTable table) {
        return toBuilder().calibrationTable(table).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .thetaZeroDegrees(thetaZeroDegrees)
            .alphaDegrees(alphaDegrees)
            .psiZeroDegrees(psiZeroDegrees)
            .polarization(polarization)
            .gain(gain)
            .efficiency(efficiency)
            .calibrationTable(calibrationTable);
    }

    @Override
    public String toString() {
        return "Detector{theta0=" + thetaZeroDegrees
            + ", alpha=" + alphaDegrees
            + ", psi0=" + psiZeroDegrees
            + ", pol=" + polarization
            + ", gain=" + gain
            + ", efficiency=" + efficiency.name()
            + ", calibrated=" + (calibrationTable != null) + "}";
    }

    // -- Builder --------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private double thetaZeroDegrees = FlowMieConstants.DEFAULT_THETA_ZERO_DEGREES;
        private double alphaDegrees = FlowMieConstants.DEFAULT_ALPHA_DEGREES;
        private double psiZeroDegrees = FlowMieConstants.DEFAULT_PSI_ZERO_DEGREES;
        private double polarization = FlowMieConstants.DEFAULT_POLARIZATION;
        private double gain = FlowMieConstants.DEFAULT_GAIN;
        private EfficiencyProfile efficiency = EfficiencyProfile.uniform();
        private CalibrationTable calibrationTable;

        private Builder() {}

        public Builder thetaZeroDegrees(double thetaZeroDegrees) {
            this.thetaZeroDegrees = thetaZeroDegrees;
            return this;
        }

        public Builder alphaDegrees(double alphaDegrees) {
            this.alphaDegrees = alphaDegrees;
            return this;
        }

        public Builder psiZeroDegrees(double psiZeroDegrees) {
            this.psiZeroDegrees = psiZeroDegrees;
            return this;
        }

        public Builder polarization(double polarization) {
            this.polarization = polarization;
            return this;
        }

        public Builder gain(double gain) {
            this.gain = gain;
            return this;
        }

        public Builder efficiency(EfficiencyProfile efficiency) {
            this.efficiency = efficiency;
            return this;
        }

        public Builder calibrationTable(CalibrationTable calibrationTable) {
            this.calibrationTable = calibrationTable;
            return this;
        }

        /** @throws InvalidInputException if any parameter is outside its domain */
        public Detector build() {
            return new Detector(this);
        }
    }
}
