package io.flowmie.api;

/**
 * Global defaults for the flowmie engine.
 *
 * Detector defaults describe a typical side-scatter detector: 90 degree collection,
 * 60 degree acceptance half-angle, fully polarized light perpendicular to the plane
 * of incidence. Particle defaults describe saline-suspended particles probed at 488 nm.
 *
 * Changing any detector or integration default changes every absolute signal the
 * engine predicts. Calibration tables built under the old values must be rebuilt.
 */
public final class FlowMieConstants {

    private FlowMieConstants() {}

    // -- Detector defaults ----------------------------------------------------

    /** Angle between incident beam and detector axis, degrees. 90 = side scatter. */
    public static final double DEFAULT_THETA_ZERO_DEGREES = 90.0;

    /** Detector acceptance half-angle, degrees. */
    public static final double DEFAULT_ALPHA_DEGREES = 60.0;

    /** Incident polarization angle, degrees. 90 = perpendicular to the plane of incidence. */
    public static final double DEFAULT_PSI_ZERO_DEGREES = 90.0;

    /** Degree of linear polarization. 1 = fully polarized. */
    public static final double DEFAULT_POLARIZATION = 1.0;

    /** Relative detector gain before calibration. */
    public static final double DEFAULT_GAIN = 1.0;

    // -- Integration defaults -------------------------------------------------

    /** Radial step over the unit aperture disk. Accurate to about 2 percent. */
    public static final double DEFAULT_DR = 0.02;

    /** Azimuthal step in degrees. Accurate to about 0.06 percent. */
    public static final double DEFAULT_DPHI_DEGREES = 10.0;

    /** Radial step used for calibration-grade evaluation. */
    public static final double FINE_DR = 0.01;

    /** Azimuthal step in degrees used for calibration-grade evaluation. */
    public static final double FINE_DPHI_DEGREES = 1.0;

    /**
     * Aperture area used to normalize the integrated signal.
     * The aperture is parametrized as a unit disk, so A = pi regardless of physical size.
     */
    public static final double APERTURE_AREA = Math.PI;

    /** Sequence fuzz applied when counting integration steps, so 1/0.02 yields 51 radii. */
    public static final double STEP_COUNT_FUZZ = 1e-10;

    // -- Amplitude grid -------------------------------------------------------

    /** Number of scattering angles requested from the amplitude provider. */
    public static final int DEFAULT_ANGLE_COUNT = 361;

    /** Angular span of the amplitude grid, degrees. */
    public static final double ANGLE_SPAN_DEGREES = 360.0;

    // -- Particle defaults ----------------------------------------------------

    /** Refractive index of the suspending medium, approximating saline. */
    public static final double DEFAULT_MEDIUM_INDEX = 1.34;

    /** Incident wavelength, nm. */
    public static final double DEFAULT_WAVELENGTH_NM = 488.0;

    public static final double POLYSTYRENE_INDEX = 1.605;

    public static final double SILICA_INDEX = 1.463;

    /** Extracellular vesicle lumen refractive index. */
    public static final double EV_CORE_INDEX = 1.38;

    /** Extracellular vesicle membrane refractive index. */
    public static final double EV_MEMBRANE_INDEX = 1.46;

    /** Extracellular vesicle membrane thickness, nm. */
    public static final double EV_MEMBRANE_THICKNESS_NM = 5.0;

    // -- Calibration defaults -------------------------------------------------

    /** Diameter of the reference polystyrene bead, nm. */
    public static final double REFERENCE_BEAD_DIAMETER_NM = 200.0;

    /** Smallest diameter of the default calibration sweep, nm. */
    public static final double SWEEP_MIN_DIAMETER_NM = 20.0;

    /** Largest diameter of the default calibration sweep, nm. */
    public static final double SWEEP_MAX_DIAMETER_NM = 1000.0;

    /** Diameter step of the default calibration sweep, nm. */
    public static final double SWEEP_STEP_NM = 10.0;

    // -- Validation -----------------------------------------------------------

    /**
     * Verifies internal consistency of the defaults.
     * Throws IllegalStateException if any invariant is violated.
     */
    public static void validate() {
        if (!(DEFAULT_ALPHA_DEGREES > 0.0 && DEFAULT_ALPHA_DEGREES < 90.0)) {
            throw new IllegalStateException(
                "DEFAULT_ALPHA_DEGREES must lie in (0, 90); actual = " + DEFAULT_ALPHA_DEGREES);
        }
        if (DEFAULT_POLARIZATION < 0.0 || DEFAULT_POLARIZATION > 1.0) {
            throw new IllegalStateException(
                "DEFAULT_POLARIZATION must lie in [0, 1]; actual = " + DEFAULT_POLARIZATION);
        }
        if (FINE_DR > DEFAULT_DR || FINE_DPHI_DEGREES > DEFAULT_DPHI_DEGREES) {
            throw new IllegalStateException("FINE integration steps must not exceed DEFAULT steps");
        }
        if (DEFAULT_ANGLE_COUNT < 2) {
            throw new IllegalStateException(
                "DEFAULT_ANGLE_COUNT must be at least 2; actual = " + DEFAULT_ANGLE_COUNT);
        }
        if (EV_MEMBRANE_THICKNESS_NM * 2.0 >= SWEEP_MIN_DIAMETER_NM) {
            throw new IllegalStateException(
                "SWEEP_MIN_DIAMETER_NM leaves no EV lumen for the default membrane thickness");
        }
        if (SWEEP_MIN_DIAMETER_NM >= SWEEP_MAX_DIAMETER_NM || SWEEP_STEP_NM <= 0.0) {
            throw new IllegalStateException("Default calibration sweep is empty");
        }
    }

    static {
        validate();
    }
}
