package io.flowmie.api;

import java.util.Locale;

/**
 * Relative detector sensitivity across the collection aperture.
 *
 * Evaluated at the local angle alphaPrime from the detector axis, which runs from 0
 * (on axis) to alpha (edge of the entrance aperture). Both angles in radians.
 *
 * UNIFORM:              weight = 1
 * VAN_DER_POL:          weight = sin(pi/2 * (alphaPrime/alpha + 1))
 *                       1 on axis, 0 at the aperture edge
 * MODIFIED_VAN_DER_POL: weight = sin(pi/2 * (fac2 * alphaPrime/alpha + 1)),
 *                       fac2 = 2 * acos(etaFac) / pi
 *                       1 on axis, etaFac at the aperture edge
 *
 * All variants are pure and finite at alphaPrime = 0 and alphaPrime = alpha.
 */
public sealed interface EfficiencyProfile
    permits EfficiencyProfile.Uniform,
            EfficiencyProfile.VanDerPol,
            EfficiencyProfile.ModifiedVanDerPol {

    /**
     * Relative weight of the aperture ring at alphaPrime.
     *
     * @param alphaPrime angle from the detector axis, radians
     * @param alpha      acceptance half-angle, radians
     */
    double efficiency(double alphaPrime, double alpha);

    /** Configuration name of this variant. */
    String name();

    /** Edge efficiency parameter, or NaN for variants that take none. */
    default double etaFac() {
        return Double.NaN;
    }

    /** Uniform response over the whole aperture. */
    record Uniform() implements EfficiencyProfile {

        public static final String NAME = "uniform";

        @Override
        public double efficiency(double alphaPrime, double alpha) {
            return 1.0;
        }

        @Override
        public String name() { return NAME; }
    }

    /** Sinusoidal fall-off from 1 on axis to 0 at the aperture edge. */
    record VanDerPol() implements EfficiencyProfile {

        public static final String NAME = "van_der_pol";

        @Override
        public double efficiency(double alphaPrime, double alpha) {
            return Math.sin((Math.PI / 2) * ((alphaPrime / alpha) + 1));
        }

        @Override
        public String name() { return NAME; }
    }

    /** Sinusoidal fall-off from 1 on axis to etaFac at the aperture edge. */
    record ModifiedVanDerPol(double etaFac) implements EfficiencyProfile {

        public static final String NAME = "modified_van_der_pol";

        public ModifiedVanDerPol {
            if (!(etaFac >= 0.0 && etaFac <= 1.0)) {
                throw InvalidInputException.invalidParameter("etaFac", etaFac, "a value in [0.0, 1.0]");
            }
        }

        @Override
        public double efficiency(double alphaPrime, double alpha) {
            double fac2 = 2 * Math.acos(etaFac) / Math.PI;
            return Math.sin((Math.PI / 2) * ((fac2 * alphaPrime / alpha) + 1));
        }

        @Override
        public String name() { return NAME; }
    }

    static EfficiencyProfile uniform() {
        return new Uniform();
    }

    static EfficiencyProfile vanDerPol() {
        return new VanDerPol();
    }

    static EfficiencyProfile modifiedVanDerPol(double etaFac) {
        return new ModifiedVanDerPol(etaFac);
    }

    /**
     * Resolves a variant from its configuration name.
     * Accepts "uniform", "van_der_pol" (or "vdp") and "modified_van_der_pol" (or "mvdp"),
     * case-insensitive. etaFac is ignored by variants that take no parameter.
     *
     * @throws InvalidInputException for an unknown name or an out-of-range etaFac
     */
    static EfficiencyProfile named(String name, double etaFac) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case Uniform.NAME                   -> uniform();
            case VanDerPol.NAME, "vdp"          -> vanDerPol();
            case ModifiedVanDerPol.NAME, "mvdp" -> modifiedVanDerPol(etaFac);
            default -> throw InvalidInputException.invalidParameter(
                "efficiency", name, "one of uniform, van_der_pol, modified_van_der_pol");
        };
    }
}
