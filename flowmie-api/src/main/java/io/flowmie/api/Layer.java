package io.flowmie.api;

import org.apache.commons.math3.complex.Complex;

/**
 * One concentric shell of a scattering particle.
 *
 * @param radius          outer radius of this shell, same length unit as the wavelength
 * @param refractiveIndex complex refractive index of the shell material
 */
public record Layer(double radius, Complex refractiveIndex) {

    public Layer {
        if (!(radius > 0.0) || Double.isInfinite(radius)) {
            throw InvalidInputException.invalidParameter("radius", radius, "a finite value > 0");
        }
        if (refractiveIndex == null) {
            throw new NullPointerException("refractiveIndex");
        }
        if (refractiveIndex.isNaN() || refractiveIndex.isInfinite()) {
            throw InvalidInputException.invalidParameter(
                "refractiveIndex", refractiveIndex, "a finite complex value");
        }
    }

    /** Shell with a purely real refractive index. */
    public static Layer of(double radius, double refractiveIndex) {
        return new Layer(radius, new Complex(refractiveIndex, 0.0));
    }
}
