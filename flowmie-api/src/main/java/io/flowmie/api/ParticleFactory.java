package io.flowmie.api;

/**
 * Builds a particle of a given outer diameter. Used by calibration sweeps.
 */
@FunctionalInterface
public interface ParticleFactory {

    /**
     * @param diameter outer diameter, same length unit as the particle wavelength
     */
    Particle create(double diameter);
}
