package io.flowmie.api;

/**
 * Source of Mie scattering amplitudes for a layered particle.
 *
 * The engine treats implementations as side-effect free black boxes. The returned grid
 * spans 0 .. ANGLE_SPAN_DEGREES in angleCount evenly spaced steps (near-even is
 * tolerated) and must be sorted ascending.
 */
@FunctionalInterface
public interface AmplitudeProvider {

    /**
     * Computes S1 and S2 for the particle.
     *
     * @param particle   the particle; never null
     * @param angleCount number of scattering angles over 0 .. 360 degrees
     */
    ScatteringAmplitudes amplitudes(Particle particle, int angleCount);

    /** Computes S1 and S2 on the default DEFAULT_ANGLE_COUNT grid. */
    default ScatteringAmplitudes amplitudes(Particle particle) {
        return amplitudes(particle, FlowMieConstants.DEFAULT_ANGLE_COUNT);
    }
}
