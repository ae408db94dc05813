package io.flowmie.core;

import io.flowmie.api.AmplitudeProvider;
import io.flowmie.api.Detector;
import io.flowmie.api.FlowMieConstants;
import io.flowmie.api.InvalidInputException;
import io.flowmie.api.Particle;
import io.flowmie.api.ScatteringAmplitudes;

/**
 * Predicts the detector signal of a particle end to end: amplitudes from the
 * provider, Stokes reduction, aperture integral.
 *
 * Holds no per-call state and is safe to share between sweep workers as long as the
 * amplitude provider is.
 */
public final class ResponseCalculator {

    private final AmplitudeProvider amplitudeProvider;
    private final int angleCount;
    private final IntegrationSettings settings;

    public ResponseCalculator(AmplitudeProvider amplitudeProvider) {
        this(amplitudeProvider, FlowMieConstants.DEFAULT_ANGLE_COUNT, IntegrationSettings.DEFAULT);
    }

    public ResponseCalculator(AmplitudeProvider amplitudeProvider, IntegrationSettings settings) {
        this(amplitudeProvider, FlowMieConstants.DEFAULT_ANGLE_COUNT, settings);
    }

    /**
     * @param amplitudeProvider source of S1/S2; must not be null
     * @param angleCount        number of angles requested over 0 .. 360 degrees; at least 2
     * @param settings          integration steps; must not be null
     */
    public ResponseCalculator(AmplitudeProvider amplitudeProvider, int angleCount, IntegrationSettings settings) {
        if (amplitudeProvider == null) {
            throw new NullPointerException("amplitudeProvider");
        }
        if (settings == null) {
            throw new NullPointerException("settings");
        }
        if (angleCount < 2) {
            throw InvalidInputException.invalidParameter("angleCount", angleCount, "at least 2");
        }
        this.amplitudeProvider = amplitudeProvider;
        this.angleCount = angleCount;
        this.settings = settings;
    }

    /** Predicted signal of the particle on the detector, including the detector gain. */
    public double response(Particle particle, Detector detector) {
        if (particle == null) {
            throw new NullPointerException("particle");
        }
        if (detector == null) {
            throw new NullPointerException("detector");
        }
        ScatteringAmplitudes amplitudes = amplitudeProvider.amplitudes(particle, angleCount);
        if (amplitudes == null) {
            throw new InvalidInputException("Amplitude provider returned no amplitudes for " + particle);
        }
        return DetectorResponseIntegrator.response(amplitudes, detector, settings);
    }

    public AmplitudeProvider amplitudeProvider() { return amplitudeProvider; }

    public int angleCount() { return angleCount; }

    public IntegrationSettings settings() { return settings; }

    /** Same provider and angle count, different integration steps. */
    public ResponseCalculator withSettings(IntegrationSettings settings) {
        return new ResponseCalculator(amplitudeProvider, angleCount, settings);
    }
}
