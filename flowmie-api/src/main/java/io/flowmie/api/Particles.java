package io.flowmie.api;

import java.util.List;
import org.apache.commons.math3.complex.Complex;

/**
 * Convenience constructors for common scatterers. All sizes are diameters in nm.
 *
 * Defaults: medium index DEFAULT_MEDIUM_INDEX (saline), wavelength DEFAULT_WAVELENGTH_NM.
 */
public final class Particles {

    private Particles() {}

    /**
     * Layered particle from parallel radius and refractive index arrays, innermost first.
     *
     * @throws DimensionMismatchException if radii and indices differ in length
     */
    public static Particle layered(double mediumIndex, double wavelength, double[] radii, double[] indices) {
        if (indices == null) {
            throw new NullPointerException("indices");
        }
        Complex[] complexIndices = new Complex[indices.length];
        for (int i = 0; i < indices.length; i++) {
            complexIndices[i] = new Complex(indices[i], 0.0);
        }
        return Particle.of(mediumIndex, wavelength, radii, complexIndices);
    }

    /** Homogeneous sphere. */
    public static Particle sphere(double mediumIndex, double wavelength, double refractiveIndex, double diameter) {
        return new Particle(mediumIndex, wavelength,
            List.of(Layer.of(diameter / 2, refractiveIndex)));
    }

    // -- Beads ------------------------------------------------------------------

    public static Particle polystyrene(double diameter) {
        return polystyrene(FlowMieConstants.DEFAULT_MEDIUM_INDEX, FlowMieConstants.DEFAULT_WAVELENGTH_NM, diameter);
    }

    public static Particle polystyrene(double mediumIndex, double wavelength, double diameter) {
        return sphere(mediumIndex, wavelength, FlowMieConstants.POLYSTYRENE_INDEX, diameter);
    }

    public static Particle silica(double diameter) {
        return silica(FlowMieConstants.DEFAULT_MEDIUM_INDEX, FlowMieConstants.DEFAULT_WAVELENGTH_NM, diameter);
    }

    public static Particle silica(double mediumIndex, double wavelength, double diameter) {
        return sphere(mediumIndex, wavelength, FlowMieConstants.SILICA_INDEX, diameter);
    }

    // -- Extracellular vesicles -------------------------------------------------

    /** Two-layer EV (lumen + membrane) with default indices and membrane thickness. */
    public static Particle extracellularVesicle(double diameter) {
        return extracellularVesicle(FlowMieConstants.DEFAULT_MEDIUM_INDEX,
            FlowMieConstants.DEFAULT_WAVELENGTH_NM,
            FlowMieConstants.EV_CORE_INDEX,
            FlowMieConstants.EV_MEMBRANE_INDEX,
            FlowMieConstants.EV_MEMBRANE_THICKNESS_NM,
            diameter);
    }

    /**
     * Two-layer EV of overall diameter d whose membrane has the given thickness.
     *
     * @throws InvalidInputException if d/2 does not exceed the membrane thickness
     */
    public static Particle extracellularVesicle(double mediumIndex, double wavelength,
                                                double coreIndex, double membraneIndex,
                                                double membraneThickness, double diameter) {
        double outer = diameter / 2;
        double core = outer - membraneThickness;
        if (!(membraneThickness > 0.0)) {
            throw InvalidInputException.invalidParameter("membraneThickness", membraneThickness, "a value > 0");
        }
        if (!(core > 0.0)) {
            throw new InvalidInputException("EV diameter " + diameter
                + " leaves no lumen inside a membrane of thickness " + membraneThickness);
        }
        return layered(mediumIndex, wavelength,
            new double[] {core, outer},
            new double[] {coreIndex, membraneIndex});
    }

    // -- Factories for calibration sweeps ---------------------------------------

    public static ParticleFactory polystyreneFactory() {
        return Particles::polystyrene;
    }

    public static ParticleFactory silicaFactory() {
        return Particles::silica;
    }

    public static ParticleFactory extracellularVesicleFactory() {
        return Particles::extracellularVesicle;
    }

    public static ParticleFactory sphereFactory(double mediumIndex, double wavelength, double refractiveIndex) {
        return d -> sphere(mediumIndex, wavelength, refractiveIndex, d);
    }
}
