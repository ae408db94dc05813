package io.flowmie.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.complex.Complex;

/**
 * Immutable description of a spherical, possibly multi-layer, scattering particle.
 *
 * Layers are ordered innermost to outermost; radii are strictly increasing. A typical
 * extracellular vesicle has two layers: the lumen, then the membrane.
 *
 * Radii and wavelength share one length unit (nm throughout this code base).
 */
public final class Particle {

    private final double mediumIndex;
    private final double wavelength;
    private final List<Layer> layers;

    public Particle(double mediumIndex, double wavelength, List<Layer> layers) {
        if (!(mediumIndex > 0.0) || Double.isInfinite(mediumIndex)) {
            throw InvalidInputException.invalidParameter("mediumIndex", mediumIndex, "a finite value > 0");
        }
        if (!(wavelength > 0.0) || Double.isInfinite(wavelength)) {
            throw InvalidInputException.invalidParameter("wavelength", wavelength, "a finite value > 0");
        }
        if (layers == null) {
            throw new NullPointerException("layers");
        }
        if (layers.isEmpty()) {
            throw new InvalidInputException("A particle needs at least one layer");
        }
        double previous = 0.0;
        for (int i = 0; i < layers.size(); i++) {
            Layer layer = layers.get(i);
            if (layer == null) {
                throw new NullPointerException("layers[" + i + "]");
            }
            if (layer.radius() <= previous) {
                throw new InvalidInputException(
                    "Layer radii must be strictly increasing from the inside out; layer "
                        + i + " has radius " + layer.radius() + " after " + previous);
            }
            previous = layer.radius();
        }
        this.mediumIndex = mediumIndex;
        this.wavelength = wavelength;
        this.layers = Collections.unmodifiableList(new ArrayList<>(layers));
    }

    /**
     * Builds a particle from parallel radius and refractive index arrays.
     *
     * @throws DimensionMismatchException if the arrays differ in length
     */
    public static Particle of(double mediumIndex, double wavelength, double[] radii, Complex[] indices) {
        if (radii == null) {
            throw new NullPointerException("radii");
        }
        if (indices == null) {
            throw new NullPointerException("indices");
        }
        if (radii.length != indices.length) {
            throw new DimensionMismatchException("Refractive index vector", radii.length, indices.length);
        }
        List<Layer> layers = new ArrayList<>(radii.length);
        for (int i = 0; i < radii.length; i++) {
            layers.add(new Layer(radii[i], indices[i]));
        }
        return new Particle(mediumIndex, wavelength, layers);
    }

    /** Refractive index of the medium surrounding the particle. */
    public double mediumIndex() { return mediumIndex; }

    /** Incident wavelength, in the same unit as the layer radii. */
    public double wavelength() { return wavelength; }

    /** Layers, innermost first. Unmodifiable. */
    public List<Layer> layers() { return layers; }

    public int layerCount() { return layers.size(); }

    public double outerRadius() {
        return layers.get(layers.size() - 1).radius();
    }

    public double outerDiameter() {
        return 2.0 * outerRadius();
    }

    @Override
    public String toString() {
        return "Particle{medium=" + mediumIndex
            + ", wavelength=" + wavelength
            + ", layers=" + layers.size()
            + ", diameter=" + outerDiameter() + "}";
    }
}
