package io.flowmie.test;

import io.flowmie.api.AmbiguousInversionException;
import io.flowmie.api.CalibrationTable;
import io.flowmie.api.Detector;
import io.flowmie.api.FlowMieConstants;
import io.flowmie.api.InvalidInputException;
import io.flowmie.api.Monotonicity;
import io.flowmie.api.ParticleFactory;
import io.flowmie.api.Particles;
import io.flowmie.calibration.CalibrationEngine;
import io.flowmie.calibration.DiameterSeries;
import io.flowmie.calibration.MieTransform;
import io.flowmie.core.ResponseCalculator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CalibrationEngineTest {

    // S11 = (d / 100)^2, S12 = 0: response = 1.02 * (d / 100)^2 at unit gain
    private static final ResponseCalculator QUADRATIC =
        new ResponseCalculator(StubAmplitudeProviders.quadraticInDiameter());

    private static final ParticleFactory SPHERES = Particles.sphereFactory(
        FlowMieConstants.DEFAULT_MEDIUM_INDEX, FlowMieConstants.DEFAULT_WAVELENGTH_NM, 1.5);

    @AfterEach
    void clearProperties() {
        System.clearProperty(CalibrationEngine.PROPERTY_THREADS);
    }

    // -- Table sweep ----------------------------------------------------------

    @Test
    void tableOfMonotoneModelInvertsBackToDiameter() {
        CalibrationEngine engine = new CalibrationEngine(QUADRATIC, 2);
        Detector detector = Detector.defaults();

        CalibrationTable table = engine.buildTable(detector, SPHERES, new double[] {50, 100, 150, 200});

        assertThat(table.monotonicity()).isEqualTo(Monotonicity.INCREASING);
        assertThat(table.signal(1)).isCloseTo(1.02, within(1e-9));
        double observed = QUADRATIC.response(SPHERES.create(150), detector);
        assertThat(new MieTransform(table).diameter(observed)).isCloseTo(150.0, within(1e-9));
    }

    @Test
    void offNodeDiameterRoundTripsWithinInterpolationError() {
        CalibrationEngine engine = new CalibrationEngine(QUADRATIC, 4);
        Detector detector = Detector.defaults();
        CalibrationTable table = engine.buildTable(detector, SPHERES, DiameterSeries.range(50, 500, 50));

        double observed = QUADRATIC.response(SPHERES.create(255), detector);

        assertThat(new MieTransform(table).diameter(observed)).isCloseTo(255.0, within(1.0));
    }

    @Test
    void shuffledSeriesIsSortedRegardlessOfCompletionOrder() {
        CalibrationEngine engine = new CalibrationEngine(QUADRATIC, 4);
        double[] shuffled = {400, 50, 300, 150, 500, 100, 250, 200, 450, 350};

        CalibrationTable table = engine.buildTable(Detector.defaults(), SPHERES, shuffled);

        assertThat(table.diameters()).isSorted().hasSize(10);
        for (int i = 0; i < table.size(); i++) {
            double expected = 1.02 * Math.pow(table.diameter(i) / 100, 2);
            assertThat(table.signal(i)).isCloseTo(expected, within(1e-9));
        }
    }

    @Test
    void parallelSweepMatchesSingleThreaded() {
        double[] series = DiameterSeries.range(20, 400, 20);
        CalibrationTable serial = new CalibrationEngine(QUADRATIC, 1).buildTable(Detector.defaults(), SPHERES, series);
        CalibrationTable parallel = new CalibrationEngine(QUADRATIC, 8).buildTable(Detector.defaults(), SPHERES, series);
        assertThat(parallel.signals()).containsExactly(serial.signals());
    }

    @Test
    void resonantModelYieldsFoldedTable() {
        ResponseCalculator resonant = new ResponseCalculator(
            StubAmplitudeProviders.sizeScaled(d -> d <= 100 ? d / 100 : 2 - d / 100));
        CalibrationEngine engine = new CalibrationEngine(resonant, 2);

        CalibrationTable table = engine.buildTable(Detector.defaults(), SPHERES, new double[] {50, 100, 150});

        assertThat(table.monotonicity()).isEqualTo(Monotonicity.NON_MONOTONE);
        assertThatThrownBy(() -> new MieTransform(table).diameter(0.6))
            .isInstanceOf(AmbiguousInversionException.class);
    }

    @Test
    void failedEvaluationFailsWholeSweep() {
        IllegalStateException boom = new IllegalStateException("amplitude solver diverged");
        CalibrationEngine engine = new CalibrationEngine(
            new ResponseCalculator(StubAmplitudeProviders.failingAt(150, boom)), 3);

        assertThatThrownBy(() -> engine.buildTable(Detector.defaults(), SPHERES, new double[] {50, 100, 150, 200}))
            .isSameAs(boom);
    }

    @Test
    void invalidSeriesThrow() {
        CalibrationEngine engine = new CalibrationEngine(QUADRATIC, 2);
        assertThatThrownBy(() -> engine.buildTable(Detector.defaults(), SPHERES, new double[] {100}))
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> engine.buildTable(Detector.defaults(), SPHERES, new double[] {100, 50, 100}))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> engine.buildTable(Detector.defaults(), SPHERES, new double[] {0, 100}))
            .isInstanceOf(InvalidInputException.class);
    }

    // -- Gain calibration -----------------------------------------------------

    @Test
    void gainReproducesReferenceSignal() {
        CalibrationEngine engine = new CalibrationEngine(QUADRATIC, 1);
        Detector uncalibrated = Detector.defaults().withGain(7);

        Detector calibrated = engine.calibrate(uncalibrated, Particles.polystyrene(200), 60000);

        assertThat(calibrated.gain()).isCloseTo(60000 / 4.08, within(1e-6));
        assertThat(QUADRATIC.response(Particles.polystyrene(200), calibrated)).isCloseTo(60000, within(1e-6));
        assertThat(uncalibrated.gain()).isEqualTo(7.0);
    }

    @Test
    void gainFromFactoryMatchesGainFromParticle() {
        CalibrationEngine engine = new CalibrationEngine(QUADRATIC, 1);
        Detector a = engine.calibrate(Detector.defaults(), Particles.polystyreneFactory(), 200, 60000);
        Detector b = engine.calibrate(Detector.defaults(), Particles.polystyrene(200), 60000);
        assertThat(a.gain()).isEqualTo(b.gain());
    }

    @Test
    void nonPositiveReferenceSignalThrows() {
        CalibrationEngine engine = new CalibrationEngine(QUADRATIC, 1);
        assertThatThrownBy(() -> engine.calibrate(Detector.defaults(), Particles.polystyrene(200), 0))
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> engine.calibrate(Detector.defaults(), Particles.polystyrene(200), Double.NaN))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void darkReferenceCannotAnchorGain() {
        CalibrationEngine engine = new CalibrationEngine(
            new ResponseCalculator(StubAmplitudeProviders.sizeScaled(d -> 0.0)), 1);
        assertThatThrownBy(() -> engine.calibrate(Detector.defaults(), Particles.polystyrene(200), 60000))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("cannot anchor");
    }

    @Test
    void fullCalibrationAttachesTableAtSolvedGain() {
        CalibrationEngine engine = new CalibrationEngine(QUADRATIC, 4);

        Detector calibrated = engine.calibrate(Detector.defaults(),
            Particles.polystyreneFactory(), 200, 60000,
            SPHERES, DiameterSeries.range(100, 400, 50));

        assertThat(calibrated.calibrationTable()).isPresent();
        CalibrationTable table = calibrated.calibrationTable().get();
        assertThat(table.maxSignal()).isCloseTo(60000 * 4, within(1e-6));
        assertThat(MieTransform.of(calibrated).diameter(60000)).isCloseTo(200.0, within(1e-6));
    }

    // -- Configuration --------------------------------------------------------

    @Test
    void threadsComeFromSystemProperty() {
        System.setProperty(CalibrationEngine.PROPERTY_THREADS, "3");
        assertThat(new CalibrationEngine(QUADRATIC).threads()).isEqualTo(3);
    }

    @Test
    void threadsDefaultToProcessorCount() {
        assertThat(CalibrationEngine.configuredThreads()).isEqualTo(Runtime.getRuntime().availableProcessors());
    }

    @Test
    void invalidThreadPropertyThrows() {
        System.setProperty(CalibrationEngine.PROPERTY_THREADS, "many");
        assertThatThrownBy(CalibrationEngine::configuredThreads).isInstanceOf(InvalidInputException.class);
        System.setProperty(CalibrationEngine.PROPERTY_THREADS, "0");
        assertThatThrownBy(CalibrationEngine::configuredThreads).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void zeroThreadsRejected() {
        assertThatThrownBy(() -> new CalibrationEngine(QUADRATIC, 0)).isInstanceOf(InvalidInputException.class);
    }
}
