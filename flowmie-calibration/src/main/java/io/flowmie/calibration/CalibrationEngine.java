package io.flowmie.calibration;

import io.flowmie.api.CalibrationPoint;
import io.flowmie.api.CalibrationTable;
import io.flowmie.api.Detector;
import io.flowmie.api.FlowMieException;
import io.flowmie.api.InvalidInputException;
import io.flowmie.api.Particle;
import io.flowmie.api.ParticleFactory;
import io.flowmie.core.ResponseCalculator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calibrates detector gain against a reference bead and builds diameter-to-signal
 * lookup tables for the Mie transform.
 *
 * CALIBRATION:
 *   gain = referenceSignal / response(referenceParticle, detector with gain 1)
 *   The reference is typically a polystyrene bead of known size; referenceSignal is
 *   its population median or mode on the scatter channel.
 *
 * TABLE SWEEP:
 *   Every diameter is evaluated independently on a fixed worker pool created for the
 *   sweep and shut down when it ends. The table re-sorts its points by diameter, so
 *   evaluation order does not matter. Any failed evaluation fails the whole sweep.
 *
 * Pool size comes from the constructor or the system property
 * {@value #PROPERTY_THREADS}; default is the number of available processors.
 */
public final class CalibrationEngine {

    private static final Logger log = LoggerFactory.getLogger(CalibrationEngine.class);

    public static final String PROPERTY_THREADS = "flowmie.calibration.threads";

    private final ResponseCalculator calculator;
    private final int threads;

    public CalibrationEngine(ResponseCalculator calculator) {
        this(calculator, configuredThreads());
    }

    /**
     * @param calculator response model used for every evaluation; must not be null
     * @param threads    worker pool size for table sweeps; at least 1
     */
    public CalibrationEngine(ResponseCalculator calculator, int threads) {
        if (calculator == null) {
            throw new NullPointerException("calculator");
        }
        if (threads < 1) {
            throw InvalidInputException.invalidParameter("threads", threads, "at least 1");
        }
        this.calculator = calculator;
        this.threads = threads;
    }

    /**
     * Pool size from {@value #PROPERTY_THREADS}, or the available processor count.
     *
     * @throws InvalidInputException if the property is not a positive integer
     */
    public static int configuredThreads() {
        String raw = System.getProperty(PROPERTY_THREADS);
        if (raw == null || raw.isBlank()) {
            return Runtime.getRuntime().availableProcessors();
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException(
                "System property " + PROPERTY_THREADS + " is not an integer: " + raw, e);
        }
        if (value < 1) {
            throw InvalidInputException.invalidParameter(PROPERTY_THREADS, value, "at least 1");
        }
        return value;
    }

    // -- Gain calibration -----------------------------------------------------

    /**
     * Solves the detector gain so the predicted reference response equals the measured one.
     *
     * @return a new detector carrying the solved gain; the input detector is unchanged
     * @throws InvalidInputException if the reference signal is not a finite positive value,
     *                               or the reference particle is predicted to scatter nothing
     */
    public Detector calibrate(Detector detector, Particle referenceParticle, double referenceSignal) {
        if (detector == null) {
            throw new NullPointerException("detector");
        }
        if (referenceParticle == null) {
            throw new NullPointerException("referenceParticle");
        }
        if (!(referenceSignal > 0.0) || Double.isInfinite(referenceSignal)) {
            throw InvalidInputException.invalidParameter("referenceSignal", referenceSignal, "a finite value > 0");
        }
        double raw = calculator.response(referenceParticle, detector.withGain(1.0));
        if (!(raw > 0.0) || Double.isInfinite(raw)) {
            throw new InvalidInputException("Predicted response " + raw + " of reference particle "
                + referenceParticle + " cannot anchor a gain");
        }
        double gain = referenceSignal / raw;
        log.info("Calibrated gain {} from reference {} (measured {}, predicted {} at unit gain)",
            gain, referenceParticle, referenceSignal, raw);
        return detector.withGain(gain);
    }

    /** Gain calibration against a reference built by the factory at the given diameter. */
    public Detector calibrate(Detector detector, ParticleFactory referenceFactory,
                              double referenceDiameter, double referenceSignal) {
        if (referenceFactory == null) {
            throw new NullPointerException("referenceFactory");
        }
        return calibrate(detector, referenceFactory.create(referenceDiameter), referenceSignal);
    }

    /**
     * Gain calibration followed by a table sweep at the solved gain.
     *
     * @return a new detector carrying both the solved gain and the lookup table
     */
    public Detector calibrate(Detector detector, ParticleFactory referenceFactory,
                              double referenceDiameter, double referenceSignal,
                              ParticleFactory particleFactory, double[] diameters) {
        Detector calibrated = calibrate(detector, referenceFactory, referenceDiameter, referenceSignal);
        CalibrationTable table = buildTable(calibrated, particleFactory, diameters);
        return calibrated.withCalibrationTable(table);
    }

    // -- Table sweep ----------------------------------------------------------

    /**
     * Predicts the detector signal for every diameter of the series.
     *
     * @param diameters at least two distinct, finite, positive diameters, any order
     * @throws InvalidInputException for an empty, duplicated or non-positive series
     */
    public CalibrationTable buildTable(Detector detector, ParticleFactory particleFactory, double[] diameters) {
        if (detector == null) {
            throw new NullPointerException("detector");
        }
        if (particleFactory == null) {
            throw new NullPointerException("particleFactory");
        }
        validateSeries(diameters);

        long start = System.nanoTime();
        int poolSize = Math.min(threads, diameters.length);
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, new SweepThreadFactory());
        List<CalibrationPoint> points = new ArrayList<>(diameters.length);
        try {
            List<Future<CalibrationPoint>> pending = new ArrayList<>(diameters.length);
            for (double d : diameters) {
                pending.add(pool.submit(() -> evaluate(detector, particleFactory, d)));
            }
            for (int i = 0; i < pending.size(); i++) {
                points.add(await(pending.get(i), diameters[i]));
            }
        } finally {
            pool.shutdownNow();
        }

        CalibrationTable table = new CalibrationTable(points);
        log.info("Built calibration table over {} diameters [{} .. {}] on {} threads in {} ms: signal [{} .. {}], {}",
            table.size(), table.minDiameter(), table.maxDiameter(), poolSize,
            (System.nanoTime() - start) / 1_000_000L,
            table.minSignal(), table.maxSignal(), table.monotonicity());
        if (!table.isMonotone()) {
            log.warn("Calibration table is not monotone in diameter (Mie resonance); "
                + "signals in folded regions will not invert");
        }
        return table;
    }

    private CalibrationPoint evaluate(Detector detector, ParticleFactory factory, double diameter) {
        Particle particle = factory.create(diameter);
        double signal = calculator.response(particle, detector);
        log.debug("diameter {} -> signal {}", diameter, signal);
        return new CalibrationPoint(diameter, signal);
    }

    private static CalibrationPoint await(Future<CalibrationPoint> future, double diameter) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new FlowMieException("Calibration sweep failed at diameter " + diameter, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlowMieException("Calibration sweep interrupted at diameter " + diameter, e);
        }
    }

    private static void validateSeries(double[] diameters) {
        if (diameters == null) {
            throw new NullPointerException("diameters");
        }
        if (diameters.length < 2) {
            throw new InvalidInputException(
                "A calibration sweep needs at least 2 diameters; got " + diameters.length);
        }
        double[] sorted = diameters.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < sorted.length; i++) {
            if (!(sorted[i] > 0.0) || Double.isInfinite(sorted[i])) {
                throw InvalidInputException.invalidParameter("diameter", sorted[i], "a finite value > 0");
            }
            if (i > 0 && sorted[i] == sorted[i - 1]) {
                throw new InvalidInputException("Duplicate diameter in sweep: " + sorted[i]);
            }
        }
    }

    public ResponseCalculator calculator() { return calculator; }

    public int threads() { return threads; }

    /** Daemon workers named "flowmie-calibration-{n}". */
    private static final class SweepThreadFactory implements ThreadFactory {

        private static final AtomicInteger COUNTER = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread t = new Thread(task, "flowmie-calibration-" + COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
