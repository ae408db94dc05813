package io.flowmie.test;

import io.flowmie.api.InvalidInputException;
import io.flowmie.calibration.DiameterSeries;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DiameterSeriesTest {

    @Test
    void defaultSweepSpansTwentyToThousand() {
        double[] d = DiameterSeries.defaultSweep();
        assertThat(d).hasSize(99);
        assertThat(d[0]).isEqualTo(20.0);
        assertThat(d[1]).isEqualTo(30.0);
        assertThat(d[d.length - 1]).isEqualTo(1000.0);
    }

    @Test
    void endIsIncludedDespiteRounding() {
        double[] d = DiameterSeries.range(0.1, 0.3, 0.1);
        assertThat(d).hasSize(3);
        assertThat(d[2]).isLessThanOrEqualTo(0.3).isCloseTo(0.3, within(1e-15));
    }

    @Test
    void stepThatOvershootsStopsBeforeEnd() {
        assertThat(DiameterSeries.range(100, 250, 100)).containsExactly(100, 200);
    }

    @Test
    void singlePointRange() {
        assertThat(DiameterSeries.range(200, 200, 10)).containsExactly(200);
    }

    @Test
    void invalidRangesThrow() {
        assertThatThrownBy(() -> DiameterSeries.range(100, 50, 10)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> DiameterSeries.range(50, 100, 0)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> DiameterSeries.range(50, Double.NaN, 10)).isInstanceOf(InvalidInputException.class);
    }
}
