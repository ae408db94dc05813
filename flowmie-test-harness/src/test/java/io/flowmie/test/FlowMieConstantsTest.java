package io.flowmie.test;

import io.flowmie.api.FlowMieConstants;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;

class FlowMieConstantsTest {

    @Test
    void defaultDetectorIsSideScatter() {
        assertThat(FlowMieConstants.DEFAULT_THETA_ZERO_DEGREES).isEqualTo(90.0);
        assertThat(FlowMieConstants.DEFAULT_ALPHA_DEGREES).isEqualTo(60.0);
        assertThat(FlowMieConstants.DEFAULT_PSI_ZERO_DEGREES).isEqualTo(90.0);
        assertThat(FlowMieConstants.DEFAULT_POLARIZATION).isEqualTo(1.0);
    }

    @Test
    void defaultIntegrationSteps() {
        assertThat(FlowMieConstants.DEFAULT_DR).isEqualTo(0.02);
        assertThat(FlowMieConstants.DEFAULT_DPHI_DEGREES).isEqualTo(10.0);
    }

    @Test
    void apertureAreaIsUnitDisk() {
        assertThat(FlowMieConstants.APERTURE_AREA).isEqualTo(Math.PI);
    }

    @Test
    void fineStepsAreFinerThanDefault() {
        assertThat(FlowMieConstants.FINE_DR).isLessThan(FlowMieConstants.DEFAULT_DR);
        assertThat(FlowMieConstants.FINE_DPHI_DEGREES).isLessThan(FlowMieConstants.DEFAULT_DPHI_DEGREES);
    }

    @Test
    void defaultAngleGridHasOneDegreeSpacing() {
        double spacing = FlowMieConstants.ANGLE_SPAN_DEGREES / (FlowMieConstants.DEFAULT_ANGLE_COUNT - 1);
        assertThat(spacing).isEqualTo(1.0);
    }

    @Test
    void validateDoesNotThrowWithCorrectDefaults() {
        assertThatCode(FlowMieConstants::validate).doesNotThrowAnyException();
    }
}
