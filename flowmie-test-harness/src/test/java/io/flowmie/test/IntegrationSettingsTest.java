package io.flowmie.test;

import io.flowmie.api.InvalidInputException;
import io.flowmie.core.IntegrationSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class IntegrationSettingsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(IntegrationSettings.PROPERTY_DR);
        System.clearProperty(IntegrationSettings.PROPERTY_DPHI);
    }

    @Test
    void defaultStepCounts() {
        assertThat(IntegrationSettings.DEFAULT.radialSteps()).isEqualTo(51);
        assertThat(IntegrationSettings.DEFAULT.azimuthalSteps()).isEqualTo(36);
    }

    @Test
    void fineStepCounts() {
        assertThat(IntegrationSettings.FINE.radialSteps()).isEqualTo(101);
        assertThat(IntegrationSettings.FINE.azimuthalSteps()).isEqualTo(360);
    }

    @Test
    void stepThatDoesNotDivideRangeStopsShort() {
        IntegrationSettings s = new IntegrationSettings(0.3, 100);
        assertThat(s.radialSteps()).isEqualTo(4);    // 0, 0.3, 0.6, 0.9
        assertThat(s.azimuthalSteps()).isEqualTo(3); // 0, 100, 200
    }

    @Test
    void wholeCircleStepSamplesOnce() {
        assertThat(new IntegrationSettings(1.0, 360).azimuthalSteps()).isEqualTo(1);
        assertThat(new IntegrationSettings(1.0, 360).radialSteps()).isEqualTo(2);
    }

    @Test
    void outOfRangeStepsThrow() {
        assertThatThrownBy(() -> new IntegrationSettings(0, 10)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new IntegrationSettings(1.5, 10)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new IntegrationSettings(0.02, 0)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new IntegrationSettings(0.02, 361)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new IntegrationSettings(Double.NaN, 10)).isInstanceOf(InvalidInputException.class);
    }

    // -- System properties ----------------------------------------------------

    @Test
    void unsetPropertiesFallBackToDefault() {
        assertThat(IntegrationSettings.fromSystemProperties()).isEqualTo(IntegrationSettings.DEFAULT);
    }

    @Test
    void propertiesOverrideSteps() {
        System.setProperty(IntegrationSettings.PROPERTY_DR, "0.01");
        System.setProperty(IntegrationSettings.PROPERTY_DPHI, " 1 ");
        assertThat(IntegrationSettings.fromSystemProperties()).isEqualTo(IntegrationSettings.FINE);
    }

    @Test
    void unparseablePropertyThrows() {
        System.setProperty(IntegrationSettings.PROPERTY_DR, "fine");
        assertThatThrownBy(IntegrationSettings::fromSystemProperties)
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining(IntegrationSettings.PROPERTY_DR);
    }

    @Test
    void outOfRangePropertyThrows() {
        System.setProperty(IntegrationSettings.PROPERTY_DPHI, "720");
        assertThatThrownBy(IntegrationSettings::fromSystemProperties)
            .isInstanceOf(InvalidInputException.class);
    }
}
