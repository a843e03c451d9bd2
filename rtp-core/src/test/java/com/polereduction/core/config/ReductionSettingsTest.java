package com.polereduction.core.config;

import com.polereduction.core.model.TaperMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ReductionSettings}.
 */
class ReductionSettingsTest {

    @Test
    @DisplayName("Defaults should be valid and match the legacy pipeline")
    void defaultsShouldBeValid() {
        ReductionSettings settings = ReductionSettings.defaults();

        assertThatCode(settings::validate).doesNotThrowAnyException();
        assertThat(settings.getTaperAlpha()).isEqualTo(0.1);
        assertThat(settings.resolveTaperMode()).isEqualTo(TaperMode.HANNING_SPLIT);
        assertThat(settings.getPaddingFactor()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should normalise the taper mode name")
    void shouldNormaliseTaperMode() {
        ReductionSettings settings = new ReductionSettings();
        settings.setTaperMode("Hanning-Split");

        assertThat(settings.getTaperMode()).isEqualTo("hanning-split");
        assertThat(settings.resolveTaperMode()).isEqualTo(TaperMode.HANNING_SPLIT);
    }

    @Test
    @DisplayName("Should collect every validation error")
    void shouldReportAllErrors() {
        ReductionSettings settings = new ReductionSettings();
        settings.setTaperAlpha(-0.1);
        settings.setTaperMode("gaussian");
        settings.setPaddingFactor(0);
        settings.setDenominatorEpsilon(0.0);

        assertThatThrownBy(settings::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("taperAlpha")
                .hasMessageContaining("Unknown taper mode")
                .hasMessageContaining("paddingFactor")
                .hasMessageContaining("denominatorEpsilon");
    }

    @Test
    @DisplayName("Should reject a NaN taper fraction")
    void shouldRejectNanAlpha() {
        ReductionSettings settings = new ReductionSettings();
        settings.setTaperAlpha(Double.NaN);

        assertThatThrownBy(settings::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("taperAlpha");
    }
}
