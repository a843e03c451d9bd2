package com.polereduction.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TaperMode}.
 */
class TaperModeTest {

    @Test
    @DisplayName("Should resolve names regardless of case and separator")
    void shouldResolveNames() {
        assertThat(TaperMode.fromName("tukey")).isEqualTo(TaperMode.TUKEY);
        assertThat(TaperMode.fromName(" Hanning-Split ")).isEqualTo(TaperMode.HANNING_SPLIT);
        assertThat(TaperMode.fromName("HANNING_SPLIT")).isEqualTo(TaperMode.HANNING_SPLIT);
    }

    @Test
    @DisplayName("Should reject unknown or blank names")
    void shouldRejectUnknownNames() {
        assertThatThrownBy(() -> TaperMode.fromName("blackman"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown taper mode");
        assertThatThrownBy(() -> TaperMode.fromName(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
