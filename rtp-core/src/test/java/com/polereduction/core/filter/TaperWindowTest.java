package com.polereduction.core.filter;

import com.polereduction.core.model.TaperMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link HanningSplitWindow}, {@link TukeyWindow},
 * {@link TaperFactory} and {@link Taper}.
 */
class TaperWindowTest {

    private static final double TOLERANCE = 1e-12;

    // ------------------------------------------------------------------
    // Hanning split
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Hanning split window of 100 samples tapers 4 leading and 5 trailing samples")
    void hanningSplitShouldTaperBothEnds() {
        double[] w = new HanningSplitWindow(0.1).weights(100);

        // m = floor(0.1 * 99) = 9, Hann(9) = 0.5 - 0.5 cos(2 pi i / 8)
        assertThat(w).hasSize(100);
        assertThat(w[0]).isCloseTo(0.0, within(TOLERANCE));
        assertThat(w[1]).isCloseTo(0.5 - 0.5 * Math.cos(Math.PI / 4), within(TOLERANCE));
        assertThat(w[2]).isCloseTo(0.5, within(TOLERANCE));
        assertThat(w[4]).isEqualTo(1.0);
        assertThat(w[95]).isCloseTo(1.0, within(TOLERANCE));
        assertThat(w[97]).isCloseTo(0.5, within(TOLERANCE));
        assertThat(w[99]).isCloseTo(0.0, within(TOLERANCE));
        for (int i = 4; i <= 95; i++) {
            assertThat(w[i]).as("centre weight %d", i).isCloseTo(1.0, within(TOLERANCE));
        }
    }

    @Test
    @DisplayName("Hanning split window stays flat when fewer than two taper points fit")
    void hanningSplitShouldStayFlatForShortTaper() {
        assertThat(new HanningSplitWindow(0.1).weights(2)).containsExactly(1.0, 1.0);
        // m = floor(0.1 * 10) = 1 and a one-point Hann window is [1.0]
        assertThat(new HanningSplitWindow(0.1).weights(11)).containsOnly(1.0);
    }

    @Test
    @DisplayName("Hann helper should be symmetric and peak at one")
    void hannHelperShouldBeSymmetric() {
        double[] hann = HanningSplitWindow.hann(5);

        assertThat(hann).containsExactly(new double[] { 0.0, 0.5, 1.0, 0.5, 0.0 }, within(TOLERANCE));
        assertThat(HanningSplitWindow.hann(0)).isEmpty();
        assertThat(HanningSplitWindow.hann(1)).containsExactly(1.0);
    }

    // ------------------------------------------------------------------
    // Tukey
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Tukey window should be zero at both ends and symmetric")
    void tukeyShouldBeZeroAtEdges() {
        double[] w = new TukeyWindow(0.5).weights(11);

        double rise = 0.5 * (1.0 + Math.cos(-0.6 * Math.PI));
        double shoulder = 0.5 * (1.0 + Math.cos(-0.2 * Math.PI));
        assertThat(w).containsExactly(new double[] {
                0.0, rise, shoulder, 1, 1, 1, 1, 1, shoulder, rise, 0.0 }, within(TOLERANCE));
    }

    @Test
    @DisplayName("Tukey window with alpha 1 is a Hann window, alpha 0 a rectangle")
    void tukeyShouldCoverLimits() {
        assertThat(new TukeyWindow(1.0).weights(5))
                .containsExactly(HanningSplitWindow.hann(5), within(TOLERANCE));
        assertThat(new TukeyWindow(0.0).weights(7)).containsOnly(1.0);
    }

    @Test
    @DisplayName("Tukey window weights stay within [0, 1]")
    void tukeyWeightsShouldBeBounded() {
        for (int n = 2; n < 64; n++) {
            for (double w : new TukeyWindow(0.3).weights(n)) {
                assertThat(w).isBetween(0.0, 1.0);
            }
        }
    }

    // ------------------------------------------------------------------
    // Factory / Taper
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Factory should create the window for each mode")
    void factoryShouldMapModes() {
        assertThat(TaperFactory.create(TaperMode.HANNING_SPLIT, 0.1)).isInstanceOf(HanningSplitWindow.class);
        assertThat(TaperFactory.create(TaperMode.TUKEY, 0.1)).isInstanceOf(TukeyWindow.class);
        assertThat(TaperFactory.create(TaperMode.TUKEY, 0.25).getAlpha()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Should reject alpha outside [0, 1]")
    void shouldRejectInvalidAlpha() {
        assertThatThrownBy(() -> TaperFactory.create(TaperMode.TUKEY, 1.2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alpha");
        assertThatThrownBy(() -> new HanningSplitWindow(-0.01))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Taper should multiply without touching the input")
    void taperShouldMultiplyElementwise() {
        double[] signal = { 2, 2, 2, 2, 2 };
        Taper taper = new Taper(new TukeyWindow(1.0));

        double[] tapered = taper.apply(signal);

        assertThat(tapered).containsExactly(new double[] { 0, 1, 2, 1, 0 }, within(TOLERANCE));
        assertThat(signal).containsOnly(2.0);
    }
}
