package com.polereduction.core.filter;

import com.polereduction.core.exceptions.NumericalInstabilityException;
import com.polereduction.core.model.FieldGeometry;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link OperatorBuilder}.
 */
class OperatorBuilderTest {

    private static final double TOLERANCE = 1e-12;

    private final OperatorBuilder builder = new OperatorBuilder(1e-12);

    private final double[] wavenumbers = SpectralTransformer.wavenumbers(64, 10.0);

    @Test
    @DisplayName("Zero wavenumber should pass through unchanged")
    void dcShouldPassThrough() {
        Complex[] operator = builder.build(FieldGeometry.of(42.3, 0.9719, 90), wavenumbers);

        assertThat(operator).hasSize(wavenumbers.length);
        assertThat(operator[0]).isEqualTo(Complex.ONE);
    }

    @Test
    @DisplayName("Should match the closed-form transfer function")
    void shouldMatchClosedForm() {
        FieldGeometry geometry = FieldGeometry.of(42.3, 0.9719, 90);
        double fz = Math.sin(Math.toRadians(42.3));
        double h = Math.cos(Math.toRadians(42.3)) * Math.sin(Math.toRadians(0.9719));

        Complex[] operator = builder.build(geometry, wavenumbers);

        Complex positive = new Complex(fz).divide(new Complex(h, fz));
        Complex negative = new Complex(fz).divide(new Complex(h, -fz));
        assertThat(operator[1].getReal()).isCloseTo(positive.getReal(), within(TOLERANCE));
        assertThat(operator[1].getImaginary()).isCloseTo(positive.getImaginary(), within(TOLERANCE));
        assertThat(operator[63].getReal()).isCloseTo(negative.getReal(), within(TOLERANCE));
        assertThat(operator[63].getImaginary()).isCloseTo(negative.getImaginary(), within(TOLERANCE));
    }

    @Test
    @DisplayName("Operator should be conjugate-symmetric so the output stays real")
    void operatorShouldBeConjugateSymmetric() {
        Complex[] operator = builder.build(FieldGeometry.of(-35, 12, 200), wavenumbers);

        for (int i = 1; i < 32; i++) {
            Complex mirrored = operator[wavenumbers.length - i].conjugate();
            assertThat(operator[i].getReal()).isCloseTo(mirrored.getReal(), within(TOLERANCE));
            assertThat(operator[i].getImaginary()).isCloseTo(mirrored.getImaginary(), within(TOLERANCE));
        }
    }

    @Test
    @DisplayName("Vertical field should give unit magnitude for any declination and azimuth")
    void verticalFieldShouldHaveUnitMagnitude() {
        for (int declination = 0; declination < 360; declination += 45) {
            for (int azimuth = 0; azimuth < 360; azimuth += 30) {
                Complex[] operator = builder.build(FieldGeometry.of(90, declination, azimuth), wavenumbers);
                for (int i = 1; i < operator.length; i++) {
                    assertThat(operator[i].abs()).isCloseTo(1.0, within(TOLERANCE));
                }
            }
        }
    }

    @Test
    @DisplayName("Magnitude should never exceed one")
    void magnitudeShouldBeBounded() {
        // inclination 0 is left out: some of these pairs are degenerate there
        for (int inclination = -75; inclination <= 75; inclination += 30) {
            for (int declination = 0; declination < 360; declination += 30) {
                for (int azimuth = 0; azimuth < 360; azimuth += 45) {
                    FieldGeometry geometry = FieldGeometry.of(inclination, declination, azimuth);
                    Complex[] operator = builder.build(geometry, wavenumbers);

                    double h = geometry.horizontalProjection();
                    double fz = geometry.fieldZ();
                    double expected = Math.abs(fz) / Math.sqrt(h * h + fz * fz);
                    for (int i = 1; i < operator.length; i++) {
                        assertThat(operator[i].abs())
                                .isLessThanOrEqualTo(1.0 + TOLERANCE)
                                .isCloseTo(expected, within(TOLERANCE));
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Magnitude reaches one when the horizontal field is perpendicular to the profile")
    void magnitudeShouldReachOneWhenPerpendicular() {
        Complex[] operator = builder.build(FieldGeometry.of(45, 0, 90), wavenumbers);

        for (int i = 1; i < operator.length; i++) {
            assertThat(operator[i].abs()).isCloseTo(1.0, within(TOLERANCE));
        }
    }

    @Test
    @DisplayName("Horizontal field along the profile should suppress every non-DC bin")
    void horizontalFieldAlongProfileShouldSuppress() {
        Complex[] operator = builder.build(FieldGeometry.of(0, 0, 0), wavenumbers);

        assertThat(operator[0]).isEqualTo(Complex.ONE);
        for (int i = 1; i < operator.length; i++) {
            assertThat(operator[i].abs()).isCloseTo(0.0, within(TOLERANCE));
        }
    }

    @Test
    @DisplayName("Horizontal field perpendicular to the profile should fail as degenerate")
    void degenerateGeometryShouldFail() {
        assertThatThrownBy(() -> builder.build(FieldGeometry.of(0, 0, 90), wavenumbers))
                .hasMessageContaining("Degenerate field geometry")
                .isInstanceOfSatisfying(NumericalInstabilityException.class, ex -> {
                    assertThat(ex.getWavenumberIndex()).isEqualTo(1);
                    assertThat(ex.getDenominatorMagnitude()).isLessThan(1e-12);
                });
    }

    @Test
    @DisplayName("A single zero wavenumber never triggers the degeneracy check")
    void dcOnlyShouldNotFail() {
        Complex[] operator = builder.build(FieldGeometry.of(0, 0, 90), new double[] { 0.0 });

        assertThat(operator).containsExactly(Complex.ONE);
    }

    @Test
    @DisplayName("Should reject a non-positive epsilon")
    void shouldRejectEpsilon() {
        assertThatThrownBy(() -> new OperatorBuilder(0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("epsilon");
    }
}
