package io.qscope.engine.math;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ComplexMatrixTest {

    private static final double EPS = 1e-12;

    @Test
    void complexArithmetic() {
        Complex a = Complex.of(1, 2);
        Complex b = Complex.of(3, -1);
        assertThat(a.multiply(b)).isEqualTo(Complex.of(5, 5));
        assertThat(a.add(b)).isEqualTo(Complex.of(4, 1));
        assertThat(a.conjugate()).isEqualTo(Complex.of(1, -2));
        assertThat(Complex.I.multiply(Complex.I).approximatelyEquals(Complex.real(-1), EPS)).isTrue();
        assertThat(Complex.of(3, 4).abs()).isCloseTo(5.0, within(EPS));
    }

    @Test
    void formatDropsNegligibleParts() {
        assertThat(Complex.of(0.5, 0).format(3)).isEqualTo("0.500");
        assertThat(Complex.I.format(3)).isEqualTo("i");
        assertThat(Complex.of(0, -1).format(3)).isEqualTo("-i");
        assertThat(Complex.of(0.5, -0.25).format(2)).isEqualTo("0.50 - 0.25i");
    }

    @Test
    void kronPutsLeftFactorOnHighIndexBits() {
        ComplexMatrix x = ComplexMatrix.of(new Complex[][]{
            {Complex.ZERO, Complex.ONE},
            {Complex.ONE, Complex.ZERO}});
        ComplexMatrix xOnHigh = x.kron(ComplexMatrix.identity(2));
        // X ⊗ I maps |00⟩ (index 0) to |10⟩ (index 2)
        assertThat(xOnHigh.get(2, 0)).isEqualTo(Complex.ONE);
        assertThat(xOnHigh.get(1, 0)).isEqualTo(Complex.ZERO);

        ComplexMatrix xOnLow = ComplexMatrix.identity(2).kron(x);
        assertThat(xOnLow.get(1, 0)).isEqualTo(Complex.ONE);
        assertThat(xOnLow.rows()).isEqualTo(4);
        assertThat(xOnLow.isUnitary(EPS)).isTrue();
    }

    @Test
    void multiplyAndConjugateTranspose() {
        ComplexMatrix y = ComplexMatrix.of(new Complex[][]{
            {Complex.ZERO, Complex.of(0, -1)},
            {Complex.I, Complex.ZERO}});
        assertThat(y.conjugateTranspose().hermitianDeviation()).isZero();
        assertThat(y.isHermitian(EPS)).isTrue();
        ComplexMatrix square = y.multiply(y);
        assertThat(square.isUnitary(EPS)).isTrue();
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                double expected = i == j ? 1.0 : 0.0;
                assertThat(square.getRe(i, j)).isCloseTo(expected, within(EPS));
                assertThat(square.getIm(i, j)).isCloseTo(0.0, within(EPS));
            }
        }
        assertThat(square.trace().re()).isCloseTo(2.0, within(EPS));
    }

    @Test
    void oversizedProductsFailBeforeAllocating() {
        ComplexMatrix column = ComplexMatrix.zeros(1 << 16, 1);
        assertThatThrownBy(() -> column.kron(column))
            .isInstanceOf(IllegalArgumentException.class)
            .hasCauseInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> ComplexMatrix.zeros(1 << 16, 1 << 16))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonUnitaryAndShapeErrors() {
        ComplexMatrix scaled = ComplexMatrix.of(new Complex[][]{
            {Complex.real(2), Complex.ZERO},
            {Complex.ZERO, Complex.ONE}});
        assertThat(scaled.isUnitary(EPS)).isFalse();
        assertThatThrownBy(() -> ComplexMatrix.zeros(2, 3).multiply(ComplexMatrix.zeros(2, 3)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
