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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/// Checks the Jacobi solver against commons-math3 on random symmetric input, and
/// the complex path against spectral invariants.
@Tag("accuracy")
class HermitianEigenvaluesTest {

    @Test
    void realSymmetricMatchesCommonsMath() {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(42L);
        for (int trial = 0; trial < 20; trial++) {
            int n = 3 + trial % 4;
            double[][] a = new double[n][n];
            for (int i = 0; i < n; i++) {
                for (int j = i; j < n; j++) {
                    double v = rng.nextDouble() * 2.0 - 1.0;
                    a[i][j] = v;
                    a[j][i] = v;
                }
            }
            double[] expected = new EigenDecomposition(new Array2DRowRealMatrix(a)).getRealEigenvalues();
            Arrays.sort(expected);
            double[] actual = HermitianEigenvalues.of(ComplexMatrix.fromParts(n, n, flatten(a), new double[n * n]));
            for (int k = 0; k < n; k++) {
                assertThat(actual[k]).isCloseTo(expected[n - 1 - k], within(1e-9));
            }
        }
    }

    @Test
    void complexHermitianPreservesTraceAndFrobeniusNorm() {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(7L);
        int n = 4;
        double[] re = new double[n * n];
        double[] im = new double[n * n];
        for (int i = 0; i < n; i++) {
            re[i * n + i] = rng.nextDouble();
            for (int j = i + 1; j < n; j++) {
                double r = rng.nextDouble() - 0.5;
                double c = rng.nextDouble() - 0.5;
                re[i * n + j] = r;
                re[j * n + i] = r;
                im[i * n + j] = c;
                im[j * n + i] = -c;
            }
        }
        ComplexMatrix h = ComplexMatrix.fromParts(n, n, re, im);
        double[] eigenvalues = HermitianEigenvalues.of(h);

        double frobenius = 0.0;
        for (int i = 0; i < n * n; i++) {
            frobenius += re[i] * re[i] + im[i] * im[i];
        }
        assertThat(Arrays.stream(eigenvalues).sum()).isCloseTo(h.trace().re(), within(1e-9));
        assertThat(Arrays.stream(eigenvalues).map(v -> v * v).sum()).isCloseTo(frobenius, within(1e-9));
        for (int k = 1; k < n; k++) {
            assertThat(eigenvalues[k - 1]).isGreaterThanOrEqualTo(eigenvalues[k]);
        }
    }

    @Test
    void closedFormForPauliY() {
        ComplexMatrix y = ComplexMatrix.of(new Complex[][]{
            {Complex.ZERO, Complex.of(0, -1)},
            {Complex.I, Complex.ZERO}});
        assertThat(HermitianEigenvalues.of(y)).containsExactly(new double[]{1.0, -1.0}, within(1e-12));
    }

    private static double[] flatten(double[][] a) {
        int n = a.length;
        double[] out = new double[n * n];
        for (int i = 0; i < n; i++) {
            System.arraycopy(a[i], 0, out, i * n, n);
        }
        return out;
    }
}
