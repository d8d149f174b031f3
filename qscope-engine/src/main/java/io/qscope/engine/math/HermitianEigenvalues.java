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

import java.util.Arrays;

/// Eigenvalues of small complex Hermitian matrices.
///
/// ## Strategy
///
/// | Size | Method |
/// |------|--------|
/// | 1×1 | the single real diagonal entry |
/// | 2×2 | closed form: (a+d)/2 ± √(((a−d)/2)² + \|b\|²) |
/// | n×n | cyclic Jacobi on the 2n×2n real symmetric embedding |
///
/// A Hermitian `H = A + iB` has the same spectrum as the real symmetric matrix
/// `[[A, −B], [B, A]]`, with every eigenvalue appearing twice. The Jacobi sweep
/// therefore runs on real arithmetic only, and every second sorted value is kept.
///
/// Reduced density matrices in this engine are at most 4×4, so the 8×8 embedding
/// converges in a handful of sweeps.
public final class HermitianEigenvalues {

    private static final int MAX_SWEEPS = 100;
    private static final double CONVERGENCE = 1e-24;

    private HermitianEigenvalues() {
        // Utility class
    }

    /// Computes all eigenvalues, sorted in descending order.
    ///
    /// The imaginary parts of the diagonal are ignored; callers are expected to
    /// check Hermiticity first.
    ///
    /// @param matrix a square Hermitian matrix
    /// @return real eigenvalues, largest first
    public static double[] of(ComplexMatrix matrix) {
        if (!matrix.isSquare()) {
            throw new IllegalArgumentException("Eigenvalues require a square matrix, got "
                + matrix.rows() + "x" + matrix.cols());
        }
        int n = matrix.rows();
        if (n == 1) {
            return new double[]{matrix.getRe(0, 0)};
        }
        if (n == 2) {
            return closedForm2x2(matrix);
        }
        return jacobiEmbedded(matrix);
    }

    static double[] closedForm2x2(ComplexMatrix m) {
        double a = m.getRe(0, 0);
        double d = m.getRe(1, 1);
        double bRe = m.getRe(0, 1);
        double bIm = m.getIm(0, 1);
        double mean = (a + d) / 2.0;
        double half = (a - d) / 2.0;
        double radius = Math.sqrt(half * half + bRe * bRe + bIm * bIm);
        return new double[]{mean + radius, mean - radius};
    }

    static double[] jacobiEmbedded(ComplexMatrix m) {
        int n = m.rows();
        int size = 2 * n;
        double[][] a = new double[size][size];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double re = m.getRe(i, j);
                double im = m.getIm(i, j);
                a[i][j] = re;
                a[i + n][j + n] = re;
                a[i][j + n] = -im;
                a[i + n][j] = im;
            }
        }
        symmetrize(a);

        double[] doubled = jacobi(a);
        Arrays.sort(doubled);

        double[] eigenvalues = new double[n];
        for (int k = 0; k < n; k++) {
            // each value is present twice; average the pair to cancel rounding
            eigenvalues[n - 1 - k] = (doubled[2 * k] + doubled[2 * k + 1]) / 2.0;
        }
        return eigenvalues;
    }

    /// Cyclic Jacobi eigenvalue iteration on a real symmetric matrix.
    ///
    /// The matrix is reduced in place; its diagonal holds the eigenvalues on return.
    ///
    /// @param a symmetric matrix, overwritten
    /// @return the diagonal after convergence, unsorted
    static double[] jacobi(double[][] a) {
        int size = a.length;
        for (int sweep = 0; sweep < MAX_SWEEPS; sweep++) {
            double off = 0.0;
            for (int p = 0; p < size; p++) {
                for (int q = p + 1; q < size; q++) {
                    off += a[p][q] * a[p][q];
                }
            }
            if (off < CONVERGENCE) {
                break;
            }
            for (int p = 0; p < size - 1; p++) {
                for (int q = p + 1; q < size; q++) {
                    if (Math.abs(a[p][q]) < 1e-300) {
                        continue;
                    }
                    rotate(a, p, q);
                }
            }
        }
        double[] diagonal = new double[size];
        for (int i = 0; i < size; i++) {
            diagonal[i] = a[i][i];
        }
        return diagonal;
    }

    private static void rotate(double[][] a, int p, int q) {
        int size = a.length;
        double theta = (a[q][q] - a[p][p]) / (2.0 * a[p][q]);
        double t = Math.signum(theta) / (Math.abs(theta) + Math.sqrt(theta * theta + 1.0));
        if (theta == 0.0) {
            t = 1.0;
        }
        double c = 1.0 / Math.sqrt(t * t + 1.0);
        double s = t * c;

        for (int k = 0; k < size; k++) {
            double akp = a[k][p];
            double akq = a[k][q];
            a[k][p] = c * akp - s * akq;
            a[k][q] = s * akp + c * akq;
        }
        for (int k = 0; k < size; k++) {
            double apk = a[p][k];
            double aqk = a[q][k];
            a[p][k] = c * apk - s * aqk;
            a[q][k] = s * apk + c * aqk;
        }
        a[p][q] = 0.0;
        a[q][p] = 0.0;
    }

    private static void symmetrize(double[][] a) {
        for (int i = 0; i < a.length; i++) {
            for (int j = i + 1; j < a.length; j++) {
                double mean = (a[i][j] + a[j][i]) / 2.0;
                a[i][j] = mean;
                a[j][i] = mean;
            }
        }
    }
}
