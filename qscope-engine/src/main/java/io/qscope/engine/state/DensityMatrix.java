package io.qscope.engine.state;

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

import io.qscope.engine.InternalInvariantViolationException;
import io.qscope.engine.math.Complex;
import io.qscope.engine.math.ComplexMatrix;
import io.qscope.engine.math.HermitianEigenvalues;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reduced density matrix of a k-qubit subsystem.
 *
 * <p>Bit {@code j} of a row or column index is the value of the j-th kept qubit, in the
 * order the qubits were passed to {@link PartialTrace#reduce(StateVector, int...)}.
 *
 * <h2>Invariants</h2>
 *
 * <p>A physical density matrix is Hermitian with unit trace. {@link #validate(double)}
 * checks both; a failure is an engine defect, reported as
 * {@link InternalInvariantViolationException}, never as a user error.
 */
public final class DensityMatrix {

    private static final Logger logger = LogManager.getLogger(DensityMatrix.class);

    /** Eigenvalues at or below this threshold contribute nothing to the entropy. */
    public static final double EIGENVALUE_THRESHOLD = 1e-16;

    private final int numQubits;
    private final ComplexMatrix matrix;

    DensityMatrix(int numQubits, ComplexMatrix matrix) {
        this.numQubits = numQubits;
        this.matrix = matrix;
    }

    /**
     * Wraps an existing matrix as a density matrix.
     *
     * @param matrix a 2ᵏ × 2ᵏ matrix
     * @return the density matrix; not validated
     */
    public static DensityMatrix of(ComplexMatrix matrix) {
        if (!matrix.isSquare() || Integer.bitCount(matrix.rows()) != 1 || matrix.rows() < 2) {
            throw new IllegalArgumentException("Density matrix must be 2^k x 2^k, got "
                + matrix.rows() + "x" + matrix.cols());
        }
        return new DensityMatrix(Integer.numberOfTrailingZeros(matrix.rows()), matrix);
    }

    /**
     * @param state a pure state
     * @return |ψ⟩⟨ψ|
     */
    public static DensityMatrix pure(StateVector state) {
        int dim = state.dimension();
        double[] re = new double[dim * dim];
        double[] im = new double[dim * dim];
        for (int a = 0; a < dim; a++) {
            for (int b = 0; b < dim; b++) {
                // ψa · conj(ψb)
                re[a * dim + b] = state.re(a) * state.re(b) + state.im(a) * state.im(b);
                im[a * dim + b] = state.im(a) * state.re(b) - state.re(a) * state.im(b);
            }
        }
        return new DensityMatrix(state.numQubits(), ComplexMatrix.fromParts(dim, dim, re, im));
    }

    public int numQubits() {
        return numQubits;
    }

    public ComplexMatrix matrix() {
        return matrix;
    }

    public Complex get(int row, int col) {
        return matrix.get(row, col);
    }

    public Complex trace() {
        return matrix.trace();
    }

    /**
     * Tr(ρ²), computed as Σ|ρᵢⱼ|² which equals Tr(ρ²) for Hermitian ρ.
     *
     * @return 1 for a pure state, 1/2ᵏ for the maximally mixed state
     */
    public double purity() {
        int dim = matrix.rows();
        double sum = 0.0;
        for (int i = 0; i < dim; i++) {
            for (int j = 0; j < dim; j++) {
                double re = matrix.getRe(i, j);
                double im = matrix.getIm(i, j);
                sum += re * re + im * im;
            }
        }
        return sum;
    }

    /** @return eigenvalues, largest first */
    public double[] eigenvalues() {
        return HermitianEigenvalues.of(matrix);
    }

    /**
     * Von Neumann entropy in bits, S = −Σ λ log₂ λ over eigenvalues above
     * {@link #EIGENVALUE_THRESHOLD}.
     *
     * @return 0 for a pure subsystem, k for a maximally mixed k-qubit subsystem
     */
    public double entropy() {
        double s = 0.0;
        for (double lambda : eigenvalues()) {
            if (lambda > EIGENVALUE_THRESHOLD) {
                s -= lambda * log2(lambda);
            }
        }
        // rounding can leave a tiny negative value for pure subsystems
        return Math.max(0.0, s);
    }

    /**
     * Bloch vector of a single-qubit density matrix: x = 2 Re ρ₀₁, y = −2 Im ρ₀₁, z = ρ₀₀ − ρ₁₁.
     *
     * @return the Bloch vector
     * @throws IllegalStateException if this is not a single-qubit matrix
     */
    public BlochVector blochVector() {
        if (numQubits != 1) {
            throw new IllegalStateException("Bloch vector requires a single-qubit density matrix, got "
                + numQubits + " qubits");
        }
        return new BlochVector(
            2.0 * matrix.getRe(0, 1),
            -2.0 * matrix.getIm(0, 1),
            matrix.getRe(0, 0) - matrix.getRe(1, 1));
    }

    /**
     * Checks unit trace and Hermiticity.
     *
     * @param tolerance allowed absolute deviation
     * @return this matrix, for chaining
     * @throws InternalInvariantViolationException if either check fails
     */
    public DensityMatrix validate(double tolerance) {
        Complex tr = matrix.trace();
        double traceDeviation = Math.hypot(tr.re() - 1.0, tr.im());
        if (traceDeviation > tolerance) {
            logger.error("Reduced density matrix on {} qubits has trace {} (deviation {})",
                numQubits, tr, traceDeviation);
            throw new InternalInvariantViolationException(
                "Reduced density matrix trace deviates from 1 by " + traceDeviation, traceDeviation);
        }
        double hermitianDeviation = matrix.hermitianDeviation();
        if (hermitianDeviation > tolerance) {
            logger.error("Reduced density matrix on {} qubits is not Hermitian (deviation {})",
                numQubits, hermitianDeviation);
            throw new InternalInvariantViolationException(
                "Reduced density matrix is not Hermitian, deviation " + hermitianDeviation, hermitianDeviation);
        }
        return this;
    }

    static double log2(double x) {
        return Math.log(x) / Math.log(2.0);
    }

    @Override
    public String toString() {
        return "DensityMatrix{qubits=" + numQubits + ", " + matrix + "}";
    }
}
