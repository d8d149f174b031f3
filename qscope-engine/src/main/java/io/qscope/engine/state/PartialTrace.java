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

import io.qscope.engine.math.ComplexMatrix;

/// Reduction of a pure global state to the density matrix of a subsystem.
///
/// ## Algorithm
///
/// For kept qubits `K` (k of them) and traced-out qubits `T` (m = n − k):
///
/// ```text
/// ρ[a, b] = Σ_t ψ(K=a, T=t) · conj(ψ(K=b, T=t))     a, b ∈ [0, 2^k), t ∈ [0, 2^m)
/// ```
///
/// The full-index lookup `(a, t) → i` is precomputed once, so the cost is
/// `O(4^k · 2^m)` with no intermediate 2ⁿ × 2ⁿ matrix.
///
/// For one qubit, [#bloch(StateVector, int)] skips the matrix entirely and sums
/// ᾱβ and |α|² − |β|² over amplitude pairs that differ only in the target bit.
public final class PartialTrace {

    private PartialTrace() {
        // Utility class
    }

    /// Reduces a pure state to the given qubits.
    ///
    /// @param state the global state
    /// @param keep distinct qubit indices to keep; bit j of the reduced index is `keep[j]`
    /// @return the reduced density matrix, not yet validated
    public static DensityMatrix reduce(StateVector state, int... keep) {
        int n = state.numQubits();
        int k = keep.length;
        if (k == 0 || k > n) {
            throw new IllegalArgumentException("Must keep between 1 and " + n + " qubits, got " + k);
        }
        int keptMask = 0;
        for (int q : keep) {
            if (q < 0 || q >= n) {
                throw new IllegalArgumentException("Qubit " + q + " out of range for " + n + "-qubit state");
            }
            if ((keptMask & (1 << q)) != 0) {
                throw new IllegalArgumentException("Qubit " + q + " listed more than once");
            }
            keptMask |= 1 << q;
        }
        int[] traced = new int[n - k];
        for (int q = 0, t = 0; q < n; q++) {
            if ((keptMask & (1 << q)) == 0) {
                traced[t++] = q;
            }
        }

        int keptDim = 1 << k;
        int tracedDim = 1 << traced.length;
        int[][] fullIndex = new int[keptDim][tracedDim];
        for (int a = 0; a < keptDim; a++) {
            int base = scatter(a, keep);
            for (int t = 0; t < tracedDim; t++) {
                fullIndex[a][t] = base | scatter(t, traced);
            }
        }

        double[] re = new double[keptDim * keptDim];
        double[] im = new double[keptDim * keptDim];
        for (int a = 0; a < keptDim; a++) {
            for (int b = a; b < keptDim; b++) {
                double sumRe = 0.0;
                double sumIm = 0.0;
                for (int t = 0; t < tracedDim; t++) {
                    int i = fullIndex[a][t];
                    int j = fullIndex[b][t];
                    // ψi · conj(ψj)
                    sumRe += state.re(i) * state.re(j) + state.im(i) * state.im(j);
                    sumIm += state.im(i) * state.re(j) - state.re(i) * state.im(j);
                }
                re[a * keptDim + b] = sumRe;
                im[a * keptDim + b] = sumIm;
                re[b * keptDim + a] = sumRe;
                im[b * keptDim + a] = -sumIm;
            }
        }
        return new DensityMatrix(k, ComplexMatrix.fromParts(keptDim, keptDim, re, im));
    }

    /// Closed-form Bloch vector of one qubit.
    ///
    /// With α the amplitude where the qubit is 0 and β the partner amplitude where it is 1,
    /// summed over all assignments of the other qubits:
    /// x = 2 Re(ᾱβ), y = 2 Im(ᾱβ), z = |α|² − |β|².
    ///
    /// @param state the global state
    /// @param qubit target qubit
    /// @return its Bloch vector
    public static BlochVector bloch(StateVector state, int qubit) {
        if (qubit < 0 || qubit >= state.numQubits()) {
            throw new IllegalArgumentException("Qubit " + qubit + " out of range for "
                + state.numQubits() + "-qubit state");
        }
        int bit = 1 << qubit;
        double crossRe = 0.0;
        double crossIm = 0.0;
        double z = 0.0;
        for (int i = 0; i < state.dimension(); i++) {
            if ((i & bit) != 0) {
                continue;
            }
            int j = i | bit;
            double aRe = state.re(i);
            double aIm = state.im(i);
            double bRe = state.re(j);
            double bIm = state.im(j);
            // conj(α) · β
            crossRe += aRe * bRe + aIm * bIm;
            crossIm += aRe * bIm - aIm * bRe;
            z += (aRe * aRe + aIm * aIm) - (bRe * bRe + bIm * bIm);
        }
        return new BlochVector(2.0 * crossRe, 2.0 * crossIm, z);
    }

    /// Spreads the low bits of `value` onto the given qubit positions.
    private static int scatter(int value, int[] positions) {
        int out = 0;
        for (int j = 0; j < positions.length; j++) {
            if (((value >> j) & 1) != 0) {
                out |= 1 << positions[j];
            }
        }
        return out;
    }
}
