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

import io.qscope.engine.math.Complex;
import io.qscope.engine.math.ComplexMatrix;

import java.util.Arrays;

/**
 * Immutable pure state of an n-qubit register: 2ⁿ complex amplitudes.
 *
 * <h2>Bit convention</h2>
 *
 * <p>Basis index {@code i} assigns qubit {@code b} the value {@code (i >> b) & 1}. Qubit 0 is
 * the least significant bit. {@link #basisLabel(int)} prints qubit n−1 first, so
 * {@code X} on qubit 0 of a 2-qubit register yields index 1, labelled {@code 01}.
 *
 * <h2>Storage</h2>
 *
 * <p>Real and imaginary parts are kept in parallel primitive arrays and never exposed;
 * every transformation returns a new instance.
 */
public final class StateVector {

    private final int numQubits;
    private final double[] re;
    private final double[] im;

    private StateVector(int numQubits, double[] re, double[] im) {
        this.numQubits = numQubits;
        this.re = re;
        this.im = im;
    }

    /**
     * @param numQubits register size, at least 1
     * @return |0…0⟩
     */
    public static StateVector ground(int numQubits) {
        int dim = dimensionOf(numQubits);
        double[] re = new double[dim];
        re[0] = 1.0;
        return new StateVector(numQubits, re, new double[dim]);
    }

    /**
     * @param numQubits register size, at least 1
     * @return (1/√N) Σ|i⟩
     */
    public static StateVector uniform(int numQubits) {
        int dim = dimensionOf(numQubits);
        double[] re = new double[dim];
        Arrays.fill(re, 1.0 / Math.sqrt(dim));
        return new StateVector(numQubits, re, new double[dim]);
    }

    /**
     * Creates a state from explicit amplitudes. No normalization is applied.
     *
     * @param amplitudes 2ⁿ amplitudes, n ≥ 1
     * @return the state
     */
    public static StateVector of(Complex... amplitudes) {
        double[] re = new double[amplitudes.length];
        double[] im = new double[amplitudes.length];
        for (int i = 0; i < amplitudes.length; i++) {
            re[i] = amplitudes[i].re();
            im[i] = amplitudes[i].im();
        }
        return fromParts(re, im);
    }

    /**
     * Creates a state from parallel real and imaginary arrays, which are copied.
     *
     * @param re real parts
     * @param im imaginary parts
     * @return the state
     * @throws IllegalArgumentException if the length is not a power of two ≥ 2
     */
    public static StateVector fromParts(double[] re, double[] im) {
        if (re.length != im.length) {
            throw new IllegalArgumentException("Real and imaginary parts differ in length: "
                + re.length + " vs " + im.length);
        }
        int dim = re.length;
        if (dim < 2 || Integer.bitCount(dim) != 1) {
            throw new IllegalArgumentException("State vector length must be a power of two >= 2, got: " + dim);
        }
        return new StateVector(Integer.numberOfTrailingZeros(dim), re.clone(), im.clone());
    }

    private static int dimensionOf(int numQubits) {
        if (numQubits < 1 || numQubits > 30) {
            throw new IllegalArgumentException("Qubit count must be in [1, 30], got: " + numQubits);
        }
        return 1 << numQubits;
    }

    public int numQubits() {
        return numQubits;
    }

    /** @return 2ⁿ */
    public int dimension() {
        return re.length;
    }

    public Complex amplitude(int index) {
        return new Complex(re[index], im[index]);
    }

    public double re(int index) {
        return re[index];
    }

    public double im(int index) {
        return im[index];
    }

    public Complex[] amplitudes() {
        Complex[] out = new Complex[re.length];
        for (int i = 0; i < re.length; i++) {
            out[i] = new Complex(re[i], im[i]);
        }
        return out;
    }

    /** @return |ψᵢ|² */
    public double probability(int index) {
        return re[index] * re[index] + im[index] * im[index];
    }

    /** @return measurement probabilities in the computational basis */
    public double[] probabilities() {
        double[] p = new double[re.length];
        for (int i = 0; i < p.length; i++) {
            p[i] = probability(i);
        }
        return p;
    }

    /** @return Σ|ψᵢ|², 1 for a normalized state */
    public double normSquared() {
        double sum = 0.0;
        for (int i = 0; i < re.length; i++) {
            sum += probability(i);
        }
        return sum;
    }

    /**
     * Applies a full-system operator.
     *
     * @param operator a 2ⁿ × 2ⁿ matrix
     * @return U|ψ⟩
     */
    public StateVector apply(ComplexMatrix operator) {
        if (operator.rows() != re.length || operator.cols() != re.length) {
            throw new IllegalArgumentException("Operator is " + operator.rows() + "x" + operator.cols()
                + " but state dimension is " + re.length);
        }
        double[] outRe = new double[re.length];
        double[] outIm = new double[im.length];
        operator.apply(re, im, outRe, outIm);
        return new StateVector(numQubits, outRe, outIm);
    }

    /**
     * @param other a state of the same dimension
     * @return ⟨this|other⟩
     */
    public Complex innerProduct(StateVector other) {
        requireSameDimension(other);
        double sumRe = 0.0;
        double sumIm = 0.0;
        for (int i = 0; i < re.length; i++) {
            // conj(a) * b
            sumRe += re[i] * other.re[i] + im[i] * other.im[i];
            sumIm += re[i] * other.im[i] - im[i] * other.re[i];
        }
        return new Complex(sumRe, sumIm);
    }

    /**
     * @param other a state of the same dimension
     * @return |⟨this|other⟩|²
     */
    public double fidelity(StateVector other) {
        return innerProduct(other).absSquared();
    }

    /**
     * Compares amplitudes component-wise.
     *
     * @param other state to compare
     * @param tolerance absolute tolerance per real and imaginary part
     * @return true if both states have the same dimension and all amplitudes match
     */
    public boolean approximatelyEquals(StateVector other, double tolerance) {
        if (other.re.length != re.length) {
            return false;
        }
        for (int i = 0; i < re.length; i++) {
            if (Math.abs(re[i] - other.re[i]) > tolerance || Math.abs(im[i] - other.im[i]) > tolerance) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param index basis index
     * @return n-character bit string, qubit n−1 first
     */
    public String basisLabel(int index) {
        return basisLabel(index, numQubits);
    }

    public static String basisLabel(int index, int numQubits) {
        StringBuilder sb = new StringBuilder(numQubits);
        for (int b = numQubits - 1; b >= 0; b--) {
            sb.append(((index >> b) & 1) == 1 ? '1' : '0');
        }
        return sb.toString();
    }

    private void requireSameDimension(StateVector other) {
        if (other.re.length != re.length) {
            throw new IllegalArgumentException("State dimensions differ: " + re.length + " vs " + other.re.length);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateVector)) return false;
        StateVector other = (StateVector) o;
        return Arrays.equals(re, other.re) && Arrays.equals(im, other.im);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(re) + Arrays.hashCode(im);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("StateVector[");
        for (int i = 0; i < re.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(amplitude(i).format(4)).append("|").append(basisLabel(i)).append("⟩");
        }
        return sb.append(']').toString();
    }
}
