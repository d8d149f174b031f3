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

/**
 * Immutable dense complex matrix with row-major storage.
 *
 * <p>Real and imaginary parts are held in two parallel {@code double[]} arrays so that
 * the Kronecker products and matrix-vector products used during state evolution
 * never allocate per-entry objects.
 *
 * <h2>Operations</h2>
 *
 * <table>
 *   <caption>Supported operations</caption>
 *   <tr><th>Method</th><th>Result</th></tr>
 *   <tr><td>{@link #kron(ComplexMatrix)}</td><td>A ⊗ B</td></tr>
 *   <tr><td>{@link #multiply(ComplexMatrix)}</td><td>A · B</td></tr>
 *   <tr><td>{@link #apply(double[], double[], double[], double[])}</td><td>A · v</td></tr>
 *   <tr><td>{@link #conjugateTranspose()}</td><td>A†</td></tr>
 *   <tr><td>{@link #trace()}</td><td>Tr(A)</td></tr>
 * </table>
 */
public final class ComplexMatrix {

    private final int rows;
    private final int cols;
    private final double[] re;
    private final double[] im;

    private ComplexMatrix(int rows, int cols, double[] re, double[] im) {
        this.rows = rows;
        this.cols = cols;
        this.re = re;
        this.im = im;
    }

    /**
     * Creates a zero matrix.
     *
     * @param rows number of rows
     * @param cols number of columns
     * @return a rows × cols zero matrix
     */
    public static ComplexMatrix zeros(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Matrix dimensions must be positive: " + rows + "x" + cols);
        }
        int size = entryCount(rows, cols);
        return new ComplexMatrix(rows, cols, new double[size], new double[size]);
    }

    /**
     * @param n dimension
     * @return the n × n identity matrix
     */
    public static ComplexMatrix identity(int n) {
        ComplexMatrix m = zeros(n, n);
        for (int i = 0; i < n; i++) {
            m.re[i * n + i] = 1.0;
        }
        return m;
    }

    /**
     * Builds a matrix from nested rows of entries.
     *
     * @param entries rows of complex entries; every row must have the same length
     * @return a matrix holding a copy of the entries
     */
    public static ComplexMatrix of(Complex[][] entries) {
        int rows = entries.length;
        if (rows == 0) {
            throw new IllegalArgumentException("Matrix must have at least one row");
        }
        int cols = entries[0].length;
        ComplexMatrix m = zeros(rows, cols);
        for (int r = 0; r < rows; r++) {
            if (entries[r].length != cols) {
                throw new IllegalArgumentException("Ragged matrix: row " + r + " has "
                    + entries[r].length + " columns, expected " + cols);
            }
            for (int c = 0; c < cols; c++) {
                m.re[r * cols + c] = entries[r][c].re();
                m.im[r * cols + c] = entries[r][c].im();
            }
        }
        return m;
    }

    /**
     * Creates a matrix directly from row-major parts. The arrays are copied.
     *
     * @param rows number of rows
     * @param cols number of columns
     * @param re real parts, row-major
     * @param im imaginary parts, row-major
     * @return the matrix
     */
    public static ComplexMatrix fromParts(int rows, int cols, double[] re, double[] im) {
        if (re.length != rows * cols || im.length != rows * cols) {
            throw new IllegalArgumentException("Expected " + rows * cols + " entries, got "
                + re.length + " real and " + im.length + " imaginary");
        }
        return new ComplexMatrix(rows, cols, re.clone(), im.clone());
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public boolean isSquare() {
        return rows == cols;
    }

    public Complex get(int row, int col) {
        int idx = row * cols + col;
        return new Complex(re[idx], im[idx]);
    }

    public double getRe(int row, int col) {
        return re[row * cols + col];
    }

    public double getIm(int row, int col) {
        return im[row * cols + col];
    }

    /**
     * Kronecker (tensor) product {@code this ⊗ other}.
     *
     * <p>Entry {@code (i·p + k, j·q + l)} of the result is {@code this[i][j] · other[k][l]}
     * where {@code other} is p × q.
     *
     * @param other right-hand factor
     * @return the Kronecker product
     */
    public ComplexMatrix kron(ComplexMatrix other) {
        int outRows;
        int outCols;
        try {
            outRows = Math.multiplyExact(rows, other.rows);
            outCols = Math.multiplyExact(cols, other.cols);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Kronecker product of " + rows + "x" + cols + " and "
                + other.rows + "x" + other.cols + " exceeds int dimensions", e);
        }
        int size = entryCount(outRows, outCols);
        double[] outRe = new double[size];
        double[] outIm = new double[size];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                double aRe = re[i * cols + j];
                double aIm = im[i * cols + j];
                if (aRe == 0.0 && aIm == 0.0) {
                    continue;
                }
                for (int k = 0; k < other.rows; k++) {
                    int outRow = i * other.rows + k;
                    for (int l = 0; l < other.cols; l++) {
                        double bRe = other.re[k * other.cols + l];
                        double bIm = other.im[k * other.cols + l];
                        int idx = outRow * outCols + j * other.cols + l;
                        outRe[idx] = aRe * bRe - aIm * bIm;
                        outIm[idx] = aRe * bIm + aIm * bRe;
                    }
                }
            }
        }
        return new ComplexMatrix(outRows, outCols, outRe, outIm);
    }

    /**
     * Matrix product {@code this · other}.
     *
     * @param other right-hand operand
     * @return the product
     */
    public ComplexMatrix multiply(ComplexMatrix other) {
        if (cols != other.rows) {
            throw new IllegalArgumentException("Dimension mismatch: " + rows + "x" + cols
                + " · " + other.rows + "x" + other.cols);
        }
        double[] outRe = new double[rows * other.cols];
        double[] outIm = new double[rows * other.cols];
        for (int i = 0; i < rows; i++) {
            for (int k = 0; k < cols; k++) {
                double aRe = re[i * cols + k];
                double aIm = im[i * cols + k];
                if (aRe == 0.0 && aIm == 0.0) {
                    continue;
                }
                for (int j = 0; j < other.cols; j++) {
                    double bRe = other.re[k * other.cols + j];
                    double bIm = other.im[k * other.cols + j];
                    outRe[i * other.cols + j] += aRe * bRe - aIm * bIm;
                    outIm[i * other.cols + j] += aRe * bIm + aIm * bRe;
                }
            }
        }
        return new ComplexMatrix(rows, other.cols, outRe, outIm);
    }

    /**
     * Matrix-vector product written into caller-supplied output arrays.
     *
     * @param vRe real parts of the input vector
     * @param vIm imaginary parts of the input vector
     * @param outRe receives real parts of the result
     * @param outIm receives imaginary parts of the result
     */
    public void apply(double[] vRe, double[] vIm, double[] outRe, double[] outIm) {
        if (vRe.length != cols || vIm.length != cols) {
            throw new IllegalArgumentException("Vector length " + vRe.length
                + " does not match matrix columns " + cols);
        }
        for (int i = 0; i < rows; i++) {
            double sumRe = 0.0;
            double sumIm = 0.0;
            int base = i * cols;
            for (int j = 0; j < cols; j++) {
                double aRe = re[base + j];
                double aIm = im[base + j];
                if (aRe == 0.0 && aIm == 0.0) {
                    continue;
                }
                sumRe += aRe * vRe[j] - aIm * vIm[j];
                sumIm += aRe * vIm[j] + aIm * vRe[j];
            }
            outRe[i] = sumRe;
            outIm[i] = sumIm;
        }
    }

    /**
     * @return the conjugate transpose A†
     */
    public ComplexMatrix conjugateTranspose() {
        double[] outRe = new double[re.length];
        double[] outIm = new double[im.length];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                outRe[c * rows + r] = re[r * cols + c];
                outIm[c * rows + r] = -im[r * cols + c];
            }
        }
        return new ComplexMatrix(cols, rows, outRe, outIm);
    }

    /**
     * @return the sum of diagonal entries
     */
    public Complex trace() {
        requireSquare();
        double sumRe = 0.0;
        double sumIm = 0.0;
        for (int i = 0; i < rows; i++) {
            sumRe += re[i * cols + i];
            sumIm += im[i * cols + i];
        }
        return new Complex(sumRe, sumIm);
    }

    /**
     * Largest absolute deviation between this matrix and its conjugate transpose.
     *
     * @return max |A[i][j] − conj(A[j][i])|, zero for an exactly Hermitian matrix
     */
    public double hermitianDeviation() {
        requireSquare();
        double worst = 0.0;
        for (int i = 0; i < rows; i++) {
            for (int j = i; j < cols; j++) {
                double dRe = re[i * cols + j] - re[j * cols + i];
                double dIm = im[i * cols + j] + im[j * cols + i];
                worst = Math.max(worst, Math.hypot(dRe, dIm));
            }
        }
        return worst;
    }

    public boolean isHermitian(double tolerance) {
        return hermitianDeviation() <= tolerance;
    }

    /**
     * Checks U·U† = I within tolerance.
     *
     * @param tolerance absolute tolerance per entry
     * @return true if this matrix is unitary
     */
    public boolean isUnitary(double tolerance) {
        if (!isSquare()) {
            return false;
        }
        ComplexMatrix product = multiply(conjugateTranspose());
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                double expected = i == j ? 1.0 : 0.0;
                if (Math.abs(product.getRe(i, j) - expected) > tolerance
                    || Math.abs(product.getIm(i, j)) > tolerance) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @return a copy of the entries as nested rows
     */
    public Complex[][] toArray() {
        Complex[][] out = new Complex[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                out[r][c] = get(r, c);
            }
        }
        return out;
    }

    private void requireSquare() {
        if (!isSquare()) {
            throw new IllegalStateException("Operation requires a square matrix, got " + rows + "x" + cols);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComplexMatrix)) return false;
        ComplexMatrix other = (ComplexMatrix) o;
        return rows == other.rows && cols == other.cols
            && Arrays.equals(re, other.re) && Arrays.equals(im, other.im);
    }

    @Override
    public int hashCode() {
        int result = 31 * rows + cols;
        result = 31 * result + Arrays.hashCode(re);
        return 31 * result + Arrays.hashCode(im);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int r = 0; r < rows; r++) {
            if (r > 0) sb.append(", ");
            sb.append('[');
            for (int c = 0; c < cols; c++) {
                if (c > 0) sb.append(", ");
                sb.append(get(r, c).format(4));
            }
            sb.append(']');
        }
        return sb.append(']').toString();
    }

    private static int entryCount(int rows, int cols) {
        try {
            return Math.multiplyExact(rows, cols);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("A " + rows + "x" + cols + " matrix exceeds the addressable size", e);
        }
    }
}
