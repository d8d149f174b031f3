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

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

/// Immutable complex number used for state amplitudes and matrix entries.
///
/// Serializes to JSON as `{"re": ..., "im": ...}`.
public final class Complex {

    /// 0 + 0i
    public static final Complex ZERO = new Complex(0.0, 0.0);
    /// 1 + 0i
    public static final Complex ONE = new Complex(1.0, 0.0);
    /// 0 + 1i
    public static final Complex I = new Complex(0.0, 1.0);

    @SerializedName("re")
    private final double re;

    @SerializedName("im")
    private final double im;

    /// Creates a complex number.
    ///
    /// @param re real part
    /// @param im imaginary part
    public Complex(double re, double im) {
        this.re = re;
        this.im = im;
    }

    /// @param re real part
    /// @param im imaginary part
    /// @return a complex number with the given parts
    public static Complex of(double re, double im) {
        return new Complex(re, im);
    }

    /// @param re real value
    /// @return a complex number with zero imaginary part
    public static Complex real(double re) {
        return new Complex(re, 0.0);
    }

    public double re() {
        return re;
    }

    public double im() {
        return im;
    }

    public Complex add(Complex other) {
        return new Complex(re + other.re, im + other.im);
    }

    public Complex subtract(Complex other) {
        return new Complex(re - other.re, im - other.im);
    }

    public Complex multiply(Complex other) {
        return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
    }

    public Complex scale(double factor) {
        return new Complex(re * factor, im * factor);
    }

    public Complex conjugate() {
        return new Complex(re, -im);
    }

    /// @return the modulus |z|
    public double abs() {
        return Math.hypot(re, im);
    }

    /// @return |z|², without the square root
    public double absSquared() {
        return re * re + im * im;
    }

    /// @return the argument of this number in (-π, π]
    public double arg() {
        return Math.atan2(im, re);
    }

    /// Compares both parts within an absolute tolerance.
    ///
    /// @param other the value to compare against
    /// @param tolerance absolute tolerance per component
    /// @return true if both parts differ by at most `tolerance`
    public boolean approximatelyEquals(Complex other, double tolerance) {
        return Math.abs(re - other.re) <= tolerance && Math.abs(im - other.im) <= tolerance;
    }

    /// Formats this number for human-readable explanations.
    ///
    /// Parts below 1e-10 are dropped, and unit imaginary parts print as `i` or `-i`.
    ///
    /// @param precision number of decimal places
    /// @return formatted representation such as `0.707107 - i`
    public String format(int precision) {
        String fmt = "%." + precision + "f";
        if (Math.abs(im) < 1e-10) {
            return String.format(Locale.ROOT, fmt, re);
        }
        if (Math.abs(re) < 1e-10) {
            if (Math.abs(im - 1) < 1e-10) {
                return "i";
            }
            if (Math.abs(im + 1) < 1e-10) {
                return "-i";
            }
            return String.format(Locale.ROOT, fmt + "i", im);
        }
        String realPart = String.format(Locale.ROOT, fmt, re);
        if (im >= 0) {
            return Math.abs(im - 1) < 1e-10
                ? realPart + " + i"
                : realPart + " + " + String.format(Locale.ROOT, fmt + "i", im);
        }
        return Math.abs(im + 1) < 1e-10
            ? realPart + " - i"
            : realPart + " - " + String.format(Locale.ROOT, fmt + "i", Math.abs(im));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Complex)) return false;
        Complex other = (Complex) o;
        return Double.compare(re, other.re) == 0 && Double.compare(im, other.im) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(re) + Double.hashCode(im);
    }

    @Override
    public String toString() {
        return format(6);
    }
}
