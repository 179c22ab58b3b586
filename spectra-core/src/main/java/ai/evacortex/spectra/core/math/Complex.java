/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.math;

/**
 * Immutable complex number used for spectral coefficients and reconstructed samples.
 * Closed value type: two doubles, no subclassing.
 */
public final class Complex {

    public static final Complex ZERO = new Complex(0.0, 0.0);

    public final double real;
    public final double imag;

    public Complex(double real, double imag) {
        this.real = real;
        this.imag = imag;
    }

    /** Lifts a real sample onto the real axis. */
    public static Complex ofReal(double real) {
        return new Complex(real, 0.0);
    }

    /** {@code cos θ + i·sin θ} */
    public static Complex unit(double theta) {
        return new Complex(Math.cos(theta), Math.sin(theta));
    }

    public Complex add(Complex other) {
        return new Complex(this.real + other.real, this.imag + other.imag);
    }

    public Complex multiply(Complex other) {
        double r = this.real * other.real - this.imag * other.imag;
        double i = this.real * other.imag + this.imag * other.real;
        return new Complex(r, i);
    }

    public Complex scale(double factor) {
        return new Complex(this.real * factor, this.imag * factor);
    }

    public Complex divide(double divisor) {
        return new Complex(this.real / divisor, this.imag / divisor);
    }

    public Complex conjugate() {
        return new Complex(this.real, -this.imag);
    }

    /** Magnitude {@code sqrt(re² + im²)}. */
    public double abs() {
        return Math.hypot(this.real, this.imag);
    }

    public double absSquared() {
        return this.real * this.real + this.imag * this.imag;
    }

    public double phase() {
        return Math.atan2(imag, real);
    }

    public boolean isFinite() {
        return Double.isFinite(real) && Double.isFinite(imag);
    }

    /**
     * Distance check used by round-trip comparisons; exact equality is never expected
     * from summed trigonometric terms.
     */
    public boolean approximatelyEquals(Complex other, double epsilon) {
        return Math.abs(real - other.real) <= epsilon && Math.abs(imag - other.imag) <= epsilon;
    }

    @Override
    public String toString() {
        return String.format("(%f %s %fi)", real, (imag < 0 ? "-" : "+"), Math.abs(imag));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Complex)) return false;
        Complex other = (Complex) obj;
        return Double.compare(real, other.real) == 0 && Double.compare(imag, other.imag) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(real) * 31 + Double.hashCode(imag);
    }
}
