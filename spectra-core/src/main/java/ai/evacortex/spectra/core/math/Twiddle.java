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
 * Per-term arithmetic of the discrete Fourier kernel.
 *
 * <p>For bin {@code k}, step {@code n} and length {@code N} the kernel angle is</p>
 * <pre>
 *     θ = 2π · k · n / N
 * </pre>
 * <p>The forward kernel multiplies by {@code cos θ − i·sin θ}, the inverse kernel by
 * {@code cos θ + i·sin θ}. Only the sign of the sine term differs.</p>
 */
public final class Twiddle {

    private static final double TWO_PI = 2.0 * Math.PI;

    private Twiddle() {}

    public static double angle(int k, int n, int length) {
        return TWO_PI * (double) k * (double) n / (double) length;
    }

    public static Complex forwardFactor(int k, int n, int length) {
        double theta = angle(k, n, length);
        return new Complex(Math.cos(theta), -Math.sin(theta));
    }

    public static Complex inverseFactor(int k, int n, int length) {
        return Complex.unit(angle(k, n, length));
    }

    /** Real sample times the forward factor, skipping the zero imaginary half of the product. */
    public static Complex forwardTerm(double sample, int k, int n, int length) {
        double theta = angle(k, n, length);
        return new Complex(sample * Math.cos(theta), -sample * Math.sin(theta));
    }

    public static Complex inverseTerm(Complex coefficient, int k, int n, int length) {
        return coefficient.multiply(inverseFactor(k, n, length));
    }
}
