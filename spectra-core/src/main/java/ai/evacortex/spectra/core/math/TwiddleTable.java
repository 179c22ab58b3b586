/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.math;

import ai.evacortex.spectra.core.exceptions.InvalidLengthException;

/**
 * Precomputed {@code cos(2π·m/N)} and {@code sin(2π·m/N)} for {@code m ∈ [0, N)}.
 *
 * <p>Since the kernel is periodic in {@code k·n} with period {@code N}, any term can be
 * read from the table at index {@code (k·n) mod N}. The product is taken in {@code long}
 * so it cannot overflow for any {@code int} length.</p>
 */
public final class TwiddleTable {

    private final int length;
    private final double[] cos;
    private final double[] sin;

    private TwiddleTable(int length, double[] cos, double[] sin) {
        this.length = length;
        this.cos = cos;
        this.sin = sin;
    }

    public static TwiddleTable of(int length) {
        if (length <= 0) {
            throw new InvalidLengthException(length);
        }
        double[] cos = new double[length];
        double[] sin = new double[length];
        for (int m = 0; m < length; m++) {
            double theta = Twiddle.angle(m, 1, length);
            cos[m] = Math.cos(theta);
            sin[m] = Math.sin(theta);
        }
        return new TwiddleTable(length, cos, sin);
    }

    public int length() {
        return length;
    }

    public int index(int k, int n) {
        return (int) (((long) k * (long) n) % length);
    }

    public double cosAt(int index) {
        return cos[index];
    }

    public double sinAt(int index) {
        return sin[index];
    }
}
