/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

import ai.evacortex.spectra.core.math.Complex;
import ai.evacortex.spectra.core.math.Twiddle;

import java.util.Objects;

/**
 * Reference kernel: evaluates {@code cos θ} and {@code sin θ} for every term.
 */
public final class DirectDftKernel extends AbstractDftKernel {

    @Override
    protected Complex sumForward(double[] samples, int k, int length) {
        double real = 0.0;
        double imag = 0.0;
        for (int n = 0; n < length; n++) {
            double theta = Twiddle.angle(k, n, length);
            real += samples[n] * Math.cos(theta);
            imag -= samples[n] * Math.sin(theta);
        }
        return new Complex(real, imag);
    }

    @Override
    protected Complex sumInverse(Complex[] spectrum, int k, int length) {
        Complex acc = Complex.ZERO;
        for (int n = 0; n < length; n++) {
            Complex coefficient = Objects.requireNonNull(spectrum[n], "spectrum element must not be null");
            acc = acc.add(Twiddle.inverseTerm(coefficient, k, n, length));
        }
        return acc;
    }
}
