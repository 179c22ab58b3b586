/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

import ai.evacortex.spectra.core.cache.TwiddleTableCache;
import ai.evacortex.spectra.core.math.Complex;
import ai.evacortex.spectra.core.math.TwiddleTable;

import java.util.Objects;

/**
 * Kernel that reads {@code cos/sin} from a per-length {@link TwiddleTable} instead of
 * evaluating the trigonometry for every term. Same O(N²) summation, same convention.
 */
public final class TwiddleDftKernel extends AbstractDftKernel {

    private final TwiddleTableCache tables;

    public TwiddleDftKernel() {
        this(TwiddleTableCache.shared());
    }

    public TwiddleDftKernel(TwiddleTableCache tables) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
    }

    @Override
    protected Complex sumForward(double[] samples, int k, int length) {
        TwiddleTable table = tables.get(length);
        double real = 0.0;
        double imag = 0.0;
        for (int n = 0; n < length; n++) {
            int m = table.index(k, n);
            real += samples[n] * table.cosAt(m);
            imag -= samples[n] * table.sinAt(m);
        }
        return new Complex(real, imag);
    }

    @Override
    protected Complex sumInverse(Complex[] spectrum, int k, int length) {
        TwiddleTable table = tables.get(length);
        double real = 0.0;
        double imag = 0.0;
        for (int n = 0; n < length; n++) {
            Complex c = Objects.requireNonNull(spectrum[n], "spectrum element must not be null");
            int m = table.index(k, n);
            double cos = table.cosAt(m);
            double sin = table.sinAt(m);
            real += c.real * cos - c.imag * sin;
            imag += c.real * sin + c.imag * cos;
        }
        return new Complex(real, imag);
    }
}
