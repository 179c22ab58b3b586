/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

import ai.evacortex.spectra.core.exceptions.InvalidLengthException;
import ai.evacortex.spectra.core.math.Complex;

import java.util.Objects;

/**
 * Shared bin loop and argument validation. Subclasses supply the per-bin sums.
 */
public abstract class AbstractDftKernel implements DftKernel {

    @Override
    public Complex[] forward(double[] samples) {
        int length = requireLength(samples);
        Complex[] spectrum = new Complex[length];
        for (int k = 0; k < length; k++) {
            spectrum[k] = forwardBin(samples, k);
        }
        return spectrum;
    }

    @Override
    public Complex[] inverse(Complex[] spectrum) {
        int length = requireLength(spectrum);
        Complex[] signal = new Complex[length];
        for (int k = 0; k < length; k++) {
            signal[k] = inverseBin(spectrum, k);
        }
        return signal;
    }

    @Override
    public final Complex forwardBin(double[] samples, int k) {
        int length = requireLength(samples);
        Objects.checkIndex(k, length);
        return sumForward(samples, k, length).divide(length);
    }

    @Override
    public final Complex inverseBin(Complex[] spectrum, int k) {
        int length = requireLength(spectrum);
        Objects.checkIndex(k, length);
        return sumInverse(spectrum, k, length);
    }

    /** Unnormalized {@code Σ x[n]·(cos θ − i·sin θ)} for bin {@code k}. */
    protected abstract Complex sumForward(double[] samples, int k, int length);

    /** {@code Σ X[n]·(cos θ + i·sin θ)} for time index {@code k}. */
    protected abstract Complex sumInverse(Complex[] spectrum, int k, int length);

    static int requireLength(double[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (samples.length == 0) throw new InvalidLengthException(0);
        return samples.length;
    }

    static int requireLength(Complex[] spectrum) {
        Objects.requireNonNull(spectrum, "spectrum must not be null");
        if (spectrum.length == 0) throw new InvalidLengthException(0);
        return spectrum.length;
    }

    static double[] widen(short[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        double[] widened = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            widened[i] = samples[i];
        }
        return widened;
    }
}
