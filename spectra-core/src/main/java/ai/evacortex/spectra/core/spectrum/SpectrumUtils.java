/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.spectrum;

import ai.evacortex.spectra.core.exceptions.InvalidLengthException;
import ai.evacortex.spectra.core.math.Complex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Conversions between coefficient arrays and the series consumed by chart renderers,
 * plus the element-wise arithmetic used to check linearity.
 */
public final class SpectrumUtils {

    private SpectrumUtils() {}

    public static double[] magnitudes(Complex[] spectrum) {
        Objects.requireNonNull(spectrum, "spectrum must not be null");
        double[] out = new double[spectrum.length];
        for (int i = 0; i < spectrum.length; i++) {
            out[i] = spectrum[i].abs();
        }
        return out;
    }

    /**
     * Bars labelled by bin index; magnitudes are truncated toward zero.
     */
    public static List<ChartBar> toBars(Complex[] spectrum) {
        return toBars(spectrum, spectrum.length);
    }

    public static List<ChartBar> toBars(Complex[] spectrum, int limit) {
        Objects.requireNonNull(spectrum, "spectrum must not be null");
        int count = Math.min(Math.max(limit, 0), spectrum.length);
        List<ChartBar> bars = new ArrayList<>(count);
        for (int k = 0; k < count; k++) {
            bars.add(new ChartBar(Integer.toString(k), (long) spectrum[k].abs()));
        }
        return bars;
    }

    /** {@code (n, x[n])} points for a time-domain chart. */
    public static List<ChartPoint> toPoints(short[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        List<ChartPoint> points = new ArrayList<>(samples.length);
        for (int n = 0; n < samples.length; n++) {
            points.add(new ChartPoint(n, samples[n]));
        }
        return points;
    }

    public static Complex[] add(Complex[] a, Complex[] b) {
        requireSameLength(a, b);
        Complex[] out = new Complex[a.length];
        for (int i = 0; i < a.length; i++) out[i] = a[i].add(b[i]);
        return out;
    }

    public static Complex[] scale(Complex[] values, double factor) {
        Objects.requireNonNull(values, "values must not be null");
        Complex[] out = new Complex[values.length];
        for (int i = 0; i < values.length; i++) out[i] = values[i].scale(factor);
        return out;
    }

    /**
     * Rounds real parts back to 16-bit samples, saturating at the {@code short} range.
     */
    public static short[] toPcm16(Complex[] signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        short[] out = new short[signal.length];
        for (int i = 0; i < signal.length; i++) {
            long v = Math.round(signal[i].real);
            out[i] = (short) Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, v));
        }
        return out;
    }

    /**
     * Index of the largest magnitude in {@code [1, N/2]}. The DC bin is skipped and the
     * mirrored upper half of a real signal's spectrum is ignored. For {@code N = 1} the
     * only bin, 0, is returned.
     */
    public static int peakBin(Complex[] spectrum) {
        Objects.requireNonNull(spectrum, "spectrum must not be null");
        if (spectrum.length == 0) throw new InvalidLengthException(0);
        if (spectrum.length == 1) return 0;
        int best = 1;
        double bestMagnitude = -1.0;
        int upper = spectrum.length / 2;
        for (int k = 1; k <= upper; k++) {
            double m = spectrum[k].abs();
            if (m > bestMagnitude) {
                bestMagnitude = m;
                best = k;
            }
        }
        return best;
    }

    /** Frequency resolution of an {@code N}-point transform. */
    public static double binWidthHz(int sampleRate, int length) {
        if (length <= 0) throw new InvalidLengthException(length);
        return (double) sampleRate / length;
    }

    private static void requireSameLength(Complex[] a, Complex[] b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        if (a.length != b.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + a.length + " vs " + b.length);
        }
    }
}
