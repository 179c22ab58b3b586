/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.cli;

import ai.evacortex.spectra.core.spectrum.ChartPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sliding view over a signal for the replay chart.
 *
 * <p>The view starts with the first {@code capacity} points. Each {@link #advance()}
 * drops {@code step} points from the front, appends the next {@code step} points of the
 * signal and shifts the x-axis bounds by {@code step}.</p>
 */
public class SignalWindow {

    private final short[] signal;
    private final int capacity;
    private final int step;
    private final double boundsWidth;
    private final short min;
    private final short max;
    private int start;

    public SignalWindow(short[] signal, int capacity, int step, double boundsWidth) {
        Objects.requireNonNull(signal, "signal must not be null");
        if (signal.length == 0) throw new IllegalArgumentException("signal must not be empty");
        if (capacity <= 0 || step <= 0) throw new IllegalArgumentException("capacity and step must be positive");
        this.signal = signal.clone();
        this.capacity = Math.min(capacity, signal.length);
        this.step = step;
        this.boundsWidth = boundsWidth;
        short lo = Short.MAX_VALUE;
        short hi = Short.MIN_VALUE;
        for (short s : signal) {
            if (s < lo) lo = s;
            if (s > hi) hi = s;
        }
        this.min = lo;
        this.max = hi;
    }

    /**
     * @return {@code false} once the signal has no more samples to slide in
     */
    public boolean advance() {
        if (start + capacity + step > signal.length) {
            return false;
        }
        start += step;
        return true;
    }

    public List<ChartPoint> points() {
        List<ChartPoint> points = new ArrayList<>(capacity);
        for (int i = start; i < start + capacity; i++) {
            points.add(new ChartPoint(i, signal[i]));
        }
        return points;
    }

    /** X-axis bounds {@code [lo, hi]}. */
    public double[] bounds() {
        return new double[]{start, start + boundsWidth};
    }

    public int start() {
        return start;
    }

    public short min() {
        return min;
    }

    public short max() {
        return max;
    }
}
