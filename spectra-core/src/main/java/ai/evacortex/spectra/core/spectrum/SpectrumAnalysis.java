/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.spectrum;

import ai.evacortex.spectra.core.math.Complex;

/**
 * Result of transforming the head window of a signal.
 *
 * @param sourceId        MD5 content id of the analyzed window
 * @param sampleRate      sampling rate of the source in Hz
 * @param window          the analyzed time-domain samples
 * @param spectrum        forward transform of {@code window}
 * @param binWidthHz      frequency step between adjacent bins
 * @param peakBin         strongest non-DC bin in the lower half of the spectrum
 * @param peakFrequencyHz {@code peakBin · binWidthHz}
 */
public record SpectrumAnalysis(String sourceId,
                               int sampleRate,
                               short[] window,
                               Complex[] spectrum,
                               double binWidthHz,
                               int peakBin,
                               double peakFrequencyHz) {

    public SpectrumAnalysis {
        window = window.clone();
        spectrum = spectrum.clone();
    }

    @Override
    public short[] window() {
        return window.clone();
    }

    @Override
    public Complex[] spectrum() {
        return spectrum.clone();
    }

    public int windowLength() {
        return window.length;
    }

    public double frequencyOf(int bin) {
        return bin * binWidthHz;
    }
}
