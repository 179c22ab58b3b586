/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.report;

import ai.evacortex.spectra.core.math.Complex;
import ai.evacortex.spectra.core.spectrum.SpectrumAnalysis;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializable view of a {@link SpectrumAnalysis} for external chart renderers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpectrumReport(String source,
                             String contentId,
                             int sampleRate,
                             int windowLength,
                             double binWidthHz,
                             int peakBin,
                             double peakFrequencyHz,
                             List<BinEntry> bins) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BinEntry(int bin, double frequencyHz, double real, double imag, double magnitude) {}

    public SpectrumReport {
        bins = bins == null ? List.of() : List.copyOf(bins);
    }

    public static SpectrumReport of(String source, SpectrumAnalysis analysis) {
        Complex[] spectrum = analysis.spectrum();
        List<BinEntry> bins = new ArrayList<>(spectrum.length);
        for (int k = 0; k < spectrum.length; k++) {
            Complex c = spectrum[k];
            bins.add(new BinEntry(k, analysis.frequencyOf(k), c.real, c.imag, c.abs()));
        }
        return new SpectrumReport(source, analysis.sourceId(), analysis.sampleRate(), analysis.windowLength(),
                analysis.binWidthHz(), analysis.peakBin(), analysis.peakFrequencyHz(), bins);
    }

    public Complex[] toSpectrum() {
        Complex[] spectrum = new Complex[bins.size()];
        for (int i = 0; i < spectrum.length; i++) {
            BinEntry entry = bins.get(i);
            spectrum[i] = new Complex(entry.real(), entry.imag());
        }
        return spectrum;
    }
}
