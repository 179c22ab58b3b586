/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.spectrum;

import ai.evacortex.spectra.core.SpectraSettings;
import ai.evacortex.spectra.core.cache.SpectrumCache;
import ai.evacortex.spectra.core.engine.DftKernel;
import ai.evacortex.spectra.core.engine.FourierEngine;
import ai.evacortex.spectra.core.exceptions.InvalidLengthException;
import ai.evacortex.spectra.core.io.wav.WavFile;
import ai.evacortex.spectra.core.math.Complex;
import ai.evacortex.spectra.core.util.HashingUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/**
 * Transforms the head of a WAV signal.
 *
 * <p>By default the window is {@code sampleRate / 10} samples long, which makes each bin
 * exactly 10 Hz wide: a 100 Hz tone at 44100 Hz shows up at bin 10 of a 4410-point
 * spectrum.</p>
 */
public class SpectrumAnalyzer {

    private static final Logger LOG = LogManager.getLogger(SpectrumAnalyzer.class);

    private final SpectrumCache cache;
    private final int windowDivisor;

    public SpectrumAnalyzer(DftKernel kernel, SpectraSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.cache = new SpectrumCache(kernel, settings.maxSpectra());
        this.windowDivisor = settings.windowDivisor();
    }

    public SpectrumAnalyzer(SpectraSettings settings) {
        this(FourierEngine.getBackend(), settings);
    }

    public int defaultWindowLength(WavFile wav) {
        return wav.sampleRate() / windowDivisor;
    }

    public SpectrumAnalysis analyze(WavFile wav) {
        Objects.requireNonNull(wav, "wav must not be null");
        return analyze(wav, defaultWindowLength(wav));
    }

    /**
     * @param windowLength requested head length; clamped to the number of samples present
     * @throws InvalidLengthException if the window is empty after clamping
     */
    public SpectrumAnalysis analyze(WavFile wav, int windowLength) {
        Objects.requireNonNull(wav, "wav must not be null");
        if (windowLength <= 0) {
            throw new InvalidLengthException(windowLength);
        }
        short[] samples = wav.samples();
        int length = Math.min(windowLength, samples.length);
        if (length < windowLength) {
            LOG.warn("Requested window of {} samples but signal has only {}", windowLength, samples.length);
        }
        short[] window = Arrays.copyOf(samples, length);
        return analyzeWindow(window, wav.sampleRate());
    }

    public SpectrumAnalysis analyzeWindow(short[] window, int sampleRate) {
        Objects.requireNonNull(window, "window must not be null");
        if (window.length == 0) {
            throw new InvalidLengthException(0);
        }
        Complex[] spectrum = cache.forward(window);
        double binWidth = SpectrumUtils.binWidthHz(sampleRate, window.length);
        int peak = SpectrumUtils.peakBin(spectrum);
        double peakHz = peak * binWidth;
        LOG.info("Analyzed {} samples: bin width {} Hz, peak at bin {} ({} Hz)",
                window.length, binWidth, peak, peakHz);
        return new SpectrumAnalysis(HashingUtil.contentId(window), sampleRate, window, spectrum, binWidth, peak, peakHz);
    }

    public SpectrumCache getCache() {
        return cache;
    }
}
