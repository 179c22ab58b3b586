/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core;

import ai.evacortex.spectra.core.engine.KernelType;

/**
 * Runtime settings read from JVM system properties.
 *
 * <ul>
 *     <li>{@code spectra.kernel}: {@code direct} (default), {@code twiddle} or {@code parallel}</li>
 *     <li>{@code spectra.kernel.parallelism}: worker count of the parallel kernel, defaults to the CPU count</li>
 *     <li>{@code spectra.cache.maxSpectra}: spectra kept by the transform cache</li>
 *     <li>{@code spectra.cache.maxTwiddleTables}: twiddle tables kept, one per length</li>
 *     <li>{@code spectra.analysis.windowDivisor}: analysis window is {@code sampleRate / divisor} samples</li>
 * </ul>
 */
public record SpectraSettings(
        KernelType kernel,
        int parallelism,
        int maxSpectra,
        int maxTwiddleTables,
        int windowDivisor
) {
    public static final int DEFAULT_MAX_SPECTRA = 64;
    public static final int DEFAULT_MAX_TWIDDLE_TABLES = 16;
    public static final int DEFAULT_WINDOW_DIVISOR = 10;

    public SpectraSettings {
        if (kernel == null) throw new IllegalArgumentException("kernel must not be null");
        if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be positive");
        if (maxSpectra <= 0) throw new IllegalArgumentException("maxSpectra must be positive");
        if (maxTwiddleTables <= 0) throw new IllegalArgumentException("maxTwiddleTables must be positive");
        if (windowDivisor <= 0) throw new IllegalArgumentException("windowDivisor must be positive");
    }

    public static SpectraSettings defaults() {
        return new SpectraSettings(KernelType.DIRECT,
                Runtime.getRuntime().availableProcessors(),
                DEFAULT_MAX_SPECTRA,
                DEFAULT_MAX_TWIDDLE_TABLES,
                DEFAULT_WINDOW_DIVISOR);
    }

    /**
     * @throws IllegalArgumentException if a property holds an unknown kernel or a malformed number
     */
    public static SpectraSettings fromSystemProperties() {
        return new SpectraSettings(
                KernelType.parse(System.getProperty("spectra.kernel", "direct")),
                intProperty("spectra.kernel.parallelism", Runtime.getRuntime().availableProcessors()),
                intProperty("spectra.cache.maxSpectra", DEFAULT_MAX_SPECTRA),
                intProperty("spectra.cache.maxTwiddleTables", DEFAULT_MAX_TWIDDLE_TABLES),
                intProperty("spectra.analysis.windowDivisor", DEFAULT_WINDOW_DIVISOR));
    }

    private static int intProperty(String name, int defaultValue) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": '" + raw + "'", e);
        }
    }

    public SpectraSettings withKernel(KernelType type) {
        return new SpectraSettings(type, parallelism, maxSpectra, maxTwiddleTables, windowDivisor);
    }
}
