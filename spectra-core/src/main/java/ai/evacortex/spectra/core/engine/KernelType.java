/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

import ai.evacortex.spectra.core.SpectraSettings;

import java.util.Locale;

/**
 * Kernel backends selectable through {@code -Dspectra.kernel=direct|twiddle|parallel}.
 */
public enum KernelType {
    DIRECT,
    TWIDDLE,
    PARALLEL;

    public DftKernel create(SpectraSettings settings) {
        return switch (this) {
            case DIRECT -> new DirectDftKernel();
            case TWIDDLE -> new TwiddleDftKernel();
            case PARALLEL -> new ParallelDftKernel(new DirectDftKernel(), settings.parallelism());
        };
    }

    public static KernelType parse(String name) {
        if (name == null || name.isBlank()) return DIRECT;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown kernel '" + name + "', expected one of direct, twiddle, parallel", e);
        }
    }
}
