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
import ai.evacortex.spectra.core.math.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Static entry point to the transform engine. The backend defaults to the kernel named
 * by {@code spectra.kernel} and may be swapped at runtime.
 */
public final class FourierEngine {

    private static final Logger LOG = LogManager.getLogger(FourierEngine.class);

    private static volatile DftKernel backend;

    private FourierEngine() {}

    public static void setBackend(DftKernel kernel) {
        backend = Objects.requireNonNull(kernel, "kernel must not be null");
        LOG.debug("DFT backend set to {}", kernel.getClass().getSimpleName());
    }

    /**
     * Returns the current backend, creating the configured default on first use.
     *
     * @throws IllegalArgumentException if the {@code spectra.*} properties are invalid
     */
    public static DftKernel getBackend() {
        DftKernel current = backend;
        if (current == null) {
            synchronized (FourierEngine.class) {
                current = backend;
                if (current == null) {
                    current = createDefault();
                    backend = current;
                }
            }
        }
        return current;
    }

    public static Complex[] forward(short[] samples) {
        return getBackend().forward(samples);
    }

    public static Complex[] forward(double[] samples) {
        return getBackend().forward(samples);
    }

    public static Complex[] inverse(Complex[] spectrum) {
        return getBackend().inverse(spectrum);
    }

    private static DftKernel createDefault() {
        SpectraSettings settings = SpectraSettings.fromSystemProperties();
        DftKernel kernel = settings.kernel().create(settings);
        LOG.debug("DFT backend {} selected from system properties", settings.kernel());
        return kernel;
    }
}
