/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

import ai.evacortex.spectra.core.math.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

/**
 * Spreads the independent bins of a delegate kernel over a fork/join pool.
 *
 * <p>Every bin is still produced by {@link DftKernel#forwardBin} or
 * {@link DftKernel#inverseBin} of the delegate with its own left-to-right accumulation,
 * so the output is bit-identical to the sequential delegate.</p>
 */
public final class ParallelDftKernel implements DftKernel, Closeable {

    private static final Logger LOG = LogManager.getLogger(ParallelDftKernel.class);

    private final DftKernel delegate;
    private final ForkJoinPool pool;

    public ParallelDftKernel(DftKernel delegate, int parallelism) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        this.pool = new ForkJoinPool(parallelism);
        LOG.debug("Parallel DFT kernel over {} with parallelism {}",
                delegate.getClass().getSimpleName(), parallelism);
    }

    public ParallelDftKernel(DftKernel delegate) {
        this(delegate, Runtime.getRuntime().availableProcessors());
    }

    @Override
    public Complex[] forward(double[] samples) {
        int length = AbstractDftKernel.requireLength(samples);
        Complex[] spectrum = new Complex[length];
        pool.submit(() -> IntStream.range(0, length)
                .parallel()
                .forEach(k -> spectrum[k] = delegate.forwardBin(samples, k)))
                .join();
        return spectrum;
    }

    @Override
    public Complex[] inverse(Complex[] spectrum) {
        int length = AbstractDftKernel.requireLength(spectrum);
        Complex[] signal = new Complex[length];
        pool.submit(() -> IntStream.range(0, length)
                .parallel()
                .forEach(k -> signal[k] = delegate.inverseBin(spectrum, k)))
                .join();
        return signal;
    }

    @Override
    public Complex forwardBin(double[] samples, int k) {
        return delegate.forwardBin(samples, k);
    }

    @Override
    public Complex inverseBin(Complex[] spectrum, int k) {
        return delegate.inverseBin(spectrum, k);
    }

    public int getParallelism() {
        return pool.getParallelism();
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) pool.shutdownNow();
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
