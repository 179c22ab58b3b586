/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.cache;

import ai.evacortex.spectra.core.engine.DftKernel;
import ai.evacortex.spectra.core.math.Complex;
import ai.evacortex.spectra.core.util.HashingUtil;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/**
 * Memoizes forward spectra of 16-bit sample windows.
 *
 * <p>Keys carry the xxhash64 digest of the samples as their hash and a private copy of
 * the samples for equality, so a digest collision can never return a foreign spectrum.
 * Callers always receive a fresh array.</p>
 */
public class SpectrumCache {

    private static final Logger LOG = LogManager.getLogger(SpectrumCache.class);

    private final DftKernel kernel;
    private final Cache<SampleKey, Complex[]> cache;

    private static final class SampleKey {
        private final long digest;
        private final short[] samples;

        SampleKey(short[] samples) {
            this.samples = samples.clone();
            this.digest = HashingUtil.xxHash64(this.samples);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SampleKey)) return false;
            SampleKey other = (SampleKey) o;
            return digest == other.digest && Arrays.equals(samples, other.samples);
        }

        @Override
        public int hashCode() {
            return Long.hashCode(digest);
        }
    }

    public SpectrumCache(DftKernel kernel, int maxEntries) {
        this.kernel = Objects.requireNonNull(kernel, "kernel must not be null");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .recordStats()
                .build();
    }

    public Complex[] forward(short[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        SampleKey key = new SampleKey(samples);
        Complex[] spectrum = cache.get(key, k -> {
            LOG.debug("Computing spectrum for {} samples", k.samples.length);
            return kernel.forward(k.samples);
        });
        return spectrum.clone();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long size() {
        return cache.estimatedSize();
    }
}
