/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.cache;

import ai.evacortex.spectra.core.SpectraSettings;
import ai.evacortex.spectra.core.exceptions.InvalidLengthException;
import ai.evacortex.spectra.core.math.TwiddleTable;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

/**
 * Bounded cache of {@link TwiddleTable}s keyed by transform length.
 */
public class TwiddleTableCache {

    private static final class Holder {
        static final TwiddleTableCache SHARED =
                new TwiddleTableCache(SpectraSettings.fromSystemProperties().maxTwiddleTables());
    }

    private final LoadingCache<Integer, TwiddleTable> cache;

    public TwiddleTableCache(int maxEntries) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .build(TwiddleTable::of);
    }

    public static TwiddleTableCache shared() {
        return Holder.SHARED;
    }

    public TwiddleTable get(int length) {
        if (length <= 0) throw new InvalidLengthException(length);
        return cache.get(length);
    }

    public boolean isCached(int length) {
        return cache.asMap().containsKey(length);
    }
}
