/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.util;

import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content digests of sample sequences: xxhash64 for cache keys, MD5 hex for stable ids.
 */
public final class HashingUtil {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final int SEED = 0x9747b28c;

    private static final ThreadLocal<MessageDigest> MD5_DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not available", e);
        }
    });

    private HashingUtil() {}

    public static long xxHash64(short[] samples) {
        byte[] bytes = toLittleEndian(samples);
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    public static long xxHash64(double[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        ByteBuffer buffer = ByteBuffer.allocate(samples.length * 8).order(ByteOrder.LITTLE_ENDIAN);
        for (double v : samples) buffer.putDouble(v);
        byte[] bytes = buffer.array();
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    /** 32-char MD5 hex of the little-endian sample bytes. */
    public static String contentId(short[] samples) {
        MessageDigest digest = MD5_DIGEST.get();
        digest.reset();
        return HexFormat.of().formatHex(digest.digest(toLittleEndian(samples)));
    }

    private static byte[] toLittleEndian(short[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        ByteBuffer buffer = ByteBuffer.allocate(samples.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (short s : samples) buffer.putShort(s);
        return buffer.array();
    }
}
