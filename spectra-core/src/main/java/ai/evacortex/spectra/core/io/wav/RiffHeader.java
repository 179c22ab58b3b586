/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.io.wav;

import ai.evacortex.spectra.core.exceptions.MalformedHeaderException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Leading RIFF chunk descriptor: {@code "RIFF"}, chunk size, format four-cc (normally {@code "WAVE"}).
 */
public record RiffHeader(String riff, long fileSize, String format) {
    public static final int SIZE = 4 + 4 + 4; // magic + size + four-cc
    public static final String MAGIC = "RIFF";

    /**
     * Serializes header to byte array in little-endian format.
     */
    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(riff.getBytes(StandardCharsets.US_ASCII));
        buf.putInt((int) fileSize);
        buf.put(format.getBytes(StandardCharsets.US_ASCII));
        return buf.array();
    }

    /**
     * Deserializes header from buffer in little-endian format.
     */
    public static RiffHeader from(ByteBuffer buf) {
        WavFields.requireRemaining(buf, SIZE, "RIFF header");
        buf.order(ByteOrder.LITTLE_ENDIAN);
        String riff = WavFields.readFourCc(buf);
        if (!MAGIC.equals(riff)) {
            throw new MalformedHeaderException("first four bytes are not RIFF");
        }
        long fileSize = Integer.toUnsignedLong(buf.getInt());
        String format = WavFields.readFourCc(buf);
        return new RiffHeader(riff, fileSize, format);
    }
}
