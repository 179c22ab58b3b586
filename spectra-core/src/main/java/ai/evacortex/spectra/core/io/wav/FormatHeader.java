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
 * PCM {@code "fmt "} chunk. Unsigned fields are widened so they round-trip unchanged.
 */
public record FormatHeader(String fmt,
                           long headerSize,
                           int audioFormat,
                           int channels,
                           long sampleRate,
                           long byteRate,
                           int blockAlign,
                           int bitsPerSample) {

    public static final int SIZE = 4 + 4 + 2 + 2 + 4 + 4 + 2 + 2;
    public static final String MAGIC = "fmt ";
    public static final int PCM_CHUNK_SIZE = 16;
    public static final int PCM_FORMAT = 1;
    public static final int SUPPORTED_BITS_PER_SAMPLE = 16;

    public static FormatHeader pcm16(int channels, int sampleRate) {
        int blockAlign = channels * SUPPORTED_BITS_PER_SAMPLE / 8;
        return new FormatHeader(MAGIC, PCM_CHUNK_SIZE, PCM_FORMAT, channels, sampleRate,
                (long) sampleRate * blockAlign, blockAlign, SUPPORTED_BITS_PER_SAMPLE);
    }

    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(fmt.getBytes(StandardCharsets.US_ASCII));
        buf.putInt((int) headerSize);
        buf.putShort((short) audioFormat);
        buf.putShort((short) channels);
        buf.putInt((int) sampleRate);
        buf.putInt((int) byteRate);
        buf.putShort((short) blockAlign);
        buf.putShort((short) bitsPerSample);
        return buf.array();
    }

    public static FormatHeader from(ByteBuffer buf) {
        WavFields.requireRemaining(buf, SIZE, "fmt header");
        buf.order(ByteOrder.LITTLE_ENDIAN);
        String fmt = WavFields.readFourCc(buf);
        if (!MAGIC.equals(fmt)) {
            throw new MalformedHeaderException("header does not start with fmt");
        }
        long headerSize = Integer.toUnsignedLong(buf.getInt());
        int audioFormat = Short.toUnsignedInt(buf.getShort());
        int channels = Short.toUnsignedInt(buf.getShort());
        long sampleRate = Integer.toUnsignedLong(buf.getInt());
        long byteRate = Integer.toUnsignedLong(buf.getInt());
        int blockAlign = Short.toUnsignedInt(buf.getShort());
        int bitsPerSample = Short.toUnsignedInt(buf.getShort());

        if (headerSize != PCM_CHUNK_SIZE) {
            throw new MalformedHeaderException("unsupported fmt chunk size " + headerSize);
        }
        if (bitsPerSample != SUPPORTED_BITS_PER_SAMPLE) {
            throw new MalformedHeaderException("unsupported bit depth " + bitsPerSample + ", expected 16");
        }
        if (sampleRate > Integer.MAX_VALUE) {
            throw new MalformedHeaderException("sample rate " + sampleRate + " out of range");
        }
        if (channels == 0 || sampleRate == 0) {
            throw new MalformedHeaderException("channels and sample rate must be non-zero");
        }
        return new FormatHeader(fmt, headerSize, audioFormat, channels, sampleRate, byteRate, blockAlign, bitsPerSample);
    }
}
