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

public record DataHeader(String data, long size) {
    public static final int SIZE = 4 + 4;
    public static final String MAGIC = "data";

    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(data.getBytes(StandardCharsets.US_ASCII));
        buf.putInt((int) size);
        return buf.array();
    }

    public static DataHeader from(ByteBuffer buf) {
        WavFields.requireRemaining(buf, SIZE, "data header");
        buf.order(ByteOrder.LITTLE_ENDIAN);
        String data = WavFields.readFourCc(buf);
        if (!MAGIC.equals(data)) {
            throw new MalformedHeaderException("header does not start with data");
        }
        return new DataHeader(data, Integer.toUnsignedLong(buf.getInt()));
    }
}
