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
import java.nio.charset.StandardCharsets;

final class WavFields {

    private WavFields() {}

    static void requireRemaining(ByteBuffer buf, int bytes, String what) {
        if (buf.remaining() < bytes) {
            throw new MalformedHeaderException(what + " truncated: need " + bytes + " bytes, found " + buf.remaining());
        }
    }

    static String readFourCc(ByteBuffer buf) {
        byte[] tag = new byte[4];
        buf.get(tag);
        for (byte b : tag) {
            if (b < 0x20 || b > 0x7e) {
                throw new MalformedHeaderException("non-ASCII chunk tag");
            }
        }
        return new String(tag, StandardCharsets.US_ASCII);
    }
}
