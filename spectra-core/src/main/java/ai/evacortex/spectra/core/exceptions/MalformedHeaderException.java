/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.exceptions;

public class MalformedHeaderException extends RuntimeException {
    public MalformedHeaderException(String message) {
        super("Malformed WAV header: " + message);
    }

    public MalformedHeaderException(String message, Throwable cause) {
        super("Malformed WAV header: " + message, cause);
    }
}
