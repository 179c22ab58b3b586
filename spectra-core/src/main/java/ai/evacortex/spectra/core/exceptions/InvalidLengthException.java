/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.exceptions;

/**
 * Raised when a transform or table is requested for a non-positive length.
 * The transform is defined only for {@code N ≥ 1}.
 */
public class InvalidLengthException extends RuntimeException {

    public InvalidLengthException(int length) {
        super("Invalid length: " + length + " (transform requires at least one sample)");
    }
}
