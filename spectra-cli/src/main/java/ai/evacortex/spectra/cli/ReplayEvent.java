/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.cli;

/**
 * Message passed from the tick and input producers to the replay loop.
 */
public record ReplayEvent(Kind kind, char key) {

    public enum Kind { INPUT, TICK }

    public static ReplayEvent tick() {
        return new ReplayEvent(Kind.TICK, '\0');
    }

    public static ReplayEvent input(char key) {
        return new ReplayEvent(Kind.INPUT, key);
    }
}
