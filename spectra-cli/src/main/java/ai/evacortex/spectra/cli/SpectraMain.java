/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.cli;

import picocli.CommandLine;

public final class SpectraMain {

    private SpectraMain() {}

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SpectraCommand()).execute(args);
        System.exit(exitCode);
    }
}
