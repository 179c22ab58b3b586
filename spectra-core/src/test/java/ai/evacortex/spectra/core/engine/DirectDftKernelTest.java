/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

class DirectDftKernelTest extends DftKernelContractTest {

    private final DftKernel kernel = new DirectDftKernel();

    @Override
    protected DftKernel kernel() {
        return kernel;
    }
}
