/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

import ai.evacortex.spectra.core.SignalTestUtils;
import ai.evacortex.spectra.core.math.Complex;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ParallelDftKernelTest extends DftKernelContractTest {

    private final ParallelDftKernel kernel = new ParallelDftKernel(new DirectDftKernel(), 4);

    @Override
    protected DftKernel kernel() {
        return kernel;
    }

    @AfterAll
    void shutdown() {
        kernel.close();
    }

    @Test
    void bitIdenticalToSequentialDelegate() {
        short[] x = SignalTestUtils.randomPcm(513, 23);
        Complex[] sequential = new DirectDftKernel().forward(x);
        Complex[] parallel = kernel.forward(x);
        assertArrayEquals(sequential, parallel);
        assertArrayEquals(new DirectDftKernel().inverse(sequential), kernel.inverse(sequential));
    }

    @Test
    void rejectsNonPositiveParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelDftKernel(new DirectDftKernel(), 0));
    }

    @Test
    void reportsParallelism() {
        assertEquals(4, kernel.getParallelism());
    }
}
