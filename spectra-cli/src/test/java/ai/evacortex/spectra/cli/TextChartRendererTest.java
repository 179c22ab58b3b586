/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.cli;

import ai.evacortex.spectra.core.spectrum.ChartBar;
import ai.evacortex.spectra.core.spectrum.ChartPoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextChartRendererTest {

    private final TextChartRenderer renderer = new TextChartRenderer(10, 3);

    @Test
    void plotsCornersOfTheGrid() {
        String chart = renderer.renderLine("t",
                List.of(new ChartPoint(0, 1), new ChartPoint(9, -1), new ChartPoint(50, 0)),
                0, 9, -1, 1);
        String[] lines = chart.split("\n");
        assertEquals("t", lines[0]);
        assertEquals("|•         ", lines[2]);
        assertEquals("|          ", lines[3]);
        assertEquals("|         •", lines[4]);
        assertEquals("+----------", lines[5]);
    }

    @Test
    void barsScaleToLargestValue() {
        String chart = renderer.renderBars("m", List.of(new ChartBar("0", 10), new ChartBar("12", 5)));
        String[] lines = chart.split("\n");
        assertEquals(" 0 |██████████ 10", lines[1]);
        assertEquals("12 |█████ 5", lines[2]);
    }

    @Test
    void allZeroBarsDrawNothing() {
        String chart = renderer.renderBars("m", List.of(new ChartBar("0", 0)));
        assertEquals("0 | 0", chart.split("\n")[1]);
    }

    @Test
    void rejectsTinyCharts() {
        assertThrows(IllegalArgumentException.class, () -> new TextChartRenderer(4, 3));
    }
}
