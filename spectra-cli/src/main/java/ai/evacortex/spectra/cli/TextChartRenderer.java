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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text charts: a dot plot for time-domain points and horizontal bars for magnitudes.
 */
public class TextChartRenderer {

    private static final char DOT = '•';
    private static final char BAR = '█';

    private final int width;
    private final int height;

    public TextChartRenderer(int width, int height) {
        if (width < 8 || height < 2) {
            throw new IllegalArgumentException("chart needs at least 8x2 cells");
        }
        this.width = width;
        this.height = height;
    }

    /**
     * Plots {@code points} inside the given axis bounds. Points outside the bounds are skipped.
     */
    public String renderLine(String title, List<ChartPoint> points, double xMin, double xMax, double yMin, double yMax) {
        char[][] grid = new char[height][width];
        for (char[] row : grid) Arrays.fill(row, ' ');

        double xSpan = xMax - xMin == 0 ? 1.0 : xMax - xMin;
        double ySpan = yMax - yMin == 0 ? 1.0 : yMax - yMin;
        for (ChartPoint p : points) {
            if (p.x() < xMin || p.x() > xMax || p.y() < yMin || p.y() > yMax) continue;
            int col = (int) Math.round((p.x() - xMin) / xSpan * (width - 1));
            int row = (height - 1) - (int) Math.round((p.y() - yMin) / ySpan * (height - 1));
            grid[row][col] = DOT;
        }

        StringBuilder sb = new StringBuilder();
        sb.append(title).append('\n');
        sb.append(String.format(Locale.ROOT, "%s .. %s%n", format(yMax), format(yMin)));
        for (char[] row : grid) {
            sb.append('|').append(row).append('\n');
        }
        sb.append('+').append("-".repeat(width)).append('\n');
        sb.append(String.format(Locale.ROOT, " %s .. %s%n", format(xMin), format(xMax)));
        return sb.toString();
    }

    /**
     * One row per bar, scaled so the largest value spans the chart width.
     */
    public String renderBars(String title, List<ChartBar> bars) {
        long peak = 0;
        int labelWidth = 1;
        for (ChartBar bar : bars) {
            peak = Math.max(peak, bar.value());
            labelWidth = Math.max(labelWidth, bar.label().length());
        }
        StringBuilder sb = new StringBuilder();
        sb.append(title).append('\n');
        for (ChartBar bar : bars) {
            int len = peak == 0 ? 0 : (int) Math.round((double) bar.value() / peak * width);
            sb.append(String.format(Locale.ROOT, "%" + labelWidth + "s |", bar.label()))
                    .append(String.valueOf(BAR).repeat(len))
                    .append(' ')
                    .append(bar.value())
                    .append('\n');
        }
        return sb.toString();
    }

    private static String format(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
