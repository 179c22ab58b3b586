/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.math;

import ai.evacortex.spectra.core.exceptions.InvalidLengthException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexTest {

    @Test
    void multiplicationFollowsStandardRule() {
        Complex a = new Complex(1.5, -2.0);
        Complex b = new Complex(-0.5, 3.0);
        Complex p = a.multiply(b);
        assertEquals(1.5 * -0.5 - (-2.0 * 3.0), p.real, 1e-15);
        assertEquals(1.5 * 3.0 + (-2.0 * -0.5), p.imag, 1e-15);
    }

    @Test
    void magnitudeAndPhase() {
        Complex c = new Complex(3.0, -4.0);
        assertEquals(5.0, c.abs(), 1e-15);
        assertEquals(25.0, c.absSquared(), 1e-15);
        assertEquals(Math.atan2(-4.0, 3.0), c.phase(), 1e-15);
        assertEquals(new Complex(3.0, 4.0), c.conjugate());
        assertEquals(new Complex(1.5, -2.0), c.divide(2.0));
    }

    @Test
    void twiddleFactorsDifferOnlyInSineSign() {
        Complex f = Twiddle.forwardFactor(1, 1, 8);
        Complex i = Twiddle.inverseFactor(1, 1, 8);
        assertEquals(f.real, i.real, 0.0);
        assertEquals(-f.imag, i.imag, 0.0);
        assertEquals(Math.PI / 4, Twiddle.angle(1, 1, 8), 1e-15);
        assertEquals(new Complex(2.0 * f.real, 2.0 * f.imag), Twiddle.forwardTerm(2.0, 1, 1, 8));
    }

    @Test
    void angleDoesNotOverflowForLargeProducts() {
        double theta = Twiddle.angle(100_000, 100_000, 100_001);
        assertTrue(theta > 0.0, "k·n must be evaluated in floating point");
    }

    @Test
    void twiddleTableMatchesDirectTrigonometry() {
        TwiddleTable table = TwiddleTable.of(12);
        for (int k = 0; k < 12; k++) {
            for (int n = 0; n < 12; n++) {
                int m = table.index(k, n);
                double theta = Twiddle.angle(k, n, 12);
                assertEquals(Math.cos(theta), table.cosAt(m), 1e-12);
                assertEquals(Math.sin(theta), table.sinAt(m), 1e-12);
            }
        }
        assertThrows(InvalidLengthException.class, () -> TwiddleTable.of(0));
    }
}
