/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

import ai.evacortex.spectra.core.exceptions.InvalidLengthException;
import ai.evacortex.spectra.core.math.Complex;

/**
 * {@code DftKernel} computes the discrete Fourier transform of a finite signal and its
 * inverse by direct summation.
 *
 * <p>For a sequence of length {@code N} and {@code θ = 2π·k·n/N} the forward transform is</p>
 * <pre>
 *     X[k] = (1/N) · Σ x[n] · (cos θ − i·sin θ)
 * </pre>
 * <p>and the inverse transform is</p>
 * <pre>
 *     x[k] = Σ X[n] · (cos θ + i·sin θ)
 * </pre>
 *
 * <p>The {@code 1/N} factor is applied once, on the forward pass. The inverse is an
 * unnormalized sum, so {@code inverse(forward(x))} reconstructs {@code x}. Under this
 * convention an impulse at the origin of length 8 transforms into a flat spectrum of
 * {@code 0.125}, and a single sample {@code v} transforms into {@code v}.</p>
 *
 * <p>Both directions preserve the length of their input: bin {@code k} and time step
 * {@code n} range over {@code [0, N)}. Nothing is padded or truncated. Any positive
 * length is supported, power of two or not.</p>
 *
 * <p>Implementations must be deterministic and free of side effects. Sums are
 * accumulated left to right over increasing {@code n}. An empty input is rejected with
 * {@link InvalidLengthException}, never answered with an empty result or a NaN.</p>
 *
 * @see DirectDftKernel
 * @see TwiddleDftKernel
 * @see ParallelDftKernel
 * @see FourierEngine
 */
public interface DftKernel {

    /**
     * Forward transform of real samples.
     *
     * @param samples time-domain values {@code x[0..N)}
     * @return {@code N} frequency-domain coefficients
     * @throws InvalidLengthException if {@code samples} is empty
     * @throws NullPointerException if {@code samples} is {@code null}
     */
    Complex[] forward(double[] samples);

    /**
     * Forward transform of signed 16-bit samples, as read from a PCM WAV file.
     * Each sample is widened to {@code double} before the kernel is applied.
     *
     * @param samples 16-bit time-domain values
     * @return {@code N} frequency-domain coefficients
     * @throws InvalidLengthException if {@code samples} is empty
     * @throws NullPointerException if {@code samples} is {@code null}
     */
    default Complex[] forward(short[] samples) {
        return forward(AbstractDftKernel.widen(samples));
    }

    /**
     * Inverse transform. The result is complex; for a spectrum produced from a real
     * signal the imaginary parts are numerically zero.
     *
     * @param spectrum frequency-domain coefficients {@code X[0..N)}
     * @return {@code N} reconstructed time-domain values
     * @throws InvalidLengthException if {@code spectrum} is empty
     * @throws NullPointerException if {@code spectrum} or any element is {@code null}
     */
    Complex[] inverse(Complex[] spectrum);

    /**
     * Computes a single forward bin {@code X[k]}, normalization included.
     *
     * @throws IndexOutOfBoundsException if {@code k} is outside {@code [0, N)}
     */
    Complex forwardBin(double[] samples, int k);

    /**
     * Computes a single reconstructed value {@code x[k]}.
     *
     * @throws IndexOutOfBoundsException if {@code k} is outside {@code [0, N)}
     */
    Complex inverseBin(Complex[] spectrum, int k);
}
