/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.io.wav;

import java.util.Objects;

/**
 * A decoded 16-bit PCM WAV file. Samples are interleaved when there is more than one
 * channel; the array is copied on the way in and on the way out.
 */
public record WavFile(RiffHeader riff, FormatHeader format, DataHeader data, short[] samples) {

    public static final int HEADER_SIZE = RiffHeader.SIZE + FormatHeader.SIZE + DataHeader.SIZE;

    public WavFile {
        Objects.requireNonNull(riff, "riff must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(data, "data must not be null");
        samples = Objects.requireNonNull(samples, "samples must not be null").clone();
    }

    /**
     * Builds a canonical PCM16 file with consistent chunk sizes.
     */
    public static WavFile pcm16(int channels, int sampleRate, short[] samples) {
        long dataSize = 2L * samples.length;
        return new WavFile(
                new RiffHeader(RiffHeader.MAGIC, 4 + FormatHeader.SIZE + DataHeader.SIZE + dataSize, "WAVE"),
                FormatHeader.pcm16(channels, sampleRate),
                new DataHeader(DataHeader.MAGIC, dataSize),
                samples);
    }

    /**
     * Same format, new payload; chunk sizes are recomputed.
     */
    public WavFile withSamples(short[] newSamples) {
        long dataSize = 2L * newSamples.length;
        return new WavFile(
                new RiffHeader(riff.riff(), 4 + FormatHeader.SIZE + DataHeader.SIZE + dataSize, riff.format()),
                format,
                new DataHeader(data.data(), dataSize),
                newSamples);
    }

    @Override
    public short[] samples() {
        return samples.clone();
    }

    public int sampleCount() {
        return samples.length;
    }

    public int sampleRate() {
        return (int) format.sampleRate();
    }

    public int channels() {
        return format.channels();
    }

    /** Duration in seconds, counting interleaved frames. */
    public double durationSeconds() {
        return (double) samples.length / channels() / sampleRate();
    }
}
