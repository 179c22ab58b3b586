/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.io.wav;

import ai.evacortex.spectra.core.exceptions.MalformedHeaderException;
import ai.evacortex.spectra.core.exceptions.WavIOException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes 16-bit PCM WAV files with the canonical 44-byte header.
 *
 * Layout:
 *   [RIFF:12][fmt :24][data:8][SAMPLE₀:short]...[SAMPLEₙ]
 *
 * All fields are little-endian. Reading a canonical file and writing it back yields
 * identical bytes. For any other file the decoded headers are rewritten to describe the
 * samples actually kept, so a clamped data chunk, a dropped odd byte or trailing bytes
 * after the data chunk do not survive a round trip.
 */
public final class WavCodec {

    private static final Logger LOG = LogManager.getLogger(WavCodec.class);
    private static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;

    private WavCodec() {}

    public static WavFile read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new WavIOException("Failed to read WAV file " + path, e);
        }
        WavFile wav = decode(bytes);
        LOG.info("Read {}: {} Hz, {} channel(s), {} samples ({} s)", path.getFileName(),
                wav.sampleRate(), wav.channels(), wav.sampleCount(),
                String.format("%.2f", wav.durationSeconds()));
        return wav;
    }

    public static WavFile decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ORDER);

        RiffHeader riff = RiffHeader.from(buf);
        FormatHeader format = FormatHeader.from(buf);
        DataHeader data = DataHeader.from(buf);

        long declared = data.size();
        int available = buf.remaining();
        int payload;
        if (declared > available) {
            LOG.warn("data chunk declares {} bytes but only {} remain; reading what is present", declared, available);
            payload = available;
        } else {
            payload = (int) declared;
            if (payload < available) {
                LOG.debug("Ignoring {} trailing bytes after data chunk", available - payload);
            }
        }
        if ((payload & 1) != 0) {
            LOG.warn("Dropping incomplete trailing sample byte");
            payload--;
        }

        short[] samples = new short[payload / 2];
        buf.asShortBuffer().get(samples);
        WavFile wav = new WavFile(riff, format, data, samples);
        if (data.size() != payload || riff.fileSize() != WavFile.HEADER_SIZE - 8L + payload) {
            LOG.debug("Rewriting chunk sizes to describe the {} samples read", samples.length);
            return wav.withSamples(samples);
        }
        return wav;
    }

    public static byte[] encode(WavFile wav) {
        Objects.requireNonNull(wav, "wav must not be null");
        short[] samples = wav.samples();
        long total = (long) WavFile.HEADER_SIZE + 2L * samples.length;
        if (total > Integer.MAX_VALUE) {
            throw new MalformedHeaderException("WAV payload too large: " + total + " bytes");
        }
        ByteBuffer buf = ByteBuffer.allocate((int) total).order(ORDER);
        buf.put(wav.riff().toBytes());
        buf.put(wav.format().toBytes());
        buf.put(wav.data().toBytes());
        for (short s : samples) buf.putShort(s);
        return buf.array();
    }

    public static void write(WavFile wav, Path path) {
        Objects.requireNonNull(path, "path must not be null");
        byte[] bytes = encode(wav);
        try (OutputStream out = Files.newOutputStream(path)) {
            out.write(bytes);
        } catch (IOException e) {
            throw new WavIOException("Failed to write WAV file " + path, e);
        }
        LOG.info("Wrote {} samples to {}", wav.sampleCount(), path);
    }
}
