/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.io.wav;

import ai.evacortex.spectra.core.SignalTestUtils;
import ai.evacortex.spectra.core.exceptions.MalformedHeaderException;
import ai.evacortex.spectra.core.exceptions.WavIOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class WavCodecTest {

    @TempDir
    Path tempDir;

    private static WavFile sineFile() {
        return WavFile.pcm16(1, 44100, SignalTestUtils.sine(1000.0, 44100, 441, 12000));
    }

    @Test
    void canonicalHeaderLayout() {
        byte[] bytes = WavCodec.encode(sineFile());
        assertEquals(44 + 441 * 2, bytes.length);

        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals('R', buf.get(0));
        assertEquals(36 + 441 * 2, buf.getInt(4));
        assertEquals('W', buf.get(8));
        assertEquals('f', buf.get(12));
        assertEquals(16, buf.getInt(16));
        assertEquals(1, buf.getShort(20));
        assertEquals(1, buf.getShort(22));
        assertEquals(44100, buf.getInt(24));
        assertEquals(88200, buf.getInt(28));
        assertEquals(2, buf.getShort(32));
        assertEquals(16, buf.getShort(34));
        assertEquals('d', buf.get(36));
        assertEquals(441 * 2, buf.getInt(40));
    }

    @Test
    void readThenWrite_isByteIdentical() throws IOException {
        Path source = tempDir.resolve("source.wav");
        Files.write(source, WavCodec.encode(sineFile()));

        WavFile wav = WavCodec.read(source);
        Path copy = tempDir.resolve("copy.wav");
        WavCodec.write(wav, copy);

        assertArrayEquals(Files.readAllBytes(source), Files.readAllBytes(copy));
    }

    @Test
    void decodesHeadersAndSamples() {
        short[] samples = {0, 1, -1, Short.MAX_VALUE, Short.MIN_VALUE};
        WavFile wav = WavCodec.decode(WavCodec.encode(WavFile.pcm16(2, 8000, samples)));
        assertEquals("RIFF", wav.riff().riff());
        assertEquals("WAVE", wav.riff().format());
        assertEquals(8000, wav.sampleRate());
        assertEquals(2, wav.channels());
        assertEquals(16, wav.format().bitsPerSample());
        assertEquals(10, wav.data().size());
        assertArrayEquals(samples, wav.samples());
    }

    @Test
    void samplesAreDefensivelyCopied() {
        short[] samples = {1, 2, 3};
        WavFile wav = WavFile.pcm16(1, 8000, samples);
        samples[0] = 99;
        wav.samples()[1] = 99;
        assertArrayEquals(new short[]{1, 2, 3}, wav.samples());
    }

    @Test
    void withSamplesRecomputesChunkSizes() {
        WavFile wav = sineFile().withSamples(new short[]{5, 6});
        assertEquals(4, wav.data().size());
        assertEquals(40, wav.riff().fileSize());
        assertEquals(44100, wav.sampleRate());
    }

    @Test
    void rejectsBadRiffMagic() {
        byte[] bytes = WavCodec.encode(sineFile());
        bytes[0] = 'X';
        MalformedHeaderException e = assertThrows(MalformedHeaderException.class, () -> WavCodec.decode(bytes));
        assertTrue(e.getMessage().contains("RIFF"));
    }

    @Test
    void rejectsBadFmtAndDataMagic() {
        byte[] badFmt = WavCodec.encode(sineFile());
        badFmt[12] = 'F';
        assertThrows(MalformedHeaderException.class, () -> WavCodec.decode(badFmt));

        byte[] badData = WavCodec.encode(sineFile());
        badData[36] = 'D';
        assertThrows(MalformedHeaderException.class, () -> WavCodec.decode(badData));
    }

    @Test
    void rejectsTruncatedHeader() {
        byte[] bytes = Arrays.copyOf(WavCodec.encode(sineFile()), 30);
        assertThrows(MalformedHeaderException.class, () -> WavCodec.decode(bytes));
    }

    @Test
    void rejectsUnsupportedBitDepth() {
        byte[] bytes = WavCodec.encode(sineFile());
        ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).putShort(34, (short) 24);
        MalformedHeaderException e = assertThrows(MalformedHeaderException.class, () -> WavCodec.decode(bytes));
        assertTrue(e.getMessage().contains("bit depth"));
    }

    @Test
    void clampsDeclaredSizeAndDropsOddByte() {
        byte[] full = WavCodec.encode(WavFile.pcm16(1, 8000, new short[]{10, 20, 30}));
        byte[] cut = Arrays.copyOf(full, full.length - 1);
        WavFile wav = WavCodec.decode(cut);
        assertArrayEquals(new short[]{10, 20}, wav.samples());
        assertEquals(4, wav.data().size());
        assertEquals(40, wav.riff().fileSize());

        byte[] rewritten = WavCodec.encode(wav);
        assertEquals(WavFile.HEADER_SIZE + 4, rewritten.length);
        assertEquals(4, ByteBuffer.wrap(rewritten).order(ByteOrder.LITTLE_ENDIAN).getInt(40));
        assertArrayEquals(new short[]{10, 20}, WavCodec.decode(rewritten).samples());
    }

    @Test
    void oversizedDataChunkIsRewrittenToPayload() {
        byte[] bytes = WavCodec.encode(WavFile.pcm16(1, 8000, new short[]{1, 2, 3, 4}));
        ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).putInt(40, 1_000);
        WavFile wav = WavCodec.decode(bytes);
        assertEquals(4, wav.sampleCount());
        assertEquals(8, wav.data().size());
        assertArrayEquals(WavCodec.encode(WavFile.pcm16(1, 8000, new short[]{1, 2, 3, 4})), WavCodec.encode(wav));
    }

    @Test
    void ignoresTrailingChunksAfterData() {
        byte[] full = WavCodec.encode(WavFile.pcm16(1, 8000, new short[]{7, 8}));
        byte[] padded = Arrays.copyOf(full, full.length + 6);
        WavFile wav = WavCodec.decode(padded);
        assertArrayEquals(new short[]{7, 8}, wav.samples());
        assertArrayEquals(full, WavCodec.encode(wav));
    }

    @Test
    void rejectsSampleRateBeyondIntRange() {
        byte[] bytes = WavCodec.encode(sineFile());
        ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).putInt(24, 0x8000_0000);
        MalformedHeaderException e = assertThrows(MalformedHeaderException.class, () -> WavCodec.decode(bytes));
        assertTrue(e.getMessage().contains("sample rate"));
    }

    @Test
    void missingFileSurfacesAsWavIOException() {
        assertThrows(WavIOException.class, () -> WavCodec.read(tempDir.resolve("absent.wav")));
    }
}
