/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.cli;

import ai.evacortex.spectra.core.io.wav.WavCodec;
import ai.evacortex.spectra.core.io.wav.WavFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SpectraCommandTest {

    @TempDir
    Path tempDir;

    private Path tone;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        short[] samples = new short[1600];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = (short) Math.round(6000 * Math.sin(2 * Math.PI * 200.0 * i / 8000));
        }
        tone = tempDir.resolve("tone.wav");
        WavCodec.write(WavFile.pcm16(1, 8000, samples), tone);
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int execute(String input, String... args) {
        SpectraCommand command = new SpectraCommand().withStreams(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
        return new CommandLine(command).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void analyzesHeadWindowAndPrintsPeak() {
        int code = execute("", tone.toString(), "--bars", "40");
        assertEquals(0, code);
        String text = stdout();
        assertTrue(text.contains("signal (800 samples)"), text);
        assertTrue(text.contains("spectrum magnitude"));
        // 800-sample window at 8000 Hz: bin width 10 Hz, 200 Hz tone lands on bin 20
        assertTrue(text.contains("peak: bin 20"), text);
    }

    @Test
    void writesJsonReportAndRoundTripWav() throws IOException {
        Path json = tempDir.resolve("report.json");
        Path back = tempDir.resolve("back.wav");
        int code = execute("", tone.toString(), "-k", "twiddle", "-w", "64", "-j", json.toString(), "-r", back.toString());
        assertEquals(0, code);

        assertTrue(Files.readString(json).contains("\"peakBin\""));
        WavFile reconstructed = WavCodec.read(back);
        WavFile original = WavCodec.read(tone);
        assertEquals(64, reconstructed.sampleCount());
        assertEquals(8000, reconstructed.sampleRate());
        short[] head = original.samples();
        short[] rebuilt = reconstructed.samples();
        for (int i = 0; i < rebuilt.length; i++) {
            assertEquals(head[i], rebuilt[i], "sample " + i);
        }
    }

    @Test
    void parallelKernelIsAcceptedAndReleased() {
        assertEquals(0, execute("", tone.toString(), "--kernel", "parallel", "--window", "128"));
    }

    @Test
    void malformedFileFailsWithExitOne() throws IOException {
        Path junk = tempDir.resolve("junk.wav");
        Files.write(junk, new byte[]{'R', 'I', 'F', 'X', 0, 0, 0, 0});
        assertEquals(1, execute("", junk.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("spectra: "));
    }

    @Test
    void missingFileFailsWithExitOne() {
        assertEquals(1, execute("", tempDir.resolve("absent.wav").toString()));
    }

    @Test
    void zeroWindowFailsWithExitOne() {
        assertEquals(1, execute("", tone.toString(), "--window", "0"));
    }

    @Test
    void missingArgumentIsUsageError() {
        assertEquals(2, execute(""));
    }

    @Test
    void unknownKernelIsUsageError() {
        assertEquals(2, execute("", tone.toString(), "--kernel", "fft"));
        assertFalse(stdout().contains("peak:"));
    }

    @Test
    void kernelNameIsCaseInsensitive() {
        assertEquals(0, execute("", tone.toString(), "--kernel", "TWIDDLE", "--window", "64"));
    }

    @Test
    void malformedPropertyFailsWithExitOne() {
        System.setProperty("spectra.cache.maxSpectra", "lots");
        try {
            assertEquals(1, execute("", tone.toString()));
            assertTrue(err.toString(StandardCharsets.UTF_8).contains("spectra.cache.maxSpectra"));
        } finally {
            System.clearProperty("spectra.cache.maxSpectra");
        }
    }

    @Test
    void replayStopsOnExitKey() {
        assertEquals(0, execute("q", tone.toString(), "--replay"));
        assertTrue(stdout().contains("wav"));
    }
}
