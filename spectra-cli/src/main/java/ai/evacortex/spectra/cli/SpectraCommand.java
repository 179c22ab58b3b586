/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.cli;

import ai.evacortex.spectra.core.SpectraSettings;
import ai.evacortex.spectra.core.engine.DftKernel;
import ai.evacortex.spectra.core.engine.FourierEngine;
import ai.evacortex.spectra.core.engine.KernelType;
import ai.evacortex.spectra.core.exceptions.InvalidLengthException;
import ai.evacortex.spectra.core.exceptions.MalformedHeaderException;
import ai.evacortex.spectra.core.exceptions.ReportIOException;
import ai.evacortex.spectra.core.exceptions.WavIOException;
import ai.evacortex.spectra.core.io.wav.WavCodec;
import ai.evacortex.spectra.core.io.wav.WavFile;
import ai.evacortex.spectra.core.math.Complex;
import ai.evacortex.spectra.core.report.SpectrumReport;
import ai.evacortex.spectra.core.report.SpectrumReportMapper;
import ai.evacortex.spectra.core.spectrum.SpectrumAnalysis;
import ai.evacortex.spectra.core.spectrum.SpectrumAnalyzer;
import ai.evacortex.spectra.core.spectrum.SpectrumUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.TypeConversionException;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Reads a 16-bit WAV file, transforms its head window and charts signal and spectrum.
 */
@Command(name = "spectra", mixinStandardHelpOptions = true, version = "spectra 0.1.0",
        description = "Charts the discrete Fourier transform of the head of a 16-bit PCM WAV file.")
public class SpectraCommand implements Callable<Integer> {

    private static final Logger LOG = LogManager.getLogger(SpectraCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @Parameters(index = "0", paramLabel = "FILE", description = "Input WAV file (16-bit PCM).")
    private Path input;

    @Option(names = {"-w", "--window"}, paramLabel = "N",
            description = "Analysis window length in samples (default: sample rate / spectra.analysis.windowDivisor).")
    private Integer window;

    @Option(names = {"-b", "--bars"}, paramLabel = "150",
            description = "Number of spectrum bins to chart.")
    private int bars = 150;

    @Option(names = {"-k", "--kernel"}, paramLabel = "direct", converter = KernelTypeConverter.class,
            description = "Transform backend: direct, twiddle or parallel (default: spectra.kernel).")
    private KernelType kernel;

    @Option(names = {"-j", "--json"}, paramLabel = "FILE",
            description = "Write the spectrum report as JSON.")
    private Path json;

    @Option(names = {"-r", "--roundtrip"}, paramLabel = "FILE",
            description = "Reconstruct the analyzed window with the inverse transform and write it as WAV.")
    private Path roundtrip;

    @Option(names = "--replay",
            description = "Replay the signal in a sliding chart; press q to quit.")
    private boolean replay;

    @Option(names = "--width", paramLabel = "80", description = "Chart width in characters.")
    private int width = 80;

    @Option(names = "--height", paramLabel = "16", description = "Chart height in rows.")
    private int height = 16;

    private PrintStream out = System.out;
    private PrintStream err = System.err;
    private InputStream in = System.in;

    SpectraCommand withStreams(PrintStream out, PrintStream err, InputStream in) {
        this.out = out;
        this.err = err;
        this.in = in;
        return this;
    }

    @Override
    public Integer call() {
        DftKernel backend = null;
        try {
            SpectraSettings settings = SpectraSettings.fromSystemProperties();
            if (kernel != null) {
                settings = settings.withKernel(kernel);
            }
            backend = kernel != null ? settings.kernel().create(settings) : FourierEngine.getBackend();
            return run(settings, backend);
        } catch (MalformedHeaderException | WavIOException | ReportIOException | InvalidLengthException
                 | IllegalArgumentException e) {
            LOG.error("Aborting: {}", e.getMessage());
            err.println("spectra: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            if (kernel != null && backend instanceof Closeable) {
                try {
                    ((Closeable) backend).close();
                } catch (IOException e) {
                    LOG.warn("Failed to release kernel: {}", e.getMessage());
                }
            }
        }
    }

    private int run(SpectraSettings settings, DftKernel backend) {
        WavFile wav = WavCodec.read(input);
        SpectrumAnalyzer analyzer = new SpectrumAnalyzer(backend, settings);
        SpectrumAnalysis analysis = window != null ? analyzer.analyze(wav, window) : analyzer.analyze(wav);

        TextChartRenderer renderer = new TextChartRenderer(width, height);
        short[] head = analysis.window();
        short lo = Short.MAX_VALUE;
        short hi = Short.MIN_VALUE;
        for (short s : head) {
            lo = (short) Math.min(lo, s);
            hi = (short) Math.max(hi, s);
        }
        out.print(renderer.renderLine("signal (" + head.length + " samples)",
                SpectrumUtils.toPoints(head), 0, head.length - 1, lo, hi));
        out.print(renderer.renderBars("spectrum magnitude",
                SpectrumUtils.toBars(analysis.spectrum(), bars)));
        out.printf("peak: bin %d, %.2f Hz (bin width %.3f Hz)%n",
                analysis.peakBin(), analysis.peakFrequencyHz(), analysis.binWidthHz());

        if (json != null) {
            new SpectrumReportMapper().write(SpectrumReport.of(input.getFileName().toString(), analysis), json);
        }
        if (roundtrip != null) {
            Complex[] reconstructed = backend.inverse(analysis.spectrum());
            WavCodec.write(wav.withSamples(SpectrumUtils.toPcm16(reconstructed)), roundtrip);
        }
        if (replay) {
            Duration tick = Duration.ofMillis(Long.getLong("spectra.cli.tickMillis", 100L));
            try (ReplayLoop loop = new ReplayLoop(new SignalWindow(wav.samples(), 200, 5, 100.0), renderer, out, tick)) {
                int frames = loop.run(in);
                LOG.info("Replay finished after {} frames", frames);
            }
        }
        return EXIT_OK;
    }

    /** Case-insensitive kernel names; unknown names are usage errors. */
    static final class KernelTypeConverter implements ITypeConverter<KernelType> {
        @Override
        public KernelType convert(String value) {
            try {
                return KernelType.parse(value);
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException(e.getMessage());
            }
        }
    }
}
