/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.cli;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Tick-driven replay of a {@link SignalWindow}.
 *
 * <p>A scheduled producer posts a tick every {@code tickInterval}; a daemon thread posts
 * every key read from {@code input}. The calling thread consumes both from one queue:
 * a tick slides the window and redraws it, the exit key stops the loop. The loop also
 * ends when the window reaches the end of the signal.</p>
 */
public class ReplayLoop implements Closeable {

    private static final Logger LOG = LogManager.getLogger(ReplayLoop.class);
    private static final char EXIT_KEY = 'q';

    private final BlockingQueue<ReplayEvent> events = new LinkedBlockingQueue<>();
    private final ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "spectra-tick");
        t.setDaemon(true);
        return t;
    });

    private final SignalWindow window;
    private final TextChartRenderer renderer;
    private final PrintStream out;
    private final Duration tickInterval;

    public ReplayLoop(SignalWindow window, TextChartRenderer renderer, PrintStream out, Duration tickInterval) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval must not be null");
    }

    /**
     * Runs until the exit key, the end of the signal or an interrupt.
     *
     * @return number of frames drawn
     */
    public int run(InputStream input) {
        startInput(input);
        long millis = Math.max(1L, tickInterval.toMillis());
        ticker.scheduleAtFixedRate(() -> events.offer(ReplayEvent.tick()), millis, millis, TimeUnit.MILLISECONDS);

        int frames = 0;
        draw();
        frames++;
        try {
            while (true) {
                ReplayEvent event = events.take();
                if (event.kind() == ReplayEvent.Kind.INPUT) {
                    if (event.key() == EXIT_KEY) {
                        LOG.debug("Exit key received after {} frames", frames);
                        break;
                    }
                } else {
                    if (!window.advance()) {
                        LOG.debug("End of signal after {} frames", frames);
                        break;
                    }
                    draw();
                    frames++;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            close();
        }
        return frames;
    }

    private void startInput(InputStream input) {
        if (input == null) return;
        Thread reader = new Thread(() -> {
            try {
                int c;
                while ((c = input.read()) != -1) {
                    events.offer(ReplayEvent.input((char) c));
                    if (c == EXIT_KEY) return;
                }
            } catch (IOException e) {
                LOG.warn("Input reader stopped: {}", e.getMessage());
            }
        }, "spectra-input");
        reader.setDaemon(true);
        reader.start();
    }

    private void draw() {
        double[] bounds = window.bounds();
        out.print(renderer.renderLine("wav", window.points(), bounds[0], bounds[1], window.min(), window.max()));
        out.flush();
    }

    @Override
    public void close() {
        ticker.shutdownNow();
    }
}
