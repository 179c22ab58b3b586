/*
 * Spectra — Discrete Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.report;

import ai.evacortex.spectra.core.exceptions.ReportIOException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * JSON persistence of {@link SpectrumReport}s.
 */
public class SpectrumReportMapper {

    private static final Logger LOG = LogManager.getLogger(SpectrumReportMapper.class);

    private final ObjectMapper mapper;

    public SpectrumReportMapper() {
        this.mapper = new ObjectMapper();
    }

    public void write(SpectrumReport report, Path path) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(path, "path must not be null");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, report);
            }
        } catch (IOException e) {
            throw new ReportIOException("Failed to write spectrum report " + path, e);
        }
        LOG.info("Wrote spectrum report with {} bins to {}", report.bins().size(), path);
    }

    public SpectrumReport read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            return mapper.readValue(in, SpectrumReport.class);
        } catch (IOException e) {
            throw new ReportIOException("Failed to read spectrum report " + path, e);
        }
    }
}
