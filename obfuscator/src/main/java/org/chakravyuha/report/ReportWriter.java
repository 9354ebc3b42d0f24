package org.chakravyuha.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes an {@link ObfuscationReport} as pretty-printed JSON.
 */
public class ReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeNulls()
            .create();

    public String toJson(ObfuscationReport report) {
        return gson.toJson(report);
    }

    public void write(ObfuscationReport report, Writer out) {
        gson.toJson(report, out);
    }

    public void write(ObfuscationReport report, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(report, out);
            out.write(System.lineSeparator());
        }
        logger.info("Report written to {}", path);
    }
}
