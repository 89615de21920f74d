package com.complexity.analyzer.processor;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes analysis reports as pretty-printed JSON.
 */
public class ReportWriter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    public String toJson(AnalysisReport report) {
        return GSON.toJson(report);
    }

    /**
     * Writes {@code report} to {@code target}, creating parent directories as needed.
     */
    public void write(AnalysisReport report, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory for " + target, e);
        }

        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            GSON.toJson(report, writer);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write report " + target + ": " + e.getMessage(), e);
        }
    }
}
