package com.complexity.analyzer.processor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    @TempDir
    Path tempDir;

    private final ReportWriter writer = new ReportWriter();

    @Test
    void jsonCarriesSummaryAndRecurrence() throws Exception {
        AnalysisReport report = new AnalysisPipeline().run(AnalysisPipelineTest.MERGESORT);
        String json = writer.toJson(report);

        assertTrue(json.contains("\"best_case\": \"Ω(n log n)\""), json);
        assertTrue(json.contains("\"worst_case\": \"O(n log n)\""), json);
        assertTrue(json.contains("T(n) = 2T(n/2) + n"), json);
    }

    @Test
    void writeCreatesParentDirectories() throws Exception {
        AnalysisReport report = new AnalysisPipeline().run("begin\n    x 🡨 1\nend");
        Path target = tempDir.resolve("nested/deeper/report.json");

        writer.write(report, target);

        assertTrue(Files.exists(target));
        assertTrue(Files.readString(target).contains("\"worst_case\": \"O(1)\""));
    }
}
