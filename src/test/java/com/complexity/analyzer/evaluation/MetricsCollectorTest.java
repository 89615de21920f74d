package com.complexity.analyzer.evaluation;

import com.complexity.analyzer.processor.AnalysisPipeline;
import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MetricsCollectorTest {

    @TempDir
    Path tempDir;

    private static final String HANOI = """
            HANOI(n, a, b, c)
            begin
                if (n > 0) then
                begin
                    CALL HANOI(n - 1, a, c, b)
                    print n
                    CALL HANOI(n - 1, c, b, a)
                end
            end
            """;

    private static final String LOOP = """
            begin
                for i 🡨 1 to n do
                begin
                    x 🡨 x + i
                end
            end
            """;

    @Test
    void emptyCollectorReportsZeroes() {
        MetricsCollector.MetricsReport report = new MetricsCollector().generateReport();
        assertEquals(0, report.totalFiles);
        assertEquals(0.0, report.parseRate);
        assertEquals(0.0, report.averageTimePerFile);
        assertTrue(report.failures.isEmpty());
    }

    @Test
    void aggregatesReportsAndFailures() throws Exception {
        AnalysisPipeline pipeline = new AnalysisPipeline();
        MetricsCollector collector = new MetricsCollector();
        collector.startAnalysis();
        for (int i = 0; i < 4; i++) {
            collector.recordFile();
        }
        collector.recordReport(pipeline.run(HANOI), 10);
        collector.recordReport(pipeline.run(LOOP), 20);
        collector.recordReport(pipeline.run(LOOP), 30);
        collector.recordFailure("broken.psc", "Expected 'end' at 3:1");
        collector.endAnalysis();

        MetricsCollector.MetricsReport report = collector.generateReport();
        assertEquals(4, report.totalFiles);
        assertEquals(3, report.parsedFiles);
        assertEquals(1, report.failedFiles);
        assertEquals(75.0, report.parseRate);
        assertEquals(20.0, report.averageTimePerFile);
        assertEquals(Integer.valueOf(1), report.patternDistribution.get("hanoi"));
        assertEquals(Integer.valueOf(2), report.patternDistribution.get(MetricsCollector.NO_IDIOM));
        assertEquals(Integer.valueOf(2), report.worstCaseDistribution.get("O(n)"));
        assertEquals(Integer.valueOf(1), report.worstCaseDistribution.get("O(2^n)"));
        assertEquals("broken.psc: Expected 'end' at 3:1", report.failures.get(0));
    }

    @Test
    void exportsJson() throws Exception {
        MetricsCollector collector = new MetricsCollector();
        collector.recordFile();
        collector.recordReport(new AnalysisPipeline().run(LOOP), 5);

        Path target = tempDir.resolve("metrics.json");
        collector.exportJSON(target);

        MetricsCollector.MetricsReport read = new Gson().fromJson(Files.readString(target),
                MetricsCollector.MetricsReport.class);
        assertEquals(1, read.totalFiles);
        assertEquals(1, read.parsedFiles);
        assertEquals(100.0, read.parseRate);
    }
}
