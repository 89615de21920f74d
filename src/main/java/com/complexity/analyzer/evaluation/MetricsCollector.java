package com.complexity.analyzer.evaluation;

import com.complexity.analyzer.processor.AnalysisReport;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects summary metrics over a batch of analysed files.
 * One collector belongs to one batch run and is not thread-safe.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    static final String NO_IDIOM = "none";

    // Timing metrics
    private Instant startTime;
    private long totalAnalysisTimeMs = 0;
    private long totalFileTimeMs = 0;

    // File metrics
    private int totalFiles = 0;
    private int parsedFiles = 0;
    private int failedFiles = 0;
    private int correctedFiles = 0;
    private int totalStatements = 0;
    private int totalWarnings = 0;
    private int conclusiveSolutions = 0;
    private int recursionTrees = 0;

    // Distributions
    private final Map<String, Integer> patternDistribution = new TreeMap<>();
    private final Map<String, Integer> worstCaseDistribution = new TreeMap<>();
    private final Map<String, Integer> solverMethodDistribution = new TreeMap<>();
    private final Map<String, String> failures = new LinkedHashMap<>();

    /**
     * Start timing the analysis.
     */
    public void startAnalysis() {
        this.startTime = Instant.now();
        logger.info("Metrics collection started");
    }

    /**
     * End timing the analysis.
     */
    public void endAnalysis() {
        if (startTime == null) {
            return;
        }
        this.totalAnalysisTimeMs = Duration.between(startTime, Instant.now()).toMillis();
        logger.info("Metrics collection completed in {}ms", totalAnalysisTimeMs);
    }

    public void recordFile() {
        totalFiles++;
    }

    /**
     * Record metrics for one successfully analysed file.
     */
    public void recordReport(AnalysisReport report, long elapsedMs) {
        parsedFiles++;
        totalFileTimeMs += elapsedMs;

        String idiom = report.getIdiom() != null ? report.getIdiom().getPattern().getLabel() : NO_IDIOM;
        patternDistribution.merge(idiom, 1, Integer::sum);
        worstCaseDistribution.merge(report.getWorstCase(), 1, Integer::sum);
        if (report.getSolution() != null) {
            solverMethodDistribution.merge(report.getSolution().getMethod(), 1, Integer::sum);
            if (report.getSolution().isConclusive()) {
                conclusiveSolutions++;
            }
        }
        if (report.getRecursionTree() != null) {
            recursionTrees++;
        }
        if (report.getAnnotations().containsKey("grammar_correction")) {
            correctedFiles++;
        }
        String statements = report.getAnnotations().get("statement_count");
        if (statements != null) {
            totalStatements += Integer.parseInt(statements);
        }
        totalWarnings += report.getWarnings().size();
    }

    public void recordFailure(String file, String reason) {
        failedFiles++;
        failures.put(file, reason);
    }

    /**
     * Generate a metrics report.
     */
    public MetricsReport generateReport() {
        MetricsReport report = new MetricsReport();

        report.totalAnalysisTimeMs = totalAnalysisTimeMs;
        report.averageTimePerFile = parsedFiles > 0 ? (double) totalFileTimeMs / parsedFiles : 0;

        report.totalFiles = totalFiles;
        report.parsedFiles = parsedFiles;
        report.failedFiles = failedFiles;
        report.correctedFiles = correctedFiles;
        report.totalStatements = totalStatements;
        report.totalWarnings = totalWarnings;

        report.parseRate = calculatePercentage(parsedFiles, totalFiles);
        report.conclusiveSolutions = conclusiveSolutions;
        report.solverCoverage = calculatePercentage(conclusiveSolutions, parsedFiles);
        report.recursionTrees = recursionTrees;

        report.patternDistribution = new LinkedHashMap<>(patternDistribution);
        report.worstCaseDistribution = new LinkedHashMap<>(worstCaseDistribution);
        report.solverMethodDistribution = new LinkedHashMap<>(solverMethodDistribution);
        report.failures = new ArrayList<>();
        failures.forEach((file, reason) -> report.failures.add(file + ": " + reason));
        return report;
    }

    /**
     * Export metrics to JSON for further analysis.
     */
    public void exportJSON(Path outputPath) throws IOException {
        try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            GSON.toJson(generateReport(), writer);
        }
        logger.info("Metrics exported to: {}", outputPath);
    }

    /**
     * Print a human-readable report to console.
     */
    public void printReport() {
        MetricsReport report = generateReport();

        System.out.println("\n" + "=".repeat(80));
        System.out.println("COMPLEXITY ANALYSIS - METRICS REPORT");
        System.out.println("=".repeat(80));

        System.out.println("\n[TIMING METRICS]");
        System.out.printf("  Total Analysis Time: %.2f seconds%n", report.totalAnalysisTimeMs / 1000.0);
        System.out.printf("  Average Time per File: %.2f ms%n", report.averageTimePerFile);

        System.out.println("\n[FILES]");
        System.out.printf("  Files Found:     %,6d%n", report.totalFiles);
        System.out.printf("  Parsed:          %,6d (%.1f%%)%n", report.parsedFiles, report.parseRate);
        System.out.printf("  Failed:          %,6d%n", report.failedFiles);
        System.out.printf("  Corrected:       %,6d%n", report.correctedFiles);
        System.out.printf("  Statements:      %,6d%n", report.totalStatements);
        System.out.printf("  Warnings:        %,6d%n", report.totalWarnings);

        System.out.println("\n[RECURSIVE IDIOMS]");
        report.patternDistribution.forEach((pattern, count) ->
                System.out.printf("  %-15s: %,6d%n", pattern, count));

        System.out.println("\n[WORST CASE DISTRIBUTION]");
        report.worstCaseDistribution.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(entry -> System.out.printf("  %-20s: %,6d files%n", entry.getKey(), entry.getValue()));

        System.out.println("\n[RECURRENCE SOLVER]");
        System.out.printf("  Conclusive Solutions: %,6d (%.1f%%)%n", report.conclusiveSolutions, report.solverCoverage);
        System.out.printf("  Recursion Trees:      %,6d%n", report.recursionTrees);
        report.solverMethodDistribution.forEach((method, count) ->
                System.out.printf("  %-40s: %,6d%n", method, count));

        if (!report.failures.isEmpty()) {
            System.out.println("\n[FAILURES]");
            report.failures.forEach(failure -> System.out.println("  " + failure));
        }

        System.out.println("\n" + "=".repeat(80) + "\n");
    }

    private double calculatePercentage(int part, int total) {
        return total > 0 ? (100.0 * part / total) : 0.0;
    }

    /**
     * Data class holding all metrics for reporting.
     */
    public static class MetricsReport {
        // Timing
        public long totalAnalysisTimeMs;
        public double averageTimePerFile;

        // Files
        public int totalFiles;
        public int parsedFiles;
        public int failedFiles;
        public int correctedFiles;
        public int totalStatements;
        public int totalWarnings;
        public double parseRate;

        // Solver
        public int conclusiveSolutions;
        public double solverCoverage;
        public int recursionTrees;

        // Distributions
        public Map<String, Integer> patternDistribution;
        public Map<String, Integer> worstCaseDistribution;
        public Map<String, Integer> solverMethodDistribution;
        public List<String> failures;
    }
}
