package com.complexity.analyzer.processor;

import com.complexity.analyzer.evaluation.MetricsCollector;
import com.complexity.analyzer.parser.SyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Analyzes every pseudocode file below a directory and writes one JSON report per file.
 */
public class SourceBatchProcessor {

    private static final Logger logger = LoggerFactory.getLogger(SourceBatchProcessor.class);

    static final List<String> SOURCE_EXTENSIONS = List.of(".psc", ".pseudo", ".txt");
    public static final String METRICS_FILE = "complexity-metrics.json";
    static final String REPORT_SUFFIX = ".complexity.json";

    private final AnalysisPipeline pipeline;
    private final ReportWriter reportWriter;
    private final MetricsCollector metricsCollector;
    private final boolean collectMetrics;
    private int failedFiles;

    public SourceBatchProcessor() {
        this(new AnalysisPipeline(), true);
    }

    public SourceBatchProcessor(AnalysisPipeline pipeline, boolean collectMetrics) {
        this.pipeline = pipeline;
        this.reportWriter = new ReportWriter();
        this.collectMetrics = collectMetrics;
        this.metricsCollector = collectMetrics ? new MetricsCollector() : null;
    }

    /**
     * Processes all pseudocode files under {@code root}.
     *
     * @param root      a directory, or a single source file
     * @param outputDir where reports go; {@code null} to skip writing them
     * @return number of files analysed successfully
     * @throws IOException if {@code root} is missing or cannot be walked
     */
    public int processDirectory(Path root, Path outputDir) throws IOException {
        if (!Files.exists(root)) {
            throw new IOException("Path does not exist: " + root);
        }

        if (collectMetrics) {
            metricsCollector.startAnalysis();
        }

        List<Path> sources = new ArrayList<>();
        if (Files.isRegularFile(root)) {
            sources.add(root);
        } else {
            try (Stream<Path> paths = Files.walk(root)) {
                paths.filter(Files::isRegularFile)
                     .filter(SourceBatchProcessor::isSourceFile)
                     .sorted()
                     .forEach(sources::add);
            }
        }
        logger.info("Found {} pseudocode files under {}", sources.size(), root);

        int processed = 0;
        for (Path source : sources) {
            if (collectMetrics) {
                metricsCollector.recordFile();
            }
            long start = System.currentTimeMillis();
            try {
                AnalysisReport report = processFile(source);
                long elapsed = System.currentTimeMillis() - start;
                if (outputDir != null) {
                    reportWriter.write(report, outputDir.resolve(reportName(source)));
                }
                if (collectMetrics) {
                    metricsCollector.recordReport(report, elapsed);
                }
                logger.info("{}: worst case {}", source.getFileName(), report.getWorstCase());
                processed++;
            } catch (SyntaxException | IOException | ReportWriter.ReportWriteException e) {
                failedFiles++;
                logger.error("Error analysing file: {}: {}", source, e.getMessage());
                if (collectMetrics) {
                    metricsCollector.recordFailure(source.toString(), e.getMessage());
                }
            }
        }

        if (collectMetrics) {
            metricsCollector.endAnalysis();
            metricsCollector.printReport();
            if (outputDir != null) {
                Files.createDirectories(outputDir);
                metricsCollector.exportJSON(outputDir.resolve(METRICS_FILE));
            }
        }

        logger.info("Analysed {} of {} files", processed, sources.size());
        return processed;
    }

    /**
     * Analyzes a single file without writing anything.
     */
    public AnalysisReport processFile(Path source) throws IOException, SyntaxException {
        String text = Files.readString(source, StandardCharsets.UTF_8);
        return pipeline.run(text);
    }

    public int getFailedFiles() {
        return failedFiles;
    }

    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }

    static boolean isSourceFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return SOURCE_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    static String reportName(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0 ? name.substring(0, dot) : name) + REPORT_SUFFIX;
    }
}
