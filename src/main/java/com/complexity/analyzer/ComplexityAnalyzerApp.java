package com.complexity.analyzer;

import com.complexity.analyzer.evaluation.SampleAlgorithm;
import com.complexity.analyzer.evaluation.SampleCorpus;
import com.complexity.analyzer.parser.GrammarRules;
import com.complexity.analyzer.parser.SyntaxException;
import com.complexity.analyzer.processor.AnalysisPipeline;
import com.complexity.analyzer.processor.AnalysisReport;
import com.complexity.analyzer.processor.PipelineConfig;
import com.complexity.analyzer.processor.PipelineConfigReader;
import com.complexity.analyzer.processor.ReportWriter;
import com.complexity.analyzer.processor.SourceBatchProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main application entry point for the pseudocode complexity analyzer.
 *
 * Usage:
 *   java -jar complexity-analyzer.jar &lt;file-or-directory&gt; [--output &lt;dir&gt;] [--config &lt;config.json&gt;] [--no-metrics]
 *   java -jar complexity-analyzer.jar --samples [--config &lt;config.json&gt;]
 *   java -jar complexity-analyzer.jar --grammar
 */
public class ComplexityAnalyzerApp {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzerApp.class);

    static final String USAGE = "Usage: java -jar complexity-analyzer.jar <file-or-directory> "
            + "[--output <dir>] [--config <config.json>] [--no-metrics] | --samples | --grammar";

    public static void main(String[] args) {
        try {
            int failures = run(args, System.out);
            System.exit(failures == 0 ? 0 : 1);
        } catch (UsageException e) {
            System.err.println("[complexity-analyzer] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            logger.error("Error running analysis", e);
            System.err.println("[complexity-analyzer] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * @return the number of inputs that could not be analysed
     */
    static int run(String[] args, PrintStream out) throws IOException, SyntaxException {
        if (args.length == 0) {
            throw new UsageException("No input specified");
        }

        String target = null;
        String outputDir = null;
        String configPath = null;
        boolean metrics = true;
        boolean samples = false;
        boolean grammar = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--output"     -> outputDir  = requireNext(args, i++, "--output");
                case "--config"     -> configPath = requireNext(args, i++, "--config");
                case "--no-metrics" -> metrics = false;
                case "--samples"    -> samples = true;
                case "--grammar"    -> grammar = true;
                default -> {
                    if (args[i].startsWith("--")) {
                        throw new UsageException("Unknown flag: " + args[i]);
                    }
                    if (target != null) {
                        throw new UsageException("Only one input path may be given");
                    }
                    target = args[i];
                }
            }
        }

        if (grammar) {
            out.println(GrammarRules.toMarkdown());
            return 0;
        }

        PipelineConfig config = configPath != null
                ? new PipelineConfigReader().read(Paths.get(configPath))
                : PipelineConfig.defaults();
        AnalysisPipeline pipeline = new AnalysisPipeline(config, null);

        if (samples) {
            return runSamples(pipeline, out);
        }
        if (target == null) {
            throw new UsageException("No input specified");
        }

        Path path = Paths.get(target);
        logger.info("Starting complexity analysis of {}", path);

        // A single file without --output prints its report
        if (Files.isRegularFile(path) && outputDir == null) {
            SourceBatchProcessor processor = new SourceBatchProcessor(pipeline, false);
            AnalysisReport report = processor.processFile(path);
            out.println(new ReportWriter().toJson(report));
            return 0;
        }

        SourceBatchProcessor processor = new SourceBatchProcessor(pipeline, metrics);
        int processed = processor.processDirectory(path, outputDir != null ? Paths.get(outputDir) : null);
        logger.info("Processing complete! Files analysed: {}", processed);
        return processor.getFailedFiles();
    }

    private static int runSamples(AnalysisPipeline pipeline, PrintStream out) {
        int mismatches = 0;
        for (SampleAlgorithm sample : SampleCorpus.load().getSamples()) {
            try {
                AnalysisReport report = pipeline.run(sample.getSource());
                boolean matches = !sample.isExact() || sample.getExpectedComplexity().equals(report.getWorstCase());
                if (!matches) {
                    mismatches++;
                }
                out.printf("%-28s expected %-12s worst %-12s %s%n", sample.getName(),
                        sample.getExpectedComplexity(), report.getWorstCase(),
                        sample.isExact() ? (matches ? "ok" : "MISMATCH") : "approx");
            } catch (SyntaxException e) {
                mismatches++;
                logger.error("Sample {} does not parse: {}", sample.getName(), e.getMessage());
            }
        }
        return mismatches;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
