package com.complexity.analyzer.processor;

import com.complexity.analyzer.recurrence.RecursionTreeBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigReaderTest {

    @TempDir
    Path tempDir;

    private final PipelineConfigReader reader = new PipelineConfigReader();

    @Test
    void missingFieldsFallBackToDefaults() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{}");

        PipelineConfig config = reader.read(file);
        assertTrue(config.isEnableValidations());
        assertTrue(config.isEnableGrammarCorrection());
        assertFalse(config.isPreferSolverForPureRecursion());
        assertEquals(RecursionTreeBuilder.DEFAULT_DEPTH, config.getRecursionTreeDepth());
    }

    @Test
    void readsSnakeCaseFields() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, """
                {
                  "enable_validations": false,
                  "enable_grammar_correction": false,
                  "prefer_solver_for_pure_recursion": true,
                  "recursion_tree_depth": 3
                }
                """);

        PipelineConfig config = reader.read(file);
        assertFalse(config.isEnableValidations());
        assertFalse(config.isEnableGrammarCorrection());
        assertTrue(config.isPreferSolverForPureRecursion());
        assertEquals(3, config.getRecursionTreeDepth());
    }

    @Test
    void missingFileIsReported() {
        PipelineConfigReader.ConfigException e = assertThrows(PipelineConfigReader.ConfigException.class,
                () -> reader.read(tempDir.resolve("absent.json")));
        assertTrue(e.getMessage().startsWith("Config file not found"));
    }

    @Test
    void emptyFileIsReported() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "");

        PipelineConfigReader.ConfigException e = assertThrows(PipelineConfigReader.ConfigException.class,
                () -> reader.read(file));
        assertTrue(e.getMessage().startsWith("Config file is empty"));
    }

    @Test
    void malformedJsonIsReported() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"recursion_tree_depth\": \"deep\"}");

        PipelineConfigReader.ConfigException e = assertThrows(PipelineConfigReader.ConfigException.class,
                () -> reader.read(file));
        assertTrue(e.getMessage().startsWith("Malformed config"));
        assertNotNull(e.getCause());
    }

    @Test
    void negativeDepthIsRejected() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"recursion_tree_depth\": -1}");

        assertThrows(PipelineConfigReader.ConfigException.class, () -> reader.read(file));
    }
}
