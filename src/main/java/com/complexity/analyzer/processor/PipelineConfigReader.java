package com.complexity.analyzer.processor;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class PipelineConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads a pipeline configuration file.
     *
     * @throws ConfigException if the file is missing, empty or malformed
     */
    public PipelineConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            PipelineConfig config = GSON.fromJson(reader, PipelineConfig.class);
            if (config == null) {
                throw new ConfigException("Config file is empty or invalid JSON: " + configPath);
            }
            if (config.getRecursionTreeDepth() < 0) {
                throw new ConfigException("recursion_tree_depth must not be negative in " + configPath);
            }
            return config;
        } catch (FileNotFoundException e) {
            throw new ConfigException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigException("Malformed config " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigException extends RuntimeException {
        public ConfigException(String message) { super(message); }
        public ConfigException(String message, Throwable cause) { super(message, cause); }
    }
}
