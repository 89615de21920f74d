package com.complexity.analyzer.evaluation;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The sample algorithms bundled on the classpath under {@code samples/}.
 */
public class SampleCorpus {

    private static final Logger logger = LoggerFactory.getLogger(SampleCorpus.class);

    private static final Gson GSON = new Gson();

    public static final String SAMPLE_ROOT = "samples/";
    public static final String INDEX = SAMPLE_ROOT + "index.json";

    private final List<SampleAlgorithm> samples;

    private SampleCorpus(List<SampleAlgorithm> samples) {
        this.samples = Collections.unmodifiableList(samples);
    }

    /**
     * Loads the index and every sample's source.
     *
     * @throws SampleCorpusException if the index or a listed file is missing or malformed
     */
    public static SampleCorpus load() {
        ClassLoader loader = SampleCorpus.class.getClassLoader();
        SampleAlgorithm[] entries;
        try (Reader reader = open(loader, INDEX)) {
            entries = GSON.fromJson(reader, SampleAlgorithm[].class);
        } catch (IOException | JsonParseException e) {
            throw new SampleCorpusException("Failed to read sample index: " + e.getMessage(), e);
        }
        if (entries == null) {
            throw new SampleCorpusException("Sample index is empty");
        }

        List<SampleAlgorithm> samples = new ArrayList<>(Arrays.asList(entries));
        for (SampleAlgorithm sample : samples) {
            String resource = SAMPLE_ROOT + sample.getFile();
            try (InputStream in = loader.getResourceAsStream(resource)) {
                if (in == null) {
                    throw new SampleCorpusException("Sample file not found: " + resource);
                }
                sample.setSource(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new SampleCorpusException("Failed to read sample " + resource, e);
            }
        }
        logger.debug("Loaded {} samples", samples.size());
        return new SampleCorpus(samples);
    }

    private static Reader open(ClassLoader loader, String resource) {
        InputStream in = loader.getResourceAsStream(resource);
        if (in == null) {
            throw new SampleCorpusException("Resource not found: " + resource);
        }
        return new InputStreamReader(in, StandardCharsets.UTF_8);
    }

    public List<SampleAlgorithm> getSamples() {
        return samples;
    }

    public Optional<SampleAlgorithm> find(String name) {
        return samples.stream().filter(s -> s.getName().equalsIgnoreCase(name)).findFirst();
    }

    public static class SampleCorpusException extends RuntimeException {
        public SampleCorpusException(String message) { super(message); }
        public SampleCorpusException(String message, Throwable cause) { super(message, cause); }
    }
}
