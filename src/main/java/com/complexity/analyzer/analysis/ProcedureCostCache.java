package com.complexity.analyzer.analysis;

import com.complexity.analyzer.model.CaseComplexity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Structural cost of each procedure, so a caller can charge a call at the callee's price.
 * Lookups ignore case, matching how calls resolve.
 */
public class ProcedureCostCache {

    private static final Logger logger = LoggerFactory.getLogger(ProcedureCostCache.class);

    private final Map<String, CaseComplexity> cache = new LinkedHashMap<>();

    public void put(String procedureName, CaseComplexity cost) {
        cache.put(normalize(procedureName), cost);
        logger.debug("Cached cost for {}: {}", procedureName, cost);
    }

    /**
     * @return the cached cost, or null if the procedure was not analysed
     */
    public CaseComplexity get(String procedureName) {
        return cache.get(normalize(procedureName));
    }

    public boolean contains(String procedureName) {
        return cache.containsKey(normalize(procedureName));
    }

    public int size() {
        return cache.size();
    }

    public Map<String, CaseComplexity> getAll() {
        return Collections.unmodifiableMap(cache);
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
