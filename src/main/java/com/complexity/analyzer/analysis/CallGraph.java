package com.complexity.analyzer.analysis;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Call relationships between the units of one pseudocode program.
 *
 * Names are compared case-insensitively, matching how the parser resolves calls. A call
 * to {@code self} is recorded as a call to the calling unit itself.
 */
public class CallGraph {

    // caller -> callee -> number of call sites
    private final Map<String, Map<String, Integer>> calls = new LinkedHashMap<>();

    // Units with a body in the program, in source order
    private final Set<String> definedUnits = new LinkedHashSet<>();

    /**
     * Records a unit that has a body in the program.
     */
    public void addUnit(String unitName) {
        String key = normalize(unitName);
        definedUnits.add(key);
        calls.computeIfAbsent(key, k -> new LinkedHashMap<>());
    }

    /**
     * Records one call site from caller to callee.
     *
     * @param caller the calling unit
     * @param callee the called name as written in the source
     */
    public void addCall(String caller, String callee) {
        String from = normalize(caller);
        String to = IdiomSignatures.SELF.equalsIgnoreCase(callee) ? from : normalize(callee);
        calls.computeIfAbsent(from, k -> new LinkedHashMap<>()).merge(to, 1, Integer::sum);
    }

    public Set<String> getCallees(String unitName) {
        Map<String, Integer> callees = calls.get(normalize(unitName));
        return callees == null ? Collections.emptySet() : Collections.unmodifiableSet(callees.keySet());
    }

    public Set<String> getDefinedUnits() {
        return Collections.unmodifiableSet(definedUnits);
    }

    /**
     * @return true if the unit calls itself directly
     */
    public boolean isRecursive(String unitName) {
        return getCallees(unitName).contains(normalize(unitName));
    }

    /**
     * Returns true if the unit can reach itself through at least one other unit.
     */
    public boolean isMutuallyRecursive(String unitName) {
        String start = normalize(unitName);
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        for (String callee : getCallees(start)) {
            if (!callee.equals(start)) {
                pending.push(callee);
            }
        }
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (String callee : getCallees(current)) {
                if (callee.equals(start)) {
                    return true;
                }
                pending.push(callee);
            }
        }
        return false;
    }

    /**
     * @return called names that no unit in the program defines
     */
    public Set<String> getUndefinedCallees() {
        Set<String> undefined = new LinkedHashSet<>();
        for (Map<String, Integer> callees : calls.values()) {
            for (String callee : callees.keySet()) {
                if (!definedUnits.contains(callee)) {
                    undefined.add(callee);
                }
            }
        }
        return undefined;
    }

    /**
     * Gets statistics about the call graph.
     */
    public String getStatistics() {
        int totalEdges = calls.values().stream().mapToInt(Map::size).sum();
        int totalCallSites = calls.values().stream()
                .flatMap(m -> m.values().stream()).mapToInt(Integer::intValue).sum();
        long recursiveUnits = definedUnits.stream().filter(this::isRecursive).count();

        return String.format("CallGraph: %d units, %d edges, %d call sites, %d recursive",
                definedUnits.size(), totalEdges, totalCallSites, recursiveUnits);
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
