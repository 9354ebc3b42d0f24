package org.chakravyuha.flatten;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Module-level aggregate of {@link FlatteningResult}s, keyed by function name.
 */
public final class FlatteningSummary {

    private final int flattenedFunctions;
    private final int flattenedBlocks;
    private final int skippedFunctions;
    private final Map<String, FlatteningResult> results;

    public FlatteningSummary(Map<String, FlatteningResult> results) {
        int functions = 0;
        int blocks = 0;
        int skipped = 0;
        for (FlatteningResult result : results.values()) {
            if (result.isModified()) {
                functions++;
                blocks += result.getBlocksFlattened();
            } else if (result.getSkipReason().map(SkipReason::countsAsSkipped).orElse(false)) {
                skipped++;
            }
        }
        this.flattenedFunctions = functions;
        this.flattenedBlocks = blocks;
        this.skippedFunctions = skipped;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public int getFlattenedFunctions() {
        return flattenedFunctions;
    }

    public int getFlattenedBlocks() {
        return flattenedBlocks;
    }

    public int getSkippedFunctions() {
        return skippedFunctions;
    }

    public Map<String, FlatteningResult> getResults() {
        return results;
    }

    public FlatteningResult getResult(String functionName) {
        return results.get(functionName);
    }

    @Override
    public String toString() {
        return String.format("FlatteningSummary{flattenedFunctions=%d, flattenedBlocks=%d, skippedFunctions=%d}",
                flattenedFunctions, flattenedBlocks, skippedFunctions);
    }
}
