package org.chakravyuha;

import java.util.Locale;

/**
 * Preset strength of the decoy passes. Each level caps how many fake loops,
 * conditionals and blocks may be inserted per function and cycle.
 */
public enum ObfuscationLevel {
    LOW("Few decoys, mostly straight fake blocks", 1, 2, 3),
    MEDIUM("Balanced mix of fake loops, conditionals and blocks", 3, 5, 6),
    HIGH("Dense decoy code in every eligible function", 5, 8, 10);

    private final String description;
    private final int maxFakeLoops;
    private final int maxFakeConditionals;
    private final int maxFakeBlocks;

    ObfuscationLevel(String description, int maxFakeLoops, int maxFakeConditionals, int maxFakeBlocks) {
        this.description = description;
        this.maxFakeLoops = maxFakeLoops;
        this.maxFakeConditionals = maxFakeConditionals;
        this.maxFakeBlocks = maxFakeBlocks;
    }

    public String getDescription() {
        return description;
    }

    public int getMaxFakeLoops() {
        return maxFakeLoops;
    }

    public int getMaxFakeConditionals() {
        return maxFakeConditionals;
    }

    public int getMaxFakeBlocks() {
        return maxFakeBlocks;
    }

    /**
     * @return the lower-case name used on the command line and in reports
     */
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
