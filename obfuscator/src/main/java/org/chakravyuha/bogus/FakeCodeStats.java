package org.chakravyuha.bogus;

/**
 * Counters of one {@link FakeCodeInsertionPass} run.
 */
public final class FakeCodeStats {

    private int fakeBlocks;
    private int fakeLoops;
    private int fakeConditionals;
    private int bogusInstructions;

    public int getFakeBlocks() {
        return fakeBlocks;
    }

    public int getFakeLoops() {
        return fakeLoops;
    }

    public int getFakeConditionals() {
        return fakeConditionals;
    }

    /**
     * Dead arithmetic plus the control instructions that carry it.
     */
    public int getBogusInstructions() {
        return bogusInstructions;
    }

    public boolean isEmpty() {
        return fakeBlocks == 0 && fakeLoops == 0 && fakeConditionals == 0;
    }

    void addBlock(int instructions) {
        fakeBlocks++;
        bogusInstructions += instructions;
    }

    void addLoop(int instructions) {
        fakeLoops++;
        bogusInstructions += instructions;
    }

    void addConditional(int instructions) {
        fakeConditionals++;
        bogusInstructions += instructions;
    }

    public void add(FakeCodeStats other) {
        fakeBlocks += other.fakeBlocks;
        fakeLoops += other.fakeLoops;
        fakeConditionals += other.fakeConditionals;
        bogusInstructions += other.bogusInstructions;
    }

    @Override
    public String toString() {
        return "FakeCodeStats{blocks=" + fakeBlocks + ", loops=" + fakeLoops
                + ", conditionals=" + fakeConditionals + ", instructions=" + bogusInstructions + '}';
    }
}
