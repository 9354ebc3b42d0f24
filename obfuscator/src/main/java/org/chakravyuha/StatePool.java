package org.chakravyuha;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Hands out the dispatcher state of each flattened block. States are positive
 * and unique within one pool; a pool is used for a single function.
 */
public final class StatePool {

    /**
     * Creates the pool for one function.
     */
    public interface Factory {
        StatePool create(Function function);
    }

    private final Map<BasicBlock, Integer> states = new LinkedHashMap<>();
    private final Set<Integer> usedStates = new HashSet<>();
    private final FastRandom random;
    private int next = 1;

    private StatePool(FastRandom random) {
        this.random = random;
    }

    /**
     * @return a pool yielding 1, 2, 3, ...
     */
    public static StatePool sequential() {
        return new StatePool(null);
    }

    /**
     * @return a pool yielding distinct pseudo-random positive states drawn from {@code seed}
     */
    public static StatePool scrambled(long seed) {
        return new StatePool(new FastRandom(seed));
    }

    public static Factory sequentialFactory() {
        return function -> sequential();
    }

    /**
     * Seeds each function's pool from {@code seed} and the function name, so a
     * function gets the same states no matter which order functions are visited in.
     */
    public static Factory scrambledFactory(long seed) {
        return function -> scrambled(new FastRandom(seed).fork(function.getName().hashCode()).nextLong());
    }

    public boolean isScrambled() {
        return random != null;
    }

    private int generateKey() {
        int key;
        do {
            key = random == null ? next++ : 1 + random.nextInt(Integer.MAX_VALUE);
        } while (usedStates.contains(key));
        usedStates.add(key);
        return key;
    }

    public int getState(BasicBlock block) {
        return states.computeIfAbsent(block, b -> generateKey());
    }
}
