package org.chakravyuha.ir.analysis;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.inst.Instruction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Block dominance over the part of a function reachable from its entry,
 * computed with the iterative set-intersection formulation.
 */
public final class DominatorTree {

    private final Function function;
    private final Map<BasicBlock, Set<BasicBlock>> dominators = new HashMap<>();
    private final Map<BasicBlock, BasicBlock> immediateDominators = new HashMap<>();

    public DominatorTree(Function function) {
        this.function = function;
        compute();
    }

    public Function getFunction() {
        return function;
    }

    /**
     * @return blocks reachable from the entry, in breadth-first order
     */
    public static Set<BasicBlock> reachableBlocks(Function function) {
        Set<BasicBlock> reachable = new LinkedHashSet<>();
        BasicBlock entry = function.getEntryBlock();
        if (entry == null) {
            return reachable;
        }
        ArrayDeque<BasicBlock> queue = new ArrayDeque<>();
        reachable.add(entry);
        queue.add(entry);
        while (!queue.isEmpty()) {
            for (BasicBlock succ : queue.poll().getSuccessors()) {
                if (reachable.add(succ)) {
                    queue.add(succ);
                }
            }
        }
        return reachable;
    }

    public boolean isReachable(BasicBlock block) {
        return dominators.containsKey(block);
    }

    /**
     * @return true if every path from the entry to {@code b} passes through
     * {@code a}; unreachable blocks are dominated by everything
     */
    public boolean dominates(BasicBlock a, BasicBlock b) {
        Set<BasicBlock> doms = dominators.get(b);
        return doms == null || doms.contains(a);
    }

    /**
     * Instruction-level dominance: same block compares positions, otherwise
     * block dominance decides.
     */
    public boolean dominates(Instruction def, Instruction use) {
        BasicBlock defBlock = def.getParent();
        BasicBlock useBlock = use.getParent();
        if (defBlock == useBlock) {
            return defBlock.indexOf(def) < defBlock.indexOf(use);
        }
        return dominates(defBlock, useBlock);
    }

    public BasicBlock getImmediateDominator(BasicBlock block) {
        return immediateDominators.get(block);
    }

    public Set<BasicBlock> getDominators(BasicBlock block) {
        Set<BasicBlock> doms = dominators.get(block);
        return doms == null ? Collections.emptySet() : Collections.unmodifiableSet(doms);
    }

    private void compute() {
        BasicBlock entry = function.getEntryBlock();
        if (entry == null) {
            return;
        }
        List<BasicBlock> blocks = new ArrayList<>(reachableBlocks(function));
        for (BasicBlock bb : blocks) {
            if (bb == entry) {
                dominators.put(bb, new HashSet<>(Collections.singleton(bb)));
            } else {
                dominators.put(bb, new HashSet<>(blocks));
            }
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (BasicBlock bb : blocks) {
                if (bb == entry) {
                    continue;
                }
                Set<BasicBlock> newDom = new HashSet<>(blocks);
                for (BasicBlock pred : bb.getPredecessors()) {
                    Set<BasicBlock> predDom = dominators.get(pred);
                    if (predDom != null) {
                        newDom.retainAll(predDom);
                    }
                }
                newDom.add(bb);
                if (!newDom.equals(dominators.get(bb))) {
                    dominators.put(bb, newDom);
                    changed = true;
                }
            }
        }
        // the immediate dominator is the strict dominator with the largest dominator set
        for (BasicBlock bb : blocks) {
            BasicBlock idom = null;
            int best = -1;
            for (BasicBlock candidate : dominators.get(bb)) {
                if (candidate != bb && dominators.get(candidate).size() > best) {
                    best = dominators.get(candidate).size();
                    idom = candidate;
                }
            }
            if (idom != null) {
                immediateDominators.put(bb, idom);
            }
        }
    }
}
