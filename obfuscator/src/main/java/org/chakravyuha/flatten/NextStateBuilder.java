package org.chakravyuha.flatten;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.ConstantInt;
import org.chakravyuha.ir.IRBuilder;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.inst.BranchInst;
import org.chakravyuha.ir.inst.ICmpInst;
import org.chakravyuha.ir.inst.SwitchInst;
import org.chakravyuha.ir.inst.TerminatorInst;

import java.util.Map;
import java.util.Objects;

/**
 * Turns a terminator into the dispatcher state it selects:
 * <ul>
 *   <li>{@code br label %b}: the constant state of {@code b}</li>
 *   <li>{@code br i1 %c, label %t, label %f}: {@code select %c, state(t), state(f)}, only when both targets are flattened</li>
 *   <li>{@code switch}: a chain of {@code select (icmp eq %v, case)} folded over the cases, starting from the default's state</li>
 *   <li>{@code ret}, {@code unreachable}: never</li>
 * </ul>
 * A switch is folded only when every target is flattened, unless a default
 * state was supplied. In that mode cases whose target keeps a direct edge are
 * left out of the fold, and an unflattened default starts the fold at the
 * supplied state.
 */
public final class NextStateBuilder {

    private final Map<BasicBlock, Integer> ids;
    private final Integer defaultState;

    public NextStateBuilder(Map<BasicBlock, Integer> ids) {
        this(ids, null);
    }

    private NextStateBuilder(Map<BasicBlock, Integer> ids, Integer defaultState) {
        this.ids = Objects.requireNonNull(ids, "ids");
        this.defaultState = defaultState;
    }

    public static NextStateBuilder withDefaultState(Map<BasicBlock, Integer> ids, int defaultState) {
        return new NextStateBuilder(ids, defaultState);
    }

    /**
     * @return true if {@link #build} would produce a value; creates nothing
     */
    public boolean isExpressible(TerminatorInst term) {
        if (term instanceof BranchInst) {
            BranchInst br = (BranchInst) term;
            if (br.isUnconditional()) {
                return ids.containsKey(br.getThenBlock());
            }
            return ids.containsKey(br.getThenBlock()) && ids.containsKey(br.getElseBlock());
        }
        if (term instanceof SwitchInst) {
            SwitchInst sw = (SwitchInst) term;
            if (defaultState == null) {
                for (BasicBlock succ : sw.getSuccessors()) {
                    if (!ids.containsKey(succ)) {
                        return false;
                    }
                }
                return true;
            }
            for (BasicBlock succ : sw.getSuccessors()) {
                if (ids.containsKey(succ)) {
                    return true;
                }
            }
            return false;
        }
        return false;
    }

    /**
     * Emits the instructions computing the next state at the builder's
     * insertion point.
     *
     * @return the i32 next-state value, or {@code null} if the terminator is
     * not expressible (nothing is emitted then)
     */
    public Value build(TerminatorInst term, IRBuilder builder) {
        if (!isExpressible(term)) {
            return null;
        }
        if (term instanceof BranchInst) {
            BranchInst br = (BranchInst) term;
            if (br.isUnconditional()) {
                return stateOf(br.getThenBlock());
            }
            return builder.createSelect(br.getCondition(), stateOf(br.getThenBlock()),
                    stateOf(br.getElseBlock()), "cff.next");
        }
        SwitchInst sw = (SwitchInst) term;
        BasicBlock defaultDest = sw.getDefaultDest();
        Value acc = ids.containsKey(defaultDest) ? stateOf(defaultDest) : IRBuilder.getInt32(defaultState);
        for (int i = 0; i < sw.getNumCases(); i++) {
            BasicBlock dest = sw.getCaseDest(i);
            if (!ids.containsKey(dest)) {
                continue;
            }
            ConstantInt caseValue = sw.getCaseValue(i);
            Value matches = builder.createICmp(ICmpInst.Predicate.EQ, sw.getCondition(),
                    ConstantInt.get(caseValue.getType(), caseValue.getValue()), "cff.case.cmp");
            acc = builder.createSelect(matches, stateOf(dest), acc, "cff.case.select");
        }
        return acc;
    }

    private ConstantInt stateOf(BasicBlock block) {
        return IRBuilder.getInt32(ids.get(block));
    }
}
