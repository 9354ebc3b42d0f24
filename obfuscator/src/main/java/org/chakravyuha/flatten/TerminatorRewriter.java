package org.chakravyuha.flatten;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.IRBuilder;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.inst.TerminatorInst;

import java.util.ArrayList;
import java.util.List;

/**
 * Routes block exits through the dispatcher: every terminator with a
 * next-state value becomes {@code store next, %cff.state; br label %cff.dispatch}.
 * Terminators without one stay exactly as they are.
 */
public final class TerminatorRewriter {

    /**
     * @return the number of terminators replaced
     */
    public int rewrite(Function function, StateDispatchBuilder.StateDispatch dispatch) {
        NextStateBuilder nextState = new NextStateBuilder(dispatch.getIds());
        IRBuilder builder = new IRBuilder();
        List<BasicBlock> blocks = new ArrayList<>(function.getBlocks());
        int rewritten = 0;
        for (BasicBlock bb : blocks) {
            if (bb == function.getEntryBlock() || bb == dispatch.getDispatcher() || bb == dispatch.getDefaultBlock()) {
                continue;
            }
            TerminatorInst term = bb.getTerminator();
            if (term == null || !nextState.isExpressible(term)) {
                continue;
            }
            builder.positionBefore(term);
            Value next = nextState.build(term, builder);
            builder.createStore(next, dispatch.getStateSlot());
            builder.createBr(dispatch.getDispatcher());
            term.eraseFromParent();
            rewritten++;
        }
        return rewritten;
    }
}
