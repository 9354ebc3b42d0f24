package org.chakravyuha.flatten;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.inst.AllocaInst;
import org.chakravyuha.ir.inst.BranchInst;
import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.inst.InvokeInst;
import org.chakravyuha.ir.inst.LoadInst;
import org.chakravyuha.ir.inst.ReturnInst;
import org.chakravyuha.ir.inst.SwitchInst;
import org.chakravyuha.ir.inst.TerminatorInst;
import org.chakravyuha.ir.inst.UnreachableInst;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides, before anything is mutated, whether a function can be flattened.
 * The decision covers the whole function: one unsupported construct anywhere
 * rejects it.
 */
public final class EligibilityChecker {

    public boolean isEligible(Function function) {
        return !check(function).isPresent();
    }

    /**
     * @return the reason the function must be skipped, or empty if it is eligible
     */
    public Optional<SkipReason> check(Function function) {
        if (function.isDeclaration() || function.isIntrinsic()) {
            return Optional.of(SkipReason.DECLARATION);
        }
        if (function.size() < 2) {
            return Optional.of(SkipReason.TOO_SMALL);
        }
        Set<BasicBlock> unwindTargets = new HashSet<>();
        for (BasicBlock bb : function.getBlocks()) {
            if (bb.getTerminator() instanceof InvokeInst) {
                unwindTargets.add(((InvokeInst) bb.getTerminator()).getUnwindDest());
            }
        }
        for (BasicBlock bb : function.getBlocks()) {
            TerminatorInst term = bb.getTerminator();
            if (bb.isLandingPad() || unwindTargets.contains(bb) || term instanceof InvokeInst) {
                return Optional.of(SkipReason.EXCEPTION_HANDLING);
            }
            if (!isSupportedTerminator(term)) {
                return Optional.of(SkipReason.UNSUPPORTED_TERMINATOR);
            }
        }
        if (containsDispatcher(function)) {
            return Optional.of(SkipReason.ALREADY_FLATTENED);
        }
        return Optional.empty();
    }

    static boolean isSupportedTerminator(TerminatorInst term) {
        return term instanceof BranchInst || term instanceof SwitchInst
                || term instanceof ReturnInst || term instanceof UnreachableInst;
    }

    /**
     * Matches a block made of a load from the entry alloca named
     * {@value StateDispatchBuilder#STATE_SLOT_NAME} and a switch on the loaded
     * value whose default block only traps, the shape every dispatcher has.
     * The name keeps a hand-written table switch on a local from matching.
     */
    static boolean containsDispatcher(Function function) {
        BasicBlock entry = function.getEntryBlock();
        for (BasicBlock bb : function.getBlocks()) {
            if (bb.size() != 2) {
                continue;
            }
            Instruction first = bb.getFirstInstruction();
            Instruction last = bb.getLastInstruction();
            if (!(first instanceof LoadInst) || !(last instanceof SwitchInst)) {
                continue;
            }
            LoadInst load = (LoadInst) first;
            SwitchInst dispatch = (SwitchInst) last;
            BasicBlock defaultDest = dispatch.getDefaultDest();
            if (dispatch.getCondition() == load
                    && defaultDest.size() == 1 && defaultDest.getFirstInstruction() instanceof UnreachableInst
                    && load.getPointer() instanceof AllocaInst
                    && ((AllocaInst) load.getPointer()).getParent() == entry
                    && StateDispatchBuilder.STATE_SLOT_NAME.equals(((AllocaInst) load.getPointer()).getName())) {
                return true;
            }
        }
        return false;
    }
}
