package org.chakravyuha.flatten;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.inst.ReturnInst;
import org.chakravyuha.ir.inst.UnreachableInst;

/**
 * Whether blocks holding nothing but a {@code ret} or {@code unreachable} are
 * routed through the dispatcher.
 */
public enum TrivialBlockPolicy {
    /** Every non-entry block gets a state. */
    INCLUDE,
    /** Single-instruction return/unreachable blocks keep their direct edges. */
    EXCLUDE;

    public boolean isFlattened(BasicBlock block) {
        return this == INCLUDE || !isTrivial(block);
    }

    public static boolean isTrivial(BasicBlock block) {
        if (block.size() != 1) {
            return false;
        }
        Instruction only = block.getFirstInstruction();
        return only instanceof ReturnInst || only instanceof UnreachableInst;
    }
}
