package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Last instruction of a block. Target blocks are ordinary operands, which is
 * what makes predecessor sets derivable from use-lists.
 */
public abstract class TerminatorInst extends Instruction {

    protected TerminatorInst(Opcode opcode, Type type, String name) {
        super(opcode, type, name);
    }

    /**
     * @return target blocks in operand order, duplicates included
     */
    public List<BasicBlock> getSuccessors() {
        List<BasicBlock> successors = new ArrayList<>();
        for (Value operand : getOperands()) {
            if (operand instanceof BasicBlock) {
                successors.add((BasicBlock) operand);
            }
        }
        return successors;
    }

    public int getNumSuccessors() {
        return getSuccessors().size();
    }

    public BasicBlock getSuccessor(int index) {
        return getSuccessors().get(index);
    }

    /**
     * Redirects every edge to {@code from} so it targets {@code to}.
     */
    public void replaceSuccessor(BasicBlock from, BasicBlock to) {
        for (int i = 0; i < getNumOperands(); i++) {
            if (getOperand(i) == from) {
                setOperand(i, to);
            }
        }
    }
}
