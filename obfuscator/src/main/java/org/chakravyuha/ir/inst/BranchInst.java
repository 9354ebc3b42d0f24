package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.VoidType;

/**
 * {@code br label %dest} or {@code br i1 %cond, label %then, label %else}.
 */
public final class BranchInst extends TerminatorInst {

    public BranchInst(BasicBlock dest) {
        super(Opcode.BR, VoidType.VOID, null);
        addOperand(dest);
    }

    public BranchInst(Value condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        super(Opcode.BR, VoidType.VOID, null);
        addOperand(condition);
        addOperand(thenBlock);
        addOperand(elseBlock);
    }

    public boolean isConditional() {
        return getNumOperands() == 3;
    }

    public boolean isUnconditional() {
        return getNumOperands() == 1;
    }

    public Value getCondition() {
        if (!isConditional()) {
            throw new IllegalStateException("Unconditional branch has no condition");
        }
        return getOperand(0);
    }

    public BasicBlock getThenBlock() {
        return (BasicBlock) getOperand(isConditional() ? 1 : 0);
    }

    public BasicBlock getElseBlock() {
        if (!isConditional()) {
            throw new IllegalStateException("Unconditional branch has no else block");
        }
        return (BasicBlock) getOperand(2);
    }

    @Override
    public String formatBody() {
        if (isConditional()) {
            return "br " + typed(getCondition()) + ", label " + getThenBlock().getReference()
                    + ", label " + getElseBlock().getReference();
        }
        return "br label " + getThenBlock().getReference();
    }
}
