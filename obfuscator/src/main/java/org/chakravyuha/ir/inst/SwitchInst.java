package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.ConstantInt;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.VoidType;

/**
 * Operands: {@code [condition, default, caseValue0, dest0, caseValue1, dest1, ...]}.
 */
public final class SwitchInst extends TerminatorInst {

    public SwitchInst(Value condition, BasicBlock defaultDest) {
        super(Opcode.SWITCH, VoidType.VOID, null);
        addOperand(condition);
        addOperand(defaultDest);
    }

    public void addCase(ConstantInt value, BasicBlock dest) {
        if (!value.getType().equals(getCondition().getType())) {
            throw new IllegalArgumentException("Case value must be " + getCondition().getType() + ", got " + value.getType());
        }
        for (int i = 0; i < getNumCases(); i++) {
            if (getCaseValue(i).getValue() == value.getValue()) {
                throw new IllegalArgumentException("Duplicate case value " + value.getValue());
            }
        }
        addOperand(value);
        addOperand(dest);
    }

    public Value getCondition() {
        return getOperand(0);
    }

    public BasicBlock getDefaultDest() {
        return (BasicBlock) getOperand(1);
    }

    public int getNumCases() {
        return (getNumOperands() - 2) / 2;
    }

    public ConstantInt getCaseValue(int index) {
        return (ConstantInt) getOperand(2 + index * 2);
    }

    public BasicBlock getCaseDest(int index) {
        return (BasicBlock) getOperand(3 + index * 2);
    }

    /**
     * @return the target taken for {@code value}
     */
    public BasicBlock findDest(long value) {
        for (int i = 0; i < getNumCases(); i++) {
            if (getCaseValue(i).getValue() == value) {
                return getCaseDest(i);
            }
        }
        return getDefaultDest();
    }

    @Override
    public String formatBody() {
        StringBuilder sb = new StringBuilder("switch ")
                .append(typed(getCondition()))
                .append(", label ").append(getDefaultDest().getReference())
                .append(" [");
        for (int i = 0; i < getNumCases(); i++) {
            sb.append(' ').append(typed(getCaseValue(i)))
                    .append(", label ").append(getCaseDest(i).getReference());
        }
        return sb.append(" ]").toString();
    }
}
