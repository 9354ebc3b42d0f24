package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.Value;

public final class SelectInst extends Instruction {

    public SelectInst(Value condition, Value trueValue, Value falseValue, String name) {
        super(Opcode.SELECT, trueValue.getType(), name);
        if (!trueValue.getType().equals(falseValue.getType())) {
            throw new IllegalArgumentException("Select arms differ: " + trueValue.getType() + " vs " + falseValue.getType());
        }
        addOperand(condition);
        addOperand(trueValue);
        addOperand(falseValue);
    }

    public Value getCondition() {
        return getOperand(0);
    }

    public Value getTrueValue() {
        return getOperand(1);
    }

    public Value getFalseValue() {
        return getOperand(2);
    }

    @Override
    public String formatBody() {
        return "select " + typed(getCondition()) + ", " + typed(getTrueValue()) + ", " + typed(getFalseValue());
    }
}
