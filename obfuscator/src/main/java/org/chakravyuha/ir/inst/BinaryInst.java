package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.Value;

public final class BinaryInst extends Instruction {

    public BinaryInst(Opcode opcode, Value lhs, Value rhs, String name) {
        super(opcode, lhs.getType(), name);
        if (!opcode.isBinary()) {
            throw new IllegalArgumentException("Not a binary opcode: " + opcode);
        }
        if (!lhs.getType().equals(rhs.getType())) {
            throw new IllegalArgumentException("Operand types differ: " + lhs.getType() + " vs " + rhs.getType());
        }
        addOperand(lhs);
        addOperand(rhs);
    }

    public Value getLhs() {
        return getOperand(0);
    }

    public Value getRhs() {
        return getOperand(1);
    }

    @Override
    public String formatBody() {
        return getOpcode().getMnemonic() + " " + typed(getLhs()) + ", " + getRhs().getReference();
    }
}
