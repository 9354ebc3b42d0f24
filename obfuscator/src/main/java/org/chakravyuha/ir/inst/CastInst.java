package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.IntegerType;

/**
 * Integer width conversion: {@code zext}, {@code sext} or {@code trunc}.
 */
public final class CastInst extends Instruction {

    public CastInst(Opcode opcode, Value value, IntegerType destType, String name) {
        super(opcode, destType, name);
        if (!opcode.isCast()) {
            throw new IllegalArgumentException("Not a cast opcode: " + opcode);
        }
        addOperand(value);
    }

    public Value getValue() {
        return getOperand(0);
    }

    @Override
    public IntegerType getType() {
        return (IntegerType) super.getType();
    }

    @Override
    public String formatBody() {
        return getOpcode().getMnemonic() + " " + typed(getValue()) + " to " + getType().toIr();
    }
}
