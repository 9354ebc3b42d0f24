package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.VoidType;

public final class ReturnInst extends TerminatorInst {

    public ReturnInst() {
        super(Opcode.RET, VoidType.VOID, null);
    }

    public ReturnInst(Value value) {
        super(Opcode.RET, VoidType.VOID, null);
        addOperand(value);
    }

    public boolean hasValue() {
        return getNumOperands() == 1;
    }

    public Value getValue() {
        return hasValue() ? getOperand(0) : null;
    }

    @Override
    public String formatBody() {
        return hasValue() ? "ret " + typed(getValue()) : "ret void";
    }
}
