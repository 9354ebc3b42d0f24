package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.VoidType;

public final class StoreInst extends Instruction {

    private final boolean volatileAccess;

    public StoreInst(Value value, Value pointer, boolean volatileAccess) {
        super(Opcode.STORE, VoidType.VOID, null);
        this.volatileAccess = volatileAccess;
        addOperand(value);
        addOperand(pointer);
    }

    public Value getValue() {
        return getOperand(0);
    }

    public Value getPointer() {
        return getOperand(1);
    }

    public boolean isVolatile() {
        return volatileAccess;
    }

    @Override
    public String formatBody() {
        return "store " + (volatileAccess ? "volatile " : "") + typed(getValue()) + ", " + typed(getPointer());
    }
}
