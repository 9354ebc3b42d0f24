package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.Type;

public final class LoadInst extends Instruction {

    private final boolean volatileAccess;

    public LoadInst(Type type, Value pointer, boolean volatileAccess, String name) {
        super(Opcode.LOAD, type, name);
        this.volatileAccess = volatileAccess;
        addOperand(pointer);
    }

    public Value getPointer() {
        return getOperand(0);
    }

    public boolean isVolatile() {
        return volatileAccess;
    }

    @Override
    public String formatBody() {
        return "load " + (volatileAccess ? "volatile " : "") + getType().toIr() + ", " + typed(getPointer());
    }
}
