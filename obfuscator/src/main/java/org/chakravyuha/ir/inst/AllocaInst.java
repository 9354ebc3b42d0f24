package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.type.PointerType;
import org.chakravyuha.ir.type.Type;

/**
 * Function-local memory slot.
 */
public final class AllocaInst extends Instruction {

    private final Type allocatedType;

    public AllocaInst(Type allocatedType, String name) {
        super(Opcode.ALLOCA, PointerType.PTR, name);
        this.allocatedType = allocatedType;
    }

    public Type getAllocatedType() {
        return allocatedType;
    }

    @Override
    public String formatBody() {
        return "alloca " + allocatedType.toIr();
    }
}
