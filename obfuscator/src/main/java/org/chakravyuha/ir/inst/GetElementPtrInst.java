package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.PointerType;
import org.chakravyuha.ir.type.Type;

/**
 * Single-index address arithmetic: {@code base + index * sizeof(elementType)}.
 */
public final class GetElementPtrInst extends Instruction {

    private final Type elementType;

    public GetElementPtrInst(Type elementType, Value base, Value index, String name) {
        super(Opcode.GEP, PointerType.PTR, name);
        this.elementType = elementType;
        addOperand(base);
        addOperand(index);
    }

    public Type getElementType() {
        return elementType;
    }

    public Value getBase() {
        return getOperand(0);
    }

    public Value getIndex() {
        return getOperand(1);
    }

    @Override
    public String formatBody() {
        return "getelementptr " + elementType.toIr() + ", " + typed(getBase()) + ", " + typed(getIndex());
    }
}
