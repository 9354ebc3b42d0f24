package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.type.VoidType;

public final class UnreachableInst extends TerminatorInst {

    public UnreachableInst() {
        super(Opcode.UNREACHABLE, VoidType.VOID, null);
    }

    @Override
    public String formatBody() {
        return "unreachable";
    }
}
