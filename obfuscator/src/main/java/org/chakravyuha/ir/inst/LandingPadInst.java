package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.type.PointerType;

/**
 * Marks its block as an exception-recovery target.
 */
public final class LandingPadInst extends Instruction {

    public LandingPadInst(String name) {
        super(Opcode.LANDINGPAD, PointerType.PTR, name);
    }

    @Override
    public String formatBody() {
        return "landingpad ptr";
    }
}
