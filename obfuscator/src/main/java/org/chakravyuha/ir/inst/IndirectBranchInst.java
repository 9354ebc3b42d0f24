package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.VoidType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Jump to a computed address; {@code destinations} lists every possible target.
 */
public final class IndirectBranchInst extends TerminatorInst {

    public IndirectBranchInst(Value address, List<BasicBlock> destinations) {
        super(Opcode.INDIRECTBR, VoidType.VOID, null);
        addOperand(address);
        for (BasicBlock dest : destinations) {
            addOperand(dest);
        }
    }

    public Value getAddress() {
        return getOperand(0);
    }

    @Override
    public String formatBody() {
        return "indirectbr " + typed(getAddress()) + ", [" + getSuccessors().stream()
                .map(b -> "label " + b.getReference())
                .collect(Collectors.joining(", ")) + "]";
    }
}
