package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Operands are stored as {@code [value0, block0, value1, block1, ...]}.
 */
public final class PhiInst extends Instruction {

    public PhiInst(Type type, String name) {
        super(Opcode.PHI, type, name);
    }

    public void addIncoming(Value value, BasicBlock block) {
        if (!value.getType().equals(getType())) {
            throw new IllegalArgumentException("PHI incoming value must be " + getType() + ", got " + value.getType());
        }
        addOperand(value);
        addOperand(block);
    }

    public int getNumIncoming() {
        return getNumOperands() / 2;
    }

    public Value getIncomingValue(int index) {
        return getOperand(index * 2);
    }

    public BasicBlock getIncomingBlock(int index) {
        return (BasicBlock) getOperand(index * 2 + 1);
    }

    public void setIncomingValue(int index, Value value) {
        setOperand(index * 2, value);
    }

    public void removeIncoming(int index) {
        removeOperand(index * 2 + 1);
        removeOperand(index * 2);
    }

    public List<BasicBlock> getIncomingBlocks() {
        List<BasicBlock> blocks = new ArrayList<>();
        for (int i = 0; i < getNumIncoming(); i++) {
            blocks.add(getIncomingBlock(i));
        }
        return blocks;
    }

    @Override
    public String formatBody() {
        StringBuilder sb = new StringBuilder("phi ").append(getType().toIr()).append(' ');
        for (int i = 0; i < getNumIncoming(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append("[ ").append(getIncomingValue(i).getReference())
                    .append(", ").append(getIncomingBlock(i).getReference()).append(" ]");
        }
        return sb.toString();
    }
}
