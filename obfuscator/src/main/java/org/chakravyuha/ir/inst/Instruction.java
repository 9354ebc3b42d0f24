package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.User;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.Type;

import java.util.List;
import java.util.stream.Collectors;

public abstract class Instruction extends User {

    private final Opcode opcode;
    private BasicBlock parent;

    protected Instruction(Opcode opcode, Type type, String name) {
        super(type, name);
        this.opcode = opcode;
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public BasicBlock getParent() {
        return parent;
    }

    /**
     * Maintained by {@link BasicBlock}; not meant to be called directly.
     */
    public void setParent(BasicBlock parent) {
        this.parent = parent;
    }

    public Function getFunction() {
        return parent == null ? null : parent.getParent();
    }

    public boolean isTerminator() {
        return opcode.isTerminator();
    }

    public boolean producesValue() {
        return !getType().isVoid();
    }

    public void insertBefore(Instruction position) {
        position.getParent().insertBefore(this, position);
    }

    public void insertAfter(Instruction position) {
        position.getParent().insertAfter(this, position);
    }

    public void removeFromParent() {
        if (parent != null) {
            parent.remove(this);
        }
    }

    /**
     * Unlinks the instruction and drops its operands. The value must be dead.
     */
    public void eraseFromParent() {
        if (hasUses()) {
            throw new IllegalStateException("Cannot erase " + getReference() + ": still has " + getNumUses() + " uses");
        }
        removeFromParent();
        dropAllOperands();
    }

    public Instruction getNextInstruction() {
        if (parent == null) {
            return null;
        }
        List<Instruction> insts = parent.getInstructions();
        int index = insts.indexOf(this);
        return index + 1 < insts.size() ? insts.get(index + 1) : null;
    }

    /**
     * @return the instruction text after the {@code %name = } prefix
     */
    public abstract String formatBody();

    protected static String typed(Value value) {
        return value.getType().toIr() + " " + value.getReference();
    }

    protected static String typedList(List<Value> values) {
        return values.stream().map(Instruction::typed).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return producesValue() ? getReference() + " = " + formatBody() : formatBody();
    }
}
