package org.chakravyuha.ir;

import org.chakravyuha.ir.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A value that consumes other values through an ordered operand list.
 */
public abstract class User extends Value {

    private final List<Value> operands = new ArrayList<>();

    protected User(Type type, String name) {
        super(type, name);
    }

    public int getNumOperands() {
        return operands.size();
    }

    public Value getOperand(int index) {
        return operands.get(index);
    }

    public List<Value> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    /**
     * Replaces operand {@code index} in place and moves the use record from the
     * old value to the new one.
     */
    public void setOperand(int index, Value value) {
        Objects.requireNonNull(value, "Operand value cannot be null");
        checkIndex(index);
        Value old = operands.get(index);
        if (old == value) {
            return;
        }
        old.removeUse(this, index);
        operands.set(index, value);
        value.addUse(new Use(this, value, index));
    }

    protected void addOperand(Value value) {
        Objects.requireNonNull(value, "Operand value cannot be null");
        operands.add(value);
        value.addUse(new Use(this, value, operands.size() - 1));
    }

    protected void removeOperand(int index) {
        checkIndex(index);
        operands.remove(index).removeUse(this, index);
        // shift the use records of every later operand down by one
        for (int i = index; i < operands.size(); i++) {
            Use use = operands.get(i).findUse(this, i + 1);
            if (use != null) {
                use.setOperandIndex(i);
            }
        }
    }

    /**
     * Drops every operand and its use record. Used when an instruction is erased.
     */
    public void dropAllOperands() {
        for (int i = 0; i < operands.size(); i++) {
            operands.get(i).removeUse(this, i);
        }
        operands.clear();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= operands.size()) {
            throw new IllegalArgumentException("Operand index " + index + " out of bounds for " + operands.size());
        }
    }
}
