package org.chakravyuha.ir;

import java.util.Objects;

/**
 * One edge of the def-use graph: operand {@code operandIndex} of {@code user}
 * refers to {@code usee}. Both ends keep it in sync through {@link User#setOperand}.
 */
public final class Use {

    private final User user;
    private final Value usee;
    private int operandIndex;

    Use(User user, Value usee, int operandIndex) {
        this.user = Objects.requireNonNull(user, "user");
        this.usee = Objects.requireNonNull(usee, "usee");
        this.operandIndex = operandIndex;
    }

    public User getUser() {
        return user;
    }

    public Value getUsee() {
        return usee;
    }

    public int getOperandIndex() {
        return operandIndex;
    }

    void setOperandIndex(int operandIndex) {
        this.operandIndex = operandIndex;
    }

    /**
     * Redirects this operand slot to {@code value}. The consumer keeps its
     * identity and position; this use record is dropped from the old value.
     */
    public void set(Value value) {
        user.setOperand(operandIndex, value);
    }

    @Override
    public String toString() {
        return "Use(" + user.getName() + " -> " + usee.getReference() + ", index=" + operandIndex + ")";
    }
}
