package org.chakravyuha.ir;

import org.chakravyuha.ir.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public abstract class Value {

    private final Type type;
    private String name;

    // who uses me
    private final List<Use> uses = new ArrayList<>();

    protected Value(Type type, String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
    }

    public Type getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return how an operand referring to this value is spelled in IR text
     */
    public String getReference() {
        return "%" + name;
    }

    public List<Use> getUses() {
        return Collections.unmodifiableList(uses);
    }

    public boolean hasUses() {
        return !uses.isEmpty();
    }

    public int getNumUses() {
        return uses.size();
    }

    /**
     * Redirects every use of this value to {@code replacement}. The use-list is
     * snapshotted first, so redirecting never invalidates the iteration.
     */
    public void replaceAllUsesWith(Value replacement) {
        Objects.requireNonNull(replacement, "replacement");
        if (replacement == this) {
            return;
        }
        for (Use use : new ArrayList<>(uses)) {
            use.set(replacement);
        }
    }

    void addUse(Use use) {
        uses.add(use);
    }

    void removeUse(User user, int operandIndex) {
        for (int i = 0; i < uses.size(); i++) {
            Use use = uses.get(i);
            if (use.getUser() == user && use.getOperandIndex() == operandIndex) {
                uses.remove(i);
                return;
            }
        }
    }

    Use findUse(User user, int operandIndex) {
        for (Use use : uses) {
            if (use.getUser() == user && use.getOperandIndex() == operandIndex) {
                return use;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return type.toIr() + " " + getReference();
    }
}
