package org.chakravyuha.ir;

import org.chakravyuha.ir.type.PointerType;
import org.chakravyuha.ir.type.Type;

import java.util.Objects;

/**
 * Module-level storage. The value itself is the address, so its type is
 * always {@code ptr}; {@link #getValueType()} is the type of the contents.
 */
public final class GlobalVariable extends Value {

    private final Type valueType;
    private final Constant initializer;
    private final boolean constant;
    private final boolean privateLinkage;
    private IrModule parent;

    public GlobalVariable(String name, Type valueType, Constant initializer, boolean constant, boolean privateLinkage) {
        super(PointerType.PTR, name);
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.initializer = initializer;
        this.constant = constant;
        this.privateLinkage = privateLinkage;
    }

    public Type getValueType() {
        return valueType;
    }

    public Constant getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    public boolean isConstant() {
        return constant;
    }

    public boolean isPrivate() {
        return privateLinkage;
    }

    public IrModule getParent() {
        return parent;
    }

    void setParent(IrModule parent) {
        this.parent = parent;
    }

    @Override
    public String getReference() {
        return "@" + getName();
    }
}
