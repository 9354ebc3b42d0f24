package org.chakravyuha.ir.type;

public final class VoidType extends Type {

    public static final VoidType VOID = new VoidType();

    private VoidType() {
    }

    @Override
    public boolean isVoid() {
        return true;
    }

    @Override
    public String toIr() {
        return "void";
    }
}
