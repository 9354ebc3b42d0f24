package org.chakravyuha.ir;

import org.chakravyuha.ir.type.Type;

public final class UndefValue extends Constant {

    private UndefValue(Type type) {
        super(type);
    }

    public static UndefValue get(Type type) {
        return new UndefValue(type);
    }

    @Override
    public String getReference() {
        return "undef";
    }
}
