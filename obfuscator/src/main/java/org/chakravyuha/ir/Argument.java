package org.chakravyuha.ir;

import org.chakravyuha.ir.type.Type;

public final class Argument extends Value {

    private final Function parent;
    private final int index;

    Argument(Type type, String name, Function parent, int index) {
        super(type, name);
        this.parent = parent;
        this.index = index;
    }

    public Function getParent() {
        return parent;
    }

    public int getIndex() {
        return index;
    }
}
