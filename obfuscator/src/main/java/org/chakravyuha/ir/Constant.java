package org.chakravyuha.ir;

import org.chakravyuha.ir.type.Type;

public abstract class Constant extends Value {

    protected Constant(Type type) {
        super(type, null);
    }
}
