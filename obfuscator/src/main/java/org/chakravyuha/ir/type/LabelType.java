package org.chakravyuha.ir.type;

/**
 * Type of basic blocks when they appear as branch operands.
 */
public final class LabelType extends Type {

    public static final LabelType LABEL = new LabelType();

    private LabelType() {
    }

    @Override
    public boolean isLabel() {
        return true;
    }

    @Override
    public String toIr() {
        return "label";
    }
}
