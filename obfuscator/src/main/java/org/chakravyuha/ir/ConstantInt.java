package org.chakravyuha.ir;

import org.chakravyuha.ir.type.IntegerType;

/**
 * Integer constant. Instances are not uniqued: each call site gets its own
 * object, so use-lists of constants stay short.
 */
public final class ConstantInt extends Constant {

    private final long value;

    private ConstantInt(IntegerType type, long value) {
        super(type);
        this.value = type.normalize(value);
    }

    public static ConstantInt get(IntegerType type, long value) {
        return new ConstantInt(type, value);
    }

    public static ConstantInt getTrue() {
        return new ConstantInt(IntegerType.I1, 1);
    }

    public static ConstantInt getFalse() {
        return new ConstantInt(IntegerType.I1, 0);
    }

    @Override
    public IntegerType getType() {
        return (IntegerType) super.getType();
    }

    public long getValue() {
        return value;
    }

    public boolean sameValue(ConstantInt other) {
        return other != null && other.getType().equals(getType()) && other.value == value;
    }

    @Override
    public String getReference() {
        if (getType() == IntegerType.I1) {
            return value != 0 ? "true" : "false";
        }
        return Long.toString(value);
    }
}
