package org.chakravyuha.ir.type;

import java.util.Objects;

public final class ArrayType extends Type {

    private final Type elementType;
    private final int length;

    public ArrayType(Type elementType, int length) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        if (length < 0) {
            throw new IllegalArgumentException("Array length must not be negative: " + length);
        }
        this.length = length;
    }

    public Type getElementType() {
        return elementType;
    }

    public int getLength() {
        return length;
    }

    @Override
    public boolean isArray() {
        return true;
    }

    @Override
    public String toIr() {
        return "[" + length + " x " + elementType.toIr() + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArrayType that = (ArrayType) o;
        return length == that.length && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, length);
    }
}
