package org.chakravyuha.ir.type;

/**
 * Base class of every IR type. Types are compared with {@link #equals(Object)};
 * scalar types are singletons, array types are structural.
 */
public abstract class Type {

    public boolean isVoid() {
        return false;
    }

    public boolean isInteger() {
        return false;
    }

    public boolean isPointer() {
        return false;
    }

    public boolean isLabel() {
        return false;
    }

    public boolean isArray() {
        return false;
    }

    /**
     * @return the textual spelling used by the IR printer and parser
     */
    public abstract String toIr();

    @Override
    public String toString() {
        return toIr();
    }
}
