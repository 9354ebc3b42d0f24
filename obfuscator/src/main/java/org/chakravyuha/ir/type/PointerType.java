package org.chakravyuha.ir.type;

/**
 * Opaque pointer. The pointee type travels with the instruction that
 * dereferences it, never with the pointer.
 */
public final class PointerType extends Type {

    public static final PointerType PTR = new PointerType();

    private PointerType() {
    }

    @Override
    public boolean isPointer() {
        return true;
    }

    @Override
    public String toIr() {
        return "ptr";
    }
}
