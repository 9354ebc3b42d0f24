package org.chakravyuha.ir.type;

public final class IntegerType extends Type {

    public static final IntegerType I1 = new IntegerType(1);
    public static final IntegerType I8 = new IntegerType(8);
    public static final IntegerType I32 = new IntegerType(32);
    public static final IntegerType I64 = new IntegerType(64);

    private final int bits;

    private IntegerType(int bits) {
        this.bits = bits;
    }

    public static IntegerType of(int bits) {
        switch (bits) {
            case 1:
                return I1;
            case 8:
                return I8;
            case 32:
                return I32;
            case 64:
                return I64;
            default:
                throw new IllegalArgumentException("Unsupported integer width: " + bits);
        }
    }

    public int getBits() {
        return bits;
    }

    /**
     * Truncates {@code value} to this width and sign-extends it back to 64 bits.
     * {@code i1} is kept as 0/1 instead of 0/-1.
     */
    public long normalize(long value) {
        if (bits == 64) {
            return value;
        }
        if (bits == 1) {
            return value & 1L;
        }
        int shift = 64 - bits;
        return (value << shift) >> shift;
    }

    @Override
    public boolean isInteger() {
        return true;
    }

    @Override
    public String toIr() {
        return "i" + bits;
    }
}
