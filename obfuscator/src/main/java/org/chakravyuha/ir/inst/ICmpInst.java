package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.IntegerType;

public final class ICmpInst extends Instruction {

    public enum Predicate {
        EQ, NE, UGT, UGE, ULT, ULE, SGT, SGE, SLT, SLE;

        public String getMnemonic() {
            return name().toLowerCase();
        }

        public static Predicate fromMnemonic(String mnemonic) {
            for (Predicate p : values()) {
                if (p.getMnemonic().equals(mnemonic)) {
                    return p;
                }
            }
            return null;
        }

        public boolean test(long lhs, long rhs) {
            switch (this) {
                case EQ:
                    return lhs == rhs;
                case NE:
                    return lhs != rhs;
                case UGT:
                    return Long.compareUnsigned(lhs, rhs) > 0;
                case UGE:
                    return Long.compareUnsigned(lhs, rhs) >= 0;
                case ULT:
                    return Long.compareUnsigned(lhs, rhs) < 0;
                case ULE:
                    return Long.compareUnsigned(lhs, rhs) <= 0;
                case SGT:
                    return lhs > rhs;
                case SGE:
                    return lhs >= rhs;
                case SLT:
                    return lhs < rhs;
                case SLE:
                    return lhs <= rhs;
                default:
                    throw new IllegalStateException("Unknown predicate " + this);
            }
        }
    }

    private final Predicate predicate;

    public ICmpInst(Predicate predicate, Value lhs, Value rhs, String name) {
        super(Opcode.ICMP, IntegerType.I1, name);
        if (!lhs.getType().equals(rhs.getType())) {
            throw new IllegalArgumentException("Operand types differ: " + lhs.getType() + " vs " + rhs.getType());
        }
        this.predicate = predicate;
        addOperand(lhs);
        addOperand(rhs);
    }

    public Predicate getPredicate() {
        return predicate;
    }

    public Value getLhs() {
        return getOperand(0);
    }

    public Value getRhs() {
        return getOperand(1);
    }

    @Override
    public String formatBody() {
        return "icmp " + predicate.getMnemonic() + " " + typed(getLhs()) + ", " + getRhs().getReference();
    }
}
