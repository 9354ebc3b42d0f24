package org.chakravyuha.ir.inst;

public enum Opcode {
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    SDIV("sdiv"),
    UDIV("udiv"),
    SREM("srem"),
    UREM("urem"),
    AND("and"),
    OR("or"),
    XOR("xor"),
    SHL("shl"),
    LSHR("lshr"),
    ASHR("ashr"),
    ICMP("icmp"),
    ZEXT("zext"),
    SEXT("sext"),
    TRUNC("trunc"),
    SELECT("select"),
    ALLOCA("alloca"),
    LOAD("load"),
    STORE("store"),
    GEP("getelementptr"),
    CALL("call"),
    PHI("phi"),
    LANDINGPAD("landingpad"),
    BR("br", true),
    SWITCH("switch", true),
    RET("ret", true),
    UNREACHABLE("unreachable", true),
    INVOKE("invoke", true),
    INDIRECTBR("indirectbr", true),
    CALLBR("callbr", true);

    private final String mnemonic;
    private final boolean terminator;

    Opcode(String mnemonic) {
        this(mnemonic, false);
    }

    Opcode(String mnemonic, boolean terminator) {
        this.mnemonic = mnemonic;
        this.terminator = terminator;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    public boolean isTerminator() {
        return terminator;
    }

    public boolean isBinary() {
        return ordinal() <= ASHR.ordinal();
    }

    public boolean isCast() {
        return this == ZEXT || this == SEXT || this == TRUNC;
    }

    public static Opcode fromMnemonic(String mnemonic) {
        for (Opcode op : values()) {
            if (op.mnemonic.equals(mnemonic)) {
                return op;
            }
        }
        return null;
    }
}
