package org.chakravyuha.ir.parse;

final class Token {

    enum Kind {
        WORD,
        LOCAL,
        GLOBAL,
        INT,
        STRING,
        CSTRING,
        PUNCT
    }

    private final Kind kind;
    private final String text;
    private final byte[] data;

    Token(Kind kind, String text) {
        this(kind, text, null);
    }

    Token(Kind kind, String text, byte[] data) {
        this.kind = kind;
        this.text = text;
        this.data = data;
    }

    Kind getKind() {
        return kind;
    }

    String getText() {
        return text;
    }

    byte[] getData() {
        return data;
    }

    boolean is(Kind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    boolean isPunct(char c) {
        return kind == Kind.PUNCT && text.charAt(0) == c;
    }

    @Override
    public String toString() {
        switch (kind) {
            case LOCAL:
                return "%" + text;
            case GLOBAL:
                return "@" + text;
            case STRING:
                return "\"" + text + "\"";
            case CSTRING:
                return "c\"" + text + "\"";
            default:
                return text;
        }
    }
}
