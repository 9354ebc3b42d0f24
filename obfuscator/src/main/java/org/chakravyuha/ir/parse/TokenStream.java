package org.chakravyuha.ir.parse;

import java.util.List;

/**
 * Cursor over the tokens of one logical line.
 */
final class TokenStream {

    private final List<Token> tokens;
    private final int lineNumber;
    private final String line;
    private int pos;

    TokenStream(List<Token> tokens, int lineNumber, String line) {
        this.tokens = tokens;
        this.lineNumber = lineNumber;
        this.line = line;
    }

    boolean atEnd() {
        return pos >= tokens.size();
    }

    Token peek() {
        return atEnd() ? null : tokens.get(pos);
    }

    Token peek(int ahead) {
        return pos + ahead < tokens.size() ? tokens.get(pos + ahead) : null;
    }

    Token next() throws IrParseException {
        if (atEnd()) {
            throw error("Unexpected end of line");
        }
        return tokens.get(pos++);
    }

    void skipOne() {
        if (!atEnd()) {
            pos++;
        }
    }

    void skipRest() {
        pos = tokens.size();
    }

    boolean peekWord(String word) {
        Token t = peek();
        return t != null && t.is(Token.Kind.WORD, word);
    }

    boolean peekKind(Token.Kind kind) {
        Token t = peek();
        return t != null && t.getKind() == kind;
    }

    boolean peekPunct(char c) {
        Token t = peek();
        return t != null && t.isPunct(c);
    }

    boolean acceptWord(String word) {
        if (peekWord(word)) {
            pos++;
            return true;
        }
        return false;
    }

    boolean acceptPunct(char c) {
        if (peekPunct(c)) {
            pos++;
            return true;
        }
        return false;
    }

    void expectWord(String word) throws IrParseException {
        if (!acceptWord(word)) {
            throw error("Expected '" + word + "' but found " + describe(peek()));
        }
    }

    void expectPunct(char c) throws IrParseException {
        if (!acceptPunct(c)) {
            throw error("Expected '" + c + "' but found " + describe(peek()));
        }
    }

    String expect(Token.Kind kind) throws IrParseException {
        Token t = peek();
        if (t == null || t.getKind() != kind) {
            throw error("Expected " + kind.name().toLowerCase() + " but found " + describe(t));
        }
        pos++;
        return t.getText();
    }

    void expectEnd() throws IrParseException {
        if (!atEnd()) {
            throw error("Unexpected " + describe(peek()));
        }
    }

    IrParseException error(String message) {
        return new IrParseException(message, lineNumber, line);
    }

    IrParseException error(String message, Throwable cause) {
        return new IrParseException(message, lineNumber, line, cause);
    }

    int getLineNumber() {
        return lineNumber;
    }

    private static String describe(Token t) {
        return t == null ? "end of line" : "'" + t + "'";
    }
}
