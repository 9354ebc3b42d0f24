package org.chakravyuha.ir.parse;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits one logical line of IR text into tokens. Comments start at {@code ;}.
 */
final class IrLexer {

    private static final String PUNCTUATION = "=,()[]{}:*<>";

    private IrLexer() {
    }

    static List<Token> tokenize(String text, int lineNumber) throws IrParseException {
        List<Token> tokens = new ArrayList<>();
        int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == ';') {
                break;
            } else if (c == 'c' && i + 1 < n && text.charAt(i + 1) == '"') {
                int end = closingQuote(text, i + 2, lineNumber);
                String raw = text.substring(i + 2, end);
                tokens.add(new Token(Token.Kind.CSTRING, raw, decode(raw, text, lineNumber)));
                i = end + 1;
            } else if (c == '"') {
                int end = closingQuote(text, i + 1, lineNumber);
                tokens.add(new Token(Token.Kind.STRING, text.substring(i + 1, end)));
                i = end + 1;
            } else if (c == '%' || c == '@') {
                int start = ++i;
                while (i < n && isNameChar(text.charAt(i))) {
                    i++;
                }
                if (i == start) {
                    throw new IrParseException("Expected a name after '" + c + "'", lineNumber, text);
                }
                tokens.add(new Token(c == '%' ? Token.Kind.LOCAL : Token.Kind.GLOBAL, text.substring(start, i)));
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < n && Character.isDigit(text.charAt(i + 1)))) {
                int start = i++;
                while (i < n && Character.isDigit(text.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(Token.Kind.INT, text.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_' || c == '!' || c == '#' || c == '.') {
                int start = i++;
                while (i < n && isNameChar(text.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(Token.Kind.WORD, text.substring(start, i)));
            } else if (PUNCTUATION.indexOf(c) >= 0) {
                tokens.add(new Token(Token.Kind.PUNCT, String.valueOf(c)));
                i++;
            } else {
                throw new IrParseException("Unexpected character '" + c + "'", lineNumber, text);
            }
        }
        return tokens;
    }

    /**
     * Parses an integer literal as a 64-bit two's complement value; literals
     * above {@code Long.MAX_VALUE} wrap.
     */
    static long parseLong(String literal) {
        try {
            return Long.parseLong(literal);
        } catch (NumberFormatException e) {
            return new BigInteger(literal).longValue();
        }
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$';
    }

    private static int closingQuote(String text, int from, int lineNumber) throws IrParseException {
        int end = text.indexOf('"', from);
        if (end < 0) {
            throw new IrParseException("Unterminated string literal", lineNumber, text);
        }
        return end;
    }

    private static byte[] decode(String raw, String line, int lineNumber) throws IrParseException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '\\') {
                out.write((byte) c);
                continue;
            }
            if (i + 1 < raw.length() && raw.charAt(i + 1) == '\\') {
                out.write('\\');
                i++;
                continue;
            }
            if (i + 2 >= raw.length()) {
                throw new IrParseException("Truncated escape in string literal", lineNumber, line);
            }
            try {
                out.write(Integer.parseInt(raw.substring(i + 1, i + 3), 16));
            } catch (NumberFormatException e) {
                throw new IrParseException("Bad escape \\" + raw.substring(i + 1, i + 3), lineNumber, line, e);
            }
            i += 2;
        }
        return out.toByteArray();
    }
}
