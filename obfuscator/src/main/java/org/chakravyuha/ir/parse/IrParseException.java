package org.chakravyuha.ir.parse;

/**
 * Malformed IR text. Carries the 1-based line number and the offending line
 * when they are known.
 */
public class IrParseException extends Exception {

    private final int lineNumber;
    private final String line;

    public IrParseException(String message) {
        super(message);
        this.lineNumber = -1;
        this.line = null;
    }

    public IrParseException(String message, int lineNumber, String line) {
        super(formatMessage(message, lineNumber, line));
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public IrParseException(String message, int lineNumber, String line, Throwable cause) {
        super(formatMessage(message, lineNumber, line), cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /**
     * @return the 1-based line number, or -1 if the error is not tied to a line
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }

    private static String formatMessage(String message, int lineNumber, String line) {
        StringBuilder sb = new StringBuilder(message);
        if (lineNumber >= 0) {
            sb.append(" (line ").append(lineNumber).append(")");
        }
        if (line != null && !line.trim().isEmpty()) {
            sb.append("\n  -> ").append(line.trim());
        }
        return sb.toString();
    }
}
