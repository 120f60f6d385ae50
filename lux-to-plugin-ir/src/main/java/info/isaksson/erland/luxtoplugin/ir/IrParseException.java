package info.isaksson.erland.luxtoplugin.ir;

import java.io.IOException;

/**
 * The IR document could not be read: malformed JSON or a shape that does not bind to the IR
 * model. Line and column are 1-based; 0 when unknown.
 */
public final class IrParseException extends IOException {

    private final int line;
    private final int column;
    private final String detail;

    public IrParseException(int line, int column, String detail, Throwable cause) {
        super("Parse error at " + line + ":" + column + ": " + detail, cause);
        this.line = line;
        this.column = column;
        this.detail = detail;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    /** Message without the location prefix. */
    public String detail() {
        return detail;
    }
}
