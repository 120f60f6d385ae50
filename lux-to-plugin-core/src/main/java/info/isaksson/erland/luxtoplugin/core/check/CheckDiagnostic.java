package info.isaksson.erland.luxtoplugin.core.check;

import info.isaksson.erland.luxtoplugin.ir.IrSourceRef;

import java.util.Objects;

/** One finding of {@link IrChecker}, printed as {@code error[CODE]: message at LINE:COL}. */
public final class CheckDiagnostic {

    public enum Severity { ERROR, WARNING }

    public static final String DUPLICATE_ITEM = "E0001";
    public static final String VISITOR_WITHOUT_PARAMS = "E0002";
    public static final String DUPLICATE_HOOK = "E0003";
    public static final String MISSING_UNIT = "E0004";
    public static final String UNSUPPORTED_CONSTRUCT = "E0100";
    public static final String PATTERN_LOWERING = "E0101";

    public final Severity severity;
    public final String code;
    public final String message;
    /** Null when the IR carries no location for the item. */
    public final IrSourceRef location;

    public CheckDiagnostic(Severity severity, String code, String message, IrSourceRef location) {
        if (severity == null) throw new IllegalArgumentException("severity must not be null");
        if (code == null) throw new IllegalArgumentException("code must not be null");
        this.severity = severity;
        this.code = code;
        this.message = message == null ? "" : message;
        this.location = location;
    }

    public static CheckDiagnostic error(String code, String message, IrSourceRef location) {
        return new CheckDiagnostic(Severity.ERROR, code, message, location);
    }

    public static CheckDiagnostic warning(String code, String message, IrSourceRef location) {
        return new CheckDiagnostic(Severity.WARNING, code, message, location);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public String format() {
        String prefix = (isError() ? "error[" : "warning[") + code + "]: " + message;
        return location == null ? prefix : prefix + " at " + location.line + ":" + location.column;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CheckDiagnostic)) return false;
        CheckDiagnostic that = (CheckDiagnostic) o;
        return severity == that.severity && code.equals(that.code) && message.equals(that.message)
                && Objects.equals(location, that.location);
    }

    @Override public int hashCode() {
        return Objects.hash(severity, code, message, location);
    }

    @Override
    public String toString() {
        return format();
    }
}
