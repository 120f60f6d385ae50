package info.isaksson.erland.luxtoplugin.emitter;

import info.isaksson.erland.luxtoplugin.ir.IrSourceRef;

/** A match pattern could not be lowered; names the innermost failing sub-pattern. */
public final class PatternLoweringException extends CodegenException {

    private final String subPattern;

    public PatternLoweringException(String subPattern, Backend backend, String reason) {
        this(subPattern, backend, reason, null);
    }

    private PatternLoweringException(String subPattern, Backend backend, String reason, IrSourceRef location) {
        super("PatternLoweringError(" + subPattern + ", " + backend.cliValue + ")"
                + (reason == null ? "" : ": " + reason), backend, location);
        this.subPattern = subPattern;
    }

    public String subPattern() {
        return subPattern;
    }

    @Override
    public CodegenException at(IrSourceRef where) {
        if (location() != null || where == null) return this;
        String d = detail();
        int colon = d.indexOf("): ");
        String reason = colon < 0 ? null : d.substring(colon + 3);
        PatternLoweringException e = new PatternLoweringException(subPattern, backend(), reason, where);
        e.setStackTrace(getStackTrace());
        return e;
    }
}
