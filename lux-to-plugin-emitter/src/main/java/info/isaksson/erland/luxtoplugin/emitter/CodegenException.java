package info.isaksson.erland.luxtoplugin.emitter;

import info.isaksson.erland.luxtoplugin.ir.IrSourceRef;

/**
 * Backend-local code generation failure. It aborts the backend that raised it; the other
 * backend's pipeline is unaffected.
 */
public class CodegenException extends RuntimeException {

    private final Backend backend;
    private final IrSourceRef location;

    public CodegenException(String message, Backend backend) {
        this(message, backend, null);
    }

    public CodegenException(String message, Backend backend, IrSourceRef location) {
        super(message);
        this.backend = backend;
        this.location = location;
    }

    public Backend backend() {
        return backend;
    }

    /** Source location of the enclosing item, when known. */
    public IrSourceRef location() {
        return location;
    }

    /** This failure tagged with the enclosing item's location; already-located failures stay as they are. */
    public CodegenException at(IrSourceRef where) {
        if (location != null || where == null) return this;
        CodegenException e = new CodegenException(detail(), backend, where);
        e.setStackTrace(getStackTrace());
        return e;
    }

    @Override
    public String getMessage() {
        String m = super.getMessage();
        return location == null ? m : m + " at " + location;
    }

    /** Message without the location suffix. */
    public String detail() {
        return super.getMessage();
    }
}
