package info.isaksson.erland.luxtoplugin.emitter;

import info.isaksson.erland.luxtoplugin.ir.IrSourceRef;

/** A type, operator or node has no mapping for one backend. */
public final class UnsupportedConstructException extends CodegenException {

    private final String construct;

    public UnsupportedConstructException(String construct, Backend backend) {
        this(construct, backend, null);
    }

    public UnsupportedConstructException(String construct, Backend backend, IrSourceRef location) {
        super("UnsupportedConstruct(" + construct + ", " + backend.cliValue + ")", backend, location);
        this.construct = construct;
    }

    public String construct() {
        return construct;
    }

    @Override
    public CodegenException at(IrSourceRef where) {
        if (location() != null || where == null) return this;
        UnsupportedConstructException e = new UnsupportedConstructException(construct, backend(), where);
        e.setStackTrace(getStackTrace());
        return e;
    }
}
