package info.isaksson.erland.luxtoplugin.emitter;

/**
 * Target ecosystems the generator emits source text for.
 */
public enum Backend {
    /** JavaScript Babel plugin. */
    BABEL("babel", "index.js", "  "),
    /** Rust SWC plugin. */
    SWC("swc", "lib.rs", "    ");

    public final String cliValue;
    public final String outputFileName;
    public final String indentUnit;

    Backend(String cliValue, String outputFileName, String indentUnit) {
        this.cliValue = cliValue;
        this.outputFileName = outputFileName;
        this.indentUnit = indentUnit;
    }

    public static Backend parseCli(String v) {
        if (v == null) throw new IllegalArgumentException("Backend must not be null");
        String s = v.trim().toLowerCase();
        for (Backend b : values()) {
            if (b.cliValue.equals(s)) return b;
        }
        throw new IllegalArgumentException("Invalid backend: " + v + " (expected one of: babel|swc)");
    }
}
