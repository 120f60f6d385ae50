package info.isaksson.erland.luxtoplugin.emitter;

/** Options for emitting plugin source from an IR program. */
public final class EmitterOptions {

    /** Overrides the top-level unit's name when set. */
    public final String pluginName;

    /** When true, outputs start with the two "generated" comment lines. */
    public final boolean includeHeader;

    /** When false, the Babel backend never emits the macro helper prelude. */
    public final boolean includeMacroShims;

    public EmitterOptions(String pluginName, boolean includeHeader, boolean includeMacroShims) {
        this.pluginName = (pluginName == null || pluginName.isBlank()) ? null : pluginName.trim();
        this.includeHeader = includeHeader;
        this.includeMacroShims = includeMacroShims;
    }

    public static EmitterOptions defaults() {
        return new EmitterOptions(null, true, true);
    }

    public EmitterOptions withPluginName(String name) {
        return new EmitterOptions(name, includeHeader, includeMacroShims);
    }

    public EmitterOptions withHeader(boolean include) {
        return new EmitterOptions(pluginName, include, includeMacroShims);
    }

    public EmitterOptions withMacroShims(boolean include) {
        return new EmitterOptions(pluginName, includeHeader, include);
    }

    @Override
    public String toString() {
        return "EmitterOptions{" +
                "pluginName='" + pluginName + '\'' +
                ", includeHeader=" + includeHeader +
                ", includeMacroShims=" + includeMacroShims +
                '}';
    }
}
