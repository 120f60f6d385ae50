package info.isaksson.erland.luxtoplugin.core;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.EmitterOptions;

import java.util.EnumSet;
import java.util.Set;

/**
 * Core (server-friendly) options for a plugin build.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class LuxToPluginOptions {

    /** Backends to generate; both by default. */
    public Set<Backend> backends = EnumSet.allOf(Backend.class);

    /**
     * Run the two backend pipelines as two tasks on an executor instead of one after the other.
     * Outputs are identical either way.
     */
    public boolean parallel = false;

    /** Overrides the unit name from the IR when set. */
    public String pluginName = null;

    public boolean includeHeader = true;
    public boolean includeMacroShims = true;

    public EmitterOptions toEmitterOptions() {
        return new EmitterOptions(pluginName, includeHeader, includeMacroShims);
    }
}
