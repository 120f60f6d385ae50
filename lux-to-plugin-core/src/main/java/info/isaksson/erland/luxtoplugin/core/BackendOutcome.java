package info.isaksson.erland.luxtoplugin.core;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.CodegenException;
import info.isaksson.erland.luxtoplugin.emitter.EmitterWarning;

import java.util.List;

/** What one backend pipeline produced: its source text, or the failure that stopped it. */
public final class BackendOutcome {
    public final Backend backend;
    /** Null when the backend failed. */
    public final String source;
    public final List<EmitterWarning> warnings;
    /** Null when the backend succeeded. */
    public final CodegenException error;

    private BackendOutcome(Backend backend, String source, List<EmitterWarning> warnings, CodegenException error) {
        this.backend = backend;
        this.source = source;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.error = error;
    }

    static BackendOutcome success(Backend backend, String source, List<EmitterWarning> warnings) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        return new BackendOutcome(backend, source, warnings, null);
    }

    static BackendOutcome failure(Backend backend, CodegenException error) {
        if (error == null) throw new IllegalArgumentException("error must not be null");
        return new BackendOutcome(backend, null, List.of(), error);
    }

    public boolean succeeded() {
        return error == null;
    }

    @Override
    public String toString() {
        return backend.cliValue + (succeeded() ? ": ok" : ": " + error.getMessage());
    }
}
