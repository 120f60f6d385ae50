package info.isaksson.erland.luxtoplugin.core;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.detect.DetectionResult;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Build result container for programmatic usage. */
public final class LuxToPluginResult {

    public final IrProgram program;
    public final DetectionResult detection;

    /** One outcome per requested backend, in {@link Backend} order. */
    public final Map<Backend, BackendOutcome> outcomes;

    LuxToPluginResult(IrProgram program, DetectionResult detection, Map<Backend, BackendOutcome> outcomes) {
        this.program = program;
        this.detection = detection;
        this.outcomes = Collections.unmodifiableMap(new EnumMap<>(outcomes));
    }

    public BackendOutcome outcome(Backend backend) {
        return outcomes.get(backend);
    }

    /** True when every requested backend produced a complete output. */
    public boolean succeeded() {
        return failures().isEmpty();
    }

    public List<BackendOutcome> failures() {
        List<BackendOutcome> out = new ArrayList<>();
        for (BackendOutcome o : outcomes.values()) {
            if (!o.succeeded()) out.add(o);
        }
        return out;
    }
}
