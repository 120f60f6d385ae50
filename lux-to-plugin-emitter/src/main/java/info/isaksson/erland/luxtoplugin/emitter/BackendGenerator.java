package info.isaksson.erland.luxtoplugin.emitter;

import info.isaksson.erland.luxtoplugin.emitter.babel.BabelGenerator;
import info.isaksson.erland.luxtoplugin.emitter.detect.DetectionResult;
import info.isaksson.erland.luxtoplugin.emitter.swc.SwcGenerator;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;

/**
 * One backend's code generator: a pure function from the shared IR to one source file.
 *
 * <p>Implementations keep all lexical state per call, so a single instance may serve
 * concurrent calls and repeated calls yield identical text.</p>
 */
public interface BackendGenerator {

    Backend backend();

    /**
     * @throws UnsupportedConstructException when a construct has no form in this backend
     * @throws PatternLoweringException when a pattern cannot be lowered
     */
    String generate(IrProgram program, DetectionResult detection, EmitterOptions options, EmitterWarnings warnings);

    static BackendGenerator forBackend(Backend backend) {
        switch (backend) {
            case BABEL: return new BabelGenerator();
            case SWC: return new SwcGenerator();
            default: throw new IllegalArgumentException("Unknown backend: " + backend);
        }
    }
}
