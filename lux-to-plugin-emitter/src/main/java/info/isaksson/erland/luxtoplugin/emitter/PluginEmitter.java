package info.isaksson.erland.luxtoplugin.emitter;

import info.isaksson.erland.luxtoplugin.emitter.detect.DetectionPass;
import info.isaksson.erland.luxtoplugin.emitter.detect.DetectionResult;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Public API: emit plugin source for one backend from a ReluxScript IR program.
 *
 * <p>Detection is normally run once per program and shared by both backends; the
 * single-argument {@link #emit(IrProgram, Backend, EmitterOptions)} runs it itself.</p>
 */
public final class PluginEmitter {

    private static final Logger log = LoggerFactory.getLogger(PluginEmitter.class);

    public static final class Result {
        public final Backend backend;
        public final String source;
        public final List<EmitterWarning> warnings;

        Result(Backend backend, String source, List<EmitterWarning> warnings) {
            this.backend = backend;
            this.source = source;
            this.warnings = warnings == null ? List.of() : warnings;
        }
    }

    /** Emission result plus the file it was written to. */
    public static final class FileResult {
        public final Path file;
        public final Result build;

        FileResult(Path file, Result build) {
            this.file = file;
            this.build = build;
        }
    }

    private final DetectionPass detection = new DetectionPass();

    public DetectionResult detect(IrProgram program) {
        return detection.run(program);
    }

    public Result emit(IrProgram program, Backend backend, EmitterOptions options) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        return emit(program, backend, options, detect(program));
    }

    /**
     * @throws UnsupportedConstructException when the program uses a construct {@code backend} cannot express
     * @throws PatternLoweringException when a pattern has no form in {@code backend}
     */
    public Result emit(IrProgram program, Backend backend, EmitterOptions options, DetectionResult detected) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        if (backend == null) throw new IllegalArgumentException("backend must not be null");
        if (options == null) options = EmitterOptions.defaults();
        if (detected == null) detected = detect(program);

        EmitterWarnings warnings = new EmitterWarnings();
        String source = BackendGenerator.forBackend(backend).generate(program, detected, options, warnings);
        List<EmitterWarning> list = warnings.toDeterministicList();
        for (EmitterWarning w : list) {
            log.warn("[{}] {}", backend.cliValue, w);
        }
        return new Result(backend, source, list);
    }

    /**
     * Emits and writes {@link Backend#outputFileName} into {@code outDir}. Nothing is written
     * when generation fails.
     */
    public FileResult emitToFile(IrProgram program, Backend backend, EmitterOptions options,
                                 DetectionResult detected, Path outDir) throws IOException {
        if (outDir == null) throw new IllegalArgumentException("outDir must not be null");
        Result r = emit(program, backend, options, detected);
        Files.createDirectories(outDir);
        Path file = outDir.resolve(backend.outputFileName);
        Files.writeString(file, r.source, StandardCharsets.UTF_8);
        log.info("Wrote {}", file);
        return new FileResult(file, r);
    }
}
