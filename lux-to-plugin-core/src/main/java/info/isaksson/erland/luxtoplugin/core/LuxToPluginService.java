package info.isaksson.erland.luxtoplugin.core;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.CodegenException;
import info.isaksson.erland.luxtoplugin.emitter.EmitterOptions;
import info.isaksson.erland.luxtoplugin.emitter.PluginEmitter;
import info.isaksson.erland.luxtoplugin.emitter.detect.DetectionResult;
import info.isaksson.erland.luxtoplugin.ir.IrJson;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Core (server-friendly) API for generating both plugin outputs from one IR program.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline.
 * Detection runs once; each backend then runs on its own, and a failure in one never
 * affects the other.</p>
 */
public final class LuxToPluginService {

    private static final Logger log = LoggerFactory.getLogger(LuxToPluginService.class);

    private final PluginEmitter emitter = new PluginEmitter();

    /** Build from an IR JSON file. */
    public LuxToPluginResult buildFromFile(Path irJson, LuxToPluginOptions options) throws IOException {
        if (irJson == null) throw new IllegalArgumentException("irJson must not be null");
        return build(IrJson.read(irJson), options);
    }

    public LuxToPluginResult build(IrProgram program, LuxToPluginOptions options) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        if (program.decl == null) throw new IllegalArgumentException("program has no top-level unit");
        if (options == null) options = new LuxToPluginOptions();

        DetectionResult detection = emitter.detect(program);
        EmitterOptions emitterOptions = options.toEmitterOptions();
        List<Backend> backends = new ArrayList<>(options.backends == null || options.backends.isEmpty()
                ? EnumSet.allOf(Backend.class) : EnumSet.copyOf(options.backends));

        Map<Backend, BackendOutcome> outcomes = new EnumMap<>(Backend.class);
        if (options.parallel && backends.size() > 1) {
            runParallel(program, backends, emitterOptions, detection, outcomes);
        } else {
            for (Backend b : backends) outcomes.put(b, runBackend(program, b, emitterOptions, detection));
        }
        LuxToPluginResult result = new LuxToPluginResult(program, detection, outcomes);
        log.info("Built '{}': {}", program.name(), result.outcomes.values());
        return result;
    }

    private void runParallel(IrProgram program, List<Backend> backends, EmitterOptions emitterOptions,
                             DetectionResult detection, Map<Backend, BackendOutcome> outcomes) {
        ExecutorService pool = Executors.newFixedThreadPool(backends.size());
        try {
            Map<Backend, Future<BackendOutcome>> futures = new EnumMap<>(Backend.class);
            for (Backend b : backends) {
                futures.put(b, pool.submit(() -> runBackend(program, b, emitterOptions, detection)));
            }
            for (Map.Entry<Backend, Future<BackendOutcome>> e : futures.entrySet()) {
                outcomes.put(e.getKey(), await(e.getValue()));
            }
        } finally {
            pool.shutdown();
        }
    }

    private static BackendOutcome await(Future<BackendOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for backend", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException(cause);
        }
    }

    private BackendOutcome runBackend(IrProgram program, Backend backend, EmitterOptions options, DetectionResult detection) {
        try {
            PluginEmitter.Result r = emitter.emit(program, backend, options, detection);
            return BackendOutcome.success(backend, r.source, r.warnings);
        } catch (CodegenException e) {
            log.warn("{} backend failed: {}", backend.cliValue, e.getMessage());
            return BackendOutcome.failure(backend, e);
        }
    }

    /**
     * Writes each successful backend's file into {@code outDir}. A failed backend's file is not
     * written, and one left over from an earlier build is removed.
     *
     * @return the files written
     */
    public List<Path> writeOutputs(LuxToPluginResult result, Path outDir) throws IOException {
        if (result == null) throw new IllegalArgumentException("result must not be null");
        if (outDir == null) throw new IllegalArgumentException("outDir must not be null");
        Files.createDirectories(outDir);
        List<Path> written = new ArrayList<>();
        for (BackendOutcome o : result.outcomes.values()) {
            Path file = outDir.resolve(o.backend.outputFileName);
            if (!o.succeeded()) {
                if (Files.deleteIfExists(file)) log.info("Removed stale {}", file);
                continue;
            }
            Files.writeString(file, o.source, StandardCharsets.UTF_8);
            written.add(file);
        }
        return written;
    }
}
