package info.isaksson.erland.luxtoplugin.core;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.UnsupportedConstructException;
import info.isaksson.erland.luxtoplugin.ir.IrJson;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LuxToPluginServiceTest {

    private final LuxToPluginService service = new LuxToPluginService();

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(LuxToPluginServiceTest.class.getClassLoader().getResource("ir/" + name).toURI());
    }

    private static IrProgram load(String name) throws Exception {
        return IrJson.read(fixture(name));
    }

    @Test
    void buildsBothBackendsByDefault() throws Exception {
        LuxToPluginResult result = service.build(load("counter.json"), new LuxToPluginOptions());

        assertTrue(result.succeeded(), () -> result.outcomes.values().toString());
        assertEquals(List.of(Backend.BABEL, Backend.SWC), List.copyOf(result.outcomes.keySet()));
        assertTrue(result.outcome(Backend.BABEL).source.contains("this.state.count += 1;"));
        assertTrue(result.outcome(Backend.SWC).source.contains("pub struct Counter {"));
        assertTrue(result.outcome(Backend.SWC).source.contains("self.state.count += 1;"));
    }

    @Test
    void parallelAndSequentialBuildsAgree() throws Exception {
        IrProgram program = load("counter.json");
        LuxToPluginOptions sequential = new LuxToPluginOptions();
        LuxToPluginOptions parallel = new LuxToPluginOptions();
        parallel.parallel = true;

        LuxToPluginResult a = service.build(program, sequential);
        LuxToPluginResult b = service.build(program, parallel);

        for (Backend backend : Backend.values()) {
            assertEquals(a.outcome(backend).source, b.outcome(backend).source, backend.cliValue);
        }
    }

    @Test
    void failingBackendDoesNotAffectTheOther() throws Exception {
        LuxToPluginResult result = service.build(load("fallback.json"), new LuxToPluginOptions());

        assertFalse(result.succeeded());
        BackendOutcome babel = result.outcome(Backend.BABEL);
        BackendOutcome swc = result.outcome(Backend.SWC);
        assertTrue(babel.succeeded());
        assertTrue(babel.source.contains("return (a ?? 0);"), babel.source);
        assertFalse(swc.succeeded());
        assertNull(swc.source);
        assertInstanceOf(UnsupportedConstructException.class, swc.error);
        assertEquals(List.of(swc), result.failures());
    }

    @Test
    void writeOutputsSkipsFailedBackend(@TempDir Path outDir) throws Exception {
        LuxToPluginResult result = service.build(load("fallback.json"), new LuxToPluginOptions());

        List<Path> written = service.writeOutputs(result, outDir);

        assertEquals(List.of(outDir.resolve("index.js")), written);
        assertTrue(Files.exists(outDir.resolve("index.js")));
        assertFalse(Files.exists(outDir.resolve("lib.rs")));
    }

    @Test
    void writeOutputsRemovesStaleFileOfFailedBackend(@TempDir Path outDir) throws Exception {
        Files.writeString(outDir.resolve("lib.rs"), "// from an earlier build\n");
        LuxToPluginResult result = service.build(load("fallback.json"), new LuxToPluginOptions());

        List<Path> written = service.writeOutputs(result, outDir);

        assertEquals(List.of(outDir.resolve("index.js")), written);
        assertFalse(Files.exists(outDir.resolve("lib.rs")));
    }

    @Test
    void singleBackendAndNameOverride() throws Exception {
        LuxToPluginOptions opts = new LuxToPluginOptions();
        opts.backends = EnumSet.of(Backend.SWC);
        opts.pluginName = "Renamed";

        LuxToPluginResult result = service.build(load("counter.json"), opts);

        assertEquals(List.of(Backend.SWC), List.copyOf(result.outcomes.keySet()));
        assertTrue(result.outcome(Backend.SWC).source.contains("pub struct Renamed {"));
    }

    @Test
    void buildFromFileReadsIr() throws Exception {
        LuxToPluginResult result = service.buildFromFile(fixture("counter.json"), null);

        assertEquals("Counter", result.program.name());
        assertTrue(result.succeeded());
    }

    @Test
    void buildFromMissingFileFails(@TempDir Path dir) {
        assertThrows(IOException.class, () -> service.buildFromFile(dir.resolve("nope.json"), null));
    }

    @Test
    void rejectsNullProgram() {
        assertThrows(IllegalArgumentException.class, () -> service.build(null, new LuxToPluginOptions()));
    }

    @Test
    void rejectsProgramWithoutUnit() throws Exception {
        IrProgram empty = IrJson.readFromString("{ \"schemaVersion\": \"1.0\" }");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> service.build(empty, new LuxToPluginOptions()));
        assertEquals("program has no top-level unit", e.getMessage());
    }
}
