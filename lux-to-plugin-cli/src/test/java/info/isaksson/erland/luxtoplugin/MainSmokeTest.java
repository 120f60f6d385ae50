package info.isaksson.erland.luxtoplugin;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    /** Copies a bundled IR fixture to the temp dir so Main reads it through the filesystem. */
    private Path fixture(String name) throws IOException {
        Path ir = tmp.resolve(name);
        try (var in = MainSmokeTest.class.getResourceAsStream("/ir/" + name)) {
            assertNotNull(in, "fixture must exist in test resources: " + name);
            Files.copy(in, ir);
        }
        return ir;
    }

    @Test
    void buildWritesBothOutputs() throws IOException {
        Path outDir = tmp.resolve("dist");

        int code = Main.run(new String[] {"build", fixture("counter.json").toString(), "--output", outDir.toString()});

        assertEquals(0, code, err());
        assertTrue(Files.readString(outDir.resolve("index.js")).contains("this.state.count += 1;"));
        assertTrue(Files.readString(outDir.resolve("lib.rs")).contains("impl VisitMut for Counter {"));
        assertTrue(out().contains("- Plugin: Counter"), out());
    }

    @Test
    void buildSingleTargetInParallelMode() throws IOException {
        Path outDir = tmp.resolve("dist");

        int code = Main.run(new String[] {
                "build", fixture("counter.json").toString(),
                "-o", outDir.toString(),
                "--target", "swc",
                "--parallel", "true",
                "--name", "Tally"
        });

        assertEquals(0, code, err());
        assertTrue(Files.exists(outDir.resolve("lib.rs")));
        assertFalse(Files.exists(outDir.resolve("index.js")));
        assertTrue(Files.readString(outDir.resolve("lib.rs")).contains("pub struct Tally {"));
    }

    @Test
    void failedBackendExitsOneButKeepsTheOtherOutput() throws IOException {
        Path outDir = tmp.resolve("dist");

        int code = Main.run(new String[] {"build", fixture("fallback.json").toString(), "--output", outDir.toString()});

        assertEquals(1, code);
        assertTrue(Files.exists(outDir.resolve("index.js")));
        assertFalse(Files.exists(outDir.resolve("lib.rs")));
        assertTrue(err().contains("Error: swc backend failed: UnsupportedConstruct(operator ??, swc)"), err());
    }

    @Test
    void unwritableOutputExitsTwo() throws IOException {
        Path blocker = Files.writeString(tmp.resolve("not-a-dir"), "x");

        int code = Main.run(new String[] {"build", fixture("counter.json").toString(), "--output", blocker.toString()});

        assertEquals(2, code);
        assertTrue(err().contains("Error: could not write outputs to:"), err());
    }

    @Test
    void checkPassesAndFails() throws IOException {
        assertEquals(0, Main.run(new String[] {"check", fixture("counter.json").toString()}), err());
        assertTrue(out().contains("Check passed: counter.json"), out());

        assertEquals(1, Main.run(new String[] {"check", fixture("fallback.json").toString()}));
        assertTrue(out().contains("Check failed: 1 error(s)"), out());
        assertTrue(out().contains("error[E0100]: [swc] UnsupportedConstruct(operator ??, swc) at 3:5"), out());
    }

    @Test
    void programWithoutUnitFailsCheckAndBuild() throws IOException {
        Path ir = fixture("no-unit.json");

        assertEquals(1, Main.run(new String[] {"check", ir.toString()}));
        assertTrue(out().contains("Check failed: 1 error(s)"), out());
        assertTrue(out().contains("error[E0004]: program has no top-level unit"), out());

        assertEquals(1, Main.run(new String[] {"build", ir.toString(), "--output", tmp.resolve("dist").toString()}));
        assertTrue(err().contains("Error: IR program has no top-level unit"), err());
        assertFalse(Files.exists(tmp.resolve("dist")));
    }

    @Test
    void parsePrintsSummary() throws IOException {
        int code = Main.run(new String[] {"parse", fixture("counter.json").toString()});

        assertEquals(0, code, err());
        assertTrue(out().contains("Parsed plugin Counter (2 item(s), 0 import(s))"), out());
    }

    @Test
    void malformedIrReportsParseError() throws IOException {
        int code = Main.run(new String[] {"parse", fixture("broken.json").toString()});

        assertEquals(1, code);
        assertTrue(err().startsWith("Parse error at "), err());
    }

    @Test
    void missingInputFile() {
        int code = Main.run(new String[] {"build", tmp.resolve("nope.json").toString()});

        assertEquals(1, code);
        assertTrue(err().contains("Error: IR file does not exist"), err());
    }

    @Test
    void argumentErrors() {
        assertEquals(1, Main.run(new String[0]));
        assertEquals(1, Main.run(new String[] {"compile", "x.json"}));
        assertEquals(1, Main.run(new String[] {"build"}));
        assertEquals(1, Main.run(new String[] {"build", "x.json", "--target", "wasm"}));
        assertEquals(1, Main.run(new String[] {"build", "x.json", "--parallel", "maybe"}));
        assertEquals(1, Main.run(new String[] {"build", "x.json", "--output"}));
        assertEquals(0, Main.run(new String[] {"--help"}));
        assertTrue(out().contains("Usage:"), out());
    }
}
