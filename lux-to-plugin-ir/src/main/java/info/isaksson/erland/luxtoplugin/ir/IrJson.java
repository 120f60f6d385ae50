package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization utilities for the DSL IR.
 *
 * <p>Writing is deterministic: property order is fixed per class and element order is
 * the declaration order the front end produced (never re-sorted).</p>
 */
public final class IrJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private IrJson() {}

    public static IrProgram read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        String json = Files.readString(path, StandardCharsets.UTF_8);
        return readFromString(json);
    }

    /**
     * Parse an IR program from a JSON string. A document without {@code decl} still loads;
     * callers decide whether a missing unit is an error.
     */
    public static IrProgram readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        try {
            IrProgram program = MAPPER.readValue(json, IrProgram.class);
            if (program == null) {
                throw new IrParseException(1, 1, "IR document is empty", null);
            }
            return program;
        } catch (JsonProcessingException e) {
            JsonLocation loc = e.getLocation();
            int line = loc == null ? 0 : Math.max(loc.getLineNr(), 0);
            int col = loc == null ? 0 : Math.max(loc.getColumnNr(), 0);
            throw new IrParseException(line, col, e.getOriginalMessage(), e);
        }
    }

    public static void write(IrProgram program, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, program);
            // Ensure trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    public static String toJsonString(IrProgram program) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(program) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        // Unknown properties are front-end/IR version drift; report them.
        om.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        om.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        // Marker nodes (Wildcard, Break, Continue) carry only their kind.
        om.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
