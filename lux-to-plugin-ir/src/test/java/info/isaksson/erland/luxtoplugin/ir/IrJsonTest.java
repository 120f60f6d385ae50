package info.isaksson.erland.luxtoplugin.ir;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IrJsonTest {

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(IrJsonTest.class.getClassLoader().getResource("ir/" + name).toURI());
    }

    @Test
    void readsPluginWithUsesAndMatch() throws Exception {
        IrProgram program = IrJson.read(fixture("matcher.json"));

        assertEquals("1.0", program.schemaVersion);
        assertEquals("Matcher", program.name());
        assertInstanceOf(IrTopLevel.Plugin.class, program.decl);

        assertEquals(2, program.uses.size());
        IrUse helpers = program.uses.get(0);
        assertTrue(helpers.isFileModule());
        assertEquals("helpers", helpers.moduleName());
        assertEquals(List.of("escape_string"), helpers.imports);
        assertFalse(program.uses.get(1).isFileModule());

        IrItem.Function visit = program.decl.itemsOf(IrItem.Function.class).get(0);
        assertEquals("visit_call_expression", visit.name);
        assertEquals(IrSourceRef.at(4, 5).line, visit.source.line);
        assertEquals("matcher.lux", visit.source.file);
        IrTypeRef nodeType = visit.params.get(0).type;
        assertEquals(IrTypeRefKind.REFERENCE, nodeType.kind);
        assertTrue(nodeType.mutable);
        assertEquals("CallExpression", nodeType.elementType.name);

        IrStmt.Match match = assertInstanceOf(IrStmt.Match.class, visit.body.get(0));
        assertEquals(2, match.arms.size());
        IrPattern.Variant variant = assertInstanceOf(IrPattern.Variant.class, match.arms.get(0).pattern);
        assertEquals("CallExpression([head, ..tail])", variant.toString());
        assertInstanceOf(IrPattern.Wildcard.class, match.arms.get(1).pattern);
        assertNull(match.arms.get(0).guard);
    }

    @Test
    void renderingIsStable() throws Exception {
        IrProgram program = IrJson.read(fixture("matcher.json"));

        String first = IrJson.toJsonString(program);
        String second = IrJson.toJsonString(IrJson.readFromString(first));

        assertEquals(first, second);
        assertTrue(first.endsWith("}\n"));
        assertTrue(first.indexOf("\"schemaVersion\"") < first.indexOf("\"uses\""));
        assertTrue(first.indexOf("\"uses\"") < first.indexOf("\"decl\""));
        assertTrue(first.contains("\"kind\" : \"Wildcard\""), first);
    }

    @Test
    void writeMatchesToJsonString(@TempDir Path dir) throws Exception {
        IrProgram program = IrJson.read(fixture("matcher.json"));
        Path out = dir.resolve("nested/out.json");

        IrJson.write(program, out);

        assertEquals(IrJson.toJsonString(program), Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    void missingDeclLoadsWithoutUnit() throws Exception {
        IrProgram program = IrJson.readFromString("{ \"schemaVersion\": \"1.0\", \"uses\": [] }");
        assertNull(program.decl);
        assertTrue(program.uses.isEmpty());
    }

    @Test
    void nullDocumentIsAParseError() {
        IrParseException e = assertThrows(IrParseException.class, () -> IrJson.readFromString("null"));
        assertEquals("Parse error at 1:1: IR document is empty", e.getMessage());
    }

    @Test
    void malformedJsonReportsLine() {
        String json = "{\n  \"decl\": {\n    \"kind\": \"Plugin\",\n    \"name\": \n}";
        IrParseException e = assertThrows(IrParseException.class, () -> IrJson.readFromString(json));
        assertEquals(5, e.line());
        assertTrue(e.getMessage().startsWith("Parse error at 5:"), e.getMessage());
    }

    @Test
    void unknownPropertyIsRejected() {
        String json = "{ \"decl\": { \"kind\": \"Plugin\", \"name\": \"P\", \"color\": \"red\" } }";
        IrParseException e = assertThrows(IrParseException.class, () -> IrJson.readFromString(json));
        assertTrue(e.detail().contains("color"), e.detail());
    }

    @Test
    void unknownKindIsRejected() {
        String json = "{ \"decl\": { \"kind\": \"Library\", \"name\": \"P\" } }";
        assertThrows(IrParseException.class, () -> IrJson.readFromString(json));
    }

    @Test
    void trailingTokensAreRejected() {
        String json = "{ \"decl\": { \"kind\": \"Module\", \"name\": \"m\" } } {}";
        assertThrows(IrParseException.class, () -> IrJson.readFromString(json));
    }

    @Test
    void defaultsApplyToOmittedFields() throws IOException {
        IrProgram program = IrJson.readFromString(
                "{ \"decl\": { \"kind\": \"Writer\", \"name\": \"Printer\", \"items\": ["
                        + "{ \"kind\": \"Function\", \"name\": \"finish\" } ] } }");

        assertEquals(IrProgram.CURRENT_SCHEMA_VERSION, program.schemaVersion);
        assertEquals(List.of(), program.uses);
        IrItem.Function f = (IrItem.Function) program.decl.items().get(0);
        assertEquals(List.of(), f.params);
        assertNull(f.returnType);
        assertFalse(f.returnsValue());
    }
}
