package info.isaksson.erland.luxtoplugin.emitter;

import info.isaksson.erland.luxtoplugin.ir.IrBinaryOp;
import info.isaksson.erland.luxtoplugin.ir.IrExpr;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;
import info.isaksson.erland.luxtoplugin.ir.IrStmt;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import info.isaksson.erland.luxtoplugin.ir.IrUse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static info.isaksson.erland.luxtoplugin.emitter.TestIr.*;
import static org.junit.jupiter.api.Assertions.*;

/** Small programs taken through both backends, checked for the shape of each output. */
public class EndToEndScenariosTest {

    private final PluginEmitter emitter = new PluginEmitter();

    private String babel(IrProgram p) {
        return emitter.emit(p, Backend.BABEL, EmitterOptions.defaults()).source;
    }

    private String swc(IrProgram p) {
        return emitter.emit(p, Backend.SWC, EmitterOptions.defaults()).source;
    }

    @Test
    void integerTailValue() {
        IrProgram p = program(plugin("Answer", fn("answer", List.of(), prim("i32"), expr(num(42)))));

        String js = babel(p);
        String rs = swc(p);

        assertTrue(js.contains("function answer() {"), js);
        assertTrue(js.contains("return 42;"), js);
        assertTrue(rs.contains("fn answer() -> i32 {"), rs);
        assertTrue(rs.contains("        42\n"), rs);
    }

    @Test
    void formatMacro() {
        IrExpr fmt = new IrExpr.MacroCall("format", List.of(str("x={}"), id("x")));
        IrProgram p = program(plugin("Fmt", fn("show", List.of(param("x", prim("i32"))), prim("Str"), expr(fmt))));

        String js = babel(p);
        String rs = swc(p);

        assertTrue(js.contains("function format(template, ...args) {"), "shim prelude expected");
        assertTrue(js.contains("return format(\"x={}\", x);"), js);
        assertTrue(rs.contains("format!(\"x={}\", x)"), rs);
        assertFalse(rs.contains("function format"), rs);
    }

    @Test
    void ifLetOnCallWithTwoArguments() {
        IrStmt ifLet = new IrStmt.If(id("node"),
                variant("CallExpression", array(bind("first"), bind("second"))),
                List.of(expr(IrExpr.call("check", id("first"), id("second")))),
                List.of());
        IrProgram p = program(plugin("Args",
                visitor("visit_expression", "Expression", ifLet),
                fn("check", List.of(param("a", named("Expression")), param("b", named("Expression"))), null)));

        String js = babel(p);
        String rs = swc(p);

        assertTrue(js.contains("const __iflet_1 = node;"), js);
        assertTrue(js.contains("if (t.isCallExpression(__iflet_1) && __iflet_1.arguments.length === 2) {"), js);
        assertTrue(js.contains("const [first, second] = __iflet_1.arguments;"), js);
        assertTrue(rs.contains("if let Expr::Call(CallExpr { args: [first, second], .. }) = n {"), rs);
        assertTrue(rs.contains("fn visit_mut_expr(&mut self, n: &mut Expr) {"), rs);
    }

    @Test
    void fileModuleImport() {
        IrProgram p = program(
                List.of(new IrUse("./helpers.lux", null, List.of("escape_string"))),
                plugin("Uses"));

        String js = babel(p);
        String rs = swc(p);

        assertTrue(js.contains("const { escape_string } = require('./helpers.js');"), js);
        assertTrue(rs.contains("mod helpers;\nuse helpers::escape_string;\n"), rs);
    }

    @Test
    void nullCoalescingFailsOnlyOnSwc(@TempDir Path out) throws Exception {
        IrExpr coalesce = bin(IrBinaryOp.NULL_COALESCE, id("a"), num(0));
        IrProgram p = program(plugin("Coalesce",
                fn("pick", List.of(param("a", IrTypeRef.optional(prim("i32")))), prim("i32"), expr(coalesce))));

        assertTrue(babel(p).contains("return (a ?? 0);"));

        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> emitter.emitToFile(p, Backend.SWC, EmitterOptions.defaults(), null, out));
        assertEquals(Backend.SWC, e.backend());
        assertEquals("operator ??", e.construct());
        assertFalse(Files.exists(out.resolve("lib.rs")));

        PluginEmitter.FileResult js = emitter.emitToFile(p, Backend.BABEL, EmitterOptions.defaults(), null, out);
        assertEquals(out.resolve("index.js"), js.file);
        assertEquals(js.build.source, Files.readString(js.file));
    }
}
