package info.isaksson.erland.luxtoplugin.emitter;

import info.isaksson.erland.luxtoplugin.ir.IrCompoundOp;
import info.isaksson.erland.luxtoplugin.ir.IrExpr;
import info.isaksson.erland.luxtoplugin.ir.IrField;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;
import info.isaksson.erland.luxtoplugin.ir.IrStmt;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import info.isaksson.erland.luxtoplugin.ir.IrUnaryOp;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.luxtoplugin.emitter.TestIr.*;
import static org.junit.jupiter.api.Assertions.*;

public class UnitShapesTest {

    private final PluginEmitter emitter = new PluginEmitter();

    private String emit(IrProgram p, Backend b) {
        return emitter.emit(p, b, EmitterOptions.defaults()).source;
    }

    private static IrStmt bumpCount() {
        return expr(new IrExpr.CompoundAssign(IrCompoundOp.ADD_ASSIGN,
                member(member(id("self"), "state"), "count"), num(1)));
    }

    private static IrItem.Struct counterState() {
        return new IrItem.Struct("State", List.of(new IrField("count", prim("i32"))), null, null);
    }

    @Test
    void pluginWithState() {
        IrProgram p = program(plugin("Counter", counterState(), visitor("visit_identifier", "Identifier", bumpCount())));

        String rs = emit(p, Backend.SWC);
        assertTrue(rs.contains("pub struct Counter {\n    pub state: State,\n}"), rs);
        assertTrue(rs.contains("state: State {\n                count: 0,\n            },"), rs);
        assertTrue(rs.contains("impl Default for Counter {"), rs);
        assertTrue(rs.contains("impl VisitMut for Counter {"), rs);
        assertTrue(rs.contains("fn visit_mut_ident(&mut self, n: &mut Ident) {"), rs);
        assertTrue(rs.contains("self.state.count += 1;"), rs);
        assertTrue(rs.contains("n.visit_mut_children_with(self);"), rs);

        String js = emit(p, Backend.BABEL);
        assertTrue(js.contains("module.exports = function({ types: t }) {"), js);
        assertTrue(js.contains("pre(file) {"), js);
        assertTrue(js.contains("this.state = {\n"), js);
        assertTrue(js.contains("count: 0,"), js);
        assertTrue(js.contains("Identifier(path) {\n"), js);
        assertTrue(js.contains("const node = path.node;"), js);
        assertTrue(js.contains("this.state.count += 1;"), js);
    }

    @Test
    void pluginWithoutState() {
        String rs = emit(program(plugin("Empty")), Backend.SWC);
        assertTrue(rs.contains("pub struct Empty {\n    // Plugin state\n}"), rs);
        assertTrue(rs.contains("Self {}"), rs);
    }

    @Test
    void writerFlattensStateIntoTheBuilderStruct() {
        IrProgram p = program(writer("Printer", counterState(), visitor("visit_identifier", "Identifier", bumpCount())));

        String rs = emit(p, Backend.SWC);
        assertTrue(rs.contains("pub struct Printer {\n    output: String,\n    indent_level: usize,\n    count: i32,\n}"), rs);
        assertFalse(rs.contains("pub struct State"), rs);
        assertTrue(rs.contains("impl Visit for Printer {"), rs);
        assertTrue(rs.contains("fn visit_ident(&mut self, n: &Ident) {"), rs);
        assertTrue(rs.contains("self.count += 1;"), rs);
        assertTrue(rs.contains("n.visit_children_with(self);"), rs);
        assertTrue(rs.contains("pub fn finish(self) -> String {"), rs);
        assertTrue(rs.contains("fn append(&mut self, s: impl AsRef<str>) {"), rs);

        String js = emit(p, Backend.BABEL);
        assertTrue(js.contains("const builder = {"), js);
        assertTrue(js.contains("builder._output = [];"), js);
        assertTrue(js.contains("Program: {"), js);
        assertTrue(js.contains("state.file.metadata.output = builder.toString();"), js);
    }

    @Test
    void writerExitHookBecomesFinish() {
        IrItem.Function finish = fn("finish", List.of(param("self", IrTypeRef.reference(named("Self"), true))), null,
                expr(IrExpr.methodCall(member(id("self"), "builder"), "append", str("done"))));
        IrProgram p = program(writer("Done", new IrItem.Hook(IrItem.Hook.Phase.EXIT, finish)));

        String rs = emit(p, Backend.SWC);
        assertTrue(rs.contains("/// Finalize output (from exit hook)\n    pub fn finish(mut self) -> String {"), rs);
        assertTrue(rs.contains("        self.output\n"), rs);
        assertTrue(balanced(rs, true), rs);
    }

    @Test
    void moduleExportsPublicFunctions() {
        IrItem.Function escape = new IrItem.Function("escape_string", true,
                List.of(param("s", prim("Str"))), prim("Str"), List.of(expr(id("s"))), null);
        IrItem.Function internal = fn("internal", List.of(), null);
        IrProgram p = program(module("helpers", escape, internal));

        String js = emit(p, Backend.BABEL);
        assertTrue(js.contains("function escape_string(s) {\n  return s;\n}"), js);
        assertTrue(js.contains("module.exports = {\n  escape_string,\n};"), js);
        assertFalse(js.contains("  internal,"), js);
        assertFalse(js.contains("module.exports = function"), js);

        String rs = emit(p, Backend.SWC);
        assertTrue(rs.contains("pub fn escape_string(s: String) -> String {\n    s\n}"), rs);
        assertTrue(rs.contains("\nfn internal() {"), rs);
        assertFalse(rs.contains("use swc_ecma_ast"), rs);
    }

    @Test
    void moduleKeepsDetectedImports() {
        IrTypeRef names = IrTypeRef.container("HashMap", List.of(prim("Str"), prim("i32")));
        IrProgram p = program(module("helpers",
                new IrItem.Struct("Index", List.of(new IrField("names", names)), null, null)));

        String rs = emit(p, Backend.SWC);
        assertTrue(rs.contains("use std::collections::HashMap;\n"), rs);
        assertTrue(rs.contains("pub struct Index {\n    pub names: HashMap<String, i32>,\n}"), rs);
        assertFalse(rs.contains("use swc_ecma_ast"), rs);
    }

    @Test
    void doubleNegationIsNotADecrement() {
        IrExpr twice = new IrExpr.Unary(IrUnaryOp.NEG, new IrExpr.Unary(IrUnaryOp.NEG, id("x")));
        IrExpr literal = new IrExpr.Unary(IrUnaryOp.NEG, new IrExpr.Unary(IrUnaryOp.NEG, num(1)));
        IrProgram p = program(module("math",
                fn("flip", List.of(param("x", prim("i32"))), prim("i32"), expr(twice)),
                fn("one", List.of(), prim("i32"), expr(literal))));

        String js = emit(p, Backend.BABEL);
        assertTrue(js.contains("-(-x)"), js);
        assertTrue(js.contains("-(-1)"), js);
        assertFalse(js.contains("--"), js);

        String rs = emit(p, Backend.SWC);
        assertTrue(rs.contains("-(-x)"), rs);
        assertTrue(rs.contains("-(-1)"), rs);
    }

    @Test
    void inlineTraverseIsHoistedOnSwcAndObjectOnBabel() {
        IrStmt.Let hits = new IrStmt.Let(true, bind("hits"), null, num(0));
        IrItem.Function onIdent = fn("visit_identifier",
                List.of(param("id", IrTypeRef.reference(named("Identifier"), true))), null,
                expr(new IrExpr.CompoundAssign(IrCompoundOp.ADD_ASSIGN, id("hits"), num(1))));
        IrStmt traverse = new IrStmt.Traverse(id("node"), List.of("count"), null, List.of(hits), List.of(onIdent));
        IrProgram p = program(plugin("Walk", visitor("visit_function_declaration", "FunctionDeclaration",
                new IrStmt.Let(true, bind("count"), null, num(0)),
                traverse)));

        String rs = emit(p, Backend.SWC);
        assertTrue(rs.contains("struct __InlineVisitor_0<'a> {\n    count: &'a mut i32,\n    hits: i32,\n}"), rs);
        assertTrue(rs.contains("impl<'a> VisitMut for __InlineVisitor_0<'a> {"), rs);
        assertTrue(rs.contains("self.hits += 1;"), rs);
        assertTrue(rs.contains("let mut __visitor = __InlineVisitor_0 {"), rs);
        assertTrue(rs.contains("count: &mut count,"), rs);
        assertTrue(rs.contains("n.visit_mut_with(&mut __visitor);"), rs);
        assertTrue(rs.indexOf("struct __InlineVisitor_0") > rs.indexOf("impl VisitMut for Walk"), rs);
        assertTrue(balanced(rs, true), rs);

        String js = emit(p, Backend.BABEL);
        assertTrue(js.contains("// Captures: count"), js);
        assertTrue(js.contains("const __visitor_1_state = {\n"), js);
        assertTrue(js.contains("const __visitor_1 = {"), js);
        assertTrue(js.contains("const id = path.node;"), js);
        assertTrue(js.contains("this.hits += 1;"), js);
        assertTrue(js.contains("path.traverse(__visitor_1, __visitor_1_state);"), js);
        assertTrue(balanced(js, false), js);
    }
}
