package info.isaksson.erland.luxtoplugin.emitter;

import info.isaksson.erland.luxtoplugin.emitter.binding.NodeKind;
import info.isaksson.erland.luxtoplugin.ir.IrBinaryOp;
import info.isaksson.erland.luxtoplugin.ir.IrCompoundOp;
import info.isaksson.erland.luxtoplugin.ir.IrExpr;
import info.isaksson.erland.luxtoplugin.ir.IrField;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrLiteral;
import info.isaksson.erland.luxtoplugin.ir.IrMatchArm;
import info.isaksson.erland.luxtoplugin.ir.IrPattern;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;
import info.isaksson.erland.luxtoplugin.ir.IrSourceRef;
import info.isaksson.erland.luxtoplugin.ir.IrStmt;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import info.isaksson.erland.luxtoplugin.ir.IrUse;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.luxtoplugin.emitter.TestIr.*;
import static org.junit.jupiter.api.Assertions.*;

public class GeneratorPropertiesTest {

    private final PluginEmitter emitter = new PluginEmitter();

    /** A plugin touching most statement forms, without macro calls. */
    private static IrProgram richPlugin() {
        IrItem.Struct state = new IrItem.Struct("State",
                List.of(new IrField("count", prim("i32")), new IrField("names", IrTypeRef.arrayOf(prim("Str")))), null, null);
        IrStmt bump = expr(new IrExpr.CompoundAssign(IrCompoundOp.ADD_ASSIGN,
                member(member(id("self"), "state"), "count"), num(1)));
        IrStmt ifLet = new IrStmt.If(member(id("node"), "callee"),
                variant("Identifier", bind("callee")),
                List.of(bump),
                List.of());
        IrStmt match = new IrStmt.Match(id("n"), List.of(
                new IrMatchArm(new IrPattern.Literal(IrLiteral.integer(0)), null,
                        List.of(expr(IrExpr.call("log", str("zero"))))),
                new IrMatchArm(new IrPattern.Wildcard(), null, List.of())));
        IrStmt loop = new IrStmt.For(bind("arg"), member(id("node"), "arguments"),
                List.of(let("seen", bin(IrBinaryOp.ADD, num(1), num(2)))));
        return program(
                List.of(new IrUse("fs", null, null)),
                plugin("Rich",
                        state,
                        visitor("visit_call_expression", "CallExpression", ifLet, loop),
                        visitor("visit_identifier", "Identifier"),
                        fn("classify", List.of(param("n", prim("i32"))), null, match),
                        fn("log", List.of(param("msg", prim("Str"))), null)));
    }

    @Test
    void outputsAreBalanced() {
        IrProgram p = richPlugin();
        String js = emitter.emit(p, Backend.BABEL, EmitterOptions.defaults()).source;
        String rs = emitter.emit(p, Backend.SWC, EmitterOptions.defaults()).source;
        assertTrue(balanced(js, false), js);
        assertTrue(balanced(rs, true), rs);
    }

    @Test
    void emissionIsIdempotent() {
        IrProgram p = richPlugin();
        for (Backend b : Backend.values()) {
            String first = emitter.emit(p, b, EmitterOptions.defaults()).source;
            String second = new PluginEmitter().emit(p, b, EmitterOptions.defaults()).source;
            assertEquals(first, second, b.cliValue);
        }
    }

    @Test
    void everyBoundVisitorAppearsInBothBackends() {
        IrProgram p = richPlugin();
        String js = emitter.emit(p, Backend.BABEL, EmitterOptions.defaults()).source;
        String rs = emitter.emit(p, Backend.SWC, EmitterOptions.defaults()).source;
        for (NodeKind k : List.of(NodeKind.CALL_EXPRESSION, NodeKind.IDENTIFIER)) {
            assertTrue(js.contains(k.babelVisitorKey() + "(path) {"), k.name());
            assertTrue(rs.contains("fn " + k.swcVisitMutHook + "(&mut self"), k.name());
        }
    }

    @Test
    void headerIsOptional() {
        IrProgram p = richPlugin();
        EmitterOptions bare = EmitterOptions.defaults().withHeader(false);
        for (Backend b : Backend.values()) {
            assertTrue(emitter.emit(p, b, EmitterOptions.defaults()).source.startsWith("// Generated by ReluxScript compiler\n"));
            assertFalse(emitter.emit(p, b, bare).source.contains("Generated by ReluxScript compiler"));
        }
    }

    @Test
    void detectedSupportReachesTheHeader() {
        IrProgram p = richPlugin();
        String js = emitter.emit(p, Backend.BABEL, EmitterOptions.defaults()).source;
        String rs = emitter.emit(p, Backend.SWC, EmitterOptions.defaults()).source;
        assertTrue(js.contains("const fs = require('fs');"));
        assertTrue(rs.contains("use std::fs;"));
        assertTrue(rs.contains("use swc_ecma_visit::{Visit, VisitMut, VisitMutWith, VisitWith};"));
    }

    @Test
    void unknownVisitorNameWarnsOnBothBackends() {
        IrProgram p = program(plugin("Odd", visitor("visit_frobnicator", "Frobnicator")));
        for (Backend b : Backend.values()) {
            PluginEmitter.Result r = emitter.emit(p, b, EmitterOptions.defaults());
            assertEquals(1, r.warnings.size(), b.cliValue);
            assertEquals(EmitterWarning.MISSING_VISITOR_BINDING, r.warnings.get(0).code);
            assertTrue(r.source.contains("visit_frobnicator("), b.cliValue);
        }
    }

    @Test
    void methodsSharingAnSwcHookAreMerged() {
        IrProgram p = program(plugin("Ops",
                visitor("visit_binary_expression", "BinaryExpression", expr(IrExpr.call("note", str("bin")))),
                visitor("visit_logical_expression", "LogicalExpression", expr(IrExpr.call("note", str("logic")))),
                fn("note", List.of(param("s", prim("Str"))), null)));

        String rs = emitter.emit(p, Backend.SWC, EmitterOptions.defaults()).source;
        String js = emitter.emit(p, Backend.BABEL, EmitterOptions.defaults()).source;

        assertEquals(rs.indexOf("fn visit_mut_bin_expr("), rs.lastIndexOf("fn visit_mut_bin_expr("), rs);
        assertTrue(rs.contains("\"bin\""));
        assertTrue(rs.contains("\"logic\""));
        assertTrue(js.contains("BinaryExpression(path) {"));
        assertTrue(js.contains("LogicalExpression(path) {"));
    }

    @Test
    void failuresCarryTheItemLocation() {
        IrItem.Function bad = new IrItem.Function("pick", false, List.of(param("a", prim("i32"))), prim("i32"),
                List.of(expr(bin(IrBinaryOp.NULL_COALESCE, id("a"), num(0)))), IrSourceRef.at(7, 3));
        IrProgram p = program(plugin("Located", bad));

        CodegenException e = assertThrows(CodegenException.class,
                () -> emitter.emit(p, Backend.SWC, EmitterOptions.defaults()));
        assertEquals(IrSourceRef.at(7, 3), e.location());
        assertTrue(e.getMessage().endsWith(" at 7:3"), e.getMessage());
    }
}
