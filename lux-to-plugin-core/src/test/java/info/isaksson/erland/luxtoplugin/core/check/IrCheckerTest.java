package info.isaksson.erland.luxtoplugin.core.check;

import info.isaksson.erland.luxtoplugin.ir.IrBinaryOp;
import info.isaksson.erland.luxtoplugin.ir.IrExpr;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrLiteral;
import info.isaksson.erland.luxtoplugin.ir.IrObjectProp;
import info.isaksson.erland.luxtoplugin.ir.IrParameter;
import info.isaksson.erland.luxtoplugin.ir.IrPattern;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;
import info.isaksson.erland.luxtoplugin.ir.IrSourceRef;
import info.isaksson.erland.luxtoplugin.ir.IrStmt;
import info.isaksson.erland.luxtoplugin.ir.IrTopLevel;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IrCheckerTest {

    private final IrChecker checker = new IrChecker();

    private static IrItem.Function fn(String name, List<IrParameter> params, IrSourceRef at, IrStmt... body) {
        return new IrItem.Function(name, false, params, null, Arrays.asList(body), at);
    }

    private static List<IrParameter> nodeParam(String type) {
        return List.of(new IrParameter("node", IrTypeRef.reference(IrTypeRef.named(type), true)));
    }

    private static IrProgram plugin(IrItem... items) {
        return IrProgram.of(List.of(), new IrTopLevel.Plugin("Checked", Arrays.asList(items)));
    }

    private static List<String> codes(List<CheckDiagnostic> diagnostics) {
        return diagnostics.stream().map(d -> d.code).toList();
    }

    @Test
    void cleanProgramHasNoDiagnostics() {
        List<CheckDiagnostic> out = checker.check(plugin(
                fn("visit_identifier", nodeParam("Identifier"), IrSourceRef.at(2, 3)),
                fn("helper", List.of(), IrSourceRef.at(5, 3))));

        assertEquals(List.of(), out);
        assertEquals(0, IrChecker.errorCount(out));
    }

    @Test
    void duplicateItemIsReported() {
        List<CheckDiagnostic> out = checker.check(plugin(
                fn("helper", List.of(), IrSourceRef.at(2, 3)),
                fn("helper", List.of(), IrSourceRef.at(8, 3))));

        assertEquals(List.of(CheckDiagnostic.DUPLICATE_ITEM), codes(out));
        CheckDiagnostic d = out.get(0);
        assertTrue(d.isError());
        assertEquals("error[E0001]: duplicate item 'helper' in Checked at 8:3", d.format());
    }

    @Test
    void visitorWithoutNodeParameter() {
        List<CheckDiagnostic> out = checker.check(plugin(fn("visit_identifier", List.of(), IrSourceRef.at(4, 1))));

        assertEquals(List.of(CheckDiagnostic.VISITOR_WITHOUT_PARAMS), codes(out));
        assertEquals(4, out.get(0).location.line);
    }

    @Test
    void duplicateHookIsReported() {
        List<CheckDiagnostic> out = checker.check(plugin(
                new IrItem.Hook(IrItem.Hook.Phase.PRE, fn("pre", List.of(), IrSourceRef.at(1, 1))),
                new IrItem.Hook(IrItem.Hook.Phase.PRE, fn("pre", List.of(), IrSourceRef.at(9, 1)))));

        assertEquals(List.of(CheckDiagnostic.DUPLICATE_HOOK), codes(out));
        assertTrue(out.get(0).message.contains("'pre'"), out.get(0).message);
    }

    @Test
    void missingUnit() {
        List<CheckDiagnostic> out = checker.check(IrProgram.of(List.of(), null));

        assertEquals(List.of(CheckDiagnostic.MISSING_UNIT), codes(out));
        assertNull(out.get(0).location);
        assertEquals("error[E0004]: program has no top-level unit", out.get(0).format());
    }

    @Test
    void structuralErrorsSkipTheDryRun() {
        IrExpr coalesce = new IrExpr.Binary(IrBinaryOp.NULL_COALESCE, IrExpr.ident("a"),
                IrExpr.literal(IrLiteral.integer(0)));
        List<CheckDiagnostic> out = checker.check(plugin(
                fn("pick", List.of(), IrSourceRef.at(2, 3), IrStmt.expr(coalesce)),
                fn("pick", List.of(), IrSourceRef.at(6, 3))));

        assertEquals(List.of(CheckDiagnostic.DUPLICATE_ITEM), codes(out));
    }

    @Test
    void unsupportedConstructNamesBackendAndLocation() {
        IrExpr coalesce = new IrExpr.Binary(IrBinaryOp.NULL_COALESCE, IrExpr.ident("a"),
                IrExpr.literal(IrLiteral.integer(0)));
        List<CheckDiagnostic> out = checker.check(plugin(
                fn("pick", List.of(), IrSourceRef.at(3, 5), new IrStmt.Return(coalesce))));

        assertEquals(List.of(CheckDiagnostic.UNSUPPORTED_CONSTRUCT), codes(out));
        CheckDiagnostic d = out.get(0);
        assertEquals("[swc] UnsupportedConstruct(operator ??, swc)", d.message);
        assertEquals(3, d.location.line);
        assertEquals(5, d.location.column);
    }

    @Test
    void patternLoweringFailure() {
        IrStmt destructure = new IrStmt.Let(false,
                new IrPattern.ObjectPattern(List.of(IrObjectProp.shorthand("a"))), null, IrExpr.ident("opts"));
        List<CheckDiagnostic> out = checker.check(plugin(fn("unpack", List.of(), IrSourceRef.at(9, 1), destructure)));

        assertEquals(List.of(CheckDiagnostic.PATTERN_LOWERING), codes(out));
        assertTrue(out.get(0).message.startsWith("[swc] PatternLoweringError("), out.get(0).message);
        assertTrue(out.get(0).format().endsWith(" at 9:1"), out.get(0).format());
    }

    @Test
    void backendWarningsAreReportedOnce() {
        List<CheckDiagnostic> out = checker.check(plugin(fn("visit_frobnicator", nodeParam("Frobnicator"), IrSourceRef.at(3, 1))));

        assertEquals(1, out.size(), out::toString);
        CheckDiagnostic d = out.get(0);
        assertFalse(d.isError());
        assertEquals("MissingVisitorBinding", d.code);
        assertTrue(d.format().startsWith("warning[MissingVisitorBinding]: "), d.format());
        assertTrue(d.format().endsWith("'visit_frobnicator'; emitted as a plain function at 3:1"), d.format());
        assertEquals(0, IrChecker.errorCount(out));
    }

    @Test
    void rejectsNullProgram() {
        assertThrows(IllegalArgumentException.class, () -> checker.check(null));
    }
}
