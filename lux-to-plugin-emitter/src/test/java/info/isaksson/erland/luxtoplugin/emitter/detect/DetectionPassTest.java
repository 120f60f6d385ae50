package info.isaksson.erland.luxtoplugin.emitter.detect;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.ir.IrExpr;
import info.isaksson.erland.luxtoplugin.ir.IrField;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;
import info.isaksson.erland.luxtoplugin.ir.IrStmt;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import info.isaksson.erland.luxtoplugin.ir.IrUse;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.luxtoplugin.emitter.TestIr.*;
import static org.junit.jupiter.api.Assertions.*;

public class DetectionPassTest {

    private final DetectionPass pass = new DetectionPass();

    @Test
    void findsCollectionTypeThreeBlocksDeep() {
        IrTypeRef map = IrTypeRef.container("HashMap", List.of(prim("Str"), prim("i32")));
        IrStmt deep = new IrStmt.Block(List.of(new IrStmt.Block(List.of(new IrStmt.Block(List.of(
                new IrStmt.Let(true, bind("counts"), map, null)))))));
        IrProgram p = program(plugin("P", fn("helper", List.of(), null, deep)));

        DetectionResult d = pass.run(p);

        assertTrue(d.has(Backend.SWC, SupportMarker.HASH_MAP));
        assertFalse(d.has(Backend.SWC, SupportMarker.HASH_SET));
        // Babel has no import for maps
        assertFalse(d.has(Backend.BABEL, SupportMarker.HASH_MAP));
    }

    @Test
    void findsNestedGenericArgument() {
        IrTypeRef nested = IrTypeRef.container("Vec", List.of(
                IrTypeRef.optional(IrTypeRef.container("HashSet", List.of(prim("Str"))))));
        IrItem.Struct s = new IrItem.Struct("State", List.of(new IrField("seen", nested)), null, null);
        DetectionResult d = pass.run(program(plugin("P", s)));
        assertTrue(d.has(Backend.SWC, SupportMarker.HASH_SET));
    }

    @Test
    void importsMapToMarkers() {
        List<IrUse> uses = List.of(
                new IrUse("fs", null, null),
                new IrUse("json", null, null),
                new IrUse("./helpers.lux", null, List.of("escape_string")));
        DetectionResult d = pass.run(program(uses, plugin("P")));

        assertTrue(d.has(Backend.SWC, SupportMarker.FS));
        assertTrue(d.has(Backend.BABEL, SupportMarker.FS));
        assertTrue(d.has(Backend.BABEL, SupportMarker.JSON));
        assertFalse(d.has(Backend.SWC, SupportMarker.PATH));
    }

    @Test
    void macroCallsNeedShimsOnBabelOnly() {
        IrExpr call = new IrExpr.MacroCall("format", List.of(str("x={}"), id("x")));
        IrProgram p = program(plugin("P", fn("f", List.of(), null,
                new IrStmt.If(id("flag"), null, List.of(expr(call)), List.of()))));

        DetectionResult d = pass.run(p);

        assertTrue(d.has(Backend.BABEL, SupportMarker.MACRO_SHIMS));
        assertFalse(d.has(Backend.SWC, SupportMarker.MACRO_SHIMS));
    }

    @Test
    void findsUsesInsidePatternsAndInlineTraversals() {
        IrStmt inner = let("re", IrExpr.pathCall("Regex", "new", str("a+")));
        IrItem.Function method = visitor("visit_identifier", "Identifier", inner);
        IrStmt traverse = new IrStmt.Traverse(id("node"), List.of(), null, List.of(), List.of(method));
        IrProgram p = program(plugin("P", visitor("visit_call_expression", "CallExpression", traverse)));

        assertTrue(pass.run(p).has(Backend.SWC, SupportMarker.REGEX));
    }

    @Test
    void emptyProgramHasNoMarkers() {
        DetectionResult d = pass.run(program(plugin("P")));
        assertTrue(d.all().isEmpty());
        assertTrue(d.markers(Backend.BABEL).isEmpty());
    }

    @Test
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> pass.run(null));
    }
}
