package info.isaksson.erland.luxtoplugin.emitter.swc;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.EmitterWarnings;
import info.isaksson.erland.luxtoplugin.emitter.PatternLoweringException;
import info.isaksson.erland.luxtoplugin.emitter.binding.NodeKind;
import info.isaksson.erland.luxtoplugin.ir.IrFieldPattern;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrLiteral;
import info.isaksson.erland.luxtoplugin.ir.IrObjectProp;
import info.isaksson.erland.luxtoplugin.ir.IrPattern;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import info.isaksson.erland.luxtoplugin.ir.IrVariant;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.luxtoplugin.emitter.TestIr.*;
import static org.junit.jupiter.api.Assertions.*;

public class SwcPatternLoweringTest {

    private final SwcContext ctx = new SwcContext(plugin("P",
            new IrItem.Enum("Mode", List.of(
                    IrVariant.unit("Fast"),
                    IrVariant.tuple("Slow", List.of(IrTypeRef.primitive("i32")))), null)),
            "P", new EmitterWarnings());

    private String lower(IrPattern p) {
        return ctx.patterns.lower(p);
    }

    @Test
    void nodeKindWithArrayDestructuresSequenceField() {
        assertEquals("Expr::Call(CallExpr { args: [first, second], .. })",
                lower(variant("CallExpression", array(bind("first"), bind("second")))));
    }

    @Test
    void binderUnderNodeKindRemembersItsKind() {
        assertEquals("Expr::Ident(id)", lower(variant("Identifier", bind("id"))));
        assertEquals(NodeKind.IDENTIFIER, ctx.kindOf("id"));
    }

    @Test
    void preludeAndUserVariants() {
        assertEquals("Some(x)", lower(variant("Some", bind("x"))));
        assertEquals("None", lower(variant("None", null)));
        assertEquals("Mode::Slow(n)", lower(variant("Slow", bind("n"))));
        assertEquals("Mode::Fast", lower(variant("Mode::Fast", null)));
    }

    @Test
    void structPatternUsesSwcFieldNames() {
        IrPattern p = new IrPattern.Struct("CallExpression", List.of(
                new IrFieldPattern("arguments", bind("a")),
                new IrFieldPattern("callee", bind("callee"))));
        assertEquals("CallExpr { args: a, callee, .. }", lower(p));
    }

    @Test
    void sequencesAndAlternatives() {
        assertEquals("[head, tail @ ..]", lower(array(bind("head"), new IrPattern.Rest(bind("tail")))));
        assertEquals("(x,)", lower(new IrPattern.Tuple(List.of(bind("x")))));
        assertEquals("1 | 2", lower(new IrPattern.Or(List.of(
                new IrPattern.Literal(IrLiteral.integer(1)),
                new IrPattern.Literal(IrLiteral.integer(2))))));
    }

    @Test
    void orAlternativesMustBindTheSameNames() {
        assertEquals("Some(x) | Ok(x)", lower(new IrPattern.Or(List.of(
                variant("Some", bind("x")), variant("Ok", bind("x"))))));

        PatternLoweringException e = assertThrows(PatternLoweringException.class, () -> lower(new IrPattern.Or(List.of(
                variant("Some", bind("x")), variant("None", null)))));
        assertEquals("None", e.subPattern());
    }

    @Test
    void objectPatternHasNoRustForm() {
        IrPattern p = new IrPattern.ObjectPattern(List.of(IrObjectProp.shorthand("a")));
        PatternLoweringException e = assertThrows(PatternLoweringException.class, () -> lower(p));
        assertEquals(Backend.SWC, e.backend());
        assertTrue(e.getMessage().startsWith("PatternLoweringError({ .. }, swc)"));
    }

    @Test
    void restOutsideSequenceFails() {
        assertThrows(PatternLoweringException.class, () -> lower(new IrPattern.Rest(bind("r"))));
    }

    @Test
    void unknownVariantFails() {
        PatternLoweringException e = assertThrows(PatternLoweringException.class,
                () -> lower(variant("Gadget", bind("g"))));
        assertEquals("Gadget(g)", e.subPattern());
    }
}
