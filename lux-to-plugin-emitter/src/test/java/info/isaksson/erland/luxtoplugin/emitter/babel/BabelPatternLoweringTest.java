package info.isaksson.erland.luxtoplugin.emitter.babel;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.EmitterWarnings;
import info.isaksson.erland.luxtoplugin.emitter.PatternLoweringException;
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

public class BabelPatternLoweringTest {

    private final BabelContext ctx = new BabelContext(plugin("P",
            new IrItem.Enum("Mode", List.of(
                    IrVariant.unit("Fast"),
                    IrVariant.tuple("Slow", List.of(IrTypeRef.primitive("i32")))), null)),
            new EmitterWarnings());

    private BabelPatternLowering.Lowered lower(IrPattern p, String subject) {
        return ctx.patterns.lower(p, subject);
    }

    @Test
    void nodeKindWithArrayChecksTypeAndLength() {
        BabelPatternLowering.Lowered l = lower(variant("CallExpression", array(bind("first"), bind("second"))), "__iflet_1");

        assertEquals("t.isCallExpression(__iflet_1) && __iflet_1.arguments.length === 2", l.condition);
        assertEquals(List.of("const [first, second] = __iflet_1.arguments;"), l.bindings);
    }

    @Test
    void someBindsTheValueItself() {
        BabelPatternLowering.Lowered l = lower(variant("Some", bind("x")), "v");
        assertEquals("(v !== null && v !== undefined)", l.condition);
        assertEquals(List.of("const x = v;"), l.bindings);
    }

    @Test
    void userEnumVariantsUseTypeTag() {
        BabelPatternLowering.Lowered l = lower(variant("Slow", bind("n")), "mode");
        assertEquals("mode.type === \"Slow\"", l.condition);
        assertEquals(List.of("const n = mode.value;"), l.bindings);

        assertEquals("mode.type === \"Fast\"", lower(variant("Mode::Fast", null), "mode").condition);
    }

    @Test
    void orOfLiterals() {
        IrPattern or = new IrPattern.Or(List.of(
                new IrPattern.Literal(IrLiteral.integer(1)),
                new IrPattern.Literal(IrLiteral.integer(2))));
        BabelPatternLowering.Lowered l = lower(or, "n");
        assertEquals("(n === 1 || n === 2)", l.condition);
        assertTrue(l.bindings.isEmpty());
    }

    @Test
    void orAlternativesMustNotBind() {
        IrPattern or = new IrPattern.Or(List.of(variant("Some", bind("x")), variant("None", null)));
        PatternLoweringException e = assertThrows(PatternLoweringException.class, () -> lower(or, "v"));
        assertEquals(Backend.BABEL, e.backend());
        assertEquals("Some(x)", e.subPattern());
    }

    @Test
    void innermostUnknownVariantIsReported() {
        IrPattern p = variant("Wrapper", variant("Gadget", null));
        PatternLoweringException e = assertThrows(PatternLoweringException.class, () -> lower(p, "x"));
        assertEquals("Gadget", e.subPattern());
    }

    @Test
    void arrayWithRestChecksMinimumLength() {
        IrPattern p = array(bind("head"), new IrPattern.Rest(bind("tail")));
        BabelPatternLowering.Lowered l = lower(p, "xs");
        assertEquals("xs.length >= 1", l.condition);
        assertEquals(List.of("const [head, ...tail] = xs;"), l.bindings);
    }

    @Test
    void wildcardIsIrrefutable() {
        assertTrue(lower(new IrPattern.Wildcard(), "x").irrefutable());
    }

    @Test
    void objectDestructuring() {
        IrPattern p = new IrPattern.ObjectPattern(List.of(IrObjectProp.shorthand("a"), IrObjectProp.rest("others")));
        assertEquals("{ a, ...others }", ctx.patterns.destructure(p));
    }

    @Test
    void refutablePatternCannotBeABinding() {
        assertThrows(PatternLoweringException.class, () -> ctx.patterns.destructure(variant("Some", bind("x"))));
    }
}
