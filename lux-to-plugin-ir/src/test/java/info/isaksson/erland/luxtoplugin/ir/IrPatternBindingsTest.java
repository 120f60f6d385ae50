package info.isaksson.erland.luxtoplugin.ir;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class IrPatternBindingsTest {

    @Test
    void collectsNamesInFirstOccurrenceOrder() {
        IrPattern p = new IrPattern.Variant("CallExpression", new IrPattern.Array(List.of(
                new IrPattern.Ident("head"),
                new IrPattern.Rest(new IrPattern.Ident("tail")),
                new IrPattern.Ident("head"))));

        assertEquals(List.of("head", "tail"), IrPatternBindings.of(p));
    }

    @Test
    void wildcardsAndLiteralsBindNothing() {
        IrPattern p = new IrPattern.Tuple(List.of(
                new IrPattern.Wildcard(),
                new IrPattern.Literal(IrLiteral.integer(1)),
                new IrPattern.Ident("_")));

        assertEquals(List.of(), IrPatternBindings.of(p));
    }

    @Test
    void objectKeysPrecedeRenamedValues() {
        IrPattern p = new IrPattern.ObjectPattern(List.of(
                IrObjectProp.shorthand("a"),
                IrObjectProp.keyValue("b", new IrPattern.Ident("renamed")),
                IrObjectProp.rest("others")));

        assertEquals(List.of("a", "others", "renamed"), IrPatternBindings.of(p));
    }

    @Test
    void structFieldsDefaultToTheirOwnName() {
        IrPattern p = new IrPattern.Struct("CallExpr", List.of(
                new IrFieldPattern("callee", null),
                new IrFieldPattern("args", new IrPattern.Ident("a"))));

        assertEquals(List.of("callee", "a"), IrPatternBindings.of(p));
    }
}
