package info.isaksson.erland.luxtoplugin.emitter.types;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.UnsupportedConstructException;
import info.isaksson.erland.luxtoplugin.ir.IrBinaryOp;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import info.isaksson.erland.luxtoplugin.ir.IrUnaryOp;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeMapperTest {

    private final TypeMapper swc = TypeMapper.forBackend(Backend.SWC);
    private final TypeMapper babel = TypeMapper.forBackend(Backend.BABEL);

    private static IrTypeRef str() {
        return IrTypeRef.primitive("Str");
    }

    @Test
    void swcTypes() {
        assertEquals("String", swc.mapType(str()));
        assertEquals("i32", swc.mapType(IrTypeRef.primitive("Number")));
        assertEquals("Vec<String>", swc.mapType(IrTypeRef.arrayOf(str())));
        assertEquals("Option<bool>", swc.mapType(IrTypeRef.optional(IrTypeRef.primitive("bool"))));
        assertEquals("HashMap<String, i32>",
                swc.mapType(IrTypeRef.container("HashMap", List.of(str(), IrTypeRef.primitive("i32")))));
        assertEquals("&mut CallExpr", swc.mapType(IrTypeRef.reference(IrTypeRef.named("CallExpression"), true)));
        assertEquals("(String,)", swc.mapType(IrTypeRef.tuple(List.of(str()))));
        assertEquals("()", swc.mapType(IrTypeRef.unit()));
        assertEquals("Config", swc.mapType(IrTypeRef.named("Config")));
    }

    @Test
    void babelTypesAreJsDoc() {
        assertEquals("string", babel.mapType(str()));
        assertEquals("number", babel.mapType(IrTypeRef.primitive("f64")));
        assertEquals("Map<string, number>",
                babel.mapType(IrTypeRef.container("HashMap", List.of(str(), IrTypeRef.primitive("i32")))));
        assertEquals("string|null", babel.mapType(IrTypeRef.optional(str())));
        assertEquals("CallExpression", babel.mapType(IrTypeRef.reference(IrTypeRef.named("CallExpression"), false)));
    }

    @Test
    void unknownContainerIsUnsupported() {
        IrTypeRef weird = IrTypeRef.container("BTreeMap", List.of(str(), str()));
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class, () -> swc.mapType(weird));
        assertEquals(Backend.SWC, e.backend());
        assertThrows(UnsupportedConstructException.class, () -> babel.mapType(weird));
    }

    @Test
    void nullCoalescingHasNoRustForm() {
        assertEquals("??", babel.binaryOp(IrBinaryOp.NULL_COALESCE));
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> swc.binaryOp(IrBinaryOp.NULL_COALESCE));
        assertTrue(e.getMessage().contains("??"));
        assertThrows(UnsupportedConstructException.class, () -> swc.binaryOp(IrBinaryOp.POW));
    }

    @Test
    void equalityIsStrictInJavaScript() {
        assertEquals("===", babel.binaryOp(IrBinaryOp.EQ));
        assertEquals("!==", babel.binaryOp(IrBinaryOp.NOT_EQ));
        assertEquals("==", swc.binaryOp(IrBinaryOp.EQ));
    }

    @Test
    void referencesEraseInJavaScript() {
        assertEquals("", babel.unaryOp(IrUnaryOp.REF_MUT));
        assertEquals("", babel.unaryOp(IrUnaryOp.DEREF));
        assertEquals("!", babel.unaryOp(IrUnaryOp.NOT));
        assertEquals("&mut ", swc.unaryOp(IrUnaryOp.REF_MUT));
    }

    @Test
    void defaults() {
        assertEquals("String::new()", swc.defaultValue(str()));
        assertEquals("0", swc.defaultValue(IrTypeRef.primitive("usize")));
        assertEquals("HashSet::new()", swc.defaultValue(IrTypeRef.container("HashSet", List.of(str()))));
        assertEquals("None", swc.defaultValue(IrTypeRef.optional(str())));
        assertEquals("\"\"", babel.defaultValue(str()));
        assertEquals("new Map()", babel.defaultValue(IrTypeRef.container("HashMap", List.of(str(), str()))));
        assertEquals("[]", babel.defaultValue(IrTypeRef.arrayOf(str())));
        assertEquals("null", babel.defaultValue(IrTypeRef.optional(str())));
    }
}
