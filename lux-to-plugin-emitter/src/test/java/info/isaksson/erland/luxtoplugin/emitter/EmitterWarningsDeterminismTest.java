package info.isaksson.erland.luxtoplugin.emitter;

import info.isaksson.erland.luxtoplugin.ir.IrSourceRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EmitterWarningsDeterminismTest {

    @Test
    public void warningsAreSortedDeterministically() {
        EmitterWarnings w = new EmitterWarnings();
        w.warn("MissingVisitorBinding", "visit_b", Map.of("method", "visit_b"));
        w.warn("Custom", "ccc", Map.of("a", "1"));
        w.warn("Custom", "bbb", Map.of("z", "9"));
        w.warn("Custom", "bbb", Map.of("a", "0"));

        List<EmitterWarning> out = w.toDeterministicList();
        assertEquals(4, out.size());
        assertEquals("Custom", out.get(0).code);
        assertEquals(Map.of("a", "0"), out.get(0).context);
        assertEquals(Map.of("z", "9"), out.get(1).context);
        assertEquals("ccc", out.get(2).message);
        assertEquals("MissingVisitorBinding", out.get(3).code);
    }

    @Test
    public void repeatedWarningIsKeptOnce() {
        EmitterWarnings w = new EmitterWarnings();
        w.warn(EmitterWarning.MISSING_VISITOR_BINDING, "visit_x", Map.of("method", "visit_x"));
        w.warn(EmitterWarning.MISSING_VISITOR_BINDING, "visit_x", Map.of("method", "visit_x"));
        w.warn(EmitterWarning.MISSING_VISITOR_BINDING, "visit_x", null);

        assertEquals(2, w.toDeterministicList().size());
        assertFalse(w.isEmpty());
        assertTrue(new EmitterWarnings().isEmpty());
    }

    @Test
    public void missingVisitorBindingCarriesMethodAndLocation() {
        EmitterWarnings w = new EmitterWarnings();
        w.add(EmitterWarning.missingVisitorBinding("visit_frob", IrSourceRef.at(2, 1)));
        w.add(EmitterWarning.missingVisitorBinding("visit_frob", IrSourceRef.at(2, 1)));

        List<EmitterWarning> out = w.toDeterministicList();
        assertEquals(1, out.size());
        assertEquals("visit_frob", out.get(0).context.get("method"));
        assertTrue(out.get(0).toString().startsWith("warning[MissingVisitorBinding]: "));
        assertTrue(out.get(0).toString().endsWith(" at 2:1"), out.get(0).toString());
    }

    @Test
    public void listIsUnmodifiable() {
        EmitterWarnings w = new EmitterWarnings();
        w.warn("A", "a", Map.of());
        assertThrows(UnsupportedOperationException.class, () -> w.toDeterministicList().clear());
    }
}
