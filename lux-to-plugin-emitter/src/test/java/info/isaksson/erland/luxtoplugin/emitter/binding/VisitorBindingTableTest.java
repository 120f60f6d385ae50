package info.isaksson.erland.luxtoplugin.emitter.binding;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.EmitterWarning;
import info.isaksson.erland.luxtoplugin.emitter.EmitterWarnings;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.luxtoplugin.emitter.TestIr.*;
import static org.junit.jupiter.api.Assertions.*;

public class VisitorBindingTableTest {

    @Test
    void bindsKnownVisitorsAndKeepsHelpers() {
        IrItem.Function call = visitor("visit_call_expression", "CallExpression");
        IrItem.Function helper = fn("is_console", List.of(), null);
        EmitterWarnings warnings = new EmitterWarnings();

        VisitorBindingTable.Partition p = VisitorBindingTable.partition(List.of(call, helper), true, warnings);

        assertEquals(1, p.visitors.size());
        VisitorBinding b = p.visitors.get(0);
        assertEquals(NodeKind.CALL_EXPRESSION, b.kind);
        assertEquals("CallExpression", b.hookName(Backend.BABEL));
        assertEquals("visit_mut_call_expr", b.hookName(Backend.SWC));
        assertEquals(List.of(helper), p.helpers);
        assertTrue(warnings.isEmpty());
    }

    @Test
    void writersUseReadOnlyHooks() {
        VisitorBindingTable.Partition p = VisitorBindingTable.partition(
                List.of(visitor("visit_identifier", "Identifier")), false, null);
        assertEquals("visit_ident", p.visitors.get(0).hookName(Backend.SWC));
    }

    @Test
    void unknownVisitorNameWarnsAndBecomesHelper() {
        IrItem.Function odd = visitor("visit_frobnicator", "Frobnicator");
        EmitterWarnings warnings = new EmitterWarnings();

        VisitorBindingTable.Partition p = VisitorBindingTable.partition(List.of(odd, odd), true, warnings);

        assertTrue(p.visitors.isEmpty());
        assertEquals(2, p.helpers.size());
        List<EmitterWarning> list = warnings.toDeterministicList();
        assertEquals(1, list.size());
        assertEquals(EmitterWarning.MISSING_VISITOR_BINDING, list.get(0).code);
        assertEquals("visit_frobnicator", list.get(0).context.get("method"));
    }

    @Test
    void nodeKindLookups() {
        assertEquals(NodeKind.CALL_EXPRESSION, NodeKind.forName("Expression::CallExpression"));
        assertNull(NodeKind.forName("NoSuchNode"));
        assertEquals("args", NodeKind.CALL_EXPRESSION.swcFieldName("arguments"));
        assertEquals("arguments", NodeKind.CALL_EXPRESSION.sequenceField().babel());
        assertEquals("call_expr", NodeKind.CALL_EXPRESSION.swcBinder());
        assertEquals("isCallExpression", NodeKind.CALL_EXPRESSION.babelChecker());
    }
}
