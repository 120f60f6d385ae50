package info.isaksson.erland.luxtoplugin.emitter.babel;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.EmitBuffer;
import info.isaksson.erland.luxtoplugin.emitter.EmitterWarnings;
import info.isaksson.erland.luxtoplugin.emitter.types.BabelTypeMapper;
import info.isaksson.erland.luxtoplugin.emitter.types.TypeMapper;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrTopLevel;
import info.isaksson.erland.luxtoplugin.ir.IrVariant;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Lexical state of one Babel generation run: parameter aliases, traverse scopes and the
 * counters behind generated temporaries. Created per call, never shared.
 */
final class BabelContext {

    final TypeMapper types = new BabelTypeMapper();
    final EmitterWarnings warnings;
    final boolean writer;

    final BabelExprCodegen exprs;
    final BabelPatternLowering patterns;
    final BabelStmtCodegen stmts;

    /** Functions declared at unit level; {@code self.f(..)} calls them with {@code this} bound. */
    final Set<String> unitFunctions = new HashSet<>();
    /** Variant name to its declaring user enum. */
    final Map<String, String> variantOwners = new HashMap<>();
    final Set<String> enumNames = new HashSet<>();
    /** Class whose methods are being emitted; {@code Self::f} resolves against it. */
    String currentClass;

    private final Deque<Map<String, String>> aliases = new ArrayDeque<>();
    private final Deque<Set<String>> traverseStates = new ArrayDeque<>();

    private int visitorSeq;
    private int ifLetSeq;
    private int matchSeq;
    private int resultSeq;

    BabelContext(IrTopLevel unit, EmitterWarnings warnings) {
        this.warnings = warnings;
        this.writer = unit instanceof IrTopLevel.Writer;
        this.exprs = new BabelExprCodegen(this);
        this.patterns = new BabelPatternLowering(this);
        this.stmts = new BabelStmtCodegen(this);
        if (unit != null) {
            for (IrItem item : unit.items()) {
                if (item instanceof IrItem.Function) {
                    unitFunctions.add(item.name());
                } else if (item instanceof IrItem.Hook && ((IrItem.Hook) item).function != null) {
                    unitFunctions.add(item.name());
                } else if (item instanceof IrItem.Enum) {
                    IrItem.Enum e = (IrItem.Enum) item;
                    enumNames.add(e.name);
                    for (IrVariant v : e.variants) {
                        variantOwners.putIfAbsent(v.name, e.name);
                    }
                }
            }
        }
    }

    Backend backend() {
        return Backend.BABEL;
    }

    EmitBuffer newBuffer() {
        return EmitBuffer.forBackend(Backend.BABEL);
    }

    void pushAliases(Map<String, String> scope) {
        aliases.push(scope);
    }

    void popAliases() {
        aliases.pop();
    }

    /** The JavaScript name a DSL identifier resolves to in the current scope. */
    String resolve(String name) {
        for (Map<String, String> scope : aliases) {
            String mapped = scope.get(name);
            if (mapped != null) return mapped;
        }
        return name;
    }

    void pushTraverseState(Set<String> names) {
        traverseStates.push(names);
    }

    void popTraverseState() {
        traverseStates.pop();
    }

    boolean isTraverseState(String name) {
        Iterator<Set<String>> it = traverseStates.iterator();
        return it.hasNext() && it.next().contains(name);
    }

    String nextVisitor() {
        return "__visitor_" + (++visitorSeq);
    }

    String nextIfLet() {
        return "__iflet_" + (++ifLetSeq);
    }

    String nextMatch() {
        return "__match_" + (++matchSeq);
    }

    String nextResult() {
        return "__result_" + (++resultSeq);
    }
}
