package info.isaksson.erland.luxtoplugin.emitter.swc;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.EmitBuffer;
import info.isaksson.erland.luxtoplugin.emitter.EmitterWarnings;
import info.isaksson.erland.luxtoplugin.emitter.binding.NodeKind;
import info.isaksson.erland.luxtoplugin.emitter.types.SwcTypeMapper;
import info.isaksson.erland.luxtoplugin.emitter.types.TypeMapper;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrTopLevel;
import info.isaksson.erland.luxtoplugin.ir.IrVariant;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lexical state of one SWC generation run.
 *
 * <p>Besides parameter renames it keeps a scoped type environment: which local names hold
 * which AST node kind (so DSL field names can be mapped to SWC ones) and which Rust type a
 * local was declared with (so captured variables can be typed in hoisted visitor structs).</p>
 */
final class SwcContext {

    final TypeMapper types = new SwcTypeMapper();
    final EmitterWarnings warnings;
    final boolean writer;

    final SwcExprCodegen exprs;
    final SwcPatternLowering patterns;
    final SwcStmtCodegen stmts;

    /** Functions without a {@code self} parameter; bare calls become {@code Self::f(..)}. */
    final Set<String> associatedFns = new HashSet<>();
    final Set<String> enumNames = new HashSet<>();
    /** Variant name to its declaring user enum. */
    final Map<String, String> variantOwners = new HashMap<>();
    /** Inline visitor structs, appended after the unit. */
    final List<String> hoisted = new ArrayList<>();

    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final Deque<Traversal> traversals = new ArrayDeque<>();

    private int inlineSeq;

    /** Name of the plugin or writer struct; qualifies associated fns inside hoisted visitors. */
    final String unitName;

    private static final class Scope {
        final Map<String, String> renames = new HashMap<>();
        final Map<String, NodeKind> kinds = new HashMap<>();
        final Map<String, String> rustTypes = new HashMap<>();
    }

    private static final class Traversal {
        final Set<String> captures;
        final Set<String> state;

        Traversal(Set<String> captures, Set<String> state) {
            this.captures = captures;
            this.state = state;
        }
    }

    SwcContext(IrTopLevel unit, String unitName, EmitterWarnings warnings) {
        this.warnings = warnings;
        this.writer = unit instanceof IrTopLevel.Writer;
        this.unitName = unitName;
        this.exprs = new SwcExprCodegen(this);
        this.patterns = new SwcPatternLowering(this);
        this.stmts = new SwcStmtCodegen(this);
        scopes.push(new Scope());
        if (unit != null) {
            for (IrItem.Enum e : unit.itemsOf(IrItem.Enum.class)) {
                enumNames.add(e.name);
                for (IrVariant v : e.variants) variantOwners.putIfAbsent(v.name, e.name);
            }
        }
        if (unit != null && !(unit instanceof IrTopLevel.Module)) {
            for (IrItem.Function f : unit.itemsOf(IrItem.Function.class)) {
                if (f.params.isEmpty() || !f.params.get(0).isSelf()) associatedFns.add(f.name);
            }
        }
    }

    Backend backend() {
        return Backend.SWC;
    }

    EmitBuffer newBuffer() {
        return EmitBuffer.forBackend(Backend.SWC);
    }

    void pushScope() {
        scopes.push(new Scope());
    }

    void popScope() {
        scopes.pop();
    }

    void rename(String name, String to) {
        scopes.peek().renames.put(name, to);
    }

    void defineKind(String name, NodeKind kind) {
        if (name != null && kind != null) scopes.peek().kinds.put(name, kind);
    }

    void defineType(String name, String rustType) {
        if (name != null && rustType != null) scopes.peek().rustTypes.put(name, rustType);
    }

    String resolve(String name) {
        for (Scope s : scopes) {
            String r = s.renames.get(name);
            if (r != null) return r;
        }
        return name;
    }

    NodeKind kindOf(String name) {
        for (Scope s : scopes) {
            NodeKind k = s.kinds.get(name);
            if (k != null) return k;
        }
        return null;
    }

    String rustTypeOf(String name) {
        for (Scope s : scopes) {
            String t = s.rustTypes.get(name);
            if (t != null) return t;
        }
        return null;
    }

    void pushTraversal(Set<String> captures, Set<String> state) {
        traversals.push(new Traversal(captures, state));
    }

    void popTraversal() {
        traversals.pop();
    }

    boolean inTraversal() {
        return !traversals.isEmpty();
    }

    boolean isCapture(String name) {
        Traversal t = traversals.peek();
        return t != null && t.captures.contains(name);
    }

    boolean isTraverseState(String name) {
        Traversal t = traversals.peek();
        return t != null && t.state.contains(name);
    }

    int nextInlineVisitor() {
        return inlineSeq++;
    }
}
