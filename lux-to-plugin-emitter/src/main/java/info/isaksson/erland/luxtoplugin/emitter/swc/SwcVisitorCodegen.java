package info.isaksson.erland.luxtoplugin.emitter.swc;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.CodegenException;
import info.isaksson.erland.luxtoplugin.emitter.EmitBuffer;
import info.isaksson.erland.luxtoplugin.emitter.binding.VisitorBinding;
import info.isaksson.erland.luxtoplugin.ir.IrParameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code impl VisitMut for X} (plugins) or {@code impl Visit for X} (writers) block.
 *
 * <p>Several DSL methods may bind to one SWC hook, e.g. two methods both mapping to
 * {@code visit_mut_bin_expr}. Their bodies are merged into one hook, each in its own block.</p>
 */
final class SwcVisitorCodegen {

    private final SwcContext ctx;

    SwcVisitorCodegen(SwcContext ctx) {
        this.ctx = ctx;
    }

    void emitVisitImpl(EmitBuffer out, String typeName, List<VisitorBinding> visitors) {
        Map<String, List<VisitorBinding>> byHook = new LinkedHashMap<>();
        for (VisitorBinding b : visitors) {
            byHook.computeIfAbsent(b.hookName(Backend.SWC), k -> new ArrayList<>()).add(b);
        }
        out.line("impl " + (ctx.writer ? "Visit" : "VisitMut") + " for " + typeName + " {");
        out.indented(() -> {
            boolean first = true;
            for (Map.Entry<String, List<VisitorBinding>> e : byHook.entrySet()) {
                if (!first) out.blankLine();
                first = false;
                emitHook(out, e.getKey(), e.getValue());
            }
        });
        out.line("}");
    }

    private void emitHook(EmitBuffer out, String hook, List<VisitorBinding> bindings) {
        VisitorBinding head = bindings.get(0);
        String ref = ctx.writer ? "&" : "&mut ";
        out.line("fn " + hook + "(&mut self, n: " + ref + head.kind.swcType + ") {");
        boolean merged = bindings.size() > 1;
        boolean visitsChildren = false;
        for (VisitorBinding b : bindings) {
            visitsChildren |= SwcStmtCodegen.visitsChildren(b.method.body);
        }
        boolean explicitChildren = visitsChildren;
        out.indented(() -> {
            for (VisitorBinding b : bindings) {
                if (merged) out.line("{");
                ctx.pushScope();
                try {
                    bindParams(b);
                    if (merged) {
                        out.indented(() -> ctx.stmts.emitBody(out, b.method.body, false));
                    } else {
                        ctx.stmts.emitBody(out, b.method.body, false);
                    }
                } catch (CodegenException e) {
                    throw e.at(b.method.source);
                } finally {
                    ctx.popScope();
                }
                if (merged) out.line("}");
            }
            if (!explicitChildren) {
                out.line(ctx.writer ? "n.visit_children_with(self);" : "n.visit_mut_children_with(self);");
            }
        });
        out.line("}");
    }

    private void bindParams(VisitorBinding b) {
        ctx.defineKind("n", b.kind);
        List<IrParameter> params = b.method.valueParams();
        for (int i = 0; i < params.size() && i < 2; i++) {
            String name = params.get(i).name;
            ctx.rename(name, "n");
            ctx.defineKind(name, b.kind);
        }
    }
}
