package info.isaksson.erland.luxtoplugin.emitter.babel;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.EmitBuffer;
import info.isaksson.erland.luxtoplugin.emitter.binding.NodeKind;
import info.isaksson.erland.luxtoplugin.emitter.binding.VisitorBinding;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrParameter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code visitor: { .. }} object of a plugin. Each bound method becomes
 * {@code Key(path) { const node = path.node; .. }}; the first DSL parameter is aliased to
 * {@code node}, the second to {@code path}.
 */
final class BabelVisitorCodegen {

    private static final List<String> EXIT_ARGS = List.of("path.node", "state", "builder");

    private final BabelContext ctx;

    BabelVisitorCodegen(BabelContext ctx) {
        this.ctx = ctx;
    }

    void emitVisitorObject(EmitBuffer out, List<VisitorBinding> visitors, IrItem.Function exitHook) {
        VisitorBinding program = null;
        for (VisitorBinding b : visitors) {
            if (b.kind == NodeKind.PROGRAM) {
                program = b;
                break;
            }
        }
        boolean programBlock = exitHook != null || ctx.writer;
        VisitorBinding enter = program;
        out.line("visitor: {");
        out.indented(() -> {
            if (programBlock) {
                out.line("Program: {");
                out.indented(() -> {
                    if (enter != null) emitMethod(out, "enter", enter);
                    emitExit(out, exitHook);
                });
                out.line("},");
            }
            for (VisitorBinding b : visitors) {
                if (programBlock && b == enter) continue;
                emitMethod(out, b.hookName(Backend.BABEL), b);
            }
        });
        out.line("},");
    }

    private void emitExit(EmitBuffer out, IrItem.Function exitHook) {
        out.line("exit(path, state) {");
        out.indented(() -> {
            String call = null;
            if (exitHook != null) {
                int limit = Math.min(exitHook.valueParams().size(), ctx.writer ? 3 : 2);
                List<String> args = new ArrayList<>(EXIT_ARGS.subList(0, limit));
                args.add(0, "this");
                call = exitHook.name + ".call(" + String.join(", ", args) + ")";
            }
            if (!ctx.writer) {
                out.line(call + ";");
            } else if (call != null && exitHook.returnsValue()) {
                out.line("const __output = " + call + ";");
                out.line("state.file.metadata.output = __output !== undefined ? __output : builder.toString();");
            } else {
                if (call != null) out.line(call + ";");
                out.line("state.file.metadata.output = builder.toString();");
            }
        });
        out.line("},");
    }

    private void emitMethod(EmitBuffer out, String key, VisitorBinding binding) {
        IrItem.Function f = binding.method;
        List<IrParameter> params = f.valueParams();
        Map<String, String> aliases = new HashMap<>();
        if (!params.isEmpty()) aliases.put(params.get(0).name, "node");
        if (params.size() > 1) aliases.put(params.get(1).name, "path");
        out.line(key + "(path) {");
        ctx.pushAliases(aliases);
        try {
            out.indented(() -> {
                out.line("const node = path.node;");
                ctx.stmts.emitBody(out, f.body, false);
            });
        } finally {
            ctx.popAliases();
        }
        out.line("},");
    }
}
