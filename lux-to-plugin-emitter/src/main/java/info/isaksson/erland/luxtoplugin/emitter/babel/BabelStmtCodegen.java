package info.isaksson.erland.luxtoplugin.emitter.babel;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.EmitBuffer;
import info.isaksson.erland.luxtoplugin.emitter.UnsupportedConstructException;
import info.isaksson.erland.luxtoplugin.emitter.binding.VisitorBinding;
import info.isaksson.erland.luxtoplugin.emitter.binding.VisitorBindingTable;
import info.isaksson.erland.luxtoplugin.ir.IrExpr;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrMatchArm;
import info.isaksson.erland.luxtoplugin.ir.IrParameter;
import info.isaksson.erland.luxtoplugin.ir.IrPattern;
import info.isaksson.erland.luxtoplugin.ir.IrStmt;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Statement lowering for the Babel backend.
 *
 * <p>With {@code tail} set, the last statement of a body yields the function result:
 * expression statements become {@code return}, and if/match push the flag into their
 * branches.</p>
 */
final class BabelStmtCodegen {

    private final BabelContext ctx;

    BabelStmtCodegen(BabelContext ctx) {
        this.ctx = ctx;
    }

    void emitBody(EmitBuffer out, List<IrStmt> stmts, boolean tail) {
        for (int i = 0; i < stmts.size(); i++) {
            boolean last = tail && i == stmts.size() - 1;
            stmts.get(i).accept(new StmtEmitter(out, last));
        }
    }

    void emit(EmitBuffer out, IrStmt stmt) {
        stmt.accept(new StmtEmitter(out, false));
    }

    /** A function body as {@code name(params) { .. }}; the keyword prefix is up to the caller. */
    void emitFunction(EmitBuffer out, String head, IrItem.Function f, Map<String, String> aliases) {
        out.line(head + "(" + paramList(f) + ") {");
        ctx.pushAliases(aliases == null ? Map.of() : aliases);
        try {
            out.indented(() -> emitBody(out, f.body, f.returnsValue()));
        } finally {
            ctx.popAliases();
        }
        out.append("}");
    }

    static String paramList(IrItem.Function f) {
        List<String> names = new ArrayList<>();
        for (IrParameter p : f.valueParams()) names.add(p.name);
        return String.join(", ", names);
    }

    void emitIf(EmitBuffer out, IrStmt.If s, boolean tail) {
        openIf(out, s, "if", tail);
        IrStmt.If current = s;
        while (true) {
            IrStmt.If next = current.elseIf();
            if (next != null && !next.isIfLet()) {
                out.append("} ");
                openIf(out, next, "else if", tail);
                current = next;
                continue;
            }
            if (!current.elseBranch.isEmpty()) {
                out.line("} else {");
                List<IrStmt> elseBranch = current.elseBranch;
                out.indented(() -> emitBody(out, elseBranch, tail));
            }
            break;
        }
        out.line("}");
    }

    private void openIf(EmitBuffer out, IrStmt.If s, String keyword, boolean tail) {
        if (s.isIfLet()) {
            // if-let needs a temporary, so emitIf only ever opens it as a fresh chain
            String temp = ctx.nextIfLet();
            out.lines("const " + temp + " = " + ctx.exprs.expr(s.condition) + ";");
            BabelPatternLowering.Lowered l = ctx.patterns.lower(s.pattern, temp);
            out.line("if (" + l.condition + ") {");
            out.indented(() -> {
                for (String b : l.bindings) out.line(b);
                emitBody(out, s.thenBranch, tail);
            });
            return;
        }
        out.lines(keyword + " (" + ctx.exprs.condition(s.condition) + ") {");
        out.indented(() -> emitBody(out, s.thenBranch, tail));
    }

    void emitMatch(EmitBuffer out, IrExpr scrutinee, List<IrMatchArm> arms, boolean tail) {
        String temp = ctx.nextMatch();
        out.lines("const " + temp + " = " + ctx.exprs.expr(scrutinee) + ";");
        if (arms.isEmpty()) return;
        boolean guarded = arms.stream().anyMatch(a -> a.guard != null);
        if (guarded) {
            emitGuardedMatch(out, temp, arms, tail);
            return;
        }
        for (int i = 0; i < arms.size(); i++) {
            IrMatchArm arm = arms.get(i);
            BabelPatternLowering.Lowered l = ctx.patterns.lower(arm.pattern, temp);
            if (i == 0) {
                out.line("if (" + l.condition + ") {");
            } else if (l.irrefutable()) {
                out.line("} else {");
            } else {
                out.line("} else if (" + l.condition + ") {");
            }
            out.indented(() -> {
                for (String b : l.bindings) out.line(b);
                emitBody(out, arm.body, tail);
            });
            if (i > 0 && l.irrefutable()) break;
        }
        out.line("}");
    }

    private void emitGuardedMatch(EmitBuffer out, String label, List<IrMatchArm> arms, boolean tail) {
        out.line(label + ": {");
        out.indented(() -> {
            for (IrMatchArm arm : arms) {
                BabelPatternLowering.Lowered l = ctx.patterns.lower(arm.pattern, label);
                int opened = 0;
                if (!l.irrefutable()) {
                    out.line("if (" + l.condition + ") {");
                    out.pushIndent();
                    opened++;
                }
                for (String b : l.bindings) out.line(b);
                if (arm.guard != null) {
                    out.lines("if (" + ctx.exprs.condition(arm.guard) + ") {");
                    out.pushIndent();
                    opened++;
                }
                emitBody(out, arm.body, tail);
                out.line("break " + label + ";");
                for (int k = 0; k < opened; k++) {
                    out.popIndent();
                    out.line("}");
                }
            }
        });
        out.line("}");
    }

    private final class StmtEmitter implements IrStmt.Visitor<Void> {
        private final EmitBuffer out;
        private final boolean tail;

        StmtEmitter(EmitBuffer out, boolean tail) {
            this.out = out;
            this.tail = tail;
        }

        @Override
        public Void visitBlock(IrStmt.Block s) {
            out.line("{");
            out.indented(() -> emitBody(out, s.stmts, tail));
            out.line("}");
            return null;
        }

        @Override
        public Void visitLet(IrStmt.Let s) {
            String kw = s.mutable ? "let" : "const";
            if (s.pattern instanceof IrPattern.Wildcard) {
                if (s.init != null) out.lines(ctx.exprs.expr(s.init) + ";");
                return null;
            }
            String target = ctx.patterns.destructure(s.pattern);
            if (s.init instanceof IrExpr.Try) {
                String r = unwrapResult(((IrExpr.Try) s.init).inner);
                out.line(kw + " " + target + " = " + r + ".value;");
            } else if (s.init == null) {
                if (s.type != null) {
                    out.line("let " + target + " = " + ctx.types.defaultValue(s.type) + ";");
                } else {
                    out.line("let " + target + ";");
                }
            } else {
                out.lines(kw + " " + target + " = " + ctx.exprs.expr(s.init) + ";");
            }
            return null;
        }

        @Override
        public Void visitConst(IrStmt.Const s) {
            out.lines("const " + s.name + " = " + ctx.exprs.expr(s.init) + ";");
            return null;
        }

        @Override
        public Void visitExpr(IrStmt.ExprStmt s) {
            IrExpr e = s.expr;
            if (BabelExprCodegen.isChildVisit(e)) {
                out.line("// children are traversed by Babel");
                return null;
            }
            if (e instanceof IrExpr.If) {
                IrExpr.If i = (IrExpr.If) e;
                emitIf(out, new IrStmt.If(i.condition, null, i.thenBranch, i.elseBranch), tail);
                return null;
            }
            if (e instanceof IrExpr.Match) {
                IrExpr.Match m = (IrExpr.Match) e;
                emitMatch(out, m.scrutinee, m.arms, tail);
                return null;
            }
            if (e instanceof IrExpr.Block) {
                visitBlock(new IrStmt.Block(((IrExpr.Block) e).stmts));
                return null;
            }
            if (e instanceof IrExpr.Try) {
                String r = unwrapResult(((IrExpr.Try) e).inner);
                if (tail) out.line("return " + r + ".value;");
                return null;
            }
            String text = ctx.exprs.expr(e);
            if (tail && producesValue(e)) {
                out.lines("return " + text + ";");
            } else {
                out.lines(text + ";");
            }
            return null;
        }

        @Override
        public Void visitIf(IrStmt.If s) {
            emitIf(out, s, tail);
            return null;
        }

        @Override
        public Void visitMatch(IrStmt.Match s) {
            emitMatch(out, s.scrutinee, s.arms, tail);
            return null;
        }

        @Override
        public Void visitFor(IrStmt.For s) {
            if (s.iterable instanceof IrExpr.Range) {
                IrExpr.Range r = (IrExpr.Range) s.iterable;
                if (r.end == null || !(s.pattern instanceof IrPattern.Ident)) {
                    throw new UnsupportedConstructException("open range loop", Backend.BABEL);
                }
                String v = ((IrPattern.Ident) s.pattern).name;
                String start = r.start == null ? "0" : ctx.exprs.expr(r.start);
                String op = r.inclusive ? " <= " : " < ";
                out.line("for (let " + v + " = " + start + "; " + v + op + ctx.exprs.expr(r.end) + "; " + v + "++) {");
            } else {
                out.lines("for (const " + ctx.patterns.destructure(s.pattern) + " of " + ctx.exprs.expr(s.iterable) + ") {");
            }
            out.indented(() -> emitBody(out, s.body, false));
            out.line("}");
            return null;
        }

        @Override
        public Void visitWhile(IrStmt.While s) {
            out.lines("while (" + ctx.exprs.condition(s.condition) + ") {");
            out.indented(() -> emitBody(out, s.body, false));
            out.line("}");
            return null;
        }

        @Override
        public Void visitLoop(IrStmt.Loop s) {
            out.line("while (true) {");
            out.indented(() -> emitBody(out, s.body, false));
            out.line("}");
            return null;
        }

        @Override
        public Void visitReturn(IrStmt.Return s) {
            if (s.value == null) {
                out.line("return;");
            } else if (s.value instanceof IrExpr.Try) {
                String r = unwrapResult(((IrExpr.Try) s.value).inner);
                out.line("return " + r + ".value;");
            } else {
                out.lines("return " + ctx.exprs.expr(s.value) + ";");
            }
            return null;
        }

        @Override
        public Void visitBreak(IrStmt.Break s) {
            out.line("break;");
            return null;
        }

        @Override
        public Void visitContinue(IrStmt.Continue s) {
            out.line("continue;");
            return null;
        }

        @Override
        public Void visitTraverse(IrStmt.Traverse s) {
            emitTraverse(out, s);
            return null;
        }

        @Override
        public Void visitVerbatim(IrStmt.Verbatim s) {
            if (s.language == IrStmt.Verbatim.Language.JAVASCRIPT) {
                out.lines(s.code);
            } else {
                out.line("// SWC-only code omitted");
            }
            return null;
        }

        /** Evaluates a Result-valued call and returns early with its error. */
        private String unwrapResult(IrExpr inner) {
            String r = ctx.nextResult();
            out.lines("const " + r + " = " + ctx.exprs.expr(inner) + ";");
            out.line("if (!" + r + ".ok) {");
            out.indented(() -> out.line("return { ok: false, error: " + r + ".error };"));
            out.line("}");
            return r;
        }
    }

    private static boolean producesValue(IrExpr e) {
        return !(e instanceof IrExpr.Assign) && !(e instanceof IrExpr.CompoundAssign);
    }

    void emitTraverse(EmitBuffer out, IrStmt.Traverse s) {
        String target = ctx.exprs.expr(s.target);
        boolean local = "node".equals(target) || "path".equals(target);
        if (s.isDelegated()) {
            out.line(local
                    ? "path.traverse(" + s.visitorName + ");"
                    : "path.scope.traverse(" + target + ", " + s.visitorName + ");");
            return;
        }
        if (!s.captures.isEmpty()) {
            out.line("// Captures: " + String.join(", ", s.captures));
        }
        String visitor = ctx.nextVisitor();
        String state = visitor + "_state";

        List<String> stateInits = new ArrayList<>();
        Set<String> stateNames = new LinkedHashSet<>();
        for (IrStmt.Let let : s.state) {
            String name = ctx.patterns.destructure(let.pattern);
            stateNames.add(name);
            String init = let.init != null
                    ? ctx.exprs.expr(let.init)
                    : (let.type != null ? ctx.types.defaultValue(let.type) : "undefined");
            stateInits.add(name + ": " + init + ",");
        }
        if (stateInits.isEmpty()) {
            out.line("const " + state + " = {};");
        } else {
            out.line("const " + state + " = {");
            out.indented(() -> stateInits.forEach(out::lines));
            out.line("};");
        }

        VisitorBindingTable.Partition parts = VisitorBindingTable.partition(s.methods, true, ctx.warnings);
        Set<String> added = new LinkedHashSet<>();
        for (IrItem.Function helper : parts.helpers) {
            if (ctx.unitFunctions.add(helper.name)) added.add(helper.name);
        }
        ctx.pushTraverseState(stateNames);
        try {
            for (IrItem.Function helper : parts.helpers) {
                emitFunction(out, "function " + helper.name, helper, Map.of());
                out.newline();
            }
            out.line("const " + visitor + " = {");
            out.indented(() -> {
                for (VisitorBinding b : parts.visitors) {
                    emitInlineVisitorMethod(out, b);
                }
            });
            out.line("};");
        } finally {
            ctx.popTraverseState();
            ctx.unitFunctions.removeAll(added);
        }
        out.line(local
                ? "path.traverse(" + visitor + ", " + state + ");"
                : "path.scope.traverse(" + target + ", " + visitor + ", " + state + ");");
    }

    private void emitInlineVisitorMethod(EmitBuffer out, VisitorBinding b) {
        IrItem.Function f = b.method;
        List<IrParameter> params = f.valueParams();
        out.line(b.hookName(Backend.BABEL) + "(path) {");
        Map<String, String> aliases = new HashMap<>();
        if (params.size() > 1) aliases.put(params.get(1).name, "path");
        ctx.pushAliases(aliases);
        try {
            out.indented(() -> {
                if (!params.isEmpty()) out.line("const " + params.get(0).name + " = path.node;");
                emitBody(out, f.body, false);
            });
        } finally {
            ctx.popAliases();
        }
        out.line("},");
    }
}
