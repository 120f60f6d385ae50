package info.isaksson.erland.luxtoplugin.emitter.swc;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.EmitBuffer;
import info.isaksson.erland.luxtoplugin.emitter.UnsupportedConstructException;
import info.isaksson.erland.luxtoplugin.emitter.binding.NodeKind;
import info.isaksson.erland.luxtoplugin.emitter.binding.VisitorBinding;
import info.isaksson.erland.luxtoplugin.emitter.binding.VisitorBindingTable;
import info.isaksson.erland.luxtoplugin.ir.IrExpr;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrLiteral;
import info.isaksson.erland.luxtoplugin.ir.IrMatchArm;
import info.isaksson.erland.luxtoplugin.ir.IrParameter;
import info.isaksson.erland.luxtoplugin.ir.IrPattern;
import info.isaksson.erland.luxtoplugin.ir.IrScanner;
import info.isaksson.erland.luxtoplugin.ir.IrStmt;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRefKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Statement lowering for the SWC backend. With {@code value} set, the last expression
 * statement of a body stays a tail expression without a semicolon.
 */
final class SwcStmtCodegen {

    private final SwcContext ctx;

    SwcStmtCodegen(SwcContext ctx) {
        this.ctx = ctx;
    }

    static boolean isSelf(IrExpr e) {
        return e instanceof IrExpr.Ident && "self".equals(((IrExpr.Ident) e).name);
    }

    void emitBody(EmitBuffer out, List<IrStmt> stmts, boolean value) {
        for (int i = 0; i < stmts.size(); i++) {
            boolean last = value && i == stmts.size() - 1;
            stmts.get(i).accept(new StmtEmitter(out, last));
        }
    }

    /**
     * A free function or method. {@code self} becomes {@code &self} for a shared reference
     * type and {@code &mut self} otherwise.
     */
    void emitFunction(EmitBuffer out, IrItem.Function f, boolean pub) {
        List<String> params = new ArrayList<>();
        for (IrParameter p : f.params) {
            if (p.isSelf()) {
                boolean shared = p.type.kind == IrTypeRefKind.REFERENCE && !p.type.mutable;
                params.add(shared ? "&self" : "&mut self");
            } else {
                params.add(p.name + ": " + ctx.types.mapType(p.type));
            }
        }
        String ret = f.returnsValue() ? " -> " + ctx.types.mapType(f.returnType) : "";
        out.line((pub ? "pub fn " : "fn ") + f.name + "(" + String.join(", ", params) + ")" + ret + " {");
        ctx.pushScope();
        try {
            for (IrParameter p : f.valueParams()) declare(p.name, p.type);
            out.indented(() -> emitBody(out, f.body, f.returnsValue()));
        } finally {
            ctx.popScope();
        }
        out.line("}");
    }

    /** Records a local's Rust type and, for AST node types, its node kind. */
    void declare(String name, IrTypeRef type) {
        if (type == null) return;
        ctx.defineType(name, ctx.types.mapType(type));
        IrTypeRef base = type.dereferenced();
        if (base.kind == IrTypeRefKind.NAMED) ctx.defineKind(name, NodeKind.forName(base.name));
    }

    void emitIf(EmitBuffer out, IrStmt.If s, boolean value) {
        out.lines(ifHead(s) + " {");
        block(out, s.thenBranch, value);
        IrStmt.If current = s;
        while (true) {
            IrStmt.If next = current.elseIf();
            if (next != null) {
                out.lines("} else " + ifHead(next) + " {");
                block(out, next.thenBranch, value);
                current = next;
                continue;
            }
            if (!current.elseBranch.isEmpty()) {
                out.line("} else {");
                block(out, current.elseBranch, value);
            }
            break;
        }
        out.line("}");
    }

    private String ifHead(IrStmt.If s) {
        if (s.isIfLet()) {
            return "if let " + ctx.patterns.lower(s.pattern) + " = " + ctx.exprs.expr(s.condition);
        }
        return "if " + ctx.exprs.condition(s.condition);
    }

    private void block(EmitBuffer out, List<IrStmt> body, boolean value) {
        ctx.pushScope();
        try {
            out.indented(() -> emitBody(out, body, value));
        } finally {
            ctx.popScope();
        }
    }

    void emitMatch(EmitBuffer out, IrExpr scrutinee, List<IrMatchArm> arms, boolean value) {
        out.lines("match " + ctx.exprs.condition(scrutinee) + " {");
        out.indented(() -> {
            for (IrMatchArm arm : arms) {
                ctx.pushScope();
                try {
                    String head = ctx.patterns.lower(arm.pattern);
                    if (arm.guard != null) head += " if " + ctx.exprs.condition(arm.guard);
                    out.lines(head + " => {");
                    out.indented(() -> emitBody(out, arm.body, value));
                    out.line("}");
                } finally {
                    ctx.popScope();
                }
            }
        });
        out.line("}");
    }

    static boolean visitsChildren(List<IrStmt> body) {
        boolean[] found = {false};
        new IrScanner() {
            @Override
            protected void onExpr(IrExpr expr) {
                if (expr instanceof IrExpr.Call && ((IrExpr.Call) expr).callee instanceof IrExpr.Member) {
                    String p = ((IrExpr.Member) ((IrExpr.Call) expr).callee).property;
                    if ("visit_children".equals(p)) found[0] = true;
                }
            }
        }.scanStmts(body);
        return found[0];
    }

    private static String literalType(IrExpr init) {
        if (!(init instanceof IrExpr.Literal)) return null;
        IrLiteral lit = ((IrExpr.Literal) init).literal;
        switch (lit.type) {
            case STRING: return "String";
            case INT: return "i32";
            case FLOAT: return "f64";
            case BOOL: return "bool";
            default: return null;
        }
    }

    private static boolean isStringLiteral(IrExpr e) {
        return e instanceof IrExpr.Literal && ((IrExpr.Literal) e).literal.type == IrLiteral.Type.STRING;
    }

    private final class StmtEmitter implements IrStmt.Visitor<Void> {
        private final EmitBuffer out;
        private final boolean value;

        StmtEmitter(EmitBuffer out, boolean value) {
            this.out = out;
            this.value = value;
        }

        @Override
        public Void visitBlock(IrStmt.Block s) {
            out.line("{");
            block(out, s.stmts, value);
            out.line("}");
            return null;
        }

        @Override
        public Void visitLet(IrStmt.Let s) {
            String pattern = ctx.patterns.lower(s.pattern);
            String type = s.type == null ? null : ctx.types.mapType(s.type);
            StringBuilder sb = new StringBuilder("let ");
            if (s.mutable) sb.append("mut ");
            sb.append(pattern);
            if (type != null) sb.append(": ").append(type);
            if (s.init != null) {
                String init = ctx.exprs.expr(s.init);
                boolean wantsString = type == null || "String".equals(type);
                if (isStringLiteral(s.init) && wantsString) init += ".to_string()";
                sb.append(" = ").append(init);
            } else if (s.type != null) {
                sb.append(" = ").append(ctx.types.defaultValue(s.type));
            }
            out.lines(sb.append(';').toString());
            if (s.pattern instanceof IrPattern.Ident) {
                String name = ((IrPattern.Ident) s.pattern).name;
                if (s.type != null) declare(name, s.type);
                else ctx.defineType(name, literalType(s.init));
            }
            return null;
        }

        @Override
        public Void visitConst(IrStmt.Const s) {
            String type;
            if (s.type != null) {
                type = isStringLiteral(s.init) ? "&str" : ctx.types.mapType(s.type);
            } else {
                type = literalType(s.init);
                if ("String".equals(type)) type = "&str";
            }
            if (type == null) {
                throw new UnsupportedConstructException("const " + s.name + " without a type", Backend.SWC);
            }
            out.lines("const " + s.name + ": " + type + " = " + ctx.exprs.expr(s.init) + ";");
            return null;
        }

        @Override
        public Void visitExpr(IrStmt.ExprStmt s) {
            IrExpr e = s.expr;
            if (e instanceof IrExpr.If) {
                IrExpr.If i = (IrExpr.If) e;
                emitIf(out, new IrStmt.If(i.condition, null, i.thenBranch, i.elseBranch), value);
                return null;
            }
            if (e instanceof IrExpr.Match) {
                IrExpr.Match m = (IrExpr.Match) e;
                emitMatch(out, m.scrutinee, m.arms, value);
                return null;
            }
            if (e instanceof IrExpr.Block) {
                visitBlock(new IrStmt.Block(((IrExpr.Block) e).stmts));
                return null;
            }
            String text = ctx.exprs.expr(e);
            boolean tail = value && !(e instanceof IrExpr.Assign) && !(e instanceof IrExpr.CompoundAssign);
            out.lines(tail ? text : text + ";");
            return null;
        }

        @Override
        public Void visitIf(IrStmt.If s) {
            emitIf(out, s, value);
            return null;
        }

        @Override
        public Void visitMatch(IrStmt.Match s) {
            emitMatch(out, s.scrutinee, s.arms, value);
            return null;
        }

        @Override
        public Void visitFor(IrStmt.For s) {
            ctx.pushScope();
            try {
                out.lines("for " + ctx.patterns.lower(s.pattern) + " in " + ctx.exprs.expr(s.iterable) + " {");
                out.indented(() -> emitBody(out, s.body, false));
                out.line("}");
            } finally {
                ctx.popScope();
            }
            return null;
        }

        @Override
        public Void visitWhile(IrStmt.While s) {
            out.lines("while " + ctx.exprs.condition(s.condition) + " {");
            block(out, s.body, false);
            out.line("}");
            return null;
        }

        @Override
        public Void visitLoop(IrStmt.Loop s) {
            out.line("loop {");
            block(out, s.body, false);
            out.line("}");
            return null;
        }

        @Override
        public Void visitReturn(IrStmt.Return s) {
            out.lines(s.value == null ? "return;" : "return " + ctx.exprs.expr(s.value) + ";");
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
            if (s.language != IrStmt.Verbatim.Language.RUST) {
                out.line("// Babel-only code omitted");
                return null;
            }
            String code = s.code.stripTrailing();
            if (!code.endsWith(";") && !code.endsWith("}")) code += ";";
            out.lines(code);
            return null;
        }
    }

    void emitTraverse(EmitBuffer out, IrStmt.Traverse s) {
        String target = ctx.exprs.expr(s.target);
        if (s.isDelegated()) {
            out.line("let mut __visitor = " + s.visitorName + "::default();");
            out.line(target + ".visit_mut_with(&mut __visitor);");
            return;
        }
        String name = "__InlineVisitor_" + ctx.nextInlineVisitor();
        boolean captures = !s.captures.isEmpty();
        String lt = captures ? "<'a>" : "";

        Set<String> stateNames = new LinkedHashSet<>();
        List<String> stateFields = new ArrayList<>();
        List<String> stateInits = new ArrayList<>();
        for (IrStmt.Let let : s.state) {
            if (!(let.pattern instanceof IrPattern.Ident)) {
                throw new UnsupportedConstructException("destructuring traverse state", Backend.SWC);
            }
            String field = ((IrPattern.Ident) let.pattern).name;
            stateNames.add(field);
            String type = let.type != null ? ctx.types.mapType(let.type) : literalType(let.init);
            stateFields.add(field + ": " + (type == null ? "i32" : type) + ",");
            String init = let.init != null
                    ? ctx.exprs.expr(let.init) + (isStringLiteral(let.init) ? ".to_string()" : "")
                    : (let.type != null ? ctx.types.defaultValue(let.type) : "0");
            stateInits.add(field + ": " + init + ",");
        }

        EmitBuffer h = ctx.newBuffer();
        h.line("struct " + name + lt + " {");
        h.indented(() -> {
            for (String c : s.captures) {
                String type = ctx.rustTypeOf(c);
                h.line(c + ": &'a mut " + (type == null ? "i32" : type) + ",");
            }
            stateFields.forEach(h::line);
        });
        h.line("}");

        VisitorBindingTable.Partition parts = VisitorBindingTable.partition(s.methods, true, ctx.warnings);
        ctx.pushTraversal(new LinkedHashSet<>(s.captures), stateNames);
        try {
            if (!parts.helpers.isEmpty()) {
                h.blankLine();
                h.line("impl" + lt + " " + name + lt + " {");
                h.indented(() -> {
                    for (IrItem.Function helper : parts.helpers) emitFunction(h, helper, false);
                });
                h.line("}");
            }
            h.blankLine();
            h.line("impl" + lt + " VisitMut for " + name + lt + " {");
            h.indented(() -> {
                for (VisitorBinding b : parts.visitors) emitInlineHook(h, b);
            });
            h.line("}");
        } finally {
            ctx.popTraversal();
        }
        ctx.hoisted.add(h.toString());

        out.line("let mut __visitor = " + name + " {");
        out.indented(() -> {
            for (String c : s.captures) out.line(c + ": &mut " + c + ",");
            stateInits.forEach(out::lines);
        });
        out.line("};");
        out.line(target + ".visit_mut_with(&mut __visitor);");
    }

    private void emitInlineHook(EmitBuffer out, VisitorBinding b) {
        List<IrParameter> params = b.method.valueParams();
        String param = params.isEmpty() ? "n" : params.get(0).name;
        out.line("fn " + b.hookName(Backend.SWC) + "(&mut self, " + param + ": &mut " + b.kind.swcType + ") {");
        ctx.pushScope();
        try {
            ctx.defineKind(param, b.kind);
            out.indented(() -> {
                emitBody(out, b.method.body, false);
                if (!visitsChildren(b.method.body)) out.line(param + ".visit_mut_children_with(self);");
            });
        } finally {
            ctx.popScope();
        }
        out.line("}");
    }
}
