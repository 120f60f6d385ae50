package info.isaksson.erland.luxtoplugin.emitter.swc;

import info.isaksson.erland.luxtoplugin.emitter.EmitBuffer;
import info.isaksson.erland.luxtoplugin.emitter.binding.NodeKind;
import info.isaksson.erland.luxtoplugin.ir.IrExpr;
import info.isaksson.erland.luxtoplugin.ir.IrFieldInit;
import info.isaksson.erland.luxtoplugin.ir.IrLiteral;
import info.isaksson.erland.luxtoplugin.ir.IrStmt;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers expressions to Rust source text. Block-valued expressions render on several lines
 * with indentation relative to column zero.
 */
final class SwcExprCodegen implements IrExpr.Visitor<String> {

    private final SwcContext ctx;

    SwcExprCodegen(SwcContext ctx) {
        this.ctx = ctx;
    }

    String expr(IrExpr e) {
        return e == null ? "()" : e.accept(this);
    }

    String args(List<IrExpr> args) {
        List<String> parts = new ArrayList<>();
        for (IrExpr a : args) parts.add(expr(a));
        return String.join(", ", parts);
    }

    String condition(IrExpr e) {
        return stripParens(expr(e));
    }

    static String stripParens(String s) {
        if (s.length() < 2 || s.charAt(0) != '(' || s.charAt(s.length() - 1) != ')') return s;
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
            if (depth == 0 && i < s.length() - 1) return s;
        }
        return s.substring(1, s.length() - 1);
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    String literal(IrLiteral lit) {
        switch (lit.type) {
            case STRING: return quote(lit.value == null ? "" : lit.value);
            case INT:
            case FLOAT: return lit.value;
            case BOOL: return Boolean.parseBoolean(lit.value) ? "true" : "false";
            case NULL: return "None";
            default: return "()";
        }
    }

    /** Expression in receiver position: captured references auto-deref, prefix operators get parentheses. */
    private String receiver(IrExpr obj) {
        if (obj instanceof IrExpr.Ident) {
            String name = ((IrExpr.Ident) obj).name;
            if (ctx.isCapture(name)) return "self." + name;
        }
        String s = expr(obj);
        return obj instanceof IrExpr.Unary ? "(" + s + ")" : s;
    }

    @Override
    public String visitLiteral(IrExpr.Literal e) {
        return literal(e.literal);
    }

    @Override
    public String visitIdent(IrExpr.Ident e) {
        if ("self".equals(e.name) || "None".equals(e.name)) return e.name;
        if (ctx.isCapture(e.name)) return "*self." + e.name;
        if (ctx.isTraverseState(e.name)) return "self." + e.name;
        return ctx.resolve(e.name);
    }

    @Override
    public String visitCall(IrExpr.Call e) {
        if (e.callee instanceof IrExpr.Ident) {
            String name = ((IrExpr.Ident) e.callee).name;
            if (ctx.associatedFns.contains(name)) {
                String owner = ctx.inTraversal() ? ctx.unitName : "Self";
                return owner + "::" + name + "(" + args(e.args) + ")";
            }
            return ctx.resolve(name) + "(" + args(e.args) + ")";
        }
        if (e.callee instanceof IrExpr.Member) {
            IrExpr.Member m = (IrExpr.Member) e.callee;
            return m.path ? pathCall(m, e.args) : methodCall(m, e.args);
        }
        return expr(e.callee) + "(" + args(e.args) + ")";
    }

    private String pathCall(IrExpr.Member m, List<IrExpr> args) {
        String owner = m.object instanceof IrExpr.Ident ? ((IrExpr.Ident) m.object).name : null;
        if ("json".equals(owner)) {
            return "serde_json::" + m.property + "(" + args(args) + ")";
        }
        if ("codegen".equals(owner)) {
            return "codegen_to_string(&" + (args.isEmpty() ? "()" : expr(args.get(0))) + ")";
        }
        if ("CodeBuilder".equals(owner) && "new".equals(m.property)) {
            return "String::new()";
        }
        return expr(m.object) + "::" + m.property + "(" + args(args) + ")";
    }

    private String methodCall(IrExpr.Member m, List<IrExpr> args) {
        String recv = receiver(m.object);
        switch (m.property) {
            case "visit_children":
                return recv + (ctx.writer ? ".visit_children_with(self)" : ".visit_mut_children_with(self)");
            case "visit_with":
                return recv + (ctx.writer ? ".visit_with(self)" : ".visit_mut_with(self)");
            default:
                return recv + "." + m.property + "(" + args(args) + ")";
        }
    }

    @Override
    public String visitMacroCall(IrExpr.MacroCall e) {
        if ("vec".equals(e.name)) return "vec![" + args(e.args) + "]";
        return e.name + "!(" + args(e.args) + ")";
    }

    @Override
    public String visitMember(IrExpr.Member e) {
        if (e.path) {
            return expr(e.object) + "::" + e.property;
        }
        if (SwcStmtCodegen.isSelf(e.object)) {
            // writer state and builder are flattened into the writer struct
            if (ctx.writer && ("state".equals(e.property) || "builder".equals(e.property))) return "self";
            return "self." + e.property;
        }
        String prop = e.property;
        if (e.object instanceof IrExpr.Ident) {
            NodeKind kind = ctx.kindOf(((IrExpr.Ident) e.object).name);
            if (kind != null) {
                String mapped = kind.swcFieldName(prop);
                if (mapped != null) prop = mapped;
            }
        }
        return receiver(e.object) + "." + prop;
    }

    @Override
    public String visitIndex(IrExpr.Index e) {
        if (e.index instanceof IrExpr.Range) {
            return "&" + receiver(e.object) + "[" + visitRange((IrExpr.Range) e.index) + "]";
        }
        return receiver(e.object) + "[" + expr(e.index) + "]";
    }

    @Override
    public String visitBinary(IrExpr.Binary e) {
        return "(" + expr(e.left) + " " + ctx.types.binaryOp(e.op) + " " + expr(e.right) + ")";
    }

    @Override
    public String visitUnary(IrExpr.Unary e) {
        String op = ctx.types.unaryOp(e.op);
        String operand = expr(e.operand);
        // "--x" would read as a decrement.
        if (op.endsWith("-") && operand.startsWith("-")) operand = "(" + operand + ")";
        return op + operand;
    }

    @Override
    public String visitAssign(IrExpr.Assign e) {
        return expr(e.target) + " = " + expr(e.value);
    }

    @Override
    public String visitCompoundAssign(IrExpr.CompoundAssign e) {
        return expr(e.target) + " " + ctx.types.compoundOp(e.op) + " " + expr(e.value);
    }

    @Override
    public String visitMatch(IrExpr.Match e) {
        EmitBuffer b = ctx.newBuffer();
        ctx.stmts.emitMatch(b, e.scrutinee, e.arms, true);
        return trimNewline(b);
    }

    @Override
    public String visitIf(IrExpr.If e) {
        EmitBuffer b = ctx.newBuffer();
        ctx.stmts.emitIf(b, new IrStmt.If(e.condition, null, e.thenBranch, e.elseBranch), true);
        return trimNewline(b);
    }

    @Override
    public String visitBlock(IrExpr.Block e) {
        EmitBuffer b = ctx.newBuffer();
        b.line("{");
        ctx.pushScope();
        try {
            b.indented(() -> ctx.stmts.emitBody(b, e.stmts, true));
        } finally {
            ctx.popScope();
        }
        b.append("}");
        return b.toString();
    }

    private static String trimNewline(EmitBuffer b) {
        String s = b.toString();
        return s.endsWith("\n") ? s.substring(0, s.length() - 1) : s;
    }

    @Override
    public String visitStructInit(IrExpr.StructInit e) {
        NodeKind kind = NodeKind.forName(e.name);
        String name = kind != null ? kind.swcType : e.name;
        List<String> parts = new ArrayList<>();
        for (IrFieldInit f : e.fields) {
            String field = f.name;
            if (kind != null && kind.swcFieldName(field) != null) field = kind.swcFieldName(field);
            String value = expr(f.value);
            parts.add(field.equals(value) ? field : field + ": " + value);
        }
        return parts.isEmpty() ? name + " {}" : name + " { " + String.join(", ", parts) + " }";
    }

    @Override
    public String visitVecInit(IrExpr.VecInit e) {
        return "vec![" + args(e.elements) + "]";
    }

    @Override
    public String visitTuple(IrExpr.Tuple e) {
        if (e.elements.size() == 1) return "(" + expr(e.elements.get(0)) + ",)";
        return "(" + args(e.elements) + ")";
    }

    @Override
    public String visitClosure(IrExpr.Closure e) {
        return "|" + String.join(", ", e.params) + "| " + expr(e.body);
    }

    @Override
    public String visitRange(IrExpr.Range e) {
        String start = e.start == null ? "" : expr(e.start);
        String end = e.end == null ? "" : expr(e.end);
        return start + (e.inclusive ? "..=" : "..") + end;
    }

    @Override
    public String visitParen(IrExpr.Paren e) {
        return "(" + expr(e.inner) + ")";
    }

    @Override
    public String visitTry(IrExpr.Try e) {
        return expr(e.inner) + "?";
    }
}
