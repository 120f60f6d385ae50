package info.isaksson.erland.luxtoplugin.emitter.babel;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.EmitBuffer;
import info.isaksson.erland.luxtoplugin.emitter.UnsupportedConstructException;
import info.isaksson.erland.luxtoplugin.ir.IrExpr;
import info.isaksson.erland.luxtoplugin.ir.IrFieldInit;
import info.isaksson.erland.luxtoplugin.ir.IrLiteral;
import info.isaksson.erland.luxtoplugin.ir.IrStmt;
import info.isaksson.erland.luxtoplugin.ir.IrUnaryOp;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Lowers expressions to JavaScript source text.
 *
 * <p>Results may span several lines when an expression carries statements (block, match,
 * closures with bodies); nested lines are indented relative to column zero so callers can
 * hand them to {@link EmitBuffer#lines(String)}.</p>
 */
final class BabelExprCodegen implements IrExpr.Visitor<String> {

    private static final Map<String, String> METHOD_RENAMES = Map.of(
            "starts_with", "startsWith",
            "ends_with", "endsWith",
            "contains", "includes",
            "to_uppercase", "toUpperCase",
            "to_lowercase", "toLowerCase",
            "contains_key", "has",
            "trim_start", "trimStart",
            "trim_end", "trimEnd"
    );

    /** SWC-flavoured field names the DSL accepts, under their Babel spelling. */
    private static final Map<String, String> FIELD_RENAMES = Map.of(
            "sym", "name",
            "stmts", "body"
    );

    private static final Set<String> BUILDER_METHODS = Set.of("append", "newline", "indent", "dedent");

    private final BabelContext ctx;

    BabelExprCodegen(BabelContext ctx) {
        this.ctx = ctx;
    }

    String expr(IrExpr e) {
        return e == null ? "undefined" : e.accept(this);
    }

    String args(List<IrExpr> args) {
        List<String> parts = new ArrayList<>();
        for (IrExpr a : args) parts.add(expr(a));
        return String.join(", ", parts);
    }

    /** Condition text without one redundant pair of outer parentheses. */
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
            case NULL: return "null";
            default: return "undefined";
        }
    }

    /** An immediately invoked arrow function; arrow functions keep {@code this}. */
    String iife(Consumer<EmitBuffer> body) {
        EmitBuffer b = ctx.newBuffer();
        b.line("(() => {");
        b.indented(() -> body.accept(b));
        b.append("})()");
        return b.toString();
    }

    @Override
    public String visitLiteral(IrExpr.Literal e) {
        return literal(e.literal);
    }

    @Override
    public String visitIdent(IrExpr.Ident e) {
        switch (e.name) {
            case "self": return "this";
            case "None": return "null";
            default:
                if (ctx.isTraverseState(e.name)) return "this." + e.name;
                return ctx.resolve(e.name);
        }
    }

    @Override
    public String visitCall(IrExpr.Call e) {
        if (e.callee instanceof IrExpr.Ident) {
            String name = ((IrExpr.Ident) e.callee).name;
            switch (name) {
                case "Some":
                    if (e.args.size() == 1) return expr(e.args.get(0));
                    break;
                case "Ok":
                    return "{ ok: true, value: " + (e.args.isEmpty() ? "undefined" : expr(e.args.get(0))) + " }";
                case "Err":
                    return "{ ok: false, error: " + (e.args.isEmpty() ? "undefined" : expr(e.args.get(0))) + " }";
                default:
                    break;
            }
        }
        if (e.callee instanceof IrExpr.Member) {
            IrExpr.Member m = (IrExpr.Member) e.callee;
            return m.path ? pathCall(m, e.args) : methodCall(m, e.args);
        }
        return expr(e.callee) + "(" + args(e.args) + ")";
    }

    private String pathCall(IrExpr.Member m, List<IrExpr> args) {
        String owner = m.object instanceof IrExpr.Ident ? ((IrExpr.Ident) m.object).name : null;
        String a0 = args.isEmpty() ? "undefined" : expr(args.get(0));
        if (owner != null) {
            switch (owner + "::" + m.property) {
                case "HashMap::new": return "new Map()";
                case "HashSet::new": return "new Set()";
                case "String::new":
                case "CodeBuilder::new": return "\"\"";
                case "String::from": return a0;
                case "Vec::new":
                case "Vec::with_capacity": return "[]";
                case "Default::default": return "undefined";
                case "json::to_string":
                case "serde_json::to_string": return "JSON.stringify(" + a0 + ")";
                case "json::to_string_pretty":
                case "serde_json::to_string_pretty": return "JSON.stringify(" + a0 + ", null, 2)";
                case "json::from_str":
                case "serde_json::from_str": return "JSON.parse(" + a0 + ")";
                case "fs::read_to_string": return "fs.readFileSync(" + a0 + ", \"utf8\")";
                case "fs::write": return "fs.writeFileSync(" + args(args) + ")";
                case "fs::exists": return "fs.existsSync(" + a0 + ")";
                case "fs::remove_file": return "fs.unlinkSync(" + a0 + ")";
                case "fs::create_dir_all": return "fs.mkdirSync(" + a0 + ", { recursive: true })";
                default:
                    break;
            }
            if ("codegen".equals(owner)) {
                return "generate(" + a0 + ").code";
            }
            if ("Self".equals(owner)) {
                String prefix = ctx.currentClass == null ? "" : ctx.currentClass + ".";
                return prefix + m.property + "(" + args(args) + ")";
            }
        }
        return expr(m.object) + "." + m.property + "(" + args(args) + ")";
    }

    private String methodCall(IrExpr.Member m, List<IrExpr> args) {
        String prop = m.property;
        if (isSelf(m.object)) {
            if (ctx.writer && BUILDER_METHODS.contains(prop)) {
                return "builder." + prop + "(" + args(args) + ")";
            }
            if (ctx.unitFunctions.contains(prop)) {
                return prop + ".call(this" + (args.isEmpty() ? "" : ", " + args(args)) + ")";
            }
        }
        String recv = expr(m.object);
        switch (prop) {
            case "len":
                return recv + ".length";
            case "is_empty":
                return "(" + recv + ".length === 0)";
            case "clone":
            case "unwrap":
            case "expect":
            case "iter":
            case "into_iter":
            case "iter_mut":
            case "as_str":
            case "as_ref":
                return recv;
            case "to_string":
                return "String(" + recv + ")";
            case "unwrap_or":
                return "(" + recv + " ?? " + (args.isEmpty() ? "undefined" : expr(args.get(0))) + ")";
            case "is_some":
                return "(" + recv + " !== null && " + recv + " !== undefined)";
            case "is_none":
                return "(" + recv + " === null || " + recv + " === undefined)";
            case "push_str":
                return recv + " += " + (args.isEmpty() ? "\"\"" : expr(args.get(0)));
            case "insert":
                return recv + (args.size() >= 2 ? ".set(" : ".add(") + args(args) + ")";
            case "visit_children":
            case "visit_with":
                return "undefined";
            default:
                break;
        }
        String js = METHOD_RENAMES.getOrDefault(prop, prop);
        return recv + "." + js + "(" + args(args) + ")";
    }

    static boolean isSelf(IrExpr e) {
        return e instanceof IrExpr.Ident && "self".equals(((IrExpr.Ident) e).name);
    }

    /** True for {@code x.visit_children(self)}; Babel walks children on its own. */
    static boolean isChildVisit(IrExpr e) {
        if (!(e instanceof IrExpr.Call)) return false;
        IrExpr callee = ((IrExpr.Call) e).callee;
        if (!(callee instanceof IrExpr.Member)) return false;
        String p = ((IrExpr.Member) callee).property;
        return "visit_children".equals(p) || "visit_with".equals(p);
    }

    @Override
    public String visitMacroCall(IrExpr.MacroCall e) {
        return e.name + "(" + args(e.args) + ")";
    }

    @Override
    public String visitMember(IrExpr.Member e) {
        if (e.path) {
            return expr(e.object) + "." + e.property;
        }
        if (isSelf(e.object)) {
            if ("builder".equals(e.property) && ctx.writer) return "builder";
            return "this." + e.property;
        }
        String obj = expr(e.object);
        if (!e.property.isEmpty() && Character.isDigit(e.property.charAt(0))) {
            return obj + "[" + e.property + "]";
        }
        return obj + "." + FIELD_RENAMES.getOrDefault(e.property, e.property);
    }

    @Override
    public String visitIndex(IrExpr.Index e) {
        if (e.index instanceof IrExpr.Range) {
            IrExpr.Range r = (IrExpr.Range) e.index;
            String start = r.start == null ? "0" : expr(r.start);
            if (r.end == null) return expr(e.object) + ".slice(" + start + ")";
            String end = r.inclusive ? expr(r.end) + " + 1" : expr(r.end);
            return expr(e.object) + ".slice(" + start + ", " + end + ")";
        }
        return expr(e.object) + "[" + expr(e.index) + "]";
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
        if (e.target instanceof IrExpr.Unary && ((IrExpr.Unary) e.target).op == IrUnaryOp.DEREF) {
            return "path.replaceWith(" + expr(e.value) + ")";
        }
        return expr(e.target) + " = " + expr(e.value);
    }

    @Override
    public String visitCompoundAssign(IrExpr.CompoundAssign e) {
        return expr(e.target) + " " + ctx.types.compoundOp(e.op) + " " + expr(e.value);
    }

    @Override
    public String visitMatch(IrExpr.Match e) {
        return iife(b -> ctx.stmts.emitMatch(b, e.scrutinee, e.arms, true));
    }

    @Override
    public String visitIf(IrExpr.If e) {
        IrExpr thenValue = singleValue(e.thenBranch);
        IrExpr elseValue = singleValue(e.elseBranch);
        if (thenValue != null && elseValue != null) {
            return "(" + expr(e.condition) + " ? " + expr(thenValue) + " : " + expr(elseValue) + ")";
        }
        IrStmt.If asStmt = new IrStmt.If(e.condition, null, e.thenBranch, e.elseBranch);
        return iife(b -> ctx.stmts.emitIf(b, asStmt, true));
    }

    private static IrExpr singleValue(List<IrStmt> branch) {
        if (branch.size() == 1 && branch.get(0) instanceof IrStmt.ExprStmt) {
            return ((IrStmt.ExprStmt) branch.get(0)).expr;
        }
        return null;
    }

    @Override
    public String visitBlock(IrExpr.Block e) {
        return iife(b -> ctx.stmts.emitBody(b, e.stmts, true));
    }

    @Override
    public String visitStructInit(IrExpr.StructInit e) {
        List<String> parts = new ArrayList<>();
        String name = e.name == null ? "" : e.name;
        int sep = name.lastIndexOf("::");
        if (sep >= 0 && ctx.enumNames.contains(name.substring(0, sep))) {
            parts.add("type: " + quote(name.substring(sep + 2)));
        }
        for (IrFieldInit f : e.fields) {
            parts.add(f.name + ": " + expr(f.value));
        }
        return parts.isEmpty() ? "{}" : "{ " + String.join(", ", parts) + " }";
    }

    @Override
    public String visitVecInit(IrExpr.VecInit e) {
        return "[" + args(e.elements) + "]";
    }

    @Override
    public String visitTuple(IrExpr.Tuple e) {
        return "[" + args(e.elements) + "]";
    }

    @Override
    public String visitClosure(IrExpr.Closure e) {
        String head = "(" + String.join(", ", e.params) + ") => ";
        if (e.body instanceof IrExpr.Block) {
            EmitBuffer b = ctx.newBuffer();
            b.line(head + "{");
            b.indented(() -> ctx.stmts.emitBody(b, ((IrExpr.Block) e.body).stmts, true));
            b.append("}");
            return b.toString();
        }
        String body = expr(e.body);
        return body.startsWith("{") ? head + "(" + body + ")" : head + body;
    }

    @Override
    public String visitRange(IrExpr.Range e) {
        throw new UnsupportedConstructException("range expression", Backend.BABEL);
    }

    @Override
    public String visitParen(IrExpr.Paren e) {
        return "(" + expr(e.inner) + ")";
    }

    @Override
    public String visitTry(IrExpr.Try e) {
        throw new UnsupportedConstructException("try operator inside an expression", Backend.BABEL);
    }
}
