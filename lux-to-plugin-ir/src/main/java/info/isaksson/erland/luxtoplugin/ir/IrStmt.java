package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/** Statement nodes (closed set, see {@link IrExpr} for the dispatch contract). */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IrStmt.Block.class, name = "Block"),
        @JsonSubTypes.Type(value = IrStmt.Let.class, name = "Let"),
        @JsonSubTypes.Type(value = IrStmt.Const.class, name = "Const"),
        @JsonSubTypes.Type(value = IrStmt.ExprStmt.class, name = "Expr"),
        @JsonSubTypes.Type(value = IrStmt.If.class, name = "If"),
        @JsonSubTypes.Type(value = IrStmt.Match.class, name = "Match"),
        @JsonSubTypes.Type(value = IrStmt.For.class, name = "For"),
        @JsonSubTypes.Type(value = IrStmt.While.class, name = "While"),
        @JsonSubTypes.Type(value = IrStmt.Loop.class, name = "Loop"),
        @JsonSubTypes.Type(value = IrStmt.Return.class, name = "Return"),
        @JsonSubTypes.Type(value = IrStmt.Break.class, name = "Break"),
        @JsonSubTypes.Type(value = IrStmt.Continue.class, name = "Continue"),
        @JsonSubTypes.Type(value = IrStmt.Traverse.class, name = "Traverse"),
        @JsonSubTypes.Type(value = IrStmt.Verbatim.class, name = "Verbatim")
})
public sealed interface IrStmt {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitBlock(Block s);
        R visitLet(Let s);
        R visitConst(Const s);
        R visitExpr(ExprStmt s);
        R visitIf(If s);
        R visitMatch(Match s);
        R visitFor(For s);
        R visitWhile(While s);
        R visitLoop(Loop s);
        R visitReturn(Return s);
        R visitBreak(Break s);
        R visitContinue(Continue s);
        R visitTraverse(Traverse s);
        R visitVerbatim(Verbatim s);
    }

    final class Block implements IrStmt {
        public final List<IrStmt> stmts;

        @JsonCreator
        public Block(@JsonProperty("stmts") List<IrStmt> stmts) {
            this.stmts = stmts == null ? List.of() : List.copyOf(stmts);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitBlock(this); }
    }

    /** Variable declaration. {@link #type} is optional. */
    @JsonPropertyOrder({"mutable","pattern","type","init"})
    final class Let implements IrStmt {
        public final boolean mutable;
        public final IrPattern pattern;
        public final IrTypeRef type;
        public final IrExpr init;

        @JsonCreator
        public Let(
                @JsonProperty("mutable") boolean mutable,
                @JsonProperty("pattern") IrPattern pattern,
                @JsonProperty("type") IrTypeRef type,
                @JsonProperty("init") IrExpr init
        ) {
            this.mutable = mutable;
            this.pattern = pattern;
            this.type = type;
            this.init = init;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitLet(this); }
    }

    @JsonPropertyOrder({"name","type","init"})
    final class Const implements IrStmt {
        public final String name;
        public final IrTypeRef type;
        public final IrExpr init;

        @JsonCreator
        public Const(
                @JsonProperty("name") String name,
                @JsonProperty("type") IrTypeRef type,
                @JsonProperty("init") IrExpr init
        ) {
            this.name = name;
            this.type = type;
            this.init = init;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitConst(this); }
    }

    final class ExprStmt implements IrStmt {
        public final IrExpr expr;

        @JsonCreator
        public ExprStmt(@JsonProperty("expr") IrExpr expr) {
            this.expr = expr;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitExpr(this); }
    }

    /**
     * {@code if cond { } else { }}, or {@code if let pattern = cond { }} when {@link #pattern}
     * is present. An else branch holding a single If is an else-if chain.
     */
    @JsonPropertyOrder({"condition","pattern","thenBranch","elseBranch"})
    final class If implements IrStmt {
        public final IrExpr condition;
        public final IrPattern pattern;
        public final List<IrStmt> thenBranch;
        public final List<IrStmt> elseBranch;

        @JsonCreator
        public If(
                @JsonProperty("condition") IrExpr condition,
                @JsonProperty("pattern") IrPattern pattern,
                @JsonProperty("thenBranch") List<IrStmt> thenBranch,
                @JsonProperty("elseBranch") List<IrStmt> elseBranch
        ) {
            this.condition = condition;
            this.pattern = pattern;
            this.thenBranch = thenBranch == null ? List.of() : List.copyOf(thenBranch);
            this.elseBranch = elseBranch == null ? List.of() : List.copyOf(elseBranch);
        }

        @JsonIgnore
        public boolean isIfLet() {
            return pattern != null;
        }

        /** The nested If when the else branch is exactly one If statement. */
        @JsonIgnore
        public If elseIf() {
            if (elseBranch.size() == 1 && elseBranch.get(0) instanceof If) {
                return (If) elseBranch.get(0);
            }
            return null;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitIf(this); }
    }

    @JsonPropertyOrder({"scrutinee","arms"})
    final class Match implements IrStmt {
        public final IrExpr scrutinee;
        public final List<IrMatchArm> arms;

        @JsonCreator
        public Match(
                @JsonProperty("scrutinee") IrExpr scrutinee,
                @JsonProperty("arms") List<IrMatchArm> arms
        ) {
            this.scrutinee = scrutinee;
            this.arms = arms == null ? List.of() : List.copyOf(arms);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitMatch(this); }
    }

    @JsonPropertyOrder({"pattern","iterable","body"})
    final class For implements IrStmt {
        public final IrPattern pattern;
        public final IrExpr iterable;
        public final List<IrStmt> body;

        @JsonCreator
        public For(
                @JsonProperty("pattern") IrPattern pattern,
                @JsonProperty("iterable") IrExpr iterable,
                @JsonProperty("body") List<IrStmt> body
        ) {
            this.pattern = pattern;
            this.iterable = iterable;
            this.body = body == null ? List.of() : List.copyOf(body);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitFor(this); }
    }

    @JsonPropertyOrder({"condition","body"})
    final class While implements IrStmt {
        public final IrExpr condition;
        public final List<IrStmt> body;

        @JsonCreator
        public While(
                @JsonProperty("condition") IrExpr condition,
                @JsonProperty("body") List<IrStmt> body
        ) {
            this.condition = condition;
            this.body = body == null ? List.of() : List.copyOf(body);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitWhile(this); }
    }

    final class Loop implements IrStmt {
        public final List<IrStmt> body;

        @JsonCreator
        public Loop(@JsonProperty("body") List<IrStmt> body) {
            this.body = body == null ? List.of() : List.copyOf(body);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitLoop(this); }
    }

    final class Return implements IrStmt {
        /** Optional. */
        public final IrExpr value;

        @JsonCreator
        public Return(@JsonProperty("value") IrExpr value) {
            this.value = value;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitReturn(this); }
    }

    final class Break implements IrStmt {
        @JsonCreator
        public Break() {}

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitBreak(this); }
    }

    final class Continue implements IrStmt {
        @JsonCreator
        public Continue() {}

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitContinue(this); }
    }

    /**
     * Drives a nested AST walk from inside a visitor method.
     *
     * <p>Inline form: {@link #state} and {@link #methods} describe an anonymous visitor.
     * Delegated form: {@link #visitorName} names a visitor declared elsewhere.</p>
     */
    @JsonPropertyOrder({"target","captures","visitorName","state","methods"})
    final class Traverse implements IrStmt {
        public final IrExpr target;
        public final List<String> captures;
        public final String visitorName;
        public final List<Let> state;
        public final List<IrItem.Function> methods;

        @JsonCreator
        public Traverse(
                @JsonProperty("target") IrExpr target,
                @JsonProperty("captures") List<String> captures,
                @JsonProperty("visitorName") String visitorName,
                @JsonProperty("state") List<Let> state,
                @JsonProperty("methods") List<IrItem.Function> methods
        ) {
            this.target = target;
            this.captures = captures == null ? List.of() : List.copyOf(captures);
            this.visitorName = visitorName;
            this.state = state == null ? List.of() : List.copyOf(state);
            this.methods = methods == null ? List.of() : List.copyOf(methods);
        }

        @JsonIgnore
        public boolean isDelegated() {
            return visitorName != null && !visitorName.isBlank();
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitTraverse(this); }
    }

    /** Host-language code copied as-is into the matching backend only. */
    @JsonPropertyOrder({"language","code"})
    final class Verbatim implements IrStmt {

        public enum Language { JAVASCRIPT, RUST }

        public final Language language;
        public final String code;

        @JsonCreator
        public Verbatim(
                @JsonProperty("language") Language language,
                @JsonProperty("code") String code
        ) {
            this.language = language;
            this.code = code == null ? "" : code;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitVerbatim(this); }
    }

    static ExprStmt expr(IrExpr expr) {
        return new ExprStmt(expr);
    }

    static Let let(String name, IrExpr init) {
        return new Let(false, new IrPattern.Ident(name), null, init);
    }
}
