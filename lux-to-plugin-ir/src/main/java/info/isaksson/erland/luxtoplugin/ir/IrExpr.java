package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Expression nodes. The set is closed; every consumer implements {@link Visitor}, so adding a
 * node kind is a compile error in each backend until it is handled there.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IrExpr.Literal.class, name = "Literal"),
        @JsonSubTypes.Type(value = IrExpr.Ident.class, name = "Ident"),
        @JsonSubTypes.Type(value = IrExpr.Call.class, name = "Call"),
        @JsonSubTypes.Type(value = IrExpr.MacroCall.class, name = "MacroCall"),
        @JsonSubTypes.Type(value = IrExpr.Member.class, name = "Member"),
        @JsonSubTypes.Type(value = IrExpr.Index.class, name = "Index"),
        @JsonSubTypes.Type(value = IrExpr.Binary.class, name = "Binary"),
        @JsonSubTypes.Type(value = IrExpr.Unary.class, name = "Unary"),
        @JsonSubTypes.Type(value = IrExpr.Assign.class, name = "Assign"),
        @JsonSubTypes.Type(value = IrExpr.CompoundAssign.class, name = "CompoundAssign"),
        @JsonSubTypes.Type(value = IrExpr.Match.class, name = "Match"),
        @JsonSubTypes.Type(value = IrExpr.If.class, name = "If"),
        @JsonSubTypes.Type(value = IrExpr.Block.class, name = "Block"),
        @JsonSubTypes.Type(value = IrExpr.StructInit.class, name = "StructInit"),
        @JsonSubTypes.Type(value = IrExpr.VecInit.class, name = "VecInit"),
        @JsonSubTypes.Type(value = IrExpr.Tuple.class, name = "Tuple"),
        @JsonSubTypes.Type(value = IrExpr.Closure.class, name = "Closure"),
        @JsonSubTypes.Type(value = IrExpr.Range.class, name = "Range"),
        @JsonSubTypes.Type(value = IrExpr.Paren.class, name = "Paren"),
        @JsonSubTypes.Type(value = IrExpr.Try.class, name = "Try")
})
public sealed interface IrExpr {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitLiteral(Literal e);
        R visitIdent(Ident e);
        R visitCall(Call e);
        R visitMacroCall(MacroCall e);
        R visitMember(Member e);
        R visitIndex(Index e);
        R visitBinary(Binary e);
        R visitUnary(Unary e);
        R visitAssign(Assign e);
        R visitCompoundAssign(CompoundAssign e);
        R visitMatch(Match e);
        R visitIf(If e);
        R visitBlock(Block e);
        R visitStructInit(StructInit e);
        R visitVecInit(VecInit e);
        R visitTuple(Tuple e);
        R visitClosure(Closure e);
        R visitRange(Range e);
        R visitParen(Paren e);
        R visitTry(Try e);
    }

    final class Literal implements IrExpr {
        public final IrLiteral literal;

        @JsonCreator
        public Literal(@JsonProperty("literal") IrLiteral literal) {
            this.literal = literal == null ? IrLiteral.unit() : literal;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitLiteral(this); }
    }

    final class Ident implements IrExpr {
        public final String name;

        @JsonCreator
        public Ident(@JsonProperty("name") String name) {
            this.name = name;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitIdent(this); }
    }

    @JsonPropertyOrder({"callee","args"})
    final class Call implements IrExpr {
        public final IrExpr callee;
        public final List<IrExpr> args;

        @JsonCreator
        public Call(
                @JsonProperty("callee") IrExpr callee,
                @JsonProperty("args") List<IrExpr> args
        ) {
            this.callee = callee;
            this.args = args == null ? List.of() : List.copyOf(args);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitCall(this); }
    }

    /** Macro-style invocation ({@code format!(...)}); {@link #name} carries no {@code !}. */
    @JsonPropertyOrder({"name","args"})
    final class MacroCall implements IrExpr {
        public final String name;
        public final List<IrExpr> args;

        @JsonCreator
        public MacroCall(
                @JsonProperty("name") String name,
                @JsonProperty("args") List<IrExpr> args
        ) {
            this.name = name;
            this.args = args == null ? List.of() : List.copyOf(args);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitMacroCall(this); }
    }

    /** {@code object.property}, or {@code object::property} when {@link #path} is set. */
    @JsonPropertyOrder({"object","property","path"})
    final class Member implements IrExpr {
        public final IrExpr object;
        public final String property;
        public final boolean path;

        @JsonCreator
        public Member(
                @JsonProperty("object") IrExpr object,
                @JsonProperty("property") String property,
                @JsonProperty("path") boolean path
        ) {
            this.object = object;
            this.property = property;
            this.path = path;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitMember(this); }
    }

    @JsonPropertyOrder({"object","index"})
    final class Index implements IrExpr {
        public final IrExpr object;
        public final IrExpr index;

        @JsonCreator
        public Index(
                @JsonProperty("object") IrExpr object,
                @JsonProperty("index") IrExpr index
        ) {
            this.object = object;
            this.index = index;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitIndex(this); }
    }

    @JsonPropertyOrder({"op","left","right"})
    final class Binary implements IrExpr {
        public final IrBinaryOp op;
        public final IrExpr left;
        public final IrExpr right;

        @JsonCreator
        public Binary(
                @JsonProperty("op") IrBinaryOp op,
                @JsonProperty("left") IrExpr left,
                @JsonProperty("right") IrExpr right
        ) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitBinary(this); }
    }

    @JsonPropertyOrder({"op","operand"})
    final class Unary implements IrExpr {
        public final IrUnaryOp op;
        public final IrExpr operand;

        @JsonCreator
        public Unary(
                @JsonProperty("op") IrUnaryOp op,
                @JsonProperty("operand") IrExpr operand
        ) {
            this.op = op;
            this.operand = operand;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitUnary(this); }
    }

    @JsonPropertyOrder({"target","value"})
    final class Assign implements IrExpr {
        public final IrExpr target;
        public final IrExpr value;

        @JsonCreator
        public Assign(
                @JsonProperty("target") IrExpr target,
                @JsonProperty("value") IrExpr value
        ) {
            this.target = target;
            this.value = value;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitAssign(this); }
    }

    @JsonPropertyOrder({"op","target","value"})
    final class CompoundAssign implements IrExpr {
        public final IrCompoundOp op;
        public final IrExpr target;
        public final IrExpr value;

        @JsonCreator
        public CompoundAssign(
                @JsonProperty("op") IrCompoundOp op,
                @JsonProperty("target") IrExpr target,
                @JsonProperty("value") IrExpr value
        ) {
            this.op = op;
            this.target = target;
            this.value = value;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitCompoundAssign(this); }
    }

    @JsonPropertyOrder({"scrutinee","arms"})
    final class Match implements IrExpr {
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

    /** Conditional in expression position; both branches yield their trailing expression. */
    @JsonPropertyOrder({"condition","thenBranch","elseBranch"})
    final class If implements IrExpr {
        public final IrExpr condition;
        public final List<IrStmt> thenBranch;
        public final List<IrStmt> elseBranch;

        @JsonCreator
        public If(
                @JsonProperty("condition") IrExpr condition,
                @JsonProperty("thenBranch") List<IrStmt> thenBranch,
                @JsonProperty("elseBranch") List<IrStmt> elseBranch
        ) {
            this.condition = condition;
            this.thenBranch = thenBranch == null ? List.of() : List.copyOf(thenBranch);
            this.elseBranch = elseBranch == null ? List.of() : List.copyOf(elseBranch);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitIf(this); }
    }

    final class Block implements IrExpr {
        public final List<IrStmt> stmts;

        @JsonCreator
        public Block(@JsonProperty("stmts") List<IrStmt> stmts) {
            this.stmts = stmts == null ? List.of() : List.copyOf(stmts);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitBlock(this); }
    }

    @JsonPropertyOrder({"name","fields"})
    final class StructInit implements IrExpr {
        public final String name;
        public final List<IrFieldInit> fields;

        @JsonCreator
        public StructInit(
                @JsonProperty("name") String name,
                @JsonProperty("fields") List<IrFieldInit> fields
        ) {
            this.name = name;
            this.fields = fields == null ? List.of() : List.copyOf(fields);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitStructInit(this); }
    }

    final class VecInit implements IrExpr {
        public final List<IrExpr> elements;

        @JsonCreator
        public VecInit(@JsonProperty("elements") List<IrExpr> elements) {
            this.elements = elements == null ? List.of() : List.copyOf(elements);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitVecInit(this); }
    }

    final class Tuple implements IrExpr {
        public final List<IrExpr> elements;

        @JsonCreator
        public Tuple(@JsonProperty("elements") List<IrExpr> elements) {
            this.elements = elements == null ? List.of() : List.copyOf(elements);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitTuple(this); }
    }

    @JsonPropertyOrder({"params","body"})
    final class Closure implements IrExpr {
        public final List<String> params;
        public final IrExpr body;

        @JsonCreator
        public Closure(
                @JsonProperty("params") List<String> params,
                @JsonProperty("body") IrExpr body
        ) {
            this.params = params == null ? List.of() : List.copyOf(params);
            this.body = body;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitClosure(this); }
    }

    @JsonPropertyOrder({"start","end","inclusive"})
    final class Range implements IrExpr {
        public final IrExpr start;
        public final IrExpr end;
        public final boolean inclusive;

        @JsonCreator
        public Range(
                @JsonProperty("start") IrExpr start,
                @JsonProperty("end") IrExpr end,
                @JsonProperty("inclusive") boolean inclusive
        ) {
            this.start = start;
            this.end = end;
            this.inclusive = inclusive;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitRange(this); }
    }

    final class Paren implements IrExpr {
        public final IrExpr inner;

        @JsonCreator
        public Paren(@JsonProperty("inner") IrExpr inner) {
            this.inner = inner;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitParen(this); }
    }

    /** {@code expr?}. */
    final class Try implements IrExpr {
        public final IrExpr inner;

        @JsonCreator
        public Try(@JsonProperty("inner") IrExpr inner) {
            this.inner = inner;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitTry(this); }
    }

    static Literal literal(IrLiteral literal) {
        return new Literal(literal);
    }

    static Ident ident(String name) {
        return new Ident(name);
    }

    static Call call(String function, IrExpr... args) {
        return new Call(new Ident(function), List.of(args));
    }

    static Call methodCall(IrExpr receiver, String method, IrExpr... args) {
        return new Call(new Member(receiver, method, false), List.of(args));
    }

    static Call pathCall(String type, String function, IrExpr... args) {
        return new Call(new Member(new Ident(type), function, true), List.of(args));
    }
}
