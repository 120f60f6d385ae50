package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/** Match/destructuring patterns. Patterns nest arbitrarily. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IrPattern.Literal.class, name = "Literal"),
        @JsonSubTypes.Type(value = IrPattern.Ident.class, name = "Ident"),
        @JsonSubTypes.Type(value = IrPattern.Wildcard.class, name = "Wildcard"),
        @JsonSubTypes.Type(value = IrPattern.Tuple.class, name = "Tuple"),
        @JsonSubTypes.Type(value = IrPattern.Struct.class, name = "Struct"),
        @JsonSubTypes.Type(value = IrPattern.Variant.class, name = "Variant"),
        @JsonSubTypes.Type(value = IrPattern.Array.class, name = "Array"),
        @JsonSubTypes.Type(value = IrPattern.ObjectPattern.class, name = "Object"),
        @JsonSubTypes.Type(value = IrPattern.Rest.class, name = "Rest"),
        @JsonSubTypes.Type(value = IrPattern.Or.class, name = "Or"),
        @JsonSubTypes.Type(value = IrPattern.Ref.class, name = "Ref")
})
public sealed interface IrPattern {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitLiteral(Literal p);
        R visitIdent(Ident p);
        R visitWildcard(Wildcard p);
        R visitTuple(Tuple p);
        R visitStruct(Struct p);
        R visitVariant(Variant p);
        R visitArray(Array p);
        R visitObject(ObjectPattern p);
        R visitRest(Rest p);
        R visitOr(Or p);
        R visitRef(Ref p);
    }

    final class Literal implements IrPattern {
        public final IrLiteral literal;

        @JsonCreator
        public Literal(@JsonProperty("literal") IrLiteral literal) {
            this.literal = literal == null ? IrLiteral.unit() : literal;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitLiteral(this); }

        @Override public String toString() { return String.valueOf(literal); }
    }

    /** Binds the matched value to {@link #name}. */
    final class Ident implements IrPattern {
        public final String name;

        @JsonCreator
        public Ident(@JsonProperty("name") String name) {
            this.name = name;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitIdent(this); }

        @Override public String toString() { return name; }
    }

    final class Wildcard implements IrPattern {
        @JsonCreator
        public Wildcard() {}

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitWildcard(this); }

        @Override public String toString() { return "_"; }
    }

    final class Tuple implements IrPattern {
        public final List<IrPattern> elements;

        @JsonCreator
        public Tuple(@JsonProperty("elements") List<IrPattern> elements) {
            this.elements = elements == null ? List.of() : List.copyOf(elements);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitTuple(this); }

        @Override public String toString() { return "(" + IrPattern.join(elements) + ")"; }
    }

    /** {@code Name { field: pattern, .. }}; an empty field list matches any instance. */
    @JsonPropertyOrder({"name","fields"})
    final class Struct implements IrPattern {
        public final String name;
        public final List<IrFieldPattern> fields;

        @JsonCreator
        public Struct(
                @JsonProperty("name") String name,
                @JsonProperty("fields") List<IrFieldPattern> fields
        ) {
            this.name = name;
            this.fields = fields == null ? List.of() : List.copyOf(fields);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitStruct(this); }

        @Override public String toString() { return name + " { .. }"; }
    }

    /**
     * Qualified variant: an AST node kind ({@code CallExpression}), Option/Result
     * ({@code Some}, {@code Ok}) or a user enum variant ({@code Mode::Fast}).
     */
    @JsonPropertyOrder({"name","inner"})
    final class Variant implements IrPattern {
        public final String name;
        /** Optional. */
        public final IrPattern inner;

        @JsonCreator
        public Variant(
                @JsonProperty("name") String name,
                @JsonProperty("inner") IrPattern inner
        ) {
            this.name = name;
            this.inner = inner;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitVariant(this); }

        @Override public String toString() { return inner == null ? name : name + "(" + inner + ")"; }
    }

    final class Array implements IrPattern {
        public final List<IrPattern> elements;

        @JsonCreator
        public Array(@JsonProperty("elements") List<IrPattern> elements) {
            this.elements = elements == null ? List.of() : List.copyOf(elements);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitArray(this); }

        @Override public String toString() { return "[" + IrPattern.join(elements) + "]"; }
    }

    final class ObjectPattern implements IrPattern {
        public final List<IrObjectProp> props;

        @JsonCreator
        public ObjectPattern(@JsonProperty("props") List<IrObjectProp> props) {
            this.props = props == null ? List.of() : List.copyOf(props);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitObject(this); }

        @Override public String toString() { return "{ .. }"; }
    }

    /** {@code ..inner} inside an array/tuple pattern; {@link #inner} is optional. */
    final class Rest implements IrPattern {
        public final IrPattern inner;

        @JsonCreator
        public Rest(@JsonProperty("inner") IrPattern inner) {
            this.inner = inner;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitRest(this); }

        @Override public String toString() { return inner == null ? ".." : ".." + inner; }
    }

    final class Or implements IrPattern {
        public final List<IrPattern> alternatives;

        @JsonCreator
        public Or(@JsonProperty("alternatives") List<IrPattern> alternatives) {
            this.alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitOr(this); }

        @Override public String toString() {
            StringBuilder sb = new StringBuilder();
            for (IrPattern p : alternatives) {
                if (sb.length() > 0) sb.append(" | ");
                sb.append(p);
            }
            return sb.toString();
        }
    }

    @JsonPropertyOrder({"mutable","inner"})
    final class Ref implements IrPattern {
        public final boolean mutable;
        public final IrPattern inner;

        @JsonCreator
        public Ref(
                @JsonProperty("mutable") boolean mutable,
                @JsonProperty("inner") IrPattern inner
        ) {
            this.mutable = mutable;
            this.inner = inner;
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitRef(this); }

        @Override public String toString() { return (mutable ? "&mut " : "&") + inner; }
    }

    private static String join(List<IrPattern> patterns) {
        StringBuilder sb = new StringBuilder();
        for (IrPattern p : patterns) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(p);
        }
        return sb.toString();
    }
}
