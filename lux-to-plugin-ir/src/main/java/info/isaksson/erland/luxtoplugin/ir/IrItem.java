package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/** Items of a plugin, writer or module, in declaration order. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IrItem.Struct.class, name = "Struct"),
        @JsonSubTypes.Type(value = IrItem.Enum.class, name = "Enum"),
        @JsonSubTypes.Type(value = IrItem.Function.class, name = "Function"),
        @JsonSubTypes.Type(value = IrItem.Impl.class, name = "Impl"),
        @JsonSubTypes.Type(value = IrItem.Hook.class, name = "Hook")
})
public sealed interface IrItem {

    String name();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitStruct(Struct item);
        R visitEnum(Enum item);
        R visitFunction(Function item);
        R visitImpl(Impl item);
        R visitHook(Hook item);
    }

    @JsonPropertyOrder({"name","fields","derives","source"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    final class Struct implements IrItem {
        public final String name;
        public final List<IrField> fields;
        public final List<String> derives;
        public final IrSourceRef source;

        @JsonCreator
        public Struct(
                @JsonProperty("name") String name,
                @JsonProperty("fields") List<IrField> fields,
                @JsonProperty("derives") List<String> derives,
                @JsonProperty("source") IrSourceRef source
        ) {
            this.name = name;
            this.fields = fields == null ? List.of() : List.copyOf(fields);
            this.derives = derives == null ? List.of() : List.copyOf(derives);
            this.source = source;
        }

        @Override public String name() { return name; }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitStruct(this); }
    }

    @JsonPropertyOrder({"name","variants","source"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    final class Enum implements IrItem {
        public final String name;
        public final List<IrVariant> variants;
        public final IrSourceRef source;

        @JsonCreator
        public Enum(
                @JsonProperty("name") String name,
                @JsonProperty("variants") List<IrVariant> variants,
                @JsonProperty("source") IrSourceRef source
        ) {
            this.name = name;
            this.variants = variants == null ? List.of() : List.copyOf(variants);
            this.source = source;
        }

        @Override public String name() { return name; }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitEnum(this); }
    }

    /**
     * Function or method. Visitor methods are ordinary functions here; their binding to a node
     * kind is resolved by the emitter from the name.
     */
    @JsonPropertyOrder({"name","pub","params","returnType","body","source"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    final class Function implements IrItem {
        public final String name;
        public final boolean pub;
        public final List<IrParameter> params;
        /** Null means unit. */
        public final IrTypeRef returnType;
        public final List<IrStmt> body;
        public final IrSourceRef source;

        @JsonCreator
        public Function(
                @JsonProperty("name") String name,
                @JsonProperty("pub") boolean pub,
                @JsonProperty("params") List<IrParameter> params,
                @JsonProperty("returnType") IrTypeRef returnType,
                @JsonProperty("body") List<IrStmt> body,
                @JsonProperty("source") IrSourceRef source
        ) {
            this.name = name;
            this.pub = pub;
            this.params = params == null ? List.of() : List.copyOf(params);
            this.returnType = returnType;
            this.body = body == null ? List.of() : List.copyOf(body);
            this.source = source;
        }

        @Override public String name() { return name; }

        @JsonIgnore
        public boolean returnsValue() {
            return returnType != null && !returnType.isUnit();
        }

        /** Parameters other than {@code self}. */
        @JsonIgnore
        public List<IrParameter> valueParams() {
            if (params.isEmpty() || !params.get(0).isSelf()) return params;
            return params.subList(1, params.size());
        }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitFunction(this); }
    }

    @JsonPropertyOrder({"target","methods","source"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    final class Impl implements IrItem {
        public final String target;
        public final List<Function> methods;
        public final IrSourceRef source;

        @JsonCreator
        public Impl(
                @JsonProperty("target") String target,
                @JsonProperty("methods") List<Function> methods,
                @JsonProperty("source") IrSourceRef source
        ) {
            this.target = target;
            this.methods = methods == null ? List.of() : List.copyOf(methods);
            this.source = source;
        }

        @Override public String name() { return "impl " + target; }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitImpl(this); }
    }

    /** {@code fn pre(...)} / {@code fn exit(...)} lifecycle hooks. */
    @JsonPropertyOrder({"phase","function"})
    final class Hook implements IrItem {

        public enum Phase { PRE, EXIT }

        public final Phase phase;
        public final Function function;

        @JsonCreator
        public Hook(
                @JsonProperty("phase") Phase phase,
                @JsonProperty("function") Function function
        ) {
            this.phase = phase == null ? Phase.PRE : phase;
            this.function = function;
        }

        @Override public String name() { return function == null ? phase.name().toLowerCase() : function.name; }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitHook(this); }
    }
}
