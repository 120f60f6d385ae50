package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Enum variant: unit ({@code A}), tuple ({@code A(T1, T2)}) or struct ({@code A { f: T }}). */
@JsonPropertyOrder({"name","shape","types","fields"})
public final class IrVariant {

    public enum Shape { UNIT, TUPLE, STRUCT }

    public final String name;
    public final Shape shape;
    public final List<IrTypeRef> types;
    public final List<IrField> fields;

    @JsonCreator
    public IrVariant(
            @JsonProperty("name") String name,
            @JsonProperty("shape") Shape shape,
            @JsonProperty("types") List<IrTypeRef> types,
            @JsonProperty("fields") List<IrField> fields
    ) {
        this.name = name;
        this.types = types == null ? List.of() : List.copyOf(types);
        this.fields = fields == null ? List.of() : List.copyOf(fields);
        if (shape != null) {
            this.shape = shape;
        } else if (!this.fields.isEmpty()) {
            this.shape = Shape.STRUCT;
        } else if (!this.types.isEmpty()) {
            this.shape = Shape.TUPLE;
        } else {
            this.shape = Shape.UNIT;
        }
    }

    public static IrVariant unit(String name) {
        return new IrVariant(name, Shape.UNIT, null, null);
    }

    public static IrVariant tuple(String name, List<IrTypeRef> types) {
        return new IrVariant(name, Shape.TUPLE, types, null);
    }

    public static IrVariant struct(String name, List<IrField> fields) {
        return new IrVariant(name, Shape.STRUCT, null, fields);
    }
}
