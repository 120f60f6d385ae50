package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Struct (or struct-variant) field. */
@JsonPropertyOrder({"name","type"})
public final class IrField {
    public final String name;
    public final IrTypeRef type;

    @JsonCreator
    public IrField(
            @JsonProperty("name") String name,
            @JsonProperty("type") IrTypeRef type
    ) {
        this.name = name;
        this.type = type == null ? IrTypeRef.unit() : type;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrField)) return false;
        IrField that = (IrField) o;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type);
    }
}
