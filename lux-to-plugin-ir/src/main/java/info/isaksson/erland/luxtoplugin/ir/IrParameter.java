package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Function parameter. Order in the owning function is significant. */
@JsonPropertyOrder({"name","type"})
public final class IrParameter {
    public final String name;
    public final IrTypeRef type;

    @JsonCreator
    public IrParameter(
            @JsonProperty("name") String name,
            @JsonProperty("type") IrTypeRef type
    ) {
        this.name = name;
        this.type = type == null ? IrTypeRef.unit() : type;
    }

    @JsonIgnore
    public boolean isSelf() {
        return "self".equals(name);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrParameter)) return false;
        IrParameter that = (IrParameter) o;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type);
    }
}
