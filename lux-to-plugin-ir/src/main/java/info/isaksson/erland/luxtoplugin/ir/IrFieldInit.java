package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** {@code name: value} inside a struct initializer. */
@JsonPropertyOrder({"name","value"})
public final class IrFieldInit {
    public final String name;
    public final IrExpr value;

    @JsonCreator
    public IrFieldInit(
            @JsonProperty("name") String name,
            @JsonProperty("value") IrExpr value
    ) {
        this.name = name;
        this.value = value;
    }
}
