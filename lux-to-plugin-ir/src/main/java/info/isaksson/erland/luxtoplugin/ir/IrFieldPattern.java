package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** {@code field: pattern} inside a struct pattern. */
@JsonPropertyOrder({"name","pattern"})
public final class IrFieldPattern {
    public final String name;
    public final IrPattern pattern;

    @JsonCreator
    public IrFieldPattern(
            @JsonProperty("name") String name,
            @JsonProperty("pattern") IrPattern pattern
    ) {
        this.name = name;
        this.pattern = pattern == null ? new IrPattern.Ident(name) : pattern;
    }
}
