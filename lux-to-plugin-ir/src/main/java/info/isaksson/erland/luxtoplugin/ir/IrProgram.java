package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Root of the validated IR for one compilation unit.
 *
 * <p>The IR is immutable once constructed. Both backends read the same instance.</p>
 */
@JsonPropertyOrder({"schemaVersion","uses","decl"})
public final class IrProgram {

    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    public final String schemaVersion;
    public final List<IrUse> uses;
    public final IrTopLevel decl;

    @JsonCreator
    public IrProgram(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("uses") List<IrUse> uses,
            @JsonProperty("decl") IrTopLevel decl
    ) {
        this.schemaVersion = schemaVersion == null ? CURRENT_SCHEMA_VERSION : schemaVersion;
        this.uses = uses == null ? List.of() : List.copyOf(uses);
        this.decl = decl;
    }

    public static IrProgram of(List<IrUse> uses, IrTopLevel decl) {
        return new IrProgram(CURRENT_SCHEMA_VERSION, uses, decl);
    }

    /** Name of the top-level unit, or {@code "plugin"} when absent. */
    public String name() {
        return decl == null || decl.name() == null ? "plugin" : decl.name();
    }
}
