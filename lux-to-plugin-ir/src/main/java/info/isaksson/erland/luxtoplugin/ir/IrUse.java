package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Import declaration ({@code use ./helpers.lux::{escape_string};}).
 *
 * <p>Paths starting with {@code ./} or {@code ../} are file modules; everything else names a
 * built-in module (fs, json, path, HashMap, ...).</p>
 */
@JsonPropertyOrder({"path","alias","imports"})
public final class IrUse {
    public final String path;
    public final String alias;
    public final List<String> imports;

    @JsonCreator
    public IrUse(
            @JsonProperty("path") String path,
            @JsonProperty("alias") String alias,
            @JsonProperty("imports") List<String> imports
    ) {
        this.path = path;
        this.alias = alias;
        this.imports = imports == null ? List.of() : List.copyOf(imports);
    }

    @JsonIgnore
    public boolean isFileModule() {
        return path != null && (path.startsWith("./") || path.startsWith("../"));
    }

    /** {@code ../utils/helpers.lux} yields {@code helpers}. */
    public String moduleName() {
        if (path == null) return "";
        String p = path;
        if (p.endsWith(".lux")) p = p.substring(0, p.length() - 4);
        else if (p.endsWith(".rsc")) p = p.substring(0, p.length() - 4);
        int slash = p.lastIndexOf('/');
        return slash >= 0 ? p.substring(slash + 1) : p;
    }
}
