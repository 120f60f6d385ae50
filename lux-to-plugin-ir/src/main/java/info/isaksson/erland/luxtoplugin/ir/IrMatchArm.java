package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One arm of a match: pattern, optional guard, body.
 *
 * <p>In expression position the arm's value is its trailing expression statement.</p>
 */
@JsonPropertyOrder({"pattern","guard","body"})
public final class IrMatchArm {
    public final IrPattern pattern;
    public final IrExpr guard;
    public final List<IrStmt> body;

    @JsonCreator
    public IrMatchArm(
            @JsonProperty("pattern") IrPattern pattern,
            @JsonProperty("guard") IrExpr guard,
            @JsonProperty("body") List<IrStmt> body
    ) {
        this.pattern = pattern == null ? new IrPattern.Wildcard() : pattern;
        this.guard = guard;
        this.body = body == null ? List.of() : List.copyOf(body);
    }
}
