package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Literal value.
 *
 * <p>Numeric literals keep the front end's source text in {@link #value} so both backends can
 * emit them verbatim. STRING values hold the unescaped content.</p>
 */
@JsonPropertyOrder({"type","value"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IrLiteral {

    public enum Type { STRING, INT, FLOAT, BOOL, NULL, UNIT }

    public final Type type;
    public final String value;

    @JsonCreator
    public IrLiteral(
            @JsonProperty("type") Type type,
            @JsonProperty("value") String value
    ) {
        this.type = type == null ? Type.UNIT : type;
        this.value = value;
    }

    public static IrLiteral string(String s) {
        return new IrLiteral(Type.STRING, s);
    }

    public static IrLiteral integer(long n) {
        return new IrLiteral(Type.INT, Long.toString(n));
    }

    public static IrLiteral floating(String text) {
        return new IrLiteral(Type.FLOAT, text);
    }

    public static IrLiteral bool(boolean b) {
        return new IrLiteral(Type.BOOL, Boolean.toString(b));
    }

    public static IrLiteral nullValue() {
        return new IrLiteral(Type.NULL, null);
    }

    public static IrLiteral unit() {
        return new IrLiteral(Type.UNIT, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrLiteral)) return false;
        IrLiteral that = (IrLiteral) o;
        return type == that.type && Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override public String toString() {
        return type == Type.STRING ? "\"" + value + "\"" : String.valueOf(value == null ? type : value);
    }
}
