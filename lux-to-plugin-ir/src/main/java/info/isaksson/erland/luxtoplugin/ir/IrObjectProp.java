package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Property of an object destructuring pattern.
 *
 * <ul>
 *   <li>SHORTHAND: {@code { key }} binds {@code key}</li>
 *   <li>KEY_VALUE: {@code { key: value }}</li>
 *   <li>REST: {@code { ...key }}</li>
 * </ul>
 */
@JsonPropertyOrder({"shape","key","value"})
public final class IrObjectProp {

    public enum Shape { SHORTHAND, KEY_VALUE, REST }

    public final Shape shape;
    public final String key;
    public final IrPattern value;

    @JsonCreator
    public IrObjectProp(
            @JsonProperty("shape") Shape shape,
            @JsonProperty("key") String key,
            @JsonProperty("value") IrPattern value
    ) {
        this.shape = shape != null ? shape : (value != null ? Shape.KEY_VALUE : Shape.SHORTHAND);
        this.key = key;
        this.value = value;
    }

    public static IrObjectProp shorthand(String key) {
        return new IrObjectProp(Shape.SHORTHAND, key, null);
    }

    public static IrObjectProp keyValue(String key, IrPattern value) {
        return new IrObjectProp(Shape.KEY_VALUE, key, value);
    }

    public static IrObjectProp rest(String key) {
        return new IrObjectProp(Shape.REST, key, null);
    }
}
