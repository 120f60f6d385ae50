package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * DSL type descriptor.
 *
 * <p>Nested descriptors (typeArgs, elementType) may be arbitrarily deep; the detection pass
 * walks them transitively.</p>
 */
@JsonPropertyOrder({"kind","name","typeArgs","elementType","mutable"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class IrTypeRef {
    public final IrTypeRefKind kind;

    /** For PRIMITIVE/NAMED/CONTAINER kinds. */
    public final String name;

    /** For CONTAINER: type arguments. For TUPLE: element types. */
    public final List<IrTypeRef> typeArgs;

    /** For ARRAY/OPTIONAL/REFERENCE: the wrapped type. */
    public final IrTypeRef elementType;

    /** For REFERENCE: {@code &mut} instead of {@code &}. */
    public final boolean mutable;

    @JsonCreator
    public IrTypeRef(
            @JsonProperty("kind") IrTypeRefKind kind,
            @JsonProperty("name") String name,
            @JsonProperty("typeArgs") List<IrTypeRef> typeArgs,
            @JsonProperty("elementType") IrTypeRef elementType,
            @JsonProperty("mutable") boolean mutable
    ) {
        this.kind = kind == null ? IrTypeRefKind.UNIT : kind;
        this.name = name;
        this.typeArgs = typeArgs == null ? List.of() : List.copyOf(typeArgs);
        this.elementType = elementType;
        this.mutable = mutable;
    }

    public static IrTypeRef primitive(String name) {
        return new IrTypeRef(IrTypeRefKind.PRIMITIVE, name, null, null, false);
    }

    public static IrTypeRef named(String name) {
        return new IrTypeRef(IrTypeRefKind.NAMED, name, null, null, false);
    }

    public static IrTypeRef container(String name, List<IrTypeRef> args) {
        return new IrTypeRef(IrTypeRefKind.CONTAINER, name, args, null, false);
    }

    public static IrTypeRef arrayOf(IrTypeRef element) {
        return new IrTypeRef(IrTypeRefKind.ARRAY, null, null, element, false);
    }

    public static IrTypeRef optional(IrTypeRef element) {
        return new IrTypeRef(IrTypeRefKind.OPTIONAL, null, null, element, false);
    }

    public static IrTypeRef reference(IrTypeRef element, boolean mutable) {
        return new IrTypeRef(IrTypeRefKind.REFERENCE, null, null, element, mutable);
    }

    public static IrTypeRef tuple(List<IrTypeRef> elements) {
        return new IrTypeRef(IrTypeRefKind.TUPLE, null, elements, null, false);
    }

    public static IrTypeRef unit() {
        return new IrTypeRef(IrTypeRefKind.UNIT, null, null, null, false);
    }

    /** Strips references, e.g. {@code &mut State} yields {@code State}. */
    @JsonIgnore
    public IrTypeRef dereferenced() {
        IrTypeRef t = this;
        while (t.kind == IrTypeRefKind.REFERENCE && t.elementType != null) {
            t = t.elementType;
        }
        return t;
    }

    @JsonIgnore
    public boolean isUnit() {
        return kind == IrTypeRefKind.UNIT || (kind == IrTypeRefKind.PRIMITIVE && "()".equals(name));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrTypeRef)) return false;
        IrTypeRef that = (IrTypeRef) o;
        return kind == that.kind &&
                mutable == that.mutable &&
                Objects.equals(name, that.name) &&
                Objects.equals(typeArgs, that.typeArgs) &&
                Objects.equals(elementType, that.elementType);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, name, typeArgs, elementType, mutable);
    }

    @Override public String toString() {
        switch (kind) {
            case ARRAY: return "[" + elementType + "]";
            case OPTIONAL: return elementType + "?";
            case REFERENCE: return (mutable ? "&mut " : "&") + elementType;
            case CONTAINER: return name + "<" + typeArgs + ">";
            case TUPLE: return "(" + typeArgs + ")";
            case UNIT: return "()";
            default: return String.valueOf(name);
        }
    }
}
