package info.isaksson.erland.luxtoplugin.emitter.types;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.UnsupportedConstructException;
import info.isaksson.erland.luxtoplugin.ir.IrBinaryOp;
import info.isaksson.erland.luxtoplugin.ir.IrCompoundOp;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRefKind;
import info.isaksson.erland.luxtoplugin.ir.IrUnaryOp;

import java.util.ArrayList;
import java.util.List;

/**
 * JavaScript side. Types are erased at runtime, so {@link #mapType} yields JSDoc type
 * expressions used in generated class documentation.
 */
public final class BabelTypeMapper implements TypeMapper {

    @Override
    public Backend backend() {
        return Backend.BABEL;
    }

    @Override
    public String mapType(IrTypeRef type) {
        if (type == null) return "undefined";
        switch (type.kind) {
            case PRIMITIVE:
            case NAMED:
                return named(type);
            case CONTAINER:
                return container(type);
            case ARRAY:
                return "Array<" + mapType(type.elementType) + ">";
            case OPTIONAL:
                return mapType(type.elementType) + "|null";
            case REFERENCE:
                return mapType(type.elementType);
            case TUPLE:
                return "[" + joined(type.typeArgs) + "]";
            case UNIT:
                return "undefined";
            default:
                throw new UnsupportedConstructException("type " + type, Backend.BABEL);
        }
    }

    private String named(IrTypeRef type) {
        String name = type.name;
        if (name == null) throw new UnsupportedConstructException("type <unnamed>", Backend.BABEL);
        if (DslTypes.STRINGS.contains(name) || DslTypes.CHAR.equals(name) || DslTypes.CODE_BUILDER.equals(name)) {
            return "string";
        }
        if (DslTypes.INTEGERS.contains(name) || DslTypes.FLOATS.contains(name)) return "number";
        if (DslTypes.BOOLEANS.contains(name)) return "boolean";
        if (DslTypes.UNIT.equals(name)) return "undefined";
        if (type.kind == IrTypeRefKind.PRIMITIVE) {
            throw new UnsupportedConstructException("type " + name, Backend.BABEL);
        }
        return name;
    }

    private String container(IrTypeRef type) {
        List<IrTypeRef> args = type.typeArgs;
        switch (type.name == null ? "" : type.name) {
            case "Vec":
                return "Array<" + joined(args) + ">";
            case "HashMap":
                return "Map<" + joined(args) + ">";
            case "HashSet":
                return "Set<" + joined(args) + ">";
            case "Option":
                return joined(args) + "|null";
            case "Result":
                return "{ok: boolean, value: " + (args.isEmpty() ? "*" : mapType(args.get(0)))
                        + ", error: " + (args.size() < 2 ? "*" : mapType(args.get(1))) + "}";
            case "Box":
                return joined(args);
            default:
                throw new UnsupportedConstructException("type " + type.name, Backend.BABEL);
        }
    }

    private String joined(List<IrTypeRef> types) {
        List<String> parts = new ArrayList<>();
        for (IrTypeRef t : types) parts.add(mapType(t));
        return String.join(", ", parts);
    }

    @Override
    public String binaryOp(IrBinaryOp op) {
        switch (op) {
            case EQ: return "===";
            case NOT_EQ: return "!==";
            default: return op.symbol;
        }
    }

    @Override
    public String compoundOp(IrCompoundOp op) {
        return op.symbol;
    }

    /** References and dereferences have no JavaScript form; they erase to nothing. */
    @Override
    public String unaryOp(IrUnaryOp op) {
        switch (op) {
            case NEG:
            case NOT:
                return op.symbol;
            default:
                return "";
        }
    }

    @Override
    public String defaultValue(IrTypeRef type) {
        if (type == null) return "undefined";
        switch (type.kind) {
            case PRIMITIVE:
            case NAMED: {
                String name = type.name == null ? "" : type.name;
                if (DslTypes.STRINGS.contains(name) || DslTypes.CODE_BUILDER.equals(name) || DslTypes.CHAR.equals(name)) {
                    return "\"\"";
                }
                if (DslTypes.INTEGERS.contains(name) || DslTypes.FLOATS.contains(name)) return "0";
                if (DslTypes.BOOLEANS.contains(name)) return "false";
                if (DslTypes.UNIT.equals(name)) return "undefined";
                return "null";
            }
            case CONTAINER:
                switch (type.name == null ? "" : type.name) {
                    case "Vec": return "[]";
                    case "HashMap": return "new Map()";
                    case "HashSet": return "new Set()";
                    default: return "null";
                }
            case ARRAY:
                return "[]";
            case UNIT:
                return "undefined";
            default:
                return "null";
        }
    }
}
