package info.isaksson.erland.luxtoplugin.emitter.types;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.UnsupportedConstructException;
import info.isaksson.erland.luxtoplugin.emitter.binding.NodeKind;
import info.isaksson.erland.luxtoplugin.ir.IrBinaryOp;
import info.isaksson.erland.luxtoplugin.ir.IrCompoundOp;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import info.isaksson.erland.luxtoplugin.ir.IrUnaryOp;

import java.util.ArrayList;
import java.util.List;

/** Rust types and operators for the SWC backend. */
public final class SwcTypeMapper implements TypeMapper {

    @Override
    public Backend backend() {
        return Backend.SWC;
    }

    @Override
    public String mapType(IrTypeRef type) {
        if (type == null) return "()";
        switch (type.kind) {
            case PRIMITIVE:
                return primitive(type.name);
            case NAMED:
                return named(type.name);
            case CONTAINER:
                if (!DslTypes.CONTAINERS.contains(type.name)) {
                    throw new UnsupportedConstructException("type " + type.name, Backend.SWC);
                }
                return type.name + "<" + joined(type.typeArgs) + ">";
            case ARRAY:
                return "Vec<" + mapType(type.elementType) + ">";
            case OPTIONAL:
                return "Option<" + mapType(type.elementType) + ">";
            case REFERENCE:
                return (type.mutable ? "&mut " : "&") + mapType(type.elementType);
            case TUPLE:
                if (type.typeArgs.size() == 1) return "(" + mapType(type.typeArgs.get(0)) + ",)";
                return "(" + joined(type.typeArgs) + ")";
            case UNIT:
                return "()";
            default:
                throw new UnsupportedConstructException("type " + type, Backend.SWC);
        }
    }

    private String primitive(String name) {
        if (name == null) throw new UnsupportedConstructException("type <unnamed>", Backend.SWC);
        if ("Str".equals(name) || "String".equals(name)) return "String";
        if ("str".equals(name)) return "str";
        if ("Number".equals(name)) return "i32";
        if ("Bool".equals(name) || "bool".equals(name)) return "bool";
        if (DslTypes.CODE_BUILDER.equals(name)) return "String";
        if (DslTypes.isPrimitive(name)) return name;
        throw new UnsupportedConstructException("type " + name, Backend.SWC);
    }

    private String named(String name) {
        if (name == null) throw new UnsupportedConstructException("type <unnamed>", Backend.SWC);
        if (DslTypes.isPrimitive(name) || DslTypes.CODE_BUILDER.equals(name)) return primitive(name);
        NodeKind kind = NodeKind.forName(name);
        return kind != null ? kind.swcType : name;
    }

    private String joined(List<IrTypeRef> types) {
        List<String> parts = new ArrayList<>();
        for (IrTypeRef t : types) parts.add(mapType(t));
        return String.join(", ", parts);
    }

    @Override
    public String binaryOp(IrBinaryOp op) {
        switch (op) {
            case NULL_COALESCE:
            case POW:
                throw new UnsupportedConstructException("operator " + op.symbol, Backend.SWC);
            default:
                return op.symbol;
        }
    }

    @Override
    public String compoundOp(IrCompoundOp op) {
        return op.symbol;
    }

    @Override
    public String unaryOp(IrUnaryOp op) {
        return op.symbol;
    }

    @Override
    public String defaultValue(IrTypeRef type) {
        if (type == null) return "()";
        switch (type.kind) {
            case PRIMITIVE:
            case NAMED:
                return primitiveDefault(type.name);
            case CONTAINER:
                switch (type.name) {
                    case "Vec": return "Vec::new()";
                    case "HashMap": return "HashMap::new()";
                    case "HashSet": return "HashSet::new()";
                    case "Option": return "None";
                    default: return "Default::default()";
                }
            case ARRAY:
                return "Vec::new()";
            case OPTIONAL:
                return "None";
            case UNIT:
                return "()";
            default:
                return "Default::default()";
        }
    }

    private static String primitiveDefault(String name) {
        if (name == null) return "Default::default()";
        if (DslTypes.STRINGS.contains(name) || DslTypes.CODE_BUILDER.equals(name)) return "String::new()";
        if (DslTypes.INTEGERS.contains(name)) return "0";
        if (DslTypes.FLOATS.contains(name)) return "0.0";
        if (DslTypes.BOOLEANS.contains(name)) return "false";
        if (DslTypes.CHAR.equals(name)) return "'\\0'";
        if (DslTypes.UNIT.equals(name)) return "()";
        return "Default::default()";
    }
}
