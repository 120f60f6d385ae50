package info.isaksson.erland.luxtoplugin.emitter.types;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.ir.IrBinaryOp;
import info.isaksson.erland.luxtoplugin.ir.IrCompoundOp;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import info.isaksson.erland.luxtoplugin.ir.IrUnaryOp;

/**
 * Maps DSL type descriptors, operators and default values to one backend's native tokens.
 *
 * <p>Every method is total over the DSL's closed grammar; a token with no native form for
 * this backend raises {@link info.isaksson.erland.luxtoplugin.emitter.UnsupportedConstructException}.</p>
 */
public interface TypeMapper {

    Backend backend();

    String mapType(IrTypeRef type);

    String binaryOp(IrBinaryOp op);

    String compoundOp(IrCompoundOp op);

    String unaryOp(IrUnaryOp op);

    /** Native literal for the zero value of {@code type}. */
    String defaultValue(IrTypeRef type);

    static TypeMapper forBackend(Backend backend) {
        switch (backend) {
            case BABEL: return new BabelTypeMapper();
            case SWC: return new SwcTypeMapper();
            default: throw new IllegalArgumentException("Unknown backend: " + backend);
        }
    }
}
