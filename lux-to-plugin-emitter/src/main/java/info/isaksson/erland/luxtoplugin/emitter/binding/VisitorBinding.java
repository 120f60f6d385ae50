package info.isaksson.erland.luxtoplugin.emitter.binding;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.ir.IrItem;

/**
 * A DSL method resolved to the node kind it visits.
 *
 * <p>{@link #mutable} is the decoration flag: plugins rewrite nodes ({@code VisitMut}),
 * writers only read them ({@code Visit}).</p>
 */
public final class VisitorBinding {
    public final IrItem.Function method;
    public final NodeKind kind;
    public final boolean mutable;

    public VisitorBinding(IrItem.Function method, NodeKind kind, boolean mutable) {
        if (method == null) throw new IllegalArgumentException("method must not be null");
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        this.method = method;
        this.kind = kind;
        this.mutable = mutable;
    }

    public String methodName() {
        return method.name;
    }

    /** Hook name the backend emits for this binding. */
    public String hookName(Backend backend) {
        switch (backend) {
            case BABEL: return kind.babelVisitorKey();
            case SWC: return mutable ? kind.swcVisitMutHook : kind.swcVisitHook();
            default: throw new IllegalArgumentException("Unknown backend: " + backend);
        }
    }

    @Override
    public String toString() {
        return method.name + " -> " + kind.babelType;
    }
}
