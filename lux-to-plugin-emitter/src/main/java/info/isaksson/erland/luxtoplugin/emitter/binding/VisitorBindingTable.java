package info.isaksson.erland.luxtoplugin.emitter.binding;

import info.isaksson.erland.luxtoplugin.emitter.EmitterWarning;
import info.isaksson.erland.luxtoplugin.emitter.EmitterWarnings;
import info.isaksson.erland.luxtoplugin.ir.IrItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a unit's functions into visitor-bound methods and plain helpers.
 *
 * <p>Binding goes through {@link NodeKind#forMethod(String)} only. A {@code visit_*} name the
 * table does not know is reported as {@value EmitterWarning#MISSING_VISITOR_BINDING} and kept
 * as a helper function.</p>
 */
public final class VisitorBindingTable {

    private static final String VISITOR_PREFIX = "visit_";

    private VisitorBindingTable() {}

    public static boolean isVisitorNamed(String methodName) {
        return methodName != null && methodName.startsWith(VISITOR_PREFIX);
    }

    public static final class Partition {
        public final List<VisitorBinding> visitors;
        public final List<IrItem.Function> helpers;

        Partition(List<VisitorBinding> visitors, List<IrItem.Function> helpers) {
            this.visitors = Collections.unmodifiableList(visitors);
            this.helpers = Collections.unmodifiableList(helpers);
        }
    }

    /**
     * @param warnings may be null when the caller does not report (e.g. inline traverse bodies
     *                 already reported through their enclosing unit)
     */
    public static Partition partition(List<IrItem.Function> functions, boolean mutable, EmitterWarnings warnings) {
        List<VisitorBinding> visitors = new ArrayList<>();
        List<IrItem.Function> helpers = new ArrayList<>();
        for (IrItem.Function f : functions) {
            if (!isVisitorNamed(f.name)) {
                helpers.add(f);
                continue;
            }
            NodeKind kind = NodeKind.forMethod(f.name);
            if (kind == null) {
                if (warnings != null) warnings.add(EmitterWarning.missingVisitorBinding(f.name, f.source));
                helpers.add(f);
            } else {
                visitors.add(new VisitorBinding(f, kind, mutable));
            }
        }
        return new Partition(visitors, helpers);
    }
}
