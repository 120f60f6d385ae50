package info.isaksson.erland.luxtoplugin.ir;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Names a pattern binds, in first-occurrence order. */
public final class IrPatternBindings {

    private IrPatternBindings() {}

    public static List<String> of(IrPattern pattern) {
        Set<String> names = new LinkedHashSet<>();
        new IrScanner() {
            @Override protected void onPattern(IrPattern p) {
                if (p instanceof IrPattern.Ident) {
                    String n = ((IrPattern.Ident) p).name;
                    if (n != null && !"_".equals(n)) names.add(n);
                } else if (p instanceof IrPattern.ObjectPattern) {
                    for (IrObjectProp prop : ((IrPattern.ObjectPattern) p).props) {
                        if (prop.shape != IrObjectProp.Shape.KEY_VALUE && prop.key != null) names.add(prop.key);
                    }
                }
            }
        }.scanPattern(pattern);
        return new ArrayList<>(names);
    }
}
