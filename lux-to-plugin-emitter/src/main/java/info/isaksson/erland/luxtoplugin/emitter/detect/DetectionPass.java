package info.isaksson.erland.luxtoplugin.emitter.detect;

import info.isaksson.erland.luxtoplugin.ir.IrExpr;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;
import info.isaksson.erland.luxtoplugin.ir.IrScanner;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRefKind;
import info.isaksson.erland.luxtoplugin.ir.IrUse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Walks the whole program once, before any text is emitted, and records which support
 * each backend's header must provide.
 *
 * <p>The walk is transitive: a {@code HashMap} in the declared type of a variable nested
 * three blocks deep sets {@link SupportMarker#HASH_MAP} just like a struct field would.</p>
 */
public final class DetectionPass {

    private static final Logger log = LoggerFactory.getLogger(DetectionPass.class);

    public DetectionResult run(IrProgram program) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        Collector c = new Collector();
        c.scanProgram(program);
        DetectionResult result = new DetectionResult(c.found);
        log.debug("Detected support markers for '{}': {}", program.name(), result.all());
        return result;
    }

    private static final class Collector extends IrScanner {
        final Set<SupportMarker> found = EnumSet.noneOf(SupportMarker.class);

        @Override
        protected void onUse(IrUse use) {
            if (use.path == null || use.isFileModule()) return;
            switch (use.path) {
                case "json":
                case "serde_json":
                    found.add(SupportMarker.JSON);
                    break;
                case "fs":
                    found.add(SupportMarker.FS);
                    break;
                case "path":
                    found.add(SupportMarker.PATH);
                    break;
                case "parser":
                    found.add(SupportMarker.PARSER);
                    break;
                case "codegen":
                    found.add(SupportMarker.CODEGEN);
                    break;
                case "regex":
                    found.add(SupportMarker.REGEX);
                    break;
                default:
                    byName(use.path);
                    for (String imported : use.imports) {
                        byName(imported);
                    }
            }
        }

        @Override
        protected void onType(IrTypeRef type) {
            if (type.kind == IrTypeRefKind.CONTAINER || type.kind == IrTypeRefKind.NAMED) {
                byName(type.name);
            }
        }

        @Override
        protected void onExpr(IrExpr expr) {
            if (expr instanceof IrExpr.Ident) {
                byName(((IrExpr.Ident) expr).name);
            } else if (expr instanceof IrExpr.Member) {
                IrExpr.Member m = (IrExpr.Member) expr;
                if (m.path && m.object instanceof IrExpr.Ident) {
                    String owner = ((IrExpr.Ident) m.object).name;
                    if ("serde_json".equals(owner) || "json".equals(owner)) found.add(SupportMarker.JSON);
                    else if ("codegen".equals(owner)) found.add(SupportMarker.CODEGEN);
                    else if ("parser".equals(owner)) found.add(SupportMarker.PARSER);
                }
            } else if (expr instanceof IrExpr.MacroCall) {
                found.add(SupportMarker.MACRO_SHIMS);
            }
        }

        private void byName(String name) {
            if (name == null) return;
            switch (name) {
                case "HashMap":
                    found.add(SupportMarker.HASH_MAP);
                    break;
                case "HashSet":
                    found.add(SupportMarker.HASH_SET);
                    break;
                case "Regex":
                    found.add(SupportMarker.REGEX);
                    break;
                default:
                    break;
            }
        }
    }
}
