package info.isaksson.erland.luxtoplugin.core.check;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.CodegenException;
import info.isaksson.erland.luxtoplugin.emitter.EmitterOptions;
import info.isaksson.erland.luxtoplugin.emitter.EmitterWarning;
import info.isaksson.erland.luxtoplugin.emitter.PatternLoweringException;
import info.isaksson.erland.luxtoplugin.emitter.PluginEmitter;
import info.isaksson.erland.luxtoplugin.emitter.detect.DetectionResult;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;
import info.isaksson.erland.luxtoplugin.ir.IrSourceRef;
import info.isaksson.erland.luxtoplugin.ir.IrTopLevel;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on an IR program plus a dry run of both backends.
 *
 * <p>The structural checks cover what the generators rely on but the IR shape does not
 * enforce. The dry run reports each backend's first failure; backend warnings are reported
 * once even when both backends raise them.</p>
 */
public final class IrChecker {

    private final PluginEmitter emitter = new PluginEmitter();

    public List<CheckDiagnostic> check(IrProgram program) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        List<CheckDiagnostic> out = new ArrayList<>();
        if (program.decl == null) {
            out.add(CheckDiagnostic.error(CheckDiagnostic.MISSING_UNIT, "program has no top-level unit", null));
            return out;
        }
        checkItems(program.decl, out);
        if (out.stream().anyMatch(CheckDiagnostic::isError)) return out;
        dryRun(program, out);
        return out;
    }

    public static long errorCount(List<CheckDiagnostic> diagnostics) {
        return diagnostics.stream().filter(CheckDiagnostic::isError).count();
    }

    private static void checkItems(IrTopLevel unit, List<CheckDiagnostic> out) {
        Map<String, IrItem> seen = new HashMap<>();
        Set<IrItem.Hook.Phase> phases = EnumSet.noneOf(IrItem.Hook.Phase.class);
        for (IrItem item : unit.items()) {
            if (item instanceof IrItem.Hook) {
                IrItem.Hook h = (IrItem.Hook) item;
                if (!phases.add(h.phase)) {
                    out.add(CheckDiagnostic.error(CheckDiagnostic.DUPLICATE_HOOK,
                            "hook '" + h.phase.name().toLowerCase() + "' is declared more than once",
                            h.function == null ? null : h.function.source));
                }
                continue;
            }
            if (item instanceof IrItem.Impl) continue;
            IrItem previous = seen.putIfAbsent(item.name(), item);
            if (previous != null) {
                out.add(CheckDiagnostic.error(CheckDiagnostic.DUPLICATE_ITEM,
                        "duplicate item '" + item.name() + "' in " + unit.name(), sourceOf(item)));
            }
            if (item instanceof IrItem.Function) {
                IrItem.Function f = (IrItem.Function) item;
                if (f.name.startsWith("visit_") && f.valueParams().isEmpty()) {
                    out.add(CheckDiagnostic.error(CheckDiagnostic.VISITOR_WITHOUT_PARAMS,
                            "visitor method '" + f.name + "' takes no node parameter", f.source));
                }
            }
        }
    }

    private void dryRun(IrProgram program, List<CheckDiagnostic> out) {
        DetectionResult detected = emitter.detect(program);
        Set<String> warned = new LinkedHashSet<>();
        for (Backend b : Backend.values()) {
            try {
                PluginEmitter.Result r = emitter.emit(program, b, EmitterOptions.defaults(), detected);
                for (EmitterWarning w : r.warnings) {
                    if (warned.add(w.code + "|" + w.message)) {
                        out.add(CheckDiagnostic.warning(w.code, w.message, w.location));
                    }
                }
            } catch (PatternLoweringException e) {
                out.add(CheckDiagnostic.error(CheckDiagnostic.PATTERN_LOWERING,
                        "[" + b.cliValue + "] " + e.detail(), e.location()));
            } catch (CodegenException e) {
                out.add(CheckDiagnostic.error(CheckDiagnostic.UNSUPPORTED_CONSTRUCT,
                        "[" + b.cliValue + "] " + e.detail(), e.location()));
            }
        }
    }

    private static IrSourceRef sourceOf(IrItem item) {
        if (item instanceof IrItem.Struct) return ((IrItem.Struct) item).source;
        if (item instanceof IrItem.Enum) return ((IrItem.Enum) item).source;
        if (item instanceof IrItem.Function) return ((IrItem.Function) item).source;
        return null;
    }
}
