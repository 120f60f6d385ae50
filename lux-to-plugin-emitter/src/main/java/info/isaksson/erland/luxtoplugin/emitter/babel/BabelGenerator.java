package info.isaksson.erland.luxtoplugin.emitter.babel;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.BackendGenerator;
import info.isaksson.erland.luxtoplugin.emitter.CodegenException;
import info.isaksson.erland.luxtoplugin.emitter.EmitBuffer;
import info.isaksson.erland.luxtoplugin.emitter.EmitterOptions;
import info.isaksson.erland.luxtoplugin.emitter.EmitterWarnings;
import info.isaksson.erland.luxtoplugin.emitter.binding.VisitorBindingTable;
import info.isaksson.erland.luxtoplugin.emitter.detect.DetectionResult;
import info.isaksson.erland.luxtoplugin.emitter.detect.SupportMarker;
import info.isaksson.erland.luxtoplugin.ir.IrField;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrProgram;
import info.isaksson.erland.luxtoplugin.ir.IrSourceRef;
import info.isaksson.erland.luxtoplugin.ir.IrTopLevel;
import info.isaksson.erland.luxtoplugin.ir.IrUse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Babel backend: emits {@code index.js}.
 *
 * <p>Order: header, support requires and helpers, user imports, then the unit. Plugins and
 * writers use {@code module.exports = function({ types: t }) { .. }}; modules export their
 * public names.</p>
 */
public final class BabelGenerator implements BackendGenerator {

    private static final Logger log = LoggerFactory.getLogger(BabelGenerator.class);

    @Override
    public Backend backend() {
        return Backend.BABEL;
    }

    @Override
    public String generate(IrProgram program, DetectionResult detection, EmitterOptions options, EmitterWarnings warnings) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        if (program.decl == null) throw new IllegalArgumentException("program.decl must not be null");
        DetectionResult d = detection == null ? DetectionResult.empty() : detection;
        EmitterOptions opts = options == null ? EmitterOptions.defaults() : options;
        EmitterWarnings w = warnings == null ? new EmitterWarnings() : warnings;

        BabelContext ctx = new BabelContext(program.decl, w);
        EmitBuffer out = ctx.newBuffer();
        if (opts.includeHeader) {
            out.lines(BabelSupport.HEADER);
            out.blankLine();
        }
        emitSupport(out, d, opts);
        emitUserImports(out, program.uses);
        program.decl.accept(new UnitEmitter(ctx, out));
        log.debug("Generated Babel output for '{}' ({} chars)", program.name(), out.toString().length());
        return out.toString();
    }

    private static void emitSupport(EmitBuffer out, DetectionResult d, EmitterOptions opts) {
        Set<SupportMarker> markers = d.markers(Backend.BABEL);
        List<String> blocks = new ArrayList<>();
        if (markers.contains(SupportMarker.FS)) blocks.add(BabelSupport.REQUIRE_FS);
        if (markers.contains(SupportMarker.PATH)) blocks.add(BabelSupport.REQUIRE_PATH);
        if (markers.contains(SupportMarker.CODEGEN)) blocks.add(BabelSupport.REQUIRE_GENERATOR);
        if (markers.contains(SupportMarker.JSON)) blocks.add(BabelSupport.JSON_HELPER);
        if (markers.contains(SupportMarker.PARSER)) blocks.add(BabelSupport.PARSER_HELPER);
        if (markers.contains(SupportMarker.MACRO_SHIMS) && opts.includeMacroShims) {
            blocks.add(BabelSupport.MACRO_PRELUDE);
        }
        if (blocks.isEmpty()) return;
        for (String b : blocks) out.lines(b);
        out.blankLine();
    }

    private static void emitUserImports(EmitBuffer out, List<IrUse> uses) {
        List<IrUse> modules = uses.stream().filter(IrUse::isFileModule).collect(Collectors.toList());
        if (modules.isEmpty()) return;
        out.line("// Module imports");
        for (IrUse use : modules) {
            String require = "require('" + jsPath(use.path) + "')";
            if (use.alias != null) {
                out.line("const " + use.alias + " = " + require + ";");
                if (!use.imports.isEmpty()) {
                    out.line("const { " + String.join(", ", use.imports) + " } = " + use.alias + ";");
                }
            } else if (!use.imports.isEmpty()) {
                out.line("const { " + String.join(", ", use.imports) + " } = " + require + ";");
            } else {
                out.line("const " + use.moduleName() + " = " + require + ";");
            }
        }
        out.blankLine();
    }

    static String jsPath(String path) {
        if (path.endsWith(".lux") || path.endsWith(".rsc")) {
            return path.substring(0, path.length() - 4) + ".js";
        }
        return path.endsWith(".js") ? path : path + ".js";
    }

    private static final class UnitEmitter implements IrTopLevel.Visitor<Void> {
        private final BabelContext ctx;
        private final EmitBuffer out;
        private final BabelStructureCodegen structures;
        private final BabelVisitorCodegen visitors;

        UnitEmitter(BabelContext ctx, EmitBuffer out) {
            this.ctx = ctx;
            this.out = out;
            this.structures = new BabelStructureCodegen(ctx);
            this.visitors = new BabelVisitorCodegen(ctx);
        }

        @Override
        public Void visitPlugin(IrTopLevel.Plugin unit) {
            emitPluginShape(unit);
            return null;
        }

        @Override
        public Void visitWriter(IrTopLevel.Writer unit) {
            emitPluginShape(unit);
            return null;
        }

        @Override
        public Void visitModule(IrTopLevel.Module unit) {
            Map<String, List<IrItem.Function>> impls = implsByTarget(unit);
            List<String> exported = new ArrayList<>();
            for (IrItem item : unit.items()) {
                if (item instanceof IrItem.Function && ((IrItem.Function) item).pub) exported.add(item.name());
                if (item instanceof IrItem.Struct || item instanceof IrItem.Enum) exported.add(item.name());
                emitDeclaration(item, impls, true);
            }
            out.line("module.exports = {");
            out.indented(() -> exported.forEach(n -> out.line(n + ",")));
            out.line("};");
            return null;
        }

        private void emitPluginShape(IrTopLevel unit) {
            Map<String, List<IrItem.Function>> impls = implsByTarget(unit);
            VisitorBindingTable.Partition parts = VisitorBindingTable.partition(
                    unit.itemsOf(IrItem.Function.class), true, ctx.warnings);
            Set<IrItem.Function> bound = parts.visitors.stream().map(b -> b.method).collect(Collectors.toSet());

            IrItem.Function pre = null;
            IrItem.Function exit = null;
            for (IrItem.Hook h : unit.itemsOf(IrItem.Hook.class)) {
                if (h.phase == IrItem.Hook.Phase.PRE && pre == null) pre = h.function;
                if (h.phase == IrItem.Hook.Phase.EXIT && exit == null) exit = h.function;
            }
            if (ctx.writer) {
                for (IrItem.Function f : parts.helpers) {
                    if (pre == null && "init".equals(f.name)) pre = f;
                    if (exit == null && "finish".equals(f.name)) exit = f;
                }
            }
            IrItem.Function preHook = pre;
            IrItem.Function exitHook = exit;

            out.line("module.exports = function({ types: t }) {");
            out.indented(() -> {
                if (ctx.writer) {
                    out.lines(BabelSupport.BUILDER);
                    out.blankLine();
                }
                for (IrItem item : unit.items()) {
                    if (item instanceof IrItem.Function) {
                        IrItem.Function f = (IrItem.Function) item;
                        if (bound.contains(f)) continue;
                        if (f == preHook || f == exitHook) {
                            emitHook(f, f == preHook);
                            continue;
                        }
                    }
                    if (item instanceof IrItem.Hook) {
                        IrItem.Hook h = (IrItem.Hook) item;
                        if (h.function != null && (h.function == preHook || h.function == exitHook)) {
                            emitHook(h.function, h.function == preHook);
                        }
                        continue;
                    }
                    emitDeclaration(item, impls, false);
                }
                out.line("return {");
                out.indented(() -> {
                    emitPre(unit, preHook);
                    visitors.emitVisitorObject(out, parts.visitors, exitHook);
                });
                out.line("};");
            });
            out.line("};");
        }

        private void emitHook(IrItem.Function f, boolean pre) {
            located(f.source, () -> {
                out.line(pre ? "// Pre-transformation hook" : "// Exit hook");
                ctx.stmts.emitFunction(out, "function " + f.name, f, null);
                out.newline();
                out.blankLine();
            });
        }

        private void emitPre(IrTopLevel unit, IrItem.Function preHook) {
            IrItem.Struct state = unit.stateStruct();
            if (state == null && preHook == null && !ctx.writer) return;
            out.line("pre(file) {");
            out.indented(() -> {
                if (state != null) {
                    if (state.fields.isEmpty()) {
                        out.line("this.state = {};");
                    } else {
                        out.line("this.state = {");
                        out.indented(() -> {
                            for (IrField f : state.fields) {
                                String init = f.type == null ? "undefined" : ctx.types.defaultValue(f.type);
                                out.line(f.name + ": " + init + ",");
                            }
                        });
                        out.line("};");
                    }
                }
                if (ctx.writer) {
                    out.line("builder._output = [];");
                    out.line("builder._indentLevel = 0;");
                }
                if (preHook != null) {
                    out.line(preHook.name + ".call(this" + (preHook.valueParams().isEmpty() ? "" : ", file") + ");");
                }
            });
            out.line("},");
        }

        private void emitDeclaration(IrItem item, Map<String, List<IrItem.Function>> impls, boolean module) {
            if (item instanceof IrItem.Struct) {
                IrItem.Struct s = (IrItem.Struct) item;
                located(s.source, () -> {
                    structures.emitStruct(out, s, impls.getOrDefault(s.name, List.of()));
                    out.blankLine();
                });
            } else if (item instanceof IrItem.Enum) {
                IrItem.Enum e = (IrItem.Enum) item;
                located(e.source, () -> {
                    structures.emitEnum(out, e);
                    out.blankLine();
                });
            } else if (item instanceof IrItem.Function) {
                IrItem.Function f = (IrItem.Function) item;
                located(f.source, () -> {
                    structures.emitFunction(out, f);
                    out.blankLine();
                });
            } else if (item instanceof IrItem.Impl) {
                IrItem.Impl impl = (IrItem.Impl) item;
                if (structNames.contains(impl.target)) return;
                located(impl.source, () -> {
                    for (IrItem.Function m : impl.methods) {
                        structures.emitFunction(out, m);
                        out.blankLine();
                    }
                });
            } else if (item instanceof IrItem.Hook && module) {
                IrItem.Hook h = (IrItem.Hook) item;
                if (h.function != null) emitHook(h.function, h.phase == IrItem.Hook.Phase.PRE);
            }
        }

        private final Set<String> structNames = new HashSet<>();

        private Map<String, List<IrItem.Function>> implsByTarget(IrTopLevel unit) {
            Map<String, List<IrItem.Function>> byTarget = new LinkedHashMap<>();
            for (IrItem.Struct s : unit.itemsOf(IrItem.Struct.class)) structNames.add(s.name);
            for (IrItem.Impl impl : unit.itemsOf(IrItem.Impl.class)) {
                if (!structNames.contains(impl.target)) continue;
                byTarget.computeIfAbsent(impl.target, k -> new ArrayList<>()).addAll(impl.methods);
            }
            return byTarget;
        }

        private static void located(IrSourceRef source, Runnable body) {
            try {
                body.run();
            } catch (CodegenException e) {
                throw e.at(source);
            }
        }
    }
}
