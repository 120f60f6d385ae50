package info.isaksson.erland.luxtoplugin.emitter.swc;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.BackendGenerator;
import info.isaksson.erland.luxtoplugin.emitter.CodegenException;
import info.isaksson.erland.luxtoplugin.emitter.EmitBuffer;
import info.isaksson.erland.luxtoplugin.emitter.EmitterOptions;
import info.isaksson.erland.luxtoplugin.emitter.EmitterWarnings;
import info.isaksson.erland.luxtoplugin.emitter.binding.VisitorBinding;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SWC backend: emits {@code lib.rs}.
 *
 * <p>Order: header, crate imports, helper items, user module imports, user structs and enums,
 * the unit, then visitor structs hoisted out of inline traversals. A plugin becomes a struct
 * implementing {@code VisitMut}; a writer becomes a struct with a flattened {@code State}
 * and a string builder implementing {@code Visit}.</p>
 */
public final class SwcGenerator implements BackendGenerator {

    private static final Logger log = LoggerFactory.getLogger(SwcGenerator.class);

    @Override
    public Backend backend() {
        return Backend.SWC;
    }

    @Override
    public String generate(IrProgram program, DetectionResult detection, EmitterOptions options, EmitterWarnings warnings) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        if (program.decl == null) throw new IllegalArgumentException("program.decl must not be null");
        DetectionResult d = detection == null ? DetectionResult.empty() : detection;
        EmitterOptions opts = options == null ? EmitterOptions.defaults() : options;
        EmitterWarnings w = warnings == null ? new EmitterWarnings() : warnings;

        String unitName = opts.pluginName != null ? opts.pluginName : program.decl.name();
        SwcContext ctx = new SwcContext(program.decl, unitName, w);
        Set<SupportMarker> markers = d.markers(Backend.SWC);
        EmitBuffer out = ctx.newBuffer();
        if (opts.includeHeader) {
            out.lines(SwcSupport.HEADER);
            out.blankLine();
        }
        if (!(program.decl instanceof IrTopLevel.Module)) {
            SwcSupport.uses(markers).forEach(out::line);
            out.blankLine();
            if (markers.contains(SupportMarker.CODEGEN)) {
                out.lines(SwcSupport.CODEGEN_HELPER);
                out.blankLine();
            }
            if (markers.contains(SupportMarker.PARSER)) {
                out.lines(SwcSupport.PARSER_MODULE);
                out.blankLine();
            }
        } else {
            Set<String> uses = SwcSupport.moduleUses(markers);
            if (!uses.isEmpty()) {
                uses.forEach(out::line);
                out.blankLine();
            }
        }
        emitUserImports(out, program.uses);

        program.decl.accept(new UnitEmitter(ctx, out, unitName, markers.contains(SupportMarker.JSON)));

        for (String hoisted : ctx.hoisted) {
            out.blankLine();
            out.lines(hoisted);
        }
        log.debug("Generated SWC output for '{}' ({} chars, {} hoisted visitors)",
                program.name(), out.toString().length(), ctx.hoisted.size());
        return out.toString();
    }

    private static void emitUserImports(EmitBuffer out, List<IrUse> uses) {
        boolean any = false;
        for (IrUse use : uses) {
            if (!use.isFileModule()) continue;
            any = true;
            String module = use.moduleName();
            out.line("mod " + module + ";");
            if (use.alias != null && !use.alias.equals(module)) {
                out.line("use " + module + " as " + use.alias + ";");
            }
            if (use.imports.size() == 1) {
                out.line("use " + module + "::" + use.imports.get(0) + ";");
            } else if (!use.imports.isEmpty()) {
                out.line("use " + module + "::{" + String.join(", ", use.imports) + "};");
            } else if (use.alias == null) {
                out.line("use " + module + "::*;");
            }
        }
        if (any) out.blankLine();
    }

    private static final class UnitEmitter implements IrTopLevel.Visitor<Void> {
        private final SwcContext ctx;
        private final EmitBuffer out;
        private final String name;
        private final SwcStructureCodegen structures;
        private final SwcVisitorCodegen visitors;

        UnitEmitter(SwcContext ctx, EmitBuffer out, String name, boolean serde) {
            this.ctx = ctx;
            this.out = out;
            this.name = name;
            this.structures = new SwcStructureCodegen(ctx, serde);
            this.visitors = new SwcVisitorCodegen(ctx);
        }

        @Override
        public Void visitPlugin(IrTopLevel.Plugin unit) {
            emitTypes(unit, false);
            IrItem.Struct state = unit.stateStruct();
            VisitorBindingTable.Partition parts = VisitorBindingTable.partition(
                    unit.itemsOf(IrItem.Function.class), true, ctx.warnings);

            if (state != null) {
                out.line("pub struct " + name + " {");
                out.indented(() -> out.line("pub state: State,"));
                out.line("}");
            } else {
                out.line("pub struct " + name + " {");
                out.indented(() -> out.line("// Plugin state"));
                out.line("}");
            }
            out.blankLine();

            out.line("impl " + name + " {");
            out.indented(() -> {
                out.line("pub fn new() -> Self {");
                out.indented(() -> {
                    if (state == null) {
                        out.line("Self {}");
                        return;
                    }
                    out.line("Self {");
                    out.indented(() -> {
                        out.line("state: State {");
                        out.indented(() -> emitFieldDefaults(state.fields));
                        out.line("},");
                    });
                    out.line("}");
                });
                out.line("}");
                for (IrItem.Hook h : unit.itemsOf(IrItem.Hook.class)) {
                    if (h.function == null) continue;
                    located(h.function.source, () -> {
                        out.blankLine();
                        out.line(h.phase == IrItem.Hook.Phase.PRE ? "// Pre hook" : "// Exit hook");
                        ctx.stmts.emitFunction(out, h.function, true);
                    });
                }
                emitHelpers(parts.helpers);
            });
            out.line("}");
            out.blankLine();
            emitDefault();
            out.blankLine();
            emitVisitImpl(parts.visitors);
            return null;
        }

        @Override
        public Void visitWriter(IrTopLevel.Writer unit) {
            emitTypes(unit, true);
            IrItem.Struct state = unit.stateStruct();
            VisitorBindingTable.Partition parts = VisitorBindingTable.partition(
                    unit.itemsOf(IrItem.Function.class), false, ctx.warnings);

            IrItem.Function pre = null;
            IrItem.Function exit = null;
            for (IrItem.Hook h : unit.itemsOf(IrItem.Hook.class)) {
                if (h.phase == IrItem.Hook.Phase.PRE && pre == null) pre = h.function;
                if (h.phase == IrItem.Hook.Phase.EXIT && exit == null) exit = h.function;
            }
            List<IrItem.Function> helpers = new ArrayList<>();
            for (IrItem.Function f : parts.helpers) {
                if (pre == null && "init".equals(f.name)) pre = f;
                else if (exit == null && "finish".equals(f.name)) exit = f;
                else helpers.add(f);
            }
            IrItem.Function exitHook = exit;
            boolean hasPre = pre != null;

            out.line("pub struct " + name + " {");
            out.indented(() -> {
                out.line("output: String,");
                out.line("indent_level: usize,");
                if (state != null) {
                    for (IrField f : state.fields) out.line(f.name + ": " + ctx.types.mapType(f.type) + ",");
                }
            });
            out.line("}");
            out.blankLine();

            out.line("impl " + name + " {");
            out.indented(() -> {
                out.line("pub fn new() -> Self {");
                out.indented(() -> {
                    out.line("Self {");
                    out.indented(() -> {
                        out.line("output: String::new(),");
                        out.line("indent_level: 0,");
                        if (state != null) emitFieldDefaults(state.fields);
                    });
                    out.line("}");
                });
                out.line("}");
                out.blankLine();
                out.lines(SwcSupport.WRITER_METHODS);
                out.blankLine();
                if (exitHook != null) {
                    located(exitHook.source, () -> {
                        out.line("/// Finalize output (from exit hook)");
                        out.line("pub fn finish(mut self) -> String {");
                        ctx.pushScope();
                        try {
                            out.indented(() -> {
                                ctx.stmts.emitBody(out, exitHook.body, false);
                                out.line("self.output");
                            });
                        } finally {
                            ctx.popScope();
                        }
                        out.line("}");
                    });
                } else {
                    out.line("pub fn finish(self) -> String {");
                    out.indented(() -> out.line("self.output"));
                    out.line("}");
                }
                if (hasPre) {
                    out.blankLine();
                    out.line("// Note: pre() hook not supported in SWC (no source access)");
                }
                emitHelpers(helpers);
            });
            out.line("}");
            out.blankLine();
            emitDefault();
            out.blankLine();
            emitVisitImpl(parts.visitors);
            return null;
        }

        @Override
        public Void visitModule(IrTopLevel.Module unit) {
            emitTypes(unit, false);
            boolean first = true;
            for (IrItem.Function f : unit.itemsOf(IrItem.Function.class)) {
                if (!first) out.blankLine();
                first = false;
                located(f.source, () -> ctx.stmts.emitFunction(out, f, f.pub));
            }
            return null;
        }

        /** Structs, enums and impl blocks. A writer's {@code State} is flattened instead. */
        private void emitTypes(IrTopLevel unit, boolean skipState) {
            Map<String, List<IrItem.Function>> impls = new LinkedHashMap<>();
            Map<String, IrSourceRef> implSources = new LinkedHashMap<>();
            for (IrItem.Impl impl : unit.itemsOf(IrItem.Impl.class)) {
                impls.computeIfAbsent(impl.target, k -> new ArrayList<>()).addAll(impl.methods);
                implSources.putIfAbsent(impl.target, impl.source);
            }
            for (IrItem.Struct s : unit.itemsOf(IrItem.Struct.class)) {
                if (skipState && "State".equals(s.name)) continue;
                located(s.source, () -> structures.emitStruct(out, s));
                out.blankLine();
            }
            for (IrItem.Enum e : unit.itemsOf(IrItem.Enum.class)) {
                located(e.source, () -> structures.emitEnum(out, e));
                out.blankLine();
            }
            for (Map.Entry<String, List<IrItem.Function>> e : impls.entrySet()) {
                located(implSources.get(e.getKey()), () -> structures.emitImpl(out, e.getKey(), e.getValue()));
                out.blankLine();
            }
        }

        private void emitFieldDefaults(List<IrField> fields) {
            for (IrField f : fields) {
                out.line(f.name + ": " + ctx.types.defaultValue(f.type) + ",");
            }
        }

        private void emitHelpers(List<IrItem.Function> helpers) {
            for (IrItem.Function f : helpers) {
                located(f.source, () -> {
                    out.blankLine();
                    ctx.stmts.emitFunction(out, f, f.pub);
                });
            }
        }

        private void emitDefault() {
            out.line("impl Default for " + name + " {");
            out.indented(() -> {
                out.line("fn default() -> Self {");
                out.indented(() -> out.line("Self::new()"));
                out.line("}");
            });
            out.line("}");
        }

        private void emitVisitImpl(List<VisitorBinding> bindings) {
            visitors.emitVisitImpl(out, name, bindings);
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
