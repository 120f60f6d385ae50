package info.isaksson.erland.luxtoplugin.emitter.babel;

import info.isaksson.erland.luxtoplugin.emitter.EmitBuffer;
import info.isaksson.erland.luxtoplugin.ir.IrField;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrVariant;

import java.util.ArrayList;
import java.util.List;

/** Structs as classes, enums as frozen constructor tables, free functions. */
final class BabelStructureCodegen {

    private final BabelContext ctx;

    BabelStructureCodegen(BabelContext ctx) {
        this.ctx = ctx;
    }

    void emitStruct(EmitBuffer out, IrItem.Struct s, List<IrItem.Function> methods) {
        if (!s.fields.isEmpty()) {
            out.line("/**");
            for (IrField f : s.fields) {
                String type = f.type == null ? "*" : ctx.types.mapType(f.type);
                out.line(" * @property {" + type + "} " + f.name);
            }
            out.line(" */");
        }
        out.line("class " + s.name + " {");
        ctx.currentClass = s.name;
        try {
            out.indented(() -> emitClassBody(out, s, methods));
        } finally {
            ctx.currentClass = null;
        }
        out.line("}");
    }

    private void emitClassBody(EmitBuffer out, IrItem.Struct s, List<IrItem.Function> methods) {
        List<String> names = new ArrayList<>();
        for (IrField f : s.fields) names.add(f.name);
        out.line("constructor(" + String.join(", ", names) + ") {");
        out.indented(() -> {
            for (String n : names) out.line("this." + n + " = " + n + ";");
        });
        out.line("}");
        for (IrItem.Function m : methods) {
            out.blankLine();
            String head = m.params.isEmpty() || !m.params.get(0).isSelf() ? "static " + m.name : m.name;
            ctx.stmts.emitFunction(out, head, m, null);
            out.newline();
        }
    }

    void emitEnum(EmitBuffer out, IrItem.Enum e) {
        out.line("const " + e.name + " = Object.freeze({");
        out.indented(() -> {
            for (IrVariant v : e.variants) {
                String tag = BabelExprCodegen.quote(v.name);
                switch (v.shape) {
                    case UNIT:
                        out.line(v.name + ": Object.freeze({ type: " + tag + " }),");
                        break;
                    case TUPLE:
                        if (v.types.size() == 1) {
                            out.line(v.name + ": (value) => ({ type: " + tag + ", value }),");
                        } else {
                            out.line(v.name + ": (...value) => ({ type: " + tag + ", value }),");
                        }
                        break;
                    default:
                        List<String> names = new ArrayList<>();
                        for (IrField f : v.fields) names.add(f.name);
                        String list = String.join(", ", names);
                        out.line(v.name + ": (" + list + ") => ({ type: " + tag
                                + (names.isEmpty() ? "" : ", " + list) + " }),");
                        break;
                }
            }
        });
        out.line("});");
    }

    void emitFunction(EmitBuffer out, IrItem.Function f) {
        ctx.stmts.emitFunction(out, "function " + f.name, f, null);
        out.newline();
    }
}
