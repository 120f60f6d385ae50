package info.isaksson.erland.luxtoplugin.emitter.swc;

import info.isaksson.erland.luxtoplugin.emitter.EmitBuffer;
import info.isaksson.erland.luxtoplugin.ir.IrField;
import info.isaksson.erland.luxtoplugin.ir.IrItem;
import info.isaksson.erland.luxtoplugin.ir.IrTypeRef;
import info.isaksson.erland.luxtoplugin.ir.IrVariant;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** User structs, enums and impl blocks as Rust items. */
final class SwcStructureCodegen {

    private final SwcContext ctx;
    private final boolean serde;

    SwcStructureCodegen(SwcContext ctx, boolean serde) {
        this.ctx = ctx;
        this.serde = serde;
    }

    private String derives(List<String> extra) {
        Set<String> all = new LinkedHashSet<>(List.of("Debug", "Clone"));
        if (serde) {
            all.add("Serialize");
            all.add("Deserialize");
        }
        all.addAll(extra);
        return "#[derive(" + String.join(", ", all) + ")]";
    }

    void emitStruct(EmitBuffer out, IrItem.Struct s) {
        out.line(derives(s.derives));
        if (s.fields.isEmpty()) {
            out.line("pub struct " + s.name + " {}");
            return;
        }
        out.line("pub struct " + s.name + " {");
        out.indented(() -> {
            for (IrField f : s.fields) out.line("pub " + f.name + ": " + ctx.types.mapType(f.type) + ",");
        });
        out.line("}");
    }

    void emitEnum(EmitBuffer out, IrItem.Enum e) {
        out.line(derives(List.of()));
        out.line("pub enum " + e.name + " {");
        out.indented(() -> {
            for (IrVariant v : e.variants) {
                switch (v.shape) {
                    case TUPLE:
                        List<String> types = new ArrayList<>();
                        for (IrTypeRef t : v.types) types.add(ctx.types.mapType(t));
                        out.line(v.name + "(" + String.join(", ", types) + "),");
                        break;
                    case STRUCT:
                        out.line(v.name + " {");
                        out.indented(() -> {
                            for (IrField f : v.fields) out.line(f.name + ": " + ctx.types.mapType(f.type) + ",");
                        });
                        out.line("},");
                        break;
                    default:
                        out.line(v.name + ",");
                }
            }
        });
        out.line("}");
    }

    void emitImpl(EmitBuffer out, String target, List<IrItem.Function> methods) {
        out.line("impl " + target + " {");
        out.indented(() -> {
            for (int i = 0; i < methods.size(); i++) {
                if (i > 0) out.blankLine();
                IrItem.Function m = methods.get(i);
                ctx.stmts.emitFunction(out, m, m.pub);
            }
        });
        out.line("}");
    }
}
