package info.isaksson.erland.luxtoplugin.emitter.swc;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.PatternLoweringException;
import info.isaksson.erland.luxtoplugin.emitter.binding.NodeKind;
import info.isaksson.erland.luxtoplugin.ir.IrFieldPattern;
import info.isaksson.erland.luxtoplugin.ir.IrPattern;
import info.isaksson.erland.luxtoplugin.ir.IrPatternBindings;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Lowers patterns to Rust pattern syntax. A binder directly under a node-kind variant is
 * recorded in the current scope with that kind, so later field accesses on it use SWC names.
 */
final class SwcPatternLowering {

    private static final Set<String> PRELUDE_VARIANTS = Set.of("Some", "None", "Ok", "Err");

    private final SwcContext ctx;

    SwcPatternLowering(SwcContext ctx) {
        this.ctx = ctx;
    }

    String lower(IrPattern pattern) {
        return lower(pattern, false);
    }

    private String lower(IrPattern pattern, boolean inSequence) {
        if (pattern == null) return "_";
        return pattern.accept(new Lowerer(inSequence));
    }

    private String sequence(List<IrPattern> elements) {
        List<String> parts = new ArrayList<>();
        for (IrPattern el : elements) parts.add(lower(el, true));
        return String.join(", ", parts);
    }

    private final class Lowerer implements IrPattern.Visitor<String> {
        private final boolean inSequence;

        Lowerer(boolean inSequence) {
            this.inSequence = inSequence;
        }

        @Override
        public String visitLiteral(IrPattern.Literal p) {
            return ctx.exprs.literal(p.literal);
        }

        @Override
        public String visitIdent(IrPattern.Ident p) {
            return p.name;
        }

        @Override
        public String visitWildcard(IrPattern.Wildcard p) {
            return "_";
        }

        @Override
        public String visitTuple(IrPattern.Tuple p) {
            if (p.elements.size() == 1) return "(" + lower(p.elements.get(0), true) + ",)";
            return "(" + sequence(p.elements) + ")";
        }

        @Override
        public String visitStruct(IrPattern.Struct p) {
            NodeKind kind = NodeKind.forName(p.name);
            if (kind == null && p.name != null && p.name.contains("::")) {
                String owner = p.name.substring(0, p.name.lastIndexOf("::"));
                if (!ctx.enumNames.contains(owner)) {
                    throw new PatternLoweringException(p.toString(), Backend.SWC, "unknown struct variant " + p.name);
                }
            }
            String name = kind != null ? kind.swcType : p.name;
            List<String> parts = new ArrayList<>();
            for (IrFieldPattern f : p.fields) {
                String field = f.name;
                if (kind != null && kind.swcFieldName(field) != null) field = kind.swcFieldName(field);
                String inner = lower(f.pattern, false);
                parts.add(field.equals(inner) ? field : field + ": " + inner);
            }
            parts.add("..");
            return name + " { " + String.join(", ", parts) + " }";
        }

        @Override
        public String visitVariant(IrPattern.Variant p) {
            String simple = p.name.contains("::") ? p.name.substring(p.name.lastIndexOf("::") + 2) : p.name;
            if (PRELUDE_VARIANTS.contains(simple) && !p.name.contains("::")) {
                return p.inner == null ? simple : simple + "(" + lower(p.inner, false) + ")";
            }
            NodeKind kind = NodeKind.forName(p.name);
            if (kind != null) {
                return nodeVariant(p, kind);
            }
            String owner = p.name.contains("::") ? p.name.substring(0, p.name.lastIndexOf("::")) : null;
            if (owner == null && ctx.variantOwners.containsKey(p.name)) {
                owner = ctx.variantOwners.get(p.name);
            }
            if (owner != null && ctx.enumNames.contains(owner)) {
                String qualified = owner + "::" + simple;
                return p.inner == null ? qualified : qualified + "(" + lower(p.inner, false) + ")";
            }
            if (p.inner != null) lower(p.inner, false);
            throw new PatternLoweringException(p.toString(), Backend.SWC, "unknown variant " + p.name);
        }

        private String nodeVariant(IrPattern.Variant p, NodeKind kind) {
            if (kind.swcEnum == null) {
                throw new PatternLoweringException(p.toString(), Backend.SWC,
                        kind.babelType + " is not wrapped in an SWC enum");
            }
            if (p.inner == null) return kind.swcEnum + "(_)";
            if (p.inner instanceof IrPattern.Array) {
                NodeKind.Field seq = kind.sequenceField();
                if (seq == null || seq.swc().contains(".")) {
                    throw new PatternLoweringException(p.inner.toString(), Backend.SWC,
                            kind.babelType + " has no sequence field to destructure");
                }
                return kind.swcEnum + "(" + kind.swcType + " { " + seq.swc() + ": "
                        + lower(p.inner, false) + ", .. })";
            }
            if (p.inner instanceof IrPattern.Ident) {
                ctx.defineKind(((IrPattern.Ident) p.inner).name, kind);
            }
            return kind.swcEnum + "(" + lower(p.inner, false) + ")";
        }

        @Override
        public String visitArray(IrPattern.Array p) {
            return "[" + sequence(p.elements) + "]";
        }

        @Override
        public String visitObject(IrPattern.ObjectPattern p) {
            throw new PatternLoweringException(p.toString(), Backend.SWC, "object destructuring has no Rust pattern form");
        }

        @Override
        public String visitRest(IrPattern.Rest p) {
            if (!inSequence) {
                throw new PatternLoweringException(p.toString(), Backend.SWC, "rest pattern outside an array or tuple");
            }
            return p.inner == null ? ".." : lower(p.inner, false) + " @ ..";
        }

        @Override
        public String visitOr(IrPattern.Or p) {
            List<String> parts = new ArrayList<>();
            Set<String> names = null;
            for (IrPattern alt : p.alternatives) {
                // every alternative must bind the same names
                Set<String> bound = new HashSet<>(IrPatternBindings.of(alt));
                if (names == null) names = bound;
                else if (!names.equals(bound)) {
                    throw new PatternLoweringException(alt.toString(), Backend.SWC,
                            "or-pattern alternatives bind different names");
                }
                parts.add(lower(alt, false));
            }
            return String.join(" | ", parts);
        }

        @Override
        public String visitRef(IrPattern.Ref p) {
            return (p.mutable ? "&mut " : "&") + lower(p.inner, inSequence);
        }
    }
}
