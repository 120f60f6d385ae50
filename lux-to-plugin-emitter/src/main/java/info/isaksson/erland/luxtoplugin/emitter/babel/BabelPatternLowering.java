package info.isaksson.erland.luxtoplugin.emitter.babel;

import info.isaksson.erland.luxtoplugin.emitter.Backend;
import info.isaksson.erland.luxtoplugin.emitter.PatternLoweringException;
import info.isaksson.erland.luxtoplugin.emitter.binding.NodeKind;
import info.isaksson.erland.luxtoplugin.ir.IrFieldPattern;
import info.isaksson.erland.luxtoplugin.ir.IrObjectProp;
import info.isaksson.erland.luxtoplugin.ir.IrPattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers patterns to a JavaScript condition over a subject plus the {@code const} bindings
 * the arm body needs. The subject must be side-effect free; callers pass a temporary.
 */
final class BabelPatternLowering {

    /** Lowered pattern: condition text ({@code true} when irrefutable) and binding statements. */
    static final class Lowered {
        final String condition;
        final List<String> bindings;

        Lowered(String condition, List<String> bindings) {
            this.condition = condition;
            this.bindings = List.copyOf(bindings);
        }

        boolean irrefutable() {
            return "true".equals(condition);
        }
    }

    private final BabelContext ctx;

    BabelPatternLowering(BabelContext ctx) {
        this.ctx = ctx;
    }

    Lowered lower(IrPattern pattern, String subject) {
        List<String> conds = new ArrayList<>();
        List<String> binds = new ArrayList<>();
        lowerInto(pattern, subject, conds, binds);
        return new Lowered(conds.isEmpty() ? "true" : String.join(" && ", conds), binds);
    }

    private void lowerInto(IrPattern pattern, String subject, List<String> conds, List<String> binds) {
        if (pattern != null) pattern.accept(new Lowerer(subject, conds, binds));
    }

    private final class Lowerer implements IrPattern.Visitor<Void> {
        private final String subject;
        private final List<String> conds;
        private final List<String> binds;

        Lowerer(String subject, List<String> conds, List<String> binds) {
            this.subject = subject;
            this.conds = conds;
            this.binds = binds;
        }

        @Override
        public Void visitLiteral(IrPattern.Literal p) {
            conds.add(subject + " === " + ctx.exprs.literal(p.literal));
            return null;
        }

        @Override
        public Void visitIdent(IrPattern.Ident p) {
            if (!"_".equals(p.name) && !p.name.equals(subject)) {
                binds.add("const " + p.name + " = " + subject + ";");
            }
            return null;
        }

        @Override
        public Void visitWildcard(IrPattern.Wildcard p) {
            return null;
        }

        @Override
        public Void visitTuple(IrPattern.Tuple p) {
            elements(p, p.elements, false);
            return null;
        }

        @Override
        public Void visitArray(IrPattern.Array p) {
            if (isSimpleSequence(p.elements) && bindsAnything(p.elements)) {
                conds.add(lengthCheck(p.elements));
                binds.add("const " + destructure(p) + " = " + subject + ";");
                return null;
            }
            elements(p, p.elements, true);
            return null;
        }

        private void elements(IrPattern owner, List<IrPattern> elements, boolean checkLength) {
            int rest = restIndex(owner, elements);
            if (checkLength) conds.add(lengthCheck(elements));
            int after = rest < 0 ? 0 : elements.size() - rest - 1;
            for (int i = 0; i < elements.size(); i++) {
                IrPattern el = elements.get(i);
                if (i == rest) {
                    IrPattern inner = ((IrPattern.Rest) el).inner;
                    if (inner != null) {
                        String slice = after == 0
                                ? subject + ".slice(" + i + ")"
                                : subject + ".slice(" + i + ", " + subject + ".length - " + after + ")";
                        lowerInto(inner, slice, conds, binds);
                    }
                } else if (rest >= 0 && i > rest) {
                    int fromEnd = elements.size() - i;
                    lowerInto(el, subject + "[" + subject + ".length - " + fromEnd + "]", conds, binds);
                } else {
                    lowerInto(el, subject + "[" + i + "]", conds, binds);
                }
            }
        }

        private String lengthCheck(List<IrPattern> elements) {
            long fixed = elements.stream().filter(e -> !(e instanceof IrPattern.Rest)).count();
            boolean hasRest = fixed != elements.size();
            return subject + ".length " + (hasRest ? ">= " : "=== ") + fixed;
        }

        @Override
        public Void visitStruct(IrPattern.Struct p) {
            NodeKind kind = NodeKind.forName(p.name);
            int sep = p.name == null ? -1 : p.name.lastIndexOf("::");
            if (kind != null) {
                conds.add("t." + kind.babelChecker() + "(" + subject + ")");
            } else if (sep >= 0) {
                String owner = p.name.substring(0, sep);
                if (!ctx.enumNames.contains(owner)) {
                    throw new PatternLoweringException(p.toString(), Backend.BABEL, "unknown struct variant " + p.name);
                }
                conds.add(subject + ".type === " + BabelExprCodegen.quote(p.name.substring(sep + 2)));
            }
            for (IrFieldPattern f : p.fields) {
                lowerInto(f.pattern, subject + "." + f.name, conds, binds);
            }
            return null;
        }

        @Override
        public Void visitVariant(IrPattern.Variant p) {
            String simple = simpleName(p.name);
            switch (simple) {
                case "Some":
                    conds.add("(" + subject + " !== null && " + subject + " !== undefined)");
                    lowerInto(p.inner, subject, conds, binds);
                    return null;
                case "None":
                    conds.add("(" + subject + " === null || " + subject + " === undefined)");
                    return null;
                case "Ok":
                    conds.add("(" + subject + " && " + subject + ".ok)");
                    lowerInto(p.inner, subject + ".value", conds, binds);
                    return null;
                case "Err":
                    conds.add("(" + subject + " && !" + subject + ".ok)");
                    lowerInto(p.inner, subject + ".error", conds, binds);
                    return null;
                default:
                    break;
            }
            NodeKind kind = NodeKind.forName(p.name);
            if (kind != null) {
                conds.add("t." + kind.babelChecker() + "(" + subject + ")");
                if (p.inner instanceof IrPattern.Array) {
                    NodeKind.Field seq = kind.sequenceField();
                    if (seq == null) {
                        throw new PatternLoweringException(p.inner.toString(), Backend.BABEL,
                                kind.babelType + " has no sequence field to destructure");
                    }
                    lowerInto(p.inner, subject + "." + seq.babel(), conds, binds);
                } else {
                    lowerInto(p.inner, subject, conds, binds);
                }
                return null;
            }
            if (isUserVariant(p.name)) {
                conds.add(subject + ".type === " + BabelExprCodegen.quote(simple));
                lowerInto(p.inner, subject + ".value", conds, binds);
                return null;
            }
            // inner failures are more precise, so they win
            lowerInto(p.inner, subject + ".value", new ArrayList<>(), new ArrayList<>());
            throw new PatternLoweringException(p.toString(), Backend.BABEL, "unknown variant " + p.name);
        }

        @Override
        public Void visitObject(IrPattern.ObjectPattern p) {
            boolean simple = p.props.stream().allMatch(pr -> pr.shape != IrObjectProp.Shape.KEY_VALUE);
            if (simple) {
                binds.add("const " + destructure(p) + " = " + subject + ";");
                return null;
            }
            List<String> named = new ArrayList<>();
            for (IrObjectProp prop : p.props) {
                switch (prop.shape) {
                    case SHORTHAND:
                        named.add(BabelExprCodegen.quote(prop.key));
                        binds.add("const " + prop.key + " = " + subject + "." + prop.key + ";");
                        break;
                    case KEY_VALUE:
                        named.add(BabelExprCodegen.quote(prop.key));
                        lowerInto(prop.value, subject + "." + prop.key, conds, binds);
                        break;
                    case REST:
                        binds.add("const " + prop.key + " = Object.fromEntries(Object.entries(" + subject
                                + ").filter(([k]) => ![" + String.join(", ", named) + "].includes(k)));");
                        break;
                    default:
                        break;
                }
            }
            return null;
        }

        @Override
        public Void visitRest(IrPattern.Rest p) {
            throw new PatternLoweringException(p.toString(), Backend.BABEL, "rest pattern outside an array or object");
        }

        @Override
        public Void visitOr(IrPattern.Or p) {
            List<String> alternatives = new ArrayList<>();
            for (IrPattern alt : p.alternatives) {
                Lowered l = lower(alt, subject);
                if (!l.bindings.isEmpty()) {
                    throw new PatternLoweringException(alt.toString(), Backend.BABEL,
                            "alternatives of an or-pattern must not bind names");
                }
                if (l.irrefutable()) return null;
                alternatives.add(l.condition);
            }
            conds.add("(" + String.join(" || ", alternatives) + ")");
            return null;
        }

        @Override
        public Void visitRef(IrPattern.Ref p) {
            lowerInto(p.inner, subject, conds, binds);
            return null;
        }
    }

    /**
     * Binding target for {@code const}/{@code let}/{@code for..of}; only irrefutable shapes
     * are accepted.
     */
    String destructure(IrPattern pattern) {
        if (pattern instanceof IrPattern.Ident) return ((IrPattern.Ident) pattern).name;
        if (pattern instanceof IrPattern.Wildcard) return "_";
        if (pattern instanceof IrPattern.Ref) return destructure(((IrPattern.Ref) pattern).inner);
        if (pattern instanceof IrPattern.Tuple || pattern instanceof IrPattern.Array) {
            List<IrPattern> elements = pattern instanceof IrPattern.Tuple
                    ? ((IrPattern.Tuple) pattern).elements
                    : ((IrPattern.Array) pattern).elements;
            int rest = restIndex(pattern, elements);
            if (rest >= 0 && rest != elements.size() - 1) {
                throw new PatternLoweringException(pattern.toString(), Backend.BABEL,
                        "rest element must be last in a binding");
            }
            List<String> parts = new ArrayList<>();
            for (IrPattern el : elements) {
                if (el instanceof IrPattern.Wildcard) {
                    parts.add("");
                } else if (el instanceof IrPattern.Rest) {
                    IrPattern inner = ((IrPattern.Rest) el).inner;
                    if (inner != null) parts.add("..." + destructure(inner));
                } else {
                    parts.add(destructure(el));
                }
            }
            String joined = String.join(", ", parts);
            // a trailing hole needs its comma kept
            if (!parts.isEmpty() && parts.get(parts.size() - 1).isEmpty()) joined += ",";
            return "[" + joined + "]";
        }
        if (pattern instanceof IrPattern.ObjectPattern) {
            List<String> parts = new ArrayList<>();
            for (IrObjectProp prop : ((IrPattern.ObjectPattern) pattern).props) {
                switch (prop.shape) {
                    case SHORTHAND: parts.add(prop.key); break;
                    case KEY_VALUE: parts.add(prop.key + ": " + destructure(prop.value)); break;
                    case REST: parts.add("..." + prop.key); break;
                    default: break;
                }
            }
            return "{ " + String.join(", ", parts) + " }";
        }
        if (pattern instanceof IrPattern.Struct) {
            IrPattern.Struct s = (IrPattern.Struct) pattern;
            if (NodeKind.forName(s.name) == null && s.name != null && s.name.contains("::")) {
                throw new PatternLoweringException(s.toString(), Backend.BABEL, "refutable pattern in a binding");
            }
            List<String> parts = new ArrayList<>();
            for (IrFieldPattern f : s.fields) {
                if (f.pattern instanceof IrPattern.Ident && ((IrPattern.Ident) f.pattern).name.equals(f.name)) {
                    parts.add(f.name);
                } else if (!(f.pattern instanceof IrPattern.Wildcard)) {
                    parts.add(f.name + ": " + destructure(f.pattern));
                }
            }
            return "{ " + String.join(", ", parts) + " }";
        }
        String text = pattern == null ? "<missing>" : pattern.toString();
        throw new PatternLoweringException(text, Backend.BABEL, "refutable pattern in a binding");
    }

    private boolean isUserVariant(String name) {
        int sep = name.lastIndexOf("::");
        if (sep >= 0) return ctx.enumNames.contains(name.substring(0, sep));
        return ctx.variantOwners.containsKey(name);
    }

    private static String simpleName(String name) {
        int sep = name.lastIndexOf("::");
        return sep >= 0 ? name.substring(sep + 2) : name;
    }

    private static int restIndex(IrPattern owner, List<IrPattern> elements) {
        int found = -1;
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) instanceof IrPattern.Rest) {
                if (found >= 0) {
                    throw new PatternLoweringException(owner.toString(), Backend.BABEL, "more than one rest element");
                }
                found = i;
            }
        }
        return found;
    }

    private static boolean isSimpleSequence(List<IrPattern> elements) {
        for (int i = 0; i < elements.size(); i++) {
            IrPattern el = elements.get(i);
            if (el instanceof IrPattern.Ident || el instanceof IrPattern.Wildcard) continue;
            if (el instanceof IrPattern.Rest && i == elements.size() - 1) {
                IrPattern inner = ((IrPattern.Rest) el).inner;
                if (inner == null || inner instanceof IrPattern.Ident) continue;
            }
            return false;
        }
        return true;
    }

    private static boolean bindsAnything(List<IrPattern> elements) {
        for (IrPattern el : elements) {
            if (el instanceof IrPattern.Ident) return true;
            if (el instanceof IrPattern.Rest && ((IrPattern.Rest) el).inner != null) return true;
        }
        return false;
    }
}
