package info.isaksson.erland.luxtoplugin.emitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Collects warnings during emission of one backend. Identical warnings are kept once.
 *
 * <p>Final output is sorted by (code, message, contextString) so that the order in which
 * codegen visits items never leaks into reports.</p>
 */
public final class EmitterWarnings {

    private final List<EmitterWarning> warnings = new ArrayList<>();

    public void warn(String code, String message, Map<String, String> context) {
        add(new EmitterWarning(code, message, context, null));
    }

    public void add(EmitterWarning w) {
        if (w == null) throw new IllegalArgumentException("warning must not be null");
        if (!contains(w)) {
            warnings.add(w);
        }
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public List<EmitterWarning> toDeterministicList() {
        List<EmitterWarning> out = new ArrayList<>(warnings);
        out.sort(Comparator
                .comparing((EmitterWarning w) -> w.code)
                .thenComparing(w -> w.message)
                .thenComparing(w -> contextString(w.context)));
        return Collections.unmodifiableList(out);
    }

    // a method seen twice (e.g. inline traverse visited from two arms) reports once
    private boolean contains(EmitterWarning w) {
        String ctx = contextString(w.context);
        for (EmitterWarning existing : warnings) {
            if (existing.code.equals(w.code) && existing.message.equals(w.message)
                    && contextString(existing.context).equals(ctx)) {
                return true;
            }
        }
        return false;
    }

    private static String contextString(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        List<String> keys = new ArrayList<>(ctx.keySet());
        keys.sort(String::compareTo);
        StringBuilder sb = new StringBuilder();
        for (String k : keys) {
            sb.append(k).append('=').append(ctx.get(k)).append(';');
        }
        return sb.toString();
    }
}
