package info.isaksson.erland.luxtoplugin.emitter;

import info.isaksson.erland.luxtoplugin.ir.IrSourceRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A non-fatal warning raised while one backend generates its output. Generation continues;
 * the warning is reported next to the backend's source.
 */
public final class EmitterWarning {

    /** A visitor-named method with no binding table entry; it is emitted as a plain function. */
    public static final String MISSING_VISITOR_BINDING = "MissingVisitorBinding";

    public final String code;
    public final String message;

    /** Structured context such as {@code method}; never null. */
    public final Map<String, String> context;

    /** Enclosing item, when the IR carries a location. */
    public final IrSourceRef location;

    public EmitterWarning(String code, String message, Map<String, String> context, IrSourceRef location) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.context = context == null || context.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.location = location;
    }

    public static EmitterWarning missingVisitorBinding(String method, IrSourceRef location) {
        return new EmitterWarning(MISSING_VISITOR_BINDING,
                "No node kind bound to visitor method '" + method + "'; emitted as a plain function",
                Map.of("method", method), location);
    }

    @Override
    public String toString() {
        String s = "warning[" + code + "]: " + message;
        return location == null ? s : s + " at " + location.line + ":" + location.column;
    }
}
