package info.isaksson.erland.luxtoplugin.emitter;

/**
 * Text sink with an indentation level, shared by all codegen components of one backend.
 *
 * <p>{@link #line(String)} writes a full indented line; {@link #append(String)} continues the
 * current line and only indents when the line is still empty. Nested scopes go through
 * {@link #indented(Runnable)} or a matching {@link #pushIndent()}/{@link #popIndent()} pair.</p>
 */
public final class EmitBuffer {

    private final StringBuilder out = new StringBuilder();
    private final String indentUnit;
    private int depth;
    private boolean atLineStart = true;

    public EmitBuffer(String indentUnit) {
        if (indentUnit == null) throw new IllegalArgumentException("indentUnit must not be null");
        this.indentUnit = indentUnit;
    }

    public static EmitBuffer forBackend(Backend backend) {
        return new EmitBuffer(backend.indentUnit);
    }

    public int depth() {
        return depth;
    }

    public EmitBuffer pushIndent() {
        depth++;
        return this;
    }

    public EmitBuffer popIndent() {
        if (depth == 0) {
            throw new IllegalStateException("Indentation popped below zero");
        }
        depth--;
        return this;
    }

    public EmitBuffer append(String text) {
        if (text == null || text.isEmpty()) return this;
        if (atLineStart) {
            writeIndent();
            atLineStart = false;
        }
        out.append(text);
        return this;
    }

    public EmitBuffer newline() {
        out.append('\n');
        atLineStart = true;
        return this;
    }

    public EmitBuffer line(String text) {
        return append(text).newline();
    }

    /** An empty line; never carries trailing indentation. */
    public EmitBuffer blankLine() {
        if (!atLineStart) newline();
        out.append('\n');
        return this;
    }

    /**
     * Writes a possibly multi-line block, re-indenting each line at the current depth.
     * Blank lines stay empty.
     */
    public EmitBuffer lines(String block) {
        if (block == null) return this;
        String[] parts = block.split("\n", -1);
        int n = parts.length;
        if (n > 0 && parts[n - 1].isEmpty()) n--;
        for (int i = 0; i < n; i++) {
            if (parts[i].isBlank()) blankLine();
            else line(parts[i]);
        }
        return this;
    }

    public EmitBuffer indented(Runnable body) {
        pushIndent();
        try {
            body.run();
        } finally {
            popIndent();
        }
        return this;
    }

    public boolean isEmpty() {
        return out.length() == 0;
    }

    @Override
    public String toString() {
        return out.toString();
    }

    private void writeIndent() {
        for (int i = 0; i < depth; i++) {
            out.append(indentUnit);
        }
    }
}
