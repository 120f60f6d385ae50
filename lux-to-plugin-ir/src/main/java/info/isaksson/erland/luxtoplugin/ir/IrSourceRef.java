package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Position of an IR element in the DSL source the front end parsed. */
@JsonPropertyOrder({"file","line","column"})
public final class IrSourceRef {
    public final String file;
    public final int line;
    public final int column;

    @JsonCreator
    public IrSourceRef(
            @JsonProperty("file") String file,
            @JsonProperty("line") int line,
            @JsonProperty("column") int column
    ) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public static IrSourceRef at(int line, int column) {
        return new IrSourceRef(null, line, column);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrSourceRef)) return false;
        IrSourceRef that = (IrSourceRef) o;
        return line == that.line && column == that.column && Objects.equals(file, that.file);
    }

    @Override public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override public String toString() {
        return line + ":" + column;
    }
}
