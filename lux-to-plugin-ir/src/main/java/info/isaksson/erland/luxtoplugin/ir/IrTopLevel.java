package info.isaksson.erland.luxtoplugin.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level unit of a compilation unit.
 *
 * <ul>
 *   <li>Plugin: a transform plugin (mutating visitor)</li>
 *   <li>Writer: a read-only visitor that builds text output</li>
 *   <li>Module: a helper module imported by plugins</li>
 * </ul>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IrTopLevel.Plugin.class, name = "Plugin"),
        @JsonSubTypes.Type(value = IrTopLevel.Writer.class, name = "Writer"),
        @JsonSubTypes.Type(value = IrTopLevel.Module.class, name = "Module")
})
public sealed interface IrTopLevel {

    String name();

    List<IrItem> items();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitPlugin(Plugin unit);
        R visitWriter(Writer unit);
        R visitModule(Module unit);
    }

    /** Items of the given type, in declaration order. */
    default <T extends IrItem> List<T> itemsOf(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (IrItem item : items()) {
            if (type.isInstance(item)) out.add(type.cast(item));
        }
        return out;
    }

    /** The struct named {@code State}, if declared. */
    default IrItem.Struct stateStruct() {
        for (IrItem.Struct s : itemsOf(IrItem.Struct.class)) {
            if ("State".equals(s.name)) return s;
        }
        return null;
    }

    @JsonPropertyOrder({"name","items"})
    final class Plugin implements IrTopLevel {
        public final String name;
        public final List<IrItem> items;

        @JsonCreator
        public Plugin(
                @JsonProperty("name") String name,
                @JsonProperty("items") List<IrItem> items
        ) {
            this.name = name;
            this.items = items == null ? List.of() : List.copyOf(items);
        }

        @Override public String name() { return name; }
        @Override public List<IrItem> items() { return items; }
        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitPlugin(this); }
    }

    @JsonPropertyOrder({"name","items"})
    final class Writer implements IrTopLevel {
        public final String name;
        public final List<IrItem> items;

        @JsonCreator
        public Writer(
                @JsonProperty("name") String name,
                @JsonProperty("items") List<IrItem> items
        ) {
            this.name = name;
            this.items = items == null ? List.of() : List.copyOf(items);
        }

        @Override public String name() { return name; }
        @Override public List<IrItem> items() { return items; }
        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitWriter(this); }
    }

    @JsonPropertyOrder({"name","items"})
    final class Module implements IrTopLevel {
        public final String name;
        public final List<IrItem> items;

        @JsonCreator
        public Module(
                @JsonProperty("name") String name,
                @JsonProperty("items") List<IrItem> items
        ) {
            this.name = name;
            this.items = items == null ? List.of() : List.copyOf(items);
        }

        @Override public String name() { return name; }
        @Override public List<IrItem> items() { return items; }
        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitModule(this); }
    }
}
