package info.isaksson.erland.luxtoplugin.emitter.types;

import java.util.Set;

/** Names of the DSL's built-in types. */
final class DslTypes {

    static final Set<String> STRINGS = Set.of("Str", "String", "str");
    static final Set<String> INTEGERS = Set.of("Number", "i8", "i16", "i32", "i64", "u8", "u16", "u32", "u64", "usize", "isize");
    static final Set<String> FLOATS = Set.of("f32", "f64");
    static final Set<String> BOOLEANS = Set.of("Bool", "bool");
    static final String CHAR = "char";
    static final String UNIT = "()";
    static final String CODE_BUILDER = "CodeBuilder";

    static final Set<String> CONTAINERS = Set.of("Vec", "HashMap", "HashSet", "Option", "Result", "Box");

    private DslTypes() {}

    static boolean isPrimitive(String name) {
        return STRINGS.contains(name) || INTEGERS.contains(name) || FLOATS.contains(name)
                || BOOLEANS.contains(name) || CHAR.equals(name) || UNIT.equals(name);
    }
}
