package info.isaksson.erland.luxtoplugin.ir;

/**
 * Closed set of DSL type descriptor shapes.
 */
public enum IrTypeRefKind {
    /** Str, Number, Bool, i32, f64, char, ... */
    PRIMITIVE,
    /** AST node types and user declared structs/enums. */
    NAMED,
    /** Standard collection of T: Vec, HashMap, HashSet, Option, Result, Box. */
    CONTAINER,
    ARRAY,
    OPTIONAL,
    REFERENCE,
    TUPLE,
    UNIT
}
