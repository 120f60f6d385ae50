package info.isaksson.erland.luxtoplugin.ir;

/** Binary operators of the DSL, with their surface spelling. */
public enum IrBinaryOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    GT(">"),
    LT_EQ("<="),
    GT_EQ(">="),
    AND("&&"),
    OR("||"),
    BIT_AND("&"),
    BIT_OR("|"),
    BIT_XOR("^"),
    SHL("<<"),
    SHR(">>"),
    /** {@code a ?? b}; JavaScript only. */
    NULL_COALESCE("??"),
    /** {@code a ** b}; JavaScript only. */
    POW("**");

    public final String symbol;

    IrBinaryOp(String symbol) {
        this.symbol = symbol;
    }
}
