package info.isaksson.erland.luxtoplugin.ir;

public enum IrCompoundOp {
    ADD_ASSIGN("+="),
    SUB_ASSIGN("-="),
    MUL_ASSIGN("*="),
    DIV_ASSIGN("/="),
    MOD_ASSIGN("%=");

    public final String symbol;

    IrCompoundOp(String symbol) {
        this.symbol = symbol;
    }
}
