package info.isaksson.erland.luxtoplugin.ir;

public enum IrUnaryOp {
    NEG("-"),
    NOT("!"),
    DEREF("*"),
    REF("&"),
    REF_MUT("&mut ");

    public final String symbol;

    IrUnaryOp(String symbol) {
        this.symbol = symbol;
    }
}
