package info.isaksson.erland.luxtoplugin.ir;

/**
 * Depth-first walk over a whole program: items, statements, expressions, patterns and type
 * descriptors, including nested ones.
 *
 * <p>Subclasses override the {@code on*} callbacks; the traversal itself is fixed so every
 * node is reached regardless of how deeply it is nested.</p>
 */
public class IrScanner implements IrItem.Visitor<Void>, IrStmt.Visitor<Void>, IrExpr.Visitor<Void>, IrPattern.Visitor<Void> {

    protected void onUse(IrUse use) {}
    protected void onItem(IrItem item) {}
    protected void onStmt(IrStmt stmt) {}
    protected void onExpr(IrExpr expr) {}
    protected void onPattern(IrPattern pattern) {}
    protected void onType(IrTypeRef type) {}

    public final void scanProgram(IrProgram program) {
        if (program == null) return;
        for (IrUse u : program.uses) {
            onUse(u);
        }
        if (program.decl != null) {
            for (IrItem item : program.decl.items()) {
                scanItem(item);
            }
        }
    }

    public final void scanItem(IrItem item) {
        if (item == null) return;
        onItem(item);
        item.accept(this);
    }

    public final void scanStmts(Iterable<IrStmt> stmts) {
        for (IrStmt s : stmts) {
            scanStmt(s);
        }
    }

    public final void scanStmt(IrStmt stmt) {
        if (stmt == null) return;
        onStmt(stmt);
        stmt.accept(this);
    }

    public final void scanExpr(IrExpr expr) {
        if (expr == null) return;
        onExpr(expr);
        expr.accept(this);
    }

    public final void scanPattern(IrPattern pattern) {
        if (pattern == null) return;
        onPattern(pattern);
        pattern.accept(this);
    }

    public final void scanType(IrTypeRef type) {
        if (type == null) return;
        onType(type);
        for (IrTypeRef arg : type.typeArgs) {
            scanType(arg);
        }
        scanType(type.elementType);
    }

    private void scanExprs(Iterable<IrExpr> exprs) {
        for (IrExpr e : exprs) {
            scanExpr(e);
        }
    }

    private void scanArms(Iterable<IrMatchArm> arms) {
        for (IrMatchArm arm : arms) {
            scanPattern(arm.pattern);
            scanExpr(arm.guard);
            scanStmts(arm.body);
        }
    }

    // items

    @Override public Void visitStruct(IrItem.Struct item) {
        for (IrField f : item.fields) scanType(f.type);
        return null;
    }

    @Override public Void visitEnum(IrItem.Enum item) {
        for (IrVariant v : item.variants) {
            for (IrTypeRef t : v.types) scanType(t);
            for (IrField f : v.fields) scanType(f.type);
        }
        return null;
    }

    @Override public Void visitFunction(IrItem.Function item) {
        for (IrParameter p : item.params) scanType(p.type);
        scanType(item.returnType);
        scanStmts(item.body);
        return null;
    }

    @Override public Void visitImpl(IrItem.Impl item) {
        for (IrItem.Function m : item.methods) scanItem(m);
        return null;
    }

    @Override public Void visitHook(IrItem.Hook item) {
        scanItem(item.function);
        return null;
    }

    // statements

    @Override public Void visitBlock(IrStmt.Block s) {
        scanStmts(s.stmts);
        return null;
    }

    @Override public Void visitLet(IrStmt.Let s) {
        scanPattern(s.pattern);
        scanType(s.type);
        scanExpr(s.init);
        return null;
    }

    @Override public Void visitConst(IrStmt.Const s) {
        scanType(s.type);
        scanExpr(s.init);
        return null;
    }

    @Override public Void visitExpr(IrStmt.ExprStmt s) {
        scanExpr(s.expr);
        return null;
    }

    @Override public Void visitIf(IrStmt.If s) {
        scanPattern(s.pattern);
        scanExpr(s.condition);
        scanStmts(s.thenBranch);
        scanStmts(s.elseBranch);
        return null;
    }

    @Override public Void visitMatch(IrStmt.Match s) {
        scanExpr(s.scrutinee);
        scanArms(s.arms);
        return null;
    }

    @Override public Void visitFor(IrStmt.For s) {
        scanPattern(s.pattern);
        scanExpr(s.iterable);
        scanStmts(s.body);
        return null;
    }

    @Override public Void visitWhile(IrStmt.While s) {
        scanExpr(s.condition);
        scanStmts(s.body);
        return null;
    }

    @Override public Void visitLoop(IrStmt.Loop s) {
        scanStmts(s.body);
        return null;
    }

    @Override public Void visitReturn(IrStmt.Return s) {
        scanExpr(s.value);
        return null;
    }

    @Override public Void visitBreak(IrStmt.Break s) {
        return null;
    }

    @Override public Void visitContinue(IrStmt.Continue s) {
        return null;
    }

    @Override public Void visitTraverse(IrStmt.Traverse s) {
        scanExpr(s.target);
        for (IrStmt.Let let : s.state) scanStmt(let);
        for (IrItem.Function m : s.methods) scanItem(m);
        return null;
    }

    @Override public Void visitVerbatim(IrStmt.Verbatim s) {
        return null;
    }

    // expressions

    @Override public Void visitLiteral(IrExpr.Literal e) {
        return null;
    }

    @Override public Void visitIdent(IrExpr.Ident e) {
        return null;
    }

    @Override public Void visitCall(IrExpr.Call e) {
        scanExpr(e.callee);
        scanExprs(e.args);
        return null;
    }

    @Override public Void visitMacroCall(IrExpr.MacroCall e) {
        scanExprs(e.args);
        return null;
    }

    @Override public Void visitMember(IrExpr.Member e) {
        scanExpr(e.object);
        return null;
    }

    @Override public Void visitIndex(IrExpr.Index e) {
        scanExpr(e.object);
        scanExpr(e.index);
        return null;
    }

    @Override public Void visitBinary(IrExpr.Binary e) {
        scanExpr(e.left);
        scanExpr(e.right);
        return null;
    }

    @Override public Void visitUnary(IrExpr.Unary e) {
        scanExpr(e.operand);
        return null;
    }

    @Override public Void visitAssign(IrExpr.Assign e) {
        scanExpr(e.target);
        scanExpr(e.value);
        return null;
    }

    @Override public Void visitCompoundAssign(IrExpr.CompoundAssign e) {
        scanExpr(e.target);
        scanExpr(e.value);
        return null;
    }

    @Override public Void visitMatch(IrExpr.Match e) {
        scanExpr(e.scrutinee);
        scanArms(e.arms);
        return null;
    }

    @Override public Void visitIf(IrExpr.If e) {
        scanExpr(e.condition);
        scanStmts(e.thenBranch);
        scanStmts(e.elseBranch);
        return null;
    }

    @Override public Void visitBlock(IrExpr.Block e) {
        scanStmts(e.stmts);
        return null;
    }

    @Override public Void visitStructInit(IrExpr.StructInit e) {
        for (IrFieldInit f : e.fields) scanExpr(f.value);
        return null;
    }

    @Override public Void visitVecInit(IrExpr.VecInit e) {
        scanExprs(e.elements);
        return null;
    }

    @Override public Void visitTuple(IrExpr.Tuple e) {
        scanExprs(e.elements);
        return null;
    }

    @Override public Void visitClosure(IrExpr.Closure e) {
        scanExpr(e.body);
        return null;
    }

    @Override public Void visitRange(IrExpr.Range e) {
        scanExpr(e.start);
        scanExpr(e.end);
        return null;
    }

    @Override public Void visitParen(IrExpr.Paren e) {
        scanExpr(e.inner);
        return null;
    }

    @Override public Void visitTry(IrExpr.Try e) {
        scanExpr(e.inner);
        return null;
    }

    // patterns

    @Override public Void visitLiteral(IrPattern.Literal p) {
        return null;
    }

    @Override public Void visitIdent(IrPattern.Ident p) {
        return null;
    }

    @Override public Void visitWildcard(IrPattern.Wildcard p) {
        return null;
    }

    @Override public Void visitTuple(IrPattern.Tuple p) {
        for (IrPattern e : p.elements) scanPattern(e);
        return null;
    }

    @Override public Void visitStruct(IrPattern.Struct p) {
        for (IrFieldPattern f : p.fields) scanPattern(f.pattern);
        return null;
    }

    @Override public Void visitVariant(IrPattern.Variant p) {
        scanPattern(p.inner);
        return null;
    }

    @Override public Void visitArray(IrPattern.Array p) {
        for (IrPattern e : p.elements) scanPattern(e);
        return null;
    }

    @Override public Void visitObject(IrPattern.ObjectPattern p) {
        for (IrObjectProp prop : p.props) scanPattern(prop.value);
        return null;
    }

    @Override public Void visitRest(IrPattern.Rest p) {
        scanPattern(p.inner);
        return null;
    }

    @Override public Void visitOr(IrPattern.Or p) {
        for (IrPattern alt : p.alternatives) scanPattern(alt);
        return null;
    }

    @Override public Void visitRef(IrPattern.Ref p) {
        scanPattern(p.inner);
        return null;
    }
}
