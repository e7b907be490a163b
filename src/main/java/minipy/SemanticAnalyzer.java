package minipy;

import java.util.List;

/**
 * Reports names read before any assignment to them.
 *
 * <p>The walk is flow-sensitive: an assignment only counts for statements after it, and
 * assignments made in an {@code if} or {@code else} branch are forgotten once the branch ends,
 * since neither branch is sure to run. Use a fresh analyzer for each program.
 */
class SemanticAnalyzer implements Stmt.Visitor<Void>, Expr.Visitor<Void> {
    private final ErrorReporter errors = new ErrorReporter();
    private SymbolTable scope = new SymbolTable();

    List<String> analyze(Program program) {
        resolve(program.statements);
        return errors.all();
    }

    @Override
    public Void visitAssignmentStmt(Stmt.Assignment stmt) {
        // The right-hand side can't see the name it defines.
        resolve(stmt.expr);
        scope.define(stmt.name);
        return null;
    }

    @Override
    public Void visitPrintStmt(Stmt.Print stmt) {
        resolve(stmt.expr);
        return null;
    }

    @Override
    public Void visitIfStmt(Stmt.If stmt) {
        resolve(stmt.condition);

        SymbolTable enclosing = scope;
        try {
            scope = enclosing.copy();
            resolve(stmt.body);
            if (stmt.orelse != null) {
                scope = enclosing.copy();
                resolve(stmt.orelse);
            }
        } finally {
            scope = enclosing;
        }
        return null;
    }

    @Override
    public Void visitBinOpExpr(Expr.BinOp expr) {
        resolve(expr.left);
        resolve(expr.right);
        return null;
    }

    @Override
    public Void visitNumberLiteralExpr(Expr.NumberLiteral expr) {
        return null;
    }

    @Override
    public Void visitStringLiteralExpr(Expr.StringLiteral expr) {
        return null;
    }

    @Override
    public Void visitNameExpr(Expr.Name expr) {
        if (!scope.isDefined(expr.id)) errors.undefinedVariable(expr.id);
        return null;
    }

    private void resolve(List<Stmt> stmts) {
        for (Stmt s : stmts) {
            resolve(s);
        }
    }

    private void resolve(Stmt s) {
        s.accept(this);
    }

    private void resolve(Expr e) {
        e.accept(this);
    }
}
