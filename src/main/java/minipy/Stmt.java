package minipy;

import java.util.List;

abstract class Stmt {
    interface Visitor<R> {
        R visitAssignmentStmt(Assignment stmt);
        R visitPrintStmt(Print stmt);
        R visitIfStmt(If stmt);
    }

    // Closed: every kind of statement is declared here.
    private Stmt() {}

    abstract <R> R accept(Visitor<R> visitor);

    static final class Assignment extends Stmt {
        final String name;
        final Expr expr;

        Assignment(String name, Expr expr) {
            this.name = name;
            this.expr = expr;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
          return visitor.visitAssignmentStmt(this);
        }
    }

    static final class Print extends Stmt {
        final Expr expr;

        Print(Expr expr) {
            this.expr = expr;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
          return visitor.visitPrintStmt(this);
        }
    }

    static final class If extends Stmt {
        final Expr condition;
        final List<Stmt> body;
        final List<Stmt> orelse; // null when there is no else branch.

        If(Expr condition, List<Stmt> body, List<Stmt> orelse) {
            this.condition = condition;
            this.body = List.copyOf(body);
            this.orelse = orelse == null ? null : List.copyOf(orelse);
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
          return visitor.visitIfStmt(this);
        }
    }
}
