package minipy;

import java.util.List;

/** Renders a syntax tree as an s-expression, e.g. {@code (program (= x (+ 1 2)) (print x))}. */
class AstPrinter implements Stmt.Visitor<String>, Expr.Visitor<String> {
   String print(Program program) {
       StringBuilder sb = new StringBuilder("(program");
       for (Stmt s : program.statements) sb.append(' ').append(s.accept(this));
       return sb.append(')').toString();
   }

   String print(Expr expr) {
       return expr.accept(this);
   }

   @Override
   public String visitAssignmentStmt(Stmt.Assignment stmt) {
       return String.format("(= %s %s)", stmt.name, stmt.expr.accept(this));
   }

   @Override
   public String visitPrintStmt(Stmt.Print stmt) {
       return String.format("(print %s)", stmt.expr.accept(this));
   }

   @Override
   public String visitIfStmt(Stmt.If stmt) {
       String s = String.format("(if %s %s", stmt.condition.accept(this), block("then", stmt.body));
       if (stmt.orelse != null) s += " " + block("else", stmt.orelse);
       return s + ")";
   }

   @Override
   public String visitBinOpExpr(Expr.BinOp expr) {
       return String.format("(%s %s %s)", expr.op, expr.left.accept(this), expr.right.accept(this));
   }

   @Override
   public String visitNumberLiteralExpr(Expr.NumberLiteral expr) {
       return Long.toString(expr.value);
   }

   @Override
   public String visitStringLiteralExpr(Expr.StringLiteral expr) {
       return '"' + expr.value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
   }

   @Override
   public String visitNameExpr(Expr.Name expr) {
       return expr.id;
   }

   private String block(String label, List<Stmt> stmts) {
       StringBuilder sb = new StringBuilder("(").append(label);
       for (Stmt s : stmts) sb.append(' ').append(s.accept(this));
       return sb.append(')').toString();
   }
}
