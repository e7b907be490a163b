package minipy;

import java.util.List;

/** Root of the syntax tree: the top-level statements in source order. */
public final class Program {
    final List<Stmt> statements;

    Program(List<Stmt> statements) {
        this.statements = List.copyOf(statements);
    }

    @Override
    public String toString() {
        return new AstPrinter().print(this);
    }
}
