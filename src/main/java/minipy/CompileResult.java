package minipy;

import java.util.List;
import java.util.Optional;

/** The outcome of compiling one source text. Failures are reported here, never thrown. */
public final class CompileResult {
    private final Program ast;
    private final List<String> syntaxErrors;
    private final List<String> semanticErrors;

    CompileResult(Program ast, List<String> syntaxErrors, List<String> semanticErrors) {
        this.ast = ast;
        this.syntaxErrors = List.copyOf(syntaxErrors);
        this.semanticErrors = List.copyOf(semanticErrors);
    }

    /** The syntax tree, absent when the parse was abandoned. */
    public Optional<Program> ast() {
        return Optional.ofNullable(ast);
    }

    /** Lexical and syntax errors in source order. */
    public List<String> syntaxErrors() {
        return syntaxErrors;
    }

    /** Semantic errors in traversal order; always empty when there are syntax errors. */
    public List<String> semanticErrors() {
        return semanticErrors;
    }

    public boolean hasErrors() {
        return !syntaxErrors.isEmpty() || !semanticErrors.isEmpty();
    }

    @Override
    public String toString() {
        return "CompileResult{syntaxErrors=" + syntaxErrors + ", semanticErrors=" + semanticErrors + "}";
    }
}
