package minipy;

import java.util.List;
import java.util.Objects;

/**
 * Runs the front end over a source text: scanning, parsing, then semantic analysis.
 *
 * <p>Semantic analysis only runs on a tree that parsed without errors. Every call builds its own
 * scanner, parser and analyzer, so one instance can serve concurrent callers.
 */
public final class Compiler {

    public CompileResult compile(String source) {
        Objects.requireNonNull(source, "source");

        ParseResult parsed = Parser.parse(source);
        Program program = parsed.program().orElse(null);
        if (parsed.hasErrors() || program == null) {
            return new CompileResult(program, parsed.errors(), List.of());
        }

        List<String> semanticErrors = new SemanticAnalyzer().analyze(program);
        return new CompileResult(program, parsed.errors(), semanticErrors);
    }
}
