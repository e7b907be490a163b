package minipy;

import java.util.ArrayList;
import java.util.List;

// Collects the diagnostics of one compilation stage, in the order they were found.
final class ErrorReporter {
    private final List<String> errors = new ArrayList<>();

    // whenever a token can't extend the parse
    void syntax(Token at) {
        if (at.type == TokenType.EOF) {
            report("Syntax error at EOF");
            return;
        }
        // A NEWLINE is quoted as the two characters \n, keeping each message on one line.
        String value = at.type == TokenType.NEWLINE ? "\\n" : at.value();
        report("Syntax error at '" + value + "' (line " + at.line + ")");
    }

    void undefinedVariable(String name) {
        report("Undefined variable '" + name + "'");
    }

    void report(String message) {
        errors.add(message);
    }

    int count() {
        return errors.size();
    }

    List<String> all() {
        return List.copyOf(errors);
    }
}
