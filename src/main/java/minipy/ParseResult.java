package minipy;

import java.util.List;
import java.util.Optional;

/** What the parser produced: the tree, when it could build one, and the syntax errors it met. */
final class ParseResult {
    private final Program program;
    private final List<String> errors;

    ParseResult(Program program, List<String> errors) {
        this.program = program;
        this.errors = List.copyOf(errors);
    }

    Optional<Program> program() {
        return Optional.ofNullable(program);
    }

    List<String> errors() {
        return errors;
    }

    boolean hasErrors() {
        return !errors.isEmpty();
    }
}
