package minipy;

import java.util.HashSet;
import java.util.Set;

/**
 * The names known to be assigned at some point of the program. Only the fact of assignment is
 * tracked, never a value.
 */
class SymbolTable {
    private final Set<String> defined;

    SymbolTable() {
        this.defined = new HashSet<>();
    }

    private SymbolTable(Set<String> defined) {
        this.defined = new HashSet<>(defined);
    }

    void define(String name) {
        defined.add(name);
    }

    boolean isDefined(String name) {
        return defined.contains(name);
    }

    // A snapshot for a conditional branch. Definitions made in the copy don't reach this table.
    SymbolTable copy() {
        return new SymbolTable(defined);
    }
}
