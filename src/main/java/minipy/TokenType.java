package minipy;

enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN, COLON,
    PLUS, MINUS, STAR, SLASH,

    // One or two character tokens.
    EQUAL, EQUAL_EQUAL, BANG_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,

    // Literals.
    NAME, STRING, NUMBER,

    // Keywords.
    PRINT, IF, ELSE,

    // Layout, synthesized from line structure and leading whitespace.
    NEWLINE, INDENT, DEDENT,

    // Carries a lexical error message; the parser reports it as a syntax error.
    ERROR,

    EOF
}
