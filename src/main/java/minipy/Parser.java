package minipy;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser producing a {@link Program}.
 *
 * <p>Syntax errors don't stop the parse. The failing statement is dropped, tokens are discarded
 * up to the end of its logical line (together with any block indented under it), and parsing
 * resumes with the next statement.
 */
class Parser {
  // Deepest nesting of blocks and parentheses accepted before the parse is abandoned.
  static final int MAX_DEPTH = 255;

  // Private because error recovery is the parser's job.
  private static class ParseError extends RuntimeException {}

  // Aborts the whole parse; no tree is returned.
  static class Unrecoverable extends RuntimeException {
    Unrecoverable(String message) {
      super(message);
    }
  }

  private final List<Token> tokens;
  private final ErrorReporter errors = new ErrorReporter();
  private int current = 0;
  private int depth = 0;

  Parser(List<Token> tokens) {
    this.tokens = new ArrayList<>(tokens);
    if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).type != TokenType.EOF) {
      int line = this.tokens.isEmpty() ? 1 : this.tokens.get(this.tokens.size() - 1).line;
      this.tokens.add(new Token(TokenType.EOF, "", null, line));
    }
  }

  static ParseResult parse(String source) {
    return new Parser(new Scanner(source).scanTokens()).parse();
  }

  ParseResult parse() {
    try {
      List<Stmt> stmts = new ArrayList<>();
      while (!isAtEnd()) {
        Stmt s = declaration();
        if (s != null) stmts.add(s);
      }
      return new ParseResult(new Program(stmts), errors.all());
    } catch (Unrecoverable e) {
      errors.report(e.getMessage());
      return new ParseResult(null, errors.all());
    }
  }

  // A statement, or null for an empty line or a statement that failed to parse.
  private Stmt declaration() {
    int before = current;
    try {
      return statement();
    } catch (ParseError e) {
      synchronise();
      // Never retry the token that failed.
      if (current == before) advance();
      return null;
    }
  }

  private Stmt statement() {
    if (match(TokenType.NEWLINE)) return null;
    if (match(TokenType.IF)) return ifStmt();
    if (match(TokenType.PRINT)) return printStmt();
    if (match(TokenType.NAME)) return assignment();

    throw error(peek());
  }

  private Stmt assignment() {
    String name = previous().lexeme;
    consume(TokenType.EQUAL);
    Expr expr = expression();
    consume(TokenType.NEWLINE);
    return new Stmt.Assignment(name, expr);
  }

  private Stmt printStmt() {
    consume(TokenType.LEFT_PAREN);
    Expr expr = expression();
    consume(TokenType.RIGHT_PAREN);
    consume(TokenType.NEWLINE);
    return new Stmt.Print(expr);
  }

  private Stmt ifStmt() {
    int errorsBefore = errors.count();

    Expr condition = comparison();
    consume(TokenType.COLON);
    consume(TokenType.NEWLINE);
    List<Stmt> body = block();

    List<Stmt> orelse = null;
    if (match(TokenType.ELSE)) {
      consume(TokenType.COLON);
      consume(TokenType.NEWLINE);
      orelse = block();
    }

    // A branch that lost a statement to an error would make the node incomplete.
    if (errors.count() != errorsBefore) return null;
    return new Stmt.If(condition, body, orelse);
  }

  private List<Stmt> block() {
    consume(TokenType.INDENT);
    enter();
    try {
      List<Stmt> stmts = new ArrayList<>();
      while (!isAtEnd() && !check(TokenType.DEDENT)) {
        Stmt s = declaration();
        if (s != null) stmts.add(s);
      }
      consume(TokenType.DEDENT);
      return stmts;
    } finally {
      leave();
    }
  }

  // Exactly one comparison; comparisons don't chain and don't appear inside expressions.
  private Expr comparison() {
    Expr left = expression();

    if (match(TokenType.GREATER, TokenType.LESS, TokenType.GREATER_EQUAL,
        TokenType.LESS_EQUAL, TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
      Operator op = Operator.of(previous().type);
      Expr right = expression();
      return new Expr.BinOp(left, op, right);
    }

    throw error(peek());
  }

  private Expr expression() {
    Expr left = term();

    while (match(TokenType.PLUS, TokenType.MINUS)) {
      Operator op = Operator.of(previous().type);
      Expr right = term();
      left = new Expr.BinOp(left, op, right);
    }

    return left;
  }

  private Expr term() {
    Expr left = primary();

    while (match(TokenType.STAR, TokenType.SLASH)) {
      Operator op = Operator.of(previous().type);
      Expr right = primary();
      left = new Expr.BinOp(left, op, right);
    }

    return left;
  }

  private Expr primary() {
    if (match(TokenType.NUMBER)) return new Expr.NumberLiteral((Long) previous().literal);
    if (match(TokenType.STRING)) return new Expr.StringLiteral((String) previous().literal);
    if (match(TokenType.NAME)) return new Expr.Name(previous().lexeme);

    if (match(TokenType.LEFT_PAREN)) {
      enter();
      try {
        Expr expr = expression();
        consume(TokenType.RIGHT_PAREN);
        return expr;
      } finally {
        leave();
      }
    }

    throw error(peek());
  }

  private void enter() {
    if (++depth > MAX_DEPTH) {
      throw new Unrecoverable("Syntax error: nesting deeper than " + MAX_DEPTH
          + " levels (line " + previous().line + ")");
    }
  }

  private void leave() {
    depth--;
  }

  private void consume(TokenType type) {
    if (match(type)) return;

    throw error(peek());
  }

  private ParseError error(Token token) {
    errors.syntax(token);
    return new ParseError();
  }

  // Discards the rest of the broken statement: up to the end of its line, plus any block
  // (and else block) nested under it. Stops before a DEDENT that closes the enclosing block.
  private void synchronise() {
    int nested = 0;
    while (!isAtEnd()) {
      switch (peek().type) {
        case NEWLINE:
          advance();
          if (nested == 0 && !check(TokenType.INDENT)) return;
          break;
        case INDENT:
          nested++;
          advance();
          break;
        case DEDENT:
          if (nested == 0) return;
          nested--;
          advance();
          if (nested == 0 && !check(TokenType.ELSE)) return;
          break;
        default:
          advance();
      }
    }
  }

  private boolean match(TokenType... types) {
    for (TokenType type : types) {
      if (check(type)) {
        advance();
        return true;
      }
    }
    return false;
  }

  private boolean check(TokenType type) {
    if (isAtEnd()) return false;
    return peek().type == type;
  }

  private Token advance() {
    if (!isAtEnd()) current++;
    return previous();
  }

  private boolean isAtEnd() {
    return peek().type == TokenType.EOF;
  }

  // Lexical errors surface here, in stream order, as syntax errors.
  private Token peek() {
    Token t = tokens.get(current);
    while (t.type == TokenType.ERROR) {
      errors.report(t.value());
      t = tokens.get(++current);
    }
    return t;
  }

  private Token previous() {
    return tokens.get(current - 1);
  }
}
