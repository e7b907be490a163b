package minipy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Queue;
import java.util.Stack;

/**
 * Splits source text into tokens, one physical line at a time.
 *
 * <p>Block structure is recovered from leading whitespace: a deeper line opens a block with an
 * INDENT, a shallower one closes blocks with one DEDENT per level. Every physical line ends in a
 * NEWLINE. A scanner holds the indentation stack of a single input, so create one per source.
 */
class Scanner {
  // Width a tab contributes to a line's indentation. Tabs are summed, not aligned to tab stops.
  static final int TAB_WIDTH = 4;

  private static final Map<String, TokenType> keywords;

  static {
    keywords = new HashMap<>();
    keywords.put("print", TokenType.PRINT);
    keywords.put("if",    TokenType.IF);
    keywords.put("else",  TokenType.ELSE);
  }

  private final List<String> lines;
  private final Stack<Integer> indents = new Stack<>();
  private final Queue<Token> pending = new ArrayDeque<>();
  private int nextLine = 0; // Index of the next physical line to scan.
  private int line = 0; // 1-based number of the line being scanned.
  private boolean finished = false;

  private String text; // The line being scanned.
  private int start; // Starting position of the lexeme being scanned.
  private int current; // Position of the next character to be read.

  Scanner(String source) {
    this.lines = splitLines(source);
    indents.push(0);
  }

  /** Lazily produces the token stream. The stream can be consumed only once. */
  Iterator<Token> tokens() {
    return new Iterator<Token>() {
      @Override
      public boolean hasNext() {
        fill();
        return !pending.isEmpty();
      }

      @Override
      public Token next() {
        if (!hasNext()) throw new NoSuchElementException();
        return pending.remove();
      }
    };
  }

  /** Drains the token stream into a list terminated by an EOF token. */
  List<Token> scanTokens() {
    List<Token> tokens = new ArrayList<>();
    Iterator<Token> it = tokens();
    while (it.hasNext()) tokens.add(it.next());

    tokens.add(new Token(TokenType.EOF, "", null, Math.max(line, 1)));
    return tokens;
  }

  private void fill() {
    while (pending.isEmpty() && !finished) {
      if (nextLine < lines.size()) {
        scanLine(lines.get(nextLine++));
      } else {
        // Close every block still open at the end of input.
        while (indents.size() > 1) {
          indents.pop();
          addLayoutToken(TokenType.DEDENT, "DEDENT");
        }
        finished = true;
      }
    }
  }

  private void scanLine(String raw) {
    line++;
    text = raw;

    int width = 0;
    int offset = 0;
    while (offset < text.length()) {
      char c = text.charAt(offset);
      if (c == ' ') width += 1;
      else if (c == '\t') width += TAB_WIDTH;
      else break;
      offset++;
    }

    String content = text.substring(offset);
    if (!content.isBlank()) indent(width);

    current = offset;
    while (current < text.length()) {
      // We are at the beginning of the next lexeme.
      start = current;
      scanToken();
    }

    addLayoutToken(TokenType.NEWLINE, "\n");
  }

  private void indent(int width) {
    if (width > indents.peek()) {
      indents.push(width);
      addLayoutToken(TokenType.INDENT, "INDENT");
    } else if (width < indents.peek()) {
      while (width < indents.peek()) {
        indents.pop();
        addLayoutToken(TokenType.DEDENT, "DEDENT");
      }
      // The line dedents to a level no enclosing block opened.
      if (indents.peek() != width) {
        error("INDENT", "Inconsistent indentation at line " + line);
      }
    }
  }

  private void scanToken() {
    char c = advance();
    switch (c) {
      case ' ':
      case '\t':
        break;
      case '(': addToken(TokenType.LEFT_PAREN); break;
      case ')': addToken(TokenType.RIGHT_PAREN); break;
      case ':': addToken(TokenType.COLON); break;
      case '+': addToken(TokenType.PLUS); break;
      case '-': addToken(TokenType.MINUS); break;
      case '*': addToken(TokenType.STAR); break;
      case '/': addToken(TokenType.SLASH); break;
      case '#':
        // A comment runs to the end of the line.
        current = text.length();
        break;
      case '!':
        if (match('=')) addToken(TokenType.BANG_EQUAL);
        else illegalCharacter(c);
        break;
      case '=':
        addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
        break;
      case '>':
        addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
        break;
      case '<':
        addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
        break;
      case '"':
      case '\'':
        string(c);
        break;
      default:
        if (isDigit(c)) {
          number();
        } else if (isAlpha(c) || c == '_') {
          identifier();
        } else {
          illegalCharacter(c);
        }
    }
  }

  private void string(char quote) {
    while (current < text.length() && text.charAt(current) != quote) {
      if (text.charAt(current) == '\\') current++; // The escaped character can't close the literal.
      current++;
    }

    if (current >= text.length()) {
      // Strings don't span lines, so the opening quote is all we can reject.
      current = start + 1;
      illegalCharacter(quote);
      return;
    }

    current++; // The closing quote.
    String body = text.substring(start + 1, current - 1);
    addToken(TokenType.STRING, unescape(body));
  }

  private void number() {
    while (isDigit(peek())) current++;

    String digits = text.substring(start, current);
    try {
      addToken(TokenType.NUMBER, Long.parseLong(digits));
    } catch (NumberFormatException e) {
      error(digits, "Integer literal too large '" + digits + "' at line " + line);
    }
  }

  private void identifier() {
    while (isAlphaNumeric(peek())) current++;

    String s = text.substring(start, current);
    addToken(keywords.getOrDefault(s, TokenType.NAME));
  }

  private void illegalCharacter(char c) {
    error(String.valueOf(c), "Illegal character '" + c + "' at line " + line);
  }

  // Decodes backslash escapes. Unknown or malformed escapes are kept as written.
  static String unescape(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    int i = 0;
    while (i < s.length()) {
      char c = s.charAt(i++);
      if (c != '\\' || i >= s.length()) {
        sb.append(c);
        continue;
      }

      char e = s.charAt(i++);
      switch (e) {
        case 'n': sb.append('\n'); break;
        case 't': sb.append('\t'); break;
        case 'r': sb.append('\r'); break;
        case 'a': sb.append('\u0007'); break;
        case 'b': sb.append('\b'); break;
        case 'f': sb.append('\f'); break;
        case 'v': sb.append('\u000B'); break;
        case '\\': sb.append('\\'); break;
        case '\'': sb.append('\''); break;
        case '"': sb.append('"'); break;
        case 'x':
          i = appendCodePoint(sb, s, i, 2, 16);
          break;
        case 'u':
          i = appendCodePoint(sb, s, i, 4, 16);
          break;
        case 'U':
          i = appendCodePoint(sb, s, i, 8, 16);
          break;
        default:
          if (e >= '0' && e <= '7') {
            int end = i - 1;
            while (end < s.length() && end < i + 2 && s.charAt(end) >= '0' && s.charAt(end) <= '7') end++;
            sb.append((char) Integer.parseInt(s.substring(i - 1, end), 8));
            i = end;
          } else {
            sb.append('\\').append(e);
          }
      }
    }
    return sb.toString();
  }

  // Appends the code point spelled by exactly `digits` characters at `from`; returns the new index.
  private static int appendCodePoint(StringBuilder sb, String s, int from, int digits, int radix) {
    int end = from + digits;
    if (end <= s.length()) {
      String spelled = s.substring(from, end);
      if (spelled.chars().allMatch(ch -> Character.digit(ch, radix) >= 0)) {
        // Eight hex digits can exceed the int range.
        long cp = Long.parseLong(spelled, radix);
        if (cp <= Character.MAX_CODE_POINT) {
          sb.appendCodePoint((int) cp);
          return end;
        }
      }
    }
    sb.append('\\').append(s.charAt(from - 1));
    return from;
  }

  private static List<String> splitLines(String source) {
    List<String> lines = new ArrayList<>();
    int lineStart = 0;
    for (int i = 0; i < source.length(); i++) {
      char c = source.charAt(i);
      if (c == '\n' || c == '\r') {
        lines.add(source.substring(lineStart, i));
        if (c == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') i++;
        lineStart = i + 1;
      }
    }
    if (lineStart < source.length()) lines.add(source.substring(lineStart));
    return lines;
  }

  private void addToken(TokenType type) {
    addToken(type, null);
  }

  private void addToken(TokenType type, Object literal) {
    pending.add(new Token(type, text.substring(start, current), literal, line));
  }

  // Layout tokens have no source text of their own.
  private void addLayoutToken(TokenType type, String lexeme) {
    pending.add(new Token(type, lexeme, null, line));
  }

  private void error(String lexeme, String message) {
    pending.add(new Token(TokenType.ERROR, lexeme, message, line));
  }

  private char advance() {
    return text.charAt(current++);
  }

  private boolean match(char expected) {
    if (peek() != expected) return false;
    current++;
    return true;
  }

  private char peek() {
    return current < text.length() ? text.charAt(current) : '\0';
  }

  private boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private boolean isAlpha(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private boolean isAlphaNumeric(char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }
}
