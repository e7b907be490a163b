package minipy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ParserTest {

    private static String tree(String source) {
        ParseResult result = Parser.parse(source);
        assertTrue(result.program().isPresent(), "expected a program");
        return new AstPrinter().print(result.program().get());
    }

    private static String validTree(String source) {
        ParseResult result = Parser.parse(source);
        assertEquals(List.of(), result.errors());
        return tree(source);
    }

    @Test
    void emptySourceIsAnEmptyProgram() {
        assertEquals("(program)", validTree(""));
        assertEquals("(program)", validTree("\n\n# nothing here\n"));
    }

    @Test
    void multiplicationBindsTighterThanAddition() {
        assertEquals("(program (= x (+ 1 (* 2 3))))", validTree("x = 1 + 2 * 3\n"));
    }

    @Test
    void arithmeticIsLeftAssociative() {
        assertEquals("(program (= x (- (- 1 2) 3)))", validTree("x = 1 - 2 - 3\n"));
        assertEquals("(program (= x (/ (* a b) c)))", validTree("x = a * b / c\n"));
    }

    @Test
    void parenthesesGroupWithoutAddingANode() {
        assertEquals("(program (= x (* (+ 1 2) 3)))", validTree("x = (1 + 2) * 3\n"));
        assertEquals("(program (print y))", validTree("print(((y)))\n"));
    }

    @Test
    void printOfAString() {
        assertEquals("(program (print \"hi\"))", validTree("print(\"hi\")\n"));
        assertEquals("(program (print \"it's\"))", validTree("print('it\\'s')\n"));
    }

    @Test
    void ifWithElse() {
        String source = "x = 5\n"
                + "y = x + 3\n"
                + "if y > 6:\n"
                + "    print(\"Large\")\n"
                + "else:\n"
                + "    print(\"Small\")\n";
        assertEquals("(program (= x 5) (= y (+ x 3)) "
                + "(if (> y 6) (then (print \"Large\")) (else (print \"Small\"))))", validTree(source));
    }

    @Test
    void ifWithoutElse() {
        assertEquals("(program (if (!= a 0) (then (= b 1) (= c 2))))",
                validTree("if a != 0:\n    b = 1\n\n    c = 2\n"));
    }

    @Test
    void nestedIfs() {
        String source = "if a >= 1:\n"
                + "    if b <= 2:\n"
                + "        c = 3\n"
                + "    else:\n"
                + "        c = 4\n"
                + "d = 5\n";
        assertEquals("(program (if (>= a 1) (then (if (<= b 2) (then (= c 3)) (else (= c 4))))) (= d 5))",
                validTree(source));
    }

    @Test
    void everyComparisonOperator() {
        for (String op : List.of(">", "<", ">=", "<=", "==", "!=")) {
            assertEquals("(program (if (" + op + " a (+ b 1)) (then (print a))))",
                    validTree("if a " + op + " b + 1:\n    print(a)\n"));
        }
    }

    @Test
    void missingColonIsASyntaxError() {
        ParseResult result = Parser.parse("if x\n    print(x)\n");
        assertEquals(List.of("Syntax error at '\\n' (line 1)"), result.errors());
        assertEquals("(program)", tree("if x\n    print(x)\n"));
    }

    @Test
    void inputEndingInsideAStatement() {
        assertEquals(List.of("Syntax error at EOF"), Parser.parse("if x > 1:").errors());
    }

    @Test
    void recoveryKeepsTheStatementsAroundTheError() {
        String source = "x = 1\ny = = 2\nprint(x)\n";
        assertEquals(List.of("Syntax error at '=' (line 2)"), Parser.parse(source).errors());
        assertEquals("(program (= x 1) (print x))", tree(source));
    }

    @Test
    void recoveryReportsOneErrorPerBrokenLine() {
        List<String> errors = Parser.parse("x = \ny = 1 +\nz = 3\n").errors();
        assertEquals(List.of("Syntax error at '\\n' (line 1)", "Syntax error at '\\n' (line 2)"), errors);
    }

    @Test
    void brokenHeaderSkipsItsBlockAndElseBranch() {
        String source = "if x\n    a = 1\nelse:\n    b = 2\nc = 3\n";
        assertEquals(1, Parser.parse(source).errors().size());
        assertEquals("(program (= c 3))", tree(source));
    }

    @Test
    void errorInsideABlockDropsTheWholeIf() {
        String source = "if a > 1:\n    x = (\n    z = 1\ny = 2\n";
        assertEquals(List.of("Syntax error at '\\n' (line 2)"), Parser.parse(source).errors());
        assertEquals("(program (= y 2))", tree(source));
    }

    @Test
    void comparisonsAreNotExpressions() {
        assertEquals(List.of("Syntax error at '<' (line 1)"), Parser.parse("x = 1 < 2\n").errors());
        assertEquals(List.of("Syntax error at '<' (line 1)"),
                Parser.parse("if a < b < c:\n    x = 1\n").errors());
    }

    @Test
    void conditionMustBeAComparison() {
        assertEquals(List.of("Syntax error at ':' (line 1)"), Parser.parse("if a:\n    x = 1\n").errors());
    }

    @Test
    void unaryMinusIsNotSupported() {
        assertEquals(List.of("Syntax error at '-' (line 1)"), Parser.parse("x = -1\n").errors());
    }

    @Test
    void errorsQuoteTheTokenValue() {
        assertEquals(List.of("Syntax error at '2' (line 1)"), Parser.parse("print(1 2)\n").errors());
        assertEquals(List.of("Syntax error at 'hi' (line 3)"), Parser.parse("\n\nx = 1 'hi'\n").errors());
        assertEquals(List.of("Syntax error at 'else' (line 1)"), Parser.parse("else:\n    x = 1\n").errors());
    }

    @Test
    void unexpectedIndentIsASyntaxError() {
        String source = "x = 1\n    y = 2\nz = 3\n";
        assertEquals(List.of("Syntax error at 'INDENT' (line 2)"), Parser.parse(source).errors());
        assertEquals("(program (= x 1) (= z 3))", tree(source));
    }

    @Test
    void lexicalErrorsBecomeSyntaxErrorsInSourceOrder() {
        String source = "x = 1 $\ny = = 2\nz = 3 ?\n";
        assertEquals(List.of(
                "Illegal character '$' at line 1",
                "Syntax error at '=' (line 2)",
                "Illegal character '?' at line 3"), Parser.parse(source).errors());
        assertEquals("(program (= x 1) (= z 3))", tree(source));
    }

    @Test
    void inconsistentIndentationIsReported() {
        ParseResult result = Parser.parse("if a > 1:\n    x = 1\n  y = 2\n");
        assertTrue(result.errors().contains("Inconsistent indentation at line 3"));
    }

    @Test
    void deepButBoundedNestingParses() {
        String source = "x = " + "(".repeat(200) + "1" + ")".repeat(200) + "\n";
        assertEquals("(program (= x 1))", validTree(source));
    }

    @Test
    void excessiveNestingAbandonsTheParse() {
        String source = "x = " + "(".repeat(300) + "1" + ")".repeat(300) + "\n";
        ParseResult result = Parser.parse(source);
        assertFalse(result.program().isPresent());
        assertEquals(List.of("Syntax error: nesting deeper than 255 levels (line 1)"), result.errors());
    }

    @Test
    void parserAcceptsTokensWithoutEof() {
        List<Token> tokens = List.of(
                new Token(TokenType.PRINT, "print", null, 1),
                new Token(TokenType.LEFT_PAREN, "(", null, 1),
                new Token(TokenType.NUMBER, "7", 7L, 1),
                new Token(TokenType.RIGHT_PAREN, ")", null, 1),
                new Token(TokenType.NEWLINE, "\n", null, 1));
        ParseResult result = new Parser(tokens).parse();
        assertEquals(List.of(), result.errors());
        assertEquals("(program (print 7))", new AstPrinter().print(result.program().get()));
    }
}
