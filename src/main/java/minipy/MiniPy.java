package minipy;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

public class MiniPy {
  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 64;
  static final int EXIT_SYNTAX = 65;
  static final int EXIT_SEMANTIC = 66;

  private static final Compiler compiler = new Compiler();

  public static void main(String[] args) throws IOException {
    boolean showTokens = false;
    boolean showAst = false;
    String script = null;

    for (String arg : args) {
      if (arg.equals("--tokens")) {
        showTokens = true;
      } else if (arg.equals("--ast")) {
        showAst = true;
      } else if (script == null && !arg.startsWith("--")) {
        script = arg;
      } else {
        System.err.println("Usage: minipy [--tokens] [--ast] [script]");
        System.exit(EXIT_USAGE);
      }
    }

    if (script != null) {
      byte[] bytes = Files.readAllBytes(Paths.get(script));
      int status = run(new String(bytes, StandardCharsets.UTF_8), showTokens, showAst, System.out);
      System.exit(status);
    } else {
      runPrompt(showTokens, showAst);
    }
  }

  private static void runPrompt(boolean showTokens, boolean showAst) throws IOException {
    InputStreamReader input = new InputStreamReader(System.in, StandardCharsets.UTF_8);
    BufferedReader reader = new BufferedReader(input);

    while (true) {
      System.out.print("> ");
      String line = reader.readLine();
      if (line == null) break;

      // A header opens a block; keep reading until a blank line closes it.
      StringBuilder source = new StringBuilder(line).append('\n');
      if (line.trim().endsWith(":")) {
        while (true) {
          System.out.print("... ");
          String more = reader.readLine();
          if (more == null || more.isBlank()) break;
          source.append(more).append('\n');
        }
      }
      run(source.toString(), showTokens, showAst, System.out);
    }
  }

  /** Compiles one source text, reports on {@code out} and returns the exit status. */
  static int run(String source, boolean showTokens, boolean showAst, PrintStream out) {
    if (showTokens) {
      out.println("Tokens:");
      for (Token t : new Scanner(source).scanTokens()) {
        out.println("  " + t);
      }
    }

    CompileResult result = compiler.compile(source);
    if (showAst) {
      out.println("AST: " + result.ast().map(Program::toString).orElse("<none>"));
    }

    report(out, "Syntax errors", result.syntaxErrors());
    report(out, "Semantic errors", result.semanticErrors());

    if (!result.syntaxErrors().isEmpty()) return EXIT_SYNTAX;
    if (!result.semanticErrors().isEmpty()) return EXIT_SEMANTIC;
    return EXIT_OK;
  }

  private static void report(PrintStream out, String label, List<String> errors) {
    out.println(label + ": " + errors);
  }
}
