package dev.zxul767.toy.runtime;

import dev.zxul767.toy.parsing.LexError;
import dev.zxul767.toy.parsing.Lexer;
import dev.zxul767.toy.parsing.Parser;
import dev.zxul767.toy.parsing.Stmt;
import dev.zxul767.toy.parsing.Token;
import dev.zxul767.toy.parsing.TokenType;
import java.io.PrintStream;
import java.util.Collections;
import java.util.List;
import java.util.Map;

// Incremental execution on top of a single interpreter: every submitted
// chunk of code is appended to the source accepted so far and the whole
// text is scanned & parsed again, but only the statements that haven't
// been run yet get executed.
public class Session {
  private final Interpreter interpreter;
  private String source = "";
  private int executedCount = 0;

  // what the last submission produced (for inspection)
  private List<Token> lastTokens = Collections.emptyList();
  private List<Stmt> lastStatements = Collections.emptyList();

  public Session() { this(System.out); }

  public Session(PrintStream out) { this.interpreter = new Interpreter(out); }

  // Lexing, parsing and runtime errors are propagated to the caller. When
  // that happens `input` is discarded, but whatever the failing run managed
  // to define in the global environment stays there.
  public void submit(String input) {
    String combined = source + input + "\n";

    List<Token> tokens = Lexer.tokenize(combined);
    lastTokens = tokens;
    List<Stmt> statements = Parser.parse(tokens);
    lastStatements = statements;

    // a top-level `return` leaves the statements after it pending: they'll
    // run with the next submission
    executedCount = interpreter.interpret(statements, executedCount);
    source = combined;
  }

  // `true` when every opening brace in `buffer` has been closed (braces
  // inside strings and comments don't count) and no string or comment is
  // left open
  public static boolean isComplete(String buffer) {
    List<Token> tokens;
    try {
      tokens = Lexer.tokenize(buffer);
    } catch (LexError error) {
      // an unterminated string/comment may still be closed on a later line;
      // any other lexing error is reported once the input is submitted
      return error.character != '\0';
    }
    int depth = 0;
    for (Token token : tokens) {
      if (token.type == TokenType.LEFT_BRACE)
        depth++;
      else if (token.type == TokenType.RIGHT_BRACE)
        depth--;
    }
    return depth <= 0;
  }

  public Map<String, Object> globals() {
    return interpreter.globals().bindings();
  }

  public String source() { return source; }

  public int executedCount() { return executedCount; }

  public List<Token> lastTokens() { return lastTokens; }

  public List<Stmt> lastStatements() { return lastStatements; }
}
