package dev.zxul767.toy;

import dev.zxul767.toy.parsing.LexError;
import dev.zxul767.toy.parsing.ParseError;
import dev.zxul767.toy.parsing.Token;
import dev.zxul767.toy.parsing.TokenType;
import dev.zxul767.toy.runtime.RuntimeError;
import java.io.PrintStream;

// Reports the errors that escape the lexer, the parser and the interpreter.
// The core never reports anything itself: it throws and leaves the decision
// of what to do (quit, or keep the REPL going) to the driver.
public class Errors {
  static boolean hadError = false;
  static boolean hadRuntimeError = false;

  private static PrintStream err = System.err;

  static void redirect(PrintStream stream) { err = stream; }

  public static void lexError(LexError error) {
    err.println(String.format(
        "Lexing Error: [line %d] %s", error.line, error.getMessage()
    ));
    err.flush();
    hadError = true;
  }

  public static void parseError(ParseError error) {
    Token token = error.token;
    String where = token.type == TokenType.EOF
                       ? " at end"
                       : String.format(" at '%s'", token.lexeme);
    err.println(
        "Parsing Error: [line " + token.line + "] Error" + where + ": " +
        error.getMessage()
    );
    err.flush();
    hadError = true;
  }

  public static void runtimeError(RuntimeError error) {
    err.println(String.format(
        "Runtime Error: %s\n[line %d]", error.getMessage(), error.token.line
    ));
    err.flush();
    hadRuntimeError = true;
  }

  public static void reset() {
    hadRuntimeError = false;
    hadError = false;
  }
}
