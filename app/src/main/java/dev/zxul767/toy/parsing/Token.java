package dev.zxul767.toy.parsing;

import java.util.Objects;

public class Token {
  // `Token` is just a data structure with no behavior so it's okay for
  // its fields to be public
  public final TokenType type;
  // for numbers and strings this is the raw source text (quotes included);
  // the parser is in charge of turning it into a value
  public final String lexeme;
  public final int line;

  public Token(TokenType type, String lexeme, int line) {
    this.type = type;
    this.lexeme = lexeme;
    this.line = line;
  }

  public Token(TokenType type, String lexeme) {
    this(type, lexeme, /*line:*/ 1);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof Token))
      return false;
    Token token = (Token)other;
    return type == token.type && line == token.line &&
        lexeme.equals(token.lexeme);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, lexeme, line);
  }

  public String toString() { return type + " " + lexeme + " " + line; }
}
