package dev.zxul767.toy.parsing;

public class ParseError extends RuntimeException {
  public final Token token;

  ParseError(Token token, String message) {
    super(message);
    this.token = token;
  }

  public int line() { return token.line; }
}
