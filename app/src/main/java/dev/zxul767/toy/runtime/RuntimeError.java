package dev.zxul767.toy.runtime;

import dev.zxul767.toy.parsing.Token;

public class RuntimeError extends RuntimeException {
  // the token closest to where things went wrong (used to report the line)
  public final Token token;

  public RuntimeError(Token token, String message) {
    super(message);
    this.token = token;
  }
}
