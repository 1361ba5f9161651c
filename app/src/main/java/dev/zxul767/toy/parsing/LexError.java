package dev.zxul767.toy.parsing;

public class LexError extends RuntimeException {
  public final int line;
  // '\0' when the error isn't about a single offending character
  // (e.g., an unterminated string)
  public final char character;

  LexError(int line, char character, String message) {
    super(message);
    this.line = line;
    this.character = character;
  }

  LexError(int line, String message) { this(line, '\0', message); }
}
