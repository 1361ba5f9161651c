package dev.zxul767.toy.parsing;

import static dev.zxul767.toy.parsing.TokenType.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Lexer {
  public static final Map<String, TokenType> keywords;
  static {
    Map<String, TokenType> table = new LinkedHashMap<>();
    table.put("and", AND);
    table.put("case", CASE);
    table.put("else", ELSE);
    table.put("false", FALSE);
    table.put("fn", FN);
    table.put("for", FOR);
    table.put("if", IF);
    table.put("match", MATCH);
    table.put("null", NULL);
    table.put("or", OR);
    table.put("print", PRINT);
    table.put("return", RETURN);
    table.put("true", TRUE);
    table.put("var", VAR);
    table.put("while", WHILE);
    keywords = Collections.unmodifiableMap(table);
  }

  private final String sourceCode;
  private final List<Token> tokens = new ArrayList<>();
  // `start` & `current` are meant to index `sourceCode` and they
  // represent the bounds of the token currently under examination.
  private int start = 0;
  private int current = 0;
  // `line` starts at 1 (and not 0) to be user friendly
  private int line = 1;

  public Lexer(String sourceCode) { this.sourceCode = sourceCode; }

  public static List<Token> tokenize(String sourceCode) {
    return new Lexer(sourceCode).tokenize();
  }

  // throws `LexError` on the first character it can't make sense of;
  // there's no attempt to recover and keep going
  public List<Token> tokenize() {
    while (!isAtEnd()) {
      start = current;
      scanToken();
    }
    tokens.add(new Token(EOF, /* lexeme: */ "", line));
    return tokens;
  }

  private void scanToken() {
    char c = advance();
    switch (c) {
    case '(':
      addToken(LEFT_PAREN);
      break;
    case ')':
      addToken(RIGHT_PAREN);
      break;
    case '{':
      addToken(LEFT_BRACE);
      break;
    case '}':
      addToken(RIGHT_BRACE);
      break;
    case ',':
      addToken(COMMA);
      break;
    case '-':
      addToken(MINUS);
      break;
    case '+':
      addToken(PLUS);
      break;
    case ';':
      addToken(SEMICOLON);
      break;
    case '*':
      addToken(STAR);
      break;

    case '!':
      addToken(match('=') ? BANG_EQUAL : BANG);
      break;
    case '=':
      if (match('=')) {
        addToken(EQUAL_EQUAL);
      } else if (match('>')) {
        addToken(ARROW);
      } else {
        addToken(EQUAL);
      }
      break;
    case '<':
      addToken(match('=') ? LESS_EQUAL : LESS);
      break;
    case '>':
      addToken(match('=') ? GREATER_EQUAL : GREATER);
      break;
    case '/':
      if (match('/')) {
        singleLineComment();
      } else if (match('*')) {
        multiLineComment();
      } else {
        addToken(SLASH);
      }
      break;

    case ' ':
    case '\r':
    case '\t':
      // ignore whitespace;
      break;

    case '\n':
      line++;
      break;

    case '"':
      string();
      break;

    default:
      if (isDigit(c)) {
        number();
      } else if (isAlpha(c)) {
        identifier();
      } else {
        throw new LexError(
            line, c, String.format("Unexpected character: <%c>.", c)
        );
      }
    }
  }

  // Scan (and ignore the contents of) a single-line comment.
  //
  // pre-condition: the opening delimiter (//) has just been consumed
  // post-condition: all characters up to a newline (or EOF) have been consumed.
  private void singleLineComment() {
    while (peek() != '\n' && !isAtEnd())
      advance();
  }

  // Scan (and ignore the contents of) a multi-line comment.
  //
  // pre-condition: the /* opening chars have just been consumed.
  // post-condition: all characters up to and including the last */ delimiter
  //    have been consumed (nested comments included)
  private void multiLineComment() {
    int openComments = 1;

    while (!isAtEnd()) {
      if (peek() == '/' && peekAhead(1) == '*') {
        openComments++;
        advance(2);
      } else if (peek() == '*' && peekAhead(1) == '/') {
        openComments--;
        advance(2);
      } else {
        char c = advance();
        if (c == '\n')
          line++;
      }
      if (openComments == 0)
        break;
    }

    if (openComments != 0) {
      throw new LexError(line, "Unterminated multi-line comment.");
    }
  }

  private void identifier() {
    while (isAlphaNumeric(peek()))
      advance();

    String text = sourceCode.substring(start, current);
    addToken(keywords.getOrDefault(text, IDENTIFIER));
  }

  private void string() {
    while (peek() != '"' && !isAtEnd()) {
      // strings may span several lines
      if (peek() == '\n')
        line++;
      advance();
    }
    if (isAtEnd()) {
      throw new LexError(line, "Unterminated string.");
    }
    // the closing "
    advance();
    addToken(STRING);
  }

  // the lexeme is kept as text; converting it is up to the parser
  private void number() {
    while (isDigit(peek()))
      advance();

    // we're looking at a decimal number...
    if (peek() == '.' && isDigit(peekAhead(1))) {
      // consume the "."
      advance();
      while (isDigit(peek()))
        advance();
    }
    addToken(NUMBER);
  }

  private boolean match(char expected) {
    if (isAtEnd())
      return false;
    if (sourceCode.charAt(current) != expected)
      return false;
    current++;
    return true;
  }

  // returns the next character to be consumed
  private char peek() { return peekAhead(0); }

  // returns the character to be consumed `distance` chars ahead
  private char peekAhead(int distance) {
    if (current + distance >= sourceCode.length())
      return '\0';
    return sourceCode.charAt(current + distance);
  }

  private boolean isAlpha(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

  private boolean isDigit(char c) { return c >= '0' && c <= '9'; }

  private boolean isAtEnd() { return current >= sourceCode.length(); }

  // returns the previously current character and advances one char forward
  private char advance() { return sourceCode.charAt(current++); }

  // returns the previously current character and advances `count` chars forward
  // pre-condition: current + count <= sourceCode.length()
  private char advance(int count) {
    char currentChar = sourceCode.charAt(current);
    current += count;
    return currentChar;
  }

  private void addToken(TokenType type) {
    String text = sourceCode.substring(start, current);
    tokens.add(new Token(type, text, line));
  }
}
