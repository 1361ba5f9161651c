package dev.zxul767.toy.parsing;

public enum TokenType {
  // single-character tokens
  LEFT_PAREN,
  RIGHT_PAREN,
  LEFT_BRACE,
  RIGHT_BRACE,
  COMMA,
  MINUS,
  PLUS,
  SEMICOLON,
  SLASH,
  STAR,

  // one or two character tokens
  BANG,
  BANG_EQUAL,
  EQUAL,
  EQUAL_EQUAL,
  GREATER,
  GREATER_EQUAL,
  LESS,
  LESS_EQUAL,
  ARROW,

  // literals
  IDENTIFIER,
  STRING,
  NUMBER,

  // keywords
  AND,
  ELSE,
  FALSE,
  FN,
  FOR,
  IF,
  NULL,
  OR,
  PRINT,
  RETURN,
  TRUE,
  VAR,
  WHILE,
  MATCH,
  CASE,

  EOF
}
