package dev.zxul767.toy.parsing;

import static dev.zxul767.toy.parsing.TokenType.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

// Recursive-descent parser. There's no error recovery: the first syntax
// error aborts the whole parse with a `ParseError`, so callers never see
// a partial AST.
public class Parser {
  private static final int MAX_ARGUMENTS = 255;

  private final List<Token> tokens;
  // indexes the token currently being looked at
  private int current = 0;

  public Parser(List<Token> tokens) { this.tokens = tokens; }

  public static List<Stmt> parse(List<Token> tokens) {
    return new Parser(tokens).parse();
  }

  // program -> declaration* EOF
  public List<Stmt> parse() {
    List<Stmt> statements = new ArrayList<>();
    while (!isAtEnd()) {
      statements.add(declaration());
    }
    return statements;
  }

  // expression -> assignment
  private Expr expression() { return assignment(); }

  // declaration -> varDeclaration
  //              | functionDeclaration
  //              | statement
  private Stmt declaration() {
    if (match(FN))
      return functionDeclaration();
    if (match(VAR))
      return varDeclaration();
    return statement();
  }

  // statement -> printStatement
  //            | ifStatement
  //            | whileStatement
  //            | forStatement
  //            | block
  //            | returnStatement
  //            | expressionStatement
  private Stmt statement() {
    if (match(PRINT))
      return printStatement();

    if (match(IF))
      return ifStatement();

    if (match(WHILE))
      return whileStatement();

    if (match(FOR))
      return forStatement();

    if (match(LEFT_BRACE))
      return new Stmt.Block(block());

    if (match(RETURN))
      return returnStatement();

    return expressionStatement();
  }

  // printStatement -> "print" expression ";"
  private Stmt printStatement() {
    Expr value = expression();
    consume(SEMICOLON, "Expected ';' after value.");
    return new Stmt.Print(value);
  }

  // forStatement ->  "for" "(" (varDeclaration | expressionStatement | ";")
  //                            expression? ";"
  //                            expression?
  //                         ")" statement
  private Stmt forStatement() {
    consume(LEFT_PAREN, "Expected '(' after 'for'.");
    Stmt initializer;
    if (match(SEMICOLON)) {
      initializer = null;
    } else if (match(VAR)) {
      initializer = varDeclaration();
    } else {
      initializer = expressionStatement();
    }
    Expr condition = null;
    if (!check(SEMICOLON)) {
      condition = expression();
    }
    consume(SEMICOLON, "Expected ';' after loop condition.");

    Expr increment = null;
    if (!check(RIGHT_PAREN)) {
      increment = expression();
    }
    consume(RIGHT_PAREN, "Expected ')' after for clauses.");

    //
    // NOTE: for statements are "desugared" into while statements
    //
    Stmt body = statement();
    if (increment != null) {
      body =
          new Stmt.Block(Arrays.asList(body, new Stmt.Expression(increment)));
    }
    if (condition == null) {
      condition = new Expr.Literal(true);
    }
    body = new Stmt.While(condition, body);

    if (initializer != null) {
      body = new Stmt.Block(Arrays.asList(initializer, body));
    }

    return body;
  }

  // ifStatement -> "if" "(" expression ")" statement
  //                ("else" statement)?
  private Stmt ifStatement() {
    consume(LEFT_PAREN, "Expected '(' after 'if'.");
    Expr condition = expression();
    consume(RIGHT_PAREN, "Expected ')' after 'if' condition.");

    Stmt thenBranch = statement();
    Stmt elseBranch = null;
    if (match(ELSE)) {
      elseBranch = statement();
    }
    return new Stmt.If(condition, thenBranch, elseBranch);
  }

  // returnStatement -> "return" expression? ";"
  private Stmt returnStatement() {
    Token keyword = previous();
    Expr value = null;
    if (!check(SEMICOLON)) {
      value = expression();
    }
    consume(SEMICOLON, "Expected ';' after return value.");

    return new Stmt.Return(keyword, value);
  }

  // varDeclaration -> "var" IDENTIFIER ("=" expression)? ";"
  private Stmt varDeclaration() {
    Token name = consume(IDENTIFIER, "Expected variable name.");
    Expr initializer = null;
    if (match(EQUAL)) {
      initializer = expression();
    }
    consume(SEMICOLON, "Expected ';' after variable declaration.");
    return new Stmt.Var(name, initializer);
  }

  // whileStatement -> "while" "(" expression ")" statement
  private Stmt whileStatement() {
    consume(LEFT_PAREN, "Expected '(' after 'while'.");
    Expr condition = expression();
    consume(RIGHT_PAREN, "Expected ')' after 'while' condition.");
    Stmt body = statement();

    return new Stmt.While(condition, body);
  }

  // expressionStatement -> expression ";"
  private Stmt expressionStatement() {
    Expr value = expression();
    consume(SEMICOLON, "Expected ';' after expression.");
    return new Stmt.Expression(value);
  }

  // block -> "{" declaration* "}"
  //
  // pre-condition: the opening "{" has just been consumed
  private List<Stmt> block() {
    List<Stmt> statements = new ArrayList<>();
    while (!check(RIGHT_BRACE) && !isAtEnd()) {
      statements.add(declaration());
    }
    consume(RIGHT_BRACE, "Expected '}' after block.");
    return statements;
  }

  // functionDeclaration -> "fn" IDENTIFIER "(" parameters? ")" block
  // parameters -> IDENTIFIER ( "," IDENTIFIER )*
  private Stmt.Function functionDeclaration() {
    Token name = consume(IDENTIFIER, "Expected function name.");
    consume(LEFT_PAREN, "Expected '(' after function name.");
    List<Token> parameters = new ArrayList<>();
    if (!check(RIGHT_PAREN)) {
      do {
        if (parameters.size() >= MAX_ARGUMENTS) {
          throw error(
              peek(), String.format(
                          "Can't have more than %d parameters.", MAX_ARGUMENTS
                      )
          );
        }
        parameters.add(consume(IDENTIFIER, "Expected parameter name."));
      } while (match(COMMA));
    }
    consume(RIGHT_PAREN, "Expected ')' after parameters.");

    consume(LEFT_BRACE, "Expected '{' before function body.");
    List<Stmt> body = block();

    return new Stmt.Function(name, parameters, body);
  }

  // Assignments are expressions, so one can do things like:
  //    if (a = true) print a;
  //
  // assignment -> IDENTIFIER "=" assignment
  //             | logic_or
  private Expr assignment() {
    Expr expr = or();

    if (match(EQUAL)) {
      Token equals = previous();
      Expr value = assignment();

      if (expr instanceof Expr.Variable) {
        Token name = ((Expr.Variable)expr).name;
        return new Expr.Assign(name, value);
      }
      throw error(equals, "Invalid assignment target.");
    }
    return expr;
  }

  // logic_or -> logic_and ( "or" logic_and )*
  private Expr or() { return logical(() -> and(), OR); }

  // logic_and -> equality ( "and" equality )*
  private Expr and() { return logical(() -> equality(), AND); }

  // equality -> equality ( "!=" | "==" ) comparison
  //           | comparison
  private Expr equality() {
    return binary(() -> comparison(), BANG_EQUAL, EQUAL_EQUAL);
  }

  // comparison -> comparison ( ">" | ">=" | "<" | "<=" ) term
  //             | term
  private Expr comparison() {
    return binary(() -> term(), GREATER, GREATER_EQUAL, LESS, LESS_EQUAL);
  }

  // term -> term ( "-" | "+" ) factor
  //       | factor
  private Expr term() { return binary(() -> factor(), MINUS, PLUS); }

  // factor -> factor ( "/" | "*" ) unary
  //         | unary
  private Expr factor() { return binary(() -> unary(), SLASH, STAR); }

  // unary -> ( "!" | "-" ) unary
  //        | call
  private Expr unary() {
    if (match(BANG, MINUS)) {
      Token operator = previous();
      Expr right = unary();
      return new Expr.Unary(operator, right);
    }
    return call();
  }

  // call -> primary ( "(" arguments? ")" )*
  private Expr call() {
    Expr callee = primary();

    // this loop is necessary because we might have an expression like this:
    //    callee(a, b)(c, d, e)(f, g)
    //
    while (match(LEFT_PAREN)) {
      callee = finishCall(callee);
    }
    return callee;
  }

  // Gather all arguments and create a single call expression
  //
  // arguments -> expression ( "," expression )*
  //
  // pre-condition: a LEFT_PAREN has just been consumed
  // post-condition: a RIGHT_PAREN is the last consumed token
  private Expr finishCall(Expr callee) {
    List<Expr> arguments = new ArrayList<>();
    if (!check(RIGHT_PAREN)) {
      do {
        if (arguments.size() >= MAX_ARGUMENTS) {
          throw error(
              peek(), String.format(
                          "Can't have more than %d arguments.", MAX_ARGUMENTS
                      )
          );
        }
        arguments.add(expression());
      } while (match(COMMA));
    }
    Token paren = consume(RIGHT_PAREN, "Expected ')' after arguments.");
    return new Expr.Call(callee, paren, arguments);
  }

  // primary -> NUMBER | STRING | "true" | "false" | "null" | IDENTIFIER
  //          | "(" expression ")"
  //          | matchExpression
  private Expr primary() {
    if (match(FALSE)) {
      return new Expr.Literal(false);
    }
    if (match(TRUE)) {
      return new Expr.Literal(true);
    }
    if (match(NULL)) {
      return new Expr.Literal(null);
    }
    if (match(NUMBER)) {
      return new Expr.Literal(Double.parseDouble(previous().lexeme));
    }
    if (match(STRING)) {
      // trim the surrounding quotes
      String lexeme = previous().lexeme;
      return new Expr.Literal(lexeme.substring(1, lexeme.length() - 1));
    }
    if (match(IDENTIFIER)) {
      return new Expr.Variable(previous());
    }
    if (match(LEFT_PAREN)) {
      Expr expr = expression();
      consume(RIGHT_PAREN, "Expected ')' after expression.");
      return new Expr.Grouping(expr);
    }
    if (match(MATCH)) {
      return matchExpression();
    }
    throw error(peek(), "Expected expression.");
  }

  // matchExpression -> "match" expression
  //                    "{" ( "case" expression "=>" expression ","? )* "}"
  private Expr matchExpression() {
    Token keyword = previous();
    Expr subject = expression();
    consume(LEFT_BRACE, "Expected '{' after match subject.");

    List<Expr.Case> cases = new ArrayList<>();
    while (!check(RIGHT_BRACE) && !isAtEnd()) {
      consume(CASE, "Expected 'case' in match body.");
      Expr pattern = expression();
      consume(ARROW, "Expected '=>' after case pattern.");
      Expr body = expression();
      cases.add(new Expr.Case(pattern, body));

      if (!match(COMMA))
        break;
    }
    consume(RIGHT_BRACE, "Expected '}' after match cases.");
    return new Expr.Match(keyword, subject, cases);
  }

  // binary -> binary ONE_OF<tokenTypes> subunit
  //         | subunit
  private Expr binary(Supplier<Expr> subunitParser, TokenType... tokenTypes) {
    Expr expr = subunitParser.get();
    while (match(tokenTypes)) {
      Token operator = previous();
      Expr right = subunitParser.get();
      expr = new Expr.Binary(expr, operator, right);
    }
    return expr;
  }

  // same shape as `binary`, but builds nodes the interpreter can short-circuit
  private Expr logical(Supplier<Expr> subunitParser, TokenType tokenType) {
    Expr expr = subunitParser.get();
    while (match(tokenType)) {
      Token operator = previous();
      Expr right = subunitParser.get();
      expr = new Expr.Logical(expr, operator, right);
    }
    return expr;
  }

  // returns true if it was able to consume the next token
  // consumes the next token if it matches one of `expectedTypes`
  private boolean match(TokenType... expectedTypes) {
    for (TokenType type : expectedTypes) {
      if (check(type)) {
        advance();
        return true;
      }
    }
    return false;
  }

  private Token consume(TokenType type, String message) {
    if (check(type))
      return advance();
    throw error(peek(), message);
  }

  private boolean check(TokenType expectedType) {
    if (isAtEnd())
      return false;
    return peek().type == expectedType;
  }

  private Token advance() {
    if (!isAtEnd())
      current++;
    return previous();
  }

  private boolean isAtEnd() { return peek().type == EOF; }

  private Token peek() { return tokens.get(current); }

  private Token previous() { return tokens.get(current - 1); }

  private ParseError error(Token token, String message) {
    return new ParseError(token, message);
  }
}
