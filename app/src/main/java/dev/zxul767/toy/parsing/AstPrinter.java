package dev.zxul767.toy.parsing;

import java.util.ArrayList;
import java.util.List;

// Renders the AST in a lisp-like parenthesized prefix form, e.g.:
//
//    1 + 2 * 3    =>    (+ 1.0 (* 2.0 3.0))
//
public class AstPrinter implements Expr.Visitor<String>, Stmt.Visitor<String> {
  public String print(Expr expr) { return expr.accept(this); }

  public String print(Stmt stmt) { return stmt.accept(this); }

  public String print(List<Stmt> statements) {
    List<String> lines = new ArrayList<>();
    for (Stmt statement : statements) {
      lines.add(print(statement));
    }
    return String.join("\n", lines);
  }

  @Override
  public String visitBlockStmt(Stmt.Block stmt) {
    return parenthesizeStatements("block", stmt.statements);
  }

  @Override
  public String visitExpressionStmt(Stmt.Expression stmt) {
    return parenthesize(";", stmt.expression);
  }

  @Override
  public String visitFunctionStmt(Stmt.Function stmt) {
    List<String> params = new ArrayList<>();
    for (Token param : stmt.params) {
      params.add(param.lexeme);
    }
    String header = String.format(
        "fn %s(%s)", stmt.name.lexeme, String.join(" ", params)
    );
    return parenthesizeStatements(header, stmt.body);
  }

  @Override
  public String visitIfStmt(Stmt.If stmt) {
    StringBuilder builder = new StringBuilder();
    builder.append("(if ")
        .append(print(stmt.condition))
        .append(" ")
        .append(print(stmt.thenBranch));
    if (stmt.elseBranch != null) {
      builder.append(" ").append(print(stmt.elseBranch));
    }
    return builder.append(")").toString();
  }

  @Override
  public String visitPrintStmt(Stmt.Print stmt) {
    return parenthesize("print", stmt.expression);
  }

  @Override
  public String visitReturnStmt(Stmt.Return stmt) {
    if (stmt.value == null)
      return "(return)";
    return parenthesize("return", stmt.value);
  }

  @Override
  public String visitVarStmt(Stmt.Var stmt) {
    if (stmt.initializer == null)
      return String.format("(var %s)", stmt.name.lexeme);
    return parenthesize("var " + stmt.name.lexeme, stmt.initializer);
  }

  @Override
  public String visitWhileStmt(Stmt.While stmt) {
    return String.format(
        "(while %s %s)", print(stmt.condition), print(stmt.body)
    );
  }

  @Override
  public String visitAssignExpr(Expr.Assign expr) {
    return parenthesize("assign", new Expr.Variable(expr.name), expr.value);
  }

  @Override
  public String visitBinaryExpr(Expr.Binary expr) {
    return parenthesize(expr.operator.lexeme, expr.left, expr.right);
  }

  @Override
  public String visitCallExpr(Expr.Call expr) {
    ArrayList<Expr> args = new ArrayList<>(expr.arguments);
    args.add(0, expr.callee);
    return parenthesize("call", args.toArray(new Expr[0]));
  }

  @Override
  public String visitGroupingExpr(Expr.Grouping expr) {
    return parenthesize("group", expr.expression);
  }

  @Override
  public String visitLiteralExpr(Expr.Literal expr) {
    if (expr.value == null)
      return "null";
    if (expr.value instanceof String)
      return String.format("\"%s\"", expr.value);
    return expr.value.toString();
  }

  @Override
  public String visitLogicalExpr(Expr.Logical expr) {
    return parenthesize(expr.operator.lexeme, expr.left, expr.right);
  }

  @Override
  public String visitMatchExpr(Expr.Match expr) {
    StringBuilder builder = new StringBuilder();
    builder.append("(match ").append(print(expr.subject));
    for (Expr.Case matchCase : expr.cases) {
      builder.append(" ").append(
          parenthesize("case", matchCase.pattern, matchCase.body)
      );
    }
    return builder.append(")").toString();
  }

  @Override
  public String visitUnaryExpr(Expr.Unary expr) {
    return parenthesize(expr.operator.lexeme, expr.right);
  }

  @Override
  public String visitVariableExpr(Expr.Variable expr) {
    return expr.name.lexeme;
  }

  private String parenthesize(String name, Expr... exprs) {
    StringBuilder builder = new StringBuilder();

    builder.append("(").append(name);
    for (Expr expr : exprs) {
      builder.append(" ");
      builder.append(expr.accept(this));
    }
    builder.append(")");

    return builder.toString();
  }

  private String parenthesizeStatements(String name, List<Stmt> statements) {
    StringBuilder builder = new StringBuilder();

    builder.append("(").append(name);
    for (Stmt statement : statements) {
      builder.append(" ");
      builder.append(statement.accept(this));
    }
    builder.append(")");

    return builder.toString();
  }
}
