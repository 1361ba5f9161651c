package dev.zxul767.toy.parsing;

import java.util.List;

// All AST classes are simple data structures with no real behavior so it's
// okay for them (and their fields) to be public.
public abstract class Expr {
  public interface Visitor<R> {
    public R visitAssignExpr(Assign expr);
    public R visitBinaryExpr(Binary expr);
    public R visitCallExpr(Call expr);
    public R visitGroupingExpr(Grouping expr);
    public R visitLiteralExpr(Literal expr);
    public R visitLogicalExpr(Logical expr);
    public R visitMatchExpr(Match expr);
    public R visitUnaryExpr(Unary expr);
    public R visitVariableExpr(Variable expr);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  public static class Assign extends Expr {
    public Assign(Token name, Expr value) {
      this.name = name;
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssignExpr(this);
    }

    public final Token name;
    public final Expr value;
  }

  public static class Binary extends Expr {
    public Binary(Expr left, Token operator, Expr right) {
      this.left = left;
      this.operator = operator;
      this.right = right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinaryExpr(this);
    }

    public final Expr left;
    public final Token operator;
    public final Expr right;
  }

  public static class Call extends Expr {
    public Call(Expr callee, Token paren, List<Expr> arguments) {
      this.callee = callee;
      this.paren = paren;
      this.arguments = arguments;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCallExpr(this);
    }

    public final Expr callee;
    // closing parenthesis, kept around to report errors with a location
    public final Token paren;
    public final List<Expr> arguments;
  }

  public static class Grouping extends Expr {
    public Grouping(Expr expression) { this.expression = expression; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitGroupingExpr(this);
    }

    public final Expr expression;
  }

  public static class Literal extends Expr {
    public Literal(Object value) { this.value = value; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLiteralExpr(this);
    }

    public final Object value;
  }

  public static class Logical extends Expr {
    public Logical(Expr left, Token operator, Expr right) {
      this.left = left;
      this.operator = operator;
      this.right = right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLogicalExpr(this);
    }

    public final Expr left;
    public final Token operator;
    public final Expr right;
  }

  public static class Match extends Expr {
    public Match(Token keyword, Expr subject, List<Case> cases) {
      this.keyword = keyword;
      this.subject = subject;
      this.cases = cases;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMatchExpr(this);
    }

    public final Token keyword;
    public final Expr subject;
    public final List<Case> cases;
  }

  // a single `case pattern => body` arm of a `match` expression
  public static class Case {
    public Case(Expr pattern, Expr body) {
      this.pattern = pattern;
      this.body = body;
    }

    public final Expr pattern;
    public final Expr body;
  }

  public static class Unary extends Expr {
    public Unary(Token operator, Expr right) {
      this.operator = operator;
      this.right = right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnaryExpr(this);
    }

    public final Token operator;
    public final Expr right;
  }

  public static class Variable extends Expr {
    public Variable(Token name) { this.name = name; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVariableExpr(this);
    }

    public final Token name;
  }
}
