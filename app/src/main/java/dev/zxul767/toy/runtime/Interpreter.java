package dev.zxul767.toy.runtime;

import dev.zxul767.toy.parsing.*;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

// Tree-walking evaluator. Every name is resolved at run time by walking the
// environment chain outward from `environment`, which is swapped in and out
// around block and call boundaries.
//
// None of the errors raised here are handled locally: a `RuntimeError`
// aborts whatever `interpret`/`execute`/`evaluate` call is in progress.
public class Interpreter
    implements Expr.Visitor<Object>, Stmt.Visitor<Completion> {
  private final Environment globals = new Environment();
  private Environment environment = globals;
  private final PrintStream out;

  public Interpreter() { this(System.out); }

  public Interpreter(PrintStream out) { this.out = out; }

  public void interpret(List<Stmt> statements) { interpret(statements, 0); }

  // runs `statements[startIndex:]` against the (persistent) global
  // environment; a top-level `return` stops the run early
  //
  // returns the index right after the last statement that was executed
  public int interpret(List<Stmt> statements, int startIndex) {
    for (int i = startIndex; i < statements.size(); i++) {
      if (execute(statements.get(i)).isReturning())
        return i + 1;
    }
    return Math.max(startIndex, statements.size());
  }

  public Object evaluate(Expr expression) { return expression.accept(this); }

  Completion execute(Stmt stmt) { return stmt.accept(this); }

  public Environment globals() { return globals; }

  Completion executeBlock(List<Stmt> statements, Environment environment) {
    Environment previous = this.environment;
    try {
      this.environment = environment;
      for (Stmt statement : statements) {
        Completion completion = execute(statement);
        if (completion.isReturning())
          return completion;
      }
      return Completion.NORMAL;
    } finally {
      this.environment = previous;
    }
  }

  @Override
  public Completion visitBlockStmt(Stmt.Block stmt) {
    return executeBlock(stmt.statements, new Environment(environment));
  }

  @Override
  public Completion visitExpressionStmt(Stmt.Expression stmt) {
    evaluate(stmt.expression);
    return Completion.NORMAL;
  }

  @Override
  public Completion visitFunctionStmt(Stmt.Function stmt) {
    // the closure gets its own frame (chained to the current one) so that
    // binding parameters later never pollutes the declaring scope; the
    // name itself goes in the current frame so the function can call itself
    ToyFunction function = new ToyFunction(stmt, new Environment(environment));
    environment.define(stmt.name, function);
    return Completion.NORMAL;
  }

  @Override
  public Completion visitIfStmt(Stmt.If stmt) {
    if (isTruthy(evaluate(stmt.condition))) {
      return execute(stmt.thenBranch);
    } else if (stmt.elseBranch != null) {
      return execute(stmt.elseBranch);
    }
    return Completion.NORMAL;
  }

  @Override
  public Completion visitPrintStmt(Stmt.Print stmt) {
    Object value = evaluate(stmt.expression);
    out.println(stringify(value));
    return Completion.NORMAL;
  }

  @Override
  public Completion visitReturnStmt(Stmt.Return stmt) {
    Object value = null;
    if (stmt.value != null)
      value = evaluate(stmt.value);
    return Completion.returning(value);
  }

  @Override
  public Completion visitVarStmt(Stmt.Var stmt) {
    Object value = null;
    if (stmt.initializer != null) {
      value = evaluate(stmt.initializer);
    }
    environment.define(stmt.name, value);
    return Completion.NORMAL;
  }

  @Override
  public Completion visitWhileStmt(Stmt.While stmt) {
    while (isTruthy(evaluate(stmt.condition))) {
      Completion completion = execute(stmt.body);
      if (completion.isReturning())
        return completion;
    }
    return Completion.NORMAL;
  }

  @Override
  public Object visitAssignExpr(Expr.Assign expr) {
    Object value = evaluate(expr.value);
    return environment.assign(expr.name, value);
  }

  @Override
  public Object visitBinaryExpr(Expr.Binary expr) {
    Object left = evaluate(expr.left);
    Object right = evaluate(expr.right);

    switch (expr.operator.type) {
    case GREATER:
      checkNumberOperands(expr.operator, left, right);
      return (double)left > (double)right;
    case GREATER_EQUAL:
      checkNumberOperands(expr.operator, left, right);
      return (double)left >= (double)right;
    case LESS:
      checkNumberOperands(expr.operator, left, right);
      return (double)left < (double)right;
    case LESS_EQUAL:
      checkNumberOperands(expr.operator, left, right);
      return (double)left <= (double)right;
    case MINUS:
      checkNumberOperands(expr.operator, left, right);
      return (double)left - (double)right;
    case PLUS:
      if (left instanceof Double && right instanceof Double) {
        return (double)left + (double)right;
      }
      if (left instanceof String && right instanceof String) {
        return (String)left + (String)right;
      }
      throw new RuntimeError(
          expr.operator, "Operands must be two numbers or two strings."
      );
    case SLASH:
      checkNumberOperands(expr.operator, left, right);
      if ((double)right == 0.0) {
        throw new RuntimeError(expr.operator, "Division by zero.");
      }
      return (double)left / (double)right;
    case STAR:
      checkNumberOperands(expr.operator, left, right);
      return (double)left * (double)right;
    case BANG_EQUAL:
      return !isEqual(left, right);
    case EQUAL_EQUAL:
      return isEqual(left, right);
    default:
      throw new RuntimeError(
          expr.operator,
          String.format("Unknown binary operator '%s'.", expr.operator.lexeme)
      );
    }
  }

  @Override
  public Object visitCallExpr(Expr.Call expr) {
    Object callee = evaluate(expr.callee);
    if (!(callee instanceof ToyCallable)) {
      throw new RuntimeError(expr.paren, "Can only call functions.");
    }
    List<Object> args = new ArrayList<>();
    for (Expr arg : expr.arguments) {
      args.add(evaluate(arg));
    }
    ToyCallable function = (ToyCallable)callee;
    if (args.size() != function.arity()) {
      throw new RuntimeError(
          expr.paren, String.format(
                          "Expected %d arguments but got %d.",
                          function.arity(), args.size()
                      )
      );
    }
    try {
      return function.call(this, args);
    } catch (StackOverflowError error) {
      // runaway recursion; the innermost call reports it and every outer
      // call just lets the `RuntimeError` through
      throw new RuntimeError(expr.paren, "Stack overflow.");
    }
  }

  @Override
  public Object visitGroupingExpr(Expr.Grouping expr) {
    return evaluate(expr.expression);
  }

  @Override
  public Object visitLiteralExpr(Expr.Literal expr) {
    return expr.value;
  }

  @Override
  public Object visitLogicalExpr(Expr.Logical expr) {
    Object left = evaluate(expr.left);
    if (expr.operator.type == TokenType.OR) {
      if (isTruthy(left))
        return left;
    } else /* TokenType.AND */ {
      if (!isTruthy(left))
        return left;
    }
    return evaluate(expr.right);
  }

  @Override
  public Object visitMatchExpr(Expr.Match expr) {
    Object subject = evaluate(expr.subject);
    for (Expr.Case matchCase : expr.cases) {
      if (isEqual(subject, evaluate(matchCase.pattern))) {
        return evaluate(matchCase.body);
      }
    }
    throw new RuntimeError(
        expr.keyword,
        String.format("No match for value: %s", stringify(subject))
    );
  }

  @Override
  public Object visitUnaryExpr(Expr.Unary expr) {
    Object right = evaluate(expr.right);
    switch (expr.operator.type) {
    case BANG:
      return !isTruthy(right);
    case MINUS:
      checkNumberOperand(expr.operator, right);
      return -(double)right;
    default:
      throw new RuntimeError(
          expr.operator,
          String.format("Unknown unary operator '%s'.", expr.operator.lexeme)
      );
    }
  }

  @Override
  public Object visitVariableExpr(Expr.Variable expr) {
    return environment.get(expr.name);
  }

  private void checkNumberOperand(Token operator, Object operand) {
    if (operand instanceof Double)
      return;
    throw new RuntimeError(operator, "Operand must be a number.");
  }

  private void checkNumberOperands(Token operator, Object left, Object right) {
    if (left instanceof Double && right instanceof Double)
      return;
    throw new RuntimeError(operator, "Operands must be numbers.");
  }

  // `null` and `false` are falsy; everything else is truthy
  static boolean isTruthy(Object object) {
    if (object == null)
      return false;
    if (object instanceof Boolean)
      return (boolean)object;
    return true;
  }

  // values of different types are simply unequal (never an error);
  // functions are only equal to themselves
  static boolean isEqual(Object a, Object b) {
    if (a == null && b == null)
      return true;
    if (a == null)
      return false;
    // `Double.equals` tells 0.0 and -0.0 apart
    if (a instanceof Double && b instanceof Double)
      return (double)a == (double)b;
    return a.equals(b);
  }

  public static String stringify(Object object) {
    if (object == null)
      return "null";

    if (object instanceof Double) {
      double number = (double)object;
      if (Double.isNaN(number) || Double.isInfinite(number))
        return object.toString();
      // never in scientific notation, and no trailing ".0"
      return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }
    return object.toString();
  }
}
