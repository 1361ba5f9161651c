package dev.zxul767.toy.runtime;

import dev.zxul767.toy.parsing.Stmt;
import java.util.List;
import java.util.stream.Collectors;

public class ToyFunction implements ToyCallable {
  private final Stmt.Function declaration;
  // the environment active where the function was declared (not where
  // it gets called): this is what makes closures lexical
  private final Environment closure;

  ToyFunction(Stmt.Function declaration, Environment closure) {
    this.declaration = declaration;
    this.closure = closure;
  }

  public String name() { return declaration.name.lexeme; }

  public List<String> parameters() {
    return declaration.params.stream()
        .map(token -> token.lexeme)
        .collect(Collectors.toList());
  }

  @Override
  public int arity() {
    return declaration.params.size();
  }

  // pre-condition: arguments.size() == arity()
  @Override
  public Object call(Interpreter interpreter, List<Object> arguments) {
    Environment environment = new Environment(closure);
    for (int i = 0; i < declaration.params.size(); i++) {
      environment.define(declaration.params.get(i), arguments.get(i));
    }
    Completion completion =
        interpreter.executeBlock(declaration.body, environment);
    if (completion.isReturning()) {
      return completion.value();
    }
    return null;
  }

  @Override
  public String toString() {
    return String.format("<fn %s>", name());
  }
}
