package dev.zxul767.toy.runtime;

import dev.zxul767.toy.parsing.Token;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// A single scope frame. Frames form a tree rooted at the global frame:
// each one points to its enclosing frame but never copies its bindings.
// A frame stays alive for as long as anything (a running block or call,
// or a closure) still references it.
public class Environment {
  public final Environment enclosing;
  private final Map<String, Object> values = new LinkedHashMap<>();

  public Environment() { this(/* enclosing: */ null); }

  public Environment(Environment enclosing) { this.enclosing = enclosing; }

  // a name can only be defined once per frame (shadowing is only possible
  // from a nested frame)
  public void define(Token name, Object value) {
    if (values.containsKey(name.lexeme)) {
      throw new RuntimeError(
          name, String.format("Variable '%s' already defined.", name.lexeme)
      );
    }
    values.put(name.lexeme, value);
  }

  public Object get(Token name) {
    Environment environment = lookup(name.lexeme);
    if (environment == null) {
      throw new RuntimeError(
          name, String.format("Undefined variable '%s'.", name.lexeme)
      );
    }
    return environment.values.get(name.lexeme);
  }

  // returns `value` so assignment can be used as an expression result
  public Object assign(Token name, Object value) {
    Environment environment = lookup(name.lexeme);
    if (environment == null) {
      throw new RuntimeError(
          name, String.format("Undefined variable '%s'.", name.lexeme)
      );
    }
    environment.values.put(name.lexeme, value);
    return value;
  }

  public boolean isDefined(String name) { return lookup(name) != null; }

  // read-only view of the bindings in this frame only (in definition order)
  public Map<String, Object> bindings() {
    return Collections.unmodifiableMap(values);
  }

  // returns the innermost frame (starting at this one) that binds `name`
  private Environment lookup(String name) {
    Environment environment = this;
    while (environment != null) {
      if (environment.values.containsKey(name))
        return environment;
      environment = environment.enclosing;
    }
    return null;
  }
}
