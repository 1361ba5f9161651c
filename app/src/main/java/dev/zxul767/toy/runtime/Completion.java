package dev.zxul767.toy.runtime;

// Outcome of executing a statement. A `return` doesn't unwind the Java
// stack: it produces a returning completion that every statement running
// sub-statements (blocks, ifs, loops) hands straight back to its caller,
// until a function call boundary consumes it.
final class Completion {
  static final Completion NORMAL = new Completion(false, null);

  private final boolean returning;
  private final Object value;

  private Completion(boolean returning, Object value) {
    this.returning = returning;
    this.value = value;
  }

  static Completion returning(Object value) {
    return new Completion(true, value);
  }

  boolean isReturning() { return returning; }

  // only meaningful for returning completions
  Object value() { return value; }
}
