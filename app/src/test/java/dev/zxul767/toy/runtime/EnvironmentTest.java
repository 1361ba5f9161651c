package dev.zxul767.toy.runtime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.zxul767.toy.parsing.Token;
import dev.zxul767.toy.parsing.TokenType;
import org.junit.jupiter.api.Test;

class EnvironmentTest {
  private static Token name(String lexeme) {
    return new Token(TokenType.IDENTIFIER, lexeme);
  }

  @Test
  void canDefineAndGetVariables() {
    Environment environment = new Environment();
    environment.define(name("a"), 1.0);

    assertEquals(1.0, environment.get(name("a")));
  }

  @Test
  void redefiningInSameFrameShouldFail() {
    Environment environment = new Environment();
    environment.define(name("a"), 1.0);

    RuntimeError error = assertThrows(
        RuntimeError.class, () -> environment.define(name("a"), 2.0)
    );
    assertEquals("a", error.token.lexeme);
    assertEquals(1.0, environment.get(name("a")));
  }

  @Test
  void childFrameShouldShadowWithoutTouchingParent() {
    Environment parent = new Environment();
    parent.define(name("a"), 1.0);
    Environment child = new Environment(parent);
    child.define(name("a"), 2.0);

    assertEquals(2.0, child.get(name("a")));
    assertEquals(1.0, parent.get(name("a")));
  }

  @Test
  void childFrameShouldStartEmpty() {
    Environment parent = new Environment();
    parent.define(name("a"), 1.0);
    Environment child = new Environment(parent);

    assertThat(child.bindings().entrySet(), is(empty()));
    assertEquals(1.0, child.get(name("a")));
  }

  @Test
  void assignShouldUpdateInnermostBinding() {
    Environment global = new Environment();
    global.define(name("a"), 1.0);
    Environment inner = new Environment(new Environment(global));

    Object result = inner.assign(name("a"), 5.0);

    assertEquals(5.0, result);
    assertEquals(5.0, global.get(name("a")));
    assertThat(inner.bindings().entrySet(), is(empty()));
  }

  @Test
  void unknownNamesShouldFail() {
    Environment environment = new Environment(new Environment());

    assertThrows(RuntimeError.class, () -> environment.get(name("missing")));
    assertThrows(
        RuntimeError.class, () -> environment.assign(name("missing"), 1.0)
    );
    assertFalse(environment.isDefined("missing"));
  }

  @Test
  void nullShouldBeAValidValue() {
    Environment environment = new Environment();
    environment.define(name("nothing"), null);

    assertTrue(environment.isDefined("nothing"));
    assertNull(environment.get(name("nothing")));
  }

  @Test
  void bindingsShouldBeReadOnly() {
    Environment environment = new Environment();
    environment.define(name("a"), 1.0);
    environment.define(name("b"), 2.0);

    assertThat(environment.bindings().keySet(), contains("a", "b"));
    assertThrows(
        UnsupportedOperationException.class,
        () -> environment.bindings().put("c", 3.0)
    );
  }
}
