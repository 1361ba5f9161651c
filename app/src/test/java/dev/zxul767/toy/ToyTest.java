package dev.zxul767.toy;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.zxul767.toy.runtime.Interpreter;
import dev.zxul767.toy.runtime.Session;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ToyTest {
  private ByteArrayOutputStream output;
  private ByteArrayOutputStream errors;
  private Interpreter interpreter;

  @BeforeEach
  void setUp() {
    output = new ByteArrayOutputStream();
    errors = new ByteArrayOutputStream();
    interpreter = new Interpreter(new PrintStream(output, true, StandardCharsets.UTF_8));
    Errors.redirect(new PrintStream(errors, true, StandardCharsets.UTF_8));
  }

  @AfterEach
  void tearDown() {
    Errors.redirect(System.err);
    Errors.reset();
  }

  private String printed() { return output.toString(StandardCharsets.UTF_8); }

  private String reported() { return errors.toString(StandardCharsets.UTF_8); }

  @Test
  void canRunWholeProgram() {
    int status = Toy.run(
        "fn square(x) { return x * x; }\nfor (var i = 1; i <= 3; i = i + 1) print square(i);",
        interpreter
    );

    assertEquals(0, status);
    assertThat(printed().lines().toArray(String[]::new), arrayContaining("1", "4", "9"));
    assertEquals("", reported());
  }

  @Test
  void lexErrorShouldExitWithSyntaxStatus() {
    int status = Toy.run("print 1;\nprint $;", interpreter);

    assertEquals(Toy.EXIT_SYNTAX_ERROR, status);
    assertThat(reported(), startsWith("Lexing Error: [line 2] Unexpected character: <$>."));
    // nothing runs when the source can't be scanned
    assertEquals("", printed());
  }

  @Test
  void parseErrorShouldExitWithSyntaxStatus() {
    int status = Toy.run("print 1;\nvar 1 = 2;", interpreter);

    assertEquals(Toy.EXIT_SYNTAX_ERROR, status);
    assertThat(
        reported(),
        startsWith("Parsing Error: [line 2] Error at '1': Expected variable name.")
    );
    assertEquals("", printed());
  }

  @Test
  void parseErrorAtEndShouldSayso() {
    Toy.run("print 1", interpreter);

    assertThat(reported(), containsString("Error at end: Expected ';' after value."));
  }

  @Test
  void runtimeErrorShouldExitWithRuntimeStatus() {
    int status = Toy.run("print 1;\nprint missing;\nprint 2;", interpreter);

    assertEquals(Toy.EXIT_RUNTIME_ERROR, status);
    assertThat(reported(), containsString("Runtime Error: Undefined variable 'missing'."));
    assertThat(reported(), containsString("[line 2]"));
    assertThat(printed().lines().toArray(String[]::new), arrayContaining("1"));
  }

  @Test
  void submitShouldReportErrorsAndKeepSessionUsable() {
    Session session = new Session(new PrintStream(output, true, StandardCharsets.UTF_8));

    Toy.submit("var a = 1;", session);
    Toy.submit("a(;", session);
    Toy.submit("print a;", session);

    assertThat(reported(), startsWith("Parsing Error: [line 2]"));
    assertThat(printed().lines().toArray(String[]::new), arrayContaining("1"));
  }

  @Test
  void runawayRecursionShouldBeReportedAndKeepSessionUsable() {
    Session session = new Session(new PrintStream(output, true, StandardCharsets.UTF_8));

    Toy.submit("fn f(n) { return f(n + 1); } f(0);", session);
    Toy.submit("print 1;", session);

    assertThat(reported(), startsWith("Runtime Error: Stack overflow."));
    assertThat(printed().lines().toArray(String[]::new), arrayContaining("1"));
  }

  @Test
  void shouldDescribeBindingsByKind() {
    Session session = new Session(new PrintStream(output, true, StandardCharsets.UTF_8));
    session.submit("fn add(a, b) { return a + b; } var s = \"hi\"; var n = 2;");

    assertEquals("fn add = fn(a, b)", Toy.describeBinding("add", session.globals().get("add")));
    assertEquals("s = \"hi\"", Toy.describeBinding("s", "hi"));
    assertEquals("n = 2", Toy.describeBinding("n", 2.0));
    assertEquals("x = null", Toy.describeBinding("x", null));
  }
}
