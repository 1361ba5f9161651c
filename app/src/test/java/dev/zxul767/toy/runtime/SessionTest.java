package dev.zxul767.toy.runtime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.zxul767.toy.parsing.LexError;
import dev.zxul767.toy.parsing.ParseError;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionTest {
  private ByteArrayOutputStream output;
  private Session session;

  @BeforeEach
  void setUp() {
    output = new ByteArrayOutputStream();
    session = new Session(
        new PrintStream(output, /* autoFlush: */ true, StandardCharsets.UTF_8)
    );
  }

  private List<String> printedLines() {
    return output.toString(StandardCharsets.UTF_8)
        .lines()
        .collect(Collectors.toList());
  }

  @Test
  void shouldOnlyRunNewStatements() {
    session.submit("var a = 1; print a;");
    session.submit("a = a + 1;");
    session.submit("print a;");

    assertThat(printedLines(), is(Arrays.asList("1", "2")));
    assertEquals(4, session.executedCount());
  }

  @Test
  void shouldExposeGlobals() {
    session.submit("var answer = 42; fn twice(x) { return x * 2; }");

    assertThat(session.globals().keySet(), contains("answer", "twice"));
    assertEquals(42.0, session.globals().get("answer"));
    assertThat(session.globals().get("twice"), instanceOf(ToyFunction.class));
  }

  @Test
  void parseErrorShouldDiscardInput() {
    session.submit("var a = 1;");

    assertThrows(ParseError.class, () -> session.submit("print a"));
    assertThrows(LexError.class, () -> session.submit("print #;"));
    session.submit("print a;");

    assertThat(printedLines(), is(Arrays.asList("1")));
    assertEquals(2, session.executedCount());
    assertThat(session.source(), not(containsString("#")));
  }

  @Test
  void runtimeErrorShouldDiscardInputButKeepDefinitions() {
    session.submit("var a = 1;");

    assertThrows(RuntimeError.class, () -> session.submit("var b = 2; a();"));
    assertTrue(session.globals().containsKey("b"));
    assertEquals(1, session.executedCount());

    session.submit("print a;");
    assertThat(printedLines(), is(Arrays.asList("1")));
  }

  @Test
  void closuresShouldSurviveAcrossSubmissions() {
    session.submit(
        "fn counter() { var i = 0; fn next() { i = i + 1; return i; } return next; }"
    );
    session.submit("var c = counter();");
    session.submit("c();");
    session.submit("print c();");

    assertThat(printedLines(), is(Arrays.asList("2")));
  }

  @Test
  void shouldKeepLastTokensAndStatements() {
    session.submit("var a = 1;");
    session.submit("print a;");

    assertEquals(2, session.lastStatements().size());
    assertThat(session.lastTokens(), hasSize(9));
  }

  @Test
  void topLevelReturnShouldLeaveRemainingStatementsPending() {
    session.submit("var x = 1;\nreturn;\nvar y = 2;");

    assertEquals(2, session.executedCount());
    session.submit("print x + y;");

    assertThat(printedLines(), is(Arrays.asList("3")));
    assertEquals(4, session.executedCount());
  }

  @Test
  void shouldDetectUnclosedBraces() {
    assertFalse(Session.isComplete("fn f() {\n"));
    assertFalse(Session.isComplete("{ { }"));
    assertTrue(Session.isComplete("fn f() {\n return 1;\n}\n"));
    assertTrue(Session.isComplete("print 1;"));
  }

  @Test
  void bracesInStringsAndCommentsShouldNotCount() {
    assertTrue(Session.isComplete("print \"{\";"));
    assertTrue(Session.isComplete("print 1; // {"));
    assertTrue(Session.isComplete("/* { */ print 1;"));
    assertFalse(Session.isComplete("print \"} still open"));
    assertFalse(Session.isComplete("/* {"));
    // bad characters are left for `submit` to report
    assertTrue(Session.isComplete("{ @"));
  }
}
