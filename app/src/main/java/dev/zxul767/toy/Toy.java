package dev.zxul767.toy;

import dev.zxul767.toy.parsing.AstPrinter;
import dev.zxul767.toy.parsing.LexError;
import dev.zxul767.toy.parsing.Lexer;
import dev.zxul767.toy.parsing.ParseError;
import dev.zxul767.toy.parsing.Parser;
import dev.zxul767.toy.parsing.Stmt;
import dev.zxul767.toy.parsing.Token;
import dev.zxul767.toy.runtime.Interpreter;
import dev.zxul767.toy.runtime.RuntimeError;
import dev.zxul767.toy.runtime.Session;
import dev.zxul767.toy.runtime.ToyFunction;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.AggregateCompleter;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

public class Toy {
  static final int EXIT_USAGE = 64;
  static final int EXIT_SYNTAX_ERROR = 65;
  static final int EXIT_RUNTIME_ERROR = 70;

  private static final String PROMPT = ">>> ";
  private static final String CONTINUATION_PROMPT = "... ";

  public static void main(String[] args) throws IOException {
    if (args.length > 1) {
      System.out.println("Usage: toy [script]");
      System.exit(EXIT_USAGE);
    } else if (args.length == 1) {
      runFile(args[0]);
    } else {
      runPrompt();
    }
  }

  private static void runFile(String path) throws IOException {
    byte[] bytes = Files.readAllBytes(Paths.get(path));
    int status = run(
        new String(bytes, StandardCharsets.UTF_8), new Interpreter(System.out)
    );
    if (status != 0)
      System.exit(status);
  }

  // Runs a whole source unit and returns the process exit status it
  // deserves (0 when everything went fine).
  static int run(String source, Interpreter interpreter) {
    Errors.reset();
    try {
      List<Token> tokens = Lexer.tokenize(source);
      List<Stmt> statements = Parser.parse(tokens);
      interpreter.interpret(statements);
    } catch (LexError error) {
      Errors.lexError(error);
    } catch (ParseError error) {
      Errors.parseError(error);
    } catch (RuntimeError error) {
      Errors.runtimeError(error);
    }
    if (Errors.hadError)
      return EXIT_SYNTAX_ERROR;
    if (Errors.hadRuntimeError)
      return EXIT_RUNTIME_ERROR;
    return 0;
  }

  private static void runPrompt() throws IOException {
    Terminal terminal = TerminalBuilder.builder().build();
    showBannerAndHelp(terminal);

    // errors and output must go through the same channel or else they can
    // interleave in confusing ways with the prompt
    System.setErr(System.out);
    Errors.redirect(System.out);

    Session session = new Session(System.out);
    LineReader reader = createReplReader(terminal);
    StringBuilder buffer = new StringBuilder();
    while (true) {
      try {
        String prompt = buffer.length() == 0 ? PROMPT : CONTINUATION_PROMPT;
        String line = reader.readLine(prompt);
        if (line == null)
          break;
        line = line.trim();

        if (buffer.length() == 0) {
          if (line.equals("quit"))
            break;
          if (line.isEmpty())
            continue;
          if (line.startsWith(":")) {
            runCommand(line, session);
            continue;
          }
        }

        buffer.append(line).append("\n");
        if (!Session.isComplete(buffer.toString()))
          continue;

        submit(buffer.toString(), session);
        buffer.setLength(0);

        // if the user makes a mistake, we don't kill the session
        Errors.reset();

      } catch (UserInterruptException e) {
        break;
      } catch (EndOfFileException e) {
        break;
      }
    }
  }

  static void submit(String input, Session session) {
    try {
      session.submit(input);
    } catch (LexError error) {
      Errors.lexError(error);
    } catch (ParseError error) {
      Errors.parseError(error);
    } catch (RuntimeError error) {
      Errors.runtimeError(error);
    }
  }

  static void runCommand(String command, Session session) {
    PrintStream out = System.out;
    switch (command) {
    case ":env":
      for (Map.Entry<String, Object> entry : session.globals().entrySet()) {
        out.println(describeBinding(entry.getKey(), entry.getValue()));
      }
      break;
    case ":tokens":
      for (Token token : session.lastTokens()) {
        out.println(token);
      }
      break;
    case ":ast":
      out.println(new AstPrinter().print(session.lastStatements()));
      break;
    default:
      out.println(String.format(
          "Unknown command: %s (try :env, :tokens or :ast)", command
      ));
    }
  }

  static String describeBinding(String name, Object value) {
    if (value instanceof ToyFunction) {
      ToyFunction function = (ToyFunction)value;
      return String.format(
          "fn %s = fn(%s)", name, String.join(", ", function.parameters())
      );
    }
    if (value instanceof String) {
      return String.format("%s = \"%s\"", name, value);
    }
    return String.format("%s = %s", name, Interpreter.stringify(value));
  }

  private static void showBannerAndHelp(Terminal terminal) {
    /* clang-format off */
    String banner =
          ""
          + "       __" + "\n"
          + "   ___( o)>" + "\n"
          + "   \\ <_. )" + "\n"
          + "    `---'" + "\n";
    /* clang-format on */
    String logo =
        new AttributedStringBuilder()
            .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
            .style(AttributedStyle.BOLD)
            .append(banner)
            .append("Welcome to the Toy REPL.")
            .style(AttributedStyle.DEFAULT)
            .toAnsi();
    terminal.writer().println(logo);

    terminal.writer().println("- Type \"quit\" to quit. (or use «ctrl-d»)");
    terminal.writer().println(
        "- Unclosed '{' keeps reading lines until it's closed"
    );
    terminal.writer().println(
        "- :env lists global variables, :tokens / :ast inspect the last input"
    );
    terminal.writer().println("- Use «tab» for word completion");
    terminal.writer().println("- Use «ctrl-r» to search the history");
    terminal.writer().println();

    terminal.writer().flush();
  }

  private static LineReader createReplReader(Terminal terminal) {
    // provide completions (triggered via TAB) for all keywords & commands
    Completer completer = new AggregateCompleter(
        new StringsCompleter("quit", ":env", ":tokens", ":ast"),
        new StringsCompleter(Lexer.keywords.keySet())
    );

    DefaultParser parser = new DefaultParser();

    LineReader reader = LineReaderBuilder.builder()
                            .terminal(terminal)
                            .parser(parser)
                            .completer(completer)
                            .build();
    return reader;
  }
}
