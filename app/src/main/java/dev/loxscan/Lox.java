package dev.loxscan;

import dev.loxscan.parsing.ScanResult;
import dev.loxscan.parsing.Scanner;
import dev.loxscan.parsing.Token;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
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

// Command-line driver: scans a script (or each line typed at the prompt) and
// prints the resulting tokens, one per line.
public class Lox {
  // exit codes follow the BSD sysexits.h conventions
  static final int EX_USAGE = 64;
  static final int EX_DATAERR = 65;

  private final PrintStream out;
  private final ErrorReporter reporter;
  private boolean hadError = false;

  Lox(PrintStream out, ErrorReporter reporter) {
    this.out = out;
    this.reporter = reporter;
  }

  public static void main(String[] args) throws IOException {
    if (args.length > 1) {
      System.out.println("Usage: lox [script]");
      System.exit(EX_USAGE);
    } else if (args.length == 1) {
      Lox lox = new Lox(System.out, new ConsoleErrorReporter());
      int status = lox.runFile(Paths.get(args[0]));
      if (status != 0)
        System.exit(status);
    } else {
      // in REPL mode errors and tokens go through the same channel, otherwise
      // the two streams can interleave and make the prompt look like it has
      // vanished
      Lox lox = new Lox(System.out, new ConsoleErrorReporter(System.out));
      lox.runPrompt();
    }
  }

  // returns the process exit status for the script at `path`
  int runFile(Path path) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    run(new String(bytes, StandardCharsets.UTF_8));
    return hadError ? EX_DATAERR : 0;
  }

  private void runPrompt() throws IOException {
    try (Terminal terminal = TerminalBuilder.builder().build()) {
      showBannerAndHelp(terminal);

      LineReader reader = createReplReader(terminal);
      while (true) {
        String line;
        try {
          line = reader.readLine("> ");
        } catch (UserInterruptException | EndOfFileException e) {
          break;
        }

        if (line.trim().equals("quit"))
          break;
        if (line.trim().isEmpty())
          continue;

        runLine(line);
      }
    }
  }

  // Runs one line of an interactive session. A mistake on one line doesn't
  // kill the session: the error flag is cleared before the next line.
  ScanResult runLine(String line) {
    ScanResult result = run(line);
    hadError = false;
    return result;
  }

  ScanResult run(String source) {
    ScanResult result = Scanner.scan(source, reporter);
    for (Token token : result.tokens()) {
      out.println(token);
    }
    out.flush();

    hadError = result.hadError();
    return result;
  }

  boolean hadError() { return hadError; }

  private static void showBannerAndHelp(Terminal terminal) {
    String banner =
        new AttributedStringBuilder()
            .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
            .style(AttributedStyle.BOLD)
            .append("Welcome to the Lox scanner. Type some code to see its tokens.")
            .style(AttributedStyle.DEFAULT)
            .toAnsi();
    terminal.writer().println(banner);

    terminal.writer().println("- Type \"quit\" to quit. (or use «ctrl-d»)");
    terminal.writer().println("- Use «tab» for keyword completion");
    terminal.writer().println("- Use «ctrl-r» to search the history");
    terminal.writer().println();

    terminal.writer().flush();
  }

  private static LineReader createReplReader(Terminal terminal) {
    // provide completions (triggered via TAB) for all keywords
    Completer completer = new AggregateCompleter(
        new StringsCompleter("quit"),
        new StringsCompleter(Scanner.keywords.keySet())
    );

    return LineReaderBuilder.builder()
        .terminal(terminal)
        .parser(new DefaultParser())
        .completer(completer)
        .build();
  }
}
