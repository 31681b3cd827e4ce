package prover.cli;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code Main "A & B |~ B & A"}: search one sequent and print its verdict
 *   <li>{@code Main --file goals.txt --tree}: search every line of a file, printing proof trees
 *   <li>{@code Main --json --max-depth 20 "..."}: JSON report with a tighter depth bound
 * </ul>
 *
 * <p>Exit codes: 0 all proved, 1 some goal unproved, 2 a goal did not parse, 3 a search bound was
 * hit, 64 bad arguments, 74 the goal file could not be read.
 */
public final class Main {
  static final int EXIT_USAGE = 64;
  static final int EXIT_IO = 74;

  private static final String USAGE =
      "Usage: prover [--file PATH] [--max-depth N] [--max-nodes N] [--time-budget-ms MS]"
          + " [--json] [--tree] [SEQUENT...]";

  private Main() {}

  public static void main(String[] args) {
    int code = run(args, System.out, System.err);
    if (code != 0) {
      System.exit(code);
    }
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    try {
      return new ProveCommand(out, err).execute(args == null ? new String[0] : args);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return EXIT_USAGE;
    } catch (IOException e) {
      err.println("Could not read goals: " + e.getMessage());
      return EXIT_IO;
    }
  }
}
