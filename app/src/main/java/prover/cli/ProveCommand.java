package prover.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import prover.parse.SequentParseException;
import prover.parse.SequentParser;
import prover.search.ProofResult;
import prover.search.ProofSearch;
import prover.search.SearchOptions;
import prover.search.Verdict;
import prover.sequent.Sequent;

/** Parses goals from the command line or a file, searches each and reports the verdicts. */
final class ProveCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ProveCommand.class);

  static final int EXIT_PROVED = 0;
  static final int EXIT_UNPROVED = 1;
  static final int EXIT_PARSE_ERROR = 2;
  static final int EXIT_UNDECIDED = 3;

  private final PrintStream out;
  private final PrintStream err;

  ProveCommand(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = parseArgs(args);
    List<String> goals = new ArrayList<>(options.goals());
    if (options.hasGoalFile()) {
      goals.addAll(CliParsers.readGoals(options.goalFile()));
    }
    if (goals.isEmpty()) {
      throw new IllegalArgumentException("No sequent given");
    }

    SearchOptions searchOptions = options.searchOptions();
    ProofSearch search = new ProofSearch(searchOptions);
    ProofTreePrinter printer = new ProofTreePrinter();
    List<ProofResult> results = new ArrayList<>();
    boolean parseFailure = false;

    for (String goal : goals) {
      Sequent sequent;
      try {
        sequent = SequentParser.parse(goal);
      } catch (SequentParseException e) {
        LOG.debug("Rejected goal {}", goal, e);
        err.println("Could not parse '" + goal + "': " + e.getMessage());
        parseFailure = true;
        continue;
      }
      ProofResult result = search.prove(sequent);
      results.add(result);
      if (!options.json()) {
        out.println(result.verdict() + "  " + result.goal());
        if (options.tree()) {
          out.print(printer.print(result.root()));
        }
      }
    }

    if (options.json()) {
      out.println(new JsonReportBuilder().build(results, searchOptions, options.tree()));
    }
    return exitCode(results, parseFailure);
  }

  private static int exitCode(List<ProofResult> results, boolean parseFailure) {
    if (parseFailure) {
      return EXIT_PARSE_ERROR;
    }
    boolean undecided = results.stream().anyMatch(r -> r.verdict() == Verdict.UNDECIDED);
    if (undecided) {
      return EXIT_UNDECIDED;
    }
    return results.stream().allMatch(ProofResult::isProved) ? EXIT_PROVED : EXIT_UNPROVED;
  }

  private CliOptions parseArgs(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < args.length; i++) {
      if (!args[i].startsWith("--")) {
        builder.goal(args[i]);
        continue;
      }
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = args[++i];
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    SearchOptions defaults = SearchOptions.defaults();
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--file", OptionSpec.withValue((b, raw) -> b.goalFile(Path.of(raw))));
    specs.put(
        "--max-depth",
        OptionSpec.withValue(
            (b, raw) -> b.maxDepth(CliParsers.parseInt(raw, defaults.maxDepth(), "--max-depth"))));
    specs.put(
        "--max-nodes",
        OptionSpec.withValue(
            (b, raw) -> b.maxNodes(CliParsers.parseInt(raw, defaults.maxNodes(), "--max-nodes"))));
    specs.put(
        "--time-budget-ms",
        OptionSpec.withValue(
            (b, raw) ->
                b.timeBudgetMs(
                    CliParsers.parseLong(raw, defaults.timeBudgetMs(), "--time-budget-ms"))));
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    specs.put("--tree", OptionSpec.flag(b -> b.tree(true)));
    return specs;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      int equalsIndex = raw.indexOf('=');
      if (equalsIndex > 0) {
        String option = raw.substring(0, equalsIndex);
        String value = raw.substring(equalsIndex + 1);
        return new ParsedArg(option, value.isEmpty() ? null : value);
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
