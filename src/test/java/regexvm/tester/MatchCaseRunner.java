package regexvm.tester;

import java.util.function.Consumer;
import java.util.function.Function;
import regexvm.Regex;
import regexvm.RegexMatcher;
import regexvm.parser.RegexParseException;

/**
 * Compiles the pattern of each match case, searches its input with
 * {@code find()}, and compares the rendered result with the expected output.
 */
public class MatchCaseRunner implements Consumer<MatchCase> {

  /**
   * How patterns are compiled.
   */
  private final Function<String, Regex> compiler;

  /**
   * How outcomes are reported.
   */
  private final MatchCaseReporter reporter;

  public MatchCaseRunner(Function<String, Regex> compiler, MatchCaseReporter reporter) {
    this.compiler = compiler;
    this.reporter = reporter;
  }

  @Override
  public void accept(MatchCase matchCase) {

    // Compile the pattern
    final RegexMatcher matcher;
    try {
      matcher = compiler.apply(matchCase.pattern()).matcher(matchCase.input());
    } catch (RegexParseException error) {
      if (matchCase.output().startsWith("error")) {
        reporter.onSuccess(matchCase, true);
      } else {
        reporter.onPatternError(matchCase, error);
      }
      return;
    }

    // Try to match
    final boolean found = matcher.find();

    // Compare the outputs
    final String foundOutput = MatchCase.createOutput(found, matcher);
    if (matchCase.output().equals(foundOutput)) {
      reporter.onSuccess(matchCase, false);
    } else {
      reporter.onUnexpectedOutput(matchCase, foundOutput);
    }
  }
}
