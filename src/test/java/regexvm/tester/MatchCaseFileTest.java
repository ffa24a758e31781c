package regexvm.tester;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;
import regexvm.Regex;
import regexvm.RegexConfig;

/**
 * Runs every case in {@code MatchCases.txt} against both backends.
 */
@DisplayName("Match case file")
class MatchCaseFileTest {

  private static final String CASES = "/regexvm/MatchCases.txt";

  private static List<MatchCase> readCases() throws IOException {
    try (var reader = MatchCaseReader.fromResource(CASES)) {
      return reader.readAll();
    }
  }

  /**
   * Reporter turning the outcome of a case into an assertion failure.
   */
  private static final MatchCaseReporter FAILING_REPORTER = new MatchCaseReporter() {
    @Override
    public void onPatternError(MatchCase matchCase, Exception error) {
      fail("Unexpected error compiling " + matchCase.summary() + ": " + error.getMessage(), error);
    }

    @Override
    public void onUnexpectedOutput(MatchCase matchCase, String foundOutput) {
      fail("Unexpected output matching " + matchCase.summary()
        + ": expected '" + matchCase.output() + "' but got '" + foundOutput + "'");
    }

    @Override
    public void onSuccess(MatchCase matchCase, boolean expectedFailure) {
    }
  };

  @Test
  void caseFileIsNotEmpty() throws IOException {
    assertThat(readCases()).hasSizeGreaterThan(50);
  }

  @TestFactory
  Stream<DynamicTest> bytecodeBackend() throws IOException {
    final var runner = new MatchCaseRunner(pattern -> Regex.compile(pattern, RegexConfig.DEFAULT), FAILING_REPORTER);
    return readCases().stream()
      .map(matchCase -> DynamicTest.dynamicTest(matchCase.summary(), () -> runner.accept(matchCase)));
  }

  @TestFactory
  Stream<DynamicTest> interpretedBackend() throws IOException {
    final var runner = new MatchCaseRunner(Regex::interpreted, FAILING_REPORTER);
    return readCases().stream()
      .map(matchCase -> DynamicTest.dynamicTest(matchCase.summary(), () -> runner.accept(matchCase)));
  }

  @Test
  @DisplayName("Counting reporter sees an expected error as a success")
  void expectedErrorsCountAsSuccesses() {
    final List<String> events = new ArrayList<>();
    final var reporter = new MatchCaseReporter() {
      @Override
      public void onPatternError(MatchCase matchCase, Exception error) {
        events.add("error");
      }

      @Override
      public void onUnexpectedOutput(MatchCase matchCase, String foundOutput) {
        events.add("unexpected " + foundOutput);
      }

      @Override
      public void onSuccess(MatchCase matchCase, boolean expectedFailure) {
        events.add("success " + expectedFailure);
      }
    };
    final var runner = new MatchCaseRunner(Regex::interpreted, reporter);

    runner.accept(new MatchCase("a{4,2}", "aaa", "error", "inline", 1));
    runner.accept(new MatchCase("(a)b", "xab", "true ab 1 a", "inline", 2));
    runner.accept(new MatchCase("(a)b", "xab", "false 1", "inline", 3));
    runner.accept(new MatchCase("(a", "a", "true a 1 a", "inline", 4));

    assertThat(events).containsExactly(
      "success true",
      "success false",
      "unexpected true ab 1 a",
      "error"
    );
  }
}
