package regexvm.vm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import regexvm.ArrayMatchResult;
import regexvm.ArrayMatchResult.Span;
import regexvm.compiler.Compiler;
import regexvm.parser.RegexParser;
import regexvm.program.Program;

@DisplayName("Virtual machine")
class VirtualMachineTest {

  private static Program compile(String pattern) {
    return Compiler.compile(RegexParser.parse(pattern));
  }

  private static Optional<ArrayMatchResult> match(String pattern, String subject) {
    return VirtualMachine.match(compile(pattern), subject, 0);
  }

  private static int[] execute(String pattern, String input, int regionStart, int regionEnd, int from, MatchMode mode) {
    final Program program = compile(pattern);
    final int[] groups = new int[program.slotCount()];
    final boolean found = VirtualMachine.execute(
      new Interpreter(program),
      program,
      input,
      regionStart,
      regionEnd,
      from,
      mode,
      groups
    );
    return found ? groups : null;
  }

  @Test
  void literalPatternMatchesItself() {
    final ArrayMatchResult result = match("hello", "hello").orElseThrow();

    assertThat(result.group()).isEqualTo("hello");
    assertThat(result.spans()).containsExactly(new Span(0, 5));
  }

  @Test
  void findsLeftmostMatch() {
    final ArrayMatchResult result = match("b+", "aabbbab").orElseThrow();

    assertThat(result.start()).isEqualTo(2);
    assertThat(result.end()).isEqualTo(5);
  }

  @Test
  void searchStartsAtOrigin() {
    final ArrayMatchResult result = VirtualMachine.match(compile("a"), "aXa", 1).orElseThrow();

    assertThat(result.start()).isEqualTo(2);
  }

  @Test
  void startAnchorIsRelativeToWholeSubject() {
    assertThat(VirtualMachine.match(compile("^a"), "aa", 0)).isPresent();
    assertThat(VirtualMachine.match(compile("^a"), "aa", 1)).isEmpty();
    assertThat(VirtualMachine.match(compile("a$"), "aa", 0).orElseThrow().start()).isEqualTo(1);
  }

  @Test
  void starMatchesEmptySubject() {
    assertThat(match("a*", "").orElseThrow().spans()).containsExactly(new Span(0, 0));
    assertThat(match("a+", "")).isEmpty();
  }

  @Test
  void greedinessDecidesBetweenEqualStarts() {
    assertThat(match("a?", "a").orElseThrow().group()).isEqualTo("a");
    assertThat(match("a??", "a").orElseThrow().group()).isEmpty();
    assertThat(match("(a|ab)", "ab").orElseThrow().group(1)).isEqualTo("a");
  }

  @Test
  void captureOffsets() {
    assertThat(match("(a)(b)", "ab").orElseThrow().spans()).containsExactly(
      new Span(0, 2),
      new Span(0, 1),
      new Span(1, 2)
    );
  }

  @Test
  void abandonedBranchesDoNotLeakSlots() {
    final ArrayMatchResult result = match("(a)x|(a)y", "ay").orElseThrow();

    assertThat(result.spans()).containsExactly(
      new Span(0, 2),
      new Span(-1, -1),
      new Span(0, 1)
    );
    assertThat(result.group(1)).isNull();
    assertThat(result.spans().get(1).isSet()).isFalse();
  }

  @Test
  void lastIterationWinsInsideLoops() {
    assertThat(match("(a|b)+", "abba").orElseThrow().group(1)).isEqualTo("a");
    assertThat(match("(a(b)?)+", "aba").orElseThrow().group(2)).isEqualTo("b");
  }

  @Test
  void fullModeMustReachRegionEnd() {
    assertThat(execute("a{2,4}", "aaaaa", 0, 5, 0, MatchMode.FULL)).isNull();
    assertThat(execute("a{2,4}", "aaaa", 0, 4, 0, MatchMode.FULL)).containsExactly(0, 4);
    assertThat(execute("a{2,4}", "a", 0, 1, 0, MatchMode.FULL)).isNull();
    assertThat(execute("a|ab", "ab", 0, 2, 0, MatchMode.FULL)).containsExactly(0, 2);
  }

  @Test
  void prefixModeAnchorsOnlyTheStart() {
    assertThat(execute("a+", "aab", 0, 3, 0, MatchMode.PREFIX)).containsExactly(0, 2);
    assertThat(execute("a+", "baa", 0, 3, 0, MatchMode.PREFIX)).isNull();
  }

  @Test
  void regionBoundsActAsAnchors() {
    assertThat(execute("^b+$", "abbc", 1, 3, 1, MatchMode.SEARCH)).containsExactly(1, 3);
    assertThat(execute("b", "abbc", 0, 1, 0, MatchMode.SEARCH)).isNull();
  }

  @Test
  void failureFillsGroupsWithUnset() {
    final Program program = compile("(x)");
    final int[] groups = {7, 7, 7, 7};

    assertThat(VirtualMachine.execute(new Interpreter(program), program, "abc", 0, 3, 0, MatchMode.SEARCH, groups))
      .isFalse();
    assertThat(groups).containsOnly(-1);
  }

  @ParameterizedTest
  @ValueSource(strings = {"(a*)*b", "(a|a)*c", "(|a)*b", "(a?)*?b", "((a*)*|b)*c", "(a*)+$b"})
  @Timeout(value = 10, unit = TimeUnit.SECONDS)
  void pathologicalPatternsTerminate(String pattern) {
    final String subject = "a".repeat(2000) + "!";

    assertThat(match(pattern, subject)).isEmpty();
  }

  /**
   * Subject of {@code y}s ending in a run of {@code x}s, without materializing it.
   */
  private record RepeatedChars(int length, int trailingXs) implements CharSequence {

    @Override
    public char charAt(int index) {
      return index >= length - trailingXs ? 'x' : 'y';
    }

    @Override
    public CharSequence subSequence(int start, int end) {
      return new StringBuilder(end - start).append(this, start, end);
    }

    @Override
    public String toString() {
      return new StringBuilder(length).append(this, 0, length).toString();
    }
  }

  @Test
  @Timeout(value = 30, unit = TimeUnit.SECONDS)
  void longSubjectsWithLargeProgramsAreSearched() {
    final Program program = compile("x{1000}");
    final int length = 2_200_000;
    assertThat((long) program.size() * (length + 1)).isGreaterThan(Integer.MAX_VALUE);

    assertThat(VirtualMachine.match(program, new RepeatedChars(length, 0), 0)).isEmpty();

    final ArrayMatchResult result = VirtualMachine.match(program, new RepeatedChars(length, 1000), 0).orElseThrow();
    assertThat(result.start()).isEqualTo(length - 1000);
    assertThat(result.end()).isEqualTo(length);
  }

  @Test
  void emptyLoopBodyTerminates() {
    final ArrayMatchResult result = match("(|a)*", "aa").orElseThrow();

    assertThat(result.group()).isEqualTo("aa");
  }

  @Test
  void originOutsideSubjectIsRejected() {
    assertThatThrownBy(() -> VirtualMachine.match(compile("a"), "abc", 4))
      .isInstanceOf(IndexOutOfBoundsException.class);
  }
}
