package regexvm.vm;

import java.util.Arrays;
import java.util.Optional;
import regexvm.ArrayMatchResult;
import regexvm.program.Program;

/**
 * Entry points for running programs against input text.
 */
public final class VirtualMachine {

  private VirtualMachine() { }

  /**
   * Find the leftmost match at or after an origin, using the interpreter.
   *
   * <p>Anchors are relative to the whole subject: {@code ^} only matches at
   * offset 0 and {@code $} only at the subject's length.
   *
   * @param program compiled program
   * @param subject text to search
   * @param origin offset at which the search starts
   * @return match, if there is one
   */
  public static Optional<ArrayMatchResult> match(Program program, CharSequence subject, int origin) {
    final int[] groups = new int[program.slotCount()];
    final boolean found = execute(
      new Interpreter(program),
      program,
      subject,
      0,
      subject.length(),
      origin,
      MatchMode.SEARCH,
      groups
    );
    return found ? Optional.of(new ArrayMatchResult(subject.toString(), groups)) : Optional.empty();
  }

  /**
   * Run a program over a region of the input.
   *
   * <p>In {@link MatchMode#SEARCH} mode, every start position from {@code from}
   * to the end of the region is tried in order, and the first one which
   * produces a match wins. Otherwise only {@code from} is tried.
   *
   * @param runner how to execute the program
   * @param program program being run
   * @param input text being matched
   * @param regionStart start of the region (inclusive), where {@code ^} matches
   * @param regionEnd end of the region (exclusive), where {@code $} matches
   * @param from position at which to start trying
   * @param mode how the match relates to the region
   * @param groups output array of capture slots, filled with {@code -1} if
   *   there is no match
   * @return whether a match was found
   */
  public static boolean execute(
    ProgramRunner runner,
    Program program,
    CharSequence input,
    int regionStart,
    int regionEnd,
    int from,
    MatchMode mode,
    int[] groups
  ) {
    final var backtracker = new Backtracker(program, input, regionStart, regionEnd, mode);

    int start = from;
    do {
      backtracker.startAt(start);
      if (runner.run(backtracker)) {
        backtracker.copySlots(groups);
        return true;
      }
      start++;
    } while (mode == MatchMode.SEARCH && start <= regionEnd);

    Arrays.fill(groups, -1);
    return false;
  }
}
