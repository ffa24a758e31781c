package regexvm.vm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import regexvm.compiler.Compiler;
import regexvm.parser.RegexParser;
import regexvm.program.Program;

class BacktrackerTest {

  private final Program program = Compiler.compile(RegexParser.parse("(a)[bc]"));

  @Test
  void statesAreEnteredOnce() {
    final var backtracker = new Backtracker(program, "abc", 0, 3, MatchMode.SEARCH);
    backtracker.startAt(0);
    assertThat(backtracker.resume()).isTrue();

    assertThat(backtracker.enter(0)).isTrue();
    assertThat(backtracker.enter(0)).isFalse();
    assertThat(backtracker.enter(1)).isTrue();

    assertThat(backtracker.consume('a')).isTrue();
    assertThat(backtracker.enter(0)).isTrue();
  }

  @Test
  void forkedThreadsKeepTheirOwnSlots() {
    final var backtracker = new Backtracker(program, "ab", 0, 2, MatchMode.SEARCH);
    final int[] slots = new int[program.slotCount()];
    backtracker.startAt(0);
    backtracker.resume();

    backtracker.save(0);
    backtracker.fork(5);
    backtracker.consume('a');
    backtracker.save(1);
    backtracker.copySlots(slots);
    assertThat(slots).startsWith(0, 1);

    assertThat(backtracker.resume()).isTrue();
    assertThat(backtracker.pc()).isEqualTo(5);
    assertThat(backtracker.position()).isZero();
    backtracker.copySlots(slots);
    assertThat(slots).startsWith(0, -1);
    assertThat(backtracker.resume()).isFalse();
  }

  @Test
  void consumingStopsAtRegionEnd() {
    final var backtracker = new Backtracker(program, "abc", 0, 1, MatchMode.SEARCH);
    backtracker.startAt(0);
    backtracker.resume();

    assertThat(backtracker.consumeAny()).isTrue();
    assertThat(backtracker.atEnd()).isTrue();
    assertThat(backtracker.consumeAny()).isFalse();
    assertThat(backtracker.consume('b')).isFalse();
  }

  @Test
  void classesAreLookedUpByProgramCounter() {
    final var backtracker = new Backtracker(program, "c", 0, 1, MatchMode.SEARCH);
    backtracker.startAt(0);
    backtracker.resume();

    assertThat(backtracker.consumeClass(4)).isTrue();
  }

  @Test
  void fullModeOnlyAcceptsAtRegionEnd() {
    final var backtracker = new Backtracker(program, "ab", 0, 2, MatchMode.FULL);
    backtracker.startAt(0);
    backtracker.resume();

    assertThat(backtracker.accept()).isFalse();
    backtracker.consumeAny();
    backtracker.consumeAny();
    assertThat(backtracker.accept()).isTrue();
  }

  @Test
  void rejectsRegionsOutsideInput() {
    assertThatThrownBy(() -> new Backtracker(program, "ab", 1, 3, MatchMode.SEARCH))
      .isInstanceOf(IndexOutOfBoundsException.class);
    assertThatThrownBy(() -> new Backtracker(program, "ab", 2, 1, MatchMode.SEARCH))
      .isInstanceOf(IndexOutOfBoundsException.class);
  }
}
