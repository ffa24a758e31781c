package regexvm.compiler;

import java.util.ArrayList;
import java.util.List;
import regexvm.program.Instruction;

/**
 * Relocatable piece of a program.
 *
 * <p>Addresses in the code are relative to the start of the fragment, and the
 * address just past the last instruction is where control continues once the
 * fragment has matched.
 *
 * @param code instructions, with fragment-relative addresses
 * @param captureCount one more than the largest group index in the fragment
 */
record Fragment(List<Instruction> code, int captureCount) {

  static final Fragment EMPTY = new Fragment(List.of(), 0);

  static Fragment of(Instruction instruction) {
    return new Fragment(List.of(instruction), 0);
  }

  int size() {
    return code.size();
  }

  /**
   * Append the code of a fragment to a buffer, shifting its addresses to
   * wherever the buffer currently ends.
   */
  void appendTo(List<Instruction> buffer) {
    final int delta = buffer.size();
    for (Instruction instruction : code) {
      buffer.add(instruction.relocate(delta));
    }
  }

  /**
   * Start a buffer with room for this fragment and some extra instructions.
   */
  List<Instruction> buffer(int extra) {
    return new ArrayList<>(code.size() + extra);
  }
}
