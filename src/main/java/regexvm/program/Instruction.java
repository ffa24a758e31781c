package regexvm.program;

import regexvm.util.CharRange;
import regexvm.util.CharRangeTree;

/**
 * Instruction of the backtracking virtual machine.
 *
 * <p>Addresses are indices into the enclosing {@link Program}. Consuming
 * instructions advance both the position in the input and the program counter
 * by one; the others move only the program counter.
 */
public sealed interface Instruction {

  /**
   * Shift every address in this instruction by a constant.
   *
   * <p>Used when splicing code generated for a subtree into a larger program.
   *
   * @param delta amount to add to each address
   * @return relocated instruction
   */
  default Instruction relocate(int delta) {
    return this;
  }

  Instruction MATCH_ANY = new MatchAny();
  Instruction CHECK_START = new CheckStart();
  Instruction CHECK_END = new CheckEnd();
  Instruction ACCEPT = new Accept();

  /**
   * Consume one specific code unit.
   */
  record MatchLiteral(char value) implements Instruction {
    @Override
    public String toString() {
      return "char " + CharRange.single(value).compactString();
    }
  }

  /**
   * Consume any one code unit.
   */
  record MatchAny() implements Instruction {
    @Override
    public String toString() {
      return "any";
    }
  }

  /**
   * Consume one code unit in a set.
   */
  record MatchClass(CharRangeTree ranges) implements Instruction {
    @Override
    public String toString() {
      return "class " + ranges;
    }
  }

  /**
   * Continue at {@code primary}, trying {@code secondary} only if that fails.
   */
  record Split(int primary, int secondary) implements Instruction {
    @Override
    public Instruction relocate(int delta) {
      return new Split(primary + delta, secondary + delta);
    }

    @Override
    public String toString() {
      return "split " + primary + ", " + secondary;
    }
  }

  /**
   * Continue at {@code target}.
   */
  record Jump(int target) implements Instruction {
    @Override
    public Instruction relocate(int delta) {
      return new Jump(target + delta);
    }

    @Override
    public String toString() {
      return "jump " + target;
    }
  }

  /**
   * Record the current position in a capture slot.
   */
  record SaveSlot(int slot) implements Instruction {
    @Override
    public String toString() {
      return "save " + slot;
    }
  }

  /**
   * Succeed only at the start of the region.
   */
  record CheckStart() implements Instruction {
    @Override
    public String toString() {
      return "start";
    }
  }

  /**
   * Succeed only at the end of the region.
   */
  record CheckEnd() implements Instruction {
    @Override
    public String toString() {
      return "end";
    }
  }

  /**
   * Report a match.
   */
  record Accept() implements Instruction {
    @Override
    public String toString() {
      return "accept";
    }
  }
}
