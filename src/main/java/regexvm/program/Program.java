package regexvm.program;

import java.util.List;

/**
 * Compiled program for the backtracking virtual machine.
 *
 * <p>Programs are immutable and can be shared between threads.
 *
 * @param captureCount number of capture groups, including the implicit group 0
 * @param instructions instructions, indexed by address
 */
public record Program(
  int captureCount,
  List<Instruction> instructions
) {

  public Program {
    if (captureCount < 1) {
      throw new IllegalArgumentException("Program must have at least the whole-match capture");
    }
    instructions = List.copyOf(instructions);

    final int size = instructions.size();
    if (size == 0 || !(instructions.get(size - 1) instanceof Instruction.Accept)) {
      throw new IllegalArgumentException("Program must end in accept");
    }

    for (int pc = 0; pc < size; pc++) {
      final Instruction instruction = instructions.get(pc);
      if (instruction instanceof Instruction.Split split) {
        checkTarget(pc, split.primary(), size);
        checkTarget(pc, split.secondary(), size);
      } else if (instruction instanceof Instruction.Jump jump) {
        checkTarget(pc, jump.target(), size);
      } else if (instruction instanceof Instruction.SaveSlot save) {
        if (save.slot() < 0 || save.slot() >= 2 * captureCount) {
          throw new IllegalArgumentException("Slot " + save.slot() + " out of range at " + pc);
        }
      } else if (instruction instanceof Instruction.Accept && pc != size - 1) {
        throw new IllegalArgumentException("Accept before end of program at " + pc);
      }
    }
  }

  private static void checkTarget(int pc, int target, int size) {
    if (target < 0 || target >= size) {
      throw new IllegalArgumentException("Target " + target + " out of range at " + pc);
    }
  }

  /**
   * Number of explicit capture groups.
   */
  public int groupCount() {
    return captureCount - 1;
  }

  /**
   * Length of the capture slot array.
   */
  public int slotCount() {
    return 2 * captureCount;
  }

  public int size() {
    return instructions.size();
  }

  public Instruction instruction(int pc) {
    return instructions.get(pc);
  }

  /**
   * Disassembly listing, one instruction per line.
   */
  @Override
  public String toString() {
    final var builder = new StringBuilder();
    builder.append("Program(captures = ").append(captureCount).append(")");
    for (int pc = 0; pc < instructions.size(); pc++) {
      builder
        .append(System.lineSeparator())
        .append(String.format("%4d: ", pc))
        .append(instructions.get(pc));
    }
    return builder.toString();
  }
}
