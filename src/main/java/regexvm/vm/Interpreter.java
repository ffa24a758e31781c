package regexvm.vm;

import regexvm.program.Instruction;
import regexvm.program.Program;

/**
 * Runs a program by dispatching on each instruction in turn.
 */
public final class Interpreter implements ProgramRunner {

  private final Instruction[] instructions;

  public Interpreter(Program program) {
    this.instructions = program.instructions().toArray(new Instruction[0]);
  }

  @Override
  public boolean run(Backtracker backtracker) {
    while (backtracker.resume()) {
      int pc = backtracker.pc();

      thread:
      while (backtracker.enter(pc)) {
        final Instruction instruction = instructions[pc];

        if (instruction instanceof Instruction.MatchLiteral literal) {
          if (!backtracker.consume(literal.value())) {
            break thread;
          }
          pc++;
        } else if (instruction instanceof Instruction.MatchAny) {
          if (!backtracker.consumeAny()) {
            break thread;
          }
          pc++;
        } else if (instruction instanceof Instruction.MatchClass) {
          if (!backtracker.consumeClass(pc)) {
            break thread;
          }
          pc++;
        } else if (instruction instanceof Instruction.Split split) {
          backtracker.fork(split.secondary());
          pc = split.primary();
        } else if (instruction instanceof Instruction.Jump jump) {
          pc = jump.target();
        } else if (instruction instanceof Instruction.SaveSlot save) {
          backtracker.save(save.slot());
          pc++;
        } else if (instruction instanceof Instruction.CheckStart) {
          if (!backtracker.atStart()) {
            break thread;
          }
          pc++;
        } else if (instruction instanceof Instruction.CheckEnd) {
          if (!backtracker.atEnd()) {
            break thread;
          }
          pc++;
        } else if (instruction instanceof Instruction.Accept) {
          if (backtracker.accept()) {
            return true;
          }
          break thread;
        } else {
          throw new IllegalStateException("Unknown instruction " + instruction);
        }
      }
    }
    return false;
  }
}
