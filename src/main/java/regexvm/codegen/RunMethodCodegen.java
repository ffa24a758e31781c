package regexvm.codegen;

import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import regexvm.program.Instruction;
import regexvm.program.Program;

/**
 * Generates the body of {@code ProgramRunner.run(Backtracker)} for a program.
 *
 * <p>Every instruction becomes a block of bytecode starting at its own label.
 * Jumps and the preferred side of splits become {@code GOTO}s between blocks
 * and straight-line code falls through into the next block. A failing thread
 * jumps back to the resume block, which pops the next pending thread and
 * dispatches on its program counter through a {@code tableswitch}.
 *
 * <pre>{@code
 * resume:
 *   if (!b.resume()) return false;
 *   switch (b.pc()) { case 0: goto L0; ...; default: return false; }
 * L0:
 *   if (!b.enter(0)) goto resume;
 *   <code for instruction 0>
 * L1:
 *   ...
 * }</pre>
 */
final class RunMethodCodegen extends BytecodeHelpers {

  /**
   * Local variable holding the {@code Backtracker} argument.
   */
  private static final int BACKTRACKER_LOCAL = 1;

  private final Program program;

  /**
   * Labels associated with instructions, indexed by program counter.
   */
  private final Label[] instructionLabels;

  /**
   * Label of the block which resumes the next pending thread.
   */
  private final Label resume = new Label();

  /**
   * Label of the block which returns {@code false}.
   */
  private final Label returnFailure = new Label();

  RunMethodCodegen(MethodVisitor mv, Program program) {
    super(mv);
    this.program = program;
    this.instructionLabels = new Label[program.size()];
    for (int pc = 0; pc < instructionLabels.length; pc++) {
      instructionLabels[pc] = new Label();
    }
  }

  /**
   * Emit the whole method body.
   */
  void visitRunMethod() {
    mv.visitCode();
    visitResume();
    for (int pc = 0; pc < program.size(); pc++) {
      visitInstruction(pc, program.instruction(pc));
    }

    mv.visitLabel(returnFailure);
    mv.visitInsn(Opcodes.ICONST_0);
    mv.visitInsn(Opcodes.IRETURN);
    mv.visitMaxs(0, 0);
    mv.visitEnd();
  }

  private void visitResume() {
    mv.visitLabel(resume);
    mv.visitVarInsn(Opcodes.ALOAD, BACKTRACKER_LOCAL);
    Method.RESUME_M.invokeMethod(mv, Method.BACKTRACKER_CLASS_NAME);
    mv.visitJumpInsn(Opcodes.IFEQ, returnFailure);

    final int[] pcs = new int[program.size()];
    for (int pc = 0; pc < pcs.length; pc++) {
      pcs[pc] = pc;
    }
    mv.visitVarInsn(Opcodes.ALOAD, BACKTRACKER_LOCAL);
    Method.PC_M.invokeMethod(mv, Method.BACKTRACKER_CLASS_NAME);
    visitLookupBranch(returnFailure, pcs, instructionLabels);
  }

  private void visitInstruction(int pc, Instruction instruction) {
    mv.visitLabel(instructionLabels[pc]);

    // if (!b.enter(pc)) goto resume;
    mv.visitVarInsn(Opcodes.ALOAD, BACKTRACKER_LOCAL);
    visitConstantInt(pc);
    Method.ENTER_M.invokeMethod(mv, Method.BACKTRACKER_CLASS_NAME);
    mv.visitJumpInsn(Opcodes.IFEQ, resume);

    if (instruction instanceof Instruction.MatchLiteral literal) {
      mv.visitVarInsn(Opcodes.ALOAD, BACKTRACKER_LOCAL);
      visitConstantInt(literal.value());
      visitCheck(Method.CONSUME_M);
    } else if (instruction instanceof Instruction.MatchAny) {
      mv.visitVarInsn(Opcodes.ALOAD, BACKTRACKER_LOCAL);
      visitCheck(Method.CONSUMEANY_M);
    } else if (instruction instanceof Instruction.MatchClass) {
      mv.visitVarInsn(Opcodes.ALOAD, BACKTRACKER_LOCAL);
      visitConstantInt(pc);
      visitCheck(Method.CONSUMECLASS_M);
    } else if (instruction instanceof Instruction.Split split) {
      mv.visitVarInsn(Opcodes.ALOAD, BACKTRACKER_LOCAL);
      visitConstantInt(split.secondary());
      Method.FORK_M.invokeMethod(mv, Method.BACKTRACKER_CLASS_NAME);
      mv.visitJumpInsn(Opcodes.GOTO, instructionLabels[split.primary()]);
    } else if (instruction instanceof Instruction.Jump jump) {
      mv.visitJumpInsn(Opcodes.GOTO, instructionLabels[jump.target()]);
    } else if (instruction instanceof Instruction.SaveSlot save) {
      mv.visitVarInsn(Opcodes.ALOAD, BACKTRACKER_LOCAL);
      visitConstantInt(save.slot());
      Method.SAVE_M.invokeMethod(mv, Method.BACKTRACKER_CLASS_NAME);
    } else if (instruction instanceof Instruction.CheckStart) {
      mv.visitVarInsn(Opcodes.ALOAD, BACKTRACKER_LOCAL);
      visitCheck(Method.ATSTART_M);
    } else if (instruction instanceof Instruction.CheckEnd) {
      mv.visitVarInsn(Opcodes.ALOAD, BACKTRACKER_LOCAL);
      visitCheck(Method.ATEND_M);
    } else if (instruction instanceof Instruction.Accept) {
      mv.visitVarInsn(Opcodes.ALOAD, BACKTRACKER_LOCAL);
      visitCheck(Method.ACCEPT_M);
      mv.visitInsn(Opcodes.ICONST_1);
      mv.visitInsn(Opcodes.IRETURN);
    } else {
      throw new IllegalStateException("Unknown instruction " + instruction);
    }
  }

  /**
   * Call a {@code boolean} method on the backtracker (whose receiver and
   * arguments are already on the stack) and resume another thread if it
   * returns {@code false}.
   */
  private void visitCheck(Method check) {
    check.invokeMethod(mv, Method.BACKTRACKER_CLASS_NAME);
    mv.visitJumpInsn(Opcodes.IFEQ, resume);
  }
}
