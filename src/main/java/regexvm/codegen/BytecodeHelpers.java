package regexvm.codegen;

import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Superclass containing utility methods for emitting bytecode.
 *
 * <p>The utilities prefer the shortest encoding of an instruction. Method
 * bodies are limited to 64KiB of code, and a large program turns into one
 * large method, so every byte saved raises the size of the largest pattern
 * that can be compiled.
 */
class BytecodeHelpers {

  /**
   * Method visitor into which code will be emitted.
   */
  protected final MethodVisitor mv;

  public BytecodeHelpers(MethodVisitor mv) {
    this.mv = mv;
  }

  /**
   * Generate bytecode equivalent to `lookupswitch`, but possibly more compact.
   *
   * <p>Equivalent to {@code mv.visitLookupSwitchInsn(dflt, values, labels)},
   * but possibly shorter.
   *
   * @param dflt label to jump to if nothing else matches
   * @param values test values in the switch (sorted in ascending order)
   * @param labels labels to jump to if the scrutinee is in the test values
   */
  protected void visitLookupBranch(
    Label dflt,
    int[] values,
    Label[] labels
  ) {
    if (values.length == 0) {
      mv.visitInsn(Opcodes.POP);
      mv.visitJumpInsn(Opcodes.GOTO, dflt);
    } else if (values.length == 1) {
      if (values[0] == 0) {
        mv.visitJumpInsn(Opcodes.IFEQ, labels[0]);
        mv.visitJumpInsn(Opcodes.GOTO, dflt);
      } else {
        visitConstantInt(values[0]);
        mv.visitJumpInsn(Opcodes.IF_ICMPEQ, labels[0]);
        mv.visitJumpInsn(Opcodes.GOTO, dflt);
      }
    } else {

      // If the range of values is dense, a tableswitch is shorter
      boolean useTableSwitch = true;
      for (int i = 0; i < values.length - 1; i++) {
        if (values[i] + 1 != values[i + 1]) {
          useTableSwitch = false;
          break;
        }
      }

      if (useTableSwitch) {
        mv.visitTableSwitchInsn(values[0], values[values.length - 1], dflt, labels);
      } else {
        mv.visitLookupSwitchInsn(dflt, values, labels);
      }
    }
  }

  /**
   * Push an integer constant onto the stack.
   *
   * <p>Equivalent to {@code mv.visitLdcInsn(constant)}, but possibly shorter
   * and ideally not consuming a slot in the constants table.
   *
   * @param constant integer constant
   */
  protected void visitConstantInt(int constant) {
    if (-1 <= constant && constant <= 5) {
      mv.visitInsn(Opcodes.ICONST_0 + constant);
    } else if (Byte.MIN_VALUE <= constant && constant <= Byte.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.BIPUSH, constant);
    } else if (Short.MIN_VALUE <= constant && constant <= Short.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.SIPUSH, constant);
    } else {
      mv.visitLdcInsn(constant);
    }
  }
}
