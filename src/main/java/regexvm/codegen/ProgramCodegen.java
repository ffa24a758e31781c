package regexvm.codegen;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;
import regexvm.program.Program;
import regexvm.vm.ProgramRunner;

/**
 * Compiles programs into JVM bytecode.
 *
 * <p>The output is a hidden class implementing {@link ProgramRunner} whose
 * {@code run} method has the program's control flow baked in, so that the JIT
 * sees ordinary branches instead of an interpreter loop.
 */
public final class ProgramCodegen {

  private static final String CLASS_NAME = "regexvm/codegen/CompiledProgram";

  private ProgramCodegen() { }

  /**
   * Generate the class file of a runner for a program.
   *
   * @param program program to compile
   * @param className internal name of the class to generate
   * @return class implementing {@code ProgramRunner}
   */
  public static ClassWriter generateRunnerClass(Program program, String className) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V17,
      Opcodes.ACC_SUPER | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC,
      className,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.PROGRAMRUNNER_CLASS_NAME }
    );

    // Make constructor (which takes no arguments - the class has no state!)
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.EMPTYINIT_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `run` method
    {
      final var mv = Method.RUN_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      new RunMethodCodegen(mv, program).visitRunMethod();
    }

    cw.visitEnd();
    return cw;
  }

  /**
   * Compile a program into a freshly loaded runner.
   *
   * @param program program to compile
   * @return runner equivalent to interpreting the program
   * @throws ReflectiveOperationException if the generated class cannot be
   *   loaded or instantiated
   * @throws RuntimeException if ASM rejects the generated code, for instance
   *   because the method exceeds the size limit
   */
  public static ProgramRunner generate(Program program) throws ReflectiveOperationException {
    final byte[] classBytes = generateRunnerClass(program, CLASS_NAME).toByteArray();

    // Load the class and get a handle on the constructor
    final MethodHandles.Lookup lookup = MethodHandles
      .lookup()
      .defineHiddenClass(classBytes, true);
    final var constructor = lookup.findConstructor(
      lookup.lookupClass(),
      MethodType.methodType(void.class)
    );

    try {
      return (ProgramRunner) constructor.invoke();
    } catch (ReflectiveOperationException | RuntimeException | Error error) {
      throw error;
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to construct program runner", error);
    }
  }
}
