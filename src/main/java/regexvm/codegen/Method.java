package regexvm.codegen;

import java.lang.invoke.MethodType;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import regexvm.vm.Backtracker;
import regexvm.vm.ProgramRunner;

/**
 * Helper class to simplify codegen around declaring and calling methods.
 *
 * @param name name of the method
 * @param typ type of the method (does not include the receiver)
 * @param invokeSort one of the {@code Opcodes.INVOKE*} codes
 */
record Method(
  String name,
  MethodType typ,
  int invokeSort
) {

  // Class name constants
  public static final String OBJECT_CLASS_NAME = Type.getInternalName(Object.class);
  public static final String BACKTRACKER_CLASS_NAME = Type.getInternalName(Backtracker.class);
  public static final String PROGRAMRUNNER_CLASS_NAME = Type.getInternalName(ProgramRunner.class);

  // Method name constants
  public static final Method EMPTYINIT_M = new Method(
    "<init>",
    MethodType.methodType(void.class),
    Opcodes.INVOKESPECIAL
  );
  public static final Method RUN_M = new Method(
    "run",
    MethodType.methodType(boolean.class, Backtracker.class),
    Opcodes.INVOKEINTERFACE
  );
  public static final Method RESUME_M = new Method(
    "resume",
    MethodType.methodType(boolean.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method PC_M = new Method(
    "pc",
    MethodType.methodType(int.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method ENTER_M = new Method(
    "enter",
    MethodType.methodType(boolean.class, int.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method FORK_M = new Method(
    "fork",
    MethodType.methodType(void.class, int.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method SAVE_M = new Method(
    "save",
    MethodType.methodType(void.class, int.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method CONSUME_M = new Method(
    "consume",
    MethodType.methodType(boolean.class, char.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method CONSUMEANY_M = new Method(
    "consumeAny",
    MethodType.methodType(boolean.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method CONSUMECLASS_M = new Method(
    "consumeClass",
    MethodType.methodType(boolean.class, int.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method ATSTART_M = new Method(
    "atStart",
    MethodType.methodType(boolean.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method ATEND_M = new Method(
    "atEnd",
    MethodType.methodType(boolean.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method ACCEPT_M = new Method(
    "accept",
    MethodType.methodType(boolean.class),
    Opcodes.INVOKEVIRTUAL
  );

  /**
   * Start this method on an existing class visitor.
   *
   * @param cv class on which the method is started
   * @param accessFlags access flags for the method (`static` or not is computed)
   * @return method visitor for this method
   */
  public MethodVisitor newMethod(ClassVisitor cv, int accessFlags) {
    int staticFlag = (invokeSort == Opcodes.INVOKESTATIC) ? Opcodes.ACC_STATIC : 0;
    return cv.visitMethod(
      accessFlags | staticFlag,
      name,
      typ.descriptorString(),
      null, // signature
      null  // exceptions
    );
  }

  /**
   * Invoke this method inside another method body.
   *
   * @param mv method inside of which this method is called
   * @param className name of the class on which this method is defined
   */
  public void invokeMethod(MethodVisitor mv, String className) {
    mv.visitMethodInsn(
      invokeSort,
      className,
      name,
      typ.descriptorString(),
      invokeSort == Opcodes.INVOKEINTERFACE
    );
  }
}
