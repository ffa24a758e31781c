package regexvm.codegen;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.objectweb.asm.ClassReader;
import regexvm.compiler.Compiler;
import regexvm.parser.RegexParser;
import regexvm.program.Program;
import regexvm.vm.Interpreter;
import regexvm.vm.MatchMode;
import regexvm.vm.ProgramRunner;
import regexvm.vm.VirtualMachine;

@DisplayName("Bytecode generation")
class ProgramCodegenTest {

  private static final List<String> INPUTS = List.of(
    "",
    "a",
    "ab",
    "abc",
    "aaab",
    "xyz abc 123",
    "abababab",
    "a1_b2-c3",
    "ba",
    "  \t\n",
    "caaandy"
  );

  private static Program compile(String pattern) {
    return Compiler.compile(RegexParser.parse(pattern));
  }

  private static String run(ProgramRunner runner, Program program, String input, MatchMode mode) {
    final int[] groups = new int[program.slotCount()];
    final boolean found = VirtualMachine.execute(runner, program, input, 0, input.length(), 0, mode, groups);
    return found + " " + Arrays.toString(groups);
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "",
    "abc",
    "a|b|c",
    "(a|ab)(c|bcd)?",
    "a*b",
    "a*?b",
    "(a+)(a*)",
    "(a+?)(a*)",
    "[a-c]+",
    "[^a-c ]+",
    "\\d\\w\\W",
    "\\s+",
    "^a",
    "b$",
    "^$",
    "(ab){2,3}",
    "(a|b){0,}c",
    "c(a{1,2})?n",
    "(|a)*",
    "(a*)*b",
    ".+?c",
  })
  void generatedRunnerAgreesWithInterpreter(String pattern) throws ReflectiveOperationException {
    final Program program = compile(pattern);
    final ProgramRunner interpreter = new Interpreter(program);
    final ProgramRunner generated = ProgramCodegen.generate(program);

    for (String input : INPUTS) {
      for (MatchMode mode : MatchMode.values()) {
        assertThat(run(generated, program, input, mode))
          .as("/%s/ against '%s' in %s mode", pattern, input, mode)
          .isEqualTo(run(interpreter, program, input, mode));
      }
    }
  }

  @Test
  void generatedClassImplementsRunner() {
    final Program program = compile("a(b|c)*");
    final byte[] classBytes = ProgramCodegen.generateRunnerClass(program, "regexvm/codegen/Example").toByteArray();
    final var reader = new ClassReader(classBytes);

    assertThat(reader.getClassName()).isEqualTo("regexvm/codegen/Example");
    assertThat(reader.getInterfaces()).containsExactly("regexvm/vm/ProgramRunner");
    assertThat(reader.getSuperName()).isEqualTo("java/lang/Object");
  }

  @Test
  void generatedRunnersAreHiddenAndStateless() throws ReflectiveOperationException {
    final Program program = compile("(x+)y");
    final ProgramRunner runner = ProgramCodegen.generate(program);

    assertThat(runner.getClass().isHidden()).isTrue();
    assertThat(runner.getClass().getDeclaredFields()).isEmpty();
    assertThat(run(runner, program, "axxy", MatchMode.SEARCH)).isEqualTo("true [1, 4, 1, 3]");
    assertThat(run(runner, program, "axxz", MatchMode.SEARCH)).isEqualTo("false [-1, -1, -1, -1]");
  }
}
