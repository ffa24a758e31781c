package regexvm;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import regexvm.codegen.ProgramCodegen;
import regexvm.compiler.Compiler;
import regexvm.parser.RegexParseException;
import regexvm.parser.RegexParser;
import regexvm.program.Program;
import regexvm.vm.Interpreter;
import regexvm.vm.MatchMode;
import regexvm.vm.ProgramRunner;
import regexvm.vm.VirtualMachine;

/**
 * Compiled regular expression, matched by a backtracking virtual machine.
 *
 * <p>This aspires to have an interface and semantics similar to {@code Pattern}
 * and {@code Matcher} from the JDK's {@code java.util.regex}, for the POSIX
 * extended syntax plus non-greedy quantifiers and {@code \d \s \w} classes.
 *
 * <p>Instances are immutable and safe to share between threads. Matchers
 * are not.
 */
public final class Regex {

  private static final Logger LOGGER = LoggerFactory.getLogger(Regex.class);

  private final String pattern;
  private final Program program;
  private final ProgramRunner runner;
  private final RegexConfig.Backend backend;

  private Regex(String pattern, Program program, ProgramRunner runner, RegexConfig.Backend backend) {
    this.pattern = pattern;
    this.program = program;
    this.runner = runner;
    this.backend = backend;
  }

  /**
   * Compiles the given regular expression, generating bytecode for it.
   *
   * @param regex source of the pattern
   * @return compiled regex
   */
  public static Regex compile(String regex) throws RegexParseException {
    return compile(regex, RegexConfig.DEFAULT);
  }

  /**
   * Compiles the given regular expression into a program which is only ever
   * interpreted.
   *
   * @param regex source of the pattern
   * @return compiled regex
   */
  public static Regex interpreted(String regex) throws RegexParseException {
    return compile(regex, RegexConfig.INTERPRETED);
  }

  /**
   * Compiles the given regular expression.
   *
   * @param regex source of the pattern
   * @param config compilation options
   * @return compiled regex
   */
  public static Regex compile(String regex, RegexConfig config) throws RegexParseException {
    final Program program = Compiler.compile(RegexParser.parseRegex(regex, config));
    if (LOGGER.isTraceEnabled()) {
      LOGGER.trace("Program for /{}/:\n{}", regex, program);
    }

    ProgramRunner runner = null;
    RegexConfig.Backend backend = RegexConfig.Backend.INTERPRETED;
    if (config.backend() == RegexConfig.Backend.BYTECODE) {
      try {
        runner = ProgramCodegen.generate(program);
        backend = RegexConfig.Backend.BYTECODE;
      } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
        LOGGER.warn("Bytecode generation failed for /{}/, falling back to the interpreter", regex, e);
      }
    }
    if (runner == null) {
      runner = new Interpreter(program);
    }

    LOGGER.debug(
      "Compiled /{}/ into {} instructions with {} groups ({} backend)",
      regex,
      program.size(),
      program.groupCount(),
      backend
    );
    return new Regex(regex, program, runner, backend);
  }

  /**
   * Returns initial regular expression from which the regex was compiled.
   *
   * @return source of the pattern
   */
  public String pattern() {
    return pattern;
  }

  /**
   * Program which this regex runs.
   */
  public Program program() {
    return program;
  }

  /**
   * Backend actually in use, which is {@code INTERPRETED} if bytecode
   * generation was requested but failed.
   */
  public RegexConfig.Backend backend() {
    return backend;
  }

  /**
   * Compute the number of groups in the pattern.
   *
   * @return number of capture groups in the pattern
   */
  public int groupCount() {
    return program.groupCount();
  }

  /**
   * Create a matcher for matching the current regex against the input.
   *
   * @param input string against which to match
   * @return matcher for the regex against the input
   */
  public RegexMatcher matcher(CharSequence input) {
    return new RegexMatcher(this, input);
  }

  /**
   * Whether the whole input matches.
   */
  public boolean matches(CharSequence input) {
    return execute(input, 0, input.length(), 0, MatchMode.FULL, new int[program.slotCount()]);
  }

  /**
   * Find the leftmost match in the input.
   *
   * @param input string to search
   * @return first match, if any
   */
  public Optional<ArrayMatchResult> find(CharSequence input) {
    final int[] groups = new int[program.slotCount()];
    if (!execute(input, 0, input.length(), 0, MatchMode.SEARCH, groups)) {
      return Optional.empty();
    }
    return Optional.of(new ArrayMatchResult(input.toString(), groups));
  }

  boolean execute(
    CharSequence input,
    int regionStart,
    int regionEnd,
    int from,
    MatchMode mode,
    int[] groups
  ) {
    return VirtualMachine.execute(runner, program, input, regionStart, regionEnd, from, mode, groups);
  }

  @Override
  public String toString() {
    return "Regex(" + pattern + ")";
  }
}
