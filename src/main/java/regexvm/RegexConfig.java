package regexvm;

import regexvm.parser.RegexParser;

/**
 * Options for compiling a {@link Regex}.
 *
 * @param backend how compiled programs are executed
 * @param maxRepetition largest number accepted in a repetition bound such
 *   as <code>a{2,5}</code>; bounds are expanded into copies of the repeated
 *   expression, so this caps the size of compiled programs
 */
public record RegexConfig(
  Backend backend,
  int maxRepetition
) {

  /**
   * Bytecode backend, default limits.
   */
  public static final RegexConfig DEFAULT = builder().build();

  /**
   * Interpreter backend, default limits.
   */
  public static final RegexConfig INTERPRETED = builder().backend(Backend.INTERPRETED).build();

  public RegexConfig {
    if (backend == null) {
      throw new IllegalArgumentException("backend must not be null");
    }
    if (maxRepetition <= 0) {
      throw new IllegalArgumentException("maxRepetition must be positive but was " + maxRepetition);
    }
  }

  /**
   * Execution strategy for compiled programs.
   */
  public enum Backend {

    /**
     * Generate a JVM class per pattern, falling back to the interpreter if
     * that fails.
     */
    BYTECODE,

    /**
     * Run programs in the interpreter.
     */
    INTERPRETED
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private Backend backend = Backend.BYTECODE;
    private int maxRepetition = RegexParser.DEFAULT_MAX_REPETITION;

    private Builder() { }

    public Builder backend(Backend backend) {
      this.backend = backend;
      return this;
    }

    public Builder maxRepetition(int maxRepetition) {
      this.maxRepetition = maxRepetition;
      return this;
    }

    public RegexConfig build() {
      return new RegexConfig(backend, maxRepetition);
    }
  }
}
