package regexvm.parser;

/**
 * Lexer state, deciding which characters are meta characters.
 *
 * <p>The set of meta characters differs between the main body of a pattern,
 * the inside of a repetition bound, and the inside of a bracket expression.
 */
sealed interface LexerMode {

  /**
   * Characters which are meta in this mode (and so may be escaped).
   */
  String metaCharacters();

  default boolean isMeta(char c) {
    return metaCharacters().indexOf(c) >= 0;
  }

  LexerMode NORMAL = new Normal();
  LexerMode BOUND = new Bound();

  /**
   * Main body of the pattern.
   */
  record Normal() implements LexerMode {
    @Override
    public String metaCharacters() {
      return ".[{()\\*+?|^$";
    }
  }

  /**
   * Inside a repetition bound {@code {m,n}}.
   */
  record Bound() implements LexerMode {
    @Override
    public String metaCharacters() {
      return "}";
    }
  }

  /**
   * Inside a bracket expression {@code [...]}.
   *
   * @param negated whether the bracket expression started with {@code ^}
   * @param previous mode to restore once the bracket expression closes
   */
  record Set(boolean negated, LexerMode previous) implements LexerMode {
    @Override
    public String metaCharacters() {
      return "\\[]";
    }
  }
}
