package regexvm.parser;

/**
 * Lexical token of a pattern.
 *
 * <p>Every token knows where it starts ({@link #offset()}) and where the next
 * token starts ({@link #next()}).
 */
sealed interface Token {

  int offset();

  int next();

  /**
   * Character standing for itself (possibly escaped in the source).
   */
  record Literal(char value, int offset, int next) implements Token { }

  /**
   * Unescaped meta character, significant in the current lexer mode.
   */
  record Meta(char symbol, int offset, int next) implements Token { }

  /**
   * Built-in class escape such as {@code \d}.
   */
  record Builtin(BuiltinClass builtinClass, int offset, int next) implements Token { }

  /**
   * End of the pattern.
   */
  record EndOfInput(int offset) implements Token {
    @Override
    public int next() {
      return offset;
    }
  }
}
