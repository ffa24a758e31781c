package regexvm.parser;

/**
 * Context-sensitive tokenizer for patterns.
 *
 * <p>The lexer is driven by the parser one token at a time, since what a
 * character means depends on the {@link LexerMode} the parser is in.
 */
final class RegexLexer {

  private final String input;
  private final int length;

  RegexLexer(String input) {
    this.input = input;
    this.length = input.length();
  }

  /**
   * Read the token starting at an offset, interpreting meta characters and
   * escapes according to the lexer mode.
   *
   * @param mode current lexer mode
   * @param offset offset of the token
   * @return next token
   */
  Token nextToken(LexerMode mode, int offset) throws RegexParseException {
    if (offset >= length) {
      return new Token.EndOfInput(offset);
    }

    final char c = input.charAt(offset);
    if (c == '\\') {
      if (offset + 1 >= length) {
        throw new RegexParseException("Unterminated escaped character", input, offset);
      }

      final char escaped = input.charAt(offset + 1);
      if (mode.isMeta(escaped)) {
        return new Token.Literal(escaped, offset, offset + 2);
      }
      final BuiltinClass builtin = BuiltinClass.forEscape(escaped);
      if (builtin != null) {
        return new Token.Builtin(builtin, offset, offset + 2);
      }
      throw new RegexParseException("Unknown escaped character '\\" + escaped + "'", input, offset + 1);
    }

    if (mode.isMeta(c)) {
      return new Token.Meta(c, offset, offset + 1);
    }
    return new Token.Literal(c, offset, offset + 1);
  }

  /**
   * Read the raw character at an offset, ignoring lexer mode and escapes.
   *
   * <p>Used for look-ahead on things like the {@code ?} of non-greedy
   * quantifiers and the {@code ^} of negated bracket expressions.
   *
   * @param offset offset of the token
   * @return literal token for the character, or end of input
   */
  Token nextRawToken(int offset) {
    if (offset >= length) {
      return new Token.EndOfInput(offset);
    }
    return new Token.Literal(input.charAt(offset), offset, offset + 1);
  }

  /**
   * Whether the raw character at an offset is a particular character.
   */
  boolean rawCharIs(int offset, char expected) {
    return nextRawToken(offset) instanceof Token.Literal literal && literal.value() == expected;
  }
}
