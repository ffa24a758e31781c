package regexvm.parser;

import regexvm.util.CharRange;
import regexvm.util.CharRangeSet;

/**
 * Character classes available through backslash escapes.
 */
public enum BuiltinClass {

  /**
   * Digit character: {@code \d}
   */
  DIGIT('d', CharRangeSet.of(CharRange.between('0', '9'))),

  /**
   * Non-digit character: {@code \D}
   */
  NON_DIGIT('D', DIGIT.ranges.negate()),

  /**
   * Whitespace character: {@code \s}
   */
  SPACE('s', CharRangeSet.unionOf(
    CharRange.single(' '),
    CharRange.single('\t'),
    CharRange.single('\r'),
    CharRange.single('\n'),
    CharRange.single('\f')
  )),

  /**
   * Non-whitespace character: {@code \S}
   */
  NON_SPACE('S', SPACE.ranges.negate()),

  /**
   * Word character: {@code \w}
   */
  WORD('w', CharRangeSet.unionOf(
    CharRange.between('A', 'Z'),
    CharRange.between('a', 'z'),
    CharRange.between('0', '9'),
    CharRange.single('_')
  )),

  /**
   * Non-word character: {@code \W}
   */
  NON_WORD('W', WORD.ranges.negate());

  /**
   * Letter following the backslash.
   */
  public final char escape;

  private final CharRangeSet ranges;

  BuiltinClass(char escape, CharRangeSet ranges) {
    this.escape = escape;
    this.ranges = ranges;
  }

  /**
   * Code units matched by the class.
   */
  public CharRangeSet ranges() {
    return ranges;
  }

  /**
   * Look up the class escaped by a letter.
   *
   * @param escaped character after the backslash
   * @return matching class, or else {@code null}
   */
  public static BuiltinClass forEscape(char escaped) {
    for (BuiltinClass builtin : values()) {
      if (builtin.escape == escaped) {
        return builtin;
      }
    }
    return null;
  }
}
