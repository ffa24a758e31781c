package regexvm.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Failure to parse a pattern, located at a zero-based offset in the pattern.
 *
 * <p>The message shows the description, the offset, and the part of the
 * pattern left unparsed from that offset on, with a caret under its first
 * character.
 */
public class RegexParseException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = -3185571720651322086L;

  public RegexParseException(String description, String regex, int index) {
    super(description, regex, index);
  }

  /**
   * Offset in the pattern at which the error was detected.
   */
  public int offset() {
    return getIndex();
  }

  @Override
  public String getMessage() {
    final String pattern = getPattern();
    final int index = getIndex();
    final String remaining = (index >= 0 && index <= pattern.length()) ? pattern.substring(index) : pattern;
    return getDescription() + " near index " + index + System.lineSeparator()
      + remaining + System.lineSeparator()
      + "^";
  }
}
