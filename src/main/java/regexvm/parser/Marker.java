package regexvm.parser;

/**
 * Temporary parser stack entries.
 *
 * <p>These only ever live on the parser stack: a successful parse reduces all
 * of them away, and any marker still present at the end is reported as an
 * error located at {@link #offset()}.
 */
sealed interface Marker extends StackItem {

  /**
   * Offset in the pattern of the token that pushed the marker.
   */
  int offset();

  /**
   * Opening {@code (} of a capturing group.
   *
   * @param level nesting level outside the group
   * @param groupIndex index of the capture group being opened
   * @param offset offset of the parenthesis
   */
  record CapturingGroupStart(int level, int groupIndex, int offset) implements Marker { }

  /**
   * Opening {@code [} of a bracket expression.
   *
   * @param level nesting level outside the bracket expression
   * @param offset offset of the bracket
   */
  record CharClassStart(int level, int offset) implements Marker { }

  /**
   * Opening {@code {} of a repetition bound.
   *
   * @param offset offset of the brace
   */
  record RepetitionBoundStart(int offset) implements Marker { }

  /**
   * A {@code |} separating the already reduced left alternative (just below
   * on the stack) from the alternative being parsed.
   *
   * @param offset offset of the pipe
   */
  record AlternationMarker(int offset) implements Marker { }
}
