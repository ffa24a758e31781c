package regexvm.util;

/**
 * Inclusive (and therefore non-empty) range of UTF-16 code units.
 *
 * @param lowerBound smallest code unit in the range
 * @param upperBound largest code unit in the range
 */
public record CharRange(
  char lowerBound,
  char upperBound
) implements Comparable<CharRange> {

  public static final CharRange FULL = CharRange.between(Character.MIN_VALUE, Character.MAX_VALUE);

  /**
   * Make a range (equivalent to the constructor, but more informatively named).
   *
   * @param lowerBound smallest code unit in the range
   * @param upperBound largest code unit in the range
   */
  public static CharRange between(char lowerBound, char upperBound) {
    return new CharRange(lowerBound, upperBound);
  }

  /**
   * Make a range containing only a single code unit.
   *
   * @param singleUnit code unit in the range
   */
  public static CharRange single(char singleUnit) {
    return new CharRange(singleUnit, singleUnit);
  }

  public CharRange {
    if (upperBound < lowerBound) {
      throw new IllegalArgumentException(
        "Range lower bound " + (int) lowerBound + " exceeds upper bound " + (int) upperBound
      );
    }
  }

  @Override
  public String toString() {
    return "CharRange(" + compactString() + ")";
  }

  public String compactString() {
    return (lowerBound == upperBound)
      ? printable(lowerBound)
      : printable(lowerBound) + "-" + printable(upperBound);
  }

  private static String printable(char c) {
    return (c >= 0x20 && c < 0x7f) ? String.valueOf(c) : String.format("\\u%04x", (int) c);
  }

  /**
   * Does this range contain the code unit?
   *
   * @param codeUnit code unit
   * @return whether the code unit is in this range
   */
  public boolean contains(char codeUnit) {
    return lowerBound <= codeUnit && codeUnit <= upperBound;
  }

  /**
   * Number of code units in the range.
   */
  public int size() {
    return upperBound - lowerBound + 1;
  }

  /**
   * Does this range overlap with or directly follow/precede another range?
   *
   * @param other other range
   * @return whether the two ranges can be merged into one
   */
  public boolean touches(CharRange other) {
    return lowerBound <= other.upperBound + 1 && other.lowerBound <= upperBound + 1;
  }

  /**
   * Merge this range with a range that it {@link #touches}.
   *
   * @param other other range
   * @return smallest range containing both ranges
   */
  public CharRange merge(CharRange other) {
    if (!touches(other)) {
      throw new IllegalArgumentException("Ranges " + this + " and " + other + " are disjoint");
    }
    return new CharRange(
      lowerBound < other.lowerBound ? lowerBound : other.lowerBound,
      upperBound > other.upperBound ? upperBound : other.upperBound
    );
  }

  @Override
  public int compareTo(CharRange other) {
    int lowCompare = Character.compare(lowerBound, other.lowerBound);
    return lowCompare != 0 ? lowCompare : Character.compare(upperBound, other.upperBound);
  }
}
