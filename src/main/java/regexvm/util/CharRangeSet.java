package regexvm.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Set of code units, tracked using ranges.
 *
 * The constraint on ranges being non-overlapping, non-contiguous, and sorted
 * ensures that there is always exactly one canonical instance for any logical
 * set of code units. If the input ranges are not already in this format,
 * construct the set using {@link #unionOf}.
 *
 * <p>Sets are immutable: {@link #add}, {@link #union}, and {@link #negate} all
 * return fresh sets.
 *
 * @param ranges non-overlapping, non-contiguous, and sorted ranges
 */
public record CharRangeSet(
  List<CharRange> ranges
) {

  public CharRangeSet(List<CharRange> ranges) {

    // Check that the ranges really are sorted
    CharRange previousRange = null;
    for (CharRange range : ranges) {
      if (previousRange != null && previousRange.upperBound() + 1 >= range.lowerBound()) {
        throw new IllegalArgumentException(
          "Ranges are overlapping or not sorted: " + previousRange + " and " + range
        );
      }
      previousRange = range;
    }

    this.ranges = List.<CharRange>copyOf(ranges);
  }

  /**
   * Empty set.
   */
  public static final CharRangeSet EMPTY = new CharRangeSet(List.<CharRange>of());

  /**
   * Universal set, containing every code unit.
   */
  public static final CharRangeSet FULL = new CharRangeSet(List.<CharRange>of(CharRange.FULL));

  /**
   * Construct a set with the following non-overlapping, non-contiguous, and
   * sorted ranges.
   *
   * @param ranges input ranges
   * @return set containing the ranges
   */
  public static CharRangeSet of(CharRange... ranges) {
    return new CharRangeSet(Arrays.asList(ranges));
  }

  /**
   * Construct a set that is the union of the following ranges.
   *
   * Unlike {@link #of}, this will never throw an exception.
   *
   * @param ranges input ranges, in any order
   * @return set containing the ranges
   */
  public static CharRangeSet unionOf(CharRange... ranges) {
    CharRangeSet output = EMPTY;
    for (CharRange range : ranges) {
      output = output.add(range);
    }
    return output;
  }

  /**
   * Add a range to the set, merging it with any overlapping or adjacent ranges.
   *
   * The complexity is {@code O(M)} for {@code M} ranges in the set.
   *
   * @param range range to add
   * @return set containing both the ranges in this set and the new range
   */
  public CharRangeSet add(CharRange range) {
    final var outputRanges = new ArrayList<CharRange>(ranges.size() + 1);
    CharRange pending = range;
    boolean inserted = false;

    for (CharRange existing : ranges) {
      if (inserted) {
        outputRanges.add(existing);
      } else if (existing.touches(pending)) {
        pending = pending.merge(existing);
      } else if (existing.upperBound() < pending.lowerBound()) {
        outputRanges.add(existing);
      } else {
        outputRanges.add(pending);
        outputRanges.add(existing);
        inserted = true;
      }
    }
    if (!inserted) {
      outputRanges.add(pending);
    }

    return new CharRangeSet(outputRanges);
  }

  /**
   * Take the union of two sets.
   *
   * @param other set to union with `this`
   * @return union of sets
   */
  public CharRangeSet union(CharRangeSet other) {
    CharRangeSet output = this;
    for (CharRange range : other.ranges) {
      output = output.add(range);
    }
    return output;
  }

  /**
   * Take the complement of the set with respect to all code units.
   *
   * The complexity is {@code O(M)} for {@code M} ranges in the set.
   *
   * @return complement of set
   */
  public CharRangeSet negate() {
    final var outputRanges = new ArrayList<CharRange>(ranges.size() + 1);
    int nextLower = Character.MIN_VALUE;

    for (CharRange range : ranges) {
      if (range.lowerBound() > nextLower) {
        outputRanges.add(CharRange.between((char) nextLower, (char) (range.lowerBound() - 1)));
      }
      nextLower = range.upperBound() + 1;
    }
    if (nextLower <= Character.MAX_VALUE) {
      outputRanges.add(CharRange.between((char) nextLower, Character.MAX_VALUE));
    }

    return new CharRangeSet(outputRanges);
  }

  /**
   * Whether this set contains the code unit.
   *
   * The complexity is {@code O(log(M))} for {@code M} ranges in the set.
   *
   * @param codeUnit code unit
   * @return whether the code unit is in this set
   */
  public boolean contains(char codeUnit) {
    int rangeIndex = Collections.binarySearch(
      ranges,
      CharRange.single(codeUnit),
      RANGE_BY_LOWER
    );
    if (rangeIndex == -1) {
      return false;
    } else if (rangeIndex < 0) {
      rangeIndex = -rangeIndex - 2;
    }
    return ranges.get(rangeIndex).contains(codeUnit);
  }

  private static final Comparator<CharRange> RANGE_BY_LOWER =
    Comparator.comparing(CharRange::lowerBound);

  public boolean isEmpty() {
    return ranges.isEmpty();
  }

  /**
   * Check if the set contains exactly one code unit.
   */
  public boolean isSingleton() {
    return ranges.size() == 1 && ranges.get(0).size() == 1;
  }

  /**
   * Build a structure optimized for membership queries at match time.
   *
   * @return balanced search tree over the ranges of this set
   */
  public CharRangeTree toSearchStructure() {
    return CharRangeTree.fromSortedRanges(ranges);
  }

  @Override
  public String toString() {
    final var builder = new StringBuilder("CharRangeSet.of(");
    boolean needsSpace = false;
    for (var range : ranges) {
      if (needsSpace) {
        builder.append(", ");
      } else {
        needsSpace = true;
      }
      builder.append(range.compactString());
    }
    builder.append(')');
    return builder.toString();
  }
}
