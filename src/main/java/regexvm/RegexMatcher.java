package regexvm;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.regex.MatchResult;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import regexvm.vm.MatchMode;

/**
 * Mutable matcher object.
 *
 * <p>Mirrors {@code java.util.regex.Matcher}: after a successful match, the
 * {@link MatchResult} methods report the offsets of the latest match. Anchors
 * match at the bounds of the current region.
 */
public final class RegexMatcher extends ArrayMatchResult {

  private final Regex regex;

  /**
   * Index into {@link #input} where matching should start.
   */
  private int regionStart = 0;

  /**
   * Index into {@link #input} where matching should end.
   */
  private int regionEnd;

  /**
   * Index into {@link #input} where the next {@link #find()} starts.
   */
  private int currentStart = 0;

  /**
   * Whether the last matching operation was successful.
   *
   * <p>If this is {@code false}, then methods extracting match results will
   * throw an illegal state exception.
   */
  private boolean successfulMatch = false;

  /**
   * Whether the last successful match was empty, in which case the next
   * {@link #find()} starts one code unit further on.
   */
  private boolean emptyMatch = false;

  RegexMatcher(Regex regex, CharSequence input) {
    super(input, new int[2 * (regex.groupCount() + 1)], regex.groupCount());
    this.regex = regex;
    this.regionEnd = input.length();
  }

  /**
   * Check that the match is in a successful state.
   */
  private void checkMatch() throws IllegalStateException {
    if (!successfulMatch) {
      throw new IllegalStateException("No match found");
    }
  }

  @Override
  public int start() throws IllegalStateException {
    checkMatch();
    return super.start();
  }

  @Override
  public int end() throws IllegalStateException {
    checkMatch();
    return super.end();
  }

  @Override
  public String group() throws IllegalStateException {
    checkMatch();
    return super.group();
  }

  @Override
  public int start(int groupIndex) throws IllegalStateException, IndexOutOfBoundsException {
    checkMatch();
    return super.start(groupIndex);
  }

  @Override
  public int end(int groupIndex) throws IllegalStateException, IndexOutOfBoundsException {
    checkMatch();
    return super.end(groupIndex);
  }

  @Override
  public String group(int groupIndex) throws IllegalStateException, IndexOutOfBoundsException {
    checkMatch();
    return super.group(groupIndex);
  }

  /**
   * Get the regex being matched by this matcher.
   *
   * @return regex matched by this matcher
   */
  public Regex regex() {
    return regex;
  }

  /**
   * Check if the last match hit the end of the region.
   *
   * @return whether the latest match was successful and reached the end of the region
   */
  public boolean hitEnd() {
    return successfulMatch && super.end() == regionEnd;
  }

  /**
   * Get the start of the region of the input being matched.
   *
   * @return start of the region to match
   */
  public int regionStart() {
    return regionStart;
  }

  /**
   * Get the end of the region of the input being matched.
   *
   * @return end of the region to match
   */
  public int regionEnd() {
    return regionEnd;
  }

  /**
   * Update the region of the input to match and reset to this region.
   *
   * @param start new start of the match region
   * @param end new end of the match region
   * @return this matcher
   */
  public RegexMatcher region(int start, int end) throws IndexOutOfBoundsException {
    if (start < 0 || start > input.length()) {
      throw new IndexOutOfBoundsException("start");
    } else if (end < start || end > input.length()) {
      throw new IndexOutOfBoundsException("end");
    }

    this.regionStart = start;
    this.regionEnd = end;
    this.currentStart = start;
    this.successfulMatch = false;
    this.emptyMatch = false;
    return this;
  }

  /**
   * Reset the region to the whole input and forget the latest match.
   *
   * @return this matcher
   */
  public RegexMatcher reset() {
    return region(0, input.length());
  }

  /**
   * Update other matcher state based on the match outcome.
   */
  private boolean postMatchUpdate(boolean successfulMatch) {
    this.successfulMatch = successfulMatch;
    if (successfulMatch) {
      this.currentStart = groups[1];
      this.emptyMatch = groups[0] == groups[1];
    }
    return successfulMatch;
  }

  /**
   * Match the whole region against the regex and extract capture groups.
   *
   * @return whether the pattern matched
   */
  public boolean matches() {
    return postMatchUpdate(regex.execute(input, regionStart, regionEnd, regionStart, MatchMode.FULL, groups));
  }

  /**
   * Match a prefix of the region against the regex and extract capture groups.
   *
   * @return whether the pattern matched
   */
  public boolean lookingAt() {
    return postMatchUpdate(regex.execute(input, regionStart, regionEnd, regionStart, MatchMode.PREFIX, groups));
  }

  /**
   * Find the next match of the regex inside the region and extract capture
   * groups.
   *
   * <p>The search starts where the previous match ended, or one code unit
   * further if the previous match was empty.
   *
   * @return whether the pattern matched
   */
  public boolean find() {
    final int from = emptyMatch ? currentStart + 1 : currentStart;
    if (from > regionEnd) {
      successfulMatch = false;
      return false;
    }
    return postMatchUpdate(regex.execute(input, regionStart, regionEnd, from, MatchMode.SEARCH, groups));
  }

  /**
   * Reset the matcher and find the next match starting at an offset.
   *
   * @param start offset at which to start searching
   * @return whether the pattern matched
   */
  public boolean find(int start) throws IndexOutOfBoundsException {
    if (start < 0 || start > input.length()) {
      throw new IndexOutOfBoundsException("Illegal start index " + start);
    }
    reset();
    currentStart = start;
    return find();
  }

  /**
   * Make an immutable snapshot of the match result.
   */
  @Override
  public ArrayMatchResult toMatchResult() {
    checkMatch();
    return new ArrayMatchResult(input.toString(), groups);
  }

  /**
   * Stream of the remaining matches, as found by repeated {@link #find()}.
   */
  public Stream<MatchResult> results() {
    if (!find()) {
      return Stream.empty();
    }

    final var iterator = new Iterator<MatchResult>() {

      // Make an immutable copy of the input for reuse in match results
      final String immutableInput = input.toString();

      /* 0 means we haven't tried the next match
       * 1 means we tried the next match and there is a result found (and ready)
       * 2 means we tried the next match and there is no result found
       */
      int nextFlag = 1;

      private void checkNext() {
        if (nextFlag == 0) {
          nextFlag = find() ? 1 : 2;
        }
      }

      @Override
      public boolean hasNext() {
        checkNext();
        return nextFlag == 1;
      }

      @Override
      public MatchResult next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        nextFlag = 0;
        return new ArrayMatchResult(immutableInput, groups);
      }

      @Override
      public void forEachRemaining(Consumer<? super MatchResult> action) {
        checkNext();
        boolean hasNext = nextFlag == 1;
        while (hasNext) {
          action.accept(new ArrayMatchResult(immutableInput, groups));
          hasNext = find();
        }
        nextFlag = 2;
      }
    };

    return StreamSupport.stream(
      Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
      false
    );
  }

  /**
   * Replace every match in the input with a literal replacement.
   *
   * <p>Unlike {@code java.util.regex.Matcher}, {@code $} and {@code \} in the
   * replacement have no special meaning.
   *
   * @param replacement literal replacement text
   * @return input with every match replaced
   */
  public String replaceAll(String replacement) {
    reset();
    if (!find()) {
      return input.toString();
    }

    final var builder = new StringBuilder();
    int lastEnd = 0;
    do {
      builder.append(input, lastEnd, groups[0]);
      builder.append(replacement);
      lastEnd = groups[1];
    } while (find());
    builder.append(input, lastEnd, input.length());
    return builder.toString();
  }

  @Override
  public String toString() {
    return "RegexMatcher(" + regex.pattern() + ", region = [" + regionStart + ", " + regionEnd + "))";
  }
}
