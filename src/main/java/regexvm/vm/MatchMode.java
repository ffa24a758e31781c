package regexvm.vm;

/**
 * How a match relates to the region being searched.
 */
public enum MatchMode {

  /**
   * Match must start at the search start and end at the region end.
   */
  FULL,

  /**
   * Match must start at the search start but may end anywhere.
   */
  PREFIX,

  /**
   * Leftmost match starting at or after the search start.
   */
  SEARCH
}
