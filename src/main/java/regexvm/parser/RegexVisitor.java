package regexvm.parser;

import regexvm.util.CharRangeSet;

/**
 * Bottom-up traversal of the regular expression AST.
 *
 * @param <R> output from traversing the regex pattern AST
 */
public interface RegexVisitor<R> {

  /**
   * Empty expression, matching only the empty string.
   */
  R visitEpsilon();

  /**
   * Matches any single code unit.
   */
  R visitAnyChar();

  /**
   * Matches exactly one code unit.
   *
   * @param value code unit to match
   */
  R visitLiteral(char value);

  /**
   * Matches any code unit inside the set.
   *
   * @param characterClass set of accepted code units
   */
  R visitCharacterClass(CharRangeSet characterClass);

  /**
   * Matches a concatenation of two patterns.
   *
   * @param lhs first pattern to match
   * @param rhs second pattern to match
   */
  R visitConcatenation(R lhs, R rhs);

  /**
   * Matches a union of two patterns.
   *
   * This is not a symmetric operation; if both sides match, the left-hand side
   * is the one taken in the match.
   *
   * @param lhs first pattern to try matching
   * @param rhs second pattern to try matching
   */
  R visitAlternation(R lhs, R rhs);

  /**
   * Matches a pattern zero or more times.
   *
   * @param lhs pattern to match
   * @param greedy whether to prioritize a longer vs. shorter match
   */
  R visitKleene(R lhs, boolean greedy);

  /**
   * Matches a pattern zero or one times.
   *
   * @param lhs pattern to match
   * @param greedy whether to prioritize a non-empty vs. empty match
   */
  R visitOptional(R lhs, boolean greedy);

  /**
   * Matches a pattern one or more times.
   *
   * @param lhs pattern to match
   * @param greedy whether to prioritize a longer vs. shorter match
   */
  R visitPlus(R lhs, boolean greedy);

  /**
   * Matches a parenthesized, capturing pattern.
   *
   * @param arg parenthesized body
   * @param groupIndex capture index of the group
   */
  R visitGroup(R arg, int groupIndex);

  /**
   * Zero-width match at the start of the input.
   */
  R visitStartAnchor();

  /**
   * Zero-width match at the end of the input.
   */
  R visitEndAnchor();
}
