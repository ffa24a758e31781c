package regexvm.parser;

import regexvm.util.CharRangeSet;

/**
 * Node of a parsed regular expression.
 *
 * <p>Trees are immutable. The same subtree may appear several times in a tree
 * (repetition bounds are expanded into copies), so traversals must not rely on
 * node identity.
 */
public sealed interface ReNode extends StackItem {

  /**
   * Traverse the tree bottom-up.
   *
   * @param visitor visitor receiving the traversal
   * @return the visitor's output for this node
   */
  <R> R accept(RegexVisitor<R> visitor);

  ReNode EMPTY = new Empty();
  ReNode ANY_CHAR = new AnyChar();
  ReNode START_ANCHOR = new StartAnchor();
  ReNode END_ANCHOR = new EndAnchor();

  /**
   * Matches the empty string.
   */
  record Empty() implements ReNode {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitEpsilon();
    }
  }

  /**
   * Matches any code unit: {@code .}
   */
  record AnyChar() implements ReNode {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitAnyChar();
    }
  }

  /**
   * Matches exactly one code unit.
   */
  record Literal(char value) implements ReNode {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitLiteral(value);
    }
  }

  /**
   * Matches {@code left} then {@code right}.
   */
  record Concat(ReNode left, ReNode right) implements ReNode {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitConcatenation(left.accept(visitor), right.accept(visitor));
    }
  }

  /**
   * Matches {@code left} or else {@code right}: {@code left|right}
   */
  record Alt(ReNode left, ReNode right) implements ReNode {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitAlternation(left.accept(visitor), right.accept(visitor));
    }
  }

  /**
   * Optional: {@code e?} (greedy) or {@code e??} (non-greedy)
   */
  record Opt(ReNode inner, boolean greedy) implements ReNode {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitOptional(inner.accept(visitor), greedy);
    }
  }

  /**
   * Zero or more: {@code e*} (greedy) or {@code e*?} (non-greedy)
   */
  record Star(ReNode inner, boolean greedy) implements ReNode {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitKleene(inner.accept(visitor), greedy);
    }
  }

  /**
   * One or more: {@code e+} (greedy) or {@code e+?} (non-greedy)
   */
  record Plus(ReNode inner, boolean greedy) implements ReNode {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitPlus(inner.accept(visitor), greedy);
    }
  }

  /**
   * Bracket expression or built-in class: {@code [a-z]}, {@code \d}
   */
  record CharClass(CharRangeSet ranges) implements ReNode {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitCharacterClass(ranges);
    }
  }

  /**
   * Capturing group: {@code (e)}
   *
   * @param inner group body
   * @param index capture index (0 is reserved for the whole match)
   */
  record Capture(ReNode inner, int index) implements ReNode {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitGroup(inner.accept(visitor), index);
    }
  }

  /**
   * Start of input: {@code ^}
   */
  record StartAnchor() implements ReNode {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitStartAnchor();
    }
  }

  /**
   * End of input: {@code $}
   */
  record EndAnchor() implements ReNode {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitEndAnchor();
    }
  }
}
