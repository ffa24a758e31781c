package regexvm.util;

import java.util.List;

/**
 * Balanced binary search tree of disjoint code unit ranges.
 *
 * <p>This is the match-time form of a {@link CharRangeSet}: the root splits
 * the ranges in half, so a membership query visits at most
 * {@code O(log(M))} nodes for {@code M} ranges.
 */
public final class CharRangeTree {

  private static final CharRangeTree EMPTY = new CharRangeTree(null, 0);

  private final Node root;
  private final int rangeCount;

  private CharRangeTree(Node root, int rangeCount) {
    this.root = root;
    this.rangeCount = rangeCount;
  }

  /**
   * Build a tree from ranges that are already sorted and disjoint.
   *
   * @param ranges canonical ranges, as found in {@link CharRangeSet#ranges()}
   * @return balanced tree
   */
  static CharRangeTree fromSortedRanges(List<CharRange> ranges) {
    if (ranges.isEmpty()) {
      return EMPTY;
    }
    return new CharRangeTree(build(ranges, 0, ranges.size() - 1), ranges.size());
  }

  private static Node build(List<CharRange> ranges, int from, int to) {
    if (from > to) {
      return null;
    }
    final int middle = (from + to) >>> 1;
    final CharRange range = ranges.get(middle);
    return new Node(
      range.lowerBound(),
      range.upperBound(),
      build(ranges, from, middle - 1),
      build(ranges, middle + 1, to)
    );
  }

  /**
   * Whether some range in the tree contains the code unit.
   *
   * @param codeUnit code unit
   * @return whether the code unit is in the tree
   */
  public boolean contains(char codeUnit) {
    Node node = root;
    while (node != null) {
      if (codeUnit < node.lowerBound) {
        node = node.left;
      } else if (codeUnit > node.upperBound) {
        node = node.right;
      } else {
        return true;
      }
    }
    return false;
  }

  /**
   * Number of ranges stored in the tree.
   */
  public int size() {
    return rangeCount;
  }

  /**
   * Height of the tree (0 for an empty tree).
   */
  public int height() {
    return height(root);
  }

  private static int height(Node node) {
    return node == null ? 0 : 1 + Math.max(height(node.left), height(node.right));
  }

  @Override
  public String toString() {
    final var builder = new StringBuilder("[");
    appendInOrder(root, builder);
    return builder.append(']').toString();
  }

  private static void appendInOrder(Node node, StringBuilder builder) {
    if (node == null) {
      return;
    }
    appendInOrder(node.left, builder);
    builder.append(CharRange.between(node.lowerBound, node.upperBound).compactString());
    appendInOrder(node.right, builder);
  }

  private record Node(char lowerBound, char upperBound, Node left, Node right) { }
}
