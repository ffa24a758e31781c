package regexvm.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Character range sets")
class CharRangeSetTest {

  private static final CharRange A_TO_C = CharRange.between('a', 'c');
  private static final CharRange X_TO_Z = CharRange.between('x', 'z');

  @Test
  void addMergesOverlappingAndAdjacentRanges() {
    final CharRangeSet set = CharRangeSet.EMPTY
      .add(A_TO_C)
      .add(X_TO_Z)
      .add(CharRange.between('d', 'f'))
      .add(CharRange.between('e', 'h'));

    assertThat(set.ranges()).containsExactly(
      CharRange.between('a', 'h'),
      X_TO_Z
    );
  }

  @Test
  void addBridgesTwoRanges() {
    final CharRangeSet set = CharRangeSet.of(A_TO_C, X_TO_Z).add(CharRange.between('d', 'w'));

    assertThat(set.ranges()).containsExactly(CharRange.between('a', 'z'));
  }

  @Test
  void unionOfAcceptsRangesInAnyOrder() {
    final CharRangeSet set = CharRangeSet.unionOf(X_TO_Z, CharRange.single('m'), A_TO_C, CharRange.single('b'));

    assertThat(set).isEqualTo(CharRangeSet.of(A_TO_C, CharRange.single('m'), X_TO_Z));
  }

  @Test
  void unionIsFoldedAdd() {
    final CharRangeSet left = CharRangeSet.of(A_TO_C);
    final CharRangeSet right = CharRangeSet.of(CharRange.single('d'), X_TO_Z);

    assertThat(left.union(right).ranges()).containsExactly(CharRange.between('a', 'd'), X_TO_Z);
    assertThat(right.union(left)).isEqualTo(left.union(right));
  }

  @Test
  void negateEmitsGapsAndDomainEnds() {
    final CharRangeSet negated = CharRangeSet.of(A_TO_C, X_TO_Z).negate();

    assertThat(negated.ranges()).containsExactly(
      CharRange.between(Character.MIN_VALUE, '`'),
      CharRange.between('d', 'w'),
      CharRange.between('{', Character.MAX_VALUE)
    );
  }

  @Test
  void negateOfDomainBoundaries() {
    assertThat(CharRangeSet.EMPTY.negate()).isEqualTo(CharRangeSet.FULL);
    assertThat(CharRangeSet.FULL.negate()).isEqualTo(CharRangeSet.EMPTY);

    final CharRangeSet edges = CharRangeSet.of(
      CharRange.single(Character.MIN_VALUE),
      CharRange.single(Character.MAX_VALUE)
    );
    assertThat(edges.negate().ranges())
      .containsExactly(CharRange.between((char) 1, (char) (Character.MAX_VALUE - 1)));
    assertThat(edges.negate().negate()).isEqualTo(edges);
  }

  @Test
  void containsChecksEveryRange() {
    final CharRangeSet set = CharRangeSet.of(A_TO_C, CharRange.single('m'), X_TO_Z);

    assertThat(set.contains('a')).isTrue();
    assertThat(set.contains('c')).isTrue();
    assertThat(set.contains('m')).isTrue();
    assertThat(set.contains('z')).isTrue();
    assertThat(set.contains('d')).isFalse();
    assertThat(set.contains('A')).isFalse();
    assertThat(set.contains('{')).isFalse();
    assertThat(CharRangeSet.EMPTY.contains('a')).isFalse();
  }

  @Test
  void ofRejectsUnsortedOrAdjacentRanges() {
    assertThatIllegalArgumentException().isThrownBy(() -> CharRangeSet.of(X_TO_Z, A_TO_C));
    assertThatIllegalArgumentException().isThrownBy(() -> CharRangeSet.of(A_TO_C, CharRange.single('d')));
  }

  @Test
  void rangeRejectsReversedBounds() {
    assertThatIllegalArgumentException().isThrownBy(() -> CharRange.between('z', 'a'));
  }

  @Test
  void singletonDetection() {
    assertThat(CharRangeSet.of(CharRange.single('q')).isSingleton()).isTrue();
    assertThat(CharRangeSet.of(A_TO_C).isSingleton()).isFalse();
    assertThat(CharRangeSet.EMPTY.isSingleton()).isFalse();
  }

  @Test
  void searchStructureAgreesWithSet() {
    final CharRangeSet set = CharRangeSet.unionOf(
      CharRange.between('0', '9'),
      CharRange.between('A', 'Z'),
      CharRange.single('_'),
      A_TO_C,
      CharRange.single('q'),
      X_TO_Z,
      CharRange.between('À', 'ÿ')
    );
    final CharRangeTree tree = set.toSearchStructure();

    assertThat(tree.size()).isEqualTo(set.ranges().size());
    assertThat(tree.height()).isLessThanOrEqualTo(3);
    for (int c = 0; c <= 0x200; c++) {
      assertThat(tree.contains((char) c)).as("code unit %d", c).isEqualTo(set.contains((char) c));
    }
  }

  @Test
  void emptySearchStructureContainsNothing() {
    final CharRangeTree tree = CharRangeSet.EMPTY.toSearchStructure();

    assertThat(tree.size()).isZero();
    assertThat(tree.contains('a')).isFalse();
    assertThat(tree.toString()).isEqualTo("[]");
  }

  @Test
  void renderingEscapesUnprintableCodeUnits() {
    assertThat(CharRange.between('a', 'c').compactString()).isEqualTo("a-c");
    assertThat(CharRange.single('\n').compactString()).isEqualTo("\\u000a");
    assertThat(CharRangeSet.of(A_TO_C, X_TO_Z).toSearchStructure().toString()).isEqualTo("[a-cx-z]");
  }
}
