package regexvm.compiler;

import java.util.ArrayList;
import java.util.List;
import regexvm.parser.ParsedRegex;
import regexvm.parser.ReNode;
import regexvm.parser.RegexVisitor;
import regexvm.program.Instruction;
import regexvm.program.Program;
import regexvm.util.CharRangeSet;

/**
 * Lowers a syntax tree into a program for the backtracking virtual machine.
 *
 * <p>Code is generated bottom-up: every subtree becomes a {@link Fragment}
 * with addresses relative to its own start, and parent nodes stitch their
 * children together by relocating them. The order of the two targets of every
 * {@code split} encodes the priority between the alternatives, so the leftmost
 * alternative and the greedy choice come first.
 */
public final class Compiler implements RegexVisitor<Fragment> {

  private static final Compiler INSTANCE = new Compiler();

  private Compiler() { }

  /**
   * Compile a syntax tree into a program.
   *
   * <p>The whole tree is wrapped in the implicit capture group 0 and the
   * program ends with an {@code accept}.
   *
   * @param root root of the syntax tree
   * @return compiled program
   */
  public static Program compile(ReNode root) {
    return compile(root, 0);
  }

  /**
   * Compile a parsed pattern into a program.
   *
   * <p>The program has a capture group for every group in the pattern, even
   * those that no longer appear in the tree.
   *
   * @param parsed parsed pattern
   * @return compiled program
   */
  public static Program compile(ParsedRegex parsed) {
    return compile(parsed.root(), parsed.groupCount());
  }

  private static Program compile(ReNode root, int groupCount) {
    final Fragment body = new ReNode.Capture(root, 0).accept(INSTANCE);
    final List<Instruction> code = body.buffer(1);
    body.appendTo(code);
    code.add(Instruction.ACCEPT);
    return new Program(Math.max(body.captureCount(), groupCount + 1), code);
  }

  @Override
  public Fragment visitEpsilon() {
    return Fragment.EMPTY;
  }

  @Override
  public Fragment visitAnyChar() {
    return Fragment.of(Instruction.MATCH_ANY);
  }

  @Override
  public Fragment visitLiteral(char value) {
    return Fragment.of(new Instruction.MatchLiteral(value));
  }

  @Override
  public Fragment visitCharacterClass(CharRangeSet characterClass) {
    return Fragment.of(new Instruction.MatchClass(characterClass.toSearchStructure()));
  }

  @Override
  public Fragment visitConcatenation(Fragment lhs, Fragment rhs) {
    final List<Instruction> code = new ArrayList<>(lhs.size() + rhs.size());
    lhs.appendTo(code);
    rhs.appendTo(code);
    return new Fragment(code, Math.max(lhs.captureCount(), rhs.captureCount()));
  }

  /*     split L1, L2
   * L1: <lhs>
   *     jump L3
   * L2: <rhs>
   * L3:
   */
  @Override
  public Fragment visitAlternation(Fragment lhs, Fragment rhs) {
    final int l1 = 1;
    final int l2 = l1 + lhs.size() + 1;
    final int l3 = l2 + rhs.size();

    final List<Instruction> code = new ArrayList<>(l3);
    code.add(new Instruction.Split(l1, l2));
    lhs.appendTo(code);
    code.add(new Instruction.Jump(l3));
    rhs.appendTo(code);
    return new Fragment(code, Math.max(lhs.captureCount(), rhs.captureCount()));
  }

  /* L0: split L1, L2   (swapped if lazy)
   * L1: <lhs>
   *     jump L0
   * L2:
   */
  @Override
  public Fragment visitKleene(Fragment lhs, boolean greedy) {
    final int l0 = 0;
    final int l1 = 1;
    final int l2 = l1 + lhs.size() + 1;

    final List<Instruction> code = lhs.buffer(2);
    code.add(split(l1, l2, greedy));
    lhs.appendTo(code);
    code.add(new Instruction.Jump(l0));
    return new Fragment(code, lhs.captureCount());
  }

  /*     split L1, L2   (swapped if lazy)
   * L1: <lhs>
   * L2:
   */
  @Override
  public Fragment visitOptional(Fragment lhs, boolean greedy) {
    final int l1 = 1;
    final int l2 = l1 + lhs.size();

    final List<Instruction> code = lhs.buffer(1);
    code.add(split(l1, l2, greedy));
    lhs.appendTo(code);
    return new Fragment(code, lhs.captureCount());
  }

  /* L0: <lhs>
   *     split L0, L1   (swapped if lazy)
   * L1:
   */
  @Override
  public Fragment visitPlus(Fragment lhs, boolean greedy) {
    final int l0 = 0;
    final int l1 = lhs.size() + 1;

    final List<Instruction> code = lhs.buffer(1);
    lhs.appendTo(code);
    code.add(split(l0, l1, greedy));
    return new Fragment(code, lhs.captureCount());
  }

  @Override
  public Fragment visitGroup(Fragment arg, int groupIndex) {
    final List<Instruction> code = arg.buffer(2);
    code.add(new Instruction.SaveSlot(2 * groupIndex));
    arg.appendTo(code);
    code.add(new Instruction.SaveSlot(2 * groupIndex + 1));
    return new Fragment(code, Math.max(arg.captureCount(), groupIndex + 1));
  }

  @Override
  public Fragment visitStartAnchor() {
    return Fragment.of(Instruction.CHECK_START);
  }

  @Override
  public Fragment visitEndAnchor() {
    return Fragment.of(Instruction.CHECK_END);
  }

  private static Instruction split(int preferred, int other, boolean greedy) {
    return greedy ? new Instruction.Split(preferred, other) : new Instruction.Split(other, preferred);
  }
}
