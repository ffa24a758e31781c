package regexvm.vm;

import java.util.Arrays;
import java.util.BitSet;
import regexvm.program.Instruction;
import regexvm.program.Program;

/**
 * Mutable state of one match attempt.
 *
 * <p>The current thread is a program counter, a position in the input, and an
 * array of capture slots. Pending threads live on an explicit stack and are
 * picked up again with {@link #resume()} once the current thread fails. Slot
 * arrays are shared between a thread and the threads forked from it until
 * one of them writes, at which point the writer takes a private copy.
 *
 * <p>Every {@code (pc, position)} state entered is remembered, and entering
 * the same state twice fails immediately. The outcome from a state never
 * depends on the capture slots, so a state seen before either already
 * accepted (and the search is over) or already failed.
 *
 * <p>This is the runtime interface for both {@link Interpreter} and generated
 * runners, so its methods are public. Not thread-safe.
 */
public final class Backtracker {

  private static final int INITIAL_STACK_CAPACITY = 16;

  private final Program program;
  private final CharSequence input;
  private final int regionStart;
  private final int regionEnd;
  private final MatchMode mode;

  // Visited positions (relative to the region start), one set per instruction
  private final BitSet[] visited;

  // Stack of pending threads
  private int[] stackPcs = new int[INITIAL_STACK_CAPACITY];
  private int[] stackPositions = new int[INITIAL_STACK_CAPACITY];
  private int[][] stackSlots = new int[INITIAL_STACK_CAPACITY][];
  private int stackSize = 0;

  // Current thread
  private int pc;
  private int position;
  private int[] slots;
  private boolean slotsShared;

  /**
   * @param program program being run
   * @param input text being matched
   * @param regionStart start of the region in the input (inclusive)
   * @param regionEnd end of the region in the input (exclusive)
   * @param mode how the match relates to the region
   */
  public Backtracker(
    Program program,
    CharSequence input,
    int regionStart,
    int regionEnd,
    MatchMode mode
  ) {
    if (regionStart < 0 || regionEnd > input.length() || regionStart > regionEnd) {
      throw new IndexOutOfBoundsException(
        "Region [" + regionStart + ", " + regionEnd + ") out of bounds for length " + input.length()
      );
    }
    this.program = program;
    this.input = input;
    this.regionStart = regionStart;
    this.regionEnd = regionEnd;
    this.mode = mode;
    this.visited = new BitSet[program.size()];
  }

  /**
   * Discard pending threads and queue a single thread starting at the first
   * instruction with all slots unset.
   *
   * <p>States visited by earlier attempts stay visited.
   *
   * @param start position in the input where the thread starts
   */
  public void startAt(int start) {
    if (start < regionStart || start > regionEnd) {
      throw new IndexOutOfBoundsException("Start " + start + " outside of region");
    }
    stackSize = 0;
    final int[] initialSlots = new int[program.slotCount()];
    Arrays.fill(initialSlots, -1);
    push(0, start, initialSlots);
  }

  private void push(int threadPc, int threadPosition, int[] threadSlots) {
    if (stackSize == stackPcs.length) {
      final int capacity = stackSize * 2;
      stackPcs = Arrays.copyOf(stackPcs, capacity);
      stackPositions = Arrays.copyOf(stackPositions, capacity);
      stackSlots = Arrays.copyOf(stackSlots, capacity);
    }
    stackPcs[stackSize] = threadPc;
    stackPositions[stackSize] = threadPosition;
    stackSlots[stackSize] = threadSlots;
    stackSize++;
  }

  /**
   * Make the most recently forked pending thread current.
   *
   * @return whether there was a thread to resume
   */
  public boolean resume() {
    if (stackSize == 0) {
      return false;
    }
    stackSize--;
    pc = stackPcs[stackSize];
    position = stackPositions[stackSize];
    slots = stackSlots[stackSize];
    stackSlots[stackSize] = null;
    slotsShared = true;
    return true;
  }

  /**
   * Program counter the current thread was resumed at.
   */
  public int pc() {
    return pc;
  }

  /**
   * Current position in the input.
   */
  public int position() {
    return position;
  }

  /**
   * Mark the state at an instruction and the current position as visited.
   *
   * @param instructionPc program counter of the instruction being entered
   * @return whether the state was not visited before (so execution continues)
   */
  public boolean enter(int instructionPc) {
    BitSet positions = visited[instructionPc];
    if (positions == null) {
      positions = new BitSet();
      visited[instructionPc] = positions;
    }
    final int offset = position - regionStart;
    if (positions.get(offset)) {
      return false;
    }
    positions.set(offset);
    return true;
  }

  /**
   * Queue a thread at another instruction, at the current position and with
   * the current slots.
   *
   * @param target program counter of the pending thread
   */
  public void fork(int target) {
    push(target, position, slots);
    slotsShared = true;
  }

  /**
   * Store the current position into a capture slot.
   *
   * @param slot index of the slot
   */
  public void save(int slot) {
    if (slotsShared) {
      slots = slots.clone();
      slotsShared = false;
    }
    slots[slot] = position;
  }

  /**
   * Consume a specific code unit.
   *
   * @return whether the next code unit was the expected one
   */
  public boolean consume(char expected) {
    if (position < regionEnd && input.charAt(position) == expected) {
      position++;
      return true;
    }
    return false;
  }

  /**
   * Consume any code unit.
   *
   * @return whether the region had a code unit left
   */
  public boolean consumeAny() {
    if (position < regionEnd) {
      position++;
      return true;
    }
    return false;
  }

  /**
   * Consume a code unit in the class of the {@code class} instruction at a
   * program counter.
   *
   * @param classPc program counter of a {@link Instruction.MatchClass}
   * @return whether the next code unit was in the class
   */
  public boolean consumeClass(int classPc) {
    final var matchClass = (Instruction.MatchClass) program.instruction(classPc);
    if (position < regionEnd && matchClass.ranges().contains(input.charAt(position))) {
      position++;
      return true;
    }
    return false;
  }

  public boolean atStart() {
    return position == regionStart;
  }

  public boolean atEnd() {
    return position == regionEnd;
  }

  /**
   * Whether the current thread may accept here.
   *
   * <p>In {@link MatchMode#FULL} mode, accepting before the end of the region
   * fails the thread.
   */
  public boolean accept() {
    return mode != MatchMode.FULL || position == regionEnd;
  }

  /**
   * Copy the slots of the current thread.
   *
   * @param groups destination, of length {@link Program#slotCount()}
   */
  public void copySlots(int[] groups) {
    System.arraycopy(slots, 0, groups, 0, groups.length);
  }
}
