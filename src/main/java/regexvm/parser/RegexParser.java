package regexvm.parser;

import java.util.ArrayList;
import java.util.List;
import regexvm.RegexConfig;
import regexvm.parser.Marker.AlternationMarker;
import regexvm.parser.Marker.CapturingGroupStart;
import regexvm.parser.Marker.CharClassStart;
import regexvm.parser.Marker.RepetitionBoundStart;
import regexvm.util.CharRange;
import regexvm.util.CharRangeSet;

/**
 * Parser for POSIX extended regular expressions.
 *
 * <p>This is a shift-reduce parser: every token either pushes something onto
 * a stack (a finished {@link ReNode}, or a {@link Marker} for a construct which
 * still needs its closing token) or reduces the top of the stack into a new
 * node. The closing tokens {@code )}, {@code ]}, and <code>}</code> reduce
 * back to their matching marker, and the end of the input reduces whatever
 * alternatives remain into a single root.
 *
 * <p>Supported syntax:
 *
 * <ul>
 *   <li>literals, {@code .}, and escapes of meta characters ({@code \*})
 *   <li>built-in classes {@code \d \s \w} and their negations {@code \D \S \W}
 *   <li>bracket expressions {@code [a-z_]}, {@code [^0-9]}, nested brackets
 *   <li>capturing groups {@code (...)} and alternation {@code a|b}
 *   <li>greedy quantifiers {@code * + ?} and non-greedy {@code *? +? ??}
 *   <li>repetition bounds <code>{m}</code>, <code>{m,}</code>, <code>{m,n}</code>
 *   <li>anchors {@code ^} and {@code $}
 * </ul>
 */
public final class RegexParser {

  /**
   * Default largest number accepted in a repetition bound.
   */
  public static final int DEFAULT_MAX_REPETITION = 1000;

  private final String input;
  private final RegexLexer lexer;
  private final int maxRepetition;

  // Top of the stack is the end of the list
  private final ArrayList<StackItem> stack = new ArrayList<>();

  private LexerMode mode = LexerMode.NORMAL;

  // Number of currently open groups and bracket expressions
  private int level = 0;

  private int groupCount = 0;

  private RegexParser(String input, int maxRepetition) {
    this.input = input;
    this.lexer = new RegexLexer(input);
    this.maxRepetition = maxRepetition;
  }

  /**
   * Parse a regular expression pattern.
   *
   * @param input regular expression pattern
   * @return root of the syntax tree
   */
  public static ReNode parse(String input) throws RegexParseException {
    return parse(input, DEFAULT_MAX_REPETITION);
  }

  /**
   * Parse a regular expression pattern, with limits taken from a configuration.
   *
   * @param input regular expression pattern
   * @param config configuration supplying the repetition limit
   * @return root of the syntax tree
   */
  public static ReNode parse(String input, RegexConfig config) throws RegexParseException {
    return parse(input, config.maxRepetition());
  }

  /**
   * Parse a regular expression pattern.
   *
   * @param input regular expression pattern
   * @param maxRepetition largest number accepted in a repetition bound
   * @return root of the syntax tree
   */
  public static ReNode parse(String input, int maxRepetition) throws RegexParseException {
    return parseRegex(input, maxRepetition).root();
  }

  /**
   * Parse a regular expression pattern, keeping the count of capture groups.
   *
   * @param input regular expression pattern
   * @param config configuration supplying the repetition limit
   * @return syntax tree and group count
   */
  public static ParsedRegex parseRegex(String input, RegexConfig config) throws RegexParseException {
    return parseRegex(input, config.maxRepetition());
  }

  /**
   * Parse a regular expression pattern, keeping the count of capture groups.
   *
   * @param input regular expression pattern
   * @param maxRepetition largest number accepted in a repetition bound
   * @return syntax tree and group count
   */
  public static ParsedRegex parseRegex(String input, int maxRepetition) throws RegexParseException {
    final var parser = new RegexParser(input, maxRepetition);

    int offset = 0;
    while (offset < input.length()) {
      offset = parser.parseToken(offset);
    }

    parser.reduceAlternatives(0);
    if (parser.stack.size() != 1 || !(parser.stack.get(0) instanceof ReNode)) {
      throw parser.error("Malformed regular expression", 0);
    }
    return new ParsedRegex((ReNode) parser.stack.get(0), parser.groupCount);
  }

  private RegexParseException error(String description, int offset) {
    return new RegexParseException(description, input, offset);
  }

  private StackItem peek(int depth) {
    final int index = stack.size() - 1 - depth;
    return index >= 0 ? stack.get(index) : null;
  }

  private StackItem pop() {
    return stack.isEmpty() ? null : stack.remove(stack.size() - 1);
  }

  private void push(StackItem item) {
    stack.add(item);
  }

  /**
   * Process one token, updating the stack.
   *
   * @param offset offset of the token
   * @return offset of the following token
   */
  private int parseToken(int offset) {
    final Token token = lexer.nextToken(mode, offset);

    if (token instanceof Token.EndOfInput) {
      return input.length();
    } else if (token instanceof Token.Literal literal) {
      push(new ReNode.Literal(literal.value()));
      return token.next();
    } else if (token instanceof Token.Builtin builtin) {
      push(new ReNode.CharClass(builtin.builtinClass().ranges()));
      return token.next();
    }

    final char symbol = ((Token.Meta) token).symbol();
    switch (symbol) {
      case '.':
        push(ReNode.ANY_CHAR);
        return token.next();

      case '*':
      case '+':
      case '?':
        return parseQuantifier(symbol, token);

      case '(':
        push(new CapturingGroupStart(level, ++groupCount, offset));
        level++;
        return token.next();

      case ')':
        reduceCapturing(level - 1, offset);
        level--;
        return token.next();

      case '|':
        reduceAlternatives(level);
        push(new AlternationMarker(offset));
        return token.next();

      case '[': {
        final boolean negated = lexer.rawCharIs(token.next(), '^');
        push(new CharClassStart(level, offset));
        level++;
        mode = new LexerMode.Set(negated, mode);
        return negated ? token.next() + 1 : token.next();
      }

      case ']': {
        final var setMode = (LexerMode.Set) mode;
        reduceCharClass(setMode.negated(), level - 1, offset);
        level--;
        mode = setMode.previous();
        return token.next();
      }

      case '^':
        push(ReNode.START_ANCHOR);
        return token.next();

      case '$':
        push(ReNode.END_ANCHOR);
        return token.next();

      case '{':
        push(new RepetitionBoundStart(offset));
        mode = LexerMode.BOUND;
        return token.next();

      case '}':
        reduceBound(offset);
        mode = LexerMode.NORMAL;
        return token.next();

      default:
        throw new IllegalStateException("Unhandled meta character '" + symbol + "'");
    }
  }

  /**
   * Wrap the top of the stack in a {@code *}, {@code +}, or {@code ?}.
   */
  private int parseQuantifier(char symbol, Token token) {
    final boolean greedy = !lexer.rawCharIs(token.next(), '?');

    final StackItem top = pop();
    if (top == null) {
      throw error("Dangling control meta character '" + symbol + "'", token.offset());
    } else if (top instanceof Marker marker) {
      throw error("Malformed regular expression", marker.offset());
    }

    final ReNode operand = (ReNode) top;
    switch (symbol) {
      case '*':
        push(new ReNode.Star(operand, greedy));
        break;
      case '+':
        push(new ReNode.Plus(operand, greedy));
        break;
      default:
        push(new ReNode.Opt(operand, greedy));
        break;
    }
    return greedy ? token.next() : token.next() + 1;
  }

  /**
   * Pop everything down to the capturing group start at {@code groupLevel},
   * then push the captured concatenation/alternation of what was popped.
   */
  private void reduceCapturing(int groupLevel, int offset) {
    ReNode accumulated = null;

    while (true) {
      final StackItem top = peek(0);

      if (top == null) {
        throw error("Unbalanced closing character ')'", offset);
      } else if (top instanceof CapturingGroupStart start && start.level() == groupLevel) {
        pop();
        push(new ReNode.Capture(accumulated == null ? ReNode.EMPTY : accumulated, start.groupIndex()));
        return;
      } else if (top instanceof ReNode second
          && peek(1) instanceof AlternationMarker
          && peek(2) instanceof ReNode first) {
        pop();
        pop();
        pop();
        final ReNode right = accumulated == null ? second : new ReNode.Concat(second, accumulated);
        accumulated = new ReNode.Alt(first, right);
      } else if (top instanceof AlternationMarker
          && accumulated == null
          && peek(1) instanceof ReNode first) {
        // Empty right-hand alternative: `(a|)`
        pop();
        pop();
        accumulated = new ReNode.Alt(first, ReNode.EMPTY);
      } else if (top instanceof Marker marker) {
        throw error("Malformed regular expression", marker.offset());
      } else {
        pop();
        accumulated = concat((ReNode) top, accumulated);
      }
    }
  }

  /**
   * Pop everything down to the enclosing group start (or the bottom of the
   * stack), merging in the previous alternative if there is one.
   *
   * <p>The group start is left on the stack.
   */
  private void reduceAlternatives(int currentLevel) {
    ReNode accumulated = null;

    while (true) {
      final StackItem top = peek(0);

      if (top == null) {
        push(accumulated == null ? ReNode.EMPTY : accumulated);
        return;
      } else if (top instanceof AlternationMarker && peek(1) instanceof ReNode first) {
        pop();
        pop();
        push(new ReNode.Alt(first, accumulated == null ? ReNode.EMPTY : accumulated));
        return;
      } else if (top instanceof CapturingGroupStart start && start.level() == currentLevel - 1) {
        push(accumulated == null ? ReNode.EMPTY : accumulated);
        return;
      } else if (top instanceof Marker marker) {
        throw error("Malformed regular expression", marker.offset());
      } else {
        pop();
        accumulated = concat((ReNode) top, accumulated);
      }
    }
  }

  /**
   * Pop everything down to the bracket expression start at {@code classLevel}
   * and push the union of the characters, ranges, and classes popped.
   *
   * <p>An empty bracket expression pushes nothing and a single non-negated
   * character collapses into a literal.
   */
  private void reduceCharClass(boolean negated, int classLevel, int offset) {
    CharRangeSet accumulated = CharRangeSet.EMPTY;

    while (true) {
      final StackItem top = peek(0);

      if (top == null) {
        throw error("Unbalanced closing character ']'", offset);
      } else if (top instanceof CharClassStart start && start.level() == classLevel) {
        pop();
        if (accumulated.isEmpty()) {
          return;
        } else if (!negated && accumulated.isSingleton()) {
          push(new ReNode.Literal(accumulated.ranges().get(0).lowerBound()));
        } else {
          push(new ReNode.CharClass(negated ? accumulated.negate() : accumulated));
        }
        return;
      } else if (top instanceof Marker marker) {
        throw error("Malformed regular expression", marker.offset());
      } else if (isLiteral(peek(1), '-')
          && peek(2) instanceof CharClassStart start
          && start.level() == classLevel) {
        // Range with no lower end: `[-a]`
        throw error("Malformed range", start.offset() + 1);
      } else if (top instanceof ReNode.Literal high
          && isLiteral(peek(1), '-')
          && peek(2) instanceof ReNode.Literal low) {
        pop();
        pop();
        pop();
        final char lower = (char) Math.min(low.value(), high.value());
        final char upper = (char) Math.max(low.value(), high.value());
        accumulated = accumulated.add(CharRange.between(lower, upper));
      } else if (top instanceof ReNode.Literal single) {
        pop();
        accumulated = accumulated.add(CharRange.single(single.value()));
      } else if (top instanceof ReNode.CharClass nested) {
        pop();
        accumulated = accumulated.union(nested.ranges());
      } else {
        throw error("Malformed character set", offset);
      }
    }
  }

  /**
   * Pop the digits and comma of a repetition bound down to its start, then
   * replace the node preceding the bound with its expansion.
   */
  private void reduceBound(int offset) {
    // Digits are popped last-first, so they get prepended
    final var maxDigits = new StringBuilder();
    final var minDigits = new StringBuilder();
    boolean inMax = true;
    boolean sawComma = false;
    RepetitionBoundStart start = null;

    while (start == null) {
      final StackItem top = pop();

      if (top instanceof RepetitionBoundStart boundStart) {
        start = boundStart;
      } else if (inMax && isLiteral(top, ',')) {
        inMax = false;
        sawComma = true;
      } else if (top instanceof ReNode.Literal digit && isDigit(digit.value())) {
        (inMax ? maxDigits : minDigits).insert(0, digit.value());
      } else {
        throw error("Malformed regular expression", offset);
      }
    }

    final int min;
    final Integer max;
    if (!sawComma) {
      if (maxDigits.length() == 0) {
        throw error("Malformed regular expression", start.offset());
      }
      min = boundValue(maxDigits, start);
      max = min;
    } else if (minDigits.length() == 0 && maxDigits.length() == 0) {
      throw error("Malformed regular expression", start.offset());
    } else if (minDigits.length() == 0) {
      // `{,n}` repeats exactly n times
      min = boundValue(maxDigits, start);
      max = min;
    } else {
      min = boundValue(minDigits, start);
      max = maxDigits.length() == 0 ? null : boundValue(maxDigits, start);
    }

    if (max != null && max < min) {
      throw error("Malformed repetition bounds", offset);
    }

    // Node being repeated
    final ReNode repeated;
    final StackItem top = pop();
    if (top == null) {
      repeated = ReNode.EMPTY;
    } else if (top instanceof Marker marker) {
      throw error("Malformed regular expression", marker.offset());
    } else {
      repeated = (ReNode) top;
    }

    push(expandBound(repeated, min, max));
  }

  private int boundValue(StringBuilder digits, RepetitionBoundStart start) {
    int firstSignificant = 0;
    while (firstSignificant < digits.length() - 1 && digits.charAt(firstSignificant) == '0') {
      firstSignificant++;
    }
    final String significant = digits.substring(firstSignificant);
    if (significant.length() > 9 || Integer.parseInt(significant) > maxRepetition) {
      throw error("Repetition bound exceeds " + maxRepetition, start.offset());
    }
    return Integer.parseInt(significant);
  }

  /**
   * Expand {@code node{min,max}} into concatenations of copies of the node.
   *
   * @param node repeated node
   * @param min minimum repetitions
   * @param max maximum repetitions, or {@code null} if unbounded
   */
  static ReNode expandBound(ReNode node, int min, Integer max) {
    final var parts = new ArrayList<ReNode>();

    if (max == null) {
      if (min == 0) {
        return new ReNode.Star(node, true);
      }
      for (int i = 1; i < min; i++) {
        parts.add(node);
      }
      parts.add(new ReNode.Plus(node, true));
    } else {
      for (int i = 0; i < min; i++) {
        parts.add(node);
      }
      for (int i = min; i < max; i++) {
        parts.add(new ReNode.Opt(node, false));
      }
    }

    return concatAll(parts);
  }

  private static ReNode concatAll(List<ReNode> parts) {
    ReNode output = null;
    for (int i = parts.size() - 1; i >= 0; i--) {
      output = concat(parts.get(i), output);
    }
    return output == null ? ReNode.EMPTY : output;
  }

  private static ReNode concat(ReNode first, ReNode rest) {
    return rest == null ? first : new ReNode.Concat(first, rest);
  }

  private static boolean isLiteral(StackItem item, char expected) {
    return item instanceof ReNode.Literal literal && literal.value() == expected;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
