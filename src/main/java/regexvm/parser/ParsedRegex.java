package regexvm.parser;

/**
 * Result of parsing a pattern.
 *
 * <p>The group count is taken from the pattern's parentheses, so it includes
 * groups that a repetition bound such as <code>{0}</code> removed from the
 * tree.
 *
 * @param root root of the syntax tree
 * @param groupCount number of capture groups opened in the pattern
 */
public record ParsedRegex(ReNode root, int groupCount) { }
