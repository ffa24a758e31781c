package regexvm.parser;

/**
 * Element of the parser's shift-reduce stack.
 *
 * <p>Either a finished syntax tree node or a temporary marker recording where
 * a construct that still needs a closer was opened.
 */
sealed interface StackItem permits ReNode, Marker { }
