package verbatim.print;

import verbatim.ast.NodeKind;
import verbatim.ast.SyntaxNode;

import java.util.Map;
import java.util.Set;

/**
 * Operator binding strength, used to decide when a rendered operand needs grouping parentheses.
 * Higher binds tighter.
 */
public final class Precedence {
	public static final int TUPLE = 0;
	public static final int LAMBDA = 1;
	public static final int TERNARY = 2;
	public static final int OR = 3;
	public static final int AND = 4;
	public static final int NOT = 5;
	public static final int COMPARISON = 6;
	public static final int UNARY = 13;
	public static final int POWER = 14;
	public static final int PRIMARY = 15;
	public static final int ATOM = 16;

	private static final Map<String, Integer> BINARY = Map.ofEntries(
			Map.entry("|", 7),
			Map.entry("^", 8),
			Map.entry("&", 9),
			Map.entry("<<", 10),
			Map.entry(">>", 10),
			Map.entry("+", 11),
			Map.entry("-", 11),
			Map.entry("*", 12),
			Map.entry("/", 12),
			Map.entry("//", 12),
			Map.entry("%", 12),
			Map.entry("@", 12),
			Map.entry("**", POWER));

	private static final Set<String> COMPARISONS = Set.of(
			"<", ">", "==", ">=", "<=", "!=", "in", "not in", "is", "is not");

	private static final Set<String> UNARY_OPERATORS = Set.of("-", "+", "~");

	private static final Set<String> AUGMENTED = Set.of(
			"+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=", "|=", "^=", ">>=", "<<=", "**=");

	private Precedence() {
	}

	public static boolean isBinaryOperator(String op) {
		return BINARY.containsKey(op);
	}

	public static boolean isBooleanOperator(String op) {
		return "and".equals(op) || "or".equals(op);
	}

	public static boolean isComparison(String op) {
		return COMPARISONS.contains(op);
	}

	public static boolean isUnaryOperator(String op) {
		return UNARY_OPERATORS.contains(op);
	}

	public static boolean isAugmentedAssignment(String op) {
		return AUGMENTED.contains(op);
	}

	/**
	 * Binding strength of {@code node} as written without parentheses.
	 */
	public static int of(SyntaxNode node) {
		return switch (node.kind()) {
			case TUPLE -> TUPLE;
			case LAMBDA -> LAMBDA;
			case IF_EXP -> TERNARY;
			case BOOL_OP -> "and".equals(node.value()) ? AND : OR;
			case NOT -> NOT;
			case COMPARE -> COMPARISON;
			case BIN_OP -> BINARY.getOrDefault(node.value(), POWER);
			case UNARY_OP -> UNARY;
			case CALL, ATTRIBUTE, SUBSCRIPT -> PRIMARY;
			default -> ATOM;
		};
	}

	/**
	 * Minimum strength the child at {@code index} of {@code parent} must have to go without parentheses.
	 */
	public static int required(SyntaxNode parent, int index) {
		return switch (parent.kind()) {
			case BIN_OP -> {
				int own = of(parent);
				if (own == POWER) {
					yield index == 0 ? POWER + 1 : UNARY;
				}
				yield index == 0 ? own : own + 1;
			}
			case BOOL_OP -> index == 0 ? of(parent) : of(parent) + 1;
			case COMPARE, COMPARATOR -> COMPARISON + 1;
			case NOT -> NOT;
			case UNARY_OP -> UNARY;
			case CALL, ATTRIBUTE, SUBSCRIPT -> index == 0 ? PRIMARY : TUPLE;
			case IF_EXP -> index == 2 ? LAMBDA : OR;
			case WITH_ITEM -> index == 0 ? LAMBDA : OR;
			case COMPREHENSION -> index == 0 ? TUPLE : OR;
			case ARGUMENTS, LIST, TUPLE, DICT_ENTRY, KEYWORD, PARAM, LAMBDA, LIST_COMP, EXCEPT_HANDLER -> LAMBDA;
			case SLICE -> TERNARY;
			case STARRED, COMP_IF, DELETE -> OR;
			default -> TUPLE;
		};
	}

	public static boolean needsParens(SyntaxNode parent, int index, SyntaxNode child) {
		return parent != null && child.kind().isExpression() && of(child) < required(parent, index);
	}
}
