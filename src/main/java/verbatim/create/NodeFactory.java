package verbatim.create;

import verbatim.ast.NodeKind;
import verbatim.ast.SyntaxNode;
import verbatim.print.Precedence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds new nodes with valid defaults. Nodes built here carry no recorded text, so they are always
 * rendered from their default templates.
 */
public final class NodeFactory {
	private static final Set<NodeKind> VALUED = EnumSet.of(
			NodeKind.AUG_ASSIGN, NodeKind.IMPORT_FROM, NodeKind.ALIAS, NodeKind.FUNCTION_DEF, NodeKind.PARAM,
			NodeKind.CLASS_DEF, NodeKind.RAW, NodeKind.NAME, NodeKind.NUMBER, NodeKind.STRING, NodeKind.BIN_OP,
			NodeKind.BOOL_OP, NodeKind.COMPARATOR, NodeKind.UNARY_OP, NodeKind.KEYWORD, NodeKind.STARRED,
			NodeKind.ATTRIBUTE);

	private NodeFactory() {
	}

	/**
	 * Generic constructor. Checks that the value is present exactly for the kinds that carry one and
	 * that operator values are known operators.
	 */
	public static SyntaxNode create(NodeKind kind, String value, SyntaxNode... children) {
		if (VALUED.contains(kind) && (value == null || (value.isEmpty() && kind != NodeKind.STRING))) {
			throw new IllegalArgumentException(kind + " requires a value");
		}
		if (!VALUED.contains(kind) && value != null) {
			throw new IllegalArgumentException(kind + " does not take a value");
		}
		switch (kind) {
			case BIN_OP -> require(Precedence.isBinaryOperator(value), "binary operator", value);
			case BOOL_OP -> require(Precedence.isBooleanOperator(value), "boolean operator", value);
			case COMPARATOR -> require(Precedence.isComparison(value), "comparison operator", value);
			case UNARY_OP -> require(Precedence.isUnaryOperator(value), "unary operator", value);
			case AUG_ASSIGN -> require(Precedence.isAugmentedAssignment(value), "augmented assignment", value);
			case STARRED -> require("*".equals(value) || "**".equals(value), "star", value);
			default -> {
			}
		}
		return new SyntaxNode(kind, value, Arrays.asList(children));
	}

	private static void require(boolean valid, String what, String value) {
		if (!valid) {
			throw new IllegalArgumentException("Unknown " + what + ": " + value);
		}
	}

	public static SyntaxNode module(SyntaxNode... statements) {
		return create(NodeKind.MODULE, null, statements);
	}

	/**
	 * Block of statements; an empty block gets a {@code pass}.
	 */
	public static SyntaxNode block(SyntaxNode... statements) {
		if (statements.length == 0) {
			return create(NodeKind.BLOCK, null, pass());
		}
		return create(NodeKind.BLOCK, null, statements);
	}

	public static SyntaxNode name(String id) {
		return create(NodeKind.NAME, id);
	}

	public static SyntaxNode number(long value) {
		return create(NodeKind.NUMBER, Long.toString(value));
	}

	public static SyntaxNode number(String literal) {
		return create(NodeKind.NUMBER, literal);
	}

	/**
	 * String literal; {@code content} is the text between the quotes, escapes included.
	 */
	public static SyntaxNode string(String content) {
		if (content == null) {
			throw new IllegalArgumentException("STRING requires a value");
		}
		return new SyntaxNode(NodeKind.STRING, content);
	}

	public static SyntaxNode exprStmt(SyntaxNode expression) {
		return create(NodeKind.EXPR_STMT, null, expression);
	}

	public static SyntaxNode assign(SyntaxNode target, SyntaxNode value) {
		return create(NodeKind.ASSIGN, null, target, value);
	}

	public static SyntaxNode augAssign(SyntaxNode target, String op, SyntaxNode value) {
		return create(NodeKind.AUG_ASSIGN, op, target, value);
	}

	public static SyntaxNode pass() {
		return create(NodeKind.PASS, null);
	}

	public static SyntaxNode breakStmt() {
		return create(NodeKind.BREAK, null);
	}

	public static SyntaxNode continueStmt() {
		return create(NodeKind.CONTINUE, null);
	}

	/**
	 * Return statement; {@code value} may be null.
	 */
	public static SyntaxNode returnStmt(SyntaxNode value) {
		return value == null ? create(NodeKind.RETURN, null) : create(NodeKind.RETURN, null, value);
	}

	public static SyntaxNode raise(SyntaxNode exception) {
		return exception == null ? create(NodeKind.RAISE, null) : create(NodeKind.RAISE, null, exception);
	}

	/**
	 * Assert statement; {@code message} may be null.
	 */
	public static SyntaxNode assertStmt(SyntaxNode test, SyntaxNode message) {
		return message == null ? create(NodeKind.ASSERT, null, test) : create(NodeKind.ASSERT, null, test, message);
	}

	public static SyntaxNode importStmt(String... modules) {
		List<SyntaxNode> aliases = new ArrayList<>();
		for (String module : modules) {
			aliases.add(alias(module, null));
		}
		return create(NodeKind.IMPORT, null, aliases.toArray(new SyntaxNode[0]));
	}

	public static SyntaxNode importFrom(String module, String... names) {
		List<SyntaxNode> aliases = new ArrayList<>();
		for (String name : names) {
			aliases.add(alias(name, null));
		}
		return create(NodeKind.IMPORT_FROM, module, aliases.toArray(new SyntaxNode[0]));
	}

	public static SyntaxNode alias(String name, String asName) {
		return asName == null ? create(NodeKind.ALIAS, name) : create(NodeKind.ALIAS, name, name(asName));
	}

	public static SyntaxNode ifStmt(SyntaxNode test, SyntaxNode... body) {
		return create(NodeKind.IF, null, test, block(body));
	}

	/**
	 * Attaches an else clause to the last if/elif of the chain starting at {@code statement}, or to a
	 * try statement after its except handlers.
	 */
	public static SyntaxNode withElse(SyntaxNode statement, SyntaxNode... body) {
		if (statement.kind() == NodeKind.TRY) {
			int index = 1;
			while (index < statement.childCount() && statement.child(index).kind() == NodeKind.EXCEPT_HANDLER) {
				index++;
			}
			if (index == 1) {
				throw new IllegalArgumentException("else clause of a try statement needs an except handler");
			}
			if (index < statement.childCount() && statement.child(index).kind() == NodeKind.ELSE) {
				throw new IllegalArgumentException("try statement already has an else clause");
			}
			statement.insert(index, create(NodeKind.ELSE, null, block(body)));
			return statement;
		}
		SyntaxNode last = statement;
		while (last.childCount() == 3 && last.child(2).kind() == NodeKind.ELIF) {
			last = last.child(2);
		}
		if (last.childCount() == 3) {
			throw new IllegalArgumentException("if statement already has an else clause");
		}
		last.add(create(NodeKind.ELSE, null, block(body)));
		return statement;
	}

	public static SyntaxNode whileStmt(SyntaxNode test, SyntaxNode... body) {
		return create(NodeKind.WHILE, null, test, block(body));
	}

	public static SyntaxNode forStmt(SyntaxNode target, SyntaxNode iterable, SyntaxNode... body) {
		return create(NodeKind.FOR, null, target, iterable, block(body));
	}

	public static SyntaxNode tryStmt(List<SyntaxNode> body, SyntaxNode... handlers) {
		if (handlers.length == 0) {
			throw new IllegalArgumentException("try statement needs an except handler");
		}
		SyntaxNode statement = create(NodeKind.TRY, null, block(body.toArray(new SyntaxNode[0])));
		for (SyntaxNode handler : handlers) {
			requireKind(handler, NodeKind.EXCEPT_HANDLER);
			statement.add(handler);
		}
		return statement;
	}

	public static SyntaxNode tryFinally(List<SyntaxNode> body, SyntaxNode... finalBody) {
		return create(NodeKind.TRY, null, block(body.toArray(new SyntaxNode[0])),
				create(NodeKind.FINALLY, null, block(finalBody)));
	}

	/**
	 * Except clause; {@code type} null catches everything, and {@code name} requires a type.
	 */
	public static SyntaxNode exceptHandler(SyntaxNode type, String name, SyntaxNode... body) {
		if (type == null && name != null) {
			throw new IllegalArgumentException("except clause without a type cannot bind a name");
		}
		SyntaxNode handler = create(NodeKind.EXCEPT_HANDLER, null);
		if (type != null) {
			handler.add(type);
		}
		if (name != null) {
			handler.add(name(name));
		}
		handler.add(block(body));
		return handler;
	}

	public static SyntaxNode withFinally(SyntaxNode tryStmt, SyntaxNode... body) {
		requireKind(tryStmt, NodeKind.TRY);
		if (tryStmt.child(tryStmt.childCount() - 1).kind() == NodeKind.FINALLY) {
			throw new IllegalArgumentException("try statement already has a finally clause");
		}
		tryStmt.add(create(NodeKind.FINALLY, null, block(body)));
		return tryStmt;
	}

	public static SyntaxNode withStmt(List<SyntaxNode> items, SyntaxNode... body) {
		if (items.isEmpty()) {
			throw new IllegalArgumentException("with statement needs at least one item");
		}
		SyntaxNode statement = create(NodeKind.WITH, null);
		for (SyntaxNode item : items) {
			requireKind(item, NodeKind.WITH_ITEM);
			statement.add(item);
		}
		statement.add(block(body));
		return statement;
	}

	/**
	 * Context manager of a with statement; {@code target} may be null.
	 */
	public static SyntaxNode withItem(SyntaxNode context, SyntaxNode target) {
		return target == null
				? create(NodeKind.WITH_ITEM, null, context)
				: create(NodeKind.WITH_ITEM, null, context, target);
	}

	public static SyntaxNode deleteStmt(SyntaxNode... targets) {
		if (targets.length == 0) {
			throw new IllegalArgumentException("del statement needs at least one target");
		}
		return create(NodeKind.DELETE, null, targets);
	}

	public static SyntaxNode globalStmt(String... names) {
		if (names.length == 0) {
			throw new IllegalArgumentException("global statement needs at least one name");
		}
		SyntaxNode statement = create(NodeKind.GLOBAL, null);
		for (String name : names) {
			statement.add(name(name));
		}
		return statement;
	}

	public static SyntaxNode functionDef(String name, List<String> parameters, SyntaxNode... body) {
		List<SyntaxNode> params = new ArrayList<>();
		for (String parameter : parameters) {
			params.add(param(parameter, null));
		}
		return create(NodeKind.FUNCTION_DEF, name,
				create(NodeKind.PARAMETERS, null, params.toArray(new SyntaxNode[0])), block(body));
	}

	public static SyntaxNode param(String name, SyntaxNode defaultValue) {
		return defaultValue == null ? create(NodeKind.PARAM, name) : create(NodeKind.PARAM, name, defaultValue);
	}

	public static SyntaxNode classDef(String name, List<SyntaxNode> bases, SyntaxNode... body) {
		if (bases.isEmpty()) {
			return create(NodeKind.CLASS_DEF, name, block(body));
		}
		return create(NodeKind.CLASS_DEF, name, arguments(bases.toArray(new SyntaxNode[0])), block(body));
	}

	public static SyntaxNode call(SyntaxNode callee, SyntaxNode... arguments) {
		return create(NodeKind.CALL, null, callee, arguments(arguments));
	}

	public static SyntaxNode arguments(SyntaxNode... arguments) {
		return create(NodeKind.ARGUMENTS, null, arguments);
	}

	public static SyntaxNode keyword(String name, SyntaxNode value) {
		return create(NodeKind.KEYWORD, name, value);
	}

	public static SyntaxNode attribute(SyntaxNode target, String attr) {
		return create(NodeKind.ATTRIBUTE, attr, target);
	}

	public static SyntaxNode subscript(SyntaxNode target, SyntaxNode index) {
		return create(NodeKind.SUBSCRIPT, null, target, index);
	}

	public static SyntaxNode binOp(SyntaxNode left, String op, SyntaxNode right) {
		return create(NodeKind.BIN_OP, op, left, right);
	}

	public static SyntaxNode boolOp(SyntaxNode left, String op, SyntaxNode right) {
		return create(NodeKind.BOOL_OP, op, left, right);
	}

	public static SyntaxNode compare(SyntaxNode left, String op, SyntaxNode right) {
		return create(NodeKind.COMPARE, null, left, comparator(op, right));
	}

	/**
	 * Comparison chain such as {@code a < b <= c}; each link is a {@link #comparator}.
	 */
	public static SyntaxNode compareChain(SyntaxNode left, SyntaxNode... comparators) {
		if (comparators.length == 0) {
			throw new IllegalArgumentException("comparison needs at least one comparator");
		}
		SyntaxNode compare = create(NodeKind.COMPARE, null, left);
		for (SyntaxNode comparator : comparators) {
			requireKind(comparator, NodeKind.COMPARATOR);
			compare.add(comparator);
		}
		return compare;
	}

	public static SyntaxNode comparator(String op, SyntaxNode right) {
		return create(NodeKind.COMPARATOR, op, right);
	}

	/**
	 * Conditional expression {@code body if test else orElse}.
	 */
	public static SyntaxNode ifExp(SyntaxNode body, SyntaxNode test, SyntaxNode orElse) {
		return create(NodeKind.IF_EXP, null, body, test, orElse);
	}

	public static SyntaxNode lambda(List<String> parameters, SyntaxNode body) {
		SyntaxNode lambda = create(NodeKind.LAMBDA, null);
		for (String parameter : parameters) {
			lambda.add(param(parameter, null));
		}
		lambda.add(body);
		return lambda;
	}

	public static SyntaxNode unaryOp(String op, SyntaxNode operand) {
		return create(NodeKind.UNARY_OP, op, operand);
	}

	public static SyntaxNode not(SyntaxNode operand) {
		return create(NodeKind.NOT, null, operand);
	}

	public static SyntaxNode list(SyntaxNode... items) {
		return create(NodeKind.LIST, null, items);
	}

	public static SyntaxNode tuple(SyntaxNode... items) {
		return create(NodeKind.TUPLE, null, items);
	}

	public static SyntaxNode dict(SyntaxNode... entries) {
		for (SyntaxNode entry : entries) {
			requireKind(entry, NodeKind.DICT_ENTRY);
		}
		return create(NodeKind.DICT, null, entries);
	}

	public static SyntaxNode entry(SyntaxNode key, SyntaxNode value) {
		return create(NodeKind.DICT_ENTRY, null, key, value);
	}

	public static SyntaxNode listComp(SyntaxNode element, SyntaxNode... comprehensions) {
		if (comprehensions.length == 0) {
			throw new IllegalArgumentException("list comprehension needs a for clause");
		}
		SyntaxNode listComp = create(NodeKind.LIST_COMP, null, element);
		for (SyntaxNode comprehension : comprehensions) {
			requireKind(comprehension, NodeKind.COMPREHENSION);
			listComp.add(comprehension);
		}
		return listComp;
	}

	/**
	 * One {@code for target in iterable} clause with its {@code if} conditions.
	 */
	public static SyntaxNode comprehension(SyntaxNode target, SyntaxNode iterable, SyntaxNode... conditions) {
		SyntaxNode comprehension = create(NodeKind.COMPREHENSION, null, target, iterable);
		for (SyntaxNode condition : conditions) {
			comprehension.add(create(NodeKind.COMP_IF, null, condition));
		}
		return comprehension;
	}

	/**
	 * Slice {@code lower:upper[:step]}; a null bound is left out. A null step drops the second colon.
	 */
	public static SyntaxNode slice(SyntaxNode lower, SyntaxNode upper, SyntaxNode step) {
		SyntaxNode slice = create(NodeKind.SLICE, null, orEmpty(lower), orEmpty(upper));
		if (step != null) {
			slice.add(step);
		}
		return slice;
	}

	/**
	 * Placeholder for an omitted slice bound.
	 */
	public static SyntaxNode empty() {
		return create(NodeKind.EMPTY, null);
	}

	private static SyntaxNode orEmpty(SyntaxNode node) {
		return node == null ? empty() : node;
	}

	private static void requireKind(SyntaxNode node, NodeKind kind) {
		if (node.kind() != kind) {
			throw new IllegalArgumentException("expected a " + kind + " node, got " + node.kind());
		}
	}

	/**
	 * Opaque statement kept verbatim. It can be inserted but has no default template.
	 */
	public static SyntaxNode raw(String text) {
		return create(NodeKind.RAW, text);
	}
}
