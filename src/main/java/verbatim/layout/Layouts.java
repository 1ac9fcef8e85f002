package verbatim.layout;

import verbatim.ast.NodeKind;
import verbatim.layout.LayoutElement.Clause;
import verbatim.layout.LayoutElement.Closer;
import verbatim.layout.LayoutElement.Literal;
import verbatim.layout.LayoutElement.OptionalSlot;
import verbatim.layout.LayoutElement.Slot;
import verbatim.layout.LayoutElement.SlotList;
import verbatim.layout.LayoutElement.Suite;
import verbatim.layout.LayoutElement.TupleComma;
import verbatim.layout.LayoutElement.ValueText;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-kind token layouts. The indexer reads them to align text, the default formatter to generate it.
 */
public final class Layouts {
	private static final Set<NodeKind> ANY = Set.of();

	private static final Set<NodeKind> EXPRESSIONS = expressions();

	private static final Map<NodeKind, Layout> LAYOUTS;

	static {
		Map<NodeKind, Layout> layouts = new EnumMap<>(NodeKind.class);
		for (NodeKind kind : NodeKind.values()) {
			layouts.put(kind, build(kind));
		}
		LAYOUTS = Collections.unmodifiableMap(layouts);
	}

	private Layouts() {
	}

	public static Layout of(NodeKind kind) {
		return LAYOUTS.get(kind);
	}

	private static Layout build(NodeKind kind) {
		return switch (kind) {
			case MODULE -> layout(kind, new Suite(false));
			case BLOCK -> layout(kind, new Suite(true));
			case EXPR_STMT -> layout(kind, slot());
			case ASSIGN -> layout(kind, slot(), new Literal("="), new Slot(" "));
			case AUG_ASSIGN -> layout(kind, slot(), new ValueText(" "), new Slot(" "));
			case PASS -> layout(kind, keyword("pass"));
			case BREAK -> layout(kind, keyword("break"));
			case CONTINUE -> layout(kind, keyword("continue"));
			case RETURN -> layout(kind, keyword("return"), new OptionalSlot(ANY, null, " "));
			case RAISE -> layout(kind, keyword("raise"), new OptionalSlot(ANY, null, " "));
			case ASSERT -> layout(kind, keyword("assert"), new Slot(" "),
					new OptionalSlot(ANY, new Literal(",", ""), " "));
			case IMPORT -> layout(kind, keyword("import"), new SlotList(",", " ", " "));
			case IMPORT_FROM -> layout(kind, keyword("from"), new ValueText(" "), new Literal("import"),
					new SlotList(",", " ", " "));
			case ALIAS -> layout(kind, new ValueText(""), new OptionalSlot(Set.of(NodeKind.NAME), new Literal("as"), " "));
			case IF -> layout(kind, keyword("if"), new Slot(" "), colon(), slot(), elseClause());
			case ELIF -> layout(kind, keyword("elif"), new Slot(" "), colon(), slot(), elseClause());
			case ELSE -> layout(kind, keyword("else"), colon(), slot());
			case WHILE -> layout(kind, keyword("while"), new Slot(" "), colon(), slot());
			case FOR -> layout(kind, keyword("for"), new Slot(" "), new Literal("in"), new Slot(" "), colon(), slot());
			case TRY -> layout(kind, keyword("try"), colon(), slot(),
					new Clause(Set.of(NodeKind.EXCEPT_HANDLER), true), new Clause(Set.of(NodeKind.ELSE)),
					new Clause(Set.of(NodeKind.FINALLY)));
			case EXCEPT_HANDLER -> layout(kind, keyword("except"), new OptionalSlot(EXPRESSIONS, null, " "),
					new OptionalSlot(Set.of(NodeKind.NAME), new Literal("as"), " "), colon(), slot());
			case FINALLY -> layout(kind, keyword("finally"), colon(), slot());
			case WITH -> layout(kind, keyword("with"), new SlotList(",", " ", " ", Set.of(NodeKind.WITH_ITEM)), colon(),
					slot());
			case WITH_ITEM -> layout(kind, slot(), new OptionalSlot(EXPRESSIONS, new Literal("as"), " "));
			case DELETE -> layout(kind, keyword("del"), new SlotList(",", " ", " "));
			case GLOBAL -> layout(kind, keyword("global"), new SlotList(",", " ", " "));
			case FUNCTION_DEF -> layout(kind, keyword("def"), new ValueText(" "), slot(), colon(), slot());
			case PARAMETERS, ARGUMENTS -> layout(kind, new Literal("(", ""), list(), new Closer(")"));
			case PARAM -> layout(kind, new ValueText(""), new OptionalSlot(ANY, new Literal("=", ""), ""));
			case CLASS_DEF -> layout(kind, keyword("class"), new ValueText(" "),
					new OptionalSlot(Set.of(NodeKind.ARGUMENTS), null, ""), colon(), slot());
			case RAW -> new Layout(kind, List.of(new ValueText("")), false);
			case NAME, NUMBER, STRING -> layout(kind, new ValueText(""));
			case BIN_OP, BOOL_OP -> layout(kind, slot(), new ValueText(" "), new Slot(" "));
			case COMPARE -> layout(kind, slot(), new SlotList("", " ", " ", Set.of(NodeKind.COMPARATOR)));
			case COMPARATOR -> layout(kind, new ValueText(""), new Slot(" "));
			case IF_EXP -> layout(kind, slot(), new Literal("if"), new Slot(" "), new Literal("else"), new Slot(" "));
			case LAMBDA -> layout(kind, keyword("lambda"), new SlotList(",", " ", " ", Set.of(NodeKind.PARAM)),
					colon(), new Slot(" "));
			case UNARY_OP, STARRED -> layout(kind, new ValueText(""), slot());
			case NOT -> layout(kind, keyword("not"), new Slot(" "));
			case CALL -> layout(kind, slot(), slot());
			case KEYWORD -> layout(kind, new ValueText(""), new Literal("=", ""), slot());
			case ATTRIBUTE -> layout(kind, slot(), new Literal(".", ""), new ValueText(""));
			case SUBSCRIPT -> layout(kind, slot(), new Literal("[", ""), slot(), new Literal("]", ""));
			case LIST -> layout(kind, new Literal("[", ""), list(), new Closer("]"));
			case TUPLE -> layout(kind, list(), new TupleComma());
			case DICT -> layout(kind, new Literal("{", ""), list(), new Closer("}"));
			case DICT_ENTRY -> layout(kind, slot(), new Literal(":", ""), new Slot(" "));
			case LIST_COMP -> layout(kind, new Literal("[", ""), slot(),
					new SlotList("", " ", " ", Set.of(NodeKind.COMPREHENSION)), new Literal("]", ""));
			case COMPREHENSION -> layout(kind, keyword("for"), new Slot(" "), new Literal("in"), new Slot(" "),
					new SlotList("", " ", " ", Set.of(NodeKind.COMP_IF)));
			case COMP_IF -> layout(kind, keyword("if"), new Slot(" "));
			case SLICE -> layout(kind, slot(), colon(), slot(), new OptionalSlot(ANY, colon(), ""));
			case EMPTY -> layout(kind);
		};
	}

	private static Set<NodeKind> expressions() {
		Set<NodeKind> kinds = EnumSet.noneOf(NodeKind.class);
		for (NodeKind kind : NodeKind.values()) {
			if (kind.isExpression()) {
				kinds.add(kind);
			}
		}
		return Collections.unmodifiableSet(kinds);
	}

	private static Layout layout(NodeKind kind, LayoutElement... elements) {
		return new Layout(kind, List.of(elements), true);
	}

	private static Literal keyword(String text) {
		return new Literal(text, "");
	}

	private static Literal colon() {
		return new Literal(":", "");
	}

	private static Slot slot() {
		return new Slot("");
	}

	private static SlotList list() {
		return new SlotList(",", " ", "");
	}

	private static Clause elseClause() {
		return new Clause(Set.of(NodeKind.ELIF, NodeKind.ELSE));
	}
}
