package verbatim.layout;

import verbatim.ast.NodeKind;
import verbatim.ast.SyntaxNode;

import java.util.Set;

/**
 * One step of a node kind's source layout. Each element carries the gap that is emitted in front of
 * it when nothing was recorded.
 */
public sealed interface LayoutElement {

	/**
	 * Fixed token text such as a keyword or punctuation.
	 */
	record Literal(String text, String defaultGap) implements LayoutElement {
		public Literal(String text) {
			this(text, " ");
		}

		public boolean opensBracket() {
			return text.equals("(") || text.equals("[") || text.equals("{");
		}

		public boolean closesBracket() {
			return text.equals(")") || text.equals("]") || text.equals("}");
		}
	}

	/**
	 * The node's own value (identifier, operator, literal text).
	 */
	record ValueText(String defaultGap) implements LayoutElement {
	}

	/**
	 * Exactly one required child.
	 */
	record Slot(String defaultGap) implements LayoutElement {
	}

	/**
	 * At most one child, taken when the next child exists and its kind is accepted. An empty kind set
	 * accepts any kind. The prefix, when present, is emitted only together with the child.
	 */
	record OptionalSlot(Set<NodeKind> kinds, Literal prefix, String defaultGap) implements LayoutElement {
		public boolean accepts(SyntaxNode child) {
			return kinds.isEmpty() || kinds.contains(child.kind());
		}
	}

	/**
	 * The following run of children whose kind is accepted, separated by {@code separator}. An empty
	 * kind set accepts every remaining child.
	 */
	record SlotList(String separator, String defaultSeparatorGap, String defaultFirstGap, Set<NodeKind> kinds)
			implements LayoutElement {
		public SlotList(String separator, String defaultSeparatorGap, String defaultFirstGap) {
			this(separator, defaultSeparatorGap, defaultFirstGap, Set.of());
		}

		public boolean accepts(SyntaxNode child) {
			return kinds.isEmpty() || kinds.contains(child.kind());
		}

		/**
		 * Index just past the run of accepted children starting at {@code first}.
		 */
		public int end(SyntaxNode node, int first) {
			int end = first;
			while (end < node.childCount() && accepts(node.child(end))) {
				end++;
			}
			return end;
		}
	}

	/**
	 * Closing bracket of a list, tolerating a trailing comma before it.
	 */
	record Closer(String text) implements LayoutElement {
	}

	/**
	 * Trailing comma of a tuple; required when the tuple has exactly one element.
	 */
	record TupleComma() implements LayoutElement {
	}

	/**
	 * Continuation clause (elif, else, except, finally) starting on its own line at the owning
	 * statement's indentation. A repeated clause takes every following child it accepts.
	 */
	record Clause(Set<NodeKind> kinds, boolean repeated) implements LayoutElement {
		public Clause(Set<NodeKind> kinds) {
			this(kinds, false);
		}

		public boolean accepts(SyntaxNode child) {
			return kinds.contains(child.kind());
		}

		/**
		 * Whether the child at {@code index} continues this clause run, given how many were taken.
		 */
		public boolean takes(SyntaxNode node, int index, int taken) {
			return index < node.childCount() && accepts(node.child(index)) && (repeated || taken == 0);
		}
	}

	/**
	 * Sequence of statements. Nested suites start after a block header and are indented one level deeper.
	 */
	record Suite(boolean nested) implements LayoutElement {
	}
}
