package verbatim.match;

import verbatim.ast.NodeKind;
import verbatim.ast.SourceSpan;
import verbatim.ast.SyntaxNode;
import verbatim.config.FormatConfig;
import verbatim.layout.ChildRenderer;
import verbatim.layout.Layout;
import verbatim.layout.LayoutElement;
import verbatim.layout.LayoutElement.Clause;
import verbatim.layout.LayoutElement.Closer;
import verbatim.layout.LayoutElement.OptionalSlot;
import verbatim.layout.LayoutElement.SlotList;
import verbatim.layout.LayoutElement.Suite;
import verbatim.layout.Layouts;
import verbatim.layout.Position;
import verbatim.layout.SuiteSpacing;
import verbatim.match.Piece.ClausePiece;
import verbatim.match.Piece.CloserPiece;
import verbatim.match.Piece.CommaPiece;
import verbatim.match.Piece.ListItem;
import verbatim.match.Piece.ListPiece;
import verbatim.match.Piece.LiteralPiece;
import verbatim.match.Piece.OptionalPiece;
import verbatim.match.Piece.SlotPiece;
import verbatim.match.Piece.SuiteLine;
import verbatim.match.Piece.SuitePiece;
import verbatim.match.Piece.ValuePiece;

import java.util.ArrayList;
import java.util.List;

/**
 * Recorded text of one indexed node.
 *
 * Rendering replays the recorded pieces against the node's current children. Children that are
 * still where they were recorded keep their surrounding text; new or moved children get default
 * separators, and removed ones take their own separators with them.
 */
public final class Matcher {
	private final SyntaxNode node;
	private final List<String> openParens;
	private final List<String> closeParens;
	private final List<Piece> pieces;
	private final String indentation;
	private final SourceSpan span;

	Matcher(SyntaxNode node, List<String> openParens, List<String> closeParens, List<Piece> pieces,
			String indentation, SourceSpan span) {
		this.node = node;
		this.openParens = List.copyOf(openParens);
		this.closeParens = List.copyOf(closeParens);
		this.pieces = List.copyOf(pieces);
		this.indentation = indentation;
		this.span = span;
	}

	public SourceSpan span() {
		return span;
	}

	/**
	 * Indentation the node was indexed at, or null when its text does not depend on it.
	 */
	public String indentation() {
		return indentation;
	}

	/**
	 * Whether the rendered text is enclosed in parentheses of its own: recorded grouping parentheses, or
	 * the {@code ()} that stands in for a bare tuple whose items were all removed.
	 */
	public boolean isParenthesized() {
		return !openParens.isEmpty() || isEmptiedBareTuple();
	}

	private boolean isEmptiedBareTuple() {
		return node.kind() == NodeKind.TUPLE && node.childCount() == 0 && openParens.isEmpty();
	}

	/**
	 * Whether the recorded text is still valid for the node at {@code position}.
	 */
	public boolean fitsAt(Position position) {
		return indentation == null || indentation.equals(position.indentation());
	}

	/**
	 * Indentation of the statements of a block or module, or null for other kinds.
	 */
	public String suiteIndentation() {
		for (Piece piece : pieces) {
			if (piece instanceof SuitePiece suite) {
				return suite.indentation();
			}
		}
		return null;
	}

	public String getSource(ChildRenderer renderer, Position position) {
		StringBuilder out = new StringBuilder();
		for (String open : openParens) {
			out.append(open);
		}
		renderBody(renderer, position, out);
		for (String close : closeParens) {
			out.append(close);
		}
		return out.toString();
	}

	private void renderBody(ChildRenderer renderer, Position position, StringBuilder out) {
		Layout layout = Layouts.of(node.kind());
		FormatConfig config = renderer.config();
		List<SyntaxNode> children = node.children();
		int next = 0;
		int listSize = 0;
		for (int e = 0; e < pieces.size(); e++) {
			Piece piece = pieces.get(e);
			LayoutElement element = layout.element(e);
			if (piece instanceof LiteralPiece literal) {
				out.append(literal.gap()).append(literal.text());
			} else if (piece instanceof ValuePiece value) {
				if (node.value() == null) {
					throw new IllegalStateException(node.kind() + " node has no value");
				}
				out.append(value.gap()).append(value.render(node.value()));
			} else if (piece instanceof SlotPiece slot) {
				if (next >= children.size()) {
					throw new IllegalStateException(node.kind() + " node is missing a required child");
				}
				out.append(slot.gap()).append(renderChild(renderer, position, next));
				next++;
			} else if (piece instanceof OptionalPiece optional) {
				OptionalSlot slot = (OptionalSlot) element;
				if (next < children.size() && slot.accepts(children.get(next))) {
					boolean recorded = optional.child() != null;
					if (slot.prefix() != null) {
						out.append(recorded ? optional.prefixGap() : slot.prefix().defaultGap()).append(slot.prefix().text());
					}
					out.append(recorded ? optional.gap() : slot.defaultGap());
					out.append(renderChild(renderer, position, next));
					next++;
				}
			} else if (piece instanceof ListPiece list) {
				SlotList slots = (SlotList) element;
				int end = slots.end(node, next);
				listSize = end - next;
				renderList(list, slots, renderer, position, next, end, out);
				next = end;
			} else if (piece instanceof CloserPiece closer) {
				out.append(closer.beforeComma());
				if (closer.comma() && listSize > 0) {
					out.append(',');
				}
				out.append(closer.afterComma()).append(((Closer) element).text());
			} else if (piece instanceof CommaPiece comma) {
				if (isEmptiedBareTuple()) {
					out.append("()");
				} else if (listSize == 1 && comma.text().isEmpty()) {
					out.append(',');
				} else if (listSize > 0) {
					out.append(comma.text());
				}
			} else if (piece instanceof ClausePiece clauses) {
				Clause clause = (Clause) element;
				for (int taken = 0; clause.takes(node, next, taken); taken++) {
					String gap = clauses.gapOf(children.get(next));
					out.append(SuiteSpacing.lineBreak(config, out));
					out.append(gap != null ? gap : position.indentation());
					out.append(renderChild(renderer, position, next));
					next++;
				}
			} else if (piece instanceof SuitePiece suite) {
				renderSuite(suite, (Suite) element, renderer, position, next, out);
				next = children.size();
			}
		}
		if (next < children.size()) {
			throw new IllegalStateException(node.kind() + " node has " + (children.size() - next) + " unexpected children");
		}
	}

	private String renderChild(ChildRenderer renderer, Position position, int index) {
		Position at = Position.of(node, index, position.indentLevel(), position.indentation());
		return renderer.render(node, node.child(index), at);
	}

	private void renderList(ListPiece list, SlotList element, ChildRenderer renderer, Position position, int first,
			int end, StringBuilder out) {
		List<SyntaxNode> items = node.children().subList(first, end);
		int[] recorded = SlotAlignment.recordedIndices(nodesOf(list), items);
		boolean[] kept = SlotAlignment.kept(recorded);
		for (int j = 0; j < items.size(); j++) {
			if (j == 0) {
				out.append(list.firstGap() != null ? list.firstGap() : element.defaultFirstGap());
			} else {
				ListItem own = kept[j] && recorded[j] > 0 ? list.items().get(recorded[j]) : null;
				ListItem previous = recorded[j - 1] >= 0 ? list.items().get(recorded[j - 1]) : null;
				out.append(own != null ? own.lead() : element.separator());
				if (previous != null && !previous.tail().isEmpty()) {
					out.append(previous.tail());
				} else if (own != null && list.items().get(recorded[j] - 1).tail().isEmpty()) {
					out.append(own.after());
				} else {
					// own gap went to the recorded predecessor's tail
					out.append(element.defaultSeparatorGap());
				}
			}
			out.append(renderChild(renderer, position, first + j));
		}
	}

	private void renderSuite(SuitePiece suite, Suite element, ChildRenderer renderer, Position position, int first,
			StringBuilder out) {
		FormatConfig config = renderer.config();
		List<SyntaxNode> statements = node.children().subList(first, node.childCount());
		List<SyntaxNode> recordedNodes = new ArrayList<>(suite.lines().size());
		for (SuiteLine line : suite.lines()) {
			recordedNodes.add(line.node());
		}
		int[] recorded = SlotAlignment.recordedIndices(recordedNodes, statements);
		boolean[] kept = SlotAlignment.kept(recorded);
		int level = element.nested() ? position.indentLevel() + 1 : 0;

		out.append(suite.opening());
		for (int j = 0; j < statements.size(); j++) {
			SyntaxNode statement = statements.get(j);
			Position at = Position.of(node, first + j, level, suite.indentation());
			String leading = SuiteSpacing.leading(config, element.nested(), at, statement);
			String trailing = SuiteSpacing.trailing(config, statement);
			if (recorded[j] >= 0) {
				SuiteLine line = suite.lines().get(recorded[j]);
				trailing = line.trailing();
				if (kept[j]) {
					leading = line.leading();
				}
			}
			out.append(SuiteSpacing.lineBreak(config, out)).append(leading);
			out.append(renderer.render(node, statement, at)).append(trailing);
		}
		if (!suite.trailer().isEmpty()) {
			out.append(SuiteSpacing.lineBreak(config, out)).append(suite.trailer());
		}
	}

	private static List<SyntaxNode> nodesOf(ListPiece list) {
		List<SyntaxNode> nodes = new ArrayList<>(list.items().size());
		for (ListItem item : list.items()) {
			nodes.add(item.node());
		}
		return nodes;
	}
}
