package verbatim.print;

import verbatim.ast.NodeKind;
import verbatim.ast.SyntaxNode;
import verbatim.config.FormatConfig;
import verbatim.layout.ChildRenderer;
import verbatim.layout.Layout;
import verbatim.layout.LayoutElement;
import verbatim.layout.LayoutElement.Clause;
import verbatim.layout.LayoutElement.Closer;
import verbatim.layout.LayoutElement.Literal;
import verbatim.layout.LayoutElement.OptionalSlot;
import verbatim.layout.LayoutElement.Slot;
import verbatim.layout.LayoutElement.SlotList;
import verbatim.layout.LayoutElement.Suite;
import verbatim.layout.LayoutElement.TupleComma;
import verbatim.layout.LayoutElement.ValueText;
import verbatim.layout.Layouts;
import verbatim.layout.Position;
import verbatim.layout.SuiteSpacing;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders nodes that have no usable recorded text, from a fixed per-kind template table.
 */
public final class DefaultFormatter {
	private static final Map<NodeKind, Template> TEMPLATES;

	static {
		Map<NodeKind, Template> templates = new EnumMap<>(NodeKind.class);
		for (NodeKind kind : NodeKind.values()) {
			Layout layout = Layouts.of(kind);
			if (layout.defaultable()) {
				templates.put(kind, new Template(layout, kind == NodeKind.TUPLE));
			}
		}
		TEMPLATES = Collections.unmodifiableMap(templates);
	}

	public static boolean hasTemplate(NodeKind kind) {
		return TEMPLATES.containsKey(kind);
	}

	public static Template templateOf(NodeKind kind) {
		return TEMPLATES.get(kind);
	}

	/**
	 * Canonical text of {@code node}. Children are rendered through {@code renderer}, so they may still
	 * use their own recorded text.
	 *
	 * @throws UnsupportedNodeException when the node's kind has no template
	 */
	public String render(SyntaxNode node, Position position, ChildRenderer renderer) {
		Template template = TEMPLATES.get(node.kind());
		if (template == null) {
			throw new UnsupportedNodeException(node.kind());
		}
		FormatConfig config = renderer.config();
		List<SyntaxNode> children = node.children();
		StringBuilder out = new StringBuilder();
		if (template.parenthesized()) {
			out.append('(');
		}
		int next = 0;
		int listSize = 0;
		for (LayoutElement element : template.layout().elements()) {
			if (element instanceof Literal literal) {
				out.append(literal.defaultGap()).append(literal.text());
			} else if (element instanceof ValueText valueText) {
				out.append(valueText.defaultGap()).append(valueOf(node, config));
			} else if (element instanceof Slot slot) {
				if (next >= children.size()) {
					throw new IllegalStateException(node.kind() + " node is missing a required child");
				}
				out.append(slot.defaultGap()).append(renderChild(node, next, position, renderer));
				next++;
			} else if (element instanceof OptionalSlot optional) {
				if (next < children.size() && optional.accepts(children.get(next))) {
					if (optional.prefix() != null) {
						out.append(optional.prefix().defaultGap()).append(optional.prefix().text());
					}
					out.append(optional.defaultGap()).append(renderChild(node, next, position, renderer));
					next++;
				}
			} else if (element instanceof SlotList list) {
				int end = list.end(node, next);
				listSize = end - next;
				for (int j = 0; next < end; j++, next++) {
					out.append(j == 0 ? list.defaultFirstGap() : list.separator() + list.defaultSeparatorGap());
					out.append(renderChild(node, next, position, renderer));
				}
			} else if (element instanceof Closer closer) {
				out.append(closer.text());
			} else if (element instanceof TupleComma) {
				if (listSize == 1) {
					out.append(',');
				}
			} else if (element instanceof Clause clause) {
				for (int taken = 0; clause.takes(node, next, taken); taken++) {
					out.append(SuiteSpacing.lineBreak(config, out)).append(position.indentation());
					out.append(renderChild(node, next, position, renderer));
					next++;
				}
			} else if (element instanceof Suite suite) {
				renderSuite(node, suite.nested(), next, position, renderer, out);
				next = children.size();
			}
		}
		if (next < children.size()) {
			throw new IllegalStateException(node.kind() + " node has " + (children.size() - next) + " unexpected children");
		}
		if (template.parenthesized()) {
			out.append(')');
		}
		return out.toString();
	}

	private static void renderSuite(SyntaxNode node, boolean nested, int first, Position position,
			ChildRenderer renderer, StringBuilder out) {
		FormatConfig config = renderer.config();
		String indentation = nested ? position.indentation() + config.getIndentUnit() : "";
		int level = nested ? position.indentLevel() + 1 : 0;
		if (nested) {
			out.append(config.getNewline());
		}
		for (int i = first; i < node.childCount(); i++) {
			SyntaxNode statement = node.child(i);
			Position at = Position.of(node, i, level, indentation);
			out.append(SuiteSpacing.lineBreak(config, out));
			out.append(SuiteSpacing.leading(config, nested, at, statement));
			out.append(renderer.render(node, statement, at));
			out.append(SuiteSpacing.trailing(config, statement));
		}
	}

	private static String renderChild(SyntaxNode node, int index, Position position, ChildRenderer renderer) {
		Position at = Position.of(node, index, position.indentLevel(), position.indentation());
		return renderer.render(node, node.child(index), at);
	}

	private static String valueOf(SyntaxNode node, FormatConfig config) {
		String value = node.value();
		if (value == null) {
			throw new IllegalStateException(node.kind() + " node has no value");
		}
		return node.kind() == NodeKind.STRING ? quote(value, config) : value;
	}

	static String quote(String content, FormatConfig config) {
		String quote = config.getQuote();
		if (content.indexOf('\n') >= 0) {
			quote = quote.repeat(3);
		} else if (content.contains(quote)) {
			String other = "\"".equals(quote) ? "'" : "\"";
			if (!content.contains(other)) {
				quote = other;
			}
		}
		return quote + content + quote;
	}
}
