package verbatim.layout;

import verbatim.ast.NodeKind;

import java.util.List;

/**
 * Token layout of one node kind, in source order.
 *
 * @param defaultable whether a node of this kind can be rendered without recorded text
 */
public record Layout(NodeKind kind, List<LayoutElement> elements, boolean defaultable) {
	public Layout {
		elements = List.copyOf(elements);
	}

	public int size() {
		return elements.size();
	}

	public LayoutElement element(int index) {
		return elements.get(index);
	}
}
