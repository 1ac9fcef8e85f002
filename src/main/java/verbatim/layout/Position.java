package verbatim.layout;

import verbatim.ast.NodeKind;
import verbatim.ast.SyntaxNode;

/**
 * Where a node sits among its current siblings.
 *
 * @param index           position in the parent's child list, 0 for a root
 * @param predecessorKind kind of the previous sibling, or null
 * @param indentLevel     number of enclosing blocks
 * @param indentation     leading whitespace of the line the enclosing statement starts on
 */
public record Position(int index, NodeKind predecessorKind, int indentLevel, String indentation) {

	public static Position root() {
		return new Position(0, null, 0, "");
	}

	public static Position of(SyntaxNode parent, int index, int indentLevel, String indentation) {
		NodeKind before = index > 0 ? parent.child(index - 1).kind() : null;
		return new Position(index, before, indentLevel, indentation);
	}
}
