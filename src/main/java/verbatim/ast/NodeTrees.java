package verbatim.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Navigation helpers over a tree of {@link SyntaxNode}s. Nodes carry no parent links, so every
 * lookup walks down from a root.
 */
public final class NodeTrees {
	private NodeTrees() {
	}

	/**
	 * Nodes from {@code root} down to {@code target}, both inclusive. Empty when target is not in the tree.
	 */
	public static List<SyntaxNode> pathTo(SyntaxNode root, SyntaxNode target) {
		List<SyntaxNode> path = new ArrayList<>();
		if (collectPath(root, target, path)) {
			Collections.reverse(path);
			return path;
		}
		return List.of();
	}

	private static boolean collectPath(SyntaxNode current, SyntaxNode target, List<SyntaxNode> path) {
		if (current == target) {
			path.add(current);
			return true;
		}
		for (SyntaxNode child : current.children()) {
			if (collectPath(child, target, path)) {
				path.add(current);
				return true;
			}
		}
		return false;
	}

	public static SyntaxNode parentOf(SyntaxNode root, SyntaxNode node) {
		List<SyntaxNode> path = pathTo(root, node);
		return path.size() < 2 ? null : path.get(path.size() - 2);
	}

	/**
	 * Closest statement containing {@code node} (the node itself when it is a statement), or null.
	 */
	public static SyntaxNode enclosingStatement(SyntaxNode root, SyntaxNode node) {
		List<SyntaxNode> path = pathTo(root, node);
		for (int i = path.size() - 1; i >= 0; i--) {
			if (path.get(i).kind().isStatement()) {
				return path.get(i);
			}
		}
		return null;
	}

	/**
	 * Number of blocks enclosing {@code node}; 0 for top-level statements, -1 when detached.
	 */
	public static int indentLevel(SyntaxNode root, SyntaxNode node) {
		List<SyntaxNode> path = pathTo(root, node);
		if (path.isEmpty()) {
			return -1;
		}
		int level = 0;
		for (int i = 0; i < path.size() - 1; i++) {
			if (path.get(i).kind() == NodeKind.BLOCK) {
				level++;
			}
		}
		return level;
	}

	/**
	 * Structural copy. The copy shares no nodes with the original and so has no recorded formatting.
	 */
	public static SyntaxNode deepCopy(SyntaxNode node) {
		SyntaxNode copy = new SyntaxNode(node.kind(), node.value());
		for (SyntaxNode child : node.children()) {
			copy.add(deepCopy(child));
		}
		return copy;
	}
}
