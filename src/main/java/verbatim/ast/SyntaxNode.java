package verbatim.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable syntax tree node: a fixed kind, an optional literal value and an ordered child list.
 *
 * Nodes compare by identity. The same node is expected to appear at most once in a tree.
 */
public final class SyntaxNode {
	private final NodeKind kind;
	private String value;
	private final List<SyntaxNode> children = new ArrayList<>();

	public SyntaxNode(NodeKind kind) {
		this(kind, null, List.of());
	}

	public SyntaxNode(NodeKind kind, String value) {
		this(kind, value, List.of());
	}

	public SyntaxNode(NodeKind kind, String value, List<SyntaxNode> children) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.value = value;
		for (SyntaxNode child : children) {
			add(child);
		}
	}

	public NodeKind kind() {
		return kind;
	}

	public String value() {
		return value;
	}

	public void setValue(String value) {
		this.value = value;
	}

	public List<SyntaxNode> children() {
		return Collections.unmodifiableList(children);
	}

	public int childCount() {
		return children.size();
	}

	public SyntaxNode child(int index) {
		return children.get(index);
	}

	public void add(SyntaxNode child) {
		children.add(Objects.requireNonNull(child, "child"));
	}

	public void insert(int index, SyntaxNode child) {
		children.add(index, Objects.requireNonNull(child, "child"));
	}

	public SyntaxNode set(int index, SyntaxNode child) {
		return children.set(index, Objects.requireNonNull(child, "child"));
	}

	public SyntaxNode removeAt(int index) {
		return children.remove(index);
	}

	public boolean remove(SyntaxNode child) {
		int index = indexOf(child);
		if (index < 0) {
			return false;
		}
		children.remove(index);
		return true;
	}

	/**
	 * Identity-based position of {@code child}, or -1.
	 */
	public int indexOf(SyntaxNode child) {
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i) == child) {
				return i;
			}
		}
		return -1;
	}

	@Override
	public String toString() {
		StringBuilder out = new StringBuilder(kind.name());
		if (value != null) {
			out.append('[').append(value).append(']');
		}
		if (!children.isEmpty()) {
			out.append('(');
			for (int i = 0; i < children.size(); i++) {
				if (i > 0) {
					out.append(", ");
				}
				out.append(children.get(i));
			}
			out.append(')');
		}
		return out.toString();
	}
}
