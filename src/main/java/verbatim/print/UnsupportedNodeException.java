package verbatim.print;

import verbatim.ast.NodeKind;

/**
 * Thrown when a node has to be rendered from scratch but its kind has no default template.
 */
public class UnsupportedNodeException extends RuntimeException {
	private final NodeKind kind;

	public UnsupportedNodeException(NodeKind kind) {
		super("No default template for node kind " + kind);
		this.kind = kind;
	}

	public UnsupportedNodeException(NodeKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public NodeKind getKind() {
		return kind;
	}
}
