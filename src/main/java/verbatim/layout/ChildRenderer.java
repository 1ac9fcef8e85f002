package verbatim.layout;

import verbatim.ast.SyntaxNode;
import verbatim.config.FormatConfig;

/**
 * Callback used by matchers and the default formatter to render a child node, whichever way that
 * child has to be rendered.
 */
public interface ChildRenderer {
	String render(SyntaxNode parent, SyntaxNode child, Position position);

	FormatConfig config();
}
