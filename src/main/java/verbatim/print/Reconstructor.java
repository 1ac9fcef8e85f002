package verbatim.print;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import verbatim.ast.NodeKind;
import verbatim.ast.NodeTrees;
import verbatim.ast.SyntaxNode;
import verbatim.config.FormatConfig;
import verbatim.layout.ChildRenderer;
import verbatim.layout.Position;
import verbatim.match.MatchException;
import verbatim.match.Matcher;
import verbatim.match.MatcherTree;
import verbatim.match.TextSpanIndexer;
import verbatim.text.SourceText;

import java.util.List;

/**
 * Regenerates source text for a tree that may have been edited since it was indexed.
 *
 * Each node is rendered from its recorded text when it has a matcher that still fits its position,
 * and from its default template otherwise. The decision is made per node on every call.
 */
public final class Reconstructor implements ChildRenderer {
	private static final Logger log = LoggerFactory.getLogger(Reconstructor.class);

	private final SyntaxNode root;
	private final MatcherTree matchers;
	private final FormatConfig config;
	private final DefaultFormatter formatter = new DefaultFormatter();

	private Reconstructor(SyntaxNode root, MatcherTree matchers, FormatConfig config) {
		this.root = root;
		this.matchers = matchers;
		this.config = config;
	}

	public static Reconstructor index(SyntaxNode root, SourceText text) throws MatchException {
		return index(root, text, FormatConfig.defaults());
	}

	public static Reconstructor index(SyntaxNode root, SourceText text, FormatConfig config) throws MatchException {
		return new Reconstructor(root, TextSpanIndexer.index(root, text), config);
	}

	/**
	 * Reconstructor for a tree built from scratch; everything is default-formatted.
	 */
	public static Reconstructor unindexed(SyntaxNode root, FormatConfig config) {
		return new Reconstructor(root, MatcherTree.empty(), config);
	}

	public SyntaxNode root() {
		return root;
	}

	public MatcherTree matchers() {
		return matchers;
	}

	@Override
	public FormatConfig config() {
		return config;
	}

	public String getSource() {
		return render(null, root, Position.root());
	}

	/**
	 * Text of {@code node} at its current place in the tree. A node outside the tree is rendered as if
	 * it were a root.
	 */
	public String getSource(SyntaxNode node) {
		List<SyntaxNode> path = NodeTrees.pathTo(root, node);
		if (path.size() < 2) {
			return render(null, node, Position.root());
		}
		Position position = Position.root();
		for (int i = 1; i < path.size(); i++) {
			SyntaxNode parent = path.get(i - 1);
			int index = parent.indexOf(path.get(i));
			position = childPosition(parent, index, position);
		}
		return render(path.get(path.size() - 2), node, position);
	}

	@Override
	public String render(SyntaxNode parent, SyntaxNode child, Position position) {
		Matcher matcher = matchers.matcherOf(child);
		String text;
		boolean parenthesized;
		if (matcher != null && matcher.fitsAt(position)) {
			text = matcher.getSource(this, position);
			parenthesized = matcher.isParenthesized();
		} else {
			if (matcher == null) {
				log.trace("{} node has no recorded text, using default formatting", child.kind());
			} else {
				log.debug("{} node moved from indentation {} to {}, using default formatting", child.kind(),
						matcher.indentation().length(), position.indentation().length());
			}
			text = formatter.render(child, position, this);
			parenthesized = DefaultFormatter.templateOf(child.kind()).parenthesized();
		}
		if (!parenthesized && Precedence.needsParens(parent, position.index(), child)) {
			return "(" + text + ")";
		}
		return text;
	}

	private Position childPosition(SyntaxNode parent, int index, Position parentPosition) {
		if (parent.kind() == NodeKind.MODULE) {
			return Position.of(parent, index, 0, "");
		}
		if (parent.kind() == NodeKind.BLOCK) {
			return Position.of(parent, index, parentPosition.indentLevel() + 1, innerIndentation(parent, parentPosition));
		}
		return Position.of(parent, index, parentPosition.indentLevel(), parentPosition.indentation());
	}

	private String innerIndentation(SyntaxNode block, Position position) {
		Matcher matcher = matchers.matcherOf(block);
		if (matcher != null && matcher.fitsAt(position) && matcher.suiteIndentation() != null) {
			return matcher.suiteIndentation();
		}
		return position.indentation() + config.getIndentUnit();
	}
}
