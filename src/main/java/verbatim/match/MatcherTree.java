package verbatim.match;

import verbatim.ast.SourceSpan;
import verbatim.ast.SyntaxNode;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Side table from indexed nodes to their matchers, keyed by node identity.
 */
public final class MatcherTree {
	private final Map<SyntaxNode, Matcher> matchers;

	MatcherTree(Map<SyntaxNode, Matcher> matchers) {
		this.matchers = new IdentityHashMap<>(matchers);
	}

	public static MatcherTree empty() {
		return new MatcherTree(Map.of());
	}

	/**
	 * Matcher recorded for {@code node}, or null when the node was created after indexing.
	 */
	public Matcher matcherOf(SyntaxNode node) {
		return matchers.get(node);
	}

	public SourceSpan spanOf(SyntaxNode node) {
		Matcher matcher = matchers.get(node);
		return matcher == null ? SourceSpan.NONE : matcher.span();
	}

	public int size() {
		return matchers.size();
	}
}
