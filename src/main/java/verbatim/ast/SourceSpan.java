package verbatim.ast;

/**
 * Range of original text owned by a node or token.
 *
 * Offsets are 0-based character indices; the end offset is exclusive.
 */
public record SourceSpan(int startOffset, int endOffset) {
	public static final SourceSpan NONE = new SourceSpan(-1, -1);

	public boolean precedes(SourceSpan other) {
		return endOffset <= other.startOffset;
	}
}
