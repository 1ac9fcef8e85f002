package verbatim.match;

/**
 * Thrown when a syntax tree cannot be aligned with the text it is claimed to come from.
 */
public class MatchException extends Exception {
	private final int offset;

	public MatchException(String message, int offset) {
		super(message);
		this.offset = offset;
	}

	public MatchException(String message, int offset, Throwable cause) {
		super(message, cause);
		this.offset = offset;
	}

	/**
	 * Character offset at which alignment failed.
	 */
	public int getOffset() {
		return offset;
	}
}
