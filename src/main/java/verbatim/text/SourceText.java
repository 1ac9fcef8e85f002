package verbatim.text;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable original text with offset to line/column lookup for diagnostics.
 */
public final class SourceText {
	private final String text;
	private final int[] lineStarts;

	private SourceText(String text) {
		this.text = text;
		int[] starts = new int[16];
		int count = 0;
		starts[count++] = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				if (count == starts.length) {
					starts = Arrays.copyOf(starts, count * 2);
				}
				starts[count++] = i + 1;
			}
		}
		this.lineStarts = Arrays.copyOf(starts, count);
	}

	public static SourceText of(String text) {
		return new SourceText(Objects.requireNonNull(text, "text"));
	}

	public String text() {
		return text;
	}

	public int length() {
		return text.length();
	}

	public String slice(int start, int end) {
		return text.substring(start, end);
	}

	public int lineCount() {
		return lineStarts.length;
	}

	/**
	 * 1-based line containing {@code offset}. Offsets past the end map to the last line.
	 */
	public int lineOf(int offset) {
		if (offset < 0 || offset > text.length()) {
			throw new IndexOutOfBoundsException("offset " + offset + " outside [0, " + text.length() + "]");
		}
		int index = Arrays.binarySearch(lineStarts, offset);
		if (index < 0) {
			index = -index - 2;
		}
		return index + 1;
	}

	/**
	 * 1-based column of {@code offset} within its line.
	 */
	public int columnOf(int offset) {
		return offset - lineStarts[lineOf(offset) - 1] + 1;
	}

	public String describe(int offset) {
		return "line " + lineOf(offset) + ", column " + columnOf(offset);
	}

	@Override
	public String toString() {
		return "SourceText[" + text.length() + " chars, " + lineStarts.length + " lines]";
	}
}
