package verbatim.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SourceTextTest {
	@Test
	void mapsOffsetsToLinesAndColumns() {
		SourceText text = SourceText.of("ab\ncd\n\nef");

		assertEquals(4, text.lineCount());
		assertEquals(1, text.lineOf(0));
		assertEquals(1, text.lineOf(2));
		assertEquals(2, text.lineOf(3));
		assertEquals(2, text.columnOf(4));
		assertEquals(3, text.lineOf(6));
		assertEquals(4, text.lineOf(9));
		assertEquals("line 4, column 3", text.describe(9));
	}

	@Test
	void slicesOriginalText() {
		SourceText text = SourceText.of("x = 1\n");

		assertEquals("= 1", text.slice(2, 5));
		assertEquals(6, text.length());
	}

	@Test
	void rejectsOffsetsOutsideText() {
		SourceText text = SourceText.of("abc");

		assertThrows(IndexOutOfBoundsException.class, () -> text.lineOf(4));
		assertThrows(IndexOutOfBoundsException.class, () -> text.lineOf(-1));
	}

	@Test
	void summarizesItself() {
		assertEquals("SourceText[6 chars, 4 lines]", SourceText.of("a\nb\nc\n").toString());
	}
}
