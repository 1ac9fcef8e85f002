package verbatim.parse.py;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PyLexerTest {
	@Test
	void emitsIndentAndDedentAroundBlocks() {
		List<PyToken> tokens = new PyLexer().lex("if x:\n    y\n");

		assertEquals(List.of(
				PyTokenType.NAME, PyTokenType.NAME, PyTokenType.OP, PyTokenType.NEWLINE,
				PyTokenType.INDENT, PyTokenType.NAME, PyTokenType.NEWLINE,
				PyTokenType.DEDENT, PyTokenType.EOF), types(tokens));
	}

	@Test
	void ignoresLineBreaksInsideBrackets() {
		List<PyToken> tokens = new PyLexer().lex("x = (1,\n  2)\n");

		assertEquals("x = ( 1 , 2 )", lexemes(tokens));
		assertEquals(1, tokens.stream().filter(t -> t.type() == PyTokenType.NEWLINE).count());
	}

	@Test
	void skipsCommentsAndBlankLines() {
		List<PyToken> tokens = new PyLexer().lex("# header\n\na = 1  # note\n   \n# footer");

		assertEquals("a = 1", lexemes(tokens));
	}

	@Test
	void readsPrefixedAndTripleQuotedStrings() {
		List<PyToken> tokens = new PyLexer().lex("s = rb'x\\'y' + \"\"\"a\nb\"\"\"\n");

		assertEquals(PyTokenType.STRING, tokens.get(2).type());
		assertEquals("rb'x\\'y'", tokens.get(2).lexeme());
		assertEquals("\"\"\"a\nb\"\"\"", tokens.get(4).lexeme());
	}

	@Test
	void prefersLongestOperator() {
		List<PyToken> tokens = new PyLexer().lex("a //= b ** -c\n");

		assertEquals("a //= b ** - c", lexemes(tokens));
	}

	@Test
	void recordsTokenSpans() {
		List<PyToken> tokens = new PyLexer().lex("foo(bar)\n");

		assertEquals(4, tokens.get(2).span().startOffset());
		assertEquals(7, tokens.get(2).span().endOffset());
	}

	@Test
	void addsMissingFinalNewline() {
		List<PyToken> tokens = new PyLexer().lex("pass");

		assertEquals(List.of(PyTokenType.NAME, PyTokenType.NEWLINE, PyTokenType.EOF), types(tokens));
	}

	@Test
	void rejectsInconsistentDedent() {
		assertThrows(IllegalArgumentException.class, () -> new PyLexer().lex("if x:\n    y\n  z\n"));
	}

	@Test
	void rejectsUnterminatedString() {
		assertThrows(IllegalArgumentException.class, () -> new PyLexer().lex("s = 'abc\n"));
	}

	private static List<PyTokenType> types(List<PyToken> tokens) {
		return tokens.stream().map(PyToken::type).collect(Collectors.toList());
	}

	private static String lexemes(List<PyToken> tokens) {
		return tokens.stream()
				.filter(t -> !t.lexeme().isEmpty())
				.map(PyToken::lexeme)
				.collect(Collectors.joining(" "));
	}
}
