package verbatim.parse.py;

import verbatim.ast.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lexer for the indentation-structured source language.
 *
 * Notes:
 * - Blank lines and comment-only lines produce no tokens.
 * - Line breaks inside brackets and after a backslash are not NEWLINE tokens.
 * - INDENT/DEDENT are derived from the width of leading whitespace (a tab counts as one column).
 */
public final class PyLexer {
	private static final String[] OPERATORS = {
			"**=", "//=", ">>=", "<<=", "...",
			"**", "//", ">>", "<<", "<=", ">=", "==", "!=", "->", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
			"@=", ":=",
			"+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">", "(", ")", "[", "]", "{", "}", ",", ":",
			".", ";", "=", "!"
	};

	public List<PyToken> lex(String input) {
		List<PyToken> tokens = new ArrayList<>();
		Deque<Integer> indents = new ArrayDeque<>();
		indents.push(0);
		int depth = 0;
		boolean lineStart = true;
		int i = 0;
		while (i < input.length()) {
			if (lineStart && depth == 0) {
				int p = i;
				while (p < input.length() && isInlineSpace(input.charAt(p))) {
					p++;
				}
				if (p >= input.length()) {
					i = p;
					break;
				}
				char c = input.charAt(p);
				if (c == '#') {
					i = skipComment(input, p);
					continue;
				}
				if (c == '\n' || c == '\r') {
					i = p + 1;
					continue;
				}
				int width = p - i;
				if (width > indents.peek()) {
					indents.push(width);
					tokens.add(new PyToken(PyTokenType.INDENT, "", new SourceSpan(p, p)));
				} else {
					while (width < indents.peek()) {
						indents.pop();
						tokens.add(new PyToken(PyTokenType.DEDENT, "", new SourceSpan(p, p)));
					}
					if (width != indents.peek()) {
						throw new IllegalArgumentException("Inconsistent dedent at offset " + p);
					}
				}
				i = p;
				lineStart = false;
				continue;
			}

			char c = input.charAt(i);

			if (isInlineSpace(c)) {
				i++;
				continue;
			}

			// line continuation
			if (c == '\\' && i + 1 < input.length() && (input.charAt(i + 1) == '\n' || input.charAt(i + 1) == '\r')) {
				i = skipLineBreak(input, i + 1);
				continue;
			}

			if (c == '#') {
				i = skipCommentText(input, i);
				continue;
			}

			if (c == '\n' || c == '\r') {
				if (depth == 0) {
					tokens.add(new PyToken(PyTokenType.NEWLINE, "", new SourceSpan(i, i + 1)));
					lineStart = true;
				}
				i = skipLineBreak(input, i);
				continue;
			}

			int stringEnd = stringEnd(input, i);
			if (stringEnd > 0) {
				tokens.add(new PyToken(PyTokenType.STRING, input.substring(i, stringEnd), new SourceSpan(i, stringEnd)));
				i = stringEnd;
				continue;
			}

			if (Character.isLetter(c) || c == '_') {
				int start = i;
				i++;
				while (i < input.length() && isWordChar(input.charAt(i))) {
					i++;
				}
				tokens.add(new PyToken(PyTokenType.NAME, input.substring(start, i), new SourceSpan(start, i)));
				continue;
			}

			if (Character.isDigit(c) || (c == '.' && i + 1 < input.length() && Character.isDigit(input.charAt(i + 1)))) {
				int start = i;
				i = numberEnd(input, i);
				tokens.add(new PyToken(PyTokenType.NUMBER, input.substring(start, i), new SourceSpan(start, i)));
				continue;
			}

			String op = operatorAt(input, i);
			if (op == null) {
				throw new IllegalArgumentException("Unexpected character '" + c + "' at offset " + i);
			}
			if (op.equals("(") || op.equals("[") || op.equals("{")) {
				depth++;
			} else if (op.equals(")") || op.equals("]") || op.equals("}")) {
				depth = Math.max(0, depth - 1);
			}
			tokens.add(new PyToken(PyTokenType.OP, op, new SourceSpan(i, i + op.length())));
			i += op.length();
		}

		int end = input.length();
		if (!tokens.isEmpty()) {
			PyTokenType last = tokens.get(tokens.size() - 1).type();
			if (last != PyTokenType.NEWLINE && last != PyTokenType.DEDENT) {
				tokens.add(new PyToken(PyTokenType.NEWLINE, "", new SourceSpan(end, end)));
			}
		}
		while (indents.size() > 1) {
			indents.pop();
			tokens.add(new PyToken(PyTokenType.DEDENT, "", new SourceSpan(end, end)));
		}
		tokens.add(new PyToken(PyTokenType.EOF, "", new SourceSpan(end, end)));
		return tokens;
	}

	/**
	 * End offset of the string literal starting at {@code start}, or -1 when none starts there.
	 */
	private static int stringEnd(String input, int start) {
		int p = start;
		while (p < input.length() && p - start < 2 && "rRbBuUfF".indexOf(input.charAt(p)) >= 0) {
			p++;
		}
		if (p >= input.length() || (input.charAt(p) != '"' && input.charAt(p) != '\'')) {
			return -1;
		}
		String quote = String.valueOf(input.charAt(p));
		if (input.startsWith(quote.repeat(3), p)) {
			quote = quote.repeat(3);
		}
		int i = p + quote.length();
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\\') {
				i += 2;
				continue;
			}
			if (input.startsWith(quote, i)) {
				return i + quote.length();
			}
			if (quote.length() == 1 && (c == '\n' || c == '\r')) {
				break;
			}
			i++;
		}
		throw new IllegalArgumentException("Unterminated string literal at offset " + start);
	}

	private static int numberEnd(String input, int start) {
		boolean hex = input.startsWith("0x", start) || input.startsWith("0X", start);
		int i = start;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (isWordChar(c) || c == '.') {
				i++;
			} else if ((c == '+' || c == '-') && !hex && (input.charAt(i - 1) == 'e' || input.charAt(i - 1) == 'E')) {
				i++;
			} else {
				break;
			}
		}
		return i;
	}

	private static String operatorAt(String input, int i) {
		for (String op : OPERATORS) {
			if (input.startsWith(op, i)) {
				return op;
			}
		}
		return null;
	}

	private static int skipComment(String input, int start) {
		return skipLineBreak(input, skipCommentText(input, start));
	}

	private static int skipCommentText(String input, int start) {
		int i = start;
		while (i < input.length() && input.charAt(i) != '\n' && input.charAt(i) != '\r') {
			i++;
		}
		return i;
	}

	private static int skipLineBreak(String input, int i) {
		if (i >= input.length()) {
			return i;
		}
		if (input.charAt(i) == '\r' && i + 1 < input.length() && input.charAt(i + 1) == '\n') {
			return i + 2;
		}
		return i + 1;
	}

	private static boolean isInlineSpace(char c) {
		return c == ' ' || c == '\t' || c == '\f';
	}

	private static boolean isWordChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}
}
