package verbatim.match;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import verbatim.ast.NodeKind;
import verbatim.ast.SourceSpan;
import verbatim.ast.SyntaxNode;
import verbatim.layout.Layout;
import verbatim.layout.LayoutElement;
import verbatim.layout.LayoutElement.Clause;
import verbatim.layout.LayoutElement.Closer;
import verbatim.layout.LayoutElement.Literal;
import verbatim.layout.LayoutElement.OptionalSlot;
import verbatim.layout.LayoutElement.Slot;
import verbatim.layout.LayoutElement.SlotList;
import verbatim.layout.LayoutElement.Suite;
import verbatim.layout.LayoutElement.TupleComma;
import verbatim.layout.LayoutElement.ValueText;
import verbatim.layout.Layouts;
import verbatim.match.Piece.ClauseLine;
import verbatim.match.Piece.ClausePiece;
import verbatim.match.Piece.CloserPiece;
import verbatim.match.Piece.CommaPiece;
import verbatim.match.Piece.ListItem;
import verbatim.match.Piece.ListPiece;
import verbatim.match.Piece.LiteralPiece;
import verbatim.match.Piece.OptionalPiece;
import verbatim.match.Piece.SlotPiece;
import verbatim.match.Piece.SuiteLine;
import verbatim.match.Piece.SuitePiece;
import verbatim.match.Piece.ValuePiece;
import verbatim.text.SourceText;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aligns a syntax tree with the text it was parsed from, in one left-to-right pass driven by the
 * per-kind layouts.
 *
 * Ownership rules:
 * - the gap in front of a node's first element belongs to the parent;
 * - blank and comment-only lines in front of a statement belong to that statement;
 * - the rest of a statement's last line (spaces, comment, line break) belongs to that statement;
 * - comment lines after the last statement of a block belong to the block when indented at least as
 * deep as its statements;
 * - a comment right after a list separator ends the line of the item before it and belongs to that item;
 * - grouping parentheses belong to the innermost node they enclose exactly.
 */
public final class TextSpanIndexer {
	private static final Logger log = LoggerFactory.getLogger(TextSpanIndexer.class);

	private final SourceText source;
	private final String text;
	private final Map<SyntaxNode, Matcher> matchers = new IdentityHashMap<>();
	private int pos;
	private int depth;

	private TextSpanIndexer(SourceText source) {
		this.source = source;
		this.text = source.text();
	}

	/**
	 * Records a matcher for every node under {@code root}. Fails without a partial result when the tree
	 * and the text disagree anywhere.
	 */
	public static MatcherTree index(SyntaxNode root, SourceText source) throws MatchException {
		TextSpanIndexer indexer = new TextSpanIndexer(source);
		indexer.match(root, null, "");
		if (indexer.pos != indexer.text.length()) {
			throw indexer.fail("unexpected text after " + root.kind());
		}
		log.debug("Indexed {} nodes over {}", indexer.matchers.size(), source);
		return new MatcherTree(indexer.matchers);
	}

	private record OpenParen(int offset, String text) {
	}

	private void match(SyntaxNode node, Deque<OpenParen> inherited, String indentation) throws MatchException {
		int start = pos;
		Deque<OpenParen> opens = node.kind().isExpression() ? inherited : null;
		boolean ownsStack = false;
		if (node.kind().isExpression()) {
			if (opens == null) {
				opens = new ArrayDeque<>();
				ownsStack = true;
			}
			while (at("(")) {
				int openStart = pos;
				pos++;
				depth++;
				scanGap();
				opens.push(new OpenParen(openStart, text.substring(openStart, pos)));
			}
		}

		List<Piece> pieces = matchLayout(node, opens, indentation);

		List<String> openTexts = new ArrayList<>();
		List<String> closeTexts = new ArrayList<>();
		int spanStart = start;
		if (opens != null) {
			while (!opens.isEmpty()) {
				int mark = pos;
				String gap = scanGap();
				if (!at(")")) {
					pos = mark;
					break;
				}
				pos++;
				depth--;
				OpenParen open = opens.pop();
				openTexts.add(0, open.text());
				closeTexts.add(gap + ")");
				spanStart = Math.min(spanStart, open.offset());
			}
			if (ownsStack && !opens.isEmpty()) {
				throw failAt(opens.peek().offset(), "unclosed parenthesis");
			}
		}

		String recordedIndentation = node.kind().isIndented() ? indentation : null;
		matchers.put(node, new Matcher(node, openTexts, closeTexts, pieces, recordedIndentation,
				new SourceSpan(spanStart, pos)));
	}

	private List<Piece> matchLayout(SyntaxNode node, Deque<OpenParen> opens, String indentation)
			throws MatchException {
		Layout layout = Layouts.of(node.kind());
		List<SyntaxNode> children = node.children();
		List<Piece> pieces = new ArrayList<>(layout.size());
		int next = 0;
		for (int e = 0; e < layout.size(); e++) {
			LayoutElement element = layout.element(e);
			Deque<OpenParen> handOff = e == 0 ? opens : null;
			if (element instanceof Literal literal) {
				String gap = e == 0 ? "" : scanGap();
				expect(literal.text());
				if (literal.opensBracket()) {
					depth++;
				} else if (literal.closesBracket()) {
					depth--;
				}
				pieces.add(new LiteralPiece(gap, literal.text()));
			} else if (element instanceof ValueText) {
				String gap = e == 0 ? "" : scanGap();
				pieces.add(matchValue(node, gap));
			} else if (element instanceof Slot) {
				if (next >= children.size()) {
					throw fail(node.kind() + " node is missing a required child");
				}
				SyntaxNode child = children.get(next++);
				String gap = e == 0 || child.kind() == NodeKind.BLOCK ? "" : scanGap();
				match(child, handOff, indentation);
				pieces.add(new SlotPiece(gap, child));
			} else if (element instanceof OptionalSlot optional) {
				if (next < children.size() && optional.accepts(children.get(next))) {
					SyntaxNode child = children.get(next++);
					String prefixGap = "";
					if (optional.prefix() != null) {
						prefixGap = scanGap();
						expect(optional.prefix().text());
					}
					String gap = scanGap();
					match(child, null, indentation);
					pieces.add(new OptionalPiece(prefixGap, gap, child));
				} else {
					pieces.add(new OptionalPiece("", "", null));
				}
			} else if (element instanceof SlotList list) {
				List<ListItem> items = new ArrayList<>();
				while (next < children.size() && list.accepts(children.get(next))) {
					SyntaxNode child = children.get(next++);
					String lead;
					String after = "";
					if (items.isEmpty()) {
						lead = e == 0 ? "" : scanGap();
					} else {
						int leadStart = pos;
						scanGap();
						expect(list.separator());
						lead = text.substring(leadStart, pos);
						after = scanGap();
						if (startsWithComment(after)) {
							ListItem previous = items.get(items.size() - 1);
							items.set(items.size() - 1, new ListItem(previous.node(), previous.lead(), previous.after(), after));
							after = "";
						}
					}
					match(child, items.isEmpty() ? handOff : null, indentation);
					items.add(new ListItem(child, lead, after, ""));
				}
				pieces.add(new ListPiece(items.isEmpty() ? null : items.get(0).lead(), items));
			} else if (element instanceof Closer closer) {
				String before = scanGap();
				boolean comma = false;
				String after = "";
				if (at(",")) {
					pos++;
					comma = true;
					after = scanGap();
				}
				expect(closer.text());
				depth--;
				pieces.add(new CloserPiece(before, comma, after));
			} else if (element instanceof TupleComma) {
				int commaStart = pos;
				scanGap();
				if (!children.isEmpty() && at(",")) {
					pos++;
					pieces.add(new CommaPiece(text.substring(commaStart, pos)));
				} else {
					pos = commaStart;
					pieces.add(new CommaPiece(""));
				}
			} else if (element instanceof Clause clause) {
				List<ClauseLine> clauses = new ArrayList<>();
				while (clause.takes(node, next, clauses.size())) {
					SyntaxNode child = children.get(next++);
					int gapStart = pos;
					String found = scanLeadingLines();
					if (!indentation.equals(found)) {
						throw fail("expected " + child.kind() + " clause at indentation " + indentation.length());
					}
					String gap = text.substring(gapStart, pos);
					match(child, null, indentation);
					clauses.add(new ClauseLine(gap, child));
				}
				pieces.add(new ClausePiece(clauses));
			} else if (element instanceof Suite suite) {
				pieces.add(matchSuite(node, suite.nested(), indentation));
				next = children.size();
			}
		}
		if (next < children.size()) {
			throw fail(node.kind() + " node has more children than its layout accepts");
		}
		return pieces;
	}

	private SuitePiece matchSuite(SyntaxNode node, boolean nested, String indentation) throws MatchException {
		String opening = "";
		if (nested) {
			int openingStart = pos;
			skipInlineSpace();
			if (at("#")) {
				pos = lineEnd(pos);
			}
			if (!consumeLineBreak()) {
				throw fail("expected line break after block header");
			}
			opening = text.substring(openingStart, pos);
		}

		List<SuiteLine> lines = new ArrayList<>();
		String inner = nested ? null : "";
		for (SyntaxNode statement : node.children()) {
			int leadingStart = pos;
			String found = scanLeadingLines();
			if (found == null) {
				throw fail("expected " + statement.kind() + " statement");
			}
			if (inner == null) {
				if (found.length() <= indentation.length() || !found.startsWith(indentation)) {
					throw fail("expected an indented block");
				}
				inner = found;
			} else if (!found.equals(inner)) {
				throw fail("unexpected indentation");
			}
			String leading = text.substring(leadingStart, pos);
			match(statement, null, inner);
			String trailing = statement.kind().isCompound() ? "" : scanStatementEnd();
			lines.add(new SuiteLine(statement, leading, trailing));
		}
		if (inner == null) {
			inner = indentation;
		}

		String trailer;
		if (nested) {
			trailer = scanBlockTrailer(inner);
		} else {
			int trailerStart = pos;
			if (scanLeadingLines() != null) {
				throw fail("unexpected statement");
			}
			trailer = text.substring(trailerStart, pos);
		}
		return new SuitePiece(opening, lines, trailer, inner);
	}

	private ValuePiece matchValue(SyntaxNode node, String gap) throws MatchException {
		String value = node.value();
		if (value == null) {
			throw fail(node.kind() + " node has no value");
		}
		if (node.kind() == NodeKind.STRING) {
			return matchString(value, gap);
		}
		int valueStart = pos;
		if (node.kind() == NodeKind.COMPARATOR && value.indexOf(' ') > 0) {
			String[] words = value.split(" +");
			for (int i = 0; i < words.length; i++) {
				if (i > 0) {
					int before = pos;
					scanGap();
					if (pos == before) {
						throw fail("expected whitespace inside '" + value + "'");
					}
				}
				expect(words[i]);
			}
		} else {
			expect(value);
		}
		return new ValuePiece(gap, "", value, text.substring(valueStart, pos), "");
	}

	private ValuePiece matchString(String value, String gap) throws MatchException {
		int tokenStart = pos;
		int p = pos;
		while (p < text.length() && Character.isLetter(text.charAt(p))) {
			p++;
		}
		if (p >= text.length() || (text.charAt(p) != '"' && text.charAt(p) != '\'')) {
			throw fail("expected string literal");
		}
		String quote = String.valueOf(text.charAt(p));
		if (text.startsWith(quote.repeat(3), p)) {
			quote = quote.repeat(3);
		}
		int contentStart = p + quote.length();
		int i = contentStart;
		while (true) {
			if (i >= text.length()) {
				throw failAt(tokenStart, "unterminated string literal");
			}
			char c = text.charAt(i);
			if (c == '\\') {
				i += 2;
				continue;
			}
			if (text.startsWith(quote, i)) {
				break;
			}
			if (quote.length() == 1 && (c == '\n' || c == '\r')) {
				throw failAt(tokenStart, "unterminated string literal");
			}
			i++;
		}
		if (!text.substring(contentStart, i).equals(value)) {
			throw failAt(tokenStart, "string literal does not match node value");
		}
		pos = i + quote.length();
		return new ValuePiece(gap, text.substring(tokenStart, contentStart), value, text.substring(tokenStart, pos), quote);
	}

	/**
	 * Inline whitespace and line continuations; inside brackets also line breaks and comments.
	 */
	private String scanGap() {
		int start = pos;
		while (pos < text.length()) {
			char c = text.charAt(pos);
			if (c == ' ' || c == '\t' || c == '\f') {
				pos++;
			} else if (c == '\\' && isLineBreakAt(pos + 1)) {
				pos = lineBreakEnd(pos + 1);
			} else if (depth > 0 && (c == '\n' || c == '\r')) {
				pos++;
			} else if (depth > 0 && c == '#') {
				pos = lineEnd(pos);
			} else {
				break;
			}
		}
		return text.substring(start, pos);
	}

	/**
	 * Skips blank and comment-only lines and returns the indentation of the next code line, leaving the
	 * position at its first token. Returns null at end of text.
	 */
	private String scanLeadingLines() {
		while (true) {
			int lineStart = pos;
			int p = pos;
			while (p < text.length() && isInlineSpace(text.charAt(p))) {
				p++;
			}
			if (p >= text.length()) {
				pos = p;
				return null;
			}
			char c = text.charAt(p);
			if (c == '#') {
				pos = lineBreakEnd(lineEnd(p));
			} else if (c == '\n' || c == '\r') {
				pos = lineBreakEnd(p);
			} else {
				pos = p;
				return text.substring(lineStart, p);
			}
		}
	}

	private String scanStatementEnd() throws MatchException {
		int start = pos;
		skipInlineSpace();
		if (at("#")) {
			pos = lineEnd(pos);
		}
		if (!consumeLineBreak() && pos < text.length()) {
			throw fail("expected end of statement");
		}
		return text.substring(start, pos);
	}

	/**
	 * Comment lines indented at least as deep as the block, with the blank lines between them.
	 */
	private String scanBlockTrailer(String inner) {
		int start = pos;
		int end = pos;
		int p = pos;
		while (p < text.length()) {
			int q = p;
			while (q < text.length() && isInlineSpace(text.charAt(q))) {
				q++;
			}
			if (q >= text.length()) {
				break;
			}
			char c = text.charAt(q);
			if (c == '\n' || c == '\r') {
				p = lineBreakEnd(q);
			} else if (c == '#' && q - p >= inner.length()) {
				p = lineBreakEnd(lineEnd(q));
				end = p;
			} else {
				break;
			}
		}
		pos = end;
		return text.substring(start, end);
	}

	private void expect(String expected) throws MatchException {
		if (expected.isEmpty()) {
			return;
		}
		if (!text.startsWith(expected, pos)) {
			throw fail("expected '" + expected + "'");
		}
		int end = pos + expected.length();
		if (isWordChar(expected.charAt(expected.length() - 1)) && end < text.length() && isWordChar(text.charAt(end))) {
			throw fail("expected '" + expected + "' to end a word");
		}
		pos = end;
	}

	private boolean at(String expected) {
		return text.startsWith(expected, pos);
	}

	private void skipInlineSpace() {
		while (pos < text.length() && isInlineSpace(text.charAt(pos))) {
			pos++;
		}
	}

	private boolean consumeLineBreak() {
		if (isLineBreakAt(pos)) {
			pos = lineBreakEnd(pos);
			return true;
		}
		return false;
	}

	private boolean isLineBreakAt(int offset) {
		return offset < text.length() && (text.charAt(offset) == '\n' || text.charAt(offset) == '\r');
	}

	private int lineEnd(int offset) {
		int i = offset;
		while (i < text.length() && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
			i++;
		}
		return i;
	}

	private int lineBreakEnd(int offset) {
		if (offset >= text.length()) {
			return text.length();
		}
		if (text.charAt(offset) == '\r' && offset + 1 < text.length() && text.charAt(offset + 1) == '\n') {
			return offset + 2;
		}
		return offset + 1;
	}

	private static boolean startsWithComment(String gap) {
		int i = 0;
		while (i < gap.length() && isInlineSpace(gap.charAt(i))) {
			i++;
		}
		return i < gap.length() && gap.charAt(i) == '#';
	}

	private static boolean isInlineSpace(char c) {
		return c == ' ' || c == '\t' || c == '\f';
	}

	private static boolean isWordChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private MatchException fail(String message) {
		return failAt(pos, message);
	}

	private MatchException failAt(int offset, String message) {
		String full = message + " at " + source.describe(offset);
		log.debug("Match failed: {}", full);
		return new MatchException(full, offset);
	}
}
