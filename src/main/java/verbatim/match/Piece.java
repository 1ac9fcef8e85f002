package verbatim.match;

import verbatim.ast.SyntaxNode;

import java.util.List;

/**
 * Text recorded for one layout element of an indexed node. Gaps are stored exactly as found.
 */
sealed interface Piece {

	record LiteralPiece(String gap, String text) implements Piece {
	}

	/**
	 * A node value as written. {@code prefix} and {@code suffix} are the quoting around string values
	 * and empty otherwise.
	 */
	record ValuePiece(String gap, String prefix, String value, String text, String suffix) implements Piece {
		String render(String current) {
			if (value.equals(current)) {
				return text;
			}
			return prefix + current + suffix;
		}
	}

	record SlotPiece(String gap, SyntaxNode child) implements Piece {
	}

	/**
	 * Recorded optional child; {@code child} is null when the slot was empty.
	 */
	record OptionalPiece(String prefixGap, String gap, SyntaxNode child) implements Piece {
	}

	/**
	 * @param firstGap gap in front of the first item, null when the list was empty
	 */
	record ListPiece(String firstGap, List<ListItem> items) implements Piece {
		public ListPiece {
			items = List.copyOf(items);
		}
	}

	/**
	 * A list item and the text around it.
	 *
	 * @param lead  for the first item the gap in front of it, otherwise the gap and separator leading into it
	 * @param after gap between the separator and the item, empty when the previous item's tail took it
	 * @param tail  gap after the following separator when it starts with a comment, which then ends this
	 *              item's line; empty otherwise
	 */
	record ListItem(SyntaxNode node, String lead, String after, String tail) {
	}

	record CloserPiece(String beforeComma, boolean comma, String afterComma) implements Piece {
	}

	record CommaPiece(String text) implements Piece {
	}

	/**
	 * Clauses recorded for one clause element, each with the blank and comment lines and indentation
	 * in front of it.
	 */
	record ClausePiece(List<ClauseLine> clauses) implements Piece {
		public ClausePiece {
			clauses = List.copyOf(clauses);
		}

		/**
		 * Recorded gap in front of {@code clause}, or null when it was not recorded here.
		 */
		String gapOf(SyntaxNode clause) {
			for (ClauseLine line : clauses) {
				if (line.node() == clause) {
					return line.gap();
				}
			}
			return null;
		}
	}

	record ClauseLine(String gap, SyntaxNode node) {
	}

	/**
	 * @param opening     text after a block header up to and including its line break
	 * @param trailer     comment and blank lines after the last statement owned by this suite
	 * @param indentation indentation of the suite's statements
	 */
	record SuitePiece(String opening, List<SuiteLine> lines, String trailer, String indentation) implements Piece {
		public SuitePiece {
			lines = List.copyOf(lines);
		}
	}

	/**
	 * A statement with its leading blank/comment lines and indentation, and the rest of its last line.
	 */
	record SuiteLine(SyntaxNode node, String leading, String trailing) {
	}
}
