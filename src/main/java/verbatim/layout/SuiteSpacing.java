package verbatim.layout;

import verbatim.ast.NodeKind;
import verbatim.ast.SyntaxNode;
import verbatim.config.FormatConfig;

/**
 * Default separators around statements that have no recorded leading or trailing text.
 */
public final class SuiteSpacing {
	private SuiteSpacing() {
	}

	/**
	 * Blank lines plus indentation in front of a statement. Definitions, and statements directly after
	 * one, are set off by the configured number of blank lines unless they open the suite.
	 */
	public static String leading(FormatConfig config, boolean nested, Position at, SyntaxNode statement) {
		NodeKind previous = at.predecessorKind();
		int blankLines = 0;
		if (previous != null && (statement.kind().isDefinition() || previous.isDefinition())) {
			blankLines = nested ? config.getNestedDefinitionBlankLines() : config.getTopLevelDefinitionBlankLines();
		}
		return config.getNewline().repeat(blankLines) + at.indentation();
	}

	public static String trailing(FormatConfig config, SyntaxNode statement) {
		return statement.kind().isCompound() ? "" : config.getNewline();
	}

	/**
	 * Line break needed before a new line can be started after {@code text}.
	 */
	public static String lineBreak(FormatConfig config, CharSequence text) {
		if (text.length() == 0 || text.charAt(text.length() - 1) == '\n') {
			return "";
		}
		return config.getNewline();
	}
}
