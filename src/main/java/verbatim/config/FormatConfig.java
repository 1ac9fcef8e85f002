package verbatim.config;

import java.util.Properties;

/**
 * Settings used when text has to be generated for nodes without recorded formatting.
 *
 * Recognised property keys: {@code indent.width}, {@code indent.tabs}, {@code quote} (single|double),
 * {@code newline} (lf|crlf), {@code blankLines.topLevel} and {@code blankLines.nested}.
 */
public class FormatConfig {
	private String indentUnit = "    ";
	private String quote = "\"";
	private String newline = "\n";
	private int topLevelDefinitionBlankLines = 2;
	private int nestedDefinitionBlankLines = 1;

	public static FormatConfig defaults() {
		return new FormatConfig();
	}

	public static FormatConfig fromProperties(Properties properties) {
		FormatConfig config = new FormatConfig();
		if (Boolean.parseBoolean(properties.getProperty("indent.tabs", "false"))) {
			config.setIndentUnit("\t");
		} else if (properties.containsKey("indent.width")) {
			config.setIndentUnit(" ".repeat(parseCount(properties, "indent.width")));
		}
		String quote = properties.getProperty("quote");
		if (quote != null) {
			switch (quote.trim()) {
				case "single":
					config.setQuote("'");
					break;
				case "double":
					config.setQuote("\"");
					break;
				default:
					throw new IllegalArgumentException("quote must be single or double: " + quote);
			}
		}
		String newline = properties.getProperty("newline");
		if (newline != null) {
			switch (newline.trim()) {
				case "lf":
					config.setNewline("\n");
					break;
				case "crlf":
					config.setNewline("\r\n");
					break;
				default:
					throw new IllegalArgumentException("newline must be lf or crlf: " + newline);
			}
		}
		if (properties.containsKey("blankLines.topLevel")) {
			config.setTopLevelDefinitionBlankLines(parseCount(properties, "blankLines.topLevel"));
		}
		if (properties.containsKey("blankLines.nested")) {
			config.setNestedDefinitionBlankLines(parseCount(properties, "blankLines.nested"));
		}
		return config;
	}

	private static int parseCount(Properties properties, String key) {
		String raw = properties.getProperty(key).trim();
		int value;
		try {
			value = Integer.parseInt(raw);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(key + " is not a number: " + raw, e);
		}
		if (value < 0) {
			throw new IllegalArgumentException(key + " must not be negative: " + value);
		}
		return value;
	}

	public String getIndentUnit() {
		return indentUnit;
	}

	public void setIndentUnit(String indentUnit) {
		this.indentUnit = indentUnit;
	}

	public String getQuote() {
		return quote;
	}

	public void setQuote(String quote) {
		this.quote = quote;
	}

	public String getNewline() {
		return newline;
	}

	public void setNewline(String newline) {
		this.newline = newline;
	}

	public int getTopLevelDefinitionBlankLines() {
		return topLevelDefinitionBlankLines;
	}

	public void setTopLevelDefinitionBlankLines(int topLevelDefinitionBlankLines) {
		this.topLevelDefinitionBlankLines = topLevelDefinitionBlankLines;
	}

	public int getNestedDefinitionBlankLines() {
		return nestedDefinitionBlankLines;
	}

	public void setNestedDefinitionBlankLines(int nestedDefinitionBlankLines) {
		this.nestedDefinitionBlankLines = nestedDefinitionBlankLines;
	}
}
