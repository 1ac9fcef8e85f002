package verbatim.config;

import org.junit.jupiter.api.Test;

import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FormatConfigTest {
	@Test
	void defaultsMatchCommonStyle() {
		FormatConfig config = FormatConfig.defaults();

		assertEquals("    ", config.getIndentUnit());
		assertEquals("\"", config.getQuote());
		assertEquals("\n", config.getNewline());
		assertEquals(2, config.getTopLevelDefinitionBlankLines());
		assertEquals(1, config.getNestedDefinitionBlankLines());
	}

	@Test
	void readsPropertiesFile() throws Exception {
		Properties properties = new Properties();
		try (Reader reader = Files.newBufferedReader(Path.of("src", "test", "resources", "format.properties"))) {
			properties.load(reader);
		}

		FormatConfig config = FormatConfig.fromProperties(properties);

		assertEquals("  ", config.getIndentUnit());
		assertEquals("'", config.getQuote());
		assertEquals("\r\n", config.getNewline());
		assertEquals(1, config.getTopLevelDefinitionBlankLines());
		assertEquals(0, config.getNestedDefinitionBlankLines());
	}

	@Test
	void tabsWinOverWidth() {
		Properties properties = new Properties();
		properties.setProperty("indent.tabs", "true");
		properties.setProperty("indent.width", "8");

		assertEquals("\t", FormatConfig.fromProperties(properties).getIndentUnit());
	}

	@Test
	void rejectsBadValues() {
		Properties badQuote = new Properties();
		badQuote.setProperty("quote", "backtick");
		Properties badWidth = new Properties();
		badWidth.setProperty("indent.width", "four");
		Properties negative = new Properties();
		negative.setProperty("blankLines.nested", "-1");

		assertThrows(IllegalArgumentException.class, () -> FormatConfig.fromProperties(badQuote));
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
				() -> FormatConfig.fromProperties(badWidth));
		assertEquals(NumberFormatException.class, e.getCause().getClass());
		assertThrows(IllegalArgumentException.class, () -> FormatConfig.fromProperties(negative));
	}
}
