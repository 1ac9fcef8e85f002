package verbatim;

import org.junit.jupiter.api.Test;
import verbatim.ast.SyntaxNode;
import verbatim.match.MatcherTree;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static verbatim.create.NodeFactory.*;

public class GoldenRoundTripTest {
	@Test
	void reproducesSampleExactly() throws Exception {
		String source = read("sample.py");

		assertEquals(source, SourceEditor.open(source).getSource());
	}

	@Test
	void reproducesTabIndentedSource() throws Exception {
		String source = read("tabs.py");

		assertEquals(source, SourceEditor.open(source).getSource());
	}

	@Test
	void topLevelStatementsRenderTheirRecordedSpans() throws Exception {
		String source = read("sample.py");
		SourceEditor editor = SourceEditor.open(source);
		MatcherTree matchers = editor.reconstructor().matchers();

		for (SyntaxNode statement : editor.root().children()) {
			var span = matchers.spanOf(statement);
			assertEquals(source.substring(span.startOffset(), span.endOffset()), editor.getSource(statement));
		}
	}

	@Test
	void appliesEditsToGoldenInput() throws Exception {
		SourceEditor editor = SourceEditor.open(read("edit_input.py"));
		SyntaxNode module = editor.root();

		module.removeAt(0);
		SyntaxNode def = module.child(1);
		def.setValue("rectangle_area");
		def.child(1).insert(0, assertStmt(compare(name("width"), ">", number(0)), null));
		SyntaxNode printCall = module.child(2).child(0);
		printCall.child(1).child(0).child(0).setValue("rectangle_area");
		module.add(exprStmt(call(name("print"), string("done"))));

		assertEquals(normalize(read("edit_expected.py")), normalize(editor.getSource()));
	}

	private static String read(String name) throws Exception {
		return Files.readString(Path.of("src", "test", "resources", "golden", name));
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
