package verbatim.print;

import org.junit.jupiter.api.Test;
import verbatim.ast.NodeKind;
import verbatim.ast.SyntaxNode;
import verbatim.config.FormatConfig;
import verbatim.match.MatchException;
import verbatim.parse.py.PyParser;
import verbatim.text.SourceText;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static verbatim.create.NodeFactory.*;

public class ReconstructorTest {
	private static Reconstructor indexed(String source) throws MatchException {
		return Reconstructor.index(new PyParser().parse(source), SourceText.of(source));
	}

	@Test
	void unchangedTreeReproducesSource() throws Exception {
		String source = "import os  # os\n\n\ndef f( a ,b ):\n  return (a+b)\n\n# done\n";

		assertEquals(source, indexed(source).getSource());
	}

	@Test
	void deletedStatementTakesItsCommentAlong() throws Exception {
		Reconstructor r = indexed("x = 1  # c\ny = 2\n");
		r.root().removeAt(0);

		assertEquals("y = 2\n", r.getSource());
	}

	@Test
	void deletedStatementTakesLeadingCommentLines() throws Exception {
		Reconstructor r = indexed("# about x\nx = 1\ny = 2\n");
		r.root().removeAt(0);

		assertEquals("y = 2\n", r.getSource());
	}

	@Test
	void blankLinesStayWithFollowingStatement() throws Exception {
		Reconstructor r = indexed("a\n\nb\n");
		r.root().removeAt(0);

		assertEquals("\nb\n", r.getSource());
	}

	@Test
	void insertedStatementUsesDefaults() throws Exception {
		Reconstructor r = indexed("x = 1\n");
		r.root().add(assign(name("y"), number(2)));

		assertEquals("x = 1\ny = 2\n", r.getSource());
	}

	@Test
	void insertedDefinitionGetsBlankLines() throws Exception {
		Reconstructor r = indexed("x = 1\n");
		r.root().add(functionDef("f", List.of()));

		assertEquals("x = 1\n\n\ndef f():\n    pass\n", r.getSource());
	}

	@Test
	void valueEditKeepsSurroundingText() throws Exception {
		Reconstructor r = indexed("x = 1  # one\ns = r'a'\n");
		r.root().child(0).child(1).setValue("42");
		r.root().child(1).child(1).setValue("b");

		assertEquals("x = 42  # one\ns = r'b'\n", r.getSource());
	}

	@Test
	void reorderedStatementKeepsItsTrailingComment() throws Exception {
		Reconstructor r = indexed("a = 1\nb = 2  # two\nc = 3\n");
		SyntaxNode c = r.root().removeAt(2);
		r.root().insert(0, c);

		assertEquals("c = 3\na = 1\nb = 2  # two\n", r.getSource());
	}

	@Test
	void groupingParenthesesStayWithTheirExpression() throws Exception {
		Reconstructor r = indexed("x = (a + b) * c\n");
		SyntaxNode sum = r.root().child(0).child(1).child(0);

		assertEquals("(a + b)", r.getSource(sum));
	}

	@Test
	void replacedOperandIsParenthesizedWhenNeeded() throws Exception {
		Reconstructor r = indexed("x = a * b  # product\n");
		r.root().child(0).child(1).set(0, binOp(name("c"), "+", name("d")));

		assertEquals("x = (c + d) * b  # product\n", r.getSource());
	}

	@Test
	void kindChangeRendersReplacementFromDefaults() throws Exception {
		Reconstructor r = indexed("x = 1  # c\n");
		r.root().child(0).set(1, string("a"));

		assertEquals("x = \"a\"  # c\n", r.getSource());
	}

	@Test
	void statementMovedIntoBlockIsReindented() throws Exception {
		Reconstructor r = indexed("x = 1\nif a:\n    pass\n");
		SyntaxNode assign = r.root().removeAt(0);
		r.root().child(0).child(1).insert(0, assign);

		assertEquals("if a:\n    x = 1\n    pass\n", r.getSource());
	}

	@Test
	void newStatementFollowsRecordedBlockIndentation() throws Exception {
		Reconstructor r = indexed("def f():\n  x = 1\n");
		r.root().child(0).child(1).add(exprStmt(call(name("g"))));

		assertEquals("def f():\n  x = 1\n  g()\n", r.getSource());
	}

	@Test
	void blockTrailerStaysAtEndOfBlock() throws Exception {
		Reconstructor r = indexed("def f():\n    pass\n    # tail\nx = 1\n");
		r.root().child(0).child(1).add(assign(name("y"), number(2)));

		assertEquals("def f():\n    pass\n    y = 2\n    # tail\nx = 1\n", r.getSource());
	}

	@Test
	void removedElseClauseLeavesNoTrace() throws Exception {
		Reconstructor r = indexed("if a:\n    x = 1\nelse:\n    x = 2\ny = 3\n");
		r.root().child(0).removeAt(2);

		assertEquals("if a:\n    x = 1\ny = 3\n", r.getSource());
	}

	@Test
	void addedElseClauseUsesStatementIndentation() throws Exception {
		Reconstructor r = indexed("if a:\n    pass\nb = 1\n");
		withElse(r.root().child(0), exprStmt(name("c")));

		assertEquals("if a:\n    pass\nelse:\n    c\nb = 1\n", r.getSource());
	}

	@Test
	void listEditsKeepRecordedSeparators() throws Exception {
		Reconstructor r = indexed("xs = [1,  2]\nf(a, b, c)\n");
		r.root().child(0).child(1).add(number(3));
		r.root().child(1).child(0).child(1).removeAt(1);

		assertEquals("xs = [1,  2, 3]\nf(a, c)\n", r.getSource());
	}

	@Test
	void movedExpressionKeepsItsText() throws Exception {
		Reconstructor r = indexed("x = f( a )\ny = b\n");
		SyntaxNode a = r.root().child(0).child(1).child(1).removeAt(0);
		r.root().child(1).set(1, a);

		assertEquals("x = f( )\ny = a\n", r.getSource());
	}

	@Test
	void moduleTrailerSurvivesDeletingEverything() throws Exception {
		Reconstructor r = indexed("x = 1\n# end\n");
		r.root().removeAt(0);

		assertEquals("# end\n", r.getSource());
	}

	@Test
	void generatedLinesUseConfiguredNewline() throws Exception {
		String source = "x = 1\r\ny = 2\r\n";
		FormatConfig config = FormatConfig.defaults();
		config.setNewline("\r\n");
		Reconstructor r = Reconstructor.index(new PyParser().parse(source), SourceText.of(source), config);
		r.root().add(assign(name("z"), number(3)));

		assertEquals("x = 1\r\ny = 2\r\nz = 3\r\n", r.getSource());
	}

	@Test
	void nestedNodeSourceUsesItsIndentation() throws Exception {
		Reconstructor r = indexed("def f():\n    return 1\n");
		SyntaxNode ret = r.root().child(0).child(1).child(0);

		assertEquals("return 1", r.getSource(ret));
		assertEquals("5", r.getSource(number(5)));
	}

	@Test
	void insertedRawStatementCannotBeRendered() throws Exception {
		Reconstructor r = indexed("x = 1\n");
		r.root().add(raw("del x"));

		assertThrows(UnsupportedNodeException.class, r::getSource);
	}

	@Test
	void outputIsStableWhenReindexed() throws Exception {
		Reconstructor r = indexed("def f(a):\n    return a\n");
		r.root().child(0).child(1).insert(0, assign(name("b"), binOp(name("a"), "*", number(2))));
		String edited = r.getSource();

		assertEquals(edited, indexed(edited).getSource());
		assertEquals("def f(a):\n    b = a * 2\n    return a\n", edited);
	}

	@Test
	void repeatedRenderingGivesSameText() throws Exception {
		String source = "x = [1,  2]  # c\nif a:\n    pass\n";
		Reconstructor r = indexed(source);

		assertEquals(source, r.getSource());
		assertEquals(source, r.getSource());

		r.root().child(0).child(1).add(number(3));
		String edited = r.getSource();

		assertEquals("x = [1,  2, 3]  # c\nif a:\n    pass\n", edited);
		assertEquals(edited, r.getSource());
	}

	@Test
	void emptiedBareTupleRendersAsEmptyParentheses() throws Exception {
		Reconstructor r = indexed("x = 1, 2\n");
		SyntaxNode tuple = r.root().child(0).child(1);
		tuple.removeAt(1);
		tuple.removeAt(0);

		assertEquals("x = ()\n", r.getSource());
	}

	@Test
	void commentAfterSeparatorStaysWithItemBeforeIt() throws Exception {
		Reconstructor r = indexed("f(a,  # c\n  b,\n  c)\n");
		r.root().child(0).child(0).child(1).removeAt(1);

		assertEquals("f(a,  # c\n  c)\n", r.getSource());
	}

	@Test
	void itemInsertedAfterCommentedItemFollowsTheComment() throws Exception {
		Reconstructor r = indexed("f(a,  # c\n  b)\n");
		r.root().child(0).child(0).child(1).insert(1, name("x"));

		assertEquals("f(a,  # c\n  x, b)\n", r.getSource());
	}

	@Test
	void addedExceptHandlerKeepsClauseComments() throws Exception {
		Reconstructor r = indexed("try:\n    a()\n# about\nexcept E:\n    pass\nfinally:\n    b()\n");
		r.root().child(0).insert(2, exceptHandler(name("K"), null, pass()));

		assertEquals("try:\n    a()\n# about\nexcept E:\n    pass\nexcept K:\n    pass\nfinally:\n    b()\n",
				r.getSource());
	}

	@Test
	void removedExceptHandlerTakesItsComment() throws Exception {
		Reconstructor r = indexed("try:\n    a()\n# about\nexcept E:\n    pass\nfinally:\n    b()\n");
		r.root().child(0).removeAt(1);

		assertEquals("try:\n    a()\nfinally:\n    b()\n", r.getSource());
	}

	@Test
	void editsInsideLambdaKeepRecordedSpacing() throws Exception {
		Reconstructor r = indexed("f = lambda x:  x if x else 0\n");
		SyntaxNode lambda = r.root().child(0).child(1);
		lambda.insert(1, param("y", null));
		lambda.child(2).set(2, number(1));

		assertEquals("f = lambda x, y:  x if x else 1\n", r.getSource());
	}

	@Test
	void addedComprehensionCondition() throws Exception {
		Reconstructor r = indexed("ys = [y for y in xs if y]\n");
		r.root().child(0).child(1).child(1).add(create(NodeKind.COMP_IF, null, name("ok")));

		assertEquals("ys = [y for y in xs if y if ok]\n", r.getSource());
	}

	@Test
	void removedComparatorShortensChain() throws Exception {
		Reconstructor r = indexed("ok = 0 <= x < 10  # range\n");
		r.root().child(0).child(1).removeAt(2);

		assertEquals("ok = 0 <= x  # range\n", r.getSource());
	}

	@Test
	void sliceBoundCanBeOmitted() throws Exception {
		Reconstructor r = indexed("y = a[1:n]\n");
		r.root().child(0).child(1).child(1).set(1, empty());

		assertEquals("y = a[1:]\n", r.getSource());
	}

	@Test
	void addedWithItem() throws Exception {
		Reconstructor r = indexed("with a as b:\n    pass\n");
		r.root().child(0).insert(1, withItem(name("c"), null));

		assertEquals("with a as b, c:\n    pass\n", r.getSource());
	}
}
