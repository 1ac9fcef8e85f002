package verbatim.ast;

import org.junit.jupiter.api.Test;
import verbatim.parse.py.PyParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NodeTreesTest {
	private final SyntaxNode module = new PyParser().parse("def f(a):\n    if a:\n        return a + 1\n");
	private final SyntaxNode def = module.child(0);
	private final SyntaxNode ifStmt = def.child(1).child(0);
	private final SyntaxNode ret = ifStmt.child(1).child(0);
	private final SyntaxNode sum = ret.child(0);

	@Test
	void findsPathFromRoot() {
		List<SyntaxNode> path = NodeTrees.pathTo(module, sum);

		assertEquals(7, path.size());
		assertSame(module, path.get(0));
		assertSame(sum, path.get(path.size() - 1));
		assertTrue(NodeTrees.pathTo(module, new SyntaxNode(NodeKind.PASS)).isEmpty());
	}

	@Test
	void findsParentAndStatement() {
		assertSame(ret, NodeTrees.parentOf(module, sum));
		assertNull(NodeTrees.parentOf(module, module));
		assertSame(ret, NodeTrees.enclosingStatement(module, sum.child(0)));
		assertSame(ifStmt, NodeTrees.enclosingStatement(module, ifStmt.child(0)));
	}

	@Test
	void countsEnclosingBlocks() {
		assertEquals(0, NodeTrees.indentLevel(module, def));
		assertEquals(1, NodeTrees.indentLevel(module, ifStmt));
		assertEquals(2, NodeTrees.indentLevel(module, ret));
		assertEquals(-1, NodeTrees.indentLevel(module, new SyntaxNode(NodeKind.PASS)));
	}

	@Test
	void deepCopySharesNoNodes() {
		SyntaxNode copy = NodeTrees.deepCopy(def);

		assertNotSame(def, copy);
		assertEquals(def.toString(), copy.toString());
		assertNotSame(def.child(0), copy.child(0));
	}
}
