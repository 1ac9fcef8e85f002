package verbatim.create;

import org.junit.jupiter.api.Test;
import verbatim.ast.NodeKind;
import verbatim.ast.SyntaxNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static verbatim.create.NodeFactory.*;

public class NodeFactoryTest {
	@Test
	void emptyBlockGetsPass() {
		SyntaxNode block = block();

		assertEquals(1, block.childCount());
		assertEquals(NodeKind.PASS, block.child(0).kind());
	}

	@Test
	void buildsFunctionWithParameters() {
		SyntaxNode def = functionDef("f", List.of("a", "b"), returnStmt(name("a")));

		assertEquals("f", def.value());
		assertEquals(2, def.child(0).childCount());
		assertEquals(NodeKind.BLOCK, def.child(1).kind());
	}

	@Test
	void attachesElseToEndOfChain() {
		SyntaxNode chain = ifStmt(name("a"), pass());
		chain.add(create(NodeKind.ELIF, null, name("b"), block()));

		withElse(chain, breakStmt());

		assertEquals(NodeKind.ELSE, chain.child(2).child(2).kind());
		assertThrows(IllegalArgumentException.class, () -> withElse(chain, pass()));
	}

	@Test
	void validatesValues() {
		assertThrows(IllegalArgumentException.class, () -> create(NodeKind.NAME, null));
		assertThrows(IllegalArgumentException.class, () -> create(NodeKind.NAME, ""));
		assertThrows(IllegalArgumentException.class, () -> create(NodeKind.PASS, "pass"));
		assertEquals("", string("").value());
	}

	@Test
	void validatesOperators() {
		assertThrows(IllegalArgumentException.class, () -> binOp(name("a"), "===", name("b")));
		assertThrows(IllegalArgumentException.class, () -> boolOp(name("a"), "xor", name("b")));
		assertThrows(IllegalArgumentException.class, () -> compare(name("a"), "=<", name("b")));
		assertThrows(IllegalArgumentException.class, () -> unaryOp("!", name("a")));
		assertThrows(IllegalArgumentException.class, () -> augAssign(name("a"), "=", name("b")));
		assertThrows(IllegalArgumentException.class, () -> comparator("=>", name("b")));
		assertEquals("not in", compare(name("a"), "not in", name("b")).child(1).value());
	}

	@Test
	void comparisonChainTakesOnlyComparators() {
		SyntaxNode chain = compareChain(number(0), comparator("<=", name("x")), comparator("<", number(10)));

		assertEquals(3, chain.childCount());
		assertEquals(NodeKind.COMPARATOR, chain.child(2).kind());
		assertThrows(IllegalArgumentException.class, () -> compareChain(name("a")));
		assertThrows(IllegalArgumentException.class, () -> compareChain(name("a"), name("b")));
	}

	@Test
	void buildsTryStatementClausesInOrder() {
		SyntaxNode statement = tryStmt(List.of(pass()), exceptHandler(name("E"), "e", pass()));

		withFinally(statement, pass());
		withElse(statement, breakStmt());

		assertEquals(NodeKind.EXCEPT_HANDLER, statement.child(1).kind());
		assertEquals(NodeKind.ELSE, statement.child(2).kind());
		assertEquals(NodeKind.FINALLY, statement.child(3).kind());
		assertThrows(IllegalArgumentException.class, () -> withElse(statement, pass()));
		assertThrows(IllegalArgumentException.class, () -> withFinally(statement, pass()));
		assertThrows(IllegalArgumentException.class, () -> withElse(tryFinally(List.of(pass()), pass()), pass()));
		assertThrows(IllegalArgumentException.class, () -> tryStmt(List.of(pass())));
	}

	@Test
	void exceptHandlerNameNeedsType() {
		assertThrows(IllegalArgumentException.class, () -> exceptHandler(null, "e", pass()));
		assertEquals(1, exceptHandler(null, null).childCount());
		assertEquals("e", exceptHandler(name("E"), "e").child(1).value());
	}

	@Test
	void sliceFillsOmittedBounds() {
		SyntaxNode stepped = slice(null, null, number(2));

		assertEquals(3, stepped.childCount());
		assertEquals(NodeKind.EMPTY, stepped.child(0).kind());
		assertEquals(NodeKind.EMPTY, stepped.child(1).kind());
		assertEquals(2, slice(number(1), null, null).childCount());
	}

	@Test
	void comprehensionWrapsConditions() {
		SyntaxNode clause = comprehension(name("x"), name("xs"), name("x"), name("y"));

		assertEquals(NodeKind.COMP_IF, clause.child(3).kind());
		assertEquals("y", clause.child(3).child(0).value());
		assertThrows(IllegalArgumentException.class, () -> listComp(name("x")));
		assertThrows(IllegalArgumentException.class, () -> listComp(name("x"), name("y")));
	}

	@Test
	void withStatementTakesItems() {
		SyntaxNode statement = withStmt(List.of(withItem(name("a"), name("b")), withItem(name("c"), null)), pass());

		assertEquals(3, statement.childCount());
		assertEquals(1, statement.child(1).childCount());
		assertThrows(IllegalArgumentException.class, () -> withStmt(List.of(), pass()));
		assertThrows(IllegalArgumentException.class, () -> withStmt(List.of(name("a")), pass()));
		assertThrows(IllegalArgumentException.class, () -> globalStmt());
		assertThrows(IllegalArgumentException.class, () -> deleteStmt());
	}

	@Test
	void dictAcceptsOnlyEntries() {
		assertThrows(IllegalArgumentException.class, () -> dict(name("a")));
		assertEquals(1, dict(entry(string("k"), number(1))).childCount());
	}

	@Test
	void buildsImports() {
		SyntaxNode from = importFrom("os.path", "join", "exists");

		assertEquals("os.path", from.value());
		assertEquals("exists", from.child(1).value());
		assertEquals("np", alias("numpy", "np").child(0).value());
	}
}
