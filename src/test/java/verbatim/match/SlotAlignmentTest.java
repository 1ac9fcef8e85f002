package verbatim.match;

import org.junit.jupiter.api.Test;
import verbatim.ast.NodeKind;
import verbatim.ast.SyntaxNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;

public class SlotAlignmentTest {
	private final SyntaxNode a = new SyntaxNode(NodeKind.NAME, "a");
	private final SyntaxNode b = new SyntaxNode(NodeKind.NAME, "b");
	private final SyntaxNode c = new SyntaxNode(NodeKind.NAME, "c");
	private final SyntaxNode fresh = new SyntaxNode(NodeKind.NAME, "a");

	@Test
	void matchesByIdentity() {
		int[] indices = SlotAlignment.recordedIndices(List.of(a, b, c), List.of(c, fresh, a));

		assertArrayEquals(new int[] {2, -1, 0}, indices);
	}

	@Test
	void keepsLongestIncreasingRun() {
		assertArrayEquals(new boolean[] {false, true, true}, SlotAlignment.kept(new int[] {2, 0, 1}));
		assertArrayEquals(new boolean[] {true, false, true}, SlotAlignment.kept(new int[] {0, -1, 2}));
	}

	@Test
	void prefersEarliestOnTies() {
		assertArrayEquals(new boolean[] {true, false}, SlotAlignment.kept(new int[] {1, 0}));
	}

	@Test
	void handlesEmptyAndAllNew() {
		assertArrayEquals(new boolean[0], SlotAlignment.kept(new int[0]));
		assertArrayEquals(new boolean[] {false, false}, SlotAlignment.kept(new int[] {-1, -1}));
	}
}
