package verbatim.match;

import verbatim.ast.SyntaxNode;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides which current children still sit where they were recorded: the longest run of children
 * whose recorded positions are increasing. Ties go to the earliest current positions.
 */
final class SlotAlignment {
	private SlotAlignment() {
	}

	/**
	 * @param recorded children in recorded order
	 * @param current  children in current order
	 * @return for each current child, its recorded index, or -1 when it is new
	 */
	static int[] recordedIndices(List<SyntaxNode> recorded, List<SyntaxNode> current) {
		Map<SyntaxNode, Integer> positions = new IdentityHashMap<>();
		for (int i = 0; i < recorded.size(); i++) {
			positions.putIfAbsent(recorded.get(i), i);
		}
		int[] indices = new int[current.size()];
		for (int j = 0; j < current.size(); j++) {
			Integer index = positions.get(current.get(j));
			indices[j] = index == null ? -1 : index;
		}
		return indices;
	}

	/**
	 * Flags the children kept in place, given {@link #recordedIndices}.
	 */
	static boolean[] kept(int[] indices) {
		int n = indices.length;
		int[] length = new int[n];
		int[] previous = new int[n];
		int best = -1;
		for (int j = 0; j < n; j++) {
			previous[j] = -1;
			if (indices[j] < 0) {
				continue;
			}
			length[j] = 1;
			for (int i = 0; i < j; i++) {
				if (indices[i] >= 0 && indices[i] < indices[j] && length[i] + 1 > length[j]) {
					length[j] = length[i] + 1;
					previous[j] = i;
				}
			}
			if (best < 0 || length[j] > length[best]) {
				best = j;
			}
		}
		boolean[] kept = new boolean[n];
		for (int j = best; j >= 0; j = previous[j]) {
			kept[j] = true;
		}
		return kept;
	}
}
