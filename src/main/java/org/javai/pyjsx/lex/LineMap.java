package org.javai.pyjsx.lex;

import java.util.ArrayList;
import java.util.List;
import org.javai.pyjsx.SourcePosition;

/**
 * Maps character offsets of a source unit to line and column numbers.
 */
public final class LineMap {

	private final int[] lineStarts;

	public LineMap(String source) {
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < source.length(); i++) {
			char c = source.charAt(i);
			if (c == '\n') {
				starts.add(i + 1);
			} else if (c == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n')) {
				starts.add(i + 1);
			}
		}
		this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
	}

	public SourcePosition positionOf(int offset) {
		int low = 0;
		int high = lineStarts.length - 1;
		while (low < high) {
			int mid = (low + high + 1) >>> 1;
			if (lineStarts[mid] <= offset) {
				low = mid;
			} else {
				high = mid - 1;
			}
		}
		return new SourcePosition(offset, low + 1, offset - lineStarts[low] + 1);
	}

	public int lineCount() {
		return lineStarts.length;
	}
}
