package org.javai.gura.parse;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into user-perceived characters (grapheme clusters).
 *
 * <p>Clusters are those of {@link BreakIterator#getCharacterInstance()}, which
 * joins combining marks but not emoji ZWJ sequences or regional-indicator
 * pairs.</p>
 */
public final class Graphemes {

	private Graphemes() {
		// Utility class - no instantiation
	}

	/**
	 * Splits {@code text} into grapheme clusters. A carriage return followed
	 * by a line feed is always a single cluster.
	 */
	public static List<String> split(String text) {
		List<String> result = new ArrayList<>(text.length());
		BreakIterator iterator = BreakIterator.getCharacterInstance();
		iterator.setText(text);
		int start = iterator.first();
		for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
			String cluster = text.substring(start, end);
			int last = result.size() - 1;
			if ("\n".equals(cluster) && last >= 0 && "\r".equals(result.get(last))) {
				result.set(last, "\r\n");
			} else {
				result.add(cluster);
			}
		}
		return result;
	}

	/**
	 * Concatenates the clusters in {@code [from, to)}.
	 */
	public static String join(List<String> graphemes, int from, int to) {
		StringBuilder sb = new StringBuilder();
		for (int i = from; i < to; i++) {
			sb.append(graphemes.get(i));
		}
		return sb.toString();
	}
}
