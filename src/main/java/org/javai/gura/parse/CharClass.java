package org.javai.gura.parse;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A set of accepted grapheme clusters described by a spec string such as
 * {@code "0-9A-Za-z_"}.
 *
 * <p>{@code x-y} denotes an inclusive code point range. A literal {@code -}
 * must come last, otherwise it is read as a range separator. Ranges only
 * match clusters made of a single code point.</p>
 */
public final class CharClass {

	private final String spec;
	private final Set<String> singles;
	private final List<Range> ranges;

	private CharClass(String spec, Set<String> singles, List<Range> ranges) {
		this.spec = spec;
		this.singles = singles;
		this.ranges = ranges;
	}

	/**
	 * Expands a spec string.
	 *
	 * @throws IllegalArgumentException if a range is empty or descending, or its
	 * bounds are not single code points
	 */
	public static CharClass parse(String spec) {
		List<String> graphemes = Graphemes.split(spec);
		Set<String> singles = new HashSet<>();
		List<Range> ranges = new ArrayList<>();
		int index = 0;
		while (index < graphemes.size()) {
			if (index + 2 < graphemes.size() && "-".equals(graphemes.get(index + 1))) {
				ranges.add(Range.of(graphemes.get(index), graphemes.get(index + 2), spec));
				index += 3;
			} else {
				singles.add(graphemes.get(index));
				index++;
			}
		}
		return new CharClass(spec, Set.copyOf(singles), List.copyOf(ranges));
	}

	public boolean contains(String grapheme) {
		if (singles.contains(grapheme)) {
			return true;
		}
		if (grapheme.codePointCount(0, grapheme.length()) != 1) {
			return false;
		}
		int codePoint = grapheme.codePointAt(0);
		for (Range range : ranges) {
			if (range.contains(codePoint)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		return "[" + spec + "]";
	}

	private record Range(int low, int high) {

		static Range of(String low, String high, String spec) {
			if (low.codePointCount(0, low.length()) != 1 || high.codePointCount(0, high.length()) != 1) {
				throw new IllegalArgumentException("Range bounds must be single characters in [" + spec + "]");
			}
			int lowCodePoint = low.codePointAt(0);
			int highCodePoint = high.codePointAt(0);
			if (lowCodePoint >= highCodePoint) {
				throw new IllegalArgumentException("Invalid range " + low + "-" + high + " in [" + spec + "]");
			}
			return new Range(lowCodePoint, highCodePoint);
		}

		boolean contains(int codePoint) {
			return low <= codePoint && codePoint <= high;
		}
	}
}
