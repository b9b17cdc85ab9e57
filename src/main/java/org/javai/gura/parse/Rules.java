package org.javai.gura.parse;

import org.javai.gura.GuraParseException;

/**
 * Ordered choice over grammar rules with backtracking.
 */
public final class Rules {

	private Rules() {
		// Utility class - no instantiation
	}

	/**
	 * Tries each rule in order and returns the result of the first one that
	 * matches.
	 *
	 * <p>The cursor is rewound after every alternative that fails with a
	 * recoverable error. When all alternatives fail, the failure that got
	 * furthest into the input is rethrown. Non-recoverable failures abort the
	 * choice immediately.</p>
	 *
	 * @throws GuraParseException if no rule matches
	 */
	@SafeVarargs
	public static <T> T matches(GuraCursor cursor, Rule<? extends T>... rules) {
		if (rules.length == 0) {
			throw new IllegalArgumentException("At least one rule is required");
		}
		GuraParseException furthest = null;
		for (Rule<? extends T> rule : rules) {
			GuraCursor.Mark mark = cursor.mark();
			try {
				return rule.apply(cursor);
			} catch (GuraParseException e) {
				if (!e.kind().isRecoverable()) {
					throw e;
				}
				cursor.rewind(mark);
				if (furthest == null || e.position() > furthest.position()) {
					furthest = e;
				}
			}
		}
		throw furthest;
	}

	/**
	 * Like {@link #matches(GuraCursor, Rule[])} but returns {@code null} instead
	 * of throwing when no rule matches.
	 */
	@SafeVarargs
	public static <T> T maybeMatch(GuraCursor cursor, Rule<? extends T>... rules) {
		try {
			return matches(cursor, rules);
		} catch (GuraParseException e) {
			if (!e.kind().isRecoverable()) {
				throw e;
			}
			return null;
		}
	}
}
