package org.javai.gura.parse;

/**
 * A grammar rule: consumes input from the cursor and produces a result, or
 * throws a {@link org.javai.gura.GuraParseException} when the input does not match.
 *
 * @param <T> the type of what the rule produces
 */
@FunctionalInterface
public interface Rule<T> {

	T apply(GuraCursor cursor);
}
