package org.javai.gura.parse;

import java.math.BigInteger;
import java.util.regex.Pattern;
import org.javai.gura.value.GuraBigInteger;
import org.javai.gura.value.GuraFloat;
import org.javai.gura.value.GuraInteger;
import org.javai.gura.value.GuraValue;

/**
 * Converts the text of a number literal into a value.
 */
final class NumberLiteral {

	/** Everything a number literal may contain, {@code inf} and {@code nan} included. */
	static final String CHARS = "0-9A-Fa-fxobinEe+._-";

	private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
	private static final Pattern FLOAT = Pattern.compile("[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?");

	private NumberLiteral() {
	}

	/**
	 * Returns the value of {@code literal}, or {@code null} if it is not a valid number.
	 */
	static GuraValue parse(String literal) {
		String text = literal.replace("_", "");
		if (text.startsWith("0x") || text.startsWith("0o") || text.startsWith("0b")) {
			return radixInteger(text.substring(2), radixOf(text.charAt(1)));
		}
		// Whatever precedes a trailing inf or nan only contributes its sign
		if (text.endsWith("nan")) {
			return new GuraFloat(Double.NaN);
		}
		if (text.endsWith("inf")) {
			return new GuraFloat(text.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
		}
		if (isFloat(text)) {
			return FLOAT.matcher(text).matches() ? new GuraFloat(Double.parseDouble(text)) : null;
		}
		if (!INTEGER.matcher(text).matches()) {
			return null;
		}
		return integer(new BigInteger(text));
	}

	private static boolean isFloat(String text) {
		return text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0;
	}

	private static int radixOf(char marker) {
		return switch (marker) {
			case 'x' -> 16;
			case 'o' -> 8;
			default -> 2;
		};
	}

	private static GuraValue radixInteger(String digits, int radix) {
		if (digits.isEmpty() || digits.startsWith("+") || digits.startsWith("-")) {
			return null;
		}
		try {
			return integer(new BigInteger(digits, radix));
		} catch (NumberFormatException e) {
			return null;
		}
	}

	private static GuraValue integer(BigInteger value) {
		if (value.bitLength() < Long.SIZE) {
			return new GuraInteger(value.longValue());
		}
		return GuraBigInteger.fits(value) ? new GuraBigInteger(value) : null;
	}
}
