package org.javai.gura.dump;

/**
 * Formats floats so that they read back as the same float.
 */
public final class PrettyFloat {

	private PrettyFloat() {
		// Utility class - no instantiation
	}

	/**
	 * Returns {@code nan}, {@code inf}, {@code -inf}, or the shortest decimal
	 * text that still contains a point or an exponent, e.g. {@code 1.5},
	 * {@code 1e22}, {@code 2.5e-7}.
	 */
	public static String format(double value) {
		if (Double.isNaN(value)) {
			return "nan";
		}
		if (Double.isInfinite(value)) {
			return value > 0 ? "inf" : "-inf";
		}
		String plain = Double.toString(value);
		String pretty = prettify(plain);
		return readsBack(pretty, value) ? pretty : plain;
	}

	private static String prettify(String plain) {
		int exponent = plain.indexOf('E');
		if (exponent < 0) {
			return plain;
		}
		String mantissa = plain.substring(0, exponent);
		if (mantissa.endsWith(".0")) {
			mantissa = mantissa.substring(0, mantissa.length() - 2);
		}
		return mantissa + "e" + plain.substring(exponent + 1);
	}

	private static boolean readsBack(String text, double value) {
		try {
			return Double.doubleToLongBits(Double.parseDouble(text)) == Double.doubleToLongBits(value);
		} catch (NumberFormatException e) {
			return false;
		}
	}
}
