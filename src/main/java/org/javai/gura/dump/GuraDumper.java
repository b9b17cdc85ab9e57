package org.javai.gura.dump;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.javai.gura.value.GuraObject;
import org.javai.gura.value.GuraValue;
import org.javai.gura.value.GuraValueVisitor;

/**
 * Writes a value tree as Gura text.
 *
 * <p>Nested objects are indented by four spaces. Arrays are written on one
 * line unless one of their elements is a non-empty object, in which case each
 * element goes on its own indented line.</p>
 */
public class GuraDumper implements GuraValueVisitor<String> {

	static final String INDENT = "    ";

	/**
	 * Returns the Gura text for {@code value}, without surrounding blank space.
	 * An empty top-level object is the empty document.
	 */
	public static String dump(GuraValue value) {
		if (value instanceof GuraObject object && object.isEmpty()) {
			return "";
		}
		return value.accept(new GuraDumper()).strip();
	}

	@Override
	public String visitNull() {
		return "null";
	}

	@Override
	public String visitBool(boolean value) {
		return Boolean.toString(value);
	}

	@Override
	public String visitInteger(long value) {
		return Long.toString(value);
	}

	@Override
	public String visitBigInteger(BigInteger value) {
		return value.toString();
	}

	@Override
	public String visitFloat(double value) {
		return PrettyFloat.format(value);
	}

	@Override
	public String visitString(String value) {
		StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
		value.chars().forEach(c -> {
			switch (c) {
				case '\b' -> sb.append("\\b");
				case '\f' -> sb.append("\\f");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '$' -> sb.append("\\$");
				default -> sb.append((char) c);
			}
		});
		return sb.append('"').toString();
	}

	@Override
	public String visitObject(Map<String, GuraValue> members) {
		if (members.isEmpty()) {
			return "empty";
		}
		StringBuilder sb = new StringBuilder();
		members.forEach((key, value) -> {
			sb.append(key).append(':');
			if (isNonEmptyObject(value)) {
				sb.append('\n');
				for (String line : lines(value.accept(this))) {
					sb.append(INDENT).append(line).append('\n');
				}
			} else {
				sb.append(' ').append(value.accept(this)).append('\n');
			}
		});
		return sb.toString();
	}

	@Override
	public String visitArray(List<GuraValue> elements) {
		boolean multiline = elements.stream().anyMatch(GuraDumper::isNonEmptyObject);
		if (!multiline) {
			StringBuilder sb = new StringBuilder("[");
			for (int i = 0; i < elements.size(); i++) {
				if (i > 0) {
					sb.append(", ");
				}
				sb.append(elements.get(i).accept(this));
			}
			return sb.append(']').toString();
		}

		StringBuilder sb = new StringBuilder("[");
		for (int i = 0; i < elements.size(); i++) {
			sb.append('\n').append(String.join("\n", indented(lines(elements.get(i).accept(this)))));
			if (i < elements.size() - 1) {
				sb.append(',');
			}
		}
		return sb.append("\n]").toString();
	}

	private static boolean isNonEmptyObject(GuraValue value) {
		return value instanceof GuraObject object && !object.isEmpty();
	}

	private static String[] lines(String dumped) {
		return dumped.stripTrailing().split("\n", -1);
	}

	private static String[] indented(String[] lines) {
		String[] result = new String[lines.length];
		for (int i = 0; i < lines.length; i++) {
			result[i] = INDENT + lines[i];
		}
		return result;
	}
}
