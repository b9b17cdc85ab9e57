package org.javai.gura.parse;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.javai.gura.ErrorKind;
import org.javai.gura.GuraParseException;
import org.javai.gura.dump.PrettyFloat;
import org.javai.gura.value.GuraFloat;
import org.javai.gura.value.GuraInteger;
import org.javai.gura.value.GuraString;
import org.javai.gura.value.GuraValue;

/**
 * Document-scoped variables defined with {@code $name: value}.
 *
 * <p>Variables are write-once. Lookups that miss the table fall back to the
 * environment, whose values are always strings.</p>
 */
public final class VariableTable {

	private final Map<String, GuraValue> values = new HashMap<>();
	private final Function<String, String> environment;

	public VariableTable(Function<String, String> environment) {
		this.environment = Objects.requireNonNull(environment, "environment");
	}

	/**
	 * Creates an empty table that falls back to the same environment.
	 */
	public VariableTable fresh() {
		return new VariableTable(environment);
	}

	/**
	 * Stores a variable.
	 *
	 * @param position where the definition starts, for error reporting
	 * @param line line of the definition, for error reporting
	 * @throws GuraParseException {@link ErrorKind#DUPLICATED_VARIABLE} if the name
	 * is already defined
	 * @throws IllegalArgumentException if the table {@linkplain #canHold cannot hold} the value
	 */
	public void define(String name, GuraValue value, int position, int line) {
		if (!canHold(value)) {
			throw new IllegalArgumentException("Variable '" + name + "' cannot hold a " + value.typeName());
		}
		if (values.containsKey(name)) {
			throw new GuraParseException(ErrorKind.DUPLICATED_VARIABLE,
					"Variable '" + name + "' has been already declared", position, line);
		}
		values.put(name, value);
	}

	/**
	 * Whether {@code value} may be stored: strings, 64-bit integers and floats.
	 */
	public static boolean canHold(GuraValue value) {
		return value instanceof GuraString || value instanceof GuraInteger || value instanceof GuraFloat;
	}

	public boolean isDefined(String name) {
		return values.containsKey(name);
	}

	/**
	 * Returns the typed value of a variable, or its environment value as a string.
	 *
	 * @throws GuraParseException {@link ErrorKind#VARIABLE_NOT_DEFINED} if neither exists
	 */
	public GuraValue resolve(String name, int position, int line) {
		GuraValue value = values.get(name);
		if (value != null) {
			return value;
		}
		String fromEnvironment = name.isEmpty() ? null : environment.apply(name);
		if (fromEnvironment != null) {
			return new GuraString(fromEnvironment);
		}
		throw new GuraParseException(ErrorKind.VARIABLE_NOT_DEFINED,
				"Variable '" + name + "' is not defined in Gura nor as environment variable", position, line);
	}

	/**
	 * Resolves a variable as text to be embedded in a string.
	 */
	public String resolveAsText(String name, int position, int line) {
		GuraValue value = resolve(name, position, line);
		if (value instanceof GuraInteger integer) {
			return Long.toString(integer.value());
		}
		if (value instanceof GuraFloat number) {
			double raw = number.value();
			if (!Double.isFinite(raw)) {
				return PrettyFloat.format(raw);
			}
			return BigDecimal.valueOf(raw).stripTrailingZeros().toPlainString();
		}
		return value.asString();
	}

	public int size() {
		return values.size();
	}
}
