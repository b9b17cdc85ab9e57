package org.javai.gura.value;

import java.math.BigInteger;
import java.util.List;

/**
 * A node of a parsed Gura document.
 *
 * <p>Every parsed document is a {@link GuraObject}; its members are any of the
 * implementations below. Containers are immutable once built.</p>
 *
 * <p>The typed accessors throw {@link IllegalStateException} when the value
 * is of a different kind, which keeps call sites free of casts:</p>
 *
 * <pre>{@code
 * GuraObject config = Gura.parse(text);
 * long port = config.get("port").asLong();
 * }</pre>
 */
public sealed interface GuraValue
		permits GuraNull, GuraBool, GuraInteger, GuraBigInteger, GuraFloat, GuraString, GuraArray, GuraObject {

	/**
	 * Dispatches to the visitor method matching this value's kind.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	<R> R accept(GuraValueVisitor<R> visitor);

	/**
	 * Short lowercase name of this kind of value, used in error messages.
	 */
	String typeName();

	default boolean isNull() {
		return false;
	}

	default boolean asBoolean() {
		throw typeMismatch("bool");
	}

	default long asLong() {
		throw typeMismatch("integer");
	}

	default BigInteger asBigInteger() {
		throw typeMismatch("integer");
	}

	default double asDouble() {
		throw typeMismatch("float");
	}

	default String asString() {
		throw typeMismatch("string");
	}

	default List<GuraValue> asList() {
		throw typeMismatch("array");
	}

	default GuraObject asObject() {
		throw typeMismatch("object");
	}

	private IllegalStateException typeMismatch(String expected) {
		return new IllegalStateException("Expected " + expected + " but value is " + typeName());
	}
}
