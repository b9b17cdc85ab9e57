package org.javai.gura.value;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An integer literal that does not fit in 64 bits but fits in a signed 128-bit integer.
 */
public record GuraBigInteger(BigInteger value) implements GuraValue {

	/** Largest bit length (sign excluded) of a signed 128-bit integer. */
	public static final int MAX_BIT_LENGTH = 127;

	public GuraBigInteger {
		Objects.requireNonNull(value, "value");
		if (value.bitLength() > MAX_BIT_LENGTH) {
			throw new IllegalArgumentException("Integer " + value + " does not fit in 128 bits");
		}
	}

	/**
	 * Returns whether {@code value} can be held by this type.
	 */
	public static boolean fits(BigInteger value) {
		return value.bitLength() <= MAX_BIT_LENGTH;
	}

	@Override
	public <R> R accept(GuraValueVisitor<R> visitor) {
		return visitor.visitBigInteger(value);
	}

	@Override
	public String typeName() {
		return "integer";
	}

	@Override
	public long asLong() {
		return value.longValueExact();
	}

	@Override
	public BigInteger asBigInteger() {
		return value;
	}
}
