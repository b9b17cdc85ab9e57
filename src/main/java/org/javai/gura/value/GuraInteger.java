package org.javai.gura.value;

import java.math.BigInteger;

/**
 * A signed 64-bit integer.
 */
public record GuraInteger(long value) implements GuraValue {

	@Override
	public <R> R accept(GuraValueVisitor<R> visitor) {
		return visitor.visitInteger(value);
	}

	@Override
	public String typeName() {
		return "integer";
	}

	@Override
	public long asLong() {
		return value;
	}

	@Override
	public BigInteger asBigInteger() {
		return BigInteger.valueOf(value);
	}
}
