package org.javai.gura.value;

import java.util.Objects;

public record GuraString(String value) implements GuraValue {

	public GuraString {
		Objects.requireNonNull(value, "value");
	}

	@Override
	public <R> R accept(GuraValueVisitor<R> visitor) {
		return visitor.visitString(value);
	}

	@Override
	public String typeName() {
		return "string";
	}

	@Override
	public String asString() {
		return value;
	}
}
