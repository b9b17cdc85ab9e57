package org.javai.gura.value;

/**
 * The {@code null} value.
 */
public record GuraNull() implements GuraValue {

	public static final GuraNull INSTANCE = new GuraNull();

	@Override
	public <R> R accept(GuraValueVisitor<R> visitor) {
		return visitor.visitNull();
	}

	@Override
	public String typeName() {
		return "null";
	}

	@Override
	public boolean isNull() {
		return true;
	}
}
