package org.javai.gura.value;

public record GuraBool(boolean value) implements GuraValue {

	public static final GuraBool TRUE = new GuraBool(true);
	public static final GuraBool FALSE = new GuraBool(false);

	public static GuraBool of(boolean value) {
		return value ? TRUE : FALSE;
	}

	@Override
	public <R> R accept(GuraValueVisitor<R> visitor) {
		return visitor.visitBool(value);
	}

	@Override
	public String typeName() {
		return "bool";
	}

	@Override
	public boolean asBoolean() {
		return value;
	}
}
