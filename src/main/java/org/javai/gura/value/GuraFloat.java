package org.javai.gura.value;

/**
 * A 64-bit float, including {@code nan}, {@code inf} and {@code -inf}.
 *
 * <p>Record equality compares the component with {@link Double#compare}, so
 * {@code nan} equals {@code nan} and {@code 0.0} differs from {@code -0.0}.</p>
 */
public record GuraFloat(double value) implements GuraValue {

	@Override
	public <R> R accept(GuraValueVisitor<R> visitor) {
		return visitor.visitFloat(value);
	}

	@Override
	public String typeName() {
		return "float";
	}

	@Override
	public double asDouble() {
		return value;
	}
}
