package org.javai.gura.value;

import java.util.List;

/**
 * An ordered sequence of values.
 */
public record GuraArray(List<GuraValue> elements) implements GuraValue {

	public GuraArray {
		elements = List.copyOf(elements);
	}

	public static GuraArray of(GuraValue... elements) {
		return new GuraArray(List.of(elements));
	}

	public int size() {
		return elements.size();
	}

	public GuraValue get(int index) {
		return elements.get(index);
	}

	@Override
	public <R> R accept(GuraValueVisitor<R> visitor) {
		return visitor.visitArray(elements);
	}

	@Override
	public String typeName() {
		return "array";
	}

	@Override
	public List<GuraValue> asList() {
		return elements;
	}
}
