package org.javai.gura.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered mapping of unique keys to values.
 *
 * <p>Insertion order is kept for iteration and serialization. Equality ignores
 * order, so two objects with the same members are equal.</p>
 */
public record GuraObject(Map<String, GuraValue> members) implements GuraValue {

	private static final GuraObject EMPTY = new GuraObject(Map.of());

	public GuraObject {
		Map<String, GuraValue> copy = new LinkedHashMap<>();
		members.forEach((key, value) -> copy.put(
				Objects.requireNonNull(key, "key"),
				Objects.requireNonNull(value, () -> "value of " + key)));
		members = Collections.unmodifiableMap(copy);
	}

	/**
	 * The object produced by the {@code empty} keyword.
	 */
	public static GuraObject empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Returns the value stored under {@code key}, or {@code null} if there is none.
	 */
	public GuraValue get(String key) {
		return members.get(key);
	}

	public boolean containsKey(String key) {
		return members.containsKey(key);
	}

	public Set<String> keys() {
		return members.keySet();
	}

	public int size() {
		return members.size();
	}

	public boolean isEmpty() {
		return members.isEmpty();
	}

	@Override
	public <R> R accept(GuraValueVisitor<R> visitor) {
		return visitor.visitObject(members);
	}

	@Override
	public String typeName() {
		return "object";
	}

	@Override
	public GuraObject asObject() {
		return this;
	}

	/**
	 * Collects members in insertion order. Later puts replace earlier ones.
	 */
	public static final class Builder {

		private final Map<String, GuraValue> members = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder put(String key, GuraValue value) {
			members.put(key, value);
			return this;
		}

		public Builder put(String key, String value) {
			return put(key, new GuraString(value));
		}

		public Builder put(String key, long value) {
			return put(key, new GuraInteger(value));
		}

		public Builder put(String key, double value) {
			return put(key, new GuraFloat(value));
		}

		public Builder put(String key, boolean value) {
			return put(key, GuraBool.of(value));
		}

		public GuraObject build() {
			return new GuraObject(members);
		}
	}
}
