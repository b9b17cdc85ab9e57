package org.javai.gura.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.gura.value.GuraArray;
import org.javai.gura.value.GuraBigInteger;
import org.javai.gura.value.GuraBool;
import org.javai.gura.value.GuraFloat;
import org.javai.gura.value.GuraInteger;
import org.javai.gura.value.GuraNull;
import org.javai.gura.value.GuraObject;
import org.javai.gura.value.GuraString;
import org.javai.gura.value.GuraValue;
import org.javai.gura.value.GuraValueVisitor;

/**
 * Converts between Gura values, Jackson trees and plain Java objects.
 *
 * <pre>{@code
 * record Server(String host, int port) {}
 *
 * GuraObject config = Gura.parse("host: \"localhost\"\nport: 8080");
 * Server server = new GuraJsonMapper().convert(config, Server.class);
 * }</pre>
 */
public class GuraJsonMapper {

	private final ObjectMapper mapper;

	public GuraJsonMapper() {
		this(new ObjectMapper());
	}

	public GuraJsonMapper(ObjectMapper mapper) {
		this.mapper = Objects.requireNonNull(mapper, "mapper");
	}

	/**
	 * Builds the JSON tree of a value. Non-finite floats become double nodes.
	 */
	public JsonNode toJson(GuraValue value) {
		return value.accept(new NodeBuilder(mapper.getNodeFactory()));
	}

	/**
	 * Builds the value of a JSON tree.
	 *
	 * @throws IllegalArgumentException if the tree holds binary or POJO nodes, or
	 * integers wider than 128 bits
	 */
	public GuraValue fromJson(JsonNode node) {
		if (node == null || node.isNull() || node.isMissingNode()) {
			return GuraNull.INSTANCE;
		}
		if (node.isBoolean()) {
			return GuraBool.of(node.booleanValue());
		}
		if (node.isIntegralNumber()) {
			if (node.canConvertToLong()) {
				return new GuraInteger(node.longValue());
			}
			BigInteger value = node.bigIntegerValue();
			if (!GuraBigInteger.fits(value)) {
				throw new IllegalArgumentException("Integer " + value + " does not fit in 128 bits");
			}
			return new GuraBigInteger(value);
		}
		if (node.isNumber()) {
			return new GuraFloat(node.doubleValue());
		}
		if (node.isTextual()) {
			return new GuraString(node.textValue());
		}
		if (node.isArray()) {
			List<GuraValue> elements = new ArrayList<>(node.size());
			for (JsonNode element : node) {
				elements.add(fromJson(element));
			}
			return new GuraArray(elements);
		}
		if (node.isObject()) {
			Map<String, GuraValue> members = new LinkedHashMap<>();
			Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				members.put(field.getKey(), fromJson(field.getValue()));
			}
			return new GuraObject(members);
		}
		throw new IllegalArgumentException("Unsupported JSON node type: " + node.getNodeType());
	}

	/**
	 * Maps a value onto a Java type, as Jackson would map the equivalent JSON.
	 *
	 * @throws IllegalArgumentException if Jackson cannot map the value
	 */
	public <T> T convert(GuraValue value, Class<T> type) {
		return mapper.convertValue(toJson(value), type);
	}

	/**
	 * Builds the value of a Java object, as Jackson would serialize it.
	 */
	public GuraValue valueOf(Object object) {
		return fromJson(mapper.valueToTree(object));
	}

	private static final class NodeBuilder implements GuraValueVisitor<JsonNode> {

		private final JsonNodeFactory factory;

		private NodeBuilder(JsonNodeFactory factory) {
			this.factory = factory;
		}

		@Override
		public JsonNode visitNull() {
			return factory.nullNode();
		}

		@Override
		public JsonNode visitBool(boolean value) {
			return factory.booleanNode(value);
		}

		@Override
		public JsonNode visitInteger(long value) {
			return factory.numberNode(value);
		}

		@Override
		public JsonNode visitBigInteger(BigInteger value) {
			return factory.numberNode(value);
		}

		@Override
		public JsonNode visitFloat(double value) {
			return factory.numberNode(value);
		}

		@Override
		public JsonNode visitString(String value) {
			return factory.textNode(value);
		}

		@Override
		public JsonNode visitArray(List<GuraValue> elements) {
			ArrayNode array = factory.arrayNode(elements.size());
			elements.forEach(element -> array.add(element.accept(this)));
			return array;
		}

		@Override
		public JsonNode visitObject(Map<String, GuraValue> members) {
			ObjectNode object = factory.objectNode();
			members.forEach((key, value) -> object.set(key, value.accept(this)));
			return object;
		}
	}
}
