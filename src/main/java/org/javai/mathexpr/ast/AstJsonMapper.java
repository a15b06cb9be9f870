package org.javai.mathexpr.ast;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps trees to and from their array form: a number is a JSON number, a symbol a string,
 * a flag a boolean and an interior node an array whose first element is the operator tag,
 * e.g. {@code ["apply","sin",["*",2,"x"]]}. Single-quoted strings are accepted when reading.
 */
public final class AstJsonMapper {

	private static final ObjectMapper MAPPER = new ObjectMapper()
			.configure(JsonParser.Feature.ALLOW_SINGLE_QUOTES, true);

	private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

	private AstJsonMapper() {
	}

	public static JsonNode toJson(MathNode tree) {
		Objects.requireNonNull(tree, "tree must not be null");
		return tree.accept(new MathNodeVisitor<JsonNode>() {
			@Override
			public JsonNode visitNumber(MathNode.Num node) {
				if (node.isIntegral()) {
					return NODES.numberNode((long) node.value());
				}
				return NODES.numberNode(node.value());
			}

			@Override
			public JsonNode visitSymbol(MathNode.Symbol node) {
				return NODES.textNode(node.name());
			}

			@Override
			public JsonNode visitBoolean(MathNode.Bool node) {
				return NODES.booleanNode(node.value());
			}

			@Override
			public JsonNode visitApply(MathNode.Apply node) {
				ArrayNode array = NODES.arrayNode();
				array.add(node.operator().tag());
				for (MathNode operand : node.operands()) {
					array.add(operand.accept(this));
				}
				return array;
			}
		});
	}

	public static String toJsonString(MathNode tree) {
		return toJson(tree).toString();
	}

	/**
	 * Decodes the array form into a validated tree.
	 *
	 * @throws InvalidTreeException if the document is not a well-formed tree
	 */
	public static MathNode fromJson(JsonNode json) {
		Objects.requireNonNull(json, "json must not be null");
		if (json.isNumber()) {
			return MathNode.number(json.asDouble());
		}
		if (json.isTextual()) {
			return MathNode.symbol(json.asText());
		}
		if (json.isBoolean()) {
			return MathNode.bool(json.asBoolean());
		}
		if (json.isArray() && !json.isEmpty() && json.get(0).isTextual()) {
			Operator operator = Operator.fromTag(json.get(0).asText());
			List<MathNode> operands = new ArrayList<>(json.size() - 1);
			for (int i = 1; i < json.size(); i++) {
				operands.add(fromJson(json.get(i)));
			}
			return MathNode.apply(operator, operands);
		}
		throw new InvalidTreeException("Not a tree node: " + json);
	}

	public static MathNode fromJsonString(String json) {
		try {
			return fromJson(MAPPER.readTree(json));
		}
		catch (JsonProcessingException e) {
			throw new InvalidTreeException("Failed to read tree JSON: " + e.getOriginalMessage(), e);
		}
	}
}
