package org.complexcalc;

import java.util.ArrayList;
import java.util.List;

import org.complexcalc.math.Complex;
import org.complexcalc.parser.Expression;
import org.complexcalc.parser.OperationNotFoundException;
import org.complexcalc.parser.OperationTable;
import org.complexcalc.parser.Token;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Reads and writes expressions as JSON documents of the form
 * <pre>
 * {"notation":"postfix","display":"[z 2 ^]",
 *  "tokens":[{"var":"z"},{"re":2.0,"im":0.0},{"op":"POW"}]}
 * </pre>
 * The display string is informational and ignored when reading.
 */
public class ExpressionJson {

	public static String toJson(Expression expression) {
		JsonObject doc = new JsonObject();
		doc.addProperty("notation", expression.isPostfix() ? "postfix" : "infix");
		doc.addProperty("display", expression.toString());
		JsonArray tokens = new JsonArray();
		for (Token t : expression.tokens()) tokens.add(toJson(t));
		doc.add("tokens", tokens);
		return doc.toString();
	}

	static JsonObject toJson(Token t) {
		JsonObject token = new JsonObject();
		switch (t.getType()) {
		case VARIABLE:
			token.addProperty("var", "z");
			break;
		case CONSTANT:
			token.addProperty("re", t.getValue().real());
			token.addProperty("im", t.getValue().imag());
			break;
		default:
			token.addProperty("op", t.getOperation().name());
		}
		return token;
	}

	/**
	 * @throws OperationNotFoundException if a token names an unknown operation
	 * @throws IllegalArgumentException if the document is not an expression document
	 */
	public static Expression fromJson(String json) throws OperationNotFoundException {
		JsonObject doc;
		try {
			doc = JsonParser.parseString(json).getAsJsonObject();
		} catch (JsonParseException | IllegalStateException e) {
			throw new IllegalArgumentException("Not a JSON object: " + json, e);
		}
		JsonElement notation = doc.get("notation");
		JsonElement tokens = doc.get("tokens");
		if (notation == null || tokens == null || !tokens.isJsonArray())
			throw new IllegalArgumentException("Expression document needs notation and tokens: " + json);

		List<Token> list = new ArrayList<Token>();
		for (JsonElement e : tokens.getAsJsonArray()) list.add(fromJson(e));

		switch (primitive(doc, "notation").getAsString()) {
		case "postfix": return Expression.postfix(list);
		case "infix": return Expression.infix(list);
		default: throw new IllegalArgumentException("Unknown notation " + notation);
		}
	}

	static Token fromJson(JsonElement element) throws OperationNotFoundException {
		if (!element.isJsonObject()) throw new IllegalArgumentException("Token is not an object: " + element);
		JsonObject token = element.getAsJsonObject();
		if (token.has("op")) return Token.operator(OperationTable.forId(primitive(token, "op").getAsString()));
		if (token.has("var")) return Token.variable();
		if (token.has("re")) {
			double im = token.has("im") ? primitive(token, "im").getAsDouble() : 0.0;
			return Token.constant(Complex.valueOf(primitive(token, "re").getAsDouble(), im));
		}
		throw new IllegalArgumentException("Unknown token: " + element);
	}

	// a non-numeric string still fails in getAsDouble with a NumberFormatException
	private static JsonPrimitive primitive(JsonObject object, String key) {
		JsonElement value = object.get(key);
		if (value == null || !value.isJsonPrimitive())
			throw new IllegalArgumentException("\"" + key + "\" must be a string or number: " + object);
		return value.getAsJsonPrimitive();
	}
}
