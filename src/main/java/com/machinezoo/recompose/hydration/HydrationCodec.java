// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import java.io.*;
import java.math.*;
import java.time.*;
import java.util.*;
import com.google.gson.*;
import com.google.gson.stream.*;
import com.machinezoo.recompose.hydration.DeserializationException.Reason;
import com.machinezoo.recompose.tree.*;
import com.machinezoo.stagean.*;

/*
 * Wire format:
 * {
 *   "componentTree": { "type": ..., "key": ..., "props": {...}, "children": [...] },
 *   "stateData": { ... },
 *   "hydrationMarkers": [ { "id": ..., "type": ..., "attributes": {...} } ],
 *   "timestamp": epoch millis
 * }
 * Only componentTree and timestamp are required. Everything else defaults to empty.
 * Missing node keys default to the node's index among siblings and to "root" for the root node.
 *
 * Decoding never returns partially populated context. Every problem ends in DeserializationException.
 * Parsing is strict. Lenient extensions like unquoted names, single quotes, or comments are malformed input.
 * Nesting is limited, because the decoder, the planner, and tree equality all recurse.
 */
/**
 * JSON encoder and decoder of {@link HydrationContext}.
 */
@StubDocs
public class HydrationCodec {
	public static final String DEFAULT_ROOT_KEY = "root";
	/**
	 * Maximum nesting of the component tree and of values inside properties.
	 */
	public static final int MAX_DEPTH = 256;
	private final Gson gson;
	public HydrationCodec(Gson gson) {
		Objects.requireNonNull(gson);
		this.gson = gson;
	}
	public HydrationCodec() {
		this(new Gson());
	}
	/*
	 * JsonElement.toString() keeps null members, which a Gson instance configured without serializeNulls() would drop.
	 * Null props must survive the trip.
	 */
	public String encode(HydrationContext context) {
		return toJson(context).toString();
	}
	public JsonObject toJson(HydrationContext context) {
		Objects.requireNonNull(context);
		JsonObject json = new JsonObject();
		json.add("componentTree", toJson(context.componentTree()));
		JsonObject state = new JsonObject();
		for (Map.Entry<String, JsonElement> entry : context.stateData().entrySet())
			state.add(entry.getKey(), entry.getValue());
		json.add("stateData", state);
		JsonArray markers = new JsonArray();
		for (DomMarker marker : context.hydrationMarkers()) {
			JsonObject item = new JsonObject();
			item.addProperty("id", marker.id());
			item.addProperty("type", marker.type());
			JsonObject attributes = new JsonObject();
			for (Map.Entry<String, String> attribute : marker.attributes().entrySet())
				attributes.addProperty(attribute.getKey(), attribute.getValue());
			item.add("attributes", attributes);
			markers.add(item);
		}
		json.add("hydrationMarkers", markers);
		json.addProperty("timestamp", context.timestamp().toEpochMilli());
		return json;
	}
	public static JsonObject toJson(ComponentNode node) {
		JsonObject json = new JsonObject();
		json.addProperty("type", node.type());
		json.addProperty("key", node.key());
		JsonObject props = new JsonObject();
		for (Map.Entry<String, PropValue> prop : node.props().entrySet())
			props.add(prop.getKey(), toJson(prop.getValue()));
		json.add("props", props);
		JsonArray children = new JsonArray();
		for (ComponentNode child : node.children())
			children.add(toJson(child));
		json.add("children", children);
		return json;
	}
	public static JsonElement toJson(PropValue value) {
		switch (value.kind()) {
		case NULL:
			return JsonNull.INSTANCE;
		case BOOLEAN:
			return new JsonPrimitive(value.asBoolean());
		case NUMBER:
			return new JsonPrimitive(value.asNumber());
		case STRING:
			return new JsonPrimitive(value.asString());
		case LIST:
			JsonArray array = new JsonArray();
			for (PropValue item : value.asList())
				array.add(toJson(item));
			return array;
		case MAP:
			JsonObject object = new JsonObject();
			for (Map.Entry<String, PropValue> entry : value.asMap().entrySet())
				object.add(entry.getKey(), toJson(entry.getValue()));
			return object;
		default:
			throw new IllegalStateException();
		}
	}
	/*
	 * Arbitrary saveable state values are converted with the configured Gson instance.
	 */
	public JsonElement stateJson(Object value) {
		if (value instanceof JsonElement)
			return (JsonElement)value;
		return gson.toJsonTree(value);
	}
	/**
	 * Parses hydration context.
	 *
	 * @param data
	 *            JSON text
	 * @return parsed context
	 * @throws DeserializationException
	 *             if the input is not well-formed JSON or it does not describe valid hydration context
	 */
	public HydrationContext decode(String data) {
		if (data == null)
			throw new DeserializationException(Reason.MALFORMED_JSON, "Cannot parse hydration context JSON: no data.");
		JsonElement json;
		/*
		 * JsonParser always switches the reader to lenient mode, so the reader is driven directly.
		 */
		try {
			JsonReader reader = new JsonReader(new StringReader(data));
			reader.setLenient(false);
			json = gson.getAdapter(JsonElement.class).read(reader);
			if (reader.peek() != JsonToken.END_DOCUMENT)
				throw new MalformedJsonException("Unexpected content after the top-level value at " + reader.getPath());
		} catch (IOException | JsonParseException | IllegalStateException ex) {
			throw new DeserializationException(Reason.MALFORMED_JSON, "Cannot parse hydration context JSON: " + ex.getMessage(), ex);
		}
		return fromJson(json);
	}
	public HydrationContext fromJson(JsonElement json) {
		if (json == null || !json.isJsonObject())
			throw new DeserializationException(Reason.NOT_AN_OBJECT, "Hydration context JSON must be an object.");
		JsonObject object = json.getAsJsonObject();
		JsonElement tree = required(object, "componentTree");
		Instant timestamp = timestamp(required(object, "timestamp"));
		ComponentNode root = node(tree, DEFAULT_ROOT_KEY, new Field(null, "componentTree"), 1);
		Map<String, JsonElement> state = new LinkedHashMap<>();
		JsonElement stateJson = optional(object, "stateData");
		if (stateJson != null) {
			for (Map.Entry<String, JsonElement> entry : expectObject(stateJson, "stateData").entrySet())
				state.put(entry.getKey(), entry.getValue());
		}
		List<DomMarker> markers = new ArrayList<>();
		JsonElement markersJson = optional(object, "hydrationMarkers");
		if (markersJson != null) {
			JsonArray array = expectArray(markersJson, "hydrationMarkers");
			for (int i = 0; i < array.size(); ++i)
				markers.add(marker(array.get(i), "hydrationMarkers[" + i + "]"));
		}
		try {
			return new HydrationContext(root, state, markers, timestamp);
		} catch (DuplicateMarkerException ex) {
			throw new DeserializationException(Reason.DUPLICATE_MARKER, ex.getMessage(), ex);
		}
	}
	private static JsonElement optional(JsonObject object, String field) {
		JsonElement value = object.get(field);
		return value == null || value.isJsonNull() ? null : value;
	}
	private static JsonElement required(JsonObject object, String field) {
		JsonElement value = optional(object, field);
		if (value == null)
			throw new DeserializationException(Reason.MISSING_FIELD, "Hydration context JSON is missing required field '" + field + "'.");
		return value;
	}
	private static DeserializationException invalid(Object field, String expected) {
		return new DeserializationException(Reason.INVALID_FIELD, "Field '" + field + "' of hydration context JSON must be " + expected + ".");
	}
	private static JsonObject expectObject(JsonElement json, Object field) {
		if (!json.isJsonObject())
			throw invalid(field, "an object");
		return json.getAsJsonObject();
	}
	private static JsonArray expectArray(JsonElement json, Object field) {
		if (!json.isJsonArray())
			throw invalid(field, "an array");
		return json.getAsJsonArray();
	}
	private static String expectString(JsonElement json, Object field) {
		if (!json.isJsonPrimitive() || !json.getAsJsonPrimitive().isString())
			throw invalid(field, "a string");
		return json.getAsString();
	}
	private static Instant timestamp(JsonElement json) {
		if (!json.isJsonPrimitive() || !json.getAsJsonPrimitive().isNumber())
			throw invalid("timestamp", "an integer");
		try {
			return Instant.ofEpochMilli(json.getAsBigDecimal().longValueExact());
		} catch (ArithmeticException | NumberFormatException ex) {
			throw invalid("timestamp", "an integer");
		}
	}
	/*
	 * Location of a node in the input, rendered to text only when an error is reported.
	 */
	private static final class Field {
		final Field parent;
		final String segment;
		Field(Field parent, String segment) {
			this.parent = parent;
			this.segment = segment;
		}
		Field child(String segment) {
			return new Field(this, segment);
		}
		@Override
		public String toString() {
			return parent != null ? parent + segment : segment;
		}
	}
	private static ComponentNode node(JsonElement json, String defaultKey, Field field, int depth) {
		if (depth > MAX_DEPTH)
			throw new DeserializationException(Reason.INVALID_FIELD, "Component tree is nested deeper than " + MAX_DEPTH + " levels.");
		JsonObject object = expectObject(json, field);
		JsonElement typeJson = optional(object, "type");
		if (typeJson == null)
			throw new DeserializationException(Reason.MISSING_FIELD, "Node " + field + " is missing required field 'type'.");
		String type = expectString(typeJson, field.child(".type"));
		if (type.isEmpty())
			throw invalid(field.child(".type"), "a non-empty string");
		JsonElement keyJson = optional(object, "key");
		String key = keyJson != null ? expectString(keyJson, field.child(".key")) : defaultKey;
		Map<String, PropValue> props = new LinkedHashMap<>();
		JsonElement propsJson = optional(object, "props");
		if (propsJson != null) {
			for (Map.Entry<String, JsonElement> prop : expectObject(propsJson, field.child(".props")).entrySet())
				props.put(prop.getKey(), prop(prop.getValue(), 1));
		}
		List<ComponentNode> children = new ArrayList<>();
		JsonElement childrenJson = optional(object, "children");
		if (childrenJson != null) {
			JsonArray array = expectArray(childrenJson, field.child(".children"));
			for (int i = 0; i < array.size(); ++i)
				children.add(node(array.get(i), Integer.toString(i), field.child(".children[" + i + "]"), depth + 1));
		}
		try {
			return new ComponentNode(type, key, props, children);
		} catch (IllegalArgumentException ex) {
			throw new DeserializationException(Reason.INVALID_FIELD, "Invalid node " + field + ": " + ex.getMessage(), ex);
		}
	}
	/**
	 * Converts JSON value into {@link PropValue}.
	 *
	 * @throws DeserializationException
	 *             if the value is nested deeper than {@link #MAX_DEPTH}
	 */
	public static PropValue prop(JsonElement json) {
		return prop(json, 1);
	}
	private static PropValue prop(JsonElement json, int depth) {
		if (depth > MAX_DEPTH)
			throw new DeserializationException(Reason.INVALID_FIELD, "Property value is nested deeper than " + MAX_DEPTH + " levels.");
		if (json == null || json.isJsonNull())
			return PropValue.NULL;
		if (json.isJsonPrimitive()) {
			JsonPrimitive primitive = json.getAsJsonPrimitive();
			if (primitive.isBoolean())
				return PropValue.of(primitive.getAsBoolean());
			if (primitive.isNumber())
				return PropValue.of(new BigDecimal(primitive.getAsString()));
			return PropValue.of(primitive.getAsString());
		}
		if (json.isJsonArray()) {
			List<PropValue> items = new ArrayList<>();
			for (JsonElement item : json.getAsJsonArray())
				items.add(prop(item, depth + 1));
			return PropValue.list(items);
		}
		Map<String, PropValue> entries = new LinkedHashMap<>();
		for (Map.Entry<String, JsonElement> entry : json.getAsJsonObject().entrySet())
			entries.put(entry.getKey(), prop(entry.getValue(), depth + 1));
		return PropValue.map(entries);
	}
	private static DomMarker marker(JsonElement json, String field) {
		JsonObject object = expectObject(json, field);
		JsonElement idJson = optional(object, "id");
		if (idJson == null)
			throw new DeserializationException(Reason.MISSING_FIELD, "Marker " + field + " is missing required field 'id'.");
		String id = expectString(idJson, field + ".id");
		if (id.isEmpty())
			throw invalid(field + ".id", "a non-empty string");
		JsonElement typeJson = optional(object, "type");
		if (typeJson == null)
			throw new DeserializationException(Reason.MISSING_FIELD, "Marker " + field + " is missing required field 'type'.");
		String type = expectString(typeJson, field + ".type");
		Map<String, String> attributes = new LinkedHashMap<>();
		JsonElement attributesJson = optional(object, "attributes");
		if (attributesJson != null) {
			for (Map.Entry<String, JsonElement> attribute : expectObject(attributesJson, field + ".attributes").entrySet()) {
				JsonElement value = attribute.getValue();
				if (value.isJsonNull())
					continue;
				attributes.put(attribute.getKey(), value.isJsonPrimitive() ? value.getAsString() : value.toString());
			}
		}
		return new DomMarker(id, type, attributes);
	}
}
