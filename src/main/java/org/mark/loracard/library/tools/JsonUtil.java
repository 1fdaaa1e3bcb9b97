package org.mark.loracard.library.tools;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

public class JsonUtil {
	
	private static final Gson gson = new Gson();
	
	private static final Gson prettyGson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
	
	
	public static String toPrettyJson(Object obj) {
		return prettyGson.toJson(obj);
	}
	
	
	public static <T> T fromJson(String json, Class<T> type) {
		return gson.fromJson(json, type);
	}
	
	
	/**
	 * 	String value of a primitive member, or the fallback when the member is missing, null or not a primitive.
	 */
	public static String getJsonString(JsonObject o, String key, String fallback) {
		if (o == null || key == null) {
			return fallback;
		}
		JsonElement el = o.get(key);
		if (el == null || !el.isJsonPrimitive()) {
			return fallback;
		}
		return el.getAsString();
	}
	
	public static JsonObject getJsonObject(JsonObject o, String key) {
		if (o == null || key == null) {
			return null;
		}
		JsonElement el = o.get(key);
		return el != null && el.isJsonObject() ? el.getAsJsonObject() : null;
	}

	/**
	 * 	Accepts either an array of values or a single string; blank items are dropped.
	 * @param el
	 * @return null when there is nothing usable
	 */
	public static List<String> getJsonStringList(JsonElement el) {
		if (el == null || el.isJsonNull()) {
			return null;
		}
		if (el.isJsonPrimitive()) {
			String single = el.getAsString().trim();
			return single.isEmpty() ? null : Arrays.asList(single);
		}
		if (!el.isJsonArray()) {
			return null;
		}
		List<String> out = new ArrayList<>();
		for (JsonElement item : el.getAsJsonArray()) {
			String text = jsonValueToString(item).trim();
			if (!text.isEmpty()) {
				out.add(text);
			}
		}
		return out;
	}

	public static String jsonValueToString(JsonElement el) {
		if (el == null || el.isJsonNull()) {
			return "";
		}
		return el.isJsonPrimitive() ? el.getAsString() : el.toString();
	}

	/**
	 * 	Parses text that should hold a JSON object.
	 * @param s
	 * @return null for blank text or a JSON value that is not an object
	 * @throws JsonParseException for malformed JSON
	 */
	public static JsonObject tryParseObject(String s) {
		if (s == null || s.trim().isEmpty()) {
			return null;
		}
		JsonElement el = fromJson(s, JsonElement.class);
		return el != null && el.isJsonObject() ? el.getAsJsonObject() : null;
	}
}
