package org.mark.loracard.variant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.mark.loracard.lora.LoraModel;

/**
 * 	Detects High/Low noise markers in LoRA file names and derives the key that
 * 	identifies sibling files of the same model.
 * 	<p>
 * 	Stateless; one instance can be shared between threads.
 */
public class VariantClassifier {

	public static final String HIGH = "High";

	public static final String LOW = "Low";

	/**
	 * 	Marker (lowercase) to label, in declaration order.
	 */
	private static final Map<String, String> VARIANT_LABELS = new LinkedHashMap<>();

	static {
		VARIANT_LABELS.put("highnoise", HIGH);
		VARIANT_LABELS.put("high_noise", HIGH);
		VARIANT_LABELS.put("high", HIGH);
		VARIANT_LABELS.put("h", HIGH);
		VARIANT_LABELS.put("hn", HIGH);
		VARIANT_LABELS.put("lownoise", LOW);
		VARIANT_LABELS.put("low_noise", LOW);
		VARIANT_LABELS.put("low", LOW);
		VARIANT_LABELS.put("l", LOW);
		VARIANT_LABELS.put("ln", LOW);
	}

	/**
	 * 	Longest markers first; ties keep declaration order.
	 */
	private static final List<String> MARKERS_BY_LENGTH;

	static {
		List<String> keys = new ArrayList<>(VARIANT_LABELS.keySet());
		keys.sort(Comparator.comparingInt(String::length).reversed());
		MARKERS_BY_LENGTH = Collections.unmodifiableList(keys);
	}

	private static final String TOKEN_SEPARATORS = " _-.()[]{}";

	private static final String[] KNOWN_EXTENSIONS = { ".safetensors", ".pt", ".ckpt", ".bin" };


	public VariantClassifier() {

	}

	public VariantClassification classify(ClassificationInput input) {
		if (input == null) {
			throw new IllegalArgumentException("input cannot be null");
		}
		if (input instanceof ClassificationInput.Structured) {
			return this.classifyModel(((ClassificationInput.Structured) input).getModel());
		}
		return classifySource(normalizeSource(((ClassificationInput.RawText) input).getText()));
	}

	public VariantClassification classify(LoraModel model) {
		return this.classify(ClassificationInput.structured(model));
	}

	public VariantClassification classify(String text) {
		return this.classify(ClassificationInput.rawText(text));
	}

	/**
	 * 	The file name decides; the declared version name only fills in what the file name lacks.
	 * @param model
	 * @return
	 */
	private VariantClassification classifyModel(LoraModel model) {
		VariantClassification classification = classifySource(normalizeSource(model.getSafeTensorFileName()));
		if (classification.hasLabel() && classification.hasKey()) {
			return classification;
		}

		String fallbackSource = normalizeSource(model.getModelVersionName());
		if (fallbackSource == null) {
			return classification;
		}

		VariantClassification fallback = classifySource(fallbackSource);
		String label = classification.hasLabel() ? classification.getVariantLabel() : fallback.getVariantLabel();
		String key = classification.hasKey() ? classification.getNormalizedKey() : fallback.getNormalizedKey();
		return new VariantClassification(key, label);
	}

	/**
	 * 	Trims the value and drops a known model extension (and any directory part with it).
	 * @param value
	 * @return null when there is nothing to classify
	 */
	static String normalizeSource(String value) {
		if (value == null || value.isBlank()) {
			return null;
		}

		String trimmed = value.trim();
		int separator = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
		int dot = trimmed.lastIndexOf('.');
		if (dot > separator && dot < trimmed.length() - 1 && isKnownExtension(trimmed.substring(dot))) {
			String withoutExtension = trimmed.substring(separator + 1, dot);
			return withoutExtension.isBlank() ? trimmed : withoutExtension;
		}

		return trimmed;
	}

	private static boolean isKnownExtension(String extension) {
		for (String known : KNOWN_EXTENSIONS) {
			if (known.equalsIgnoreCase(extension)) {
				return true;
			}
		}
		return false;
	}

	private static VariantClassification classifySource(String source) {
		if (source == null || source.isBlank()) {
			return VariantClassification.empty();
		}

		String label = detectVariantLabel(source);
		String key = buildNormalizedKey(source, label);
		return new VariantClassification(key, label);
	}

	private static String detectVariantLabel(String source) {
		for (String marker : MARKERS_BY_LENGTH) {
			if (containsToken(source, marker)) {
				return VARIANT_LABELS.get(marker);
			}
		}

		for (String token : tokenize(source)) {
			String label = lookup(token);
			if (label != null) {
				return label;
			}

			String trimmed = trimNumericEdges(token);
			if (!trimmed.equalsIgnoreCase(token)) {
				label = lookup(trimmed);
				if (label != null) {
					return label;
				}
			}

			label = detectEmbeddedVariant(token);
			if (label != null) {
				return label;
			}
		}

		return VariantClassification.NO_VARIANT;
	}

	/**
	 * 	Finds a marker glued to other text, e.g. "MuscleMommyH_high" or "WANT2VHIGHNOISEJIGGLE".
	 * 	Single-letter markers are never matched inside a token.
	 */
	private static String detectEmbeddedVariant(String token) {
		for (String marker : MARKERS_BY_LENGTH) {
			if (marker.length() == 1) {
				continue;
			}

			int index = indexOfIgnoreCase(token, marker, 0);
			while (index >= 0) {
				Character before = index > 0 ? token.charAt(index - 1) : null;
				int afterIndex = index + marker.length();
				Character after = afterIndex < token.length() ? token.charAt(afterIndex) : null;

				if (!isLetter(before) || !isLetter(after)) {
					return VARIANT_LABELS.get(marker);
				}

				if (marker.length() > 3 && Character.isUpperCase(before) && Character.isUpperCase(after)) {
					return VARIANT_LABELS.get(marker);
				}

				index = indexOfIgnoreCase(token, marker, index + 1);
			}
		}

		return null;
	}

	private static String buildNormalizedKey(String source, String variantLabel) {
		List<String> tokens = tokenize(removeVariantSegments(source));
		if (tokens.isEmpty()) {
			return "";
		}

		StringBuilder key = new StringBuilder();
		for (int i = 0; i < tokens.size(); i++) {
			String token = tokens.get(i);
			String lower = token.toLowerCase(Locale.ROOT);

			if (VARIANT_LABELS.containsKey(lower) || "noise".equals(lower) || isVersionToken(lower)) {
				continue;
			}

			if (Character.isDigit(lower.charAt(0))) {
				if (isAllDigits(lower)) {
					if (!hasSubsequentAlphabeticToken(tokens, i)) {
						continue;
					}
				} else if (hasOtherAlphabeticToken(tokens, i)) {
					continue;
				}
			}

			key.append(normalizeToken(token, variantLabel));
		}

		return key.toString().toLowerCase(Locale.ROOT);
	}

	private static String removeVariantSegments(String source) {
		String result = source;
		for (String marker : MARKERS_BY_LENGTH) {
			result = removeToken(result, marker);
		}
		return result;
	}

	/**
	 * 	Removes every occurrence of {@code token} that stands alone between non-alphanumeric characters.
	 */
	private static String removeToken(String source, String token) {
		int index = 0;
		while (index < source.length()) {
			int found = indexOfIgnoreCase(source, token, index);
			if (found < 0) {
				break;
			}

			if (isTokenBoundary(source, found, token.length())) {
				source = source.substring(0, found) + source.substring(found + token.length());
				continue;
			}

			index = found + 1;
		}
		return source;
	}

	private static boolean containsToken(String source, String token) {
		int index = 0;
		while (index < source.length()) {
			int found = indexOfIgnoreCase(source, token, index);
			if (found < 0) {
				return false;
			}

			if (isTokenBoundary(source, found, token.length())) {
				return true;
			}

			index = found + 1;
		}
		return false;
	}

	private static boolean isTokenBoundary(String source, int start, int length) {
		boolean startBoundary = start == 0 || !Character.isLetterOrDigit(source.charAt(start - 1));
		int end = start + length;
		boolean endBoundary = end >= source.length() || !Character.isLetterOrDigit(source.charAt(end));
		return startBoundary && endBoundary;
	}

	private static String normalizeToken(String token, String variantLabel) {
		if (variantLabel.isEmpty()) {
			return token;
		}

		if (HIGH.equalsIgnoreCase(variantLabel)) {
			token = trimSuffix(token, "hn");
			token = trimSuffix(token, "h");
		} else if (LOW.equalsIgnoreCase(variantLabel)) {
			token = trimSuffix(token, "ln");
			token = trimSuffix(token, "l");
		}

		for (Map.Entry<String, String> pair : VARIANT_LABELS.entrySet()) {
			if (pair.getKey().length() > 1 && pair.getValue().equalsIgnoreCase(variantLabel)) {
				token = removeSubstring(token, pair.getKey());
			}
		}

		return token;
	}

	/**
	 * 	Removes an embedded marker unless it is wrapped in letters on both sides
	 * 	(long markers wrapped in uppercase letters are still removed).
	 */
	private static String removeSubstring(String token, String marker) {
		int index = indexOfIgnoreCase(token, marker, 0);
		while (index >= 0) {
			Character before = index > 0 ? token.charAt(index - 1) : null;
			int afterIndex = index + marker.length();
			Character after = afterIndex < token.length() ? token.charAt(afterIndex) : null;

			boolean remove = !isLetter(before) || !isLetter(after);
			if (!remove && marker.length() > 3 && Character.isUpperCase(before) && Character.isUpperCase(after)) {
				remove = true;
			}

			if (!remove) {
				index = indexOfIgnoreCase(token, marker, index + 1);
				continue;
			}

			token = token.substring(0, index) + token.substring(afterIndex);
			index = indexOfIgnoreCase(token, marker, 0);
		}
		return token;
	}

	/**
	 * 	Drops an uppercase "H"/"HN"/"L"/"LN" suffix such as in "MuscleMommyH", keeping tokens of at least four chars.
	 */
	private static String trimSuffix(String token, String suffix) {
		int keep = token.length() - suffix.length();
		if (keep <= 0 || !token.regionMatches(true, keep, suffix, 0, suffix.length())) {
			return token;
		}
		if (keep < 4) {
			return token;
		}

		boolean hasUpper = false;
		for (int i = keep; i < token.length(); i++) {
			if (Character.isUpperCase(token.charAt(i))) {
				hasUpper = true;
				break;
			}
		}
		if (!hasUpper) {
			return token;
		}

		return Character.isDigit(token.charAt(keep - 1)) ? token : token.substring(0, keep);
	}

	private static String trimNumericEdges(String token) {
		int start = 0;
		while (start < token.length() && Character.isDigit(token.charAt(start))) {
			start++;
		}

		int end = token.length() - 1;
		while (end >= start && Character.isDigit(token.charAt(end))) {
			end--;
		}

		return start > end ? "" : token.substring(start, end + 1);
	}

	private static boolean isVersionToken(String token) {
		if (token.isEmpty()) {
			return false;
		}
		if (token.startsWith("ver") || token.equals("v") || token.startsWith("epoch")) {
			return true;
		}
		char first = token.charAt(0);
		return (first == 'v' || first == 'e') && token.length() > 1 && isAllDigits(token.substring(1));
	}

	private static boolean hasOtherAlphabeticToken(List<String> tokens, int excludeIndex) {
		for (int i = 0; i < tokens.size(); i++) {
			if (i == excludeIndex) {
				continue;
			}

			String lower = tokens.get(i).toLowerCase(Locale.ROOT);
			if (VARIANT_LABELS.containsKey(lower) || isVersionToken(lower)) {
				continue;
			}

			if (hasLetter(lower)) {
				return true;
			}
		}
		return false;
	}

	private static boolean hasSubsequentAlphabeticToken(List<String> tokens, int index) {
		for (int i = index + 1; i < tokens.size(); i++) {
			String lower = tokens.get(i).toLowerCase(Locale.ROOT);
			if (VARIANT_LABELS.containsKey(lower) || isVersionToken(lower) || isAllDigits(lower)) {
				continue;
			}

			if (hasLetter(lower)) {
				return true;
			}
		}
		return false;
	}

	static List<String> tokenize(String source) {
		List<String> tokens = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		for (int i = 0; i < source.length(); i++) {
			char c = source.charAt(i);
			if (TOKEN_SEPARATORS.indexOf(c) >= 0) {
				addToken(tokens, current);
			} else {
				current.append(c);
			}
		}
		addToken(tokens, current);
		return tokens;
	}

	private static void addToken(List<String> tokens, StringBuilder current) {
		String token = current.toString().trim();
		if (!token.isEmpty()) {
			tokens.add(token);
		}
		current.setLength(0);
	}

	private static String lookup(String token) {
		return VARIANT_LABELS.get(token.toLowerCase(Locale.ROOT));
	}

	private static int indexOfIgnoreCase(String source, String target, int from) {
		for (int i = Math.max(from, 0); i <= source.length() - target.length(); i++) {
			if (source.regionMatches(true, i, target, 0, target.length())) {
				return i;
			}
		}
		return -1;
	}

	private static boolean isLetter(Character c) {
		return c != null && Character.isLetter(c);
	}

	private static boolean hasLetter(String value) {
		for (int i = 0; i < value.length(); i++) {
			if (Character.isLetter(value.charAt(i))) {
				return true;
			}
		}
		return false;
	}

	private static boolean isAllDigits(String value) {
		for (int i = 0; i < value.length(); i++) {
			if (!Character.isDigit(value.charAt(i))) {
				return false;
			}
		}
		return true;
	}
}
