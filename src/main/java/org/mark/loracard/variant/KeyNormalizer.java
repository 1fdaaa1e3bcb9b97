package org.mark.loracard.variant;

import java.util.Locale;

import org.mark.loracard.lora.LoraModel;

/**
 * 	Derives the identity key of a card. Falls back step by step and never returns an empty key:
 * 	<ol>
 * 	<li>classification of the whole model record</li>
 * 	<li>classification of the file name alone</li>
 * 	<li>classification of the version name alone</li>
 * 	<li>file name (or version name) with everything but letters and digits removed</li>
 * 	<li>a fresh id from the {@link UniqueIdGenerator}</li>
 * 	</ol>
 */
public class KeyNormalizer {

	private final VariantClassifier classifier;

	private final UniqueIdGenerator idGenerator;


	public KeyNormalizer(VariantClassifier classifier, UniqueIdGenerator idGenerator) {
		if (classifier == null || idGenerator == null) {
			throw new IllegalArgumentException("classifier and idGenerator are required");
		}
		this.classifier = classifier;
		this.idGenerator = idGenerator;
	}

	public String normalize(LoraModel model) {
		if (model == null) {
			throw new IllegalArgumentException("model cannot be null");
		}

		String key = this.classifier.classify(ClassificationInput.structured(model)).getNormalizedKey();
		if (!key.isBlank()) {
			return key;
		}

		key = this.classifier.classify(ClassificationInput.rawText(model.getSafeTensorFileName())).getNormalizedKey();
		if (!key.isBlank()) {
			return key;
		}

		key = this.classifier.classify(ClassificationInput.rawText(model.getModelVersionName())).getNormalizedKey();
		if (!key.isBlank()) {
			return key;
		}

		String text = !model.getSafeTensorFileName().isBlank() ? model.getSafeTensorFileName() : model.getModelVersionName();
		key = stripToAlphanumeric(text);
		if (!key.isEmpty()) {
			return key;
		}

		return this.idGenerator.nextId();
	}

	static String stripToAlphanumeric(String text) {
		if (text == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (Character.isLetterOrDigit(c)) {
				sb.append(c);
			}
		}
		return sb.toString().toLowerCase(Locale.ROOT);
	}
}
