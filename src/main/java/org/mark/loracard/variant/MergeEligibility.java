package org.mark.loracard.variant;

import org.mark.loracard.lora.LoraModel;

/**
 * 	Only High/Low files whose key, model id and base model are all known get merged.
 */
public final class MergeEligibility {

	private MergeEligibility() {

	}

	public static boolean isEligible(LoraModel model, VariantClassification classification) {
		if (model == null || classification == null) {
			return false;
		}

		String label = classification.getVariantLabel();
		if (!VariantClassifier.HIGH.equalsIgnoreCase(label) && !VariantClassifier.LOW.equalsIgnoreCase(label)) {
			return false;
		}

		return classification.hasKey()
				&& !model.getModelId().isBlank()
				&& !model.getDiffusionBaseModel().isBlank();
	}
}
