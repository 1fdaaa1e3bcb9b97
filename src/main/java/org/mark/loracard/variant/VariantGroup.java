package org.mark.loracard.variant;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.mark.loracard.lora.LoraModel;

/**
 * 	Collects the variants of one logical model during a merge run.
 */
final class VariantGroup {

	/**
	 * 	The seed that created the group; its paths end up on the card.
	 */
	private final CardSeed seed;

	private final String normalizedKey;

	/**
	 * 	Case-insensitive label to model. A later model with the same label replaces the earlier one.
	 */
	private final Map<String, LoraModel> variants = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);


	VariantGroup(CardSeed seed, String normalizedKey) {
		this.seed = seed;
		this.normalizedKey = normalizedKey;
	}

	/**
	 *
	 * @return the model that was replaced, or null
	 */
	LoraModel addVariant(String label, LoraModel model) {
		return this.variants.put(label, model);
	}

	CardEntry toEntry() {
		List<String> labels = new ArrayList<>(this.variants.keySet());
		labels.sort(VariantOrder.INSTANCE);

		List<VariantDescriptor> ordered = new ArrayList<>(labels.size());
		for (String label : labels) {
			ordered.add(new VariantDescriptor(label, this.variants.get(label)));
		}

		LoraModel selected = ordered.get(0).getModel();
		return new CardEntry(selected, this.normalizedKey, this.seed.getSourcePath(), this.seed.getFolderPath(),
				this.seed.getTreePath(), this.seed.getTreeSegments(), ordered);
	}
}
