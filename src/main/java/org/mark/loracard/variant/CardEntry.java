package org.mark.loracard.variant;

import java.util.Collections;
import java.util.List;

import org.mark.loracard.lora.LoraModel;

/**
 * 	One visible card: a standalone model, or a High/Low group shown as a single model with a variant selector.
 */
public final class CardEntry {

	/**
	 * 	Model shown by default.
	 */
	private final LoraModel model;

	/**
	 * 	Identity of the card, never empty.
	 */
	private final String key;

	private final String sourcePath;

	private final String folderPath;

	private final String treePath;

	private final List<String> treeSegments;

	/**
	 * 	High before Low before anything else.
	 */
	private final List<VariantDescriptor> variants;


	public CardEntry(LoraModel model, String key, String sourcePath, String folderPath, String treePath,
			List<String> treeSegments, List<VariantDescriptor> variants) {
		this.model = model;
		this.key = key;
		this.sourcePath = sourcePath;
		this.folderPath = folderPath;
		this.treePath = treePath;
		this.treeSegments = treeSegments;
		this.variants = variants == null ? Collections.emptyList() : Collections.unmodifiableList(variants);
	}

	public LoraModel getModel() {
		return this.model;
	}

	public String getKey() {
		return this.key;
	}

	public String getSourcePath() {
		return this.sourcePath;
	}

	public String getFolderPath() {
		return this.folderPath;
	}

	public String getTreePath() {
		return this.treePath;
	}

	public List<String> getTreeSegments() {
		return this.treeSegments;
	}

	public List<VariantDescriptor> getVariants() {
		return this.variants;
	}

	/**
	 * 	A selector is only worth showing with two or more variants.
	 * @return
	 */
	public boolean hasVariants() {
		return this.variants.size() > 1;
	}

	/**
	 *
	 * @param label
	 * @return the model for that label, or null
	 */
	public LoraModel findVariant(String label) {
		for (VariantDescriptor variant : this.variants) {
			if (variant.getLabel().equalsIgnoreCase(label)) {
				return variant.getModel();
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return "CardEntry{" + "key='" + key + '\'' + ", model=" + model.getSafeTensorFileName() + ", variants=" + variants + '}';
	}
}
