package org.mark.loracard.variant;

import java.util.Collections;
import java.util.List;

import org.mark.loracard.lora.LoraModel;

/**
 * 	A discovered LoRA before classification and merging.
 */
public final class CardSeed {

	private final LoraModel model;

	/**
	 * 	Root folder the model was found under.
	 */
	private final String sourcePath;

	/**
	 * 	Containing folder, may be null.
	 */
	private final String folderPath;

	private final String treePath;

	private final List<String> treeSegments;


	public CardSeed(LoraModel model, String sourcePath, String folderPath, String treePath, List<String> treeSegments) {
		if (model == null) {
			throw new IllegalArgumentException("model cannot be null");
		}
		this.model = model;
		this.sourcePath = sourcePath;
		this.folderPath = folderPath;
		this.treePath = treePath;
		this.treeSegments = treeSegments == null ? null : Collections.unmodifiableList(treeSegments);
	}

	public LoraModel getModel() {
		return this.model;
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
}
