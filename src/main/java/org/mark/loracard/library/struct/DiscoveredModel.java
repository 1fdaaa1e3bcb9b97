package org.mark.loracard.library.struct;

import org.mark.loracard.lora.LoraModel;

/**
 * 	A model found on disk together with where it was found.
 */
public class DiscoveredModel {
	
	private final LoraModel model;
	
	/**
	 * 	The configured folder the model was found under.
	 */
	private final String sourcePath;
	
	/**
	 * 	The directory that holds the model file.
	 */
	private final String folderPath;
	
	
	public DiscoveredModel(LoraModel model, String sourcePath, String folderPath) {
		if (model == null) {
			throw new IllegalArgumentException("model cannot be null");
		}
		this.model = model;
		this.sourcePath = sourcePath;
		this.folderPath = folderPath;
	}

	public LoraModel getModel() {
		return model;
	}

	public String getSourcePath() {
		return sourcePath;
	}

	public String getFolderPath() {
		return folderPath;
	}
}
