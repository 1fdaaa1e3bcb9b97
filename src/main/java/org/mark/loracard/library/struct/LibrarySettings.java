package org.mark.loracard.library.struct;

import java.util.ArrayList;
import java.util.List;

/**
 * 	Content of config/settings.json.
 */
public class LibrarySettings {
	
	/**
	 * 	Folders to scan, in scan order.
	 */
	private List<ModelPathDataStruct> modelPaths = new ArrayList<>();
	
	/**
	 * 	Show all folders under one "Base Loras" tree grouped by base model.
	 */
	private boolean mergeSources = true;
	
	
	public LibrarySettings() {
		
	}

	public List<ModelPathDataStruct> getModelPaths() {
		return modelPaths;
	}

	public void setModelPaths(List<ModelPathDataStruct> modelPaths) {
		this.modelPaths = modelPaths == null ? new ArrayList<>() : modelPaths;
	}

	public boolean isMergeSources() {
		return mergeSources;
	}

	public void setMergeSources(boolean mergeSources) {
		this.mergeSources = mergeSources;
	}
	
	/**
	 * 	Paths of the enabled folders, blank entries skipped.
	 * @return
	 */
	public List<String> getEnabledPaths() {
		List<String> paths = new ArrayList<>();
		for (ModelPathDataStruct item : this.modelPaths) {
			if (item == null || !item.isEnabled() || item.getPath() == null || item.getPath().isBlank()) {
				continue;
			}
			paths.add(item.getPath().trim());
		}
		return paths;
	}
}
