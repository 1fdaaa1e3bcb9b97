package org.mark.loracard.library.struct;



/**
 * 	One configured LoRA folder.
 */
public class ModelPathDataStruct {
	
	/**
	 * 	
	 */
	private String path;
	
	/**
	 * 	
	 */
	private String name;
	
	/**
	 * 	Free text shown next to the folder.
	 */
	private String description;
	
	/**
	 * 	Disabled folders are kept in the settings but not scanned.
	 */
	private boolean enabled = true;
	
	
	public ModelPathDataStruct() {
		
	}
	
	public ModelPathDataStruct(String path, String name, String description) {
		this.path  = path;
		this.name = name;
		this.description = description;
	}


	public String getPath() {
		return path;
	}


	public void setPath(String path) {
		this.path = path;
	}


	public String getName() {
		return name;
	}


	public void setName(String name) {
		this.name = name;
	}


	public String getDescription() {
		return description;
	}


	public void setDescription(String description) {
		this.description = description;
	}


	public boolean isEnabled() {
		return enabled;
	}


	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}
}
