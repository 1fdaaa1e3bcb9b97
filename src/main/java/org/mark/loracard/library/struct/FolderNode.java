package org.mark.loracard.library.struct;

import java.util.ArrayList;
import java.util.List;

/**
 * 	A node of the folder tree shown next to the cards.
 */
public class FolderNode {
	
	private final String name;
	
	/**
	 * 	Absolute path for disk trees, "/"-joined segments for merged trees.
	 */
	private final String fullPath;
	
	private final List<FolderNode> children = new ArrayList<>();
	
	/**
	 * 	Models in this folder and all folders below it.
	 */
	private int modelCount;
	
	
	public FolderNode(String name, String fullPath) {
		this.name = name;
		this.fullPath = fullPath;
	}

	public String getName() {
		return name;
	}

	public String getFullPath() {
		return fullPath;
	}

	public List<FolderNode> getChildren() {
		return children;
	}

	public int getModelCount() {
		return modelCount;
	}

	public void setModelCount(int modelCount) {
		this.modelCount = modelCount;
	}
	
	public FolderNode findChild(String childName) {
		for (FolderNode child : this.children) {
			if (child.getName().equalsIgnoreCase(childName)) {
				return child;
			}
		}
		return null;
	}
	
	@Override
	public String toString() {
		return this.name + " (" + this.modelCount + ")";
	}
}
