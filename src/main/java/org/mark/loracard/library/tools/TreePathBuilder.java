package org.mark.loracard.library.tools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.mark.loracard.library.struct.FolderNode;

/**
 * 	Builds the tree location of a card.
 */
public class TreePathBuilder {
	
	public static final String BASE_LORA_ROOT_NAME = "Base Loras";
	
	public static final String UNKNOWN_BASE_MODEL_FOLDER_NAME = "Unknown Base Model";
	
	public static final String SEGMENT_SEPARATOR = "/";
	
	private static final Pattern PATH_SEPARATORS = Pattern.compile("[\\\\/]+");
	
	
	private TreePathBuilder() {
		
	}
	
	/**
	 * 	Location in the merged tree: "Base Loras", the base model, then the folders below the source folder.
	 * 	A first folder named like the base model is dropped so "Wan/Wan/x" does not happen.
	 * @param sourcePath
	 * @param folderPath
	 * @param baseModel
	 * @return
	 */
	public static List<String> buildMergedSegments(String sourcePath, String folderPath, String baseModel) {
		List<String> segments = new ArrayList<>();
		segments.add(BASE_LORA_ROOT_NAME);
		String normalizedBaseModel = normalizeBaseModel(baseModel);
		segments.add(normalizedBaseModel != null ? normalizedBaseModel : UNKNOWN_BASE_MODEL_FOLDER_NAME);
		
		if (folderPath != null && !folderPath.isBlank()) {
			List<String> relative = getRelativeSegments(sourcePath, folderPath);
			if (normalizedBaseModel != null && !relative.isEmpty() && relative.get(0).equalsIgnoreCase(normalizedBaseModel)) {
				relative.remove(0);
			}
			segments.addAll(relative);
		}
		return segments;
	}
	
	/**
	 * 	Location when sources are not merged: the source folder name, then the folders below it.
	 * @param sourcePath
	 * @param folderPath
	 * @return
	 */
	public static List<String> buildSourceSegments(String sourcePath, String folderPath) {
		List<String> segments = new ArrayList<>();
		List<String> source = splitSegments(sourcePath);
		if (!source.isEmpty()) {
			segments.add(source.get(source.size() - 1));
		}
		if (folderPath != null && !folderPath.isBlank()) {
			segments.addAll(getRelativeSegments(sourcePath, folderPath));
		}
		return segments;
	}
	
	/**
	 * 	Folds the card locations into one tree rooted at "Base Loras".
	 * @param entrySegments
	 * @return the root, or null when no location starts at "Base Loras"
	 */
	public static FolderNode buildMergedFolderTree(Iterable<List<String>> entrySegments) {
		if (entrySegments == null) {
			return null;
		}
		// keys are lowercased joined paths
		Map<String, FolderNode> nodes = new HashMap<>();
		boolean any = false;
		for (List<String> segments : entrySegments) {
			if (segments == null || segments.isEmpty()) {
				continue;
			}
			any = true;
			List<String> cumulative = new ArrayList<>(segments.size());
			FolderNode parent = null;
			for (String segment : segments) {
				cumulative.add(segment);
				String path = joinSegments(cumulative);
				String lookup = path.toLowerCase(Locale.ROOT);
				FolderNode node = nodes.get(lookup);
				if (node == null) {
					node = new FolderNode(segment, path);
					nodes.put(lookup, node);
					if (parent != null) {
						parent.getChildren().add(node);
					}
				}
				node.setModelCount(node.getModelCount() + 1);
				parent = node;
			}
		}
		if (!any) {
			return null;
		}
		FolderNode root = nodes.get(BASE_LORA_ROOT_NAME.toLowerCase(Locale.ROOT));
		if (root == null) {
			return null;
		}
		sortChildren(root);
		return root;
	}
	
	public static String joinSegments(List<String> segments) {
		if (segments == null || segments.isEmpty()) {
			return "";
		}
		return String.join(SEGMENT_SEPARATOR, segments);
	}
	
	private static void sortChildren(FolderNode node) {
		node.getChildren().sort((a, b) -> String.CASE_INSENSITIVE_ORDER.compare(a.getName(), b.getName()));
		for (FolderNode child : node.getChildren()) {
			sortChildren(child);
		}
	}
	
	private static String normalizeBaseModel(String baseModel) {
		if (baseModel == null || baseModel.isBlank()) {
			return null;
		}
		String trimmed = baseModel.trim();
		return "UNKNOWN".equalsIgnoreCase(trimmed) ? null : trimmed;
	}
	
	private static List<String> getRelativeSegments(String sourcePath, String folderPath) {
		List<String> source = splitSegments(sourcePath);
		List<String> folder = splitSegments(folderPath);
		int index = 0;
		while (index < source.size() && index < folder.size() && source.get(index).equalsIgnoreCase(folder.get(index))) {
			index++;
		}
		return new ArrayList<>(folder.subList(index, folder.size()));
	}
	
	private static List<String> splitSegments(String path) {
		if (path == null || path.isBlank()) {
			return Collections.emptyList();
		}
		List<String> out = new ArrayList<>();
		for (String part : PATH_SEPARATORS.split(path)) {
			if (!part.isEmpty()) {
				out.add(part);
			}
		}
		return out;
	}
}
