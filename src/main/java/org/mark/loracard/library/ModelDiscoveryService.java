package org.mark.loracard.library;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

import org.mark.loracard.library.exception.LibraryScanException;
import org.mark.loracard.library.struct.DiscoveredModel;
import org.mark.loracard.library.struct.FolderNode;
import org.mark.loracard.lora.LoraFileTypes;
import org.mark.loracard.lora.LoraMetaData;
import org.mark.loracard.lora.LoraModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	Finds LoRA files below a folder.
 */
public class ModelDiscoveryService {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(ModelDiscoveryService.class);
	
	
	public ModelDiscoveryService() {
		
	}
	
	/**
	 * 	Walks the folder and returns one entry per model file, in path order. Files sharing a directory and
	 * 	base name ("x.safetensors", "x.civitai.info", "x.preview.png") belong to the same model.
	 * @param root
	 * @return
	 * @throws LibraryScanException when the folder does not exist or cannot be read
	 */
	public List<DiscoveredModel> collectModels(Path root) throws LibraryScanException {
		Path modelDir = checkRoot(root);
		
		// directory + lowercase base name -> files
		Map<String, List<Path>> bundles = new LinkedHashMap<>();
		try (Stream<Path> paths = Files.walk(modelDir)) {
			List<Path> files = paths.filter(Files::isRegularFile).filter(p -> !isHidden(modelDir, p)).sorted().toList();
			for (Path file : files) {
				String baseName = LoraFileTypes.extractBaseName(file.getFileName().toString());
				String bundleKey = file.getParent().toString() + File.separator + baseName.toLowerCase(Locale.ROOT);
				bundles.computeIfAbsent(bundleKey, k -> new ArrayList<>()).add(file);
			}
		} catch (IOException | UncheckedIOException e) {
			throw new LibraryScanException("Failed to scan model folder: " + modelDir, e);
		}
		
		String sourcePath = modelDir.toString();
		List<DiscoveredModel> result = new ArrayList<>();
		for (List<Path> bundle : bundles.values()) {
			Path modelFile = null;
			for (Path file : bundle) {
				if (LoraFileTypes.isModelFile(file.getFileName().toString())) {
					modelFile = file;
					break;
				}
			}
			if (modelFile == null) {
				continue;
			}
			LoraModel model = LoraMetaData.readFile(modelFile.toFile());
			List<File> associated = new ArrayList<>();
			for (Path file : bundle) {
				associated.add(file.toFile());
			}
			model.setAssociatedFiles(associated);
			result.add(new DiscoveredModel(model, sourcePath, modelFile.getParent().toString()));
		}
		LOGGER.info("Found {} model(s) in {}", result.size(), modelDir);
		return result;
	}
	
	/**
	 * 	Builds the on-disk folder tree below the folder. Each node counts the models in its subtree.
	 * @param root
	 * @return
	 * @throws LibraryScanException
	 */
	public FolderNode buildFolderTree(Path root) throws LibraryScanException {
		Path modelDir = checkRoot(root);
		try {
			return this.buildNode(modelDir);
		} catch (IOException | UncheckedIOException e) {
			throw new LibraryScanException("Failed to read folder tree: " + modelDir, e);
		}
	}
	
	private FolderNode buildNode(Path dir) throws IOException {
		String name = dir.getFileName() == null ? dir.toString() : dir.getFileName().toString();
		FolderNode node = new FolderNode(name, dir.toString());
		
		int count = 0;
		List<Path> children;
		try (Stream<Path> stream = Files.list(dir)) {
			children = stream.sorted(Comparator.comparing(p -> p.getFileName().toString(), String.CASE_INSENSITIVE_ORDER))
					.toList();
		}
		for (Path child : children) {
			String childName = child.getFileName().toString();
			if (childName.startsWith(".")) {
				continue;
			}
			if (Files.isDirectory(child)) {
				FolderNode childNode = this.buildNode(child);
				node.getChildren().add(childNode);
				count += childNode.getModelCount();
			} else if (LoraFileTypes.isModelFile(childName)) {
				count++;
			}
		}
		node.setModelCount(count);
		return node;
	}
	
	private static Path checkRoot(Path root) throws LibraryScanException {
		if (root == null) {
			throw new IllegalArgumentException("root cannot be null");
		}
		Path modelDir = root.toAbsolutePath().normalize();
		if (!Files.exists(modelDir)) {
			throw new LibraryScanException("Model folder does not exist: " + modelDir);
		}
		if (!Files.isDirectory(modelDir)) {
			throw new LibraryScanException("Not a directory: " + modelDir);
		}
		return modelDir;
	}
	
	/**
	 * 	Skips dot files and anything inside a dot directory below the root.
	 */
	private static boolean isHidden(Path root, Path file) {
		for (Path part : root.relativize(file)) {
			if (part.toString().startsWith(".")) {
				return true;
			}
		}
		return false;
	}
}
