package org.mark.loracard.lora;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 	File extensions found in a LoRA folder.
 */
public final class LoraFileTypes {

	public static final List<String> MODEL_EXTENSIONS = List.of(".ckpt", ".safetensors", ".pth", ".pt");

	/**
	 * 	Sidecar suffixes, longest first so ".preview.png" wins over ".png".
	 */
	public static final List<String> SIDECAR_EXTENSIONS;

	static {
		String[] sidecars = { ".thumb.jpg", ".preview.png", ".preview.webp", ".metadata.json", ".webp", ".mp4", ".mov",
				".webm", ".png", ".preview.jpeg", ".preview.jpg", ".cm-info.json", ".civitai.info", ".civitai",
				".safetensors", ".thumb", ".json", ".pt", ".ckpt", ".pth", ".yaml", ".jpg", ".jpeg" };
		Arrays.sort(sidecars, Comparator.comparingInt(String::length).reversed());
		SIDECAR_EXTENSIONS = List.of(sidecars);
	}

	private LoraFileTypes() {

	}

	public static boolean isModelFile(String fileName) {
		if (fileName == null) {
			return false;
		}
		String lower = fileName.toLowerCase(Locale.ROOT);
		for (String ext : MODEL_EXTENSIONS) {
			if (lower.endsWith(ext)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * 	"foo.preview.png" and "foo.safetensors" both give "foo".
	 * @param fileName
	 * @return
	 */
	public static String extractBaseName(String fileName) {
		if (fileName == null || fileName.isEmpty()) {
			return fileName;
		}
		String lower = fileName.toLowerCase(Locale.ROOT);
		for (String ext : SIDECAR_EXTENSIONS) {
			if (lower.endsWith(ext) && lower.length() > ext.length()) {
				return fileName.substring(0, fileName.length() - ext.length());
			}
		}
		int dot = fileName.lastIndexOf('.');
		return dot > 0 ? fileName.substring(0, dot) : fileName;
	}
}
