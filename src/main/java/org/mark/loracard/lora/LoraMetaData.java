package org.mark.loracard.lora;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.mark.loracard.library.tools.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * 	Reads the metadata files that download tools put next to a LoRA file.
 * 	<p>
 * 	A Civitai "*.civitai.info" file wins over a plain "*.json" file.
 */
public class LoraMetaData {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(LoraMetaData.class);
	
	public static final String CIVITAI_INFO_EXTENSION = ".civitai.info";
	
	public static final String JSON_EXTENSION = ".json";
	
	
	private LoraMetaData() {
		
	}
	
	/**
	 * 	Builds a model record for the given model file. Never returns null; when no metadata can be read the
	 * 	record only carries the file name.
	 * @param modelFile
	 * @return
	 */
	public static LoraModel readFile(File modelFile) {
		if (modelFile == null) {
			throw new IllegalArgumentException("modelFile cannot be null");
		}
		LoraModel model = new LoraModel(modelFile.getName());
		
		File dir = modelFile.getAbsoluteFile().getParentFile();
		String baseName = LoraFileTypes.extractBaseName(modelFile.getName());
		
		File civitaiInfo = new File(dir, baseName + CIVITAI_INFO_EXTENSION);
		if (civitaiInfo.isFile()) {
			JsonObject root = readObject(civitaiInfo);
			if (root != null) {
				applyCivitaiInfo(model, root);
				return model;
			}
		}
		
		File json = new File(dir, baseName + JSON_EXTENSION);
		if (json.isFile()) {
			JsonObject root = readObject(json);
			if (root != null) {
				applyJson(model, root);
				return model;
			}
		}
		return model;
	}
	
	private static JsonObject readObject(File file) {
		try {
			String text = Files.readString(file.toPath(), StandardCharsets.UTF_8);
			JsonObject root = JsonUtil.tryParseObject(text);
			if (root == null) {
				LOGGER.warn("Ignoring metadata file {}: not a JSON object", file);
			}
			return root;
		} catch (IOException | JsonParseException e) {
			LOGGER.warn("Failed to read metadata file {}: {}", file, e.getMessage());
			return null;
		}
	}
	
	private static void applyCivitaiInfo(LoraModel model, JsonObject root) {
		model.setModelId(JsonUtil.getJsonString(root, "modelId", ""));
		model.setDiffusionBaseModel(JsonUtil.getJsonString(root, "baseModel", ""));
		model.setModelVersionName(JsonUtil.getJsonString(root, "name", ""));
		model.setSha256Hash(readSha256(root));
		
		JsonObject info = JsonUtil.getJsonObject(root, "model");
		String type = JsonUtil.getJsonString(info, "type", null);
		model.setModelType(type != null ? type : JsonUtil.getJsonString(root, "type", ""));
		
		List<String> tags = info != null ? JsonUtil.getJsonStringList(info.get("tags")) : null;
		if (tags == null) {
			tags = JsonUtil.getJsonStringList(root.get("tags"));
		}
		model.setTags(tags == null ? null : new ArrayList<>(tags));
		model.setNoMetaData(false);
	}
	
	private static String readSha256(JsonObject root) {
		JsonElement files = root.get("files");
		if (files == null || !files.isJsonArray()) {
			return "";
		}
		JsonArray arr = files.getAsJsonArray();
		if (arr.size() == 0 || !arr.get(0).isJsonObject()) {
			return "";
		}
		JsonObject hashes = JsonUtil.getJsonObject(arr.get(0).getAsJsonObject(), "hashes");
		return JsonUtil.getJsonString(hashes, "SHA256", "");
	}
	
	private static void applyJson(LoraModel model, JsonObject root) {
		model.setDiffusionBaseModel(JsonUtil.getJsonString(root, "sd version", ""));
		model.setModelId(JsonUtil.getJsonString(root, "modelId", ""));
		model.setModelType(JsonUtil.getJsonString(root, "type", ""));
		List<String> tags = JsonUtil.getJsonStringList(root.get("tags"));
		model.setTags(tags == null ? null : new ArrayList<>(tags));
		model.setNoMetaData(false);
	}
}
