package org.mark.loracard.library;

import java.util.ArrayList;
import java.util.List;

import org.mark.loracard.library.tools.JsonUtil;
import org.mark.loracard.lora.LoraModel;
import org.mark.loracard.variant.CardEntry;
import org.mark.loracard.variant.VariantDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * 	Command line entry: scans the LoRA folders and prints the cards as JSON.
 * 	<pre>
 * 	java -jar target/lora-card-library-1.0.0-SNAPSHOT.jar [folder...] [--search query]
 * 	</pre>
 * 	The jar's manifest points at the runtime libraries that {@code mvn package} copies to {@code target/lib}.
 */
public class LoraLibrary {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(LoraLibrary.class);
	
	public static final int EXIT_OK = 0;
	
	public static final int EXIT_USAGE = 1;
	
	public static final int EXIT_NO_FOLDER = 2;
	
	
	public static void main(String[] args) {
		int code = run(args, LoraLibraryManager.getInstance(), ConfigManager.getInstance());
		LoraLibraryManager.getInstance().shutdown();
		if (code != EXIT_OK) {
			System.exit(code);
		}
	}
	
	/**
	 * 	Runs one listing and returns the exit code.
	 * @param args
	 * @param manager
	 * @param configManager
	 * @return
	 */
	static int run(String[] args, LoraLibraryManager manager, ConfigManager configManager) {
		List<String> folders = new ArrayList<>();
		String query = null;
		for (int i = 0; i < args.length; i++) {
			if ("--search".equals(args[i])) {
				if (i + 1 >= args.length) {
					LOGGER.error("--search needs a query");
					return EXIT_USAGE;
				}
				query = args[++i];
			} else {
				folders.add(args[i]);
			}
		}
		
		if (!folders.isEmpty()) {
			manager.setOverridePaths(folders);
		} else if (configManager.loadSettings().getEnabledPaths().isEmpty()) {
			LOGGER.error("No model folder given and none configured in {}", configManager.getSettingsPath());
			return EXIT_NO_FOLDER;
		}
		
		LOGGER.info("Scanning model folders...");
		List<CardEntry> cards = manager.listCards(true);
		if (query != null) {
			cards = manager.searchCards(query);
			LOGGER.info("{} card(s) match \"{}\"", cards.size(), query);
		}
		
		JsonArray out = new JsonArray();
		for (CardEntry card : cards) {
			out.add(toJson(card));
		}
		System.out.println(JsonUtil.toPrettyJson(out));
		return EXIT_OK;
	}
	
	static JsonObject toJson(CardEntry card) {
		LoraModel model = card.getModel();
		JsonObject obj = new JsonObject();
		obj.addProperty("key", card.getKey());
		obj.addProperty("name", model.getDisplayName());
		obj.addProperty("file", model.getSafeTensorFileName());
		obj.addProperty("modelId", model.getModelId());
		obj.addProperty("baseModel", model.getDiffusionBaseModel());
		obj.addProperty("treePath", card.getTreePath());
		obj.addProperty("folderPath", card.getFolderPath());
		
		JsonArray variants = new JsonArray();
		for (VariantDescriptor variant : card.getVariants()) {
			JsonObject v = new JsonObject();
			v.addProperty("label", variant.getLabel());
			v.addProperty("file", variant.getModel().getSafeTensorFileName());
			variants.add(v);
		}
		obj.add("variants", variants);
		return obj;
	}
}
