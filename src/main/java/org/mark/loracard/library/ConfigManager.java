package org.mark.loracard.library;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.mark.loracard.library.struct.LibrarySettings;
import org.mark.loracard.library.struct.ModelPathDataStruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * 	Loads and saves config/settings.json.
 */
public class ConfigManager {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(ConfigManager.class);
	
	private static final String CONFIG_DIR = "config";
	
	private static final String SETTINGS_FILE = "settings.json";
	
	private static final ConfigManager INSTANCE = new ConfigManager(Paths.get(System.getProperty("user.dir"), CONFIG_DIR));
	
	private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
	
	private final Path configDir;
	
	
	public ConfigManager(Path configDir) {
		if (configDir == null) {
			throw new IllegalArgumentException("configDir cannot be null");
		}
		this.configDir = configDir;
	}
	
	public static ConfigManager getInstance() {
		return INSTANCE;
	}
	
	public Path getSettingsPath() {
		return this.configDir.resolve(SETTINGS_FILE);
	}
	
	/**
	 * 	Reads the settings. A missing or broken file gives the defaults.
	 * @return
	 */
	public LibrarySettings loadSettings() {
		Path settingsPath = this.getSettingsPath();
		if (!Files.exists(settingsPath)) {
			LOGGER.info("Settings file not found, using defaults: {}", settingsPath);
			return new LibrarySettings();
		}
		
		try (Reader reader = Files.newBufferedReader(settingsPath, StandardCharsets.UTF_8)) {
			LibrarySettings settings = this.gson.fromJson(reader, LibrarySettings.class);
			if (settings == null) {
				return new LibrarySettings();
			}
			// Gson bypasses the setter, so a "modelPaths": null entry has to be fixed here.
			settings.setModelPaths(settings.getModelPaths());
			LOGGER.info("Loaded settings from {}: {} model folder(s)", settingsPath, settings.getModelPaths().size());
			return settings;
		} catch (IOException | JsonParseException e) {
			LOGGER.error("Failed to load settings from {}, using defaults", settingsPath, e);
			return new LibrarySettings();
		}
	}
	
	/**
	 * 	Writes the settings, creating the config directory when needed.
	 * @param settings
	 * @return true when the file was written
	 */
	public boolean saveSettings(LibrarySettings settings) {
		if (settings == null) {
			throw new IllegalArgumentException("settings cannot be null");
		}
		Path settingsPath = this.getSettingsPath();
		try {
			Files.createDirectories(this.configDir);
			try (Writer writer = Files.newBufferedWriter(settingsPath, StandardCharsets.UTF_8)) {
				this.gson.toJson(settings, writer);
			}
			LOGGER.info("Settings saved to {}", settingsPath);
			return true;
		} catch (IOException e) {
			LOGGER.error("Failed to save settings to {}", settingsPath, e);
			return false;
		}
	}
	
	/**
	 * 	Adds a folder to the settings file unless the same path is already listed.
	 * @param path
	 * @param name
	 * @param description
	 * @return true when the folder was added
	 */
	public boolean addModelPath(String path, String name, String description) {
		if (path == null || path.isBlank()) {
			throw new IllegalArgumentException("path cannot be blank");
		}
		LibrarySettings settings = this.loadSettings();
		for (ModelPathDataStruct item : settings.getModelPaths()) {
			if (item != null && path.trim().equals(item.getPath())) {
				return false;
			}
		}
		settings.getModelPaths().add(new ModelPathDataStruct(path.trim(), name, description));
		return this.saveSettings(settings);
	}
}
