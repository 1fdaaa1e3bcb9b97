package org.mark.loracard.library;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.mark.loracard.library.exception.LibraryScanException;
import org.mark.loracard.library.struct.DiscoveredModel;
import org.mark.loracard.library.struct.FolderNode;
import org.mark.loracard.library.struct.LibrarySettings;
import org.mark.loracard.library.tools.SearchIndex;
import org.mark.loracard.library.tools.TreePathBuilder;
import org.mark.loracard.variant.CardEntry;
import org.mark.loracard.variant.CardSeed;
import org.mark.loracard.variant.VariantMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	Keeps the card list of the configured LoRA folders.
 */
public class LoraLibraryManager {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(LoraLibraryManager.class);
	
	/**
	 * 	Shared instance, created on first use.
	 */
	private static volatile LoraLibraryManager INSTANCE;
	
	public static LoraLibraryManager getInstance() {
		if (INSTANCE == null) {
			synchronized (LoraLibraryManager.class) {
				if (INSTANCE == null) {
					INSTANCE = new LoraLibraryManager(ConfigManager.getInstance(), new ModelDiscoveryService(), new VariantMerger());
				}
			}
		}
		return INSTANCE;
	}
	
	private final ConfigManager configManager;
	
	private final ModelDiscoveryService discoveryService;
	
	private final VariantMerger merger;
	
	/**
	 * 	Folders given on the command line; when set they replace the configured ones.
	 */
	private volatile List<String> overridePaths = null;
	
	/**
	 * 	Cards of the last scan with their search index, replaced as a whole. Null until the first scan.
	 */
	private volatile Snapshot library = null;
	
	private final Object scanLock = new Object();
	
	/**
	 * 	Runs background rescans one at a time.
	 */
	private final ExecutorService executorService = Executors.newSingleThreadExecutor(r -> {
		Thread t = new Thread(r, "lora-library-scan");
		t.setDaemon(true);
		return t;
	});
	
	
	public LoraLibraryManager(ConfigManager configManager, ModelDiscoveryService discoveryService, VariantMerger merger) {
		if (configManager == null || discoveryService == null || merger == null) {
			throw new IllegalArgumentException("configManager, discoveryService and merger are required");
		}
		this.configManager = configManager;
		this.discoveryService = discoveryService;
		this.merger = merger;
	}
	
	/**
	 * 	Replaces the configured folders for this process only. Null restores the configured ones.
	 * @param paths
	 */
	public void setOverridePaths(List<String> paths) {
		this.overridePaths = paths == null ? null : List.copyOf(paths);
	}
	
	public List<CardEntry> listCards() {
		return this.listCards(false);
	}
	
	/**
	 * 	Returns the cached cards, scanning when no scan has run yet.
	 * @param reload scan the folders again even when cards are cached
	 * @return
	 */
	public List<CardEntry> listCards(boolean reload) {
		synchronized (this.scanLock) {
			if (this.library == null || reload) {
				this.rescan();
			}
			return this.library.getCards();
		}
	}
	
	/**
	 * 	Rescans on the background thread. Results of a scan that is no longer wanted can simply be ignored.
	 * @param listener may be null
	 * @return
	 */
	public Future<List<CardEntry>> rescanAsync(LibraryScanListener listener) {
		return this.executorService.submit(() -> {
			List<CardEntry> result;
			try {
				synchronized (this.scanLock) {
					result = this.rescan();
				}
			} catch (RuntimeException e) {
				LOGGER.error("Library scan failed", e);
				if (listener != null) {
					listener.onScanFailed(e);
				}
				throw e;
			}
			if (listener != null) {
				listener.onScanCompleted(result);
			}
			return result;
		});
	}
	
	/**
	 * 	Cards whose display name matches every query word as a word prefix, in card order.
	 * 	A blank query returns all cards.
	 * @param query
	 * @return
	 */
	public List<CardEntry> searchCards(String query) {
		Snapshot current = this.snapshot();
		if (query == null || query.isBlank()) {
			return current.getCards();
		}
		List<CardEntry> out = new ArrayList<>();
		for (int i : current.getIndex().searchPrefix(query)) {
			out.add(current.getCards().get(i));
		}
		return out;
	}
	
	public List<String> suggest(String prefix, int limit) {
		Snapshot current = this.library;
		return current == null ? Collections.emptyList() : current.getIndex().suggest(prefix, limit);
	}
	
	public CardEntry findCardByKey(String key) {
		if (key == null || key.isBlank()) {
			return null;
		}
		for (CardEntry entry : this.currentCards()) {
			if (key.equalsIgnoreCase(entry.getKey())) {
				return entry;
			}
		}
		return null;
	}
	
	/**
	 * 	Merged tree of the current cards, null when there are none.
	 * @return
	 */
	public FolderNode getFolderTree() {
		List<List<String>> segments = new ArrayList<>();
		for (CardEntry entry : this.currentCards()) {
			segments.add(entry.getTreeSegments());
		}
		return TreePathBuilder.buildMergedFolderTree(segments);
	}
	
	public void shutdown() {
		this.executorService.shutdownNow();
	}
	
	/**
	 * 	The current snapshot, scanning first when no scan has run yet. Cards and index always belong together.
	 * @return
	 */
	Snapshot snapshot() {
		Snapshot current = this.library;
		if (current != null) {
			return current;
		}
		synchronized (this.scanLock) {
			if (this.library == null) {
				this.rescan();
			}
			return this.library;
		}
	}
	
	private List<CardEntry> currentCards() {
		Snapshot current = this.library;
		return current == null ? Collections.emptyList() : current.getCards();
	}
	
	/**
	 * 	Callers hold {@link #scanLock}.
	 */
	private List<CardEntry> rescan() {
		LibrarySettings settings = this.configManager.loadSettings();
		List<String> roots = this.overridePaths != null ? this.overridePaths : settings.getEnabledPaths();
		boolean merge = settings.isMergeSources();
		
		List<CardSeed> seeds = new ArrayList<>();
		for (String root : roots) {
			if (root == null || root.isBlank()) {
				continue;
			}
			Path modelDir = Paths.get(root.trim());
			List<DiscoveredModel> found;
			try {
				found = this.discoveryService.collectModels(modelDir);
			} catch (LibraryScanException e) {
				LOGGER.error("Skipping model folder {}: {}", modelDir, e.getMessage());
				continue;
			}
			for (DiscoveredModel item : found) {
				seeds.add(toSeed(item, merge));
			}
		}
		
		List<CardEntry> result = Collections.unmodifiableList(this.merger.merge(seeds));
		List<String> names = new ArrayList<>(result.size());
		for (CardEntry entry : result) {
			names.add(entry.getModel().getDisplayName());
		}
		SearchIndex index = new SearchIndex();
		index.build(names);
		this.library = new Snapshot(result, index);
		LOGGER.info("Library scan finished: {} model(s), {} card(s)", seeds.size(), result.size());
		return result;
	}
	
	private static CardSeed toSeed(DiscoveredModel item, boolean merge) {
		List<String> segments = merge
				? TreePathBuilder.buildMergedSegments(item.getSourcePath(), item.getFolderPath(), item.getModel().getDiffusionBaseModel())
				: TreePathBuilder.buildSourceSegments(item.getSourcePath(), item.getFolderPath());
		return new CardSeed(item.getModel(), item.getSourcePath(), item.getFolderPath(), TreePathBuilder.joinSegments(segments), segments);
	}
	
	
	/**
	 * 	Result of one scan. Positions returned by the index are positions in the card list.
	 */
	static final class Snapshot {
		
		private final List<CardEntry> cards;
		
		private final SearchIndex index;
		
		Snapshot(List<CardEntry> cards, SearchIndex index) {
			this.cards = cards;
			this.index = index;
		}
		
		List<CardEntry> getCards() {
			return this.cards;
		}
		
		SearchIndex getIndex() {
			return this.index;
		}
	}
}
