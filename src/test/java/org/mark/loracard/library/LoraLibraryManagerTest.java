package org.mark.loracard.library;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mark.loracard.library.exception.LibraryScanException;
import org.mark.loracard.library.struct.DiscoveredModel;
import org.mark.loracard.library.struct.FolderNode;
import org.mark.loracard.library.struct.LibrarySettings;
import org.mark.loracard.library.struct.ModelPathDataStruct;
import org.mark.loracard.variant.CardEntry;
import org.mark.loracard.variant.VariantMerger;

class LoraLibraryManagerTest {

	@TempDir
	Path dir;

	private Path loras;

	private ConfigManager configManager;

	private LoraLibraryManager manager;

	@BeforeEach
	void setUp() throws IOException {
		loras = dir.resolve("loras");
		info("wan/KingMachine_high", 10, "Wan Video 2.2");
		info("wan/KingMachine_low", 10, "Wan Video 2.2");
		touch("wan/Anime Style.safetensors");
		touch("flux/Portrait_low.safetensors");

		configManager = new ConfigManager(dir.resolve("config"));
		LibrarySettings settings = new LibrarySettings();
		settings.getModelPaths().add(new ModelPathDataStruct(loras.toString(), "Loras", null));
		settings.getModelPaths().add(new ModelPathDataStruct(dir.resolve("missing").toString(), "Gone", null));
		configManager.saveSettings(settings);

		manager = new LoraLibraryManager(configManager, new ModelDiscoveryService(), new VariantMerger());
	}

	@AfterEach
	void tearDown() {
		manager.shutdown();
	}

	private void touch(String relative) throws IOException {
		Path file = loras.resolve(relative);
		Files.createDirectories(file.getParent());
		Files.writeString(file, "", StandardCharsets.UTF_8);
	}

	private void info(String baseName, int modelId, String baseModel) throws IOException {
		touch(baseName + ".safetensors");
		Files.writeString(loras.resolve(baseName + ".civitai.info"),
				"{\"modelId\": " + modelId + ", \"baseModel\": \"" + baseModel + "\"}", StandardCharsets.UTF_8);
	}

	@Test
	@DisplayName("Scans enabled folders, skips missing ones and merges variants")
	void listCards() {
		List<CardEntry> cards = manager.listCards(true);

		assertEquals(3, cards.size());
		assertEquals("Portrait_low.safetensors", cards.get(0).getModel().getSafeTensorFileName());
		assertEquals("Anime Style.safetensors", cards.get(1).getModel().getSafeTensorFileName());
		CardEntry king = cards.get(2);
		assertEquals("kingmachine", king.getKey());
		assertEquals(2, king.getVariants().size());
		assertEquals("Base Loras/Wan Video 2.2/wan", king.getTreePath());
		assertEquals("Base Loras/Unknown Base Model/flux", cards.get(0).getTreePath());
	}

	@Test
	@DisplayName("Cached cards are returned until a reload is asked for")
	void listCards_cached() throws IOException {
		List<CardEntry> first = manager.listCards();
		touch("extra/New.safetensors");

		assertSame(first, manager.listCards(false));
		assertEquals(first.size() + 1, manager.listCards(true).size());
	}

	@Test
	@DisplayName("Folder-relative tree paths when sources are not merged")
	void listCards_unmerged() {
		LibrarySettings settings = configManager.loadSettings();
		settings.setMergeSources(false);
		configManager.saveSettings(settings);

		CardEntry king = manager.findCardByKey("kingmachine");
		assertNull(king);
		manager.listCards(true);
		king = manager.findCardByKey("KingMachine");

		assertNotNull(king);
		assertEquals("loras/wan", king.getTreePath());
	}

	@Test
	@DisplayName("Search filters by card name prefix")
	void searchCards() {
		manager.listCards(true);

		List<CardEntry> found = manager.searchCards("anim");
		assertEquals(1, found.size());
		assertEquals("Anime Style.safetensors", found.get(0).getModel().getSafeTensorFileName());
		assertEquals(3, manager.searchCards(" ").size());
		assertTrue(manager.searchCards("nothing").isEmpty());
		assertEquals(List.of("kingmachine"), manager.suggest("king", 5));
	}

	@Test
	@DisplayName("Folder tree follows the cards")
	void getFolderTree() {
		manager.listCards(true);

		FolderNode root = manager.getFolderTree();

		assertEquals("Base Loras", root.getName());
		assertEquals(3, root.getModelCount());
		assertEquals(2, root.findChild("Unknown Base Model").getModelCount());
	}

	@Test
	@DisplayName("Background rescan reports the new cards")
	void rescanAsync() throws Exception {
		CompletableFuture<List<CardEntry>> reported = new CompletableFuture<>();
		manager.rescanAsync(new LibraryScanListener() {
			@Override
			public void onScanCompleted(List<CardEntry> cards) {
				reported.complete(cards);
			}

			@Override
			public void onScanFailed(Exception error) {
				reported.completeExceptionally(error);
			}
		}).get(10, TimeUnit.SECONDS);

		assertEquals(3, reported.get(10, TimeUnit.SECONDS).size());
		assertEquals(3, manager.listCards(false).size());
	}

	@Test
	@DisplayName("Override folders replace the configured ones")
	void overridePaths() throws IOException {
		Path other = dir.resolve("other");
		Files.createDirectories(other);
		Files.writeString(other.resolve("Solo.safetensors"), "", StandardCharsets.UTF_8);

		manager.setOverridePaths(List.of(other.toString()));

		List<CardEntry> cards = manager.listCards(true);
		assertEquals(1, cards.size());
		assertEquals("solo", cards.get(0).getKey());
	}

	@Test
	@DisplayName("A rescan during a search does not mix old cards with the new index")
	void searchCards_rescanDuringLookup() throws IOException {
		Path other = dir.resolve("other");
		Files.createDirectories(other);
		Files.writeString(other.resolve("Aaa.safetensors"), "", StandardCharsets.UTF_8);
		Files.writeString(other.resolve("King.safetensors"), "", StandardCharsets.UTF_8);

		RescanningManager racing = new RescanningManager(configManager);
		try {
			racing.listCards(true);
			racing.beforeLookup = () -> {
				racing.setOverridePaths(List.of(other.toString()));
				racing.listCards(true);
			};

			List<CardEntry> found = racing.searchCards("king");

			assertEquals(1, found.size());
			assertEquals("KingMachine_high.safetensors", found.get(0).getModel().getSafeTensorFileName());
			List<CardEntry> after = racing.searchCards("king");
			assertEquals(1, after.size());
			assertEquals("King.safetensors", after.get(0).getModel().getSafeTensorFileName());
		} finally {
			racing.shutdown();
		}
	}

	@Test
	@DisplayName("An empty library is scanned once, not on every call")
	void listCards_emptyLibraryScannedOnce() throws IOException {
		Path empty = dir.resolve("empty");
		Files.createDirectories(empty);
		AtomicInteger scans = new AtomicInteger();
		ModelDiscoveryService counting = new ModelDiscoveryService() {
			@Override
			public List<DiscoveredModel> collectModels(Path root) throws LibraryScanException {
				scans.incrementAndGet();
				return super.collectModels(root);
			}
		};
		LoraLibraryManager emptyManager = new LoraLibraryManager(configManager, counting, new VariantMerger());
		try {
			emptyManager.setOverridePaths(List.of(empty.toString()));

			assertTrue(emptyManager.listCards().isEmpty());
			assertTrue(emptyManager.listCards().isEmpty());
			assertTrue(emptyManager.searchCards("anything").isEmpty());

			assertEquals(1, scans.get());
			emptyManager.listCards(true);
			assertEquals(2, scans.get());
		} finally {
			emptyManager.shutdown();
		}
	}

	@Test
	@DisplayName("A listener error after a good scan is not reported as a scan failure")
	void rescanAsync_listenerErrorIsNotScanFailure() {
		AtomicBoolean failedCalled = new AtomicBoolean();
		Future<List<CardEntry>> future = manager.rescanAsync(new LibraryScanListener() {
			@Override
			public void onScanCompleted(List<CardEntry> cards) {
				throw new IllegalStateException("listener broke");
			}

			@Override
			public void onScanFailed(Exception error) {
				failedCalled.set(true);
			}
		});

		assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
		assertFalse(failedCalled.get());
		assertEquals(3, manager.listCards(false).size());
	}


	/**
	 * 	Runs a rescan after the search has taken its snapshot.
	 */
	private static final class RescanningManager extends LoraLibraryManager {

		private Runnable beforeLookup;

		RescanningManager(ConfigManager configManager) {
			super(configManager, new ModelDiscoveryService(), new VariantMerger());
		}

		@Override
		Snapshot snapshot() {
			Snapshot current = super.snapshot();
			Runnable hook = this.beforeLookup;
			this.beforeLookup = null;
			if (hook != null) {
				hook.run();
			}
			return current;
		}
	}
}
