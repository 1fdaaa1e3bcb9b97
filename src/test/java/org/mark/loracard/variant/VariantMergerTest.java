package org.mark.loracard.variant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mark.loracard.lora.LoraModel;

class VariantMergerTest {

	private static final String WAN = "Wan Video 2.2";

	private final VariantMerger merger = new VariantMerger(new VariantClassifier(), () -> "generated");

	private static LoraModel model(String fileName, String modelId, String baseModel) {
		LoraModel model = new LoraModel(fileName);
		model.setModelId(modelId);
		model.setDiffusionBaseModel(baseModel);
		return model;
	}

	private static CardSeed seed(LoraModel model, String folder) {
		return new CardSeed(model, "/loras", folder, "Base Loras/" + folder, List.of("Base Loras", folder));
	}

	private static CardSeed seed(LoraModel model) {
		return seed(model, "wan");
	}

	private static List<String> labels(CardEntry entry) {
		List<String> out = new ArrayList<>();
		for (VariantDescriptor variant : entry.getVariants()) {
			out.add(variant.getLabel());
		}
		return out;
	}

	@Test
	@DisplayName("Scenario: matching High and Low seeds merge into one card")
	void scenario_pairMerges() {
		LoraModel high = model("wan-character_high.safetensors", "123", "WanVideo");
		LoraModel low = model("wan-character_low.safetensors", "123", "WanVideo");

		List<CardEntry> cards = merger.merge(List.of(seed(high), seed(low)));

		assertEquals(1, cards.size());
		assertEquals(List.of("High", "Low"), labels(cards.get(0)));
		assertSame(high, cards.get(0).getModel());
	}

	@Test
	@DisplayName("Scenario: a missing model id keeps identical file names apart")
	void scenario_missingModelIdStaysApart() {
		LoraModel withId = model("wan-character_high.safetensors", "123", "WanVideo");
		LoraModel withoutId = model("wan-character_high.safetensors", "", "WanVideo");

		List<CardEntry> cards = merger.merge(List.of(seed(withId), seed(withoutId)));

		assertEquals(2, cards.size());
		assertSame(withId, cards.get(0).getModel());
		assertSame(withoutId, cards.get(1).getModel());
	}

	@Test
	@DisplayName("Scenario: blank models each get their own generated key")
	void scenario_blankModelsGetGeneratedKeys() {
		AtomicInteger counter = new AtomicInteger();
		VariantMerger counting = new VariantMerger(new VariantClassifier(), () -> "id" + counter.incrementAndGet());

		List<CardEntry> cards = counting.merge(List.of(seed(new LoraModel()), seed(new LoraModel())));

		assertEquals(2, cards.size());
		assertTrue(cards.get(0).getVariants().isEmpty());
		assertFalse(cards.get(0).getKey().isEmpty());
		assertNotEquals(cards.get(0).getKey(), cards.get(1).getKey());
	}

	@Test
	@DisplayName("High and Low of the same model become one card")
	void merge_highAndLowPair() {
		LoraModel high = model("MyStyle_high.safetensors", "100", WAN);
		LoraModel low = model("MyStyle_low.safetensors", "100", WAN);

		List<CardEntry> cards = merger.merge(List.of(seed(high), seed(low)));

		assertEquals(1, cards.size());
		CardEntry card = cards.get(0);
		assertEquals("mystyle", card.getKey());
		assertSame(high, card.getModel());
		assertEquals(List.of("High", "Low"), labels(card));
		assertSame(low, card.findVariant("low"));
		assertTrue(card.hasVariants());
	}

	@Test
	@DisplayName("Low seen first still selects High, but the card keeps the first seed's paths")
	void merge_lowFirst() {
		LoraModel low = model("MyStyle_low.safetensors", "100", WAN);
		LoraModel high = model("MyStyle_high.safetensors", "100", WAN);

		List<CardEntry> cards = merger.merge(List.of(seed(low, "first"), seed(high, "second")));

		assertEquals(1, cards.size());
		assertSame(high, cards.get(0).getModel());
		assertEquals(List.of("High", "Low"), labels(cards.get(0)));
		assertEquals("first", cards.get(0).getFolderPath());
		assertEquals("Base Loras/first", cards.get(0).getTreePath());
		assertEquals(List.of("Base Loras", "first"), cards.get(0).getTreeSegments());
	}

	@Test
	@DisplayName("Different model ids stay on separate cards")
	void merge_differentModelIds() {
		LoraModel a = model("MyStyle_high.safetensors", "100", WAN);
		LoraModel b = model("MyStyle_low.safetensors", "200", WAN);

		List<CardEntry> cards = merger.merge(List.of(seed(a), seed(b)));

		assertEquals(2, cards.size());
		assertSame(a, cards.get(0).getModel());
		assertSame(b, cards.get(1).getModel());
		assertEquals(List.of("High"), labels(cards.get(0)));
		assertEquals(List.of("Low"), labels(cards.get(1)));
	}

	@Test
	@DisplayName("Different base models stay on separate cards")
	void merge_differentBaseModels() {
		LoraModel a = model("MyStyle_high.safetensors", "100", WAN);
		LoraModel b = model("MyStyle_low.safetensors", "100", "Wan Video 2.1");

		assertEquals(2, merger.merge(List.of(seed(a), seed(b))).size());
	}

	@Test
	@DisplayName("A file without a variant label is not merged with its labelled sibling")
	void merge_missingLabelSplitsPair() {
		LoraModel plain = model("MyStyle.safetensors", "100", WAN);
		LoraModel low = model("MyStyle_low.safetensors", "100", WAN);

		List<CardEntry> cards = merger.merge(List.of(seed(plain), seed(low)));

		assertEquals(2, cards.size());
		assertSame(plain, cards.get(0).getModel());
		assertTrue(cards.get(0).getVariants().isEmpty());
		assertSame(low, cards.get(1).getModel());
		assertEquals(List.of("Low"), labels(cards.get(1)));
	}

	@Test
	@DisplayName("Files whose names are only a marker have no key and are not merged")
	void merge_emptyKeySplitsPair() {
		LoraModel high = model("High.safetensors", "100", WAN);
		LoraModel low = model("Low.safetensors", "100", WAN);

		List<CardEntry> cards = merger.merge(List.of(seed(high), seed(low)));

		assertEquals(2, cards.size());
		assertSame(high, cards.get(0).getModel());
		assertSame(low, cards.get(1).getModel());
		assertEquals(List.of("High"), labels(cards.get(0)));
		assertEquals(List.of("Low"), labels(cards.get(1)));
	}

	@Test
	@DisplayName("Group key ignores case of model id and base model")
	void merge_caseInsensitiveGroupKey() {
		LoraModel a = model("MyStyle_high.safetensors", "abc", WAN);
		LoraModel b = model("MyStyle_low.safetensors", "ABC", WAN.toUpperCase());

		List<CardEntry> cards = merger.merge(List.of(seed(a), seed(b)));

		assertEquals(1, cards.size());
		assertEquals(List.of("High", "Low"), labels(cards.get(0)));
	}

	@Test
	@DisplayName("Models without metadata are never merged")
	void merge_missingMetadataStaysStandalone() {
		LoraModel high = new LoraModel("MyStyle_high.safetensors");
		LoraModel low = new LoraModel("MyStyle_low.safetensors");

		List<CardEntry> cards = merger.merge(List.of(seed(high), seed(low)));

		assertEquals(2, cards.size());
		assertEquals("mystyle", cards.get(0).getKey());
		assertEquals("mystyle", cards.get(1).getKey());
		assertEquals(List.of("High"), labels(cards.get(0)));
		assertEquals(List.of("Low"), labels(cards.get(1)));
		assertFalse(cards.get(0).hasVariants());
	}

	@Test
	@DisplayName("Unlabelled models get no variant list")
	void merge_unlabelledStandalone() {
		LoraModel plain = model("MyStyle.safetensors", "100", WAN);

		List<CardEntry> cards = merger.merge(List.of(seed(plain)));

		assertEquals(1, cards.size());
		assertSame(plain, cards.get(0).getModel());
		assertTrue(cards.get(0).getVariants().isEmpty());
		assertEquals("mystyle", cards.get(0).getKey());
		assertNull(cards.get(0).findVariant("High"));
	}

	@Test
	@DisplayName("A group keeps the position of its first member")
	void merge_interleavedKeepsFirstPosition() {
		LoraModel aHigh = model("MyStyle_high.safetensors", "100", WAN);
		LoraModel plain = model("Other.safetensors", "300", WAN);
		LoraModel bHigh = model("Second_high.safetensors", "200", WAN);
		LoraModel aLow = model("MyStyle_low.safetensors", "100", WAN);
		LoraModel bLow = model("Second_low.safetensors", "200", WAN);

		List<CardEntry> cards = merger.merge(List.of(seed(aHigh), seed(plain), seed(bHigh), seed(aLow), seed(bLow)));

		assertEquals(3, cards.size());
		assertEquals("mystyle", cards.get(0).getKey());
		assertSame(plain, cards.get(1).getModel());
		assertEquals("second", cards.get(2).getKey());
		assertSame(aLow, cards.get(0).findVariant("Low"));
		assertSame(bLow, cards.get(2).findVariant("Low"));
	}

	@Test
	@DisplayName("A later file with the same label replaces the earlier one")
	void merge_duplicateLabelLastWins() {
		LoraModel first = model("MyStyle_high.safetensors", "100", WAN);
		LoraModel second = model("MyStyle-high.safetensors", "100", WAN);

		List<CardEntry> cards = merger.merge(List.of(seed(first), seed(second)));

		assertEquals(1, cards.size());
		assertEquals(1, cards.get(0).getVariants().size());
		assertSame(second, cards.get(0).getModel());
	}

	@Test
	@DisplayName("Every input model appears on exactly one card")
	void merge_everyModelAccountedFor() {
		List<LoraModel> models = Arrays.asList(
				model("MyStyle_high.safetensors", "100", WAN),
				model("MyStyle_low.safetensors", "100", WAN),
				model("Other.safetensors", "", ""),
				model("Third_low.safetensors", "300", WAN),
				model("", "", ""));
		List<CardSeed> seeds = new ArrayList<>();
		for (LoraModel m : models) {
			seeds.add(seed(m));
		}

		List<CardEntry> cards = merger.merge(seeds);

		assertEquals(4, cards.size());
		for (LoraModel m : models) {
			int found = 0;
			for (CardEntry card : cards) {
				if (card.getModel() == m || card.getVariants().stream().anyMatch(v -> v.getModel() == m)) {
					found++;
				}
			}
			assertEquals(1, found, m.toString());
		}
		assertEquals("generated", cards.get(3).getKey());
	}

	@Test
	@DisplayName("Empty input gives no cards, null input is rejected")
	void merge_emptyAndNull() {
		assertTrue(merger.merge(Collections.emptyList()).isEmpty());
		assertThrows(IllegalArgumentException.class, () -> merger.merge(null));
		assertThrows(IllegalArgumentException.class, () -> merger.merge(Arrays.asList(seed(new LoraModel("a")), null)));
	}

	@Test
	@DisplayName("Merging twice gives the same cards")
	void merge_isRepeatable() {
		List<CardSeed> seeds = List.of(
				seed(model("MyStyle_high.safetensors", "100", WAN)),
				seed(model("MyStyle_low.safetensors", "100", WAN)),
				seed(model("Other.safetensors", "", "")));

		List<CardEntry> first = merger.merge(seeds);
		List<CardEntry> second = merger.merge(seeds);

		assertEquals(first.size(), second.size());
		for (int i = 0; i < first.size(); i++) {
			assertEquals(first.get(i).getKey(), second.get(i).getKey());
			assertSame(first.get(i).getModel(), second.get(i).getModel());
			assertEquals(labels(first.get(i)), labels(second.get(i)));
		}
	}
}
