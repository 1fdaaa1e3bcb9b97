package org.mark.loracard.variant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.mark.loracard.lora.LoraModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	Turns discovered LoRAs into cards, folding High/Low siblings of the same model into one card.
 * 	<p>
 * 	Output order follows the first appearance of each card in the input: a group stays where its
 * 	first file was seen. Every call is a full pass; nothing is kept between calls, so an instance
 * 	can be shared between threads.
 */
public class VariantMerger {

	private static final Logger LOGGER = LoggerFactory.getLogger(VariantMerger.class);

	private final VariantClassifier classifier;

	private final KeyNormalizer keyNormalizer;


	public VariantMerger() {
		this(new VariantClassifier(), UniqueIdGenerator.randomUuid());
	}

	public VariantMerger(VariantClassifier classifier, UniqueIdGenerator idGenerator) {
		if (classifier == null) {
			throw new IllegalArgumentException("classifier cannot be null");
		}
		this.classifier = classifier;
		this.keyNormalizer = new KeyNormalizer(classifier, idGenerator);
	}

	/**
	 *
	 * @param seeds must not be null; may be empty
	 * @return one entry per standalone model or per group, in first-seen order
	 */
	public List<CardEntry> merge(Iterable<CardSeed> seeds) {
		if (seeds == null) {
			throw new IllegalArgumentException("seeds cannot be null");
		}

		MergeRun run = new MergeRun();
		for (CardSeed seed : seeds) {
			if (seed == null) {
				throw new IllegalArgumentException("seeds cannot contain null");
			}
			run.add(seed);
		}
		return run.toEntries();
	}

	private CardEntry createStandaloneEntry(CardSeed seed, VariantClassification classification) {
		List<VariantDescriptor> variants = classification.hasLabel()
				? Collections.singletonList(new VariantDescriptor(classification.getVariantLabel(), seed.getModel()))
				: Collections.emptyList();

		String key = this.keyNormalizer.normalize(seed.getModel());
		return new CardEntry(seed.getModel(), key, seed.getSourcePath(), seed.getFolderPath(), seed.getTreePath(),
				seed.getTreeSegments(), variants);
	}


	/**
	 * 	State of a single {@link #merge(Iterable)} call.
	 */
	private final class MergeRun {

		private final List<MergeMarker> markers = new ArrayList<>();

		private final List<VariantGroup> groups = new ArrayList<>();

		private final Map<GroupKey, Integer> groupHandles = new HashMap<>();


		void add(CardSeed seed) {
			LoraModel model = seed.getModel();
			VariantClassification classification = classifier.classify(ClassificationInput.structured(model));

			if (!MergeEligibility.isEligible(model, classification)) {
				this.markers.add(MergeMarker.standalone(createStandaloneEntry(seed, classification)));
				return;
			}

			GroupKey key = new GroupKey(classification.getNormalizedKey(), model.getModelId(), model.getDiffusionBaseModel());
			Integer handle = this.groupHandles.get(key);
			if (handle == null) {
				handle = this.groups.size();
				this.groups.add(new VariantGroup(seed, key.getNormalizedKey()));
				this.groupHandles.put(key, handle);
				this.markers.add(MergeMarker.group(handle));
				LOGGER.debug("New variant group {} from {}", key, model.getSafeTensorFileName());
			}

			LoraModel replaced = this.groups.get(handle).addVariant(classification.getVariantLabel(), model);
			if (replaced != null) {
				LOGGER.debug("Variant {} of {} replaced: {} -> {}", classification.getVariantLabel(), key,
						replaced.getSafeTensorFileName(), model.getSafeTensorFileName());
			}
		}

		List<CardEntry> toEntries() {
			List<CardEntry> entries = new ArrayList<>(this.markers.size());
			for (MergeMarker marker : this.markers) {
				if (marker.getKind() == MergeMarker.Kind.GROUP) {
					entries.add(this.groups.get(marker.getGroupHandle()).toEntry());
				} else {
					entries.add(marker.getEntry());
				}
			}
			return entries;
		}
	}
}
