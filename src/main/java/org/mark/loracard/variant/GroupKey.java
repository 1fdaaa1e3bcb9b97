package org.mark.loracard.variant;

import java.util.Locale;
import java.util.Objects;

/**
 * 	Case-insensitive composite of normalized key, model id and base model.
 */
final class GroupKey {

	private final String normalizedKey;

	private final String modelId;

	private final String baseModel;


	GroupKey(String normalizedKey, String modelId, String baseModel) {
		if (isBlank(normalizedKey) || isBlank(modelId) || isBlank(baseModel)) {
			throw new IllegalArgumentException("group key parts cannot be empty: " + normalizedKey + "/" + modelId + "/" + baseModel);
		}
		this.normalizedKey = normalizedKey.toLowerCase(Locale.ROOT);
		this.modelId = modelId.toLowerCase(Locale.ROOT);
		this.baseModel = baseModel.toLowerCase(Locale.ROOT);
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}

	String getNormalizedKey() {
		return this.normalizedKey;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof GroupKey)) {
			return false;
		}
		GroupKey other = (GroupKey) obj;
		return this.normalizedKey.equals(other.normalizedKey) && this.modelId.equals(other.modelId)
				&& this.baseModel.equals(other.baseModel);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.normalizedKey, this.modelId, this.baseModel);
	}

	@Override
	public String toString() {
		return "GroupKey{" + this.normalizedKey + ", " + this.modelId + ", " + this.baseModel + "}";
	}
}
