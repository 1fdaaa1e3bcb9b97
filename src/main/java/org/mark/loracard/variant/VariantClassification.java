package org.mark.loracard.variant;

import java.util.Objects;

/**
 * 	Result of classifying one model or one file name.
 */
public final class VariantClassification {

	/**
	 * 	Label used when no variant marker was found.
	 */
	public static final String NO_VARIANT = "";

	/**
	 * 	Lowercase identity string, empty when nothing usable was left after stripping markers.
	 */
	private final String normalizedKey;

	/**
	 * 	"High", "Low", or {@link #NO_VARIANT}.
	 */
	private final String variantLabel;


	public VariantClassification(String normalizedKey, String variantLabel) {
		this.normalizedKey = normalizedKey == null ? "" : normalizedKey;
		this.variantLabel = variantLabel == null ? NO_VARIANT : variantLabel;
	}

	public static VariantClassification empty() {
		return new VariantClassification("", NO_VARIANT);
	}

	public String getNormalizedKey() {
		return this.normalizedKey;
	}

	public String getVariantLabel() {
		return this.variantLabel;
	}

	public boolean hasKey() {
		return !this.normalizedKey.isBlank();
	}

	public boolean hasLabel() {
		return !this.variantLabel.isBlank();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof VariantClassification)) {
			return false;
		}
		VariantClassification other = (VariantClassification) obj;
		return this.normalizedKey.equals(other.normalizedKey) && this.variantLabel.equals(other.variantLabel);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.normalizedKey, this.variantLabel);
	}

	@Override
	public String toString() {
		return this.normalizedKey + "|" + this.variantLabel;
	}
}
