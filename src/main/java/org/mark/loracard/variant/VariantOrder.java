package org.mark.loracard.variant;

import java.util.Comparator;

/**
 * 	High first, then Low, then everything else; ties by label, ignoring case.
 */
public final class VariantOrder implements Comparator<String> {

	public static final VariantOrder INSTANCE = new VariantOrder();

	private VariantOrder() {

	}

	public static int priority(String label) {
		if (VariantClassifier.HIGH.equalsIgnoreCase(label)) {
			return 0;
		}
		if (VariantClassifier.LOW.equalsIgnoreCase(label)) {
			return 1;
		}
		return 2;
	}

	@Override
	public int compare(String a, String b) {
		int result = Integer.compare(priority(a), priority(b));
		return result != 0 ? result : String.CASE_INSENSITIVE_ORDER.compare(a, b);
	}
}
