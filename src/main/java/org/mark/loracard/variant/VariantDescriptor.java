package org.mark.loracard.variant;

import org.mark.loracard.lora.LoraModel;

/**
 * 	One selectable variant on a card.
 */
public final class VariantDescriptor {

	private final String label;

	private final LoraModel model;


	public VariantDescriptor(String label, LoraModel model) {
		this.label = label;
		this.model = model;
	}

	public String getLabel() {
		return this.label;
	}

	public LoraModel getModel() {
		return this.model;
	}

	@Override
	public String toString() {
		return this.label + "=" + this.model.getSafeTensorFileName();
	}
}
