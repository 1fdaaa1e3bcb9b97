package org.mark.loracard.variant;

import org.mark.loracard.lora.LoraModel;

/**
 * 	What the classifier looks at: either a full model record or a raw file/version name.
 */
public abstract class ClassificationInput {

	private ClassificationInput() {

	}

	public static ClassificationInput structured(LoraModel model) {
		if (model == null) {
			throw new IllegalArgumentException("model cannot be null");
		}
		return new Structured(model);
	}

	public static ClassificationInput rawText(String text) {
		return new RawText(text == null ? "" : text);
	}


	/**
	 * 	Declared fields of a model record.
	 */
	public static final class Structured extends ClassificationInput {

		private final LoraModel model;

		private Structured(LoraModel model) {
			this.model = model;
		}

		public LoraModel getModel() {
			return this.model;
		}

		@Override
		public String toString() {
			return "Structured{" + this.model + "}";
		}
	}

	/**
	 * 	A single file name or version name.
	 */
	public static final class RawText extends ClassificationInput {

		private final String text;

		private RawText(String text) {
			this.text = text;
		}

		public String getText() {
			return this.text;
		}

		@Override
		public String toString() {
			return "RawText{" + this.text + "}";
		}
	}
}
